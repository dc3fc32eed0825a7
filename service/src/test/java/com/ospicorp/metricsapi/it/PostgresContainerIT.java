package com.ospicorp.metricsapi.it;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest(properties = {"metrics.store=jdbc", "spring.autoconfigure.exclude="})
@Testcontainers
class PostgresContainerIT {

  @Container
  static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16");

  @DynamicPropertySource
  static void configureDataSource(DynamicPropertyRegistry registry) {
    POSTGRES.start();
    registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
    registry.add("spring.datasource.username", POSTGRES::getUsername);
    registry.add("spring.datasource.password", POSTGRES::getPassword);
  }

  @Autowired
  private JdbcTemplate jdbcTemplate;

  @Test
  void flywayRanAgainstContainer() {
    List<String> tables = jdbcTemplate.queryForList(
        """
        SELECT table_name FROM information_schema.tables
        WHERE table_schema = 'public'
          AND table_name = 'metric_record'
        """,
        String.class);

    assertThat(tables).containsExactly("metric_record");
  }

  @Test
  void rangeIndexExists() {
    String index = jdbcTemplate.queryForObject(
        "SELECT to_regclass('public.metric_record_metric_id_date_time_idx')", String.class);

    assertThat(index).isEqualTo("metric_record_metric_id_date_time_idx");
  }
}
