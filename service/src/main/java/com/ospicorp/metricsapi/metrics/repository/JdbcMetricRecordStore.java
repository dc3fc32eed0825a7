package com.ospicorp.metricsapi.metrics.repository;

import com.ospicorp.metricsapi.metrics.model.AggregationType;
import com.ospicorp.metricsapi.metrics.model.MetricBucket;
import com.ospicorp.metricsapi.metrics.model.MetricRecord;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@ConditionalOnProperty(name = "metrics.store", havingValue = "jdbc", matchIfMissing = true)
public class JdbcMetricRecordStore implements MetricRecordStore {
  private static final String INSERT_SQL = """
      INSERT INTO metric_record (metric_id, date_time, agg_day, agg_month, agg_year)
      VALUES (?, ?, ?, ?, ?)
      """;

  private final JdbcTemplate jdbc;
  private final MetricRecordRepository repository;

  public JdbcMetricRecordStore(JdbcTemplate jdbc, MetricRecordRepository repository) {
    this.jdbc = jdbc;
    this.repository = repository;
  }

  @Override
  @Transactional
  public int insertBatch(List<MetricRecord> records) {
    if (records.isEmpty()) {
      return 0;
    }
    jdbc.batchUpdate(INSERT_SQL, records, records.size(), (ps, record) -> {
      ps.setInt(1, record.getMetricId());
      ps.setObject(2, record.getDateTime());
      ps.setInt(3, record.getAggDay());
      ps.setInt(4, record.getAggMonth());
      ps.setInt(5, record.getAggYear());
    });
    return records.size();
  }

  @Override
  @Transactional(readOnly = true)
  public List<MetricRecord> findByMetricIdAndRange(int metricId, LocalDateTime fromInclusive,
      LocalDateTime toExclusive) {
    return repository.findInRange(metricId, fromInclusive, toExclusive);
  }

  @Override
  @Transactional(readOnly = true)
  public List<MetricBucket> aggregate(int metricId, AggregationType type,
      LocalDateTime fromInclusive, LocalDateTime toExclusive) {
    // the unit comes from the enum, never from request input
    String sql = """
      SELECT DATE_TRUNC('%s', date_time) AS bucket, SUM(agg_day) AS total
      FROM metric_record
      WHERE metric_id = ? AND date_time >= ? AND date_time < ?
      GROUP BY bucket
      ORDER BY bucket
    """.formatted(type.truncUnit());
    return jdbc.query(sql, (rs, i) -> new MetricBucket(
            rs.getObject("bucket", LocalDateTime.class).toLocalDate(),
            rs.getLong("total")),
        metricId, fromInclusive, toExclusive);
  }
}
