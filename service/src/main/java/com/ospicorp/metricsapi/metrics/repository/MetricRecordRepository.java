package com.ospicorp.metricsapi.metrics.repository;

import com.ospicorp.metricsapi.metrics.model.MetricRecord;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface MetricRecordRepository extends JpaRepository<MetricRecord, Long> {
  @Query("""
      SELECT m FROM MetricRecord m
      WHERE m.metricId = :metricId
        AND m.dateTime >= :fromInclusive
        AND m.dateTime < :toExclusive
      ORDER BY m.dateTime ASC, m.id ASC
      """)
  List<MetricRecord> findInRange(@Param("metricId") int metricId,
      @Param("fromInclusive") LocalDateTime fromInclusive,
      @Param("toExclusive") LocalDateTime toExclusive);
}
