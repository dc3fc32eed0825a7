package com.ospicorp.metricsapi.metrics.repository;

import com.ospicorp.metricsapi.metrics.model.AggregationType;
import com.ospicorp.metricsapi.metrics.model.MetricBucket;
import com.ospicorp.metricsapi.metrics.model.MetricRecord;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Append-only storage for metric records. Implementations must be safe for concurrent use by
 * independent imports and queries.
 */
public interface MetricRecordStore {

  /**
   * Persists the batch in one call. The records are durable once this method returns; a
   * failure leaves none of the batch behind.
   *
   * @return number of records written
   */
  int insertBatch(List<MetricRecord> records);

  /**
   * Records of {@code metricId} with {@code fromInclusive <= dateTime < toExclusive}, ordered by
   * dateTime ascending.
   */
  List<MetricRecord> findByMetricIdAndRange(int metricId, LocalDateTime fromInclusive,
      LocalDateTime toExclusive);

  /**
   * Sum of {@code aggDay} per truncated timestamp over the same window as
   * {@link #findByMetricIdAndRange}, ordered by bucket ascending.
   */
  List<MetricBucket> aggregate(int metricId, AggregationType type, LocalDateTime fromInclusive,
      LocalDateTime toExclusive);
}
