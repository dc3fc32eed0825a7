package com.ospicorp.metricsapi.metrics.service;

import com.ospicorp.metricsapi.metrics.model.AggregationType;
import com.ospicorp.metricsapi.metrics.model.MetricBucket;
import com.ospicorp.metricsapi.metrics.model.MetricQuery;
import com.ospicorp.metricsapi.metrics.repository.MetricRecordStore;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import org.springframework.stereotype.Service;

@Service
public class AggregationService {

  private final MetricRecordStore store;

  public AggregationService(MetricRecordStore store) {
    this.store = store;
  }

  /**
   * Sums {@code aggDay} per bucket of the requested granularity. The same column is summed for
   * DAY, MONTH and YEAR.
   *
   * @throws NoSuchElementException when no record of the metric falls in the range
   */
  public List<MetricBucket> aggregate(MetricQuery query, AggregationType type) {
    Objects.requireNonNull(query, "query must be provided");
    Objects.requireNonNull(type, "aggregation type must be provided");

    List<MetricBucket> buckets = store.aggregate(query.metricId(), type, query.fromInclusive(),
        query.toExclusive());
    if (buckets.isEmpty()) {
      throw new NoSuchElementException("No data found for metric " + query.metricId()
          + " between " + query.start() + " and " + query.end());
    }
    return buckets;
  }
}
