package com.ospicorp.metricsapi.metrics.model;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Metric id plus an inclusive calendar-day range, shared by aggregation and report queries.
 */
public record MetricQuery(int metricId, LocalDate start, LocalDate end) {

  public MetricQuery {
    Objects.requireNonNull(start, "start must be provided");
    Objects.requireNonNull(end, "end must be provided");
    if (metricId < 1) {
      throw new IllegalArgumentException("metricId must be greater than zero");
    }
    if (start.isAfter(end)) {
      throw new IllegalArgumentException("start must be before or equal to end");
    }
  }

  public LocalDateTime fromInclusive() {
    return start.atStartOfDay();
  }

  public LocalDateTime toExclusive() {
    return end.plusDays(1).atStartOfDay();
  }
}
