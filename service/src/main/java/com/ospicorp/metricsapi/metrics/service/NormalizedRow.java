package com.ospicorp.metricsapi.metrics.service;

import com.ospicorp.metricsapi.metrics.model.MetricRecord;

/**
 * Outcome of normalizing one CSV row: exactly one of {@code record} and {@code discardReason}
 * is set.
 */
public record NormalizedRow(MetricRecord record, String discardReason) {

  public static NormalizedRow accepted(MetricRecord record) {
    return new NormalizedRow(record, null);
  }

  public static NormalizedRow discarded(String reason) {
    return new NormalizedRow(null, reason);
  }

  public boolean isDiscarded() {
    return record == null;
  }
}
