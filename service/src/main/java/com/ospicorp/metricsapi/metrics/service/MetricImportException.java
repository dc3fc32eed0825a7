package com.ospicorp.metricsapi.metrics.service;

/**
 * Fatal import failure. Batches flushed before the failure stay committed; their record count
 * is carried here.
 */
public class MetricImportException extends RuntimeException {
  private final long recordsWritten;

  public MetricImportException(String message, long recordsWritten, Throwable cause) {
    super(message, cause);
    this.recordsWritten = recordsWritten;
  }

  public long recordsWritten() {
    return recordsWritten;
  }
}
