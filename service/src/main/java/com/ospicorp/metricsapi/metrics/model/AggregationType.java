package com.ospicorp.metricsapi.metrics.model;

import java.time.LocalDate;
import java.time.LocalDateTime;

public enum AggregationType {
  DAY("day"),
  MONTH("month"),
  YEAR("year");

  private final String truncUnit;

  AggregationType(String truncUnit) {
    this.truncUnit = truncUnit;
  }

  /**
   * Field name accepted by PostgreSQL {@code DATE_TRUNC}.
   */
  public String truncUnit() {
    return truncUnit;
  }

  /**
   * Start of the period containing {@code dateTime}.
   */
  public LocalDate bucketOf(LocalDateTime dateTime) {
    LocalDate date = dateTime.toLocalDate();
    return switch (this) {
      case DAY -> date;
      case MONTH -> date.withDayOfMonth(1);
      case YEAR -> date.withDayOfYear(1);
    };
  }
}
