package com.ospicorp.metricsapi.metrics.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * One stored metric sample. Records are append-only: the store assigns {@code id} on insert
 * and nothing updates a record afterwards.
 */
@Entity
@Table(name = "metric_record")
public class MetricRecord {

  /**
   * Stored in place of a metric id that was missing, non-numeric or not positive.
   */
  public static final int UNKNOWN_METRIC_ID = 0;

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  private int metricId;

  @Column(name = "date_time", nullable = false)
  private LocalDateTime dateTime;

  private int aggDay;
  private int aggMonth;
  private int aggYear;

  protected MetricRecord() {
    // JPA default constructor
  }

  public MetricRecord(int metricId, LocalDateTime dateTime, int aggDay, int aggMonth,
      int aggYear) {
    this(null, metricId, dateTime, aggDay, aggMonth, aggYear);
  }

  private MetricRecord(Long id, int metricId, LocalDateTime dateTime, int aggDay, int aggMonth,
      int aggYear) {
    this.id = id;
    this.metricId = metricId;
    this.dateTime = Objects.requireNonNull(dateTime, "dateTime");
    this.aggDay = aggDay;
    this.aggMonth = aggMonth;
    this.aggYear = aggYear;
  }

  /**
   * Copy of this record carrying a store-assigned identifier.
   */
  public MetricRecord withId(long assignedId) {
    return new MetricRecord(assignedId, metricId, dateTime, aggDay, aggMonth, aggYear);
  }

  public Long getId() {
    return id;
  }

  public int getMetricId() {
    return metricId;
  }

  public boolean hasUnknownMetricId() {
    return metricId == UNKNOWN_METRIC_ID;
  }

  public LocalDateTime getDateTime() {
    return dateTime;
  }

  public int getAggDay() {
    return aggDay;
  }

  public int getAggMonth() {
    return aggMonth;
  }

  public int getAggYear() {
    return aggYear;
  }

  @Override
  public String toString() {
    return "MetricRecord{id=" + id + ", metricId=" + metricId + ", dateTime=" + dateTime
        + ", aggDay=" + aggDay + ", aggMonth=" + aggMonth + ", aggYear=" + aggYear + '}';
  }
}
