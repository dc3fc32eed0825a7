package com.ospicorp.metricsapi.metrics.service;

import com.ospicorp.metricsapi.metrics.model.MetricRecord;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.Year;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Turns one raw CSV row into a {@link MetricRecord} or a discard. Bad timestamps discard the
 * row; bad numeric fields fall back to their defaults.
 */
@Component
public class RowNormalizer {
  public static final String METRIC_ID = "metricId";
  public static final String DATE_TIME = "dateTime";
  public static final String AGG_DAY = "aggDay";
  public static final String AGG_MONTH = "aggMonth";
  public static final String AGG_YEAR = "aggYear";

  static final DateTimeFormatter DATE_TIME_FORMAT = DateTimeFormatter
      .ofPattern("dd/MM/uuuu HH:mm")
      .withResolverStyle(ResolverStyle.STRICT);

  private static final int DEFAULT_AGG_DAY = 1;
  private static final int DEFAULT_AGG_MONTH = 1;

  private final Clock clock;
  private final boolean rejectUnknownMetricId;

  public RowNormalizer(Clock clock,
      @Value("${metrics.import.reject-unknown-metric-id:false}") boolean rejectUnknownMetricId) {
    this.clock = clock;
    this.rejectUnknownMetricId = rejectUnknownMetricId;
  }

  public NormalizedRow normalize(Map<String, String> row) {
    String rawDateTime = row.get(DATE_TIME);
    LocalDateTime dateTime = parseDateTime(rawDateTime);
    if (dateTime == null) {
      return NormalizedRow.discarded("invalid dateTime '" + rawDateTime + "'");
    }

    int metricId = positiveOrDefault(row.get(METRIC_ID), MetricRecord.UNKNOWN_METRIC_ID);
    if (rejectUnknownMetricId && metricId == MetricRecord.UNKNOWN_METRIC_ID) {
      return NormalizedRow.discarded("invalid metricId '" + row.get(METRIC_ID) + "'");
    }

    return NormalizedRow.accepted(new MetricRecord(
        metricId,
        dateTime,
        positiveOrDefault(row.get(AGG_DAY), DEFAULT_AGG_DAY),
        positiveOrDefault(row.get(AGG_MONTH), DEFAULT_AGG_MONTH),
        positiveOrDefault(row.get(AGG_YEAR), Year.now(clock).getValue())));
  }

  private static LocalDateTime parseDateTime(String value) {
    if (value == null) {
      return null;
    }
    try {
      return LocalDateTime.parse(value, DATE_TIME_FORMAT);
    } catch (DateTimeParseException ex) {
      return null;
    }
  }

  /**
   * Reads the leading integer of {@code value}, ignoring whatever follows it, so {@code "10.5"}
   * gives 10 and {@code "12abc"} gives 12. Missing, non-positive or out-of-range values give the
   * default.
   */
  static int positiveOrDefault(String value, int defaultValue) {
    if (value == null) {
      return defaultValue;
    }
    String trimmed = value.trim();
    int start = 0;
    if (!trimmed.isEmpty() && (trimmed.charAt(0) == '+' || trimmed.charAt(0) == '-')) {
      start = 1;
    }
    int end = start;
    while (end < trimmed.length() && trimmed.charAt(end) >= '0' && trimmed.charAt(end) <= '9') {
      end++;
    }
    if (end == start) {
      return defaultValue;
    }
    try {
      int parsed = Integer.parseInt(trimmed.substring(0, end));
      return parsed > 0 ? parsed : defaultValue;
    } catch (NumberFormatException ex) {
      return defaultValue;
    }
  }
}
