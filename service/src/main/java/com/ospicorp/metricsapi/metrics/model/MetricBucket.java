package com.ospicorp.metricsapi.metrics.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.LocalDate;

// date is the first day of the bucket; value is the summed aggDay
@JsonPropertyOrder({"date", "value"})
public record MetricBucket(LocalDate date, long value) {}
