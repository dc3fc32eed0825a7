package com.ospicorp.metricsapi.metrics.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ImportResult(
    @JsonProperty("rows_read") long rowsRead,
    @JsonProperty("records_written") long recordsWritten,
    @JsonProperty("rows_discarded") long rowsDiscarded,
    @JsonProperty("batches_flushed") int batchesFlushed
) {}
