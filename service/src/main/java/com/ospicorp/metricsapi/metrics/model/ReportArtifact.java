package com.ospicorp.metricsapi.metrics.model;

public record ReportArtifact(String fileName, byte[] content, int recordCount) {}
