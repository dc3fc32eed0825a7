package com.ospicorp.metricsapi.metrics.controller;

import com.ospicorp.metricsapi.metrics.model.AggregationType;
import com.ospicorp.metricsapi.metrics.model.ImportResult;
import com.ospicorp.metricsapi.metrics.model.MetricBucket;
import com.ospicorp.metricsapi.metrics.model.MetricQuery;
import com.ospicorp.metricsapi.metrics.model.ReportArtifact;
import com.ospicorp.metricsapi.metrics.service.AggregationService;
import com.ospicorp.metricsapi.metrics.service.CsvIngestionPipeline;
import com.ospicorp.metricsapi.metrics.service.ReportExporter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Pattern;
import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MimeTypeUtils;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/v1/metrics")
@Validated
@Tag(name = "Metrics")
public class MetricController {
  static final MediaType CSV_MEDIA_TYPE = MediaType.valueOf("text/csv");
  private static final String FORMAT_REGEX = "(?i)json|csv";
  private static final String ERROR_DOCS_BASE = "https://developers.company.com/docs/errors/";

  private final CsvIngestionPipeline ingestionPipeline;
  private final AggregationService aggregationService;
  private final ReportExporter reportExporter;

  public MetricController(CsvIngestionPipeline ingestionPipeline,
      AggregationService aggregationService, ReportExporter reportExporter) {
    this.ingestionPipeline = ingestionPipeline;
    this.aggregationService = aggregationService;
    this.reportExporter = reportExporter;
  }

  @PostMapping(path = "/import", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Tag(name = "Import")
  @Operation(summary = "Import metric file",
      description = "Stream a ';'-separated metric file into storage. Rows with an invalid "
          + "dateTime are skipped; the response returns once every accepted row is stored.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Import completed",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = ImportResult.class))),
      @ApiResponse(responseCode = "400", description = "No file uploaded",
          content = @Content(mediaType = "application/json")),
      @ApiResponse(responseCode = "500", description = "Import aborted",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ImportResult importMetrics(@RequestPart(name = "file", required = false)
      @Parameter(description = "Metric file with header metricId;dateTime;aggDay;aggMonth;aggYear")
      MultipartFile file) throws IOException {
    if (file == null || file.isEmpty()) {
      throw invalidParameter("file", "No file uploaded.", 2001);
    }
    try (InputStream in = file.getInputStream()) {
      return awaitImport(ingestionPipeline.importCsv(in));
    }
  }

  @GetMapping("/aggregate")
  @Tag(name = "Aggregation")
  @Operation(summary = "Aggregate metric",
      description = "Sum aggDay per day, month or year bucket for one metric over an inclusive date range.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Buckets in ascending order",
          content = {
              @Content(mediaType = "application/json",
                  array = @ArraySchema(schema = @Schema(implementation = MetricBucket.class))),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/json")),
      @ApiResponse(responseCode = "404", description = "No data in range",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<List<MetricBucket>> aggregate(
      @RequestParam @Parameter(description = "Metric identifier", example = "7") int metricId,
      @RequestParam @Parameter(description = "Bucket size: DAY, MONTH or YEAR", example = "MONTH")
          String aggType,
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
      @Parameter(description = "Start date (inclusive)", example = "2024-01-01") LocalDate dateInitial,
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
      @Parameter(description = "End date (inclusive)", example = "2024-01-31") LocalDate finalDate,
      @RequestParam(name = "format", required = false)
      @Pattern(regexp = FORMAT_REGEX, message = "Invalid format value. Supported values: json,csv.")
      @Parameter(description = "Response format: json or csv; overrides Accept") String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {

    AggregationType type = parseAggregationType(aggType);
    MetricQuery query = toQuery(metricId, dateInitial, finalDate);
    MediaType contentType = selectMediaType(format, accept);

    List<MetricBucket> buckets = aggregationService.aggregate(query, type);
    return ResponseEntity.ok().contentType(contentType).body(buckets);
  }

  @GetMapping("/report")
  @Tag(name = "Reports")
  @Operation(summary = "Export metric report",
      description = "Download every record of a metric in the date range as an Excel workbook.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Report file",
          content = @Content(mediaType = ReportExporter.CONTENT_TYPE)),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/json")),
      @ApiResponse(responseCode = "404", description = "No data in range",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<byte[]> report(
      @RequestParam @Parameter(description = "Metric identifier", example = "7") int metricId,
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
      @Parameter(description = "Start date (inclusive)", example = "2024-01-01") LocalDate dateInitial,
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
      @Parameter(description = "End date (inclusive)", example = "2024-01-31") LocalDate finalDate) {

    ReportArtifact artifact = reportExporter.export(toQuery(metricId, dateInitial, finalDate));
    ContentDisposition disposition = ContentDisposition.attachment()
        .filename(artifact.fileName())
        .build();
    return ResponseEntity.ok()
        .contentType(MediaType.parseMediaType(ReportExporter.CONTENT_TYPE))
        .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
        .body(artifact.content());
  }

  private static ImportResult awaitImport(CompletableFuture<ImportResult> pending) {
    try {
      return pending.join();
    } catch (CompletionException ex) {
      if (ex.getCause() instanceof RuntimeException cause) {
        throw cause;
      }
      throw ex;
    }
  }

  private static MetricQuery toQuery(int metricId, LocalDate dateInitial, LocalDate finalDate) {
    if (metricId < 1) {
      throw invalidParameter("metricId",
          "Invalid metricId. Must be an integer greater than zero.", 2002);
    }
    if (dateInitial.isAfter(finalDate)) {
      throw invalidParameter("dateInitial", "dateInitial must not be after finalDate.", 2004);
    }
    return new MetricQuery(metricId, dateInitial, finalDate);
  }

  private static AggregationType parseAggregationType(String value) {
    try {
      return AggregationType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw invalidParameter("aggType",
          "Invalid aggType. Supported values: DAY,MONTH,YEAR.", 2003);
    }
  }

  private static MediaType selectMediaType(String format, String accept) {
    if (StringUtils.hasText(format)) {
      return "csv".equalsIgnoreCase(format) ? CSV_MEDIA_TYPE : MediaType.APPLICATION_JSON;
    }
    if (!StringUtils.hasText(accept)) {
      return MediaType.APPLICATION_JSON;
    }
    List<MediaType> mediaTypes = MediaType.parseMediaTypes(accept);
    mediaTypes.sort(Comparator.comparingDouble(MediaType::getQualityValue).reversed());
    MimeTypeUtils.sortBySpecificity(mediaTypes);
    for (MediaType mediaType : mediaTypes) {
      if (mediaType.isCompatibleWith(MediaType.APPLICATION_JSON)) {
        return MediaType.APPLICATION_JSON;
      }
      if (mediaType.isCompatibleWith(CSV_MEDIA_TYPE)) {
        return CSV_MEDIA_TYPE;
      }
    }
    return MediaType.APPLICATION_JSON;
  }

  private static InvalidParameterException invalidParameter(String parameter, String message,
      int errorCode) {
    return new InvalidParameterException(parameter, message, errorCode,
        ERROR_DOCS_BASE + errorCode);
  }
}
