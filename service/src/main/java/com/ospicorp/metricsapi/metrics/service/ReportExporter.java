package com.ospicorp.metricsapi.metrics.service;

import com.ospicorp.metricsapi.metrics.model.MetricQuery;
import com.ospicorp.metricsapi.metrics.model.MetricRecord;
import com.ospicorp.metricsapi.metrics.model.ReportArtifact;
import com.ospicorp.metricsapi.metrics.repository.MetricRecordStore;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.UUID;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Renders the raw records of a metric into an Excel workbook, one sheet row per record.
 *
 * <p>Every call produces its own artifact name. When a report directory is configured the
 * artifact is also archived there; the file is created exclusively, so concurrent reports never
 * share or overwrite a file.
 */
@Service
public class ReportExporter {
  public static final String CONTENT_TYPE =
      "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";
  static final String SHEET_NAME = "Relatório de Métricas";
  static final List<String> COLUMNS =
      List.of("MetricId", "DateTime", "AggDay", "AggMonth", "AggYear");

  private static final Logger log = LoggerFactory.getLogger(ReportExporter.class);
  private static final DateTimeFormatter REPORT_DATE = DateTimeFormatter.ofPattern("dd/MM/yyyy");
  // column widths in characters
  private static final int[] COLUMN_WIDTHS = {15, 20, 15, 15, 15};

  private final MetricRecordStore store;
  private final Path archiveDirectory;

  public ReportExporter(MetricRecordStore store,
      @Value("${metrics.reports.directory:}") String archiveDirectory) {
    this.store = store;
    this.archiveDirectory = StringUtils.hasText(archiveDirectory) ? Path.of(archiveDirectory) : null;
  }

  /**
   * @throws NoSuchElementException when no record of the metric falls in the range; nothing is
   *     rendered or archived in that case
   */
  public ReportArtifact export(MetricQuery query) {
    Objects.requireNonNull(query, "query must be provided");
    List<MetricRecord> records = store.findByMetricIdAndRange(query.metricId(),
        query.fromInclusive(), query.toExclusive());
    log.info("Found {} records for report of metric {} ({} to {})", records.size(),
        query.metricId(), query.start(), query.end());
    if (records.isEmpty()) {
      throw new NoSuchElementException("No data found for metric " + query.metricId()
          + " between " + query.start() + " and " + query.end());
    }

    byte[] content = render(records);
    String fileName = "metric-report-" + query.metricId() + "-" + UUID.randomUUID() + ".xlsx";
    if (archiveDirectory != null) {
      archive(fileName, content);
    }
    return new ReportArtifact(fileName, content, records.size());
  }

  byte[] render(List<MetricRecord> records) {
    try (Workbook workbook = new XSSFWorkbook();
        ByteArrayOutputStream out = new ByteArrayOutputStream()) {
      Sheet sheet = workbook.createSheet(SHEET_NAME);
      Row header = sheet.createRow(0);
      for (int i = 0; i < COLUMNS.size(); i++) {
        header.createCell(i).setCellValue(COLUMNS.get(i));
        sheet.setColumnWidth(i, COLUMN_WIDTHS[i] * 256);
      }

      int rowIndex = 1;
      for (MetricRecord record : records) {
        Row row = sheet.createRow(rowIndex++);
        row.createCell(0).setCellValue(record.getMetricId());
        row.createCell(1).setCellValue(REPORT_DATE.format(record.getDateTime()));
        row.createCell(2).setCellValue(record.getAggDay());
        row.createCell(3).setCellValue(record.getAggMonth());
        row.createCell(4).setCellValue(twoDigitYear(record.getAggYear()));
      }

      workbook.write(out);
      return out.toByteArray();
    } catch (IOException ex) {
      throw new UncheckedIOException("Unable to render metric report", ex);
    }
  }

  static String twoDigitYear(int aggYear) {
    String year = Integer.toString(aggYear);
    return year.length() > 2 ? year.substring(year.length() - 2) : year;
  }

  private void archive(String fileName, byte[] content) {
    Path target = archiveDirectory.resolve(fileName);
    try {
      Files.createDirectories(archiveDirectory);
      Files.write(target, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
    } catch (IOException ex) {
      throw new UncheckedIOException("Unable to archive report " + target, ex);
    }
    log.info("Report archived at {}", target);
  }
}
