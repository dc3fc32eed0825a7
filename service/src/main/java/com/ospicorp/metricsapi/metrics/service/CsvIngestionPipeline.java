package com.ospicorp.metricsapi.metrics.service;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.ospicorp.metricsapi.metrics.model.ImportResult;
import com.ospicorp.metricsapi.metrics.model.MetricRecord;
import com.ospicorp.metricsapi.metrics.repository.MetricRecordStore;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PushbackInputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Streams a {@code ;}-separated metric file into the {@link MetricRecordStore}.
 *
 * <p>The calling thread reads and normalizes rows. Full batches are handed to the writer
 * executor and flushed one after another in read order, so parsing overlaps with persistence
 * while batch order is kept. At most {@code maxPendingBatches} batches wait for the writer at
 * any time; the reader blocks until one completes.
 *
 * <p>Quotes carry no meaning in the file format: a {@code "} is kept as part of the field.
 *
 * <p>The returned future completes only once every flushed batch is durable. A read failure or a
 * failed flush is fatal: reading stops, no later batch is written, and the future fails with a
 * {@link MetricImportException} reporting how many records were committed before the failure.
 */
@Service
public class CsvIngestionPipeline {
  private static final Logger log = LoggerFactory.getLogger(CsvIngestionPipeline.class);
  private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};
  static final char COLUMN_SEPARATOR = ';';

  private final MetricRecordStore store;
  private final RowNormalizer normalizer;
  private final Executor writerExecutor;
  private final int batchSize;
  private final int maxPendingBatches;
  private final CsvMapper mapper = CsvMapper.builder()
      .enable(CsvParser.Feature.SKIP_EMPTY_LINES, CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE)
      .build();
  private final CsvSchema schema = CsvSchema.emptySchema()
      .withHeader()
      .withColumnSeparator(COLUMN_SEPARATOR)
      .withoutQuoteChar();

  public CsvIngestionPipeline(MetricRecordStore store,
      RowNormalizer normalizer,
      @Qualifier("metricWriterExecutor") Executor writerExecutor,
      @Value("${metrics.import.batch-size:1000}") int batchSize,
      @Value("${metrics.import.max-pending-batches:2}") int maxPendingBatches) {
    if (batchSize < 1) {
      throw new IllegalArgumentException("metrics.import.batch-size must be positive");
    }
    if (maxPendingBatches < 1) {
      throw new IllegalArgumentException("metrics.import.max-pending-batches must be positive");
    }
    this.store = store;
    this.normalizer = normalizer;
    this.writerExecutor = writerExecutor;
    this.batchSize = batchSize;
    this.maxPendingBatches = maxPendingBatches;
  }

  public CompletableFuture<ImportResult> importCsv(InputStream source) {
    Objects.requireNonNull(source, "source must be provided");
    ImportRun run = new ImportRun();
    log.info("Starting metric import (batch size {})", batchSize);

    try (Reader reader = new InputStreamReader(skipByteOrderMark(source), StandardCharsets.UTF_8);
        MappingIterator<Map<String, String>> rows = mapper.readerForMapOf(String.class)
            .with(schema)
            .readValues(reader)) {
      List<MetricRecord> batch = new ArrayList<>(batchSize);
      while (!run.writeFailed() && rows.hasNextValue()) {
        Map<String, String> row = rows.nextValue();
        long rowNumber = ++run.rowsRead;
        NormalizedRow normalized = normalizer.normalize(row);
        if (normalized.isDiscarded()) {
          run.rowsDiscarded++;
          log.warn("Discarding data row {}: {}", rowNumber, normalized.discardReason());
          continue;
        }
        batch.add(normalized.record());
        if (batch.size() >= batchSize) {
          run.submit(batch);
          batch = new ArrayList<>(batchSize);
        }
      }
      if (!batch.isEmpty() && !run.writeFailed()) {
        run.submit(batch);
      }
    } catch (IOException ex) {
      log.error("Failed to read metric file after {} data rows", run.rowsRead, ex);
      return run.fail("Failed to read metric file", ex);
    } catch (RuntimeException ex) {
      log.error("Metric import stopped after {} data rows", run.rowsRead, ex);
      return run.fail("Failed to read metric file", ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return run.fail("Metric import interrupted", ex);
    }
    return run.completion();
  }

  static InputStream skipByteOrderMark(InputStream source) throws IOException {
    PushbackInputStream in = new PushbackInputStream(source, UTF8_BOM.length);
    byte[] head = in.readNBytes(UTF8_BOM.length);
    if (!Arrays.equals(head, UTF8_BOM)) {
      in.unread(head);
    }
    return in;
  }

  private static Throwable unwrap(Throwable ex) {
    return ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
  }

  /**
   * State of one import. Row counters are only touched by the reading thread; the write-side
   * counters are shared with the writer executor.
   */
  private final class ImportRun {
    private final Semaphore pending = new Semaphore(maxPendingBatches);
    private final AtomicLong recordsWritten = new AtomicLong();
    private final AtomicInteger batchesFlushed = new AtomicInteger();
    private final AtomicReference<Throwable> writeFailure = new AtomicReference<>();
    private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);
    private long rowsRead;
    private long rowsDiscarded;
    private int batchesSubmitted;

    boolean writeFailed() {
      return writeFailure.get() != null;
    }

    void submit(List<MetricRecord> batch) throws InterruptedException {
      pending.acquire();
      int batchNumber = ++batchesSubmitted;
      // a failed predecessor completes this stage exceptionally without running the flush
      tail = tail
          .thenRunAsync(() -> flush(batchNumber, batch), writerExecutor)
          .whenComplete((ignored, ex) -> {
            if (ex != null) {
              writeFailure.compareAndSet(null, unwrap(ex));
            }
            pending.release();
          });
    }

    private void flush(int batchNumber, List<MetricRecord> batch) {
      int written = store.insertBatch(batch);
      recordsWritten.addAndGet(written);
      batchesFlushed.incrementAndGet();
      log.debug("Flushed batch {} with {} records", batchNumber, written);
    }

    CompletableFuture<ImportResult> completion() {
      long read = rowsRead;
      long discarded = rowsDiscarded;
      return tail.handle((ignored, ex) -> {
        if (ex != null) {
          Throwable cause = unwrap(ex);
          log.error("Metric import aborted after {} records were written", recordsWritten.get(),
              cause);
          throw new MetricImportException("Failed to persist metric batch", recordsWritten.get(),
              cause);
        }
        ImportResult result = new ImportResult(read, recordsWritten.get(), discarded,
            batchesFlushed.get());
        log.info("Metric import finished: {} rows read, {} records written, {} rows discarded",
            result.rowsRead(), result.recordsWritten(), result.rowsDiscarded());
        return result;
      });
    }

    CompletableFuture<ImportResult> fail(String message, Throwable cause) {
      return tail.<ImportResult>handle((ignored, writeEx) -> {
        MetricImportException failure =
            new MetricImportException(message, recordsWritten.get(), cause);
        if (writeEx != null) {
          failure.addSuppressed(unwrap(writeEx));
        }
        throw failure;
      });
    }
  }
}
