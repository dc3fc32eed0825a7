package com.ospicorp.metricsapi.metrics.repository;

import com.ospicorp.metricsapi.metrics.model.AggregationType;
import com.ospicorp.metricsapi.metrics.model.MetricBucket;
import com.ospicorp.metricsapi.metrics.model.MetricRecord;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

/**
 * Process-local store, used when no database is configured ({@code metrics.store=memory}).
 */
@Repository
@ConditionalOnProperty(name = "metrics.store", havingValue = "memory")
public class InMemoryMetricRecordStore implements MetricRecordStore {

  private final Map<Long, MetricRecord> storage = new ConcurrentHashMap<>();
  private final AtomicLong sequence = new AtomicLong();

  @Override
  public int insertBatch(List<MetricRecord> records) {
    List<MetricRecord> stored = new ArrayList<>(records.size());
    for (MetricRecord record : records) {
      stored.add(record.withId(sequence.incrementAndGet()));
    }
    stored.forEach(record -> storage.put(record.getId(), record));
    return stored.size();
  }

  @Override
  public List<MetricRecord> findByMetricIdAndRange(int metricId, LocalDateTime fromInclusive,
      LocalDateTime toExclusive) {
    return storage.values().stream()
        .filter(record -> record.getMetricId() == metricId)
        .filter(record -> !record.getDateTime().isBefore(fromInclusive)
            && record.getDateTime().isBefore(toExclusive))
        .sorted(Comparator.comparing(MetricRecord::getDateTime)
            .thenComparing(MetricRecord::getId))
        .collect(Collectors.toCollection(ArrayList::new));
  }

  @Override
  public List<MetricBucket> aggregate(int metricId, AggregationType type,
      LocalDateTime fromInclusive, LocalDateTime toExclusive) {
    Map<LocalDate, Long> sums = new TreeMap<>();
    for (MetricRecord record : findByMetricIdAndRange(metricId, fromInclusive, toExclusive)) {
      sums.merge(type.bucketOf(record.getDateTime()), (long) record.getAggDay(), Long::sum);
    }
    List<MetricBucket> buckets = new ArrayList<>(sums.size());
    sums.forEach((date, total) -> buckets.add(new MetricBucket(date, total)));
    return buckets;
  }

  public int size() {
    return storage.size();
  }
}
