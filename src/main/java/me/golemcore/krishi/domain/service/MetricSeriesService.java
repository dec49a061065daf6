package me.golemcore.krishi.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.krishi.domain.exception.NotFoundException;
import me.golemcore.krishi.domain.exception.ProviderException;
import me.golemcore.krishi.domain.exception.ValidationException;
import me.golemcore.krishi.domain.metrics.RetentionPolicy;
import me.golemcore.krishi.domain.model.Deadline;
import me.golemcore.krishi.domain.model.MetricBucket;
import me.golemcore.krishi.domain.model.MetricPoint;
import me.golemcore.krishi.domain.model.MetricStatistics;
import me.golemcore.krishi.domain.model.SeriesTrend;
import me.golemcore.krishi.infrastructure.config.KrishiProperties;
import me.golemcore.krishi.port.outbound.RecordQuery;
import me.golemcore.krishi.port.outbound.RecordStorePort;
import me.golemcore.krishi.port.outbound.StoredRecord;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;

/**
 * Timestamped numeric series keyed by hierarchical metric ids such as
 * {@code weather:rainfall:pune} or {@code market:price:wheat}.
 *
 * <p>
 * Each metric id is one partition of the {@value #TABLE} table, with points
 * sorted by a zero-padded timestamp. Writing the same timestamp twice
 * overwrites the first point.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MetricSeriesService {

    public static final String TABLE = "metric_points";
    static final long DAY_MILLIS = 24L * 60 * 60 * 1000;
    private static final double TREND_THRESHOLD = 0.05;

    private final RecordStorePort recordStore;
    private final RetentionPolicy retentionPolicy;
    private final KrishiProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    // ==================== WRITE ====================

    /**
     * Stores the point, replacing any point at the same timestamp. A point
     * without an expiry gets one from the retention policy.
     */
    public void append(MetricPoint point) {
        FutureSupport.join(appendAsync(point), "append metric point");
    }

    /**
     * Appends each point independently; a failure leaves the earlier points
     * written.
     */
    public void appendAll(List<MetricPoint> points) {
        if (points == null || points.isEmpty()) {
            return;
        }
        List<CompletableFuture<Void>> writes = new ArrayList<>(points.size());
        for (MetricPoint point : points) {
            writes.add(appendAsync(point));
        }
        FutureSupport.joinAll(writes, "append metric points");
        log.debug("[Metrics] Appended {} points", points.size());
    }

    private CompletableFuture<Void> appendAsync(MetricPoint point) {
        validate(point);
        MetricPoint stored = point.toBuilder()
                .source(point.getSource() != null ? point.getSource() : MetricPoint.UNKNOWN_SOURCE)
                .unit(point.getUnit() != null ? point.getUnit() : "")
                .expiry(point.getExpiry() != null ? point.getExpiry()
                        : retentionPolicy.expiryFor(point.getMetricId(), clock.millis()))
                .build();
        StoredRecord record = StoredRecord.builder()
                .partitionKey(stored.getMetricId())
                .sortKey(sortKey(stored.getTimestamp()))
                .payload(write(stored))
                .expiresAt(stored.getExpiry())
                .build();
        return recordStore.put(TABLE, record);
    }

    // ==================== READ ====================

    /**
     * Points with {@code start <= timestamp <= end}, oldest first.
     */
    public List<MetricPoint> range(String metricId, long start, long end) {
        return FutureSupport.join(rangeAsync(metricId, start, end), "read metric range");
    }

    public Optional<MetricPoint> latest(String metricId) {
        requireMetricId(metricId);
        List<StoredRecord> records = FutureSupport.join(recordStore.query(TABLE, metricId, RecordQuery.last()),
                "read latest metric point");
        return records.stream().findFirst().map(this::read);
    }

    /**
     * Range query for several metrics at once. The queries run concurrently and
     * the result keeps the order of {@code metricIds}.
     */
    public Map<String, List<MetricPoint>> multiRange(List<String> metricIds, long start, long end) {
        if (metricIds == null) {
            throw new ValidationException("Metric ids are required");
        }
        List<String> ids = List.copyOf(new LinkedHashSet<>(metricIds));
        List<CompletableFuture<List<MetricPoint>>> queries = new ArrayList<>(ids.size());
        for (String id : ids) {
            queries.add(rangeAsync(id, start, end));
        }
        List<List<MetricPoint>> results = FutureSupport.joinAll(queries, "read metric ranges");
        Map<String, List<MetricPoint>> byId = new LinkedHashMap<>();
        for (int i = 0; i < ids.size(); i++) {
            byId.put(ids.get(i), results.get(i));
        }
        return byId;
    }

    /**
     * Min, max, average and count per bucket of {@code bucketMs}. Buckets are
     * keyed by {@code floor(ts / bucketMs) * bucketMs}; only non-empty buckets
     * are returned, oldest first.
     */
    public List<MetricBucket> aggregate(String metricId, long start, long end, long bucketMs) {
        if (bucketMs <= 0) {
            throw new ValidationException("Bucket size must be positive, got " + bucketMs);
        }
        TreeMap<Long, List<Double>> buckets = new TreeMap<>();
        for (MetricPoint point : range(metricId, start, end)) {
            long key = Math.floorDiv(point.getTimestamp(), bucketMs) * bucketMs;
            buckets.computeIfAbsent(key, ignored -> new ArrayList<>()).add(point.getValue());
        }

        List<MetricBucket> result = new ArrayList<>(buckets.size());
        for (Map.Entry<Long, List<Double>> bucket : buckets.entrySet()) {
            List<Double> values = bucket.getValue();
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            double sum = 0;
            for (double value : values) {
                min = Math.min(min, value);
                max = Math.max(max, value);
                sum += value;
            }
            result.add(new MetricBucket(bucket.getKey(), min, max, sum / values.size(), values.size()));
        }
        return result;
    }

    /**
     * Summary statistics of a window. The trend is the least-squares slope of
     * value over days since the first point, compared with 5% of the mean.
     *
     * @throws NotFoundException
     *             when the window holds no points
     */
    public MetricStatistics statistics(String metricId, long start, long end) {
        List<MetricPoint> points = range(metricId, start, end);
        if (points.isEmpty()) {
            throw new NotFoundException("No data found for metric " + metricId + " in the specified time range");
        }

        int count = points.size();
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        double sum = 0;
        for (MetricPoint point : points) {
            min = Math.min(min, point.getValue());
            max = Math.max(max, point.getValue());
            sum += point.getValue();
        }
        double avg = sum / count;

        double squaredDiffs = 0;
        for (MetricPoint point : points) {
            squaredDiffs += Math.pow(point.getValue() - avg, 2);
        }
        double stdDev = Math.sqrt(squaredDiffs / count);

        long first = points.get(0).getTimestamp();
        double dayAvg = 0;
        for (MetricPoint point : points) {
            dayAvg += (point.getTimestamp() - first) / (double) DAY_MILLIS;
        }
        dayAvg /= count;
        double numerator = 0;
        double denominator = 0;
        for (MetricPoint point : points) {
            double day = (point.getTimestamp() - first) / (double) DAY_MILLIS;
            numerator += (day - dayAvg) * (point.getValue() - avg);
            denominator += Math.pow(day - dayAvg, 2);
        }
        double slope = denominator != 0 ? numerator / denominator : 0;

        double threshold = TREND_THRESHOLD * avg;
        SeriesTrend trend;
        if (slope > threshold) {
            trend = SeriesTrend.INCREASING;
        } else if (slope < -threshold) {
            trend = SeriesTrend.DECREASING;
        } else {
            trend = SeriesTrend.STABLE;
        }

        return MetricStatistics.builder()
                .min(min)
                .max(max)
                .avg(avg)
                .count(count)
                .stdDev(stdDev)
                .slopePerDay(slope)
                .trend(trend)
                .build();
    }

    // ==================== DELETE ====================

    public int deleteRange(String metricId, Long start, Long end) {
        return deleteRange(metricId, start, end, Deadline.after(properties.getMetrics().getDeleteTimeout()));
    }

    /**
     * Deletes the points of a window one by one. Open bounds are given as
     * {@code null}. Points appended concurrently may or may not survive.
     *
     * @return number of deleted points
     * @throws me.golemcore.krishi.domain.exception.DeadlineExceededException
     *             when the deadline passes between two deletes; points deleted
     *             so far stay deleted
     */
    public int deleteRange(String metricId, Long start, Long end, Deadline deadline) {
        requireMetricId(metricId);
        if (start != null && end != null && start > end) {
            throw new ValidationException("Range start " + start + " is after end " + end);
        }
        if (end != null && end < 0) {
            return 0;
        }
        Deadline budget = deadline != null ? deadline : Deadline.none();
        RecordQuery query = RecordQuery.between(start != null ? sortKey(Math.max(0, start)) : null,
                end != null ? sortKey(end) : null);

        List<StoredRecord> matching = FutureSupport.join(recordStore.query(TABLE, metricId, query),
                "enumerate metric points");
        int deleted = 0;
        for (StoredRecord record : matching) {
            budget.check("metric delete");
            if (FutureSupport.join(recordStore.delete(TABLE, metricId, record.getSortKey()), "delete metric point")) {
                deleted++;
            }
        }
        log.debug("[Metrics] Deleted {} points of {}", deleted, metricId);
        return deleted;
    }

    // ==================== HELPERS ====================

    private CompletableFuture<List<MetricPoint>> rangeAsync(String metricId, long start, long end) {
        requireMetricId(metricId);
        if (start > end) {
            throw new ValidationException("Range start " + start + " is after end " + end);
        }
        if (end < 0) {
            return CompletableFuture.completedFuture(List.of());
        }
        RecordQuery query = RecordQuery.between(sortKey(Math.max(0, start)), sortKey(end));
        return recordStore.query(TABLE, metricId, query)
                .thenApply(records -> records.stream().map(this::read).toList());
    }

    /**
     * Zero-padded so that lexicographic order equals numeric order.
     */
    static String sortKey(long timestamp) {
        return String.format(Locale.ROOT, "%019d", timestamp);
    }

    private static void validate(MetricPoint point) {
        if (point == null) {
            throw new ValidationException("Metric point is required");
        }
        List<String> problems = new ArrayList<>();
        if (point.getMetricId() == null || point.getMetricId().isBlank()) {
            problems.add("Metric id must not be blank");
        }
        if (point.getTimestamp() < 0) {
            problems.add("Timestamp must not be negative: " + point.getTimestamp());
        }
        if (Double.isNaN(point.getValue()) || Double.isInfinite(point.getValue())) {
            problems.add("Metric value must be finite, got " + point.getValue());
        }
        if (!problems.isEmpty()) {
            throw new ValidationException(problems);
        }
    }

    private static void requireMetricId(String metricId) {
        if (metricId == null || metricId.isBlank()) {
            throw new ValidationException("Metric id must not be blank");
        }
    }

    private String write(MetricPoint point) {
        try {
            return objectMapper.writeValueAsString(point);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Metric point is not serializable: " + e.getOriginalMessage());
        }
    }

    private MetricPoint read(StoredRecord record) {
        try {
            return objectMapper.readValue(record.getPayload(), MetricPoint.class);
        } catch (JsonProcessingException e) {
            throw new ProviderException("Corrupt metric point " + record.getPartitionKey() + "@"
                    + record.getSortKey(), e);
        }
    }
}
