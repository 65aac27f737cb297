package com.queryguard.service.core.sketch;

import com.queryguard.service.core.config.QueryGuardProperties;
import com.queryguard.service.core.config.TimeBucket;
import com.queryguard.service.core.model.InsufficientDataException;
import com.queryguard.service.core.model.InvalidRangeException;
import com.queryguard.service.core.model.TimeRange;
import com.queryguard.service.core.telemetry.ReadingBuffer;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Per-category percentile estimation over bucketed DDSketches.
 *
 * <p>A reading lands in the sketch of the bucket containing its timestamp. An approximate range
 * query merges the buckets lying entirely inside {@code [start, end)}; a boundary that cuts
 * through a bucket is answered from the raw readings of the partial bucket, so the range stays
 * half-open. When those raw readings are not retained the query fails with
 * {@link InvalidRangeException} instead of counting readings outside the range.
 */
@Service
@Slf4j
public class PercentileEstimator {

    private final ConcurrentMap<String, CategorySketches> categories = new ConcurrentHashMap<>();
    private final ReadingBuffer rawBuffer;
    private final double relativeAccuracy;
    private final int maxBins;
    private final TimeBucket bucket;
    private final Duration retention;

    public PercentileEstimator(QueryGuardProperties properties, ReadingBuffer rawBuffer) {
        QueryGuardProperties.Sketch sketch = properties.getSketch();
        this.rawBuffer = rawBuffer;
        this.relativeAccuracy = sketch.getRelativeAccuracy();
        this.maxBins = sketch.getMaxBins();
        this.bucket = sketch.getBucket();
        this.retention = sketch.getRetention();
        log.info(
                "Percentile estimator ready relativeAccuracy={} maxBins={} bucket={} retention={}",
                relativeAccuracy,
                maxBins,
                bucket,
                retention);
    }

    public void insert(String category, Instant timestamp, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return;
        }
        CategorySketches sketches = categories.computeIfAbsent(category, ignored -> new CategorySketches());
        Instant bucketStart = bucket.align(timestamp);
        QuantileSketch sketch = sketches.buckets.computeIfAbsent(bucketStart, ignored -> newSketch());
        if (sketch.insert(value)) {
            log.warn(
                    "SketchCapacityExceeded category={} bucket={} maxBins={}; lowest quantiles lose precision",
                    category,
                    bucketStart,
                    maxBins);
        }
        sketches.observe(timestamp);
    }

    public PercentileResult query(
            String category, TimeRange range, List<Double> percentiles, PercentileMethod method) {
        Objects.requireNonNull(range, "range");
        requireCategory(category);
        double[] ps = validatePercentiles(percentiles);
        return switch (method == null ? PercentileMethod.APPROXIMATE : method) {
            case APPROXIMATE -> approximate(category, range, ps);
            case EXACT -> exact(category, range, ps);
        };
    }

    /**
     * Merged sketch of the readings in {@code [start, end)}, or an empty sketch when there are none.
     *
     * @throws InvalidRangeException when a boundary cuts through a bucket whose raw readings are
     *     no longer retained
     */
    public QuantileSketch export(String category, TimeRange range) {
        requireCategory(category);
        Objects.requireNonNull(range, "range");
        QuantileSketch merged = newSketch();
        Instant interiorStart = bucket.alignUp(range.start());
        Instant interiorEnd = bucket.align(range.end());
        if (!interiorStart.isBefore(interiorEnd)) {
            addRaw(merged, category, range);
            return merged;
        }
        if (!interiorStart.equals(range.start())) {
            addRaw(merged, category, new TimeRange(range.start(), interiorStart));
        }
        CategorySketches sketches = categories.get(category);
        if (sketches != null) {
            for (QuantileSketch part : sketches.buckets.subMap(interiorStart, true, interiorEnd, false).values()) {
                merged.mergeFrom(part);
            }
        }
        if (!interiorEnd.equals(range.end())) {
            addRaw(merged, category, new TimeRange(interiorEnd, range.end()));
        }
        return merged;
    }

    /**
     * Per-bucket count, sum and mean of the category (every category when {@code category} is
     * null), rolled up to {@code granularity}. Empty buckets are omitted.
     *
     * @throws IllegalArgumentException when {@code granularity} is finer than the sketch buckets
     * @throws InvalidRangeException when the range is not aligned to {@code granularity}
     */
    public List<UsagePoint> usage(String category, TimeRange range, TimeBucket granularity) {
        Objects.requireNonNull(range, "range");
        TimeBucket effective = granularity == null ? bucket : granularity;
        if (!bucket.nestsIn(effective)) {
            throw new IllegalArgumentException(
                    "Usage granularity " + effective + " is finer than the sketch bucket " + bucket);
        }
        if (!effective.isAligned(range.start()) || !effective.isAligned(range.end())) {
            throw new InvalidRangeException("Usage range " + range + " is not aligned to " + effective + " buckets");
        }
        List<CategorySketches> selected = new ArrayList<>();
        if (category == null || category.isBlank()) {
            selected.addAll(categories.values());
        } else {
            CategorySketches sketches = categories.get(category);
            if (sketches != null) {
                selected.add(sketches);
            }
        }
        NavigableMap<Instant, double[]> rollup = new TreeMap<>();
        for (CategorySketches sketches : selected) {
            for (Map.Entry<Instant, QuantileSketch> entry :
                    sketches.buckets.subMap(range.start(), true, range.end(), false).entrySet()) {
                QuantileSketch sketch = entry.getValue();
                long count = sketch.count();
                if (count == 0) {
                    continue;
                }
                double[] totals = rollup.computeIfAbsent(effective.align(entry.getKey()), ignored -> new double[2]);
                totals[0] += count;
                totals[1] += sketch.sum();
            }
        }
        List<UsagePoint> points = new ArrayList<>(rollup.size());
        rollup.forEach((start, totals) -> points.add(
                new UsagePoint(start, (long) totals[0], totals[1], totals[1] / totals[0])));
        return points;
    }

    /** Folds a partial sketch produced elsewhere (another shard) into the local bucket. */
    public void mergePartial(String category, Instant bucketStart, QuantileSketch partial) {
        requireCategory(category);
        Objects.requireNonNull(partial, "partial sketch");
        if (Double.compare(partial.relativeAccuracy(), relativeAccuracy) != 0) {
            throw new IllegalArgumentException("Partial sketch relative accuracy " + partial.relativeAccuracy()
                    + " does not match local " + relativeAccuracy);
        }
        if (partial.count() == 0) {
            return;
        }
        Instant aligned = bucket.align(bucketStart);
        CategorySketches sketches = categories.computeIfAbsent(category, ignored -> new CategorySketches());
        QuantileSketch target = sketches.buckets.computeIfAbsent(aligned, ignored -> newSketch());
        target.mergeFrom(partial);
        sketches.observe(aligned);
        log.debug("Merged partial sketch category={} bucket={} samples={}", category, aligned, partial.count());
    }

    /** Drops buckets older than the retention window, measured from each category's newest reading. */
    public int evictExpired() {
        int evicted = 0;
        for (Map.Entry<String, CategorySketches> entry : categories.entrySet()) {
            CategorySketches sketches = entry.getValue();
            Instant newest = sketches.newest.get();
            if (newest == null) {
                continue;
            }
            NavigableMap<Instant, QuantileSketch> expired =
                    sketches.buckets.headMap(bucket.align(newest.minus(retention)), false);
            evicted += expired.size();
            expired.clear();
        }
        if (evicted > 0) {
            log.info("Evicted {} expired sketch buckets", evicted);
        }
        return evicted;
    }

    public Map<String, Long> sampleCounts() {
        Map<String, Long> counts = new TreeMap<>();
        categories.forEach((category, sketches) -> counts.put(
                category,
                sketches.buckets.values().stream().mapToLong(QuantileSketch::count).sum()));
        return counts;
    }

    public TimeBucket bucket() {
        return bucket;
    }

    public double relativeAccuracy() {
        return relativeAccuracy;
    }

    public QuantileSketch newSketch() {
        return QuantileSketch.create(relativeAccuracy, maxBins);
    }

    private PercentileResult approximate(String category, TimeRange range, double[] ps) {
        QuantileSketch snapshot = export(category, range);
        if (snapshot.count() == 0) {
            throw new InsufficientDataException(category, range);
        }
        double[] values = snapshot.quantiles(ps);
        return new PercentileResult(
                category,
                range,
                PercentileMethod.APPROXIMATE,
                snapshot.count(),
                snapshot.mean(),
                toMap(ps, values));
    }

    private PercentileResult exact(String category, TimeRange range, double[] ps) {
        if (!rawBuffer.isEnabled()) {
            throw new IllegalStateException("Exact percentiles require raw retention (queryguard.telemetry.raw-retention)");
        }
        double[] sorted = rawBuffer.sortedValues(category, range);
        if (sorted.length == 0) {
            throw new InsufficientDataException(category, range);
        }
        double sum = 0.0d;
        for (double v : sorted) {
            sum += v;
        }
        double[] values = new double[ps.length];
        for (int i = 0; i < ps.length; i++) {
            values[i] = interpolate(sorted, ps[i]);
        }
        return new PercentileResult(
                category, range, PercentileMethod.EXACT, sorted.length, sum / sorted.length, toMap(ps, values));
    }

    /** Linear interpolation between the closest ranks. */
    static double interpolate(double[] sorted, double p) {
        double position = p * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (position - lower);
    }

    private void addRaw(QuantileSketch target, String category, TimeRange partial) {
        if (!rawBuffer.retainsFrom(category, partial.start())) {
            throw new InvalidRangeException("Range boundary in " + partial + " is not aligned to " + bucket
                    + " buckets and the raw readings needed to split the bucket are not retained");
        }
        for (double value : rawBuffer.sortedValues(category, partial)) {
            target.insert(value);
        }
    }

    private static Map<Double, Double> toMap(double[] ps, double[] values) {
        Map<Double, Double> result = new LinkedHashMap<>();
        for (int i = 0; i < ps.length; i++) {
            result.put(ps[i], values[i]);
        }
        return result;
    }

    private static double[] validatePercentiles(List<Double> percentiles) {
        if (percentiles == null || percentiles.isEmpty()) {
            throw new IllegalArgumentException("At least one percentile is required");
        }
        double[] ps = new double[percentiles.size()];
        for (int i = 0; i < ps.length; i++) {
            Double p = percentiles.get(i);
            if (p == null || Double.isNaN(p) || p < 0d || p > 1d) {
                throw new IllegalArgumentException("Percentile must be within [0, 1]: " + p);
            }
            ps[i] = p;
        }
        return ps;
    }

    private static void requireCategory(String category) {
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("category is required");
        }
    }

    private static final class CategorySketches {
        private final ConcurrentSkipListMap<Instant, QuantileSketch> buckets = new ConcurrentSkipListMap<>();
        private final AtomicReference<Instant> newest = new AtomicReference<>();

        void observe(Instant timestamp) {
            newest.accumulateAndGet(timestamp, (current, next) -> current == null || next.isAfter(current) ? next : current);
        }
    }
}
