package com.queryguard.service.core.telemetry;

import com.queryguard.service.core.config.QueryGuardProperties;
import com.queryguard.service.core.model.TimeRange;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Per-category, time-ordered store of raw readings backing exact percentile queries.
 *
 * <p>Retention is measured in event time: a category keeps readings no older than its newest
 * reading minus {@code queryguard.telemetry.raw-retention}, and never more than
 * {@code max-samples-per-category} of them (oldest dropped first).
 */
@Component
@Slf4j
public class ReadingBuffer {

    private final ConcurrentMap<String, CategoryBuffer> categories = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Duration retention;
    private final int maxSamples;

    public ReadingBuffer(QueryGuardProperties properties) {
        QueryGuardProperties.Telemetry telemetry = properties.getTelemetry();
        this.retention = telemetry.isRawRetentionEnabled() ? telemetry.getRawRetention() : Duration.ZERO;
        this.maxSamples = telemetry.getMaxSamplesPerCategory();
    }

    public boolean isEnabled() {
        return !retention.isZero();
    }

    public void append(Reading reading) {
        if (!isEnabled()) {
            return;
        }
        CategoryBuffer buffer = categories.computeIfAbsent(reading.deviceCategory(), ignored -> new CategoryBuffer());
        buffer.append(new SampleKey(reading.timestamp(), sequence.incrementAndGet()), reading.value());
        buffer.trim(retention, maxSamples);
    }

    /** Returns the values in {@code [start, end)} sorted ascending. */
    public double[] sortedValues(String category, TimeRange range) {
        CategoryBuffer buffer = categories.get(category);
        if (buffer == null) {
            return new double[0];
        }
        NavigableMap<SampleKey, Double> slice = buffer.samples.subMap(
                SampleKey.lowerBound(range.start()), true, SampleKey.lowerBound(range.end()), false);
        double[] values = slice.values().stream().mapToDouble(Double::doubleValue).toArray();
        Arrays.sort(values);
        return values;
    }

    /**
     * Whether every reading of the category at or after {@code from} is still retained, i.e. no
     * reading that late has been trimmed by retention or the size cap.
     */
    public boolean retainsFrom(String category, Instant from) {
        if (!isEnabled()) {
            return false;
        }
        CategoryBuffer buffer = categories.get(category);
        if (buffer == null) {
            return true;
        }
        Instant evicted = buffer.evictedThrough;
        return evicted == null || evicted.isBefore(from);
    }

    public int size(String category) {
        CategoryBuffer buffer = categories.get(category);
        return buffer == null ? 0 : buffer.size.get();
    }

    public Map<String, Integer> sizes() {
        Map<String, Integer> sizes = new TreeMap<>();
        categories.forEach((category, buffer) -> sizes.put(category, buffer.size.get()));
        return sizes;
    }

    private static final class CategoryBuffer {
        private final ConcurrentSkipListMap<SampleKey, Double> samples = new ConcurrentSkipListMap<>();
        private final AtomicInteger size = new AtomicInteger();
        private volatile Instant newest = Instant.MIN;
        private volatile Instant evictedThrough;

        void append(SampleKey key, double value) {
            samples.put(key, value);
            size.incrementAndGet();
            if (key.timestamp().isAfter(newest)) {
                newest = key.timestamp();
            }
        }

        synchronized void trim(Duration retention, int maxSamples) {
            Instant cutoff = newest.minus(retention);
            Map.Entry<SampleKey, Double> oldest = samples.firstEntry();
            while (oldest != null && (oldest.getKey().timestamp().isBefore(cutoff) || size.get() > maxSamples)) {
                if (samples.remove(oldest.getKey()) != null) {
                    size.decrementAndGet();
                    Instant dropped = oldest.getKey().timestamp();
                    if (evictedThrough == null || dropped.isAfter(evictedThrough)) {
                        evictedThrough = dropped;
                    }
                }
                oldest = samples.firstEntry();
            }
        }
    }

    record SampleKey(Instant timestamp, long sequence) implements Comparable<SampleKey> {

        static SampleKey lowerBound(Instant timestamp) {
            return new SampleKey(timestamp, Long.MIN_VALUE);
        }

        @Override
        public int compareTo(SampleKey other) {
            int byTime = timestamp.compareTo(other.timestamp);
            return byTime != 0 ? byTime : Long.compare(sequence, other.sequence);
        }
    }
}
