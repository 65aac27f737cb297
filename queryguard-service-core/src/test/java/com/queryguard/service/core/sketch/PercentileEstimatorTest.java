package com.queryguard.service.core.sketch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.queryguard.service.core.config.QueryGuardProperties;
import com.queryguard.service.core.config.TimeBucket;
import com.queryguard.service.core.model.InsufficientDataException;
import com.queryguard.service.core.model.InvalidRangeException;
import com.queryguard.service.core.model.TimeRange;
import com.queryguard.service.core.telemetry.Reading;
import com.queryguard.service.core.telemetry.ReadingBuffer;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PercentileEstimatorTest {

    private static final Instant HOUR = Instant.parse("2024-12-10T10:00:00Z");
    private static final TimeRange DAY =
            new TimeRange(Instant.parse("2024-12-10T00:00:00Z"), Instant.parse("2024-12-11T00:00:00Z"));

    private QueryGuardProperties properties;
    private ReadingBuffer rawBuffer;
    private PercentileEstimator estimator;

    @BeforeEach
    void setUp() {
        properties = new QueryGuardProperties();
        rawBuffer = new ReadingBuffer(properties);
        estimator = new PercentileEstimator(properties, rawBuffer);
    }

    @Test
    void approximateAndExactAgreeWithinAccuracy() {
        for (int i = 1; i <= 1000; i++) {
            ingest("Appliance", HOUR.plusSeconds(i), i);
        }

        PercentileResult exact = estimator.query("Appliance", DAY, List.of(0.5, 0.95), PercentileMethod.EXACT);
        PercentileResult approx = estimator.query("Appliance", DAY, List.of(0.5, 0.95), PercentileMethod.APPROXIMATE);

        assertThat(exact.percentile(0.5)).isCloseTo(500.5, within(1e-9));
        assertThat(exact.percentile(0.95)).isCloseTo(950.05, within(1e-9));
        assertThat(approx.percentile(0.5)).isBetween(500 * 0.99, 501 * 1.01);
        assertThat(approx.percentile(0.95)).isBetween(950 * 0.99, 951 * 1.01);
        assertThat(approx.sampleCount()).isEqualTo(1000);
        assertThat(approx.mean()).isCloseTo(500.5, within(1e-9));
    }

    @Test
    void rangeWithoutSamplesIsInsufficientData() {
        ingest("Appliance", HOUR, 10);
        TimeRange otherDay =
                new TimeRange(Instant.parse("2024-12-11T00:00:00Z"), Instant.parse("2024-12-12T00:00:00Z"));

        assertThatThrownBy(() -> estimator.query("Appliance", otherDay, List.of(0.5), null))
                .isInstanceOf(InsufficientDataException.class)
                .hasMessageContaining("Appliance");
        assertThatThrownBy(() -> estimator.query("Lighting", DAY, List.of(0.5), PercentileMethod.EXACT))
                .isInstanceOf(InsufficientDataException.class);
    }

    @Test
    void rangeEndIsExclusive() {
        ingest("Appliance", Instant.parse("2024-12-11T00:00:00Z"), 99);
        ingest("Appliance", HOUR, 1);

        PercentileResult result = estimator.query("Appliance", DAY, List.of(1.0), PercentileMethod.APPROXIMATE);

        assertThat(result.sampleCount()).isEqualTo(1);
        assertThat(result.percentile(1.0)).isBetween(0.99, 1.01);
    }

    @Test
    void adjacentHalfHourRangesSplitTheSharedBucket() {
        ingest("Appliance", Instant.parse("2024-12-10T10:10:00Z"), 10);
        ingest("Appliance", Instant.parse("2024-12-10T10:45:00Z"), 45);
        TimeRange firstHalf = new TimeRange(HOUR, Instant.parse("2024-12-10T10:30:00Z"));
        TimeRange secondHalf = new TimeRange(Instant.parse("2024-12-10T10:30:00Z"), HOUR.plusSeconds(3600));

        PercentileResult first = estimator.query("Appliance", firstHalf, List.of(0.5), PercentileMethod.APPROXIMATE);
        PercentileResult second = estimator.query("Appliance", secondHalf, List.of(0.5), PercentileMethod.APPROXIMATE);

        assertThat(first.sampleCount()).isEqualTo(1);
        assertThat(first.percentile(0.5)).isBetween(10 * 0.99, 10 * 1.01);
        assertThat(second.sampleCount()).isEqualTo(1);
        assertThat(second.percentile(0.5)).isBetween(45 * 0.99, 45 * 1.01);
        assertThat(estimator.query("Appliance", secondHalf, List.of(0.5), PercentileMethod.EXACT).sampleCount())
                .isEqualTo(1);
    }

    @Test
    void unalignedRangeCombinesEdgeReadingsWithInteriorBuckets() {
        ingest("Appliance", Instant.parse("2024-12-10T09:20:00Z"), 1);
        ingest("Appliance", Instant.parse("2024-12-10T09:50:00Z"), 2);
        for (int i = 0; i < 10; i++) {
            ingest("Appliance", HOUR.plusSeconds(i * 60L), 3);
        }
        ingest("Appliance", Instant.parse("2024-12-10T11:10:00Z"), 4);
        ingest("Appliance", Instant.parse("2024-12-10T11:40:00Z"), 5);
        TimeRange range = new TimeRange(Instant.parse("2024-12-10T09:30:00Z"), Instant.parse("2024-12-10T11:30:00Z"));

        QuantileSketch exported = estimator.export("Appliance", range);

        assertThat(exported.count()).isEqualTo(12);
        assertThat(exported.sum()).isCloseTo(36.0, within(1e-9));
    }

    @Test
    void unalignedRangeWithoutRawReadingsIsRejected() {
        properties.getTelemetry().setRawRetention(Duration.ZERO);
        PercentileEstimator sketchOnly = newEstimator(properties);
        sketchOnly.insert("Appliance", Instant.parse("2024-12-10T10:10:00Z"), 10);
        TimeRange unaligned = new TimeRange(HOUR, Instant.parse("2024-12-10T10:30:00Z"));

        assertThatThrownBy(() -> sketchOnly.query("Appliance", unaligned, List.of(0.5), PercentileMethod.APPROXIMATE))
                .isInstanceOf(InvalidRangeException.class)
                .hasMessageContaining("not aligned");
        assertThat(sketchOnly.query("Appliance", DAY, List.of(0.5), PercentileMethod.APPROXIMATE).sampleCount())
                .isEqualTo(1);
    }

    @Test
    void unalignedRangeOverTrimmedReadingsIsRejected() {
        properties.getTelemetry().setMaxSamplesPerCategory(1);
        rawBuffer = new ReadingBuffer(properties);
        estimator = new PercentileEstimator(properties, rawBuffer);
        ingest("Appliance", Instant.parse("2024-12-10T10:10:00Z"), 10);
        ingest("Appliance", Instant.parse("2024-12-10T10:20:00Z"), 20);

        assertThatThrownBy(() -> estimator.export("Appliance", new TimeRange(HOUR, Instant.parse("2024-12-10T10:15:00Z"))))
                .isInstanceOf(InvalidRangeException.class);
        assertThat(estimator.export("Appliance", new TimeRange(Instant.parse("2024-12-10T10:15:00Z"), HOUR.plusSeconds(3600)))
                        .count())
                .isEqualTo(1);
    }

    @Test
    void usageRollsBucketsUpPerGranularity() {
        ingest("Appliance", HOUR.plusSeconds(60), 10);
        ingest("Appliance", HOUR.plusSeconds(120), 30);
        ingest("Lighting", HOUR.plusSeconds(3600), 5);
        ingest("Lighting", Instant.parse("2024-12-11T01:00:00Z"), 7);

        List<UsagePoint> hourly = estimator.usage(null, DAY, null);
        List<UsagePoint> appliance = estimator.usage("Appliance", DAY, TimeBucket.D1);

        assertThat(hourly).containsExactly(
                new UsagePoint(HOUR, 2, 40.0, 20.0),
                new UsagePoint(HOUR.plusSeconds(3600), 1, 5.0, 5.0));
        assertThat(appliance).containsExactly(new UsagePoint(DAY.start(), 2, 40.0, 20.0));
        assertThat(estimator.usage("Unknown", DAY, null)).isEmpty();
    }

    @Test
    void usageRejectsFinerGranularityAndUnalignedRanges() {
        assertThatThrownBy(() -> estimator.usage(null, DAY, TimeBucket.M5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> estimator.usage(null, new TimeRange(HOUR, HOUR.plusSeconds(90)), null))
                .isInstanceOf(InvalidRangeException.class);
    }

    @Test
    void exactRequiresRawRetention() {
        properties.getTelemetry().setRawRetention(Duration.ZERO);
        PercentileEstimator sketchOnly = newEstimator(properties);
        sketchOnly.insert("Appliance", HOUR, 5);

        assertThatThrownBy(() -> sketchOnly.query("Appliance", DAY, List.of(0.5), PercentileMethod.EXACT))
                .isInstanceOf(IllegalStateException.class);
        assertThat(sketchOnly.query("Appliance", DAY, List.of(0.5), PercentileMethod.APPROXIMATE).sampleCount())
                .isEqualTo(1);
    }

    @Test
    void rejectsInvalidPercentilesAndCategories() {
        ingest("Appliance", HOUR, 5);

        assertThatThrownBy(() -> estimator.query("Appliance", DAY, List.of(1.5), null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> estimator.query("Appliance", DAY, List.of(), null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> estimator.query(" ", DAY, List.of(0.5), null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void mergesPartialSketchesFromOtherShards() {
        PercentileEstimator shard = newEstimator(new QueryGuardProperties());
        for (int i = 101; i <= 200; i++) {
            shard.insert("Appliance", HOUR, i);
        }
        for (int i = 1; i <= 100; i++) {
            ingest("Appliance", HOUR, i);
        }

        estimator.mergePartial("Appliance", HOUR.plusSeconds(30), shard.export("Appliance", DAY));
        PercentileResult result = estimator.query("Appliance", DAY, List.of(0.5), PercentileMethod.APPROXIMATE);

        assertThat(result.sampleCount()).isEqualTo(200);
        assertThat(result.percentile(0.5)).isBetween(100 * 0.99, 101 * 1.01);
    }

    @Test
    void rejectsPartialWithDifferentAccuracy() {
        QuantileSketch coarse = QuantileSketch.create(0.05, 2048);
        coarse.insert(1);

        assertThatThrownBy(() -> estimator.mergePartial("Appliance", HOUR, coarse))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void evictsBucketsOlderThanRetention() {
        properties.getSketch().setRetention(Duration.ofDays(1));
        PercentileEstimator shortLived = newEstimator(properties);
        shortLived.insert("Appliance", Instant.parse("2024-12-01T05:00:00Z"), 1);
        shortLived.insert("Appliance", Instant.parse("2024-12-05T05:00:00Z"), 2);

        int evicted = shortLived.evictExpired();

        assertThat(evicted).isEqualTo(1);
        assertThat(shortLived.sampleCounts()).containsEntry("Appliance", 1L);
    }

    @Test
    void concurrentInsertsAreAllCounted() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                futures.add(pool.submit(() -> {
                    for (int i = 1; i <= 10_000; i++) {
                        estimator.insert("Appliance", HOUR.plusMillis(i), i);
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(estimator.sampleCounts()).containsEntry("Appliance", 40_000L);
    }

    @Test
    void interpolatesBetweenClosestRanks() {
        double[] sorted = {1, 2, 3, 4};

        assertThat(PercentileEstimator.interpolate(sorted, 0.5)).isEqualTo(2.5);
        assertThat(PercentileEstimator.interpolate(sorted, 0.0)).isEqualTo(1.0);
        assertThat(PercentileEstimator.interpolate(sorted, 1.0)).isEqualTo(4.0);
    }

    private void ingest(String category, Instant timestamp, double value) {
        estimator.insert(category, timestamp, value);
        rawBuffer.append(new Reading(timestamp, category, value));
    }

    private static PercentileEstimator newEstimator(QueryGuardProperties props) {
        return new PercentileEstimator(props, new ReadingBuffer(props));
    }
}
