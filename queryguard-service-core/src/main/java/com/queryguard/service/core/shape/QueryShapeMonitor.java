package com.queryguard.service.core.shape;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.queryguard.service.core.config.QueryGuardProperties;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Tracks execution cost per query shape.
 *
 * <p>Each shape keeps a circular buffer of its last {@code window-size} costs (oldest evicted
 * first). At most {@code capacity} shapes are tracked; a shape not observed for
 * {@code staleness} (service clock) is dropped entirely.
 */
@Service
@Slf4j
public class QueryShapeMonitor {

    private final Cache<String, ShapeTracker> trackers;
    private final QueryShapeHasher hasher;
    private final Clock clock;
    private final int windowSize;

    public QueryShapeMonitor(QueryGuardProperties properties, QueryShapeHasher hasher, Clock clock) {
        QueryGuardProperties.Shapes shapes = properties.getShapes();
        this.hasher = hasher;
        this.clock = clock;
        this.windowSize = shapes.getWindowSize();
        this.trackers = Caffeine.newBuilder()
                .maximumSize(shapes.getCapacity())
                .expireAfterWrite(shapes.getStaleness())
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .removalListener((String key, ShapeTracker tracker, RemovalCause cause) -> {
                    if (cause.wasEvicted()) {
                        log.debug("Stopped tracking shape {} cause={}", key, cause);
                    }
                })
                .build();
        log.info(
                "Query shape monitor ready windowSize={} capacity={} staleness={}",
                windowSize,
                shapes.getCapacity(),
                shapes.getStaleness());
    }

    public void observe(String shapeKey, double costUnits, Instant timestamp) {
        String key = ShapeKeys.normalize(shapeKey);
        if (Double.isNaN(costUnits) || Double.isInfinite(costUnits) || costUnits < 0) {
            throw new IllegalArgumentException("costUnits must be a finite, non-negative number: " + costUnits);
        }
        Instant observedAt = timestamp != null ? timestamp : clock.instant();
        trackers.asMap().compute(key, (k, existing) -> {
            ShapeTracker tracker = existing != null ? existing : new ShapeTracker(k, windowSize);
            tracker.record(costUnits, observedAt);
            return tracker;
        });
    }

    /** Hashes the query document first; returns the shape key it was recorded under. */
    public String observeQuery(JsonNode query, double costUnits, Instant timestamp) {
        String shapeKey = hasher.shapeKey(query);
        observe(shapeKey, costUnits, timestamp);
        return shapeKey;
    }

    /**
     * Shapes whose buffer average is strictly above {@code thresholdCost} with at least
     * {@code minExecCount} observations in the buffer.
     */
    public Set<String> flagged(double thresholdCost, int minExecCount) {
        Set<String> keys = new LinkedHashSet<>();
        flaggedStats(thresholdCost, minExecCount).forEach(stats -> keys.add(stats.shapeKey()));
        return keys;
    }

    /** Same selection as {@link #flagged}, most expensive first. */
    public List<ShapeStats> flaggedStats(double thresholdCost, int minExecCount) {
        if (minExecCount < 1) {
            throw new IllegalArgumentException("minExecCount must be at least 1");
        }
        if (minExecCount > windowSize) {
            log.warn("minExecCount={} exceeds window size {}; no shape can be flagged", minExecCount, windowSize);
        }
        return snapshot().stream()
                .filter(stats -> stats.windowCount() >= minExecCount)
                .filter(stats -> stats.windowAverage() > thresholdCost)
                .toList();
    }

    public Optional<ShapeStats> stats(String shapeKey) {
        ShapeTracker tracker = trackers.getIfPresent(ShapeKeys.normalize(shapeKey));
        return tracker == null ? Optional.empty() : Optional.of(tracker.snapshot());
    }

    /** Every tracked shape, most expensive window average first. */
    public List<ShapeStats> snapshot() {
        trackers.cleanUp();
        return trackers.asMap().values().stream()
                .map(ShapeTracker::snapshot)
                .sorted(Comparator.comparingDouble(ShapeStats::windowAverage).reversed())
                .toList();
    }

    public long trackedShapes() {
        trackers.cleanUp();
        return trackers.estimatedSize();
    }

    public int windowSize() {
        return windowSize;
    }
}
