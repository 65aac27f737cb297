package com.queryguard.service.core.shape;

import java.time.Instant;

/**
 * Execution statistics for one shape. {@code execCount}, {@code totalCost} and {@code maxCost}
 * cover every observation while the shape has been tracked; {@code windowCount} and
 * {@code windowAverage} cover the circular buffer only.
 */
public record ShapeStats(
        String shapeKey,
        long execCount,
        double totalCost,
        double maxCost,
        Instant lastSeen,
        int windowCount,
        double windowAverage) {}
