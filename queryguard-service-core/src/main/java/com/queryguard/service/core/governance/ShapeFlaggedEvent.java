package com.queryguard.service.core.governance;

import com.queryguard.service.core.shape.ShapeStats;
import java.time.Instant;

/** A shape crossed the configured cost threshold. */
public record ShapeFlaggedEvent(ShapeStats stats, double thresholdCost, int minExecCount, Instant flaggedAt) {

    public String shapeKey() {
        return stats.shapeKey();
    }
}
