package com.queryguard.service.core.window;

import com.queryguard.service.core.sketch.PercentileMethod;
import java.util.List;

/**
 * Baseline versus target comparison. {@code target}, {@code targetPower} and
 * {@code targetPowerRatio} are null when the target range holds no samples, which is how
 * "no data" stays distinct from "no anomaly".
 */
public record WindowComparison(
        String category,
        PercentileMethod method,
        WindowStats baseline,
        WindowStats target,
        Double targetPower,
        Double targetPowerRatio,
        List<StatDelta> deltas,
        String summary) {

    public boolean hasTargetData() {
        return target != null;
    }
}
