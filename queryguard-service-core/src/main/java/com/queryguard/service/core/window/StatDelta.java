package com.queryguard.service.core.window;

/** One statistic compared across ranges. Target-side fields are null when the target has no data. */
public record StatDelta(String statistic, double baseline, Double target, Double ratio, Double deltaPercent) {

    static StatDelta of(String statistic, double baseline, Double target) {
        if (target == null) {
            return new StatDelta(statistic, baseline, null, null, null);
        }
        if (baseline == 0.0d) {
            return new StatDelta(statistic, baseline, target, null, null);
        }
        double ratio = target / baseline;
        return new StatDelta(statistic, baseline, target, ratio, (ratio - 1.0d) * 100.0d);
    }
}
