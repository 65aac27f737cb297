package com.queryguard.service.core.sketch;

import com.queryguard.service.core.model.TimeRange;
import java.util.Map;

/** Percentiles and mean for one category over one range. {@code percentiles} preserves request order. */
public record PercentileResult(
        String category,
        TimeRange range,
        PercentileMethod method,
        long sampleCount,
        double mean,
        Map<Double, Double> percentiles) {

    public Double percentile(double p) {
        return percentiles.get(p);
    }
}
