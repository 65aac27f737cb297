package com.queryguard.service.core.window;

import java.time.Instant;
import java.util.Map;

/** Statistics for one range; {@code percentiles} is keyed by label ({@code p50}, {@code p95}, ...). */
public record WindowStats(
        Instant rangeStart,
        Instant rangeEnd,
        double median,
        double p95,
        double mean,
        long sampleCount,
        Map<String, Double> percentiles) {}
