package com.queryguard.service.core.sketch;

import java.time.Instant;

/** Aggregated readings of one time bucket. */
public record UsagePoint(Instant bucketStart, long count, double sum, double mean) {}
