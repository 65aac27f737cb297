package com.queryguard.api.dto;

import java.util.List;

public record WindowCompareRequest(
        String category, RangeRequest baseline, RangeRequest target, List<Double> percentiles, String method) {}
