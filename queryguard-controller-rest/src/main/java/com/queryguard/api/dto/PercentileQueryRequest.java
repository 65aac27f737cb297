package com.queryguard.api.dto;

import java.util.List;

public record PercentileQueryRequest(
        String category, String start, String end, List<Double> percentiles, String method) {}
