package com.queryguard.api.dto;

import com.queryguard.service.core.model.TimeRange;

/** ISO-8601 instants; the range is half-open {@code [start, end)}. */
public record RangeRequest(String start, String end) {

    public TimeRange toRange() {
        return TimeRange.of(start, end);
    }
}
