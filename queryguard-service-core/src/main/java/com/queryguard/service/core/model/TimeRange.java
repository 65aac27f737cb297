package com.queryguard.service.core.model;

import java.time.Instant;
import java.time.format.DateTimeParseException;

/** Half-open interval {@code [start, end)}. */
public record TimeRange(Instant start, Instant end) {

    public TimeRange {
        if (start == null || end == null) {
            throw new InvalidRangeException("Range start and end are required");
        }
        if (!end.isAfter(start)) {
            throw new InvalidRangeException("Range end " + end + " must be after start " + start);
        }
    }

    public static TimeRange of(String start, String end) {
        if (start == null || start.isBlank() || end == null || end.isBlank()) {
            throw new InvalidRangeException("Range start and end are required");
        }
        try {
            return new TimeRange(Instant.parse(start.trim()), Instant.parse(end.trim()));
        } catch (DateTimeParseException ex) {
            throw new InvalidRangeException("Unparseable range boundary: " + ex.getParsedString());
        }
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }

    public boolean overlaps(TimeRange other) {
        return start.isBefore(other.end) && other.start.isBefore(end);
    }
}
