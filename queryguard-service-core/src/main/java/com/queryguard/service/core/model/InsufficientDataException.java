package com.queryguard.service.core.model;

import java.time.Instant;

/**
 * No samples were available to answer a statistics query. Recoverable: callers may retry later
 * or treat the result as "no signal".
 */
public class InsufficientDataException extends RuntimeException {

    private final String category;
    private final transient TimeRange range;

    public InsufficientDataException(String category, TimeRange range) {
        super("No samples for category '" + category + "' in [" + format(range, true) + ", "
                + format(range, false) + ")");
        this.category = category;
        this.range = range;
    }

    public String category() {
        return category;
    }

    public TimeRange range() {
        return range;
    }

    private static String format(TimeRange range, boolean start) {
        if (range == null) {
            return "?";
        }
        Instant value = start ? range.start() : range.end();
        return value.toString();
    }
}
