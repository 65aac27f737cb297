package com.queryguard.service.core.sketch;

import java.util.Locale;

public enum PercentileMethod {
    /** Sort of the retained raw samples; only available while raw retention is enabled. */
    EXACT,
    /** Merged bucket sketches; bounded relative error. */
    APPROXIMATE;

    public static PercentileMethod defaulted(String value) {
        if (value == null || value.isBlank()) {
            return APPROXIMATE;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported percentile method: " + value);
        }
    }
}
