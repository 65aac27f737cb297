package com.queryguard.service.core.telemetry;

import java.time.Instant;

/** One timestamped numeric sample for a device category. */
public record Reading(Instant timestamp, String deviceCategory, double value) {

    public boolean isValid() {
        return timestamp != null
                && deviceCategory != null
                && !deviceCategory.isBlank()
                && !Double.isNaN(value)
                && !Double.isInfinite(value);
    }
}
