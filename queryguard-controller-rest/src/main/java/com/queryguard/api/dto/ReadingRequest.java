package com.queryguard.api.dto;

import com.queryguard.service.core.telemetry.Reading;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;

public record ReadingRequest(@NotNull Instant timestamp, @NotBlank String deviceCategory, @NotNull Double value) {

    public Reading toReading() {
        return new Reading(
                timestamp,
                deviceCategory != null ? deviceCategory.trim() : null,
                value != null ? value : Double.NaN);
    }
}
