package com.queryguard.service.core.config;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Granularity of the per-category sketch buckets. Buckets are aligned in UTC.
 */
public enum TimeBucket {
    M5(Duration.ofMinutes(5)),
    H1(Duration.ofHours(1)),
    D1(Duration.ofDays(1));

    private final Duration duration;

    TimeBucket(Duration duration) {
        this.duration = duration;
    }

    public Duration duration() {
        return duration;
    }

    /** Aligns the instant to the start of the containing bucket. */
    public Instant align(Instant instant) {
        ZonedDateTime zdt = instant.atZone(ZoneOffset.UTC);
        return switch (this) {
            case D1 -> zdt.toLocalDate().atStartOfDay(ZoneOffset.UTC).toInstant();
            case H1 -> zdt.withMinute(0).withSecond(0).withNano(0).toInstant();
            case M5 -> {
                int minute = zdt.getMinute();
                int aligned = (minute / 5) * 5;
                yield zdt.withMinute(aligned).withSecond(0).withNano(0).toInstant();
            }
        };
    }

    /** Start of the first bucket at or after the instant. */
    public Instant alignUp(Instant instant) {
        Instant floor = align(instant);
        return floor.equals(instant) ? instant : floor.plus(duration);
    }

    /** Whether every bucket of this granularity lies inside one bucket of {@code coarser}. */
    public boolean nestsIn(TimeBucket coarser) {
        return coarser.duration.compareTo(duration) >= 0;
    }

    public boolean isAligned(Instant instant) {
        return align(instant).equals(instant);
    }
}
