package com.queryguard.reference.demodata;

import com.queryguard.service.core.telemetry.Reading;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Produces a month of power readings for one category: {@code regularReadings} spread uniformly
 * over every day except the holiday, and {@code holidayReadings} on the holiday scaled by
 * {@code holidayMultiplier}.
 */
public final class HolidayReadingGenerator {

    private static final double JITTER = 0.1d;

    private HolidayReadingGenerator() {}

    public static List<Reading> generate(HolidayProfile profile, Random random) {
        YearMonth month = YearMonth.of(profile.year(), profile.month());
        if (profile.holidayDay() < 1 || profile.holidayDay() > month.lengthOfMonth()) {
            throw new IllegalArgumentException("holidayDay " + profile.holidayDay() + " is outside " + month);
        }
        List<LocalDate> regularDays = new ArrayList<>();
        for (int day = 1; day <= month.lengthOfMonth(); day++) {
            if (day != profile.holidayDay()) {
                regularDays.add(month.atDay(day));
            }
        }

        List<Reading> readings = new ArrayList<>(profile.regularReadings() + profile.holidayReadings());
        for (int i = 0; i < profile.regularReadings(); i++) {
            LocalDate day = regularDays.get(random.nextInt(regularDays.size()));
            readings.add(new Reading(
                    randomInstant(day, random), profile.category(), jitter(profile.baselinePower(), random)));
        }
        LocalDate holiday = month.atDay(profile.holidayDay());
        double holidayPower = profile.baselinePower() * profile.holidayMultiplier();
        for (int i = 0; i < profile.holidayReadings(); i++) {
            readings.add(new Reading(randomInstant(holiday, random), profile.category(), jitter(holidayPower, random)));
        }
        return readings;
    }

    private static Instant randomInstant(LocalDate day, Random random) {
        long start = day.atStartOfDay(ZoneOffset.UTC).toEpochSecond();
        return Instant.ofEpochSecond(start + random.nextInt(86_400));
    }

    private static double jitter(double center, Random random) {
        return center * (1.0d - JITTER + 2 * JITTER * random.nextDouble());
    }

    public record HolidayProfile(
            String category,
            int year,
            int month,
            int holidayDay,
            int regularReadings,
            int holidayReadings,
            double baselinePower,
            double holidayMultiplier) {}
}
