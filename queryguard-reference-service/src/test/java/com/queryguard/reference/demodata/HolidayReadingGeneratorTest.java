package com.queryguard.reference.demodata;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.queryguard.reference.demodata.HolidayReadingGenerator.HolidayProfile;
import com.queryguard.service.core.telemetry.Reading;
import java.time.Instant;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class HolidayReadingGeneratorTest {

    private static final Instant DEC_25 = Instant.parse("2024-12-25T00:00:00Z");
    private static final Instant DEC_26 = Instant.parse("2024-12-26T00:00:00Z");

    @Test
    void holidayReadingsAreScaledAndConfinedToTheHoliday() {
        HolidayProfile profile = new HolidayProfile("Appliance", 2024, 12, 25, 1000, 24, 100.0, 3.0);

        List<Reading> readings = HolidayReadingGenerator.generate(profile, new Random(7));

        assertThat(readings).hasSize(1024).allMatch(Reading::isValid);
        List<Reading> holiday = readings.stream()
                .filter(r -> !r.timestamp().isBefore(DEC_25) && r.timestamp().isBefore(DEC_26))
                .toList();
        assertThat(holiday).hasSize(24).allSatisfy(r -> assertThat(r.value()).isBetween(270.0, 330.0));
        assertThat(readings).filteredOn(r -> !holiday.contains(r))
                .allSatisfy(r -> assertThat(r.value()).isBetween(90.0, 110.0));
    }

    @Test
    void sameSeedSameReadings() {
        HolidayProfile profile = new HolidayProfile("Lighting", 2024, 12, 25, 50, 5, 40.0, 2.0);

        assertThat(HolidayReadingGenerator.generate(profile, new Random(1)))
                .isEqualTo(HolidayReadingGenerator.generate(profile, new Random(1)));
    }

    @Test
    void rejectsHolidayOutsideTheMonth() {
        HolidayProfile profile = new HolidayProfile("Appliance", 2024, 2, 30, 10, 1, 100.0, 3.0);

        assertThatThrownBy(() -> HolidayReadingGenerator.generate(profile, new Random()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
