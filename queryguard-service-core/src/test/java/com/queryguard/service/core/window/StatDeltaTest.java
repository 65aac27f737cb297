package com.queryguard.service.core.window;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class StatDeltaTest {

    @Test
    void computesRatioAndPercentChange() {
        StatDelta delta = StatDelta.of("p95", 100.0, 250.0);

        assertThat(delta.ratio()).isCloseTo(2.5, within(1e-9));
        assertThat(delta.deltaPercent()).isCloseTo(150.0, within(1e-9));
    }

    @Test
    void zeroBaselineHasNoRatio() {
        StatDelta delta = StatDelta.of("mean", 0.0, 5.0);

        assertThat(delta.ratio()).isNull();
        assertThat(delta.deltaPercent()).isNull();
        assertThat(delta.target()).isEqualTo(5.0);
    }
}
