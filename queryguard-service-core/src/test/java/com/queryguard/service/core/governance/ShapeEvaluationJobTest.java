package com.queryguard.service.core.governance;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.queryguard.service.core.config.QueryGuardProperties;
import com.queryguard.service.core.shape.QueryShapeHasher;
import com.queryguard.service.core.shape.QueryShapeMonitor;
import com.queryguard.service.core.support.MutableClock;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class ShapeEvaluationJobTest {

    private static final String SLOW = "5".repeat(64);
    private static final String FAST = "F".repeat(64);

    @Mock
    private ShapeFlagDispatchBus bus;

    private QueryGuardProperties properties;
    private QueryShapeMonitor monitor;
    private ShapeEvaluationJob job;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        MutableClock clock = new MutableClock(Instant.parse("2024-12-25T10:00:00Z"));
        properties = new QueryGuardProperties();
        properties.getShapes().setWindowSize(3);
        properties.getGovernance().setCostThreshold(100.0);
        properties.getGovernance().setMinExecCount(3);
        monitor = new QueryShapeMonitor(properties, new QueryShapeHasher(), clock);
        job = new ShapeEvaluationJob(monitor, bus, properties, clock);
    }

    @Test
    void publishesNewlyFlaggedShapesOnce() {
        record(SLOW, 500, 500, 500);
        record(FAST, 5, 5, 5);

        List<ShapeFlaggedEvent> first = job.evaluate();
        List<ShapeFlaggedEvent> second = job.evaluate();

        assertThat(first).singleElement().satisfies(event -> {
            assertThat(event.shapeKey()).isEqualTo(SLOW);
            assertThat(event.thresholdCost()).isEqualTo(100.0);
            assertThat(event.minExecCount()).isEqualTo(3);
        });
        assertThat(second).isEmpty();
        verify(bus, times(1)).dispatch(any());
    }

    @Test
    void republishesAfterShapeRecoversAndRegresses() {
        record(SLOW, 500, 500, 500);
        job.evaluate();

        record(SLOW, 1, 1, 1);
        assertThat(job.evaluate()).isEmpty();

        record(SLOW, 900, 900, 900);
        assertThat(job.evaluate()).hasSize(1);
        verify(bus, times(2)).dispatch(any());
    }

    @Test
    void waitsForMinimumExecutions() {
        record(SLOW, 500, 500);

        assertThat(job.evaluate()).isEmpty();
        verify(bus, never()).dispatch(any());
    }

    @Test
    void staysOffUntilThresholdAndCountAreConfigured() {
        properties.getGovernance().setMinExecCount(null);
        record(SLOW, 500, 500, 500);

        assertThat(job.evaluate()).isEmpty();
        verify(bus, never()).dispatch(any());
    }

    private void record(String shapeKey, double... costs) {
        for (double cost : costs) {
            monitor.observe(shapeKey, cost, null);
        }
    }
}
