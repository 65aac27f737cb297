package com.queryguard.service.core.governance;

import com.queryguard.service.core.config.QueryGuardProperties;
import com.queryguard.service.core.shape.QueryShapeMonitor;
import com.queryguard.service.core.shape.ShapeStats;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically asks the monitor for expensive shapes and publishes newly flagged ones. A shape is
 * published again only after it dropped out of the flagged set in between.
 */
@Component
@Slf4j
public class ShapeEvaluationJob {

    private final QueryShapeMonitor monitor;
    private final ShapeFlagDispatchBus bus;
    private final QueryGuardProperties properties;
    private final Clock clock;
    private Set<String> previouslyFlagged = Set.of();

    public ShapeEvaluationJob(
            QueryShapeMonitor monitor, ShapeFlagDispatchBus bus, QueryGuardProperties properties, Clock clock) {
        this.monitor = monitor;
        this.bus = bus;
        this.properties = properties;
        this.clock = clock;
        if (!properties.getGovernance().isEvaluationEnabled()) {
            log.info("Automatic shape evaluation off: cost-threshold and min-exec-count are not both configured");
        }
    }

    @Scheduled(fixedDelayString = "#{@queryGuardProperties.governance.evaluationRate.toMillis()}")
    public void scheduledRun() {
        evaluate();
    }

    public synchronized List<ShapeFlaggedEvent> evaluate() {
        QueryGuardProperties.Governance governance = properties.getGovernance();
        if (!governance.isEvaluationEnabled()) {
            return List.of();
        }
        double threshold = governance.getCostThreshold();
        int minExecCount = governance.getMinExecCount();
        List<ShapeStats> flagged = monitor.flaggedStats(threshold, minExecCount);

        Instant now = clock.instant();
        Set<String> current = new HashSet<>();
        List<ShapeFlaggedEvent> published = new ArrayList<>();
        for (ShapeStats stats : flagged) {
            current.add(stats.shapeKey());
            if (previouslyFlagged.contains(stats.shapeKey())) {
                continue;
            }
            ShapeFlaggedEvent event = new ShapeFlaggedEvent(stats, threshold, minExecCount, now);
            bus.dispatch(event);
            published.add(event);
        }
        previouslyFlagged = Set.copyOf(current);
        if (!published.isEmpty()) {
            log.info("Flagged {} new expensive query shapes (threshold={}, minExecCount={})",
                    published.size(), threshold, minExecCount);
        }
        return published;
    }
}
