package com.queryguard.service.core.sketch;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SketchMaintenanceJob {

    private final PercentileEstimator estimator;

    @Scheduled(fixedDelayString = "#{@queryGuardProperties.sketch.maintenanceRate.toMillis()}")
    public void evictExpired() {
        estimator.evictExpired();
    }
}
