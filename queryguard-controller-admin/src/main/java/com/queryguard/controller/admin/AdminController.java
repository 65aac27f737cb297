package com.queryguard.controller.admin;

import com.queryguard.service.core.governance.ShapeEvaluationJob;
import com.queryguard.service.core.governance.ShapeFlaggedEvent;
import com.queryguard.service.core.sketch.PercentileEstimator;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.*;

/** Admin/ops endpoints for on-demand maintenance runs. */
@RestController
@RequestMapping("/admin")
public class AdminController {

    private final PercentileEstimator estimator;
    private final ShapeEvaluationJob evaluationJob;

    public AdminController(PercentileEstimator estimator, ShapeEvaluationJob evaluationJob) {
        this.estimator = estimator;
        this.evaluationJob = evaluationJob;
    }

    @PostMapping("/retention/run")
    public Map<String, Object> runRetention() {
        return Map.of("evictedBuckets", estimator.evictExpired());
    }

    @PostMapping("/governance/evaluate")
    public Map<String, Object> evaluate() {
        List<String> flagged = evaluationJob.evaluate().stream()
                .map(ShapeFlaggedEvent::shapeKey)
                .toList();
        return Map.of("newlyFlagged", flagged);
    }

    @GetMapping("/telemetry/categories")
    public Map<String, Long> categories() {
        return estimator.sampleCounts();
    }
}
