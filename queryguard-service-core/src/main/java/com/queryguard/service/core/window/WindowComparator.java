package com.queryguard.service.core.window;

import com.queryguard.service.core.model.InsufficientDataException;
import com.queryguard.service.core.model.InvalidRangeException;
import com.queryguard.service.core.model.TimeRange;
import com.queryguard.service.core.sketch.PercentileEstimator;
import com.queryguard.service.core.sketch.PercentileMethod;
import com.queryguard.service.core.sketch.PercentileResult;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class WindowComparator {

    static final double MEDIAN = 0.5d;
    static final double P95 = 0.95d;
    private static final List<Double> DEFAULT_PERCENTILES = List.of(MEDIAN, P95);

    private final PercentileEstimator estimator;

    public WindowComparison compare(
            String category,
            TimeRange baselineRange,
            TimeRange targetRange,
            List<Double> percentiles,
            PercentileMethod method) {
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("category is required");
        }
        validateRanges(baselineRange, targetRange);
        PercentileMethod effectiveMethod = method == null ? PercentileMethod.APPROXIMATE : method;
        List<Double> requested = withRequiredPercentiles(percentiles);

        PercentileResult baselineResult = estimator.query(category, baselineRange, requested, effectiveMethod);
        PercentileResult targetResult;
        try {
            targetResult = estimator.query(category, targetRange, requested, effectiveMethod);
        } catch (InsufficientDataException ex) {
            log.debug("Target range has no samples category={} range={}", category, targetRange);
            targetResult = null;
        }

        WindowStats baseline = toStats(baselineResult);
        WindowStats target = targetResult != null ? toStats(targetResult) : null;
        List<StatDelta> deltas = buildDeltas(baseline, target, requested);
        Double targetPower = target != null ? target.mean() : null;
        Double targetPowerRatio = target != null && baseline.median() != 0.0d ? target.mean() / baseline.median() : null;

        return new WindowComparison(
                category,
                effectiveMethod,
                baseline,
                target,
                targetPower,
                targetPowerRatio,
                deltas,
                summarize(deltas));
    }

    static String percentileLabel(double p) {
        BigDecimal scaled = BigDecimal.valueOf(p).multiply(BigDecimal.valueOf(100)).stripTrailingZeros();
        return "p" + scaled.toPlainString();
    }

    private static void validateRanges(TimeRange baseline, TimeRange target) {
        if (baseline == null || target == null) {
            throw new InvalidRangeException("Both baseline and target ranges are required");
        }
        if (baseline.overlaps(target)) {
            throw new InvalidRangeException("Baseline " + baseline + " and target " + target + " overlap");
        }
        if (target.start().isBefore(baseline.start())) {
            throw new InvalidRangeException("Target range must not start before the baseline range");
        }
    }

    private static List<Double> withRequiredPercentiles(List<Double> percentiles) {
        Set<Double> merged = new LinkedHashSet<>(DEFAULT_PERCENTILES);
        if (percentiles != null) {
            merged.addAll(percentiles);
        }
        return List.copyOf(merged);
    }

    private static WindowStats toStats(PercentileResult result) {
        Map<String, Double> labelled = new LinkedHashMap<>();
        result.percentiles().forEach((p, value) -> labelled.put(percentileLabel(p), value));
        return new WindowStats(
                result.range().start(),
                result.range().end(),
                result.percentile(MEDIAN),
                result.percentile(P95),
                result.mean(),
                result.sampleCount(),
                labelled);
    }

    private static List<StatDelta> buildDeltas(WindowStats baseline, WindowStats target, List<Double> percentiles) {
        List<StatDelta> deltas = new ArrayList<>();
        deltas.add(StatDelta.of("mean", baseline.mean(), target != null ? target.mean() : null));
        for (Double p : percentiles) {
            String label = percentileLabel(p);
            deltas.add(StatDelta.of(
                    label, baseline.percentiles().get(label), target != null ? target.percentiles().get(label) : null));
        }
        return deltas;
    }

    private static String summarize(List<StatDelta> deltas) {
        StatDelta p95 = deltas.stream()
                .filter(d -> d.statistic().equals(percentileLabel(P95)))
                .findFirst()
                .orElseThrow();
        if (p95.target() == null) {
            return "no data in target range";
        }
        if (p95.deltaPercent() == null) {
            return "baseline p95 is zero; no relative comparison";
        }
        double delta = p95.deltaPercent();
        if (Math.abs(delta) < 0.05d) {
            return "target matches baseline p95";
        }
        String direction = delta > 0 ? "exceeds" : "is below";
        return String.format(Locale.ROOT, "target %s baseline p95 by %.1f%%", direction, Math.abs(delta));
    }
}
