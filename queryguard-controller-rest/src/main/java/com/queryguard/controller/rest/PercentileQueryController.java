package com.queryguard.controller.rest;

import com.queryguard.api.dto.PercentileQueryRequest;
import com.queryguard.service.core.model.TimeRange;
import com.queryguard.service.core.sketch.PercentileEstimator;
import com.queryguard.service.core.sketch.PercentileMethod;
import com.queryguard.service.core.sketch.PercentileResult;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(path = "/api/percentiles", produces = MediaType.APPLICATION_JSON_VALUE)
public class PercentileQueryController {

    private static final List<Double> DEFAULT_PERCENTILES = List.of(0.5d, 0.95d);

    private final PercentileEstimator estimator;

    public PercentileQueryController(PercentileEstimator estimator) {
        this.estimator = estimator;
    }

    @PostMapping(path = "/query", consumes = MediaType.APPLICATION_JSON_VALUE)
    public PercentileResponse query(@RequestBody PercentileQueryRequest request) {
        List<Double> percentiles = request.percentiles() != null && !request.percentiles().isEmpty()
                ? request.percentiles()
                : DEFAULT_PERCENTILES;
        PercentileResult result = estimator.query(
                request.category(),
                TimeRange.of(request.start(), request.end()),
                percentiles,
                PercentileMethod.defaulted(request.method()));
        return PercentileResponse.from(result);
    }

    public record PercentileResponse(
            String category,
            Instant start,
            Instant end,
            PercentileMethod method,
            long sampleCount,
            double mean,
            Map<String, Double> percentiles) {

        static PercentileResponse from(PercentileResult result) {
            Map<String, Double> labelled = new LinkedHashMap<>();
            result.percentiles().forEach((p, value) -> labelled.put(String.valueOf(p), value));
            return new PercentileResponse(
                    result.category(),
                    result.range().start(),
                    result.range().end(),
                    result.method(),
                    result.sampleCount(),
                    result.mean(),
                    labelled);
        }
    }
}
