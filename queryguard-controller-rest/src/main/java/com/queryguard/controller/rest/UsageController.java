package com.queryguard.controller.rest;

import com.queryguard.service.core.config.TimeBucket;
import com.queryguard.service.core.model.TimeRange;
import com.queryguard.service.core.sketch.PercentileEstimator;
import com.queryguard.service.core.sketch.UsagePoint;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Usage series per time bucket, summed across categories unless one is named. */
@RestController
@RequestMapping(path = "/api/telemetry", produces = MediaType.APPLICATION_JSON_VALUE)
public class UsageController {

    static final Duration DEFAULT_WINDOW = Duration.ofDays(3);

    private final PercentileEstimator estimator;
    private final Clock clock;

    public UsageController(PercentileEstimator estimator, Clock clock) {
        this.estimator = estimator;
        this.clock = clock;
    }

    /** Without {@code start} and {@code end} the last three days up to the current bucket are returned. */
    @GetMapping("/usage")
    public List<UsagePoint> usage(
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String start,
            @RequestParam(required = false) String end,
            @RequestParam(required = false) TimeBucket granularity) {
        TimeBucket effective = granularity != null ? granularity : estimator.bucket();
        TimeRange range;
        if (start == null && end == null) {
            Instant until = effective.alignUp(clock.instant().plusNanos(1));
            range = new TimeRange(until.minus(DEFAULT_WINDOW), until);
        } else {
            range = TimeRange.of(start, end);
        }
        return estimator.usage(category, range, effective);
    }
}
