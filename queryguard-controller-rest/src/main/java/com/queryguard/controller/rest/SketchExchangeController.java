package com.queryguard.controller.rest;

import com.queryguard.api.dto.PercentileQueryRequest;
import com.queryguard.api.dto.SketchMergeRequest;
import com.queryguard.service.core.model.TimeRange;
import com.queryguard.service.core.sketch.PercentileEstimator;
import com.queryguard.service.core.sketch.QuantileSketch;
import com.queryguard.service.core.sketch.SketchCodec;
import com.queryguard.service.core.sketch.SketchPayload;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/** Lets shards exchange partial sketches; payload bytes travel base64-encoded. */
@RestController
@RequestMapping(path = "/api/sketches", produces = MediaType.APPLICATION_JSON_VALUE)
@Slf4j
public class SketchExchangeController {

    private final PercentileEstimator estimator;

    public SketchExchangeController(PercentileEstimator estimator) {
        this.estimator = estimator;
    }

    @PostMapping(path = "/export", consumes = MediaType.APPLICATION_JSON_VALUE)
    public SketchPayload export(@RequestBody PercentileQueryRequest request) {
        QuantileSketch sketch = estimator.export(request.category(), TimeRange.of(request.start(), request.end()));
        return SketchCodec.encode(sketch);
    }

    @PostMapping(path = "/merge", consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Map<String, Object> merge(@RequestBody SketchMergeRequest request) {
        if (request.bucketStart() == null) {
            throw new IllegalArgumentException("bucketStart is required");
        }
        QuantileSketch partial = SketchCodec.decode(request.payload());
        estimator.mergePartial(request.category(), request.bucketStart(), partial);
        log.debug("Accepted partial sketch category={} samples={}", request.category(), partial.count());
        return Map.of("merged", partial.count(), "bucket", estimator.bucket().align(request.bucketStart()));
    }
}
