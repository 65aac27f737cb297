package com.queryguard.controller.rest;

import com.queryguard.api.dto.WindowCompareRequest;
import com.queryguard.service.core.model.InvalidRangeException;
import com.queryguard.service.core.sketch.PercentileMethod;
import com.queryguard.service.core.window.WindowComparator;
import com.queryguard.service.core.window.WindowComparison;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(path = "/api/windows", produces = MediaType.APPLICATION_JSON_VALUE)
public class WindowCompareController {

    private final WindowComparator comparator;

    public WindowCompareController(WindowComparator comparator) {
        this.comparator = comparator;
    }

    @PostMapping(path = "/compare", consumes = MediaType.APPLICATION_JSON_VALUE)
    public WindowComparison compare(@RequestBody WindowCompareRequest request) {
        if (request.baseline() == null || request.target() == null) {
            throw new InvalidRangeException("Both baseline and target ranges are required");
        }
        return comparator.compare(
                request.category(),
                request.baseline().toRange(),
                request.target().toRange(),
                request.percentiles(),
                PercentileMethod.defaulted(request.method()));
    }
}
