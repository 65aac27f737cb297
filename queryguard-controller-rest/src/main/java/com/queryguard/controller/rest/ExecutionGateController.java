package com.queryguard.controller.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.queryguard.api.dto.ExecutionReport;
import com.queryguard.service.core.policy.ExecutionGate;
import com.queryguard.service.core.policy.GateDecision;
import com.queryguard.service.core.shape.QueryShapeHasher;
import com.queryguard.service.core.shape.QueryShapeMonitor;
import com.queryguard.service.core.shape.ShapeKeys;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/** Engine-facing endpoints: the pre-execution check and post-execution cost reports. */
@RestController
@RequestMapping(path = "/api", produces = MediaType.APPLICATION_JSON_VALUE)
public class ExecutionGateController {

    private final ExecutionGate gate;
    private final QueryShapeMonitor monitor;
    private final QueryShapeHasher hasher;

    public ExecutionGateController(ExecutionGate gate, QueryShapeMonitor monitor, QueryShapeHasher hasher) {
        this.gate = gate;
        this.monitor = monitor;
        this.hasher = hasher;
    }

    @GetMapping("/gate/{shapeKey}")
    public GateDecision check(@PathVariable String shapeKey) {
        return gate.beforeExecute(shapeKey);
    }

    @PostMapping(path = "/gate/check", consumes = MediaType.APPLICATION_JSON_VALUE)
    public GateDecision checkQuery(@RequestBody JsonNode query) {
        return gate.beforeExecute(query);
    }

    @PostMapping(path = "/shapes/hash", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, String> hash(@RequestBody JsonNode query) {
        return Map.of("shapeKey", hasher.shapeKey(query), "template", hasher.template(query));
    }

    @PostMapping(path = "/executions", consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Map<String, Object> observe(@RequestBody ExecutionReport report) {
        if (report.costUnits() == null) {
            throw new IllegalArgumentException("costUnits is required");
        }
        String shapeKey;
        if (report.shapeKey() != null && !report.shapeKey().isBlank()) {
            shapeKey = report.shapeKey();
            monitor.observe(shapeKey, report.costUnits(), report.timestamp());
        } else if (report.query() != null && !report.query().isNull()) {
            shapeKey = monitor.observeQuery(report.query(), report.costUnits(), report.timestamp());
        } else {
            throw new IllegalArgumentException("Either shapeKey or query is required");
        }
        return Map.of("shapeKey", ShapeKeys.normalize(shapeKey), "recorded", true);
    }
}
