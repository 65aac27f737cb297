package com.queryguard.controller.admin;

import com.queryguard.service.core.shape.QueryShapeHasher;
import com.queryguard.service.core.shape.QueryShapeMonitor;
import com.queryguard.service.core.shape.ShapeStats;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

/** Query insights: what runs, how much it costs, and which shapes are over budget. */
@RestController
@RequestMapping(path = "/admin/shapes", produces = MediaType.APPLICATION_JSON_VALUE)
public class ShapeAdminController {

    private final QueryShapeMonitor monitor;
    private final QueryShapeHasher hasher;

    public ShapeAdminController(QueryShapeMonitor monitor, QueryShapeHasher hasher) {
        this.monitor = monitor;
        this.hasher = hasher;
    }

    @GetMapping
    public List<ShapeStats> shapes() {
        return monitor.snapshot();
    }

    @GetMapping("/{shapeKey}")
    public Map<String, Object> shape(@PathVariable String shapeKey) {
        ShapeStats stats = monitor.stats(shapeKey)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Shape not tracked: " + shapeKey));
        return Map.of("stats", stats, "template", hasher.templateFor(shapeKey).orElse(""));
    }

    /** Both parameters are required: there is no built-in notion of "too expensive". */
    @GetMapping("/flagged")
    public List<ShapeStats> flagged(@RequestParam double thresholdCost, @RequestParam int minExecCount) {
        return monitor.flaggedStats(thresholdCost, minExecCount);
    }
}
