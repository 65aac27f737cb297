package com.queryguard.reference.demodata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.queryguard.service.core.shape.QueryShapeMonitor;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reports synthetic executions of two cheap and two expensive query shapes to the monitor, with
 * randomized literals so each family still collapses to one shape.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class QueryLoadSimulator {

    private static final double FAST_COST = 5.0d;
    private static final double SLOW_COST = 4_000.0d;

    private final QueryShapeMonitor monitor;
    private final ObjectMapper mapper;
    private final Clock clock;

    /** @return executions recorded per shape key */
    public Map<String, Integer> run(int executionsPerShape, Random random) {
        Map<String, Integer> recorded = new LinkedHashMap<>();
        for (int i = 0; i < executionsPerShape; i++) {
            record(recorded, indexedFind(random), FAST_COST, random);
            record(recorded, categoryCount(), FAST_COST, random);
            record(recorded, percentileWithLookup(random), SLOW_COST, random);
            record(recorded, regexScan(random), SLOW_COST, random);
        }
        log.info("Simulated query load shapes={} executionsPerShape={}", recorded.size(), executionsPerShape);
        return recorded;
    }

    private void record(Map<String, Integer> recorded, JsonNode query, double cost, Random random) {
        double jittered = cost * (0.8d + 0.4d * random.nextDouble());
        String shapeKey = monitor.observeQuery(query, jittered, clock.instant());
        recorded.merge(shapeKey, 1, Integer::sum);
    }

    private JsonNode indexedFind(Random random) {
        return parse("""
                {"find": "power_readings",
                 "filter": {"timestamp": {"$gt": "2024-06-%02dT00:00:00Z"}},
                 "projection": {"device_id": 1, "current_power": 1, "timestamp": 1, "_id": 0},
                 "limit": 10}
                """.formatted(1 + random.nextInt(28)));
    }

    private JsonNode categoryCount() {
        return parse("""
                {"aggregate": "power_readings", "pipeline": [
                  {"$group": {"_id": "$device_id.Category", "count": {"$sum": 1}}},
                  {"$sort": {"count": -1}}]}
                """);
    }

    private JsonNode percentileWithLookup(Random random) {
        return parse("""
                {"aggregate": "power_readings", "pipeline": [
                  {"$match": {"timestamp": {"$gte": "2024-0%d-01T00:00:00Z"}}},
                  {"$group": {"_id": {"device": "$device_id.Device", "day": {"$dayOfMonth": "$timestamp"}},
                              "dailyAvgPower": {"$avg": "$current_power"}}},
                  {"$group": {"_id": "$_id.device",
                              "powerPercentiles": {"$percentile": {"input": "$dailyAvgPower",
                                                                   "p": [0.1, 0.5, 0.95], "method": "approximate"}}}},
                  {"$lookup": {"from": "power_readings", "localField": "_id", "foreignField": "device_id.Device",
                               "as": "hourly"}},
                  {"$limit": %d}]}
                """.formatted(1 + random.nextInt(6), 10 + random.nextInt(20)));
    }

    private JsonNode regexScan(Random random) {
        return parse("""
                {"aggregate": "power_readings", "pipeline": [
                  {"$match": {"$expr": {"$regexMatch": {"input": {"$toString": "$device_id.Name"},
                                                         "regex": ".*%s.*", "options": "i"}}}},
                  {"$group": {"_id": {"device": "$device_id.Device", "hour": {"$hour": "$timestamp"}},
                              "avgPower": {"$avg": "$current_power"}, "count": {"$sum": 1}}}]}
                """.formatted(random.nextBoolean() ? "heater" : "oven"));
    }

    private JsonNode parse(String json) {
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Invalid simulated query", ex);
        }
    }
}
