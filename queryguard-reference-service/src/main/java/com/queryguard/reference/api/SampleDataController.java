package com.queryguard.reference.api;

import com.queryguard.reference.demodata.HolidayReadingGenerator;
import com.queryguard.reference.demodata.HolidayReadingGenerator.HolidayProfile;
import com.queryguard.reference.demodata.QueryLoadSimulator;
import com.queryguard.service.core.telemetry.Reading;
import com.queryguard.service.core.telemetry.TelemetryIngestService;
import com.queryguard.service.core.telemetry.TelemetryIngestService.IngestResult;
import java.util.List;
import java.util.Map;
import java.util.Random;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/internal/demo")
@RequiredArgsConstructor
@Slf4j
public class SampleDataController {

    private final TelemetryIngestService ingestService;
    private final QueryLoadSimulator loadSimulator;

    @PostMapping("/holiday-readings")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Map<String, Object> generateHolidayReadings(@RequestBody(required = false) HolidayRequest request) {
        HolidayRequest req = HolidayRequest.defaults(request);
        HolidayProfile profile = new HolidayProfile(
                req.category(),
                req.year(),
                req.month(),
                req.holidayDay(),
                req.regularReadings(),
                req.holidayReadings(),
                req.baselinePower(),
                req.holidayMultiplier());
        List<Reading> readings = HolidayReadingGenerator.generate(profile, random(req.seed()));
        IngestResult result = ingestService.pushBatch(readings);
        log.info("Generated holiday readings category={} accepted={}", req.category(), result.accepted());
        return Map.of(
                "generated", readings.size(),
                "accepted", result.accepted(),
                "category", req.category());
    }

    @PostMapping("/query-load")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Map<String, Integer> generateQueryLoad(@RequestBody(required = false) QueryLoadRequest request) {
        QueryLoadRequest req = QueryLoadRequest.defaults(request);
        return loadSimulator.run(req.executionsPerShape(), random(req.seed()));
    }

    private static Random random(Long seed) {
        return seed != null ? new Random(seed) : new Random();
    }

    public record HolidayRequest(
            String category,
            Integer year,
            Integer month,
            Integer holidayDay,
            Integer regularReadings,
            Integer holidayReadings,
            Double baselinePower,
            Double holidayMultiplier,
            Long seed) {

        static HolidayRequest defaults(HolidayRequest maybe) {
            HolidayRequest r = maybe != null
                    ? maybe
                    : new HolidayRequest(null, null, null, null, null, null, null, null, null);
            return new HolidayRequest(
                    r.category() != null && !r.category().isBlank() ? r.category() : "Appliance",
                    r.year() != null ? r.year() : 2024,
                    r.month() != null ? r.month() : 12,
                    r.holidayDay() != null ? r.holidayDay() : 25,
                    r.regularReadings() != null ? Math.max(0, r.regularReadings()) : 1000,
                    r.holidayReadings() != null ? Math.max(0, r.holidayReadings()) : 24,
                    r.baselinePower() != null ? r.baselinePower() : 100.0d,
                    r.holidayMultiplier() != null ? r.holidayMultiplier() : 3.0d,
                    r.seed());
        }
    }

    public record QueryLoadRequest(Integer executionsPerShape, Long seed) {

        static QueryLoadRequest defaults(QueryLoadRequest maybe) {
            if (maybe == null) {
                return new QueryLoadRequest(20, null);
            }
            int executions = maybe.executionsPerShape() != null ? Math.max(1, maybe.executionsPerShape()) : 20;
            return new QueryLoadRequest(executions, maybe.seed());
        }
    }
}
