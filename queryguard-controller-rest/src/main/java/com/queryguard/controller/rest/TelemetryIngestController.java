package com.queryguard.controller.rest;

import com.queryguard.api.dto.ReadingRequest;
import com.queryguard.service.core.telemetry.Reading;
import com.queryguard.service.core.telemetry.TelemetryIngestService;
import com.queryguard.service.core.telemetry.TelemetryIngestService.IngestResult;
import jakarta.validation.Valid;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/telemetry")
public class TelemetryIngestController {
    private final TelemetryIngestService ingest;

    public TelemetryIngestController(TelemetryIngestService ingest) {
        this.ingest = ingest;
    }

    @PostMapping("/readings")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Map<String, Object> pushOne(@Valid @RequestBody ReadingRequest reading) {
        boolean stored = ingest.push(reading.toReading());
        return Map.of("status", stored ? "accepted" : "skipped");
    }

    /** Individual readings that fail validation are skipped; the rest of the batch is still ingested. */
    @PostMapping("/readings/batch")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Map<String, Object> pushBatch(@RequestBody List<ReadingRequest> readings) {
        List<Reading> batch = new ArrayList<>(readings.size());
        for (ReadingRequest request : readings) {
            batch.add(request != null ? request.toReading() : null);
        }
        IngestResult result = ingest.pushBatch(batch);
        return Map.of("accepted", result.accepted(), "skipped", result.skipped());
    }
}
