package com.queryguard.service.core.telemetry;

import com.queryguard.service.core.sketch.PercentileEstimator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for telemetry pushes. Invalid readings are skipped and counted; a bad reading
 * never prevents the rest of a batch from being ingested.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TelemetryIngestService {

    private final PercentileEstimator estimator;
    private final ReadingBuffer rawBuffer;

    /** @return {@code true} if the reading was ingested */
    public boolean push(Reading reading) {
        if (reading == null || !reading.isValid()) {
            log.debug("Skipping invalid reading {}", reading);
            return false;
        }
        estimator.insert(reading.deviceCategory(), reading.timestamp(), reading.value());
        rawBuffer.append(reading);
        return true;
    }

    public IngestResult pushBatch(List<Reading> readings) {
        if (readings == null || readings.isEmpty()) {
            return new IngestResult(0, 0);
        }
        int accepted = 0;
        int skipped = 0;
        for (Reading reading : readings) {
            boolean stored;
            try {
                stored = push(reading);
            } catch (RuntimeException ex) {
                log.warn("Failed to ingest reading {}", reading, ex);
                stored = false;
            }
            if (stored) {
                accepted++;
            } else {
                skipped++;
            }
        }
        if (skipped > 0) {
            log.info("Ingested batch accepted={} skipped={}", accepted, skipped);
        }
        return new IngestResult(accepted, skipped);
    }

    public record IngestResult(int accepted, int skipped) {}
}
