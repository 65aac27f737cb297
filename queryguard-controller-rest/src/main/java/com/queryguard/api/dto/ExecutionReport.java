package com.queryguard.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

/** One executed query as reported by the engine: either a precomputed shape key or the query document. */
public record ExecutionReport(String shapeKey, JsonNode query, Double costUnits, Instant timestamp) {}
