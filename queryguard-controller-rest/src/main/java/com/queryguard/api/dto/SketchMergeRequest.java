package com.queryguard.api.dto;

import com.queryguard.service.core.sketch.SketchPayload;
import java.time.Instant;

public record SketchMergeRequest(String category, Instant bucketStart, SketchPayload payload) {}
