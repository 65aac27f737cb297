package com.queryguard.service.core.sketch;

/**
 * Wire form of a {@link QuantileSketch} exchanged between shards. {@code sketch} holds the
 * DDSketch protobuf encoding, including its index mapping.
 */
public record SketchPayload(
        double relativeAccuracy, int maxBins, long count, double sum, int minIndex, int maxIndex, byte[] sketch) {}
