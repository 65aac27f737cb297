package com.queryguard.service.core.sketch;

import com.datadoghq.sketch.ddsketch.DDSketch;
import com.datadoghq.sketch.ddsketch.encoding.ByteArrayInput;
import com.datadoghq.sketch.ddsketch.encoding.GrowingByteArrayOutput;
import com.datadoghq.sketch.ddsketch.store.CollapsingLowestDenseStore;
import java.io.IOException;

/** Serialization helpers for shipping sketches between shards. */
public final class SketchCodec {

    private SketchCodec() {}

    public static SketchPayload encode(QuantileSketch sketch) {
        if (sketch == null) {
            throw new IllegalArgumentException("sketch is required");
        }
        QuantileSketch snapshot = sketch.copy();
        try {
            GrowingByteArrayOutput output = GrowingByteArrayOutput.withDefaultInitialCapacity();
            snapshot.sketchCopy().encode(output, false); // include mapping info
            return new SketchPayload(
                    snapshot.relativeAccuracy(),
                    snapshot.maxBins(),
                    snapshot.count(),
                    snapshot.sum(),
                    snapshot.minIndex(),
                    snapshot.maxIndex(),
                    output.trimmedCopy());
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to serialize quantile sketch", ex);
        }
    }

    public static QuantileSketch decode(SketchPayload payload) {
        if (payload == null || payload.sketch() == null || payload.sketch().length == 0) {
            throw new IllegalArgumentException("Sketch payload is empty");
        }
        if (payload.count() < 0 || payload.maxBins() <= 0) {
            throw new IllegalArgumentException("Sketch payload has invalid count or bin capacity");
        }
        int maxBins = payload.maxBins();
        try {
            ByteArrayInput input = ByteArrayInput.wrap(payload.sketch());
            DDSketch sketch = DDSketch.decode(input, () -> new CollapsingLowestDenseStore(maxBins));
            return QuantileSketch.restore(
                    payload.relativeAccuracy(),
                    maxBins,
                    sketch,
                    payload.count(),
                    payload.sum(),
                    payload.minIndex(),
                    payload.maxIndex());
        } catch (IOException ex) {
            throw new IllegalArgumentException("Failed to deserialize quantile sketch", ex);
        }
    }
}
