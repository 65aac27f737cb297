package com.queryguard.service.core.sketch;

import com.datadoghq.sketch.ddsketch.DDSketch;
import com.datadoghq.sketch.ddsketch.mapping.IndexMapping;
import com.datadoghq.sketch.ddsketch.mapping.LogarithmicMapping;
import com.datadoghq.sketch.ddsketch.store.CollapsingLowestDenseStore;

/**
 * Bounded-memory, mergeable quantile sketch backed by a DDSketch.
 *
 * <p>Every quantile answer is within {@code relativeAccuracy} (relative) of a sample whose rank is
 * adjacent to {@code p * (count - 1)}. Each value store holds at most {@code maxBins} bins; past
 * that the lowest bins collapse, so low quantiles lose precision while memory stays fixed.
 *
 * <p>All public methods are thread-safe. Readers receive values computed under the same monitor
 * that writers hold, so several quantiles asked in one call see one consistent state.
 */
public final class QuantileSketch {

    private final double relativeAccuracy;
    private final int maxBins;
    private final IndexMapping mapping;
    private final DDSketch sketch;
    private long count;
    private double sum;
    private int minIndex = Integer.MAX_VALUE;
    private int maxIndex = Integer.MIN_VALUE;
    private boolean capacityExceeded;

    private QuantileSketch(double relativeAccuracy, int maxBins, DDSketch sketch) {
        this.relativeAccuracy = relativeAccuracy;
        this.maxBins = maxBins;
        this.mapping = sketch.getIndexMapping();
        this.sketch = sketch;
    }

    public static QuantileSketch create(double relativeAccuracy, int maxBins) {
        IndexMapping mapping = new LogarithmicMapping(relativeAccuracy);
        DDSketch sketch = new DDSketch(mapping, () -> new CollapsingLowestDenseStore(maxBins));
        return new QuantileSketch(relativeAccuracy, maxBins, sketch);
    }

    static QuantileSketch restore(
            double relativeAccuracy,
            int maxBins,
            DDSketch sketch,
            long count,
            double sum,
            int minIndex,
            int maxIndex) {
        QuantileSketch restored = new QuantileSketch(relativeAccuracy, maxBins, sketch);
        restored.count = count;
        restored.sum = sum;
        restored.minIndex = minIndex;
        restored.maxIndex = maxIndex;
        restored.capacityExceeded = restored.binSpan() > maxBins;
        return restored;
    }

    /**
     * Adds a value. Non-finite values are ignored.
     *
     * @return {@code true} when this insert is the first to push the sketch past its bin capacity
     */
    public synchronized boolean insert(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return false;
        }
        sketch.accept(value);
        count++;
        sum += value;
        double magnitude = Math.abs(value);
        if (magnitude > mapping.minIndexableValue()) {
            int index = mapping.index(magnitude);
            minIndex = Math.min(minIndex, index);
            maxIndex = Math.max(maxIndex, index);
        }
        return markCapacity();
    }

    /** Folds {@code other} into this sketch. Both sketches must share the same accuracy. */
    public void mergeFrom(QuantileSketch other) {
        if (other == this) {
            throw new IllegalArgumentException("Cannot merge a sketch into itself");
        }
        QuantileSketch source = other.copy();
        if (Double.compare(source.relativeAccuracy, relativeAccuracy) != 0) {
            throw new IllegalArgumentException("Cannot merge sketches with relative accuracy "
                    + source.relativeAccuracy + " and " + relativeAccuracy);
        }
        synchronized (this) {
            sketch.mergeWith(source.sketch);
            count += source.count;
            sum += source.sum;
            minIndex = Math.min(minIndex, source.minIndex);
            maxIndex = Math.max(maxIndex, source.maxIndex);
            markCapacity();
        }
    }

    /** Returns a new sketch holding the union of both inputs; neither input is modified. */
    public QuantileSketch merge(QuantileSketch other) {
        QuantileSketch merged = copy();
        merged.mergeFrom(other);
        return merged;
    }

    public synchronized QuantileSketch copy() {
        return restore(relativeAccuracy, maxBins, sketch.copy(), count, sum, minIndex, maxIndex);
    }

    /**
     * Answers every requested quantile from one consistent state.
     *
     * @throws IllegalStateException when the sketch is empty
     */
    public synchronized double[] quantiles(double... quantiles) {
        if (count == 0) {
            throw new IllegalStateException("Sketch is empty");
        }
        double[] values = new double[quantiles.length];
        for (int i = 0; i < quantiles.length; i++) {
            values[i] = sketch.getValueAtQuantile(quantiles[i]);
        }
        return values;
    }

    public synchronized long count() {
        return count;
    }

    public synchronized double sum() {
        return sum;
    }

    public synchronized double mean() {
        return count == 0 ? 0.0d : sum / count;
    }

    public synchronized boolean isCapacityExceeded() {
        return capacityExceeded;
    }

    public double relativeAccuracy() {
        return relativeAccuracy;
    }

    public int maxBins() {
        return maxBins;
    }

    synchronized DDSketch sketchCopy() {
        return sketch.copy();
    }

    synchronized int minIndex() {
        return minIndex;
    }

    synchronized int maxIndex() {
        return maxIndex;
    }

    private boolean markCapacity() {
        if (!capacityExceeded && binSpan() > maxBins) {
            capacityExceeded = true;
            return true;
        }
        return false;
    }

    private long binSpan() {
        if (maxIndex < minIndex) {
            return 0;
        }
        return (long) maxIndex - minIndex + 1;
    }
}
