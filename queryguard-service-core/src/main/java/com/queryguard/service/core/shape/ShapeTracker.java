package com.queryguard.service.core.shape;

import java.time.Instant;

/** Fixed-size circular buffer of the most recent execution costs for one shape. */
final class ShapeTracker {

    private final String shapeKey;
    private final double[] window;
    private int next;
    private int filled;
    private long execCount;
    private double totalCost;
    private double maxCost;
    private Instant lastSeen;

    ShapeTracker(String shapeKey, int windowSize) {
        this.shapeKey = shapeKey;
        this.window = new double[windowSize];
    }

    synchronized void record(double cost, Instant timestamp) {
        window[next] = cost;
        next = (next + 1) % window.length;
        if (filled < window.length) {
            filled++;
        }
        execCount++;
        totalCost += cost;
        maxCost = execCount == 1 ? cost : Math.max(maxCost, cost);
        if (lastSeen == null || timestamp.isAfter(lastSeen)) {
            lastSeen = timestamp;
        }
    }

    synchronized ShapeStats snapshot() {
        double sum = 0.0d;
        for (int i = 0; i < filled; i++) {
            sum += window[i];
        }
        double average = filled == 0 ? 0.0d : sum / filled;
        return new ShapeStats(shapeKey, execCount, totalCost, maxCost, lastSeen, filled, average);
    }
}
