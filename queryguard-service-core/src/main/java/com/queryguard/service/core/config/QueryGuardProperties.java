package com.queryguard.service.core.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "queryguard")
public class QueryGuardProperties {
    private Sketch sketch = new Sketch();
    private Telemetry telemetry = new Telemetry();
    private Shapes shapes = new Shapes();
    private Governance governance = new Governance();
    private Gate gate = new Gate();

    public Sketch getSketch() {
        return sketch;
    }

    public void setSketch(Sketch sketch) {
        this.sketch = sketch;
    }

    public Telemetry getTelemetry() {
        return telemetry;
    }

    public void setTelemetry(Telemetry telemetry) {
        this.telemetry = telemetry;
    }

    public Shapes getShapes() {
        return shapes;
    }

    public void setShapes(Shapes shapes) {
        this.shapes = shapes;
    }

    public Governance getGovernance() {
        return governance;
    }

    public void setGovernance(Governance governance) {
        this.governance = governance;
    }

    public Gate getGate() {
        return gate;
    }

    public void setGate(Gate gate) {
        this.gate = gate;
    }

    public static class Sketch {
        private double relativeAccuracy = 0.01d;
        private int maxBins = 2048;
        private TimeBucket bucket = TimeBucket.H1;
        private Duration retention = Duration.ofDays(400);
        private Duration maintenanceRate = Duration.ofMinutes(5);

        public double getRelativeAccuracy() {
            return relativeAccuracy;
        }

        public void setRelativeAccuracy(double relativeAccuracy) {
            if (relativeAccuracy <= 0 || relativeAccuracy >= 1) {
                throw new IllegalArgumentException("relative-accuracy must be in (0, 1): " + relativeAccuracy);
            }
            this.relativeAccuracy = relativeAccuracy;
        }

        public int getMaxBins() {
            return maxBins;
        }

        public void setMaxBins(int maxBins) {
            this.maxBins = Math.max(16, maxBins);
        }

        public TimeBucket getBucket() {
            return bucket;
        }

        public void setBucket(TimeBucket bucket) {
            this.bucket = bucket == null ? TimeBucket.H1 : bucket;
        }

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention == null ? Duration.ofDays(400) : retention;
        }

        public Duration getMaintenanceRate() {
            return maintenanceRate;
        }

        public void setMaintenanceRate(Duration maintenanceRate) {
            this.maintenanceRate = maintenanceRate == null ? Duration.ofMinutes(5) : maintenanceRate;
        }
    }

    public static class Telemetry {
        private Duration rawRetention = Duration.ofDays(45);
        private int maxSamplesPerCategory = 200_000;

        public Duration getRawRetention() {
            return rawRetention;
        }

        public void setRawRetention(Duration rawRetention) {
            this.rawRetention = rawRetention == null ? Duration.ZERO : rawRetention;
        }

        public boolean isRawRetentionEnabled() {
            return !rawRetention.isZero() && !rawRetention.isNegative();
        }

        public int getMaxSamplesPerCategory() {
            return maxSamplesPerCategory;
        }

        public void setMaxSamplesPerCategory(int maxSamplesPerCategory) {
            this.maxSamplesPerCategory = Math.max(1, maxSamplesPerCategory);
        }
    }

    public static class Shapes {
        private int windowSize = 20;
        private int capacity = 10_000;
        private Duration staleness = Duration.ofHours(1);

        public int getWindowSize() {
            return windowSize;
        }

        public void setWindowSize(int windowSize) {
            this.windowSize = Math.max(1, windowSize);
        }

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = Math.max(1, capacity);
        }

        public Duration getStaleness() {
            return staleness;
        }

        public void setStaleness(Duration staleness) {
            this.staleness = staleness == null ? Duration.ofHours(1) : staleness;
        }
    }

    /** Automatic evaluation stays off until both the threshold and the minimum count are configured. */
    public static class Governance {
        private Double costThreshold;
        private Integer minExecCount;
        private boolean autoReject;
        private Duration evaluationRate = Duration.ofSeconds(30);
        private String rejectComment = "Blocked query with excessive resource consumption";

        public Double getCostThreshold() {
            return costThreshold;
        }

        public void setCostThreshold(Double costThreshold) {
            this.costThreshold = costThreshold;
        }

        public Integer getMinExecCount() {
            return minExecCount;
        }

        public void setMinExecCount(Integer minExecCount) {
            this.minExecCount = minExecCount;
        }

        public boolean isEvaluationEnabled() {
            return costThreshold != null && minExecCount != null;
        }

        public boolean isAutoReject() {
            return autoReject;
        }

        public void setAutoReject(boolean autoReject) {
            this.autoReject = autoReject;
        }

        public Duration getEvaluationRate() {
            return evaluationRate;
        }

        public void setEvaluationRate(Duration evaluationRate) {
            this.evaluationRate = evaluationRate == null ? Duration.ofSeconds(30) : evaluationRate;
        }

        public String getRejectComment() {
            return rejectComment;
        }

        public void setRejectComment(String rejectComment) {
            this.rejectComment = rejectComment;
        }
    }

    public static class Gate {
        private Duration cacheTtl = Duration.ofSeconds(1);
        private int cacheSize = 50_000;

        public Duration getCacheTtl() {
            return cacheTtl;
        }

        public void setCacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl == null ? Duration.ofSeconds(1) : cacheTtl;
        }

        public int getCacheSize() {
            return cacheSize;
        }

        public void setCacheSize(int cacheSize) {
            this.cacheSize = Math.max(1, cacheSize);
        }
    }
}
