package com.nightscan.core.progress;

/**
 * Stages of the overnight run in execution order. Expected minutes double as progress weights.
 */
public enum PipelineStage {
    INITIALIZATION("initialization", 2),
    REGIME_DETECTION("regime_detection", 5),
    UNIVERSE_SCAN("universe_scan", 30),
    MODEL_REFRESH("model_refresh", 180),
    BATCH_PREDICTION("batch_prediction", 120),
    SCORING("scoring", 30),
    REPORT_GENERATION("report_generation", 15);

    private final String wireName;
    private final int expectedMinutes;

    PipelineStage(String wireName, int expectedMinutes) {
        this.wireName = wireName;
        this.expectedMinutes = expectedMinutes;
    }

    public String wireName() {
        return wireName;
    }

    public int expectedMinutes() {
        return expectedMinutes;
    }

    public static int totalExpectedMinutes() {
        int total = 0;
        for (PipelineStage stage : values()) {
            total += stage.expectedMinutes;
        }
        return total;
    }

    public static PipelineStage fromWireName(String name) {
        for (PipelineStage stage : values()) {
            if (stage.wireName.equals(name)) {
                return stage;
            }
        }
        throw new IllegalArgumentException("unknown pipeline stage: " + name);
    }
}
