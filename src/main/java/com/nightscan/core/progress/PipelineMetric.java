package com.nightscan.core.progress;

public enum PipelineMetric {
    STOCKS_SCANNED("stocks_scanned"),
    MODELS_TRAINED("models_trained"),
    PREDICTIONS_GENERATED("predictions_generated"),
    OPPORTUNITIES_FOUND("opportunities_found");

    private final String wireName;

    PipelineMetric(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
