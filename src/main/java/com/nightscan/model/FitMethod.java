package com.nightscan.model;

/**
 * Which estimator actually produced a regime or volatility figure.
 */
public enum FitMethod {
    HMM("hmm"),
    GMM("gmm"),
    GARCH("garch"),
    EWMA("ewma"),
    NONE("none");

    private final String wireName;

    FitMethod(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
