package com.nightscan.model;

import java.util.Locale;

/**
 * One sub-model's vote: direction in [-1, 1] and confidence in [0, 1].
 */
public final class ModelSignal {
    public final double direction;
    public final double confidence;

    public ModelSignal(double direction, double confidence) {
        this.direction = clamp(direction, -1.0, 1.0);
        this.confidence = clamp(confidence, 0.0, 1.0);
    }

    private static double clamp(double value, double lo, double hi) {
        if (!Double.isFinite(value)) {
            return 0.0;
        }
        return Math.max(lo, Math.min(hi, value));
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "(%.3f, %.3f)", direction, confidence);
    }
}
