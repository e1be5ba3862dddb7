package com.nightscan.regime;

import com.nightscan.model.FitMethod;

/**
 * Exponentially weighted variance of returns, seeded with the sample variance.
 */
public final class EwmaVolatility {
    private final double lambda;

    public EwmaVolatility(double lambda) {
        if (!(lambda > 0.0 && lambda < 1.0)) {
            throw new IllegalArgumentException("ewma lambda must be in (0, 1), got " + lambda);
        }
        this.lambda = lambda;
    }

    public VolatilityEstimate forecast(double[] returns) {
        if (returns.length == 0) {
            return new VolatilityEstimate(FitMethod.EWMA, 0.0);
        }
        double seed = 0.0;
        for (double r : returns) {
            seed += r * r;
        }
        double variance = seed / returns.length;
        for (double r : returns) {
            variance = lambda * variance + (1.0 - lambda) * r * r;
        }
        return new VolatilityEstimate(FitMethod.EWMA, variance);
    }
}
