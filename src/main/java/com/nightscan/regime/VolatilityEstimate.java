package com.nightscan.regime;

import com.nightscan.model.FitMethod;

/**
 * One-day-ahead volatility forecast and the method that produced it.
 */
public final class VolatilityEstimate {
    public final FitMethod method;
    public final double vol1d;
    public final double volAnnual;

    public VolatilityEstimate(FitMethod method, double variance1d) {
        this.method = method;
        this.vol1d = Math.sqrt(Math.max(0.0, variance1d));
        this.volAnnual = vol1d * Math.sqrt(252.0);
    }
}
