package com.nightscan.scoring;

import com.nightscan.model.RegimeLabel;
import com.nightscan.model.RegimeResult;
import com.nightscan.model.TechnicalSnapshot;

/**
 * Market-wide inputs to the scorer: index direction in [-1, 1], regime label and crash risk.
 */
public final class MarketContext {
    public final double marketDirection;
    public final RegimeLabel regimeLabel;
    public final double crashRiskScore;

    public MarketContext(double marketDirection, RegimeLabel regimeLabel, double crashRiskScore) {
        this.marketDirection = Double.isFinite(marketDirection) ? Math.max(-1.0, Math.min(1.0, marketDirection)) : 0.0;
        this.regimeLabel = regimeLabel == null ? RegimeLabel.UNKNOWN : regimeLabel;
        this.crashRiskScore = Double.isFinite(crashRiskScore) ? crashRiskScore : 0.0;
    }

    public static MarketContext neutral() {
        return new MarketContext(0.0, RegimeLabel.UNKNOWN, 0.0);
    }

    /**
     * Market direction from the index's 20-day return, squashed with tanh (10% maps to about 0.76).
     */
    public static MarketContext from(RegimeResult regime, TechnicalSnapshot index) {
        double direction = index == null || !Double.isFinite(index.return20dPct) ? 0.0 : Math.tanh(index.return20dPct / 10.0);
        if (regime == null) {
            return new MarketContext(direction, RegimeLabel.UNKNOWN, 0.0);
        }
        return new MarketContext(direction, regime.regimeLabel, regime.crashRiskScore);
    }
}
