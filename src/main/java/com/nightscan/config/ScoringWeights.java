package com.nightscan.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable sub-score weights for the opportunity score. The weights are validated once, at construction:
 * each must be finite and non-negative and together they must sum to 1.
 */
public final class ScoringWeights {
    public static final String PREDICTION_CONFIDENCE = "prediction_confidence";
    public static final String TECHNICAL_STRENGTH = "technical_strength";
    public static final String INDEX_ALIGNMENT = "index_alignment";
    public static final String LIQUIDITY = "liquidity";
    public static final String VOLATILITY = "volatility";
    public static final String SECTOR_MOMENTUM = "sector_momentum";

    private static final double SUM_TOLERANCE = 1e-6;

    public final double predictionConfidence;
    public final double technicalStrength;
    public final double indexAlignment;
    public final double liquidity;
    public final double volatility;
    public final double sectorMomentum;

    public ScoringWeights(
            double predictionConfidence,
            double technicalStrength,
            double indexAlignment,
            double liquidity,
            double volatility,
            double sectorMomentum
    ) {
        requireWeight(PREDICTION_CONFIDENCE, predictionConfidence);
        requireWeight(TECHNICAL_STRENGTH, technicalStrength);
        requireWeight(INDEX_ALIGNMENT, indexAlignment);
        requireWeight(LIQUIDITY, liquidity);
        requireWeight(VOLATILITY, volatility);
        requireWeight(SECTOR_MOMENTUM, sectorMomentum);
        double sum = predictionConfidence + technicalStrength + indexAlignment + liquidity + volatility + sectorMomentum;
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new IllegalArgumentException(String.format(Locale.US, "scoring weights must sum to 1, got %.6f", sum));
        }
        this.predictionConfidence = predictionConfidence;
        this.technicalStrength = technicalStrength;
        this.indexAlignment = indexAlignment;
        this.liquidity = liquidity;
        this.volatility = volatility;
        this.sectorMomentum = sectorMomentum;
    }

    public static ScoringWeights defaults() {
        return new ScoringWeights(0.30, 0.20, 0.15, 0.15, 0.10, 0.10);
    }

    public static ScoringWeights fromConfig(Config config) {
        return new ScoringWeights(
                config.getDouble("scoring.weight." + PREDICTION_CONFIDENCE),
                config.getDouble("scoring.weight." + TECHNICAL_STRENGTH),
                config.getDouble("scoring.weight." + INDEX_ALIGNMENT),
                config.getDouble("scoring.weight." + LIQUIDITY),
                config.getDouble("scoring.weight." + VOLATILITY),
                config.getDouble("scoring.weight." + SECTOR_MOMENTUM)
        );
    }

    /**
     * Weights in the fixed sub-score order used by breakdowns and exports.
     */
    public Map<String, Double> asMap() {
        Map<String, Double> out = new LinkedHashMap<>();
        out.put(PREDICTION_CONFIDENCE, predictionConfidence);
        out.put(TECHNICAL_STRENGTH, technicalStrength);
        out.put(INDEX_ALIGNMENT, indexAlignment);
        out.put(LIQUIDITY, liquidity);
        out.put(VOLATILITY, volatility);
        out.put(SECTOR_MOMENTUM, sectorMomentum);
        return Collections.unmodifiableMap(out);
    }

    private static void requireWeight(String name, double value) {
        if (!Double.isFinite(value) || value < 0.0) {
            throw new IllegalArgumentException("scoring weight " + name + " must be a non-negative number, got " + value);
        }
    }
}
