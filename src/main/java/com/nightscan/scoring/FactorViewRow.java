package com.nightscan.scoring;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One stock in the factor view. Missing sub-scores and betas are stored as 0.
 */
public final class FactorViewRow {
    public final String symbol;
    public final String name;
    public final String sector;
    public final double opportunityScore;
    public final Map<String, Double> subScores;
    public final double baseTotal;
    public final double totalAdjustment;
    public final long penaltyCount;
    public final long bonusCount;
    public final Map<String, Double> betas;
    public final String prediction;
    public final double confidencePct;

    public FactorViewRow(
            String symbol,
            String name,
            String sector,
            double opportunityScore,
            Map<String, Double> subScores,
            double baseTotal,
            double totalAdjustment,
            long penaltyCount,
            long bonusCount,
            Map<String, Double> betas,
            String prediction,
            double confidencePct
    ) {
        this.symbol = symbol;
        this.name = name;
        this.sector = sector;
        this.opportunityScore = opportunityScore;
        this.subScores = Collections.unmodifiableMap(new LinkedHashMap<>(subScores));
        this.baseTotal = baseTotal;
        this.totalAdjustment = totalAdjustment;
        this.penaltyCount = penaltyCount;
        this.bonusCount = bonusCount;
        this.betas = Collections.unmodifiableMap(new LinkedHashMap<>(betas));
        this.prediction = prediction;
        this.confidencePct = confidencePct;
    }

    public double beta(String factor) {
        return betas.getOrDefault(factor, 0.0);
    }
}
