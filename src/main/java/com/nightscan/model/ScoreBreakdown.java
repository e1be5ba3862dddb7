package com.nightscan.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raw sub-scores (0-100), their weighted contributions, and {@code baseTotal} = sum of contributions.
 */
public final class ScoreBreakdown {
    public final Map<String, Double> subScores;
    public final Map<String, Double> weighted;
    public final double baseTotal;

    public ScoreBreakdown(Map<String, Double> subScores, Map<String, Double> weights) {
        Map<String, Double> raw = new LinkedHashMap<>();
        Map<String, Double> contrib = new LinkedHashMap<>();
        double total = 0.0;
        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            Double score = subScores.get(entry.getKey());
            double value = score == null || !Double.isFinite(score) ? 0.0 : score;
            double part = value * entry.getValue();
            raw.put(entry.getKey(), value);
            contrib.put(entry.getKey(), part);
            total += part;
        }
        this.subScores = Collections.unmodifiableMap(raw);
        this.weighted = Collections.unmodifiableMap(contrib);
        this.baseTotal = total;
    }

    public double subScore(String name) {
        Double value = subScores.get(name);
        return value == null ? 0.0 : value;
    }
}
