package com.nightscan.scoring;

import org.json.JSONObject;

/**
 * Counts by score band: high (at least 80), medium (65 to 80) and low (below 65).
 */
public final class ScoringSummary {
    public static final double HIGH_SCORE = 80.0;
    public static final double MEDIUM_SCORE = 65.0;

    public final int total;
    public final int high;
    public final int medium;
    public final int low;
    public final double averageScore;

    public ScoringSummary(int total, int high, int medium, int low, double averageScore) {
        this.total = total;
        this.high = high;
        this.medium = medium;
        this.low = low;
        this.averageScore = averageScore;
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("total_stocks", total);
        json.put("high_opportunity", high);
        json.put("medium_opportunity", medium);
        json.put("low_opportunity", low);
        json.put("avg_opportunity_score", averageScore);
        return json;
    }
}
