package com.nightscan.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.List;
import java.util.Map;

/**
 * 模块说明：ScoredOpportunity（class）。
 * 主要职责：单个标的的机会评分结果，opportunityScore = clip(baseTotal + totalAdjustment, 0, 100)。
 * 使用建议：由 OpportunityScorer 生成，运行结束后只读。
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class ScoredOpportunity {
    public final String symbol;
    public final String name;
    public final String sector;
    public final double opportunityScore;
    public final ScoreBreakdown breakdown;
    public final List<Adjustment> adjustments;
    public final double totalAdjustment;
    public final Map<String, Double> macroBetas;
    public final PredictionRecord prediction;
    public final double confidencePct;

    public long penaltyCount() {
        return adjustments.stream().filter(Adjustment::isPenalty).count();
    }

    public long bonusCount() {
        return adjustments.stream().filter(Adjustment::isBonus).count();
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("symbol", symbol);
        json.put("name", name);
        json.put("sector", sector);
        json.put("opportunity_score", opportunityScore);
        JSONObject breakdownJson = new JSONObject();
        breakdownJson.put("sub_scores", new JSONObject(breakdown.subScores));
        breakdownJson.put("weighted", new JSONObject(breakdown.weighted));
        breakdownJson.put("base_total", breakdown.baseTotal);
        json.put("score_breakdown", breakdownJson);
        JSONArray adj = new JSONArray();
        for (Adjustment adjustment : adjustments) {
            JSONObject a = new JSONObject();
            a.put("name", adjustment.name);
            a.put("amount", adjustment.amount);
            a.put("reason", adjustment.reason);
            adj.put(a);
        }
        json.put("adjustments", adj);
        json.put("total_adjustment", totalAdjustment);
        json.put("macro_betas", new JSONObject(macroBetas));
        json.put("prediction", prediction.toJson());
        json.put("confidence_pct", confidencePct);
        return json;
    }
}
