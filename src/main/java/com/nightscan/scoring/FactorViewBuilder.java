package com.nightscan.scoring;

import com.nightscan.config.ScoringWeights;
import com.nightscan.model.ScoredOpportunity;
import com.nightscan.model.Signal;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * 模块说明：FactorViewBuilder（class）。
 * 主要职责：由评分结果生成因子视图：逐股行、行业汇总与整体汇总。
 * 使用建议：全部为纯函数，行业汇总只由行列表推导；缺失的分项或 beta 按 0 计入，不剔除该股票。
 */
public final class FactorViewBuilder {
    public static final List<String> SUB_SCORES = List.of(
            ScoringWeights.PREDICTION_CONFIDENCE,
            ScoringWeights.TECHNICAL_STRENGTH,
            ScoringWeights.INDEX_ALIGNMENT,
            ScoringWeights.LIQUIDITY,
            ScoringWeights.VOLATILITY,
            ScoringWeights.SECTOR_MOMENTUM
    );

    private FactorViewBuilder() {
    }

    /**
     * @param factorNames factors to always include; factors found on the stocks are appended
     */
    public static FactorView build(List<ScoredOpportunity> scored, List<String> factorNames) {
        Set<String> factors = new LinkedHashSet<>(factorNames == null ? List.of() : factorNames);
        for (ScoredOpportunity s : scored) {
            factors.addAll(s.macroBetas.keySet());
        }
        List<String> factorList = new ArrayList<>(factors);
        List<FactorViewRow> rows = rows(scored, factorList);
        return new FactorView(factorList, rows, sectorSummaries(rows, factorList), summary(rows, factorList));
    }

    public static List<FactorViewRow> rows(List<ScoredOpportunity> scored, List<String> factors) {
        List<FactorViewRow> rows = new ArrayList<>(scored.size());
        for (ScoredOpportunity s : scored) {
            Map<String, Double> subScores = new LinkedHashMap<>();
            for (String name : SUB_SCORES) {
                subScores.put(name, s.breakdown == null ? 0.0 : s.breakdown.subScore(name));
            }
            Map<String, Double> betas = new LinkedHashMap<>();
            for (String factor : factors) {
                Double beta = s.macroBetas.get(factor);
                betas.put(factor, beta == null || !Double.isFinite(beta) ? 0.0 : beta);
            }
            rows.add(new FactorViewRow(
                    s.symbol,
                    s.name,
                    s.sector,
                    s.opportunityScore,
                    subScores,
                    s.breakdown == null ? 0.0 : s.breakdown.baseTotal,
                    s.totalAdjustment,
                    s.penaltyCount(),
                    s.bonusCount(),
                    betas,
                    s.prediction == null ? Signal.HOLD.name() : s.prediction.signal.name(),
                    s.confidencePct
            ));
        }
        return rows;
    }

    /**
     * Sector rollup, sorted by sector name, computed only from {@code rows}.
     */
    public static List<SectorSummary> sectorSummaries(List<FactorViewRow> rows, List<String> factors) {
        Map<String, List<FactorViewRow>> bySector = new TreeMap<>();
        for (FactorViewRow row : rows) {
            bySector.computeIfAbsent(row.sector, k -> new ArrayList<>()).add(row);
        }
        List<SectorSummary> out = new ArrayList<>();
        for (Map.Entry<String, List<FactorViewRow>> entry : bySector.entrySet()) {
            List<FactorViewRow> members = entry.getValue();
            double scoreSum = 0.0;
            int buys = 0;
            int sells = 0;
            for (FactorViewRow row : members) {
                scoreSum += row.opportunityScore;
                if (Signal.BUY.name().equals(row.prediction)) {
                    buys++;
                } else if (Signal.SELL.name().equals(row.prediction)) {
                    sells++;
                }
            }
            out.add(new SectorSummary(entry.getKey(), members.size(), scoreSum / members.size(),
                    averageBetas(members, factors), buys, sells));
        }
        return out;
    }

    public static JSONObject summary(List<FactorViewRow> rows, List<String> factors) {
        int high = 0;
        int medium = 0;
        int low = 0;
        double sum = 0.0;
        for (FactorViewRow row : rows) {
            sum += row.opportunityScore;
            if (row.opportunityScore >= ScoringSummary.HIGH_SCORE) {
                high++;
            } else if (row.opportunityScore >= ScoringSummary.MEDIUM_SCORE) {
                medium++;
            } else {
                low++;
            }
        }
        JSONObject json = new JSONObject();
        json.put("total_stocks", rows.size());
        json.put("avg_opportunity_score", rows.isEmpty() ? 0.0 : sum / rows.size());
        for (Map.Entry<String, Double> beta : averageBetas(rows, factors).entrySet()) {
            json.put("avg_beta_" + beta.getKey(), beta.getValue());
        }
        json.put("high_opportunity", high);
        json.put("medium_opportunity", medium);
        json.put("low_opportunity", low);
        return json;
    }

    private static Map<String, Double> averageBetas(List<FactorViewRow> rows, List<String> factors) {
        Map<String, Double> out = new LinkedHashMap<>();
        for (String factor : factors) {
            double acc = 0.0;
            for (FactorViewRow row : rows) {
                acc += row.beta(factor);
            }
            out.put(factor, rows.isEmpty() ? 0.0 : acc / rows.size());
        }
        return out;
    }
}
