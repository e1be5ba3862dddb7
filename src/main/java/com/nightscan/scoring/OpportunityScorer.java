package com.nightscan.scoring;

import com.nightscan.config.ScoringWeights;
import com.nightscan.model.Adjustment;
import com.nightscan.model.PredictionRecord;
import com.nightscan.model.RegimeLabel;
import com.nightscan.model.ScoreBreakdown;
import com.nightscan.model.ScoredOpportunity;
import com.nightscan.model.Signal;
import com.nightscan.model.TechnicalSnapshot;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 模块说明：OpportunityScorer（class）。
 * 主要职责：把预测结果与技术指标转换为 0-100 的机会评分，并保留可审计的分项、权重贡献与加减分明细。
 * 使用建议：无共享可变状态，可在定时任务与临时重算中并发调用；权重由 ScoringWeights 在构造时校验。
 */
public final class OpportunityScorer {
    static final double LOW_VOLUME = 100_000.0;
    static final double HIGH_VOLATILITY_PCT = 80.0;
    static final double CONTRARIAN_MARKET = 0.3;
    static final double CRASH_RISK = 0.7;
    static final double STRONG_ALIGNMENT = 85.0;
    static final double SECTOR_LEADER = 85.0;

    private final ScoringWeights weights;

    public OpportunityScorer(ScoringWeights weights) {
        this.weights = weights == null ? ScoringWeights.defaults() : weights;
    }

    public ScoringWeights weights() {
        return weights;
    }

    /**
     * 方法说明：scoreAll，对整批股票评分并按分数降序返回。
     * 处理流程：先由整批输入计算行业动量，再逐只评分。
     * 维护提示：行业动量只取决于传入列表，同一列表多次调用结果一致。
     */
    public List<ScoredOpportunity> scoreAll(List<ScoringInput> inputs, MarketContext market) {
        Map<String, Double> sectorMomentum = sectorMomentum(inputs);
        List<ScoredOpportunity> out = new ArrayList<>(inputs.size());
        for (ScoringInput input : inputs) {
            out.add(score(input, market, sectorMomentum.getOrDefault(input.candidate.sector, 50.0)));
        }
        out.sort(Comparator.comparingDouble((ScoredOpportunity s) -> s.opportunityScore).reversed()
                .thenComparing(s -> s.symbol));
        return out;
    }

    public ScoredOpportunity score(ScoringInput input, MarketContext market, double sectorMomentumScore) {
        MarketContext ctx = market == null ? MarketContext.neutral() : market;
        TechnicalSnapshot tech = input.technical;
        PredictionRecord prediction = input.prediction;

        Map<String, Double> subScores = new LinkedHashMap<>();
        subScores.put(ScoringWeights.PREDICTION_CONFIDENCE, clip(prediction.confidence * 100.0));
        subScores.put(ScoringWeights.TECHNICAL_STRENGTH, technicalStrength(tech));
        subScores.put(ScoringWeights.INDEX_ALIGNMENT, indexAlignment(prediction.direction, ctx));
        subScores.put(ScoringWeights.LIQUIDITY, liquidity(tech.avgVolume20));
        subScores.put(ScoringWeights.VOLATILITY, volatility(tech.volatility20Pct));
        subScores.put(ScoringWeights.SECTOR_MOMENTUM, clip(sectorMomentumScore));
        ScoreBreakdown breakdown = new ScoreBreakdown(subScores, weights.asMap());

        List<Adjustment> adjustments = adjustments(tech, prediction, ctx, breakdown);
        double totalAdjustment = 0.0;
        for (Adjustment adjustment : adjustments) {
            totalAdjustment += adjustment.amount;
        }
        return ScoredOpportunity.builder()
                .symbol(input.candidate.symbol)
                .name(input.candidate.name)
                .sector(input.candidate.sector)
                .opportunityScore(clip(breakdown.baseTotal + totalAdjustment))
                .breakdown(breakdown)
                .adjustments(List.copyOf(adjustments))
                .totalAdjustment(totalAdjustment)
                .macroBetas(input.macroBetas)
                .prediction(prediction)
                .confidencePct(prediction.confidencePct())
                .build();
    }

    static List<Adjustment> adjustments(
            TechnicalSnapshot tech,
            PredictionRecord prediction,
            MarketContext market,
            ScoreBreakdown breakdown
    ) {
        List<Adjustment> out = new ArrayList<>();
        if (tech.avgVolume20 < LOW_VOLUME) {
            out.add(new Adjustment("low_volume", -10.0,
                    String.format(Locale.US, "average volume %.0f below %.0f", tech.avgVolume20, LOW_VOLUME)));
        }
        if (tech.volatility20Pct > HIGH_VOLATILITY_PCT) {
            out.add(new Adjustment("high_volatility", -10.0,
                    String.format(Locale.US, "annualised volatility %.1f%% above %.0f%%", tech.volatility20Pct, HIGH_VOLATILITY_PCT)));
        }
        boolean againstRally = prediction.signal == Signal.SELL && market.marketDirection > CONTRARIAN_MARKET;
        boolean againstSelloff = prediction.signal == Signal.BUY && market.marketDirection < -CONTRARIAN_MARKET;
        if (againstRally || againstSelloff) {
            out.add(new Adjustment("contrarian", -5.0,
                    String.format(Locale.US, "%s signal against market direction %.2f", prediction.signal, market.marketDirection)));
        }
        if (market.crashRiskScore >= CRASH_RISK) {
            out.add(new Adjustment("crash_risk", -10.0,
                    String.format(Locale.US, "crash risk %.2f", market.crashRiskScore)));
        }
        if (breakdown.subScore(ScoringWeights.INDEX_ALIGNMENT) >= STRONG_ALIGNMENT) {
            out.add(new Adjustment("strong_index_alignment", 5.0, "prediction agrees with a strong index move"));
        }
        if (breakdown.subScore(ScoringWeights.TECHNICAL_STRENGTH) >= SECTOR_LEADER) {
            out.add(new Adjustment("sector_leader", 5.0, "technical strength at leader level"));
        }
        return out;
    }

    /**
     * RSI band, price against SMA-20, SMA-20 against SMA-50 and 5-day momentum; capped at 100.
     */
    static double technicalStrength(TechnicalSnapshot tech) {
        double score;
        double rsi = tech.rsi14;
        if (rsi >= 40.0 && rsi <= 60.0) {
            score = 30.0;
        } else if ((rsi >= 30.0 && rsi < 40.0) || (rsi > 60.0 && rsi <= 70.0)) {
            score = 20.0;
        } else {
            score = 10.0;
        }
        if (tech.lastClose > tech.sma20) {
            score += 20.0;
        }
        if (tech.sma20 > tech.sma50) {
            score += 20.0;
        }
        if (Double.isFinite(tech.return5dPct) && tech.return5dPct > 0) {
            score += Math.min(30.0, tech.return5dPct * 3.0);
        }
        return clip(score);
    }

    /**
     * 50 plus 50 times the product of prediction and market direction; bullish agreement is halved in a high-vol regime.
     */
    static double indexAlignment(double predictionDirection, MarketContext market) {
        double contribution = 50.0 * predictionDirection * market.marketDirection;
        if (contribution > 0 && predictionDirection > 0 && market.regimeLabel == RegimeLabel.HIGH_VOL) {
            contribution *= 0.5;
        }
        return clip(50.0 + contribution);
    }

    static double liquidity(double avgVolume) {
        if (avgVolume >= 5_000_000) {
            return 100.0;
        }
        if (avgVolume >= 1_000_000) {
            return 80.0;
        }
        if (avgVolume >= 500_000) {
            return 60.0;
        }
        if (avgVolume >= 100_000) {
            return 40.0;
        }
        return 20.0;
    }

    static double volatility(double annualVolPct) {
        if (!Double.isFinite(annualVolPct)) {
            return 20.0;
        }
        if (annualVolPct < 15.0) {
            return 100.0;
        }
        if (annualVolPct < 25.0) {
            return 80.0;
        }
        if (annualVolPct < 40.0) {
            return 60.0;
        }
        if (annualVolPct < 60.0) {
            return 40.0;
        }
        return 20.0;
    }

    /**
     * Sector momentum score per sector: 50 + 500 x mean 20-day return of the sector's stocks in {@code inputs}.
     */
    public static Map<String, Double> sectorMomentum(List<ScoringInput> inputs) {
        Map<String, double[]> acc = new HashMap<>();
        for (ScoringInput input : inputs) {
            double r = input.technical.return20dPct;
            double[] slot = acc.computeIfAbsent(input.candidate.sector, k -> new double[2]);
            slot[0] += Double.isFinite(r) ? r / 100.0 : 0.0;
            slot[1] += 1.0;
        }
        Map<String, Double> out = new HashMap<>();
        for (Map.Entry<String, double[]> entry : acc.entrySet()) {
            double mean = entry.getValue()[0] / entry.getValue()[1];
            out.put(entry.getKey(), clip(50.0 + 500.0 * mean));
        }
        return out;
    }

    public static ScoringSummary summarize(List<ScoredOpportunity> scored) {
        int high = 0;
        int medium = 0;
        int low = 0;
        double sum = 0.0;
        for (ScoredOpportunity s : scored) {
            sum += s.opportunityScore;
            if (s.opportunityScore >= ScoringSummary.HIGH_SCORE) {
                high++;
            } else if (s.opportunityScore >= ScoringSummary.MEDIUM_SCORE) {
                medium++;
            } else {
                low++;
            }
        }
        double avg = scored.isEmpty() ? 0.0 : sum / scored.size();
        return new ScoringSummary(scored.size(), high, medium, low, avg);
    }

    /**
     * Rows scoring at least {@code minScore}, best first, at most {@code limit}.
     */
    public static List<ScoredOpportunity> topOpportunities(List<ScoredOpportunity> scored, double minScore, int limit) {
        List<ScoredOpportunity> out = new ArrayList<>();
        for (ScoredOpportunity s : scored) {
            if (s.opportunityScore >= minScore) {
                out.add(s);
            }
        }
        out.sort(Comparator.comparingDouble((ScoredOpportunity s) -> s.opportunityScore).reversed()
                .thenComparing(s -> s.symbol));
        return out.size() > limit ? new ArrayList<>(out.subList(0, Math.max(0, limit))) : out;
    }

    static double clip(double value) {
        if (!Double.isFinite(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(100.0, value));
    }
}
