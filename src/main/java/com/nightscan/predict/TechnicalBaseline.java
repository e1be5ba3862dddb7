package com.nightscan.predict;

import com.nightscan.indicator.IndicatorEngine;
import com.nightscan.model.ModelSignal;
import com.nightscan.model.PriceSeries;
import com.nightscan.model.TechnicalSnapshot;

/**
 * 模块说明：TechnicalBaseline（class）。
 * 主要职责：仅依赖价格历史的基线模型，由动量、均值回归与均线交叉三票取平均得到方向。
 * 使用建议：始终可用；置信度 = 三票一致度 × 历史覆盖度，因此随输入数据变化。
 */
public final class TechnicalBaseline {
    static final int FULL_COVERAGE_BARS = 60;

    private final IndicatorEngine indicators;

    public TechnicalBaseline(IndicatorEngine indicators) {
        this.indicators = indicators;
    }

    public ModelSignal evaluate(PriceSeries history) {
        if (history == null || history.size() < 2) {
            return new ModelSignal(0.0, 0.0);
        }
        TechnicalSnapshot snap = indicators.compute(history);
        double momentum = tanh(snap.return20dPct / 10.0);
        double rsiVote = -(snap.rsi14 - 50.0) / 50.0;
        double zVote = -tanh(snap.zFromSma20 / 2.0);
        double meanReversion = 0.5 * (rsiVote + zVote);
        double crossover = snap.sma30 > 0 ? tanh((snap.sma10 / snap.sma30 - 1.0) * 20.0) : 0.0;

        double direction = (momentum + meanReversion + crossover) / 3.0;
        double agreement = agreement(momentum, meanReversion, crossover);
        double coverage = Math.min(1.0, (double) history.size() / FULL_COVERAGE_BARS);
        return new ModelSignal(direction, agreement * coverage);
    }

    /**
     * Share of votes pointing the same way as their sum, weighted by how decisive they are.
     */
    static double agreement(double... votes) {
        double sum = 0.0;
        double absSum = 0.0;
        for (double v : votes) {
            sum += v;
            absSum += Math.abs(v);
        }
        if (absSum <= 1e-12) {
            return 0.0;
        }
        return Math.abs(sum) / absSum * Math.min(1.0, absSum / votes.length * 2.0);
    }

    private static double tanh(double x) {
        return Double.isFinite(x) ? Math.tanh(x) : 0.0;
    }
}
