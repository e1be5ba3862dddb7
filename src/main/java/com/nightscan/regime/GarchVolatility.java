package com.nightscan.regime;

import com.nightscan.model.FitMethod;

import java.util.Optional;

/**
 * 模块说明：GarchVolatility（class）。
 * 主要职责：GARCH(1,1) 条件波动率，方差目标法固定 omega，在 (alpha, beta) 网格上做极大似然，再在最优点附近细化。
 * 使用建议：网格只包含 alpha + beta < MAX_PERSISTENCE 的点，拟合结果总是平稳的；
 * 样本不足或收益率方差为零时返回 empty，由 EWMA 接替。
 */
public final class GarchVolatility {
    static final double MAX_PERSISTENCE = 0.995;

    private final int minObservations;

    public GarchVolatility(int minObservations) {
        this.minObservations = Math.max(10, minObservations);
    }

    public Optional<VolatilityEstimate> forecast(double[] returns) {
        if (returns.length < minObservations) {
            return Optional.empty();
        }
        double[] r = demean(returns);
        double var0 = 0.0;
        for (double v : r) {
            var0 += v * v;
        }
        var0 /= r.length;
        if (!(var0 > 1e-16)) {
            return Optional.empty();
        }

        double[] best = {Double.NEGATIVE_INFINITY, 0.0, 0.0};
        search(r, var0, 0.02, 0.30, 0.02, 0.50, 0.98, 0.02, best);
        if (!Double.isFinite(best[0])) {
            return Optional.empty();
        }
        search(r, var0, Math.max(0.005, best[1] - 0.02), best[1] + 0.02, 0.005,
                Math.max(0.0, best[2] - 0.02), Math.min(0.99, best[2] + 0.02), 0.005, best);
        double alpha = best[1];
        double beta = best[2];
        double omega = var0 * (1.0 - alpha - beta);
        double sigma2 = var0;
        for (int t = 1; t < r.length; t++) {
            sigma2 = omega + alpha * r[t - 1] * r[t - 1] + beta * sigma2;
        }
        double next = omega + alpha * r[r.length - 1] * r[r.length - 1] + beta * sigma2;
        if (!Double.isFinite(next) || next <= 0) {
            return Optional.empty();
        }
        return Optional.of(new VolatilityEstimate(FitMethod.GARCH, next));
    }

    private static void search(double[] r, double var0, double aLo, double aHi, double aStep,
                               double bLo, double bHi, double bStep, double[] best) {
        for (double a = aLo; a <= aHi + 1e-12; a += aStep) {
            for (double b = bLo; b <= bHi + 1e-12; b += bStep) {
                if (a + b >= MAX_PERSISTENCE) {
                    continue;
                }
                double ll = logLikelihood(r, var0, a, b);
                if (ll > best[0]) {
                    best[0] = ll;
                    best[1] = a;
                    best[2] = b;
                }
            }
        }
    }

    static double logLikelihood(double[] r, double var0, double alpha, double beta) {
        double omega = var0 * (1.0 - alpha - beta);
        double sigma2 = var0;
        double ll = 0.0;
        for (int t = 0; t < r.length; t++) {
            if (t > 0) {
                sigma2 = omega + alpha * r[t - 1] * r[t - 1] + beta * sigma2;
            }
            if (!(sigma2 > 0)) {
                return Double.NEGATIVE_INFINITY;
            }
            ll += -0.5 * (Math.log(sigma2) + r[t] * r[t] / sigma2);
        }
        return ll;
    }

    private static double[] demean(double[] values) {
        double mean = 0.0;
        for (double v : values) {
            mean += v;
        }
        mean /= values.length;
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[i] - mean;
        }
        return out;
    }
}
