package com.nightscan.indicator;

import com.nightscan.model.PriceSeries;
import com.nightscan.model.TechnicalSnapshot;

/**
 * 模块说明：IndicatorEngine（class）。
 * 主要职责：由日线序列计算技术基线与评分所需的指标快照。
 * 使用建议：历史不足的指标返回中性值（均线取最新收盘价，RSI 取 50），调用方通过 barCount 判断可信度。
 */
public final class IndicatorEngine {

    public TechnicalSnapshot compute(PriceSeries series) {
        double[] closes = series.closes();
        double[] volumes = series.volumes();
        int size = closes.length;
        if (size == 0) {
            return TechnicalSnapshot.builder().rsi14(50.0).build();
        }
        double lastClose = closes[size - 1];
        double sma20 = sma(closes, 20, lastClose);
        double std20 = std(closes, 20);
        return TechnicalSnapshot.builder()
                .barCount(size)
                .lastClose(lastClose)
                .sma10(sma(closes, 10, lastClose))
                .sma20(sma20)
                .sma30(sma(closes, 30, lastClose))
                .sma50(sma(closes, 50, lastClose))
                .rsi14(rsi(closes, 14))
                .return5dPct(returnPct(closes, 5))
                .return20dPct(returnPct(closes, 20))
                .pctFromSma20(sma20 <= 0 ? 0.0 : (lastClose - sma20) / sma20 * 100.0)
                .zFromSma20(std20 <= 0 ? 0.0 : (lastClose - sma20) / std20)
                .volatility20Pct(volatilityPct(closes, 20))
                .avgVolume20(sma(volumes, 20, volumes[size - 1]))
                .build();
    }

    /**
     * Simple moving average of the last {@code period} values; with fewer values the mean of what exists,
     * and {@code fallback} for an empty array.
     */
    public static double sma(double[] values, int period, double fallback) {
        if (values.length == 0 || period <= 0) {
            return fallback;
        }
        int start = Math.max(0, values.length - period);
        double sum = 0.0;
        for (int i = start; i < values.length; i++) {
            sum += values[i];
        }
        return sum / (values.length - start);
    }

    /**
     * Wilder RSI; 50 when there is not enough history.
     */
    public static double rsi(double[] closes, int period) {
        if (closes.length <= period) {
            return 50.0;
        }
        double gain = 0.0;
        double loss = 0.0;
        for (int i = 1; i <= period; i++) {
            double diff = closes[i] - closes[i - 1];
            if (diff >= 0) {
                gain += diff;
            } else {
                loss -= diff;
            }
        }
        double avgGain = gain / period;
        double avgLoss = loss / period;

        for (int i = period + 1; i < closes.length; i++) {
            double diff = closes[i] - closes[i - 1];
            double currentGain = diff > 0 ? diff : 0.0;
            double currentLoss = diff < 0 ? -diff : 0.0;
            avgGain = (avgGain * (period - 1) + currentGain) / period;
            avgLoss = (avgLoss * (period - 1) + currentLoss) / period;
        }
        if (avgLoss == 0.0) {
            return avgGain == 0.0 ? 50.0 : 100.0;
        }
        double rs = avgGain / avgLoss;
        return 100.0 - (100.0 / (1.0 + rs));
    }

    /**
     * Annualised close-to-close volatility in percent over the last {@code period} returns.
     */
    public static double volatilityPct(double[] closes, int period) {
        if (closes.length < 3) {
            return 0.0;
        }
        int start = Math.max(1, closes.length - period);
        int count = closes.length - start;
        double[] returns = new double[count];
        for (int i = start; i < closes.length; i++) {
            double prev = closes[i - 1];
            returns[i - start] = prev == 0.0 ? 0.0 : closes[i] / prev - 1.0;
        }
        double mean = 0.0;
        for (double r : returns) {
            mean += r;
        }
        mean /= count;
        double var = 0.0;
        for (double r : returns) {
            double d = r - mean;
            var += d * d;
        }
        var /= count;
        return Math.sqrt(var) * Math.sqrt(252.0) * 100.0;
    }

    public static double returnPct(double[] closes, int days) {
        if (closes.length <= days) {
            return closes.length < 2 ? 0.0 : (closes[closes.length - 1] / closes[0] - 1.0) * 100.0;
        }
        double prev = closes[closes.length - 1 - days];
        if (prev == 0.0) {
            return 0.0;
        }
        return (closes[closes.length - 1] - prev) / prev * 100.0;
    }

    private static double std(double[] values, int period) {
        if (values.length < 2) {
            return 0.0;
        }
        int start = Math.max(0, values.length - period);
        int n = values.length - start;
        double mean = 0.0;
        for (int i = start; i < values.length; i++) {
            mean += values[i];
        }
        mean /= n;
        double var = 0.0;
        for (int i = start; i < values.length; i++) {
            double d = values[i] - mean;
            var += d * d;
        }
        return Math.sqrt(var / n);
    }
}
