package com.nightscan.predict;

import com.nightscan.config.Config;
import com.nightscan.indicator.IndicatorEngine;
import com.nightscan.model.DirectionForecast;
import com.nightscan.model.PriceBar;
import com.nightscan.model.PriceSeries;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 模块说明：LogisticDirectionModel（class）。
 * 主要职责：按标的拟合逻辑回归，预测次日收盘上涨概率 p，方向 = 2p - 1，置信度综合 |2p - 1| 与样本内准确率。
 * 使用建议：refresh 负责训练并缓存，predict 只使用已训练模型；历史少于最小天数时不训练。
 */
public final class LogisticDirectionModel implements DirectionModel {
    private static final Logger LOG = LogManager.getLogger(LogisticDirectionModel.class);
    static final int WARMUP = 20;
    static final int FEATURES = 6;

    private final int minHistory;
    private final int epochs;
    private final double learningRate;
    private final double l2;
    private final Map<String, Fitted> fitted = new ConcurrentHashMap<>();

    public LogisticDirectionModel(Config config) {
        this(config.getInt("predict.min_history_days"),
                config.getInt("predict.direction.epochs"),
                config.getDouble("predict.direction.learning_rate"),
                config.getDouble("predict.direction.l2"));
    }

    public LogisticDirectionModel(int minHistory, int epochs, double learningRate, double l2) {
        this.minHistory = Math.max(WARMUP + 10, minHistory);
        this.epochs = Math.max(1, epochs);
        this.learningRate = learningRate;
        this.l2 = Math.max(0.0, l2);
    }

    @Override
    public String name() {
        return "logistic_direction";
    }

    @Override
    public boolean refresh(String symbol, PriceSeries history) {
        if (history == null || history.size() < minHistory) {
            fitted.remove(symbol);
            return false;
        }
        double[] closes = history.closes();
        int rows = closes.length - 1 - WARMUP;
        double[][] x = new double[rows][];
        double[] y = new double[rows];
        for (int i = 0; i < rows; i++) {
            int t = WARMUP + i;
            x[i] = features(closes, t);
            y[i] = closes[t + 1] > closes[t] ? 1.0 : 0.0;
        }
        double[] mean = new double[FEATURES];
        double[] std = new double[FEATURES];
        standardize(x, mean, std);

        double[] w = new double[FEATURES];
        double b = 0.0;
        for (int epoch = 0; epoch < epochs; epoch++) {
            double[] grad = new double[FEATURES];
            double gradB = 0.0;
            for (int i = 0; i < rows; i++) {
                double err = sigmoid(dot(w, x[i]) + b) - y[i];
                for (int d = 0; d < FEATURES; d++) {
                    grad[d] += err * x[i][d];
                }
                gradB += err;
            }
            for (int d = 0; d < FEATURES; d++) {
                w[d] -= learningRate * (grad[d] / rows + l2 * w[d]);
            }
            b -= learningRate * gradB / rows;
        }
        if (!allFinite(w) || !Double.isFinite(b)) {
            fitted.remove(symbol);
            LOG.warn("Direction model diverged symbol={}", symbol);
            return false;
        }
        int correct = 0;
        for (int i = 0; i < rows; i++) {
            boolean up = sigmoid(dot(w, x[i]) + b) >= 0.5;
            if (up == (y[i] > 0.5)) {
                correct++;
            }
        }
        double accuracy = (double) correct / rows;
        fitted.put(symbol, new Fitted(w, b, mean, std, accuracy, history.last().date.toString(), rows));
        LOG.debug("Direction model fitted symbol={} rows={} accuracy={}", symbol, rows, accuracy);
        return true;
    }

    @Override
    public DirectionForecast predict(String symbol, PriceSeries history) {
        if (history == null || history.size() < minHistory) {
            return DirectionForecast.untrained(false, "history below " + minHistory + " days");
        }
        Fitted model = fitted.get(symbol);
        if (model == null) {
            return DirectionForecast.untrained(true, "no trained model");
        }
        double[] closes = history.closes();
        double[] x = features(closes, closes.length - 1);
        for (int d = 0; d < FEATURES; d++) {
            x[d] = (x[d] - model.mean[d]) / model.std[d];
        }
        double p = sigmoid(dot(model.weights, x) + model.bias);
        double direction = 2.0 * p - 1.0;
        double confidence = 0.5 * Math.abs(direction) + 0.5 * Math.max(0.0, 2.0 * model.accuracy - 1.0);
        PriceBar last = history.last();
        double predictedPrice = last.close * (1.0 + direction * meanAbsReturn(closes, 20));
        return new DirectionForecast(true, true, direction, Math.min(1.0, confidence), predictedPrice,
                last.date.plusDays(1), "fitted on " + model.rows + " rows through " + model.trainedThrough);
    }

    boolean hasModel(String symbol) {
        return fitted.containsKey(symbol);
    }

    /**
     * 1d, 5d and 20d returns, RSI-14 scaled to [-1, 1], distance from SMA-20 and 10-day return volatility at {@code t}.
     */
    static double[] features(double[] closes, int t) {
        double[] upTo = Arrays.copyOfRange(closes, 0, t + 1);
        double sma20 = IndicatorEngine.sma(upTo, 20, closes[t]);
        return new double[]{
                ret(closes, t, 1),
                ret(closes, t, 5),
                ret(closes, t, 20),
                (IndicatorEngine.rsi(Arrays.copyOfRange(upTo, Math.max(0, upTo.length - 60), upTo.length), 14) - 50.0) / 50.0,
                sma20 > 0 ? closes[t] / sma20 - 1.0 : 0.0,
                IndicatorEngine.volatilityPct(Arrays.copyOfRange(upTo, Math.max(0, upTo.length - 11), upTo.length), 10) / 100.0
        };
    }

    private static double ret(double[] closes, int t, int days) {
        int from = Math.max(0, t - days);
        return closes[from] > 0 ? closes[t] / closes[from] - 1.0 : 0.0;
    }

    private static void standardize(double[][] x, double[] mean, double[] std) {
        int rows = x.length;
        for (int d = 0; d < FEATURES; d++) {
            double m = 0.0;
            for (double[] row : x) {
                m += row[d];
            }
            m /= rows;
            double v = 0.0;
            for (double[] row : x) {
                v += (row[d] - m) * (row[d] - m);
            }
            double s = Math.sqrt(v / rows);
            mean[d] = m;
            std[d] = s > 1e-12 ? s : 1.0;
            for (double[] row : x) {
                row[d] = (row[d] - m) / std[d];
            }
        }
    }

    private static double meanAbsReturn(double[] closes, int window) {
        int start = Math.max(1, closes.length - window);
        double acc = 0.0;
        int n = 0;
        for (int i = start; i < closes.length; i++) {
            if (closes[i - 1] > 0) {
                acc += Math.abs(closes[i] / closes[i - 1] - 1.0);
                n++;
            }
        }
        return n == 0 ? 0.0 : acc / n;
    }

    private static double sigmoid(double z) {
        return 1.0 / (1.0 + Math.exp(-z));
    }

    private static double dot(double[] a, double[] b) {
        double acc = 0.0;
        for (int i = 0; i < a.length; i++) {
            acc += a[i] * b[i];
        }
        return acc;
    }

    private static boolean allFinite(double[] values) {
        for (double v : values) {
            if (!Double.isFinite(v)) {
                return false;
            }
        }
        return true;
    }

    private static final class Fitted {
        final double[] weights;
        final double bias;
        final double[] mean;
        final double[] std;
        final double accuracy;
        final String trainedThrough;
        final int rows;

        Fitted(double[] weights, double bias, double[] mean, double[] std, double accuracy, String trainedThrough, int rows) {
            this.weights = weights;
            this.bias = bias;
            this.mean = mean;
            this.std = std;
            this.accuracy = accuracy;
            this.trainedThrough = trainedThrough;
            this.rows = rows;
        }
    }
}
