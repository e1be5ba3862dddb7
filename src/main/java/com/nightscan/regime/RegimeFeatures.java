package com.nightscan.regime;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Daily regime features built from aligned index, volatility-proxy and FX closes. Rows that still contain a NaN
 * after the rolling windows fill up are dropped.
 */
public final class RegimeFeatures {
    public static final int RET_INDEX = 0;
    public static final int RET_FX = 1;
    public static final int VOL_LEVEL = 2;
    public static final int VOL_CHANGE = 3;
    public static final int REALIZED_VOL_10D = 4;
    public static final List<String> NAMES = List.of("ret_index", "ret_fx", "vol_level", "vol_change", "realized_vol_10d");

    static final int PROXY_WINDOW = 20;
    static final int REALIZED_WINDOW = 10;

    public final List<LocalDate> dates;
    public final double[][] rows;

    private RegimeFeatures(List<LocalDate> dates, double[][] rows) {
        this.dates = dates;
        this.rows = rows;
    }

    public int size() {
        return rows.length;
    }

    public double[] column(int index) {
        double[] out = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            out[i] = rows[i][index];
        }
        return out;
    }

    /**
     * @param volClose volatility-proxy level per row, or null to derive it from 20-day realized index volatility
     * @param fxClose FX closes per row, or null for a zero FX return
     */
    public static RegimeFeatures build(List<LocalDate> dates, double[] indexClose, double[] volClose, double[] fxClose) {
        int n = indexClose.length;
        double[] vol = volClose == null ? null : forwardFill(volClose);
        double[] fx = fxClose == null ? null : forwardFill(fxClose);

        double[] retIndex = new double[n];
        double[] retFx = new double[n];
        double[] volLevel = new double[n];
        for (int t = 0; t < n; t++) {
            retIndex[t] = t == 0 ? Double.NaN : pctChange(indexClose[t - 1], indexClose[t]);
            retFx[t] = fx == null ? (t == 0 ? Double.NaN : 0.0) : (t == 0 ? Double.NaN : pctChange(fx[t - 1], fx[t]));
        }
        for (int t = 0; t < n; t++) {
            volLevel[t] = vol == null
                    ? rollingStd(retIndex, t, PROXY_WINDOW) * Math.sqrt(252.0) * 100.0
                    : vol[t];
        }

        List<LocalDate> keptDates = new ArrayList<>();
        List<double[]> kept = new ArrayList<>();
        for (int t = 0; t < n; t++) {
            double volChange = t == 0 ? Double.NaN : pctChange(volLevel[t - 1], volLevel[t]);
            double realized = rollingStd(retIndex, t, REALIZED_WINDOW) * Math.sqrt(252.0);
            double[] row = {retIndex[t], retFx[t], volLevel[t], volChange, realized};
            if (allFinite(row)) {
                kept.add(row);
                keptDates.add(dates.get(t));
            }
        }
        return new RegimeFeatures(keptDates, kept.toArray(new double[0][]));
    }

    /**
     * Column-wise z-scores; a constant column becomes all zeros.
     */
    public static double[][] standardize(double[][] x) {
        int n = x.length;
        int dims = n == 0 ? 0 : x[0].length;
        double[][] out = new double[n][dims];
        for (int d = 0; d < dims; d++) {
            double mean = 0.0;
            for (double[] row : x) {
                mean += row[d];
            }
            mean /= n;
            double var = 0.0;
            for (double[] row : x) {
                double diff = row[d] - mean;
                var += diff * diff;
            }
            double std = Math.sqrt(var / n);
            for (int t = 0; t < n; t++) {
                out[t][d] = std > 1e-12 ? (x[t][d] - mean) / std : 0.0;
            }
        }
        return out;
    }

    private static double pctChange(double prev, double current) {
        if (!Double.isFinite(prev) || !Double.isFinite(current) || prev == 0.0) {
            return Double.NaN;
        }
        return current / prev - 1.0;
    }

    /**
     * Sample standard deviation of {@code values[t - window + 1 .. t]}; NaN until the window is full of finite values.
     */
    static double rollingStd(double[] values, int t, int window) {
        if (t - window + 1 < 0) {
            return Double.NaN;
        }
        double mean = 0.0;
        for (int i = t - window + 1; i <= t; i++) {
            if (!Double.isFinite(values[i])) {
                return Double.NaN;
            }
            mean += values[i];
        }
        mean /= window;
        double acc = 0.0;
        for (int i = t - window + 1; i <= t; i++) {
            double d = values[i] - mean;
            acc += d * d;
        }
        return Math.sqrt(acc / (window - 1));
    }

    private static double[] forwardFill(double[] values) {
        double[] out = values.clone();
        for (int i = 1; i < out.length; i++) {
            if (!Double.isFinite(out[i])) {
                out[i] = out[i - 1];
            }
        }
        return out;
    }

    private static boolean allFinite(double[] row) {
        for (double v : row) {
            if (!Double.isFinite(v)) {
                return false;
            }
        }
        return true;
    }
}
