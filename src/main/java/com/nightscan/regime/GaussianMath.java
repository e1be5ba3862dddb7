package com.nightscan.regime;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Shared pieces of the diagonal-Gaussian state models.
 */
final class GaussianMath {
    static final double VARIANCE_FLOOR = 1e-3;
    static final double MIN_STATE_WEIGHT = 1e-6;
    private static final double LOG_2PI = Math.log(2.0 * Math.PI);

    private GaussianMath() {
    }

    static double logDensity(double[] x, double[] mean, double[] var) {
        double acc = 0.0;
        for (int d = 0; d < x.length; d++) {
            double diff = x[d] - mean[d];
            acc += LOG_2PI + Math.log(var[d]) + diff * diff / var[d];
        }
        return -0.5 * acc;
    }

    /**
     * Initial means and variances from equal-size groups of rows ordered by {@code sortColumn}; deterministic.
     */
    static double[][][] quantileInit(double[][] x, int states, int sortColumn) {
        int n = x.length;
        int dims = x[0].length;
        Integer[] order = new Integer[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingDouble(i -> x[i][sortColumn]));
        double[][] means = new double[states][dims];
        double[][] vars = new double[states][dims];
        for (int k = 0; k < states; k++) {
            int from = k * n / states;
            int to = Math.max(from + 1, (k + 1) * n / states);
            int count = to - from;
            for (int r = from; r < to; r++) {
                for (int d = 0; d < dims; d++) {
                    means[k][d] += x[order[r]][d] / count;
                }
            }
            for (int r = from; r < to; r++) {
                for (int d = 0; d < dims; d++) {
                    double diff = x[order[r]][d] - means[k][d];
                    vars[k][d] += diff * diff / count;
                }
            }
            for (int d = 0; d < dims; d++) {
                vars[k][d] = Math.max(VARIANCE_FLOOR, vars[k][d]);
            }
        }
        return new double[][][]{means, vars};
    }

    /**
     * Weighted means and floored variances; false when a state has (almost) no weight.
     */
    static boolean reestimate(double[][] x, double[][] weights, double[][] means, double[][] vars) {
        int states = means.length;
        int dims = x[0].length;
        for (int k = 0; k < states; k++) {
            double total = 0.0;
            double[] mean = new double[dims];
            for (int t = 0; t < x.length; t++) {
                total += weights[t][k];
                for (int d = 0; d < dims; d++) {
                    mean[d] += weights[t][k] * x[t][d];
                }
            }
            if (!(total > MIN_STATE_WEIGHT)) {
                return false;
            }
            double[] var = new double[dims];
            for (int d = 0; d < dims; d++) {
                mean[d] /= total;
            }
            for (int t = 0; t < x.length; t++) {
                for (int d = 0; d < dims; d++) {
                    double diff = x[t][d] - mean[d];
                    var[d] += weights[t][k] * diff * diff;
                }
            }
            for (int d = 0; d < dims; d++) {
                var[d] = Math.max(VARIANCE_FLOOR, var[d] / total);
            }
            means[k] = mean;
            vars[k] = var;
        }
        return true;
    }

    static boolean converged(double logLik, double previous, double tol) {
        return Math.abs(logLik - previous) < tol * Math.max(1.0, Math.abs(logLik));
    }

    static boolean allFinite(double[][] values) {
        for (double[] row : values) {
            for (double v : row) {
                if (!Double.isFinite(v)) {
                    return false;
                }
            }
        }
        return true;
    }
}
