package com.nightscan.regime;

import com.nightscan.model.FitMethod;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Optional;

/**
 * 模块说明：GaussianHmm（class）。
 * 主要职责：对角协方差高斯隐马尔可夫模型，Baum-Welch 训练（带缩放的前向后向算法）。
 * 使用建议：初始化按波动列分位数分组，结果可复现；未收敛或出现空状态时返回 empty，由调用方回退。
 */
public final class GaussianHmm implements RegimeClassifier {
    private static final Logger LOG = LogManager.getLogger(GaussianHmm.class);

    private final int maxIterations;
    private final double tolerance;
    private final int sortColumn;

    public GaussianHmm(int maxIterations, double tolerance, int sortColumn) {
        this.maxIterations = Math.max(1, maxIterations);
        this.tolerance = tolerance;
        this.sortColumn = sortColumn;
    }

    @Override
    public String name() {
        return "hmm";
    }

    @Override
    public Optional<RegimeFit> fit(double[][] x, int states) {
        int n = x.length;
        if (states < 2 || n < states * 5) {
            return Optional.empty();
        }
        double[][][] init = GaussianMath.quantileInit(x, states, sortColumn);
        double[][] means = init[0];
        double[][] vars = init[1];
        double[] start = new double[states];
        double[][] trans = new double[states][states];
        for (int i = 0; i < states; i++) {
            start[i] = 1.0 / states;
            for (int j = 0; j < states; j++) {
                trans[i][j] = i == j ? 0.9 : 0.1 / (states - 1);
            }
        }

        double previous = Double.NEGATIVE_INFINITY;
        for (int iter = 1; iter <= maxIterations; iter++) {
            Pass pass = forwardBackward(x, start, trans, means, vars);
            if (!Double.isFinite(pass.logLikelihood)) {
                LOG.debug("hmm log-likelihood not finite at iteration {}", iter);
                return Optional.empty();
            }
            boolean done = iter > 1 && GaussianMath.converged(pass.logLikelihood, previous, tolerance);
            if (done) {
                return Optional.of(new RegimeFit(FitMethod.HMM, means, pass.alpha[n - 1].clone(), pass.logLikelihood, iter));
            }
            previous = pass.logLikelihood;

            for (int i = 0; i < states; i++) {
                start[i] = pass.gamma[0][i];
                double from = 0.0;
                for (int t = 0; t < n - 1; t++) {
                    from += pass.gamma[t][i];
                }
                if (!(from > GaussianMath.MIN_STATE_WEIGHT)) {
                    return Optional.empty();
                }
                for (int j = 0; j < states; j++) {
                    trans[i][j] = pass.xi[i][j] / from;
                }
            }
            if (!GaussianMath.reestimate(x, pass.gamma, means, vars) || !GaussianMath.allFinite(means)) {
                LOG.debug("hmm state collapsed at iteration {}", iter);
                return Optional.empty();
            }
        }
        LOG.debug("hmm did not converge in {} iterations", maxIterations);
        return Optional.empty();
    }

    private static Pass forwardBackward(double[][] x, double[] start, double[][] trans, double[][] means, double[][] vars) {
        int n = x.length;
        int states = start.length;
        double[][] emit = new double[n][states];
        double[] shift = new double[n];
        for (int t = 0; t < n; t++) {
            double max = Double.NEGATIVE_INFINITY;
            for (int k = 0; k < states; k++) {
                emit[t][k] = GaussianMath.logDensity(x[t], means[k], vars[k]);
                max = Math.max(max, emit[t][k]);
            }
            shift[t] = max;
            for (int k = 0; k < states; k++) {
                emit[t][k] = Math.exp(emit[t][k] - max);
            }
        }

        double[][] alpha = new double[n][states];
        double[] scale = new double[n];
        double logLik = 0.0;
        for (int t = 0; t < n; t++) {
            double sum = 0.0;
            for (int j = 0; j < states; j++) {
                double prior;
                if (t == 0) {
                    prior = start[j];
                } else {
                    prior = 0.0;
                    for (int i = 0; i < states; i++) {
                        prior += alpha[t - 1][i] * trans[i][j];
                    }
                }
                alpha[t][j] = prior * emit[t][j];
                sum += alpha[t][j];
            }
            if (!(sum > 0)) {
                return new Pass(alpha, null, null, Double.NaN);
            }
            for (int j = 0; j < states; j++) {
                alpha[t][j] /= sum;
            }
            scale[t] = sum;
            logLik += Math.log(sum) + shift[t];
        }

        double[][] beta = new double[n][states];
        for (int k = 0; k < states; k++) {
            beta[n - 1][k] = 1.0;
        }
        for (int t = n - 2; t >= 0; t--) {
            for (int i = 0; i < states; i++) {
                double acc = 0.0;
                for (int j = 0; j < states; j++) {
                    acc += trans[i][j] * emit[t + 1][j] * beta[t + 1][j];
                }
                beta[t][i] = acc / scale[t + 1];
            }
        }

        double[][] gamma = new double[n][states];
        for (int t = 0; t < n; t++) {
            double sum = 0.0;
            for (int k = 0; k < states; k++) {
                gamma[t][k] = alpha[t][k] * beta[t][k];
                sum += gamma[t][k];
            }
            for (int k = 0; k < states; k++) {
                gamma[t][k] = sum > 0 ? gamma[t][k] / sum : 1.0 / states;
            }
        }

        double[][] xi = new double[states][states];
        for (int t = 0; t < n - 1; t++) {
            for (int i = 0; i < states; i++) {
                for (int j = 0; j < states; j++) {
                    xi[i][j] += alpha[t][i] * trans[i][j] * emit[t + 1][j] * beta[t + 1][j] / scale[t + 1];
                }
            }
        }
        return new Pass(alpha, gamma, xi, logLik);
    }

    private static final class Pass {
        final double[][] alpha;
        final double[][] gamma;
        final double[][] xi;
        final double logLikelihood;

        Pass(double[][] alpha, double[][] gamma, double[][] xi, double logLikelihood) {
            this.alpha = alpha;
            this.gamma = gamma;
            this.xi = xi;
            this.logLikelihood = logLikelihood;
        }
    }
}
