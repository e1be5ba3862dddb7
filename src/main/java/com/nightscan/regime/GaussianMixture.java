package com.nightscan.regime;

import com.nightscan.model.FitMethod;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Optional;

/**
 * Diagonal Gaussian mixture fitted by EM. Used when the HMM is disabled or fails; ignores time ordering.
 */
public final class GaussianMixture implements RegimeClassifier {
    private static final Logger LOG = LogManager.getLogger(GaussianMixture.class);

    private final int maxIterations;
    private final double tolerance;
    private final int sortColumn;

    public GaussianMixture(int maxIterations, double tolerance, int sortColumn) {
        this.maxIterations = Math.max(1, maxIterations);
        this.tolerance = tolerance;
        this.sortColumn = sortColumn;
    }

    @Override
    public String name() {
        return "gmm";
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
        double[] weights = new double[states];
        for (int k = 0; k < states; k++) {
            weights[k] = 1.0 / states;
        }

        double previous = Double.NEGATIVE_INFINITY;
        double[][] resp = new double[n][states];
        for (int iter = 1; iter <= maxIterations; iter++) {
            double logLik = 0.0;
            for (int t = 0; t < n; t++) {
                double max = Double.NEGATIVE_INFINITY;
                double[] logp = new double[states];
                for (int k = 0; k < states; k++) {
                    logp[k] = Math.log(weights[k]) + GaussianMath.logDensity(x[t], means[k], vars[k]);
                    max = Math.max(max, logp[k]);
                }
                double sum = 0.0;
                for (int k = 0; k < states; k++) {
                    resp[t][k] = Math.exp(logp[k] - max);
                    sum += resp[t][k];
                }
                for (int k = 0; k < states; k++) {
                    resp[t][k] /= sum;
                }
                logLik += max + Math.log(sum);
            }
            if (!Double.isFinite(logLik)) {
                LOG.debug("gmm log-likelihood not finite at iteration {}", iter);
                return Optional.empty();
            }
            if (iter > 1 && GaussianMath.converged(logLik, previous, tolerance)) {
                return Optional.of(new RegimeFit(FitMethod.GMM, means, resp[n - 1].clone(), logLik, iter));
            }
            previous = logLik;

            for (int k = 0; k < states; k++) {
                double total = 0.0;
                for (int t = 0; t < n; t++) {
                    total += resp[t][k];
                }
                weights[k] = total / n;
            }
            if (!GaussianMath.reestimate(x, resp, means, vars) || !GaussianMath.allFinite(means)) {
                LOG.debug("gmm component collapsed at iteration {}", iter);
                return Optional.empty();
            }
        }
        LOG.debug("gmm did not converge in {} iterations", maxIterations);
        return Optional.empty();
    }
}
