package com.nightscan.regime;

import com.nightscan.model.FitMethod;

/**
 * A fitted state model: per-state feature means (in the fitted feature space) and the state probabilities of the
 * last observation.
 */
public final class RegimeFit {
    public final FitMethod method;
    public final double[][] means;
    public final double[] lastProbabilities;
    public final double logLikelihood;
    public final int iterations;

    public RegimeFit(FitMethod method, double[][] means, double[] lastProbabilities, double logLikelihood, int iterations) {
        this.method = method;
        this.means = means;
        this.lastProbabilities = lastProbabilities;
        this.logLikelihood = logLikelihood;
        this.iterations = iterations;
    }

    public int stateCount() {
        return lastProbabilities.length;
    }
}
