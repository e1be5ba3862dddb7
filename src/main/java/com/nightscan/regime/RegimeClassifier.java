package com.nightscan.regime;

import java.util.Optional;

/**
 * Unsupervised state model over a feature matrix {@code x[row][feature]}.
 * Returns empty when the fit does not converge or degenerates, so the caller can fall back.
 */
public interface RegimeClassifier {

    Optional<RegimeFit> fit(double[][] x, int states);

    String name();
}
