package com.nightscan.regime;

import com.nightscan.model.FitMethod;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VolatilityEstimatorsTest {

    @Test
    void garch_shouldFitClusteredReturns() {
        double[] returns = garchPath(600, 2e-6, 0.10, 0.85, 42L);

        Optional<VolatilityEstimate> estimate = new GarchVolatility(60).forecast(returns);

        assertTrue(estimate.isPresent());
        assertEquals(FitMethod.GARCH, estimate.get().method);
        assertTrue(estimate.get().vol1d > 0 && Double.isFinite(estimate.get().vol1d));
        assertEquals(estimate.get().vol1d * Math.sqrt(252.0), estimate.get().volAnnual, 1e-12);
    }

    @Test
    void garch_shouldKeepStationaryFitForNearUnitRootPath() {
        double[] returns = garchPath(800, 1e-7, 0.09, 0.909, 17L);

        Optional<VolatilityEstimate> estimate = new GarchVolatility(60).forecast(returns);

        assertTrue(estimate.isPresent());
        assertEquals(FitMethod.GARCH, estimate.get().method);
        assertTrue(estimate.get().vol1d > 0 && Double.isFinite(estimate.get().vol1d));
    }

    @Test
    void garch_shouldDeclineShortOrDegenerateSamples() {
        assertTrue(new GarchVolatility(60).forecast(new double[30]).isEmpty());

        double[] flat = new double[100];
        Arrays.fill(flat, 0.001);
        assertTrue(new GarchVolatility(60).forecast(flat).isEmpty());
    }

    @Test
    void ewma_shouldMatchConstantReturnMagnitude() {
        double[] returns = new double[50];
        Arrays.fill(returns, 0.02);

        VolatilityEstimate estimate = new EwmaVolatility(0.94).forecast(returns);

        assertEquals(FitMethod.EWMA, estimate.method);
        assertEquals(0.02, estimate.vol1d, 1e-12);
    }

    @Test
    void ewma_shouldRejectLambdaOutsideUnitInterval() {
        assertThrows(IllegalArgumentException.class, () -> new EwmaVolatility(1.0));
        assertThrows(IllegalArgumentException.class, () -> new EwmaVolatility(0.0));
    }

    @Test
    void classifiers_shouldSeparateCalmAndTurbulentBlocks() {
        Random random = new Random(7L);
        double[][] x = new double[200][1];
        for (int t = 0; t < x.length; t++) {
            double scale = t < 100 ? 0.2 : 3.0;
            x[t][0] = (t < 100 ? -1.0 : 2.0) + scale * random.nextGaussian();
        }

        Optional<RegimeFit> gmm = new GaussianMixture(200, 1e-4, 0).fit(x, 2);

        assertTrue(gmm.isPresent());
        assertEquals(FitMethod.GMM, gmm.get().method);
        double total = 0.0;
        for (double p : gmm.get().lastProbabilities) {
            total += p;
        }
        assertEquals(1.0, total, 1e-6);
    }

    private static double[] garchPath(int n, double omega, double alpha, double beta, long seed) {
        Random random = new Random(seed);
        double[] out = new double[n];
        double sigma2 = omega / (1.0 - alpha - beta);
        double prev = 0.0;
        for (int t = 0; t < n; t++) {
            sigma2 = omega + alpha * prev * prev + beta * sigma2;
            prev = Math.sqrt(sigma2) * random.nextGaussian();
            out[t] = prev;
        }
        return out;
    }
}
