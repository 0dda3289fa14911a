package com.demo.churn.service.explain;

import com.demo.churn.service.model.FittedPipeline;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.Random;

/**
 * Additive attribution for a linear model with independent features:
 * {@code phi[i][j] = w[j] * (z[i][j] - E_bg[z[j]])}, the expectation taken over a
 * bounded background sample of the standardized population.
 */
@Slf4j
final class LinearAttribution {

    static final long BACKGROUND_SEED = 42L;

    private final int backgroundCap;

    LinearAttribution(int backgroundCap) {
        this.backgroundCap = backgroundCap;
    }

    /** Empty when attribution cannot be computed for this population. */
    Optional<double[][]> contributions(FittedPipeline pipeline, double[][] z) {
        if (z.length == 0 || backgroundCap <= 0) {
            return Optional.empty();
        }
        double[] coef = pipeline.getCoefficients();
        double[] baseline = backgroundMean(z, backgroundIndices(z.length));

        double[][] phi = new double[z.length][coef.length];
        for (int i = 0; i < z.length; i++) {
            for (int j = 0; j < coef.length; j++) {
                double v = coef[j] * (z[i][j] - baseline[j]);
                if (!Double.isFinite(v)) {
                    log.debug("Non-finite attribution at row {}, feature {}", i, j);
                    return Optional.empty();
                }
                phi[i][j] = v;
            }
        }
        return Optional.of(phi);
    }

    /** Weight times standardized value, used when attribution is unavailable. */
    static double[] approximate(FittedPipeline pipeline, double[] zRow) {
        double[] coef = pipeline.getCoefficients();
        double[] out = new double[coef.length];
        for (int j = 0; j < coef.length; j++) out[j] = zRow[j] * coef[j];
        return out;
    }

    int[] backgroundIndices(int n) {
        int size = Math.min(n, backgroundCap);
        int[] idx = new int[n];
        for (int i = 0; i < n; i++) idx[i] = i;
        if (size == n) return idx;

        // Partial Fisher-Yates: the first `size` slots end up a uniform sample without replacement.
        Random rng = new Random(BACKGROUND_SEED);
        for (int i = 0; i < size; i++) {
            int k = i + rng.nextInt(n - i);
            int tmp = idx[i];
            idx[i] = idx[k];
            idx[k] = tmp;
        }
        int[] out = new int[size];
        System.arraycopy(idx, 0, out, 0, size);
        return out;
    }

    private static double[] backgroundMean(double[][] z, int[] rows) {
        int p = z[0].length;
        double[] mean = new double[p];
        for (int r : rows) {
            for (int j = 0; j < p; j++) mean[j] += z[r][j];
        }
        for (int j = 0; j < p; j++) mean[j] /= rows.length;
        return mean;
    }
}
