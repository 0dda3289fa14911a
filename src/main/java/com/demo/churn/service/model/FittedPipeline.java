package com.demo.churn.service.model;

/**
 * Median imputation, standardization and logistic regression weights fit on one population.
 * Lives for a single scoring run.
 */
public final class FittedPipeline {

    private final double[] medians;
    private final double[] means;
    private final double[] scales;
    private final double[] coefficients;
    private final double intercept;

    FittedPipeline(double[] medians, double[] means, double[] scales, double[] coefficients, double intercept) {
        this.medians = medians.clone();
        this.means = means.clone();
        this.scales = scales.clone();
        this.coefficients = coefficients.clone();
        this.intercept = intercept;
    }

    public double[] getMedians() {
        return medians.clone();
    }

    public double[] getMeans() {
        return means.clone();
    }

    public double[] getScales() {
        return scales.clone();
    }

    public double[] getCoefficients() {
        return coefficients.clone();
    }

    public double getIntercept() {
        return intercept;
    }

    public int featureCount() {
        return coefficients.length;
    }

    /** Imputes then standardizes a raw matrix. Columns with zero scale come out as 0. */
    public double[][] transform(double[][] raw) {
        double[][] out = new double[raw.length][];
        for (int i = 0; i < raw.length; i++) {
            out[i] = transformRow(raw[i]);
        }
        return out;
    }

    public double[] transformRow(double[] raw) {
        double[] z = new double[raw.length];
        for (int j = 0; j < raw.length; j++) {
            double v = Double.isNaN(raw[j]) ? medians[j] : raw[j];
            z[j] = (v - means[j]) / scales[j];
        }
        return z;
    }

    public double decision(double[] z) {
        double s = intercept;
        for (int j = 0; j < z.length; j++) s += coefficients[j] * z[j];
        return s;
    }

    public double probability(double[] z) {
        return sigmoid(decision(z));
    }

    static double sigmoid(double t) {
        if (t >= 0) {
            return 1.0 / (1.0 + Math.exp(-t));
        }
        double e = Math.exp(t);
        return e / (1.0 + e);
    }
}
