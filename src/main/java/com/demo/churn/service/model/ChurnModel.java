package com.demo.churn.service.model;

import com.demo.churn.service.error.TrainingException;
import com.demo.churn.service.features.FeatureMatrix;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Binary churn classifier: median imputation, standardization and class-balanced
 * logistic regression (C = 1). A new model is fit on every call.
 */
@Slf4j
@Component
public class ChurnModel {

    public static final double THRESHOLD = 0.5;
    private static final double REGULARIZATION_C = 1.0;
    private static final double TOLERANCE = 1e-4;

    private final int maxIterations;

    public ChurnModel(@Value("${churn.model.max-iterations:1000}") int maxIterations) {
        this.maxIterations = maxIterations;
    }

    /**
     * Fits on {@code labels} and scores the same matrix. Without labels every row gets
     * probability 0 and label 0, since there is nothing to train a supervised model on.
     */
    public ModelRun fitPredict(FeatureMatrix matrix, int[] labels) {
        int n = matrix.rows();
        if (labels == null) {
            log.warn("No target labels supplied; returning zero churn probability for {} rows", n);
            return new ModelRun(new int[n], new double[n], null);
        }
        if (labels.length != n) {
            throw new TrainingException("Label count " + labels.length + " does not match matrix rows " + n);
        }

        FittedPipeline pipeline = fit(matrix, labels);
        double[][] z = pipeline.transform(matrix.toArray());
        double[] proba = new double[n];
        int[] pred = new int[n];
        for (int i = 0; i < n; i++) {
            proba[i] = pipeline.probability(z[i]);
            pred[i] = proba[i] >= THRESHOLD ? 1 : 0;
        }
        return new ModelRun(pred, proba, pipeline);
    }

    FittedPipeline fit(FeatureMatrix matrix, int[] labels) {
        int n = matrix.rows();
        int p = matrix.cols();

        int positives = 0;
        for (int y : labels) {
            if (y != 0 && y != 1) {
                throw new TrainingException("Labels must be 0 or 1, got " + y);
            }
            positives += y;
        }
        if (positives == 0 || positives == n) {
            throw new TrainingException("Training labels contain a single class (" + positives
                    + " churned of " + n + " rows)");
        }

        double[] medians = new double[p];
        double[] means = new double[p];
        double[] scales = new double[p];
        for (int j = 0; j < p; j++) {
            double[] col = matrix.column(j);
            DescriptiveStatistics present = new DescriptiveStatistics();
            for (double v : col) {
                if (!Double.isNaN(v)) present.addValue(v);
            }
            medians[j] = present.getN() == 0 ? 0.0 : present.getPercentile(50);

            DescriptiveStatistics imputed = new DescriptiveStatistics();
            for (double v : col) imputed.addValue(Double.isNaN(v) ? medians[j] : v);
            means[j] = imputed.getMean();
            double sd = Math.sqrt(imputed.getPopulationVariance());
            if (!(sd > 1e-12) || !Double.isFinite(sd)) {
                log.debug("Feature {} is constant; its standardized value is fixed at 0", matrix.columns().get(j));
                sd = 1.0;
            }
            scales[j] = sd;
        }

        double[] weights = balancedWeights(labels, positives);
        FittedPipeline scaler = new FittedPipeline(medians, means, scales, new double[p], 0.0);
        double[][] z = scaler.transform(matrix.toArray());

        double[] theta = new LogisticRegressionSolver(REGULARIZATION_C, maxIterations, TOLERANCE)
                .fit(z, labels, weights);
        double[] coef = new double[p];
        System.arraycopy(theta, 0, coef, 0, p);
        log.info("Fitted churn model on {} rows ({} churned), intercept={}", n, positives, theta[p]);
        return new FittedPipeline(medians, means, scales, coef, theta[p]);
    }

    private static double[] balancedWeights(int[] labels, int positives) {
        int n = labels.length;
        double wPos = n / (2.0 * positives);
        double wNeg = n / (2.0 * (n - positives));
        double[] w = new double[n];
        for (int i = 0; i < n; i++) w[i] = labels[i] == 1 ? wPos : wNeg;
        return w;
    }
}
