package com.demo.churn.service.model;

import java.util.Optional;

/**
 * Output of one fit + predict pass.
 *
 * @param predictedLabels 1 when the churn probability is at least 0.5
 * @param probabilities   churn probability per row
 * @param pipeline        fitted pipeline, absent when no labels were available to train on
 */
public record ModelRun(int[] predictedLabels, double[] probabilities, FittedPipeline pipeline) {

    public ModelRun {
        predictedLabels = predictedLabels.clone();
        probabilities = probabilities.clone();
    }

    @Override
    public int[] predictedLabels() {
        return predictedLabels.clone();
    }

    @Override
    public double[] probabilities() {
        return probabilities.clone();
    }

    public int predictedLabel(int row) {
        return predictedLabels[row];
    }

    public double probability(int row) {
        return probabilities[row];
    }

    public Optional<FittedPipeline> fitted() {
        return Optional.ofNullable(pipeline);
    }

    public boolean trained() {
        return pipeline != null;
    }

    public int rows() {
        return probabilities.length;
    }
}
