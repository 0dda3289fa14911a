package com.demo.churn.service.explain;

import com.demo.churn.service.features.ChurnFeature;
import com.demo.churn.service.features.FeatureMatrix;
import com.demo.churn.service.model.FittedPipeline;
import com.demo.churn.service.model.ModelRun;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.IntToDoubleFunction;

/**
 * Builds the "why" text for each scored row from per-feature contributions.
 * Explanations are best effort: a row that cannot be explained gets its fallback
 * phrase and the run carries on.
 */
@Slf4j
@Component
public class ContributionExplainer {

    public static final int MAX_REASONS = 3;
    public static final String PREDICTED_FALLBACK = "elevated churn risk across multiple signals";
    public static final String ACTUAL_FALLBACK = "observed churn within 90 days";

    private final ReasonPhraseRenderer renderer;
    private final LinearAttribution attribution;

    public ContributionExplainer(ReasonPhraseRenderer renderer,
                                 @Value("${churn.explain.background-cap:512}") int backgroundCap) {
        this.renderer = renderer;
        this.attribution = new LinearAttribution(backgroundCap);
    }

    /**
     * @param raw          the normalized matrix before imputation
     * @param actualLabels observed labels, or null when the run had none
     */
    public Explanations explain(ModelRun run, FeatureMatrix raw, int[] actualLabels) {
        int n = raw.rows();
        Optional<FittedPipeline> fitted = run.fitted();
        if (fitted.isEmpty()) {
            List<RowExplanation> none = Collections.nCopies(n, RowExplanation.none());
            return new Explanations(none, actualLabels == null ? null : none);
        }

        FittedPipeline pipeline = fitted.get();
        double[][] z = pipeline.transform(raw.toArray());
        Optional<double[][]> phi = safeContributions(pipeline, z);
        if (phi.isEmpty()) {
            log.info("Feature attribution unavailable; using weight x value contributions");
        }

        List<ChurnFeature> schema = ChurnFeature.schema();
        List<RowExplanation> predicted = new ArrayList<>(n);
        List<RowExplanation> actual = actualLabels == null ? null : new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            double[] contrib = phi.isPresent() ? phi.get()[i] : LinearAttribution.approximate(pipeline, z[i]);
            double[] rawRow = raw.row(i);
            double[] zRow = z[i];

            boolean churn = run.predictedLabel(i) == 1;
            predicted.add(explainRow(i, schema, contrib, rawRow, zRow, churn, PREDICTED_FALLBACK));

            if (actual != null) {
                actual.add(actualLabels[i] == 1
                        ? explainRow(i, schema, contrib, rawRow, zRow, true, ACTUAL_FALLBACK)
                        : RowExplanation.none());
            }
        }
        return new Explanations(predicted, actual);
    }

    private Optional<double[][]> safeContributions(FittedPipeline pipeline, double[][] z) {
        try {
            return attribution.contributions(pipeline, z);
        } catch (RuntimeException e) {
            log.warn("Feature attribution failed: {}", e.toString());
            return Optional.empty();
        }
    }

    private RowExplanation explainRow(int row, List<ChurnFeature> schema, double[] contrib, double[] raw,
                                      double[] z, boolean positiveOnly, String fallback) {
        try {
            return RowExplanation.explained(topPhrases(schema, contrib, raw, z, positiveOnly), fallback);
        } catch (RuntimeException e) {
            log.debug("Could not explain row {}: {}", row, e.toString());
            return RowExplanation.degraded(fallback);
        }
    }

    /**
     * Churn rows rank by signed contribution and keep risk-increasing features only;
     * other rows rank by magnitude in either direction.
     */
    List<String> topPhrases(List<ChurnFeature> schema, double[] contrib, double[] raw, double[] z,
                            boolean positiveOnly) {
        IntToDoubleFunction key = positiveOnly ? j -> contrib[j] : j -> Math.abs(contrib[j]);
        Integer[] order = new Integer[contrib.length];
        for (int j = 0; j < order.length; j++) order[j] = j;
        Arrays.sort(order, Comparator.comparingDouble((Integer j) -> key.applyAsDouble(j)).reversed());

        List<String> phrases = new ArrayList<>(MAX_REASONS);
        for (int j : order) {
            if (phrases.size() >= MAX_REASONS) break;
            if (positiveOnly && !(contrib[j] > 0)) continue;
            String phrase = renderer.describe(schema.get(j), raw[j], z[j]);
            if (!phrase.isEmpty()) phrases.add(phrase);
        }
        return phrases;
    }

    /** Predicted-side and actual-side explanations, row-aligned with the scored matrix. */
    public record Explanations(List<RowExplanation> predicted, List<RowExplanation> actual) {

        public Optional<List<RowExplanation>> actualSide() {
            return Optional.ofNullable(actual);
        }
    }
}
