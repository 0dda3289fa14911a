package com.demo.churn.service.explain;

import com.demo.churn.service.features.ChurnFeature;
import com.demo.churn.service.features.ChurnRecord;
import com.demo.churn.service.features.ChurnRecords;
import com.demo.churn.service.features.FeatureMatrix;
import com.demo.churn.service.features.FeatureNormalizer;
import com.demo.churn.service.model.ChurnModel;
import com.demo.churn.service.model.FittedPipeline;
import com.demo.churn.service.model.ModelRun;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class ContributionExplainerTest {

    private final FeatureNormalizer normalizer = new FeatureNormalizer();
    private final ChurnModel model = new ChurnModel(1000);
    private final ContributionExplainer explainer = new ContributionExplainer(new ReasonPhraseRenderer(), 512);

    @Test
    void explain_givesAtMostThreePhrasesPerRow() {
        List<ChurnRecord> records = ChurnRecords.population(45, 21L);
        FeatureMatrix m = normalizer.normalize(records);
        int[] labels = normalizer.labels(records);
        ModelRun run = model.fitPredict(m, labels);

        ContributionExplainer.Explanations why = explainer.explain(run, m, labels);

        assertThat(why.predicted()).hasSize(45);
        assertThat(why.actualSide()).isPresent();
        for (int i = 0; i < 45; i++) {
            RowExplanation p = why.predicted().get(i);
            assertThat(p.phrases()).hasSizeLessThanOrEqualTo(ContributionExplainer.MAX_REASONS);
            assertThat(p.text()).isNotBlank();
            assertThat(p.degraded()).isFalse();

            RowExplanation a = why.actual().get(i);
            if (labels[i] == 1) {
                assertThat(a.text()).isNotBlank();
                assertThat(a.phrases()).hasSizeLessThanOrEqualTo(ContributionExplainer.MAX_REASONS);
            } else {
                assertThat(a.text()).isEmpty();
            }
        }
    }

    @Test
    void explain_untrainedRunHasNoReasons() {
        FeatureMatrix m = normalizer.normalize(ChurnRecords.population(6, 3L));
        ModelRun run = model.fitPredict(m, null);

        ContributionExplainer.Explanations why = explainer.explain(run, m, null);

        assertThat(why.predicted()).extracting(RowExplanation::text).containsOnly("");
        assertThat(why.actualSide()).isEmpty();
    }

    @Test
    void topPhrases_churnSideKeepsPositiveContributionsInRankOrder() {
        List<ChurnFeature> schema = ChurnFeature.schema();
        int p = schema.size();
        double[] contrib = new double[p];
        double[] raw = new double[p];
        double[] z = new double[p];
        Arrays.fill(contrib, -0.5);
        Arrays.fill(raw, Double.NaN);
        Arrays.fill(z, 1.0);

        contrib[ChurnFeature.CREDIT_NOTES_90D.ordinal()] = 0.4;
        raw[ChurnFeature.CREDIT_NOTES_90D.ordinal()] = 4;
        contrib[ChurnFeature.RECENCY_DAYS.ordinal()] = 2.0;
        raw[ChurnFeature.RECENCY_DAYS.ordinal()] = 130;
        // strongly negative contribution must never be cited on the churn side
        contrib[ChurnFeature.TREND_COMPONENT.ordinal()] = -9.0;

        List<String> phrases = explainer.topPhrases(schema, contrib, raw, z, true);

        assertThat(phrases).containsExactly("No purchases for 130 days", "Credit notes in last 90 days (4)");
    }

    @Test
    void topPhrases_noPositiveContributionFallsBack() {
        List<ChurnFeature> schema = ChurnFeature.schema();
        double[] contrib = new double[schema.size()];
        double[] raw = new double[schema.size()];
        double[] z = new double[schema.size()];
        Arrays.fill(contrib, -1.0);
        Arrays.fill(z, 1.0);

        List<String> phrases = explainer.topPhrases(schema, contrib, raw, z, true);
        RowExplanation row = RowExplanation.explained(phrases, ContributionExplainer.PREDICTED_FALLBACK);

        assertThat(phrases).isEmpty();
        assertThat(row.text()).isEqualTo("elevated churn risk across multiple signals");
    }

    @Test
    void topPhrases_stopsAtThree() {
        List<ChurnFeature> schema = ChurnFeature.schema();
        double[] contrib = new double[schema.size()];
        double[] raw = new double[schema.size()];
        double[] z = new double[schema.size()];
        for (int j = 0; j < contrib.length; j++) contrib[j] = 1.0 + j;
        Arrays.fill(raw, 1.0);
        Arrays.fill(z, 2.0);

        assertThat(explainer.topPhrases(schema, contrib, raw, z, true)).hasSize(3);
        assertThat(String.join(RowExplanation.SEPARATOR, explainer.topPhrases(schema, contrib, raw, z, true)))
                .doesNotEndWith(RowExplanation.SEPARATOR);
    }

    @Test
    void explain_rowThatFailsToRenderDegradesToFallback() {
        ReasonPhraseRenderer broken = new ReasonPhraseRenderer() {
            @Override
            public String describe(ChurnFeature feature, double raw, double z) {
                throw new IllegalStateException("boom");
            }
        };
        ContributionExplainer failing = new ContributionExplainer(broken, 512);
        List<ChurnRecord> records = ChurnRecords.population(12, 31L);
        FeatureMatrix m = normalizer.normalize(records);
        int[] labels = normalizer.labels(records);
        ModelRun run = model.fitPredict(m, labels);

        ContributionExplainer.Explanations why = failing.explain(run, m, labels);

        assertThat(why.predicted()).allSatisfy(r -> {
            assertThat(r.phrases()).isEmpty();
            assertThat(r.text()).isEqualTo(ContributionExplainer.PREDICTED_FALLBACK);
        });
        // rows predicted not to churn always reach the renderer
        for (int i = 0; i < labels.length; i++) {
            if (run.predictedLabels()[i] == 0) {
                assertThat(why.predicted().get(i).degraded()).isTrue();
            }
        }
        assertThat(why.predicted()).anyMatch(RowExplanation::degraded);
        for (int i = 0; i < labels.length; i++) {
            RowExplanation actual = why.actual().get(i);
            if (labels[i] == 1) {
                assertThat(actual.phrases()).isEmpty();
                assertThat(actual.text()).isEqualTo(ContributionExplainer.ACTUAL_FALLBACK);
            } else {
                assertThat(actual).isEqualTo(RowExplanation.none());
            }
        }
    }

    @Test
    void explain_withoutBackgroundRanksByWeightTimesStandardizedValue() {
        ReasonPhraseRenderer byColumn = new ReasonPhraseRenderer() {
            @Override
            public String describe(ChurnFeature feature, double raw, double z) {
                return feature.column();
            }
        };
        ContributionExplainer noBackground = new ContributionExplainer(byColumn, 0);
        List<ChurnRecord> records = ChurnRecords.population(15, 12L);
        FeatureMatrix m = normalizer.normalize(records);
        int[] labels = normalizer.labels(records);
        ModelRun run = model.fitPredict(m, labels);
        int row = firstPredictedChurn(run);

        ContributionExplainer.Explanations why = noBackground.explain(run, m, null);

        FittedPipeline p = run.pipeline();
        double[] z = p.transformRow(m.row(row));
        double[] w = p.getCoefficients();
        List<String> expected = IntStream.range(0, z.length)
                .filter(j -> z[j] * w[j] > 0)
                .boxed()
                .sorted(Comparator.comparingDouble((Integer j) -> z[j] * w[j]).reversed())
                .limit(ContributionExplainer.MAX_REASONS)
                .map(j -> ChurnFeature.schema().get(j).column())
                .collect(Collectors.toList());
        assertThat(expected).isNotEmpty();
        assertThat(why.predicted().get(row).phrases()).containsExactlyElementsOf(expected);
        assertThat(why.predicted().get(row).degraded()).isFalse();
    }

    private static int firstPredictedChurn(ModelRun run) {
        for (int i = 0; i < run.rows(); i++) {
            if (run.predictedLabels()[i] == 1) return i;
        }
        throw new AssertionError("no row predicted to churn");
    }
}
