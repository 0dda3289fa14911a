package com.demo.churn.service.explain;

import com.demo.churn.service.features.ChurnFeature;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ReasonPhraseRendererTest {

    private final ReasonPhraseRenderer renderer = new ReasonPhraseRenderer();

    @Test
    void recencyReadsAsNaturalSentence() {
        assertThat(renderer.describe(ChurnFeature.RECENCY_DAYS, 121.6, 1.4)).isEqualTo("No purchases for 122 days");
    }

    @Test
    void highDirectionNeedsAboveAverageValue() {
        assertThat(renderer.describe(ChurnFeature.CREDIT_NOTES_90D, 4, 0.8))
                .isEqualTo("Credit notes in last 90 days (4)");
        assertThat(renderer.describe(ChurnFeature.CREDIT_NOTES_90D, 0, -0.3)).isEmpty();
        assertThat(renderer.describe(ChurnFeature.CREDIT_NOTES_90D, 0, 0.0)).isEmpty();
    }

    @Test
    void lowDirectionUsesDeficiencyWording() {
        assertThat(renderer.describe(ChurnFeature.REV_180D, 1234.5, -1.2))
                .isEqualTo("Low recent revenue ($1,234.50)");
        assertThat(renderer.describe(ChurnFeature.INVOICES_90D, 1, -0.9))
                .isEqualTo("Few invoices in last 90 days (1)");
        assertThat(renderer.describe(ChurnFeature.REV_180D, 9000, 0.7)).isEmpty();
    }

    @Test
    void signalComponentsOmitTheNumber() {
        assertThat(renderer.describe(ChurnFeature.TREND_COMPONENT, 0.6, 1.1)).isEqualTo("Negative trend signal");
        assertThat(renderer.describe(ChurnFeature.MITIGATOR_COMPONENT, 0.05, -1.5)).isEqualTo("Few mitigating signals");
    }

    @Test
    void negativeChangeReportedOnlyWhenBelowZero() {
        assertThat(renderer.describe(ChurnFeature.PCT_CHANGE_3M, -12.34, 5.0))
                .isEqualTo("Change vs prior 3 months (-12.3%)");
        assertThat(renderer.describe(ChurnFeature.PCT_CHANGE_3M, 4.0, -5.0)).isEmpty();
        assertThat(renderer.describe(ChurnFeature.PCT_CHANGE_3M, Double.NaN, -5.0)).isEmpty();
    }

    @Test
    void flagsRenderWhenSet() {
        assertThat(renderer.describe(ChurnFeature.IN_RENEWAL_GRACE, 1, -3)).isEqualTo("In renewal grace period");
        assertThat(renderer.describe(ChurnFeature.IS_MAINTENANCE_HEAVY, 0, 3)).isEmpty();
        assertThat(renderer.describe(ChurnFeature.IS_MAINTENANCE_HEAVY, Double.NaN, 3)).isEmpty();
    }

    @Test
    void missingValueKeepsLabelOnly() {
        assertThat(renderer.describe(ChurnFeature.CV_GAP, Double.NaN, 0.5)).isEqualTo("Irregular buying cadence");
    }
}
