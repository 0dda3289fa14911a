package com.demo.churn.service.rules;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class BusinessRuleEvaluatorTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 6, 30);

    private final BusinessRuleEvaluator evaluator = new BusinessRuleEvaluator();

    @Test
    void recentPurchaseIsNotChurn() {
        BusinessRuleOutcome out = evaluator.evaluate(TODAY.minusDays(89).toString(), false, TODAY);

        assertThat(out.daysSincePurchase()).isEqualTo(89);
        assertThat(out.thresholdDays()).isEqualTo(90);
        assertThat(out.churnedNow()).isFalse();
        assertThat(out.reason()).isEqualTo("Recent purchase within last 90 days");
    }

    @Test
    void ninetyDaysIsChurnWithoutGrace() {
        BusinessRuleOutcome out = evaluator.evaluate(TODAY.minusDays(90).toString(), false, TODAY);

        assertThat(out.churnedNow()).isTrue();
        assertThat(out.reason()).isEqualTo("No purchases for 90 days");
    }

    @Test
    void graceExtendsThresholdToOneTwenty() {
        BusinessRuleOutcome inside = evaluator.evaluate(TODAY.minusDays(110).toString(), true, TODAY);
        assertThat(inside.thresholdDays()).isEqualTo(120);
        assertThat(inside.churnedNow()).isFalse();
        assertThat(inside.reason()).isEqualTo("In renewal grace period (extra 30 days)");

        BusinessRuleOutcome past = evaluator.evaluate(TODAY.minusDays(121).toString(), true, TODAY);
        assertThat(past.churnedNow()).isTrue();
        assertThat(past.reason()).isEqualTo("No purchases for 121 days; Grace period exceeded");
    }

    @Test
    void unparseableDateMeansZeroDays() {
        BusinessRuleOutcome out = evaluator.evaluate("not-a-date", false, TODAY);

        assertThat(out.daysSincePurchase()).isZero();
        assertThat(out.churnedNow()).isFalse();
        assertThat(evaluator.evaluate(null, true, TODAY).daysSincePurchase()).isZero();
    }

    @Test
    void futureDateClampsToZero() {
        assertThat(evaluator.evaluate("2024-07-15", false, TODAY).daysSincePurchase()).isZero();
    }

    @Test
    void parseDateAcceptsTimestamps() {
        assertThat(BusinessRuleEvaluator.parseDate("2024-03-01 00:00:00.000")).isEqualTo(LocalDate.of(2024, 3, 1));
        assertThat(BusinessRuleEvaluator.parseDate("  ")).isNull();
    }

    @Test
    void graceFlagCoercion() {
        assertThat(BusinessRuleEvaluator.isInGrace(Boolean.TRUE)).isTrue();
        assertThat(BusinessRuleEvaluator.isInGrace(1)).isTrue();
        assertThat(BusinessRuleEvaluator.isInGrace(0.0)).isFalse();
        assertThat(BusinessRuleEvaluator.isInGrace(" Yes ")).isTrue();
        assertThat(BusinessRuleEvaluator.isInGrace("off")).isFalse();
        assertThat(BusinessRuleEvaluator.isInGrace(null)).isFalse();
    }
}
