package com.demo.churn.service.dto;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * One scored customer: model output with its explanation, the observed label when
 * the run had one, and the independent business-rule churn flag.
 */
@Value
@Builder
public class ChurnPrediction {

    long customerId;
    /** Snapshot date t0, yyyy-MM-dd. */
    String snapshotDate;

    long daysSinceLastPurchaseToday;
    boolean churnedNow;
    String churnedNowReason;

    /** Null when the run had no labels. */
    Integer actualChurned;
    String actualChurnReason;

    int predictedChurn;
    double churnProbability;
    /** Probability in percent, rounded to 2 decimals. */
    double churnProbabilityPct;
    String predictedChurnReason;

    LocalDateTime createdOn;

    public static double toPercent(double probability) {
        return Math.round(probability * 100.0 * 100.0) / 100.0;
    }
}
