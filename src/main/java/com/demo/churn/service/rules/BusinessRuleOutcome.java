package com.demo.churn.service.rules;

/**
 * @param daysSincePurchase whole days between the last purchase and today, never negative
 * @param thresholdDays     90, or 120 for customers in renewal grace
 * @param churnedNow        whether the customer counts as churned today
 * @param reason            human-readable explanation of the flag
 */
public record BusinessRuleOutcome(long daysSincePurchase, int thresholdDays, boolean churnedNow, String reason) {
}
