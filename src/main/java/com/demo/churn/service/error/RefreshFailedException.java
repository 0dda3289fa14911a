package com.demo.churn.service.error;

import com.demo.churn.service.refresh.RefreshOutcome;

/** Raised only when a run is configured to abort after the upstream refresh failed. */
public class RefreshFailedException extends ChurnScoringException {

    private final RefreshOutcome outcome;

    public RefreshFailedException(RefreshOutcome outcome) {
        super("Upstream refresh failed: " + outcome.reason());
        this.outcome = outcome;
    }

    public RefreshOutcome getOutcome() {
        return outcome;
    }
}
