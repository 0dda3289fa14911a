package com.demo.churn.service.refresh;

/**
 * @param ran    the refresh executed successfully
 * @param failed the refresh was attempted and failed
 * @param reason "forced", "ttl_expired", "recent (last run ...)", "skipped" or "failed: ..."
 */
public record RefreshOutcome(boolean ran, boolean failed, String reason) {

    public static RefreshOutcome ran(String reason) {
        return new RefreshOutcome(true, false, reason);
    }

    public static RefreshOutcome skipped(String reason) {
        return new RefreshOutcome(false, false, reason);
    }

    public static RefreshOutcome failed(String message) {
        return new RefreshOutcome(false, true, "failed: " + message);
    }

    public String status() {
        if (failed) return "failed";
        return ran ? "executed" : "skipped";
    }
}
