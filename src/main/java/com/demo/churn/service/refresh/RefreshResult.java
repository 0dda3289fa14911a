package com.demo.churn.service.refresh;

/** What the executor reports back after trying to run a refresh. */
public record RefreshResult(boolean success, String message) {

    public static RefreshResult ok() {
        return new RefreshResult(true, "ok");
    }

    public static RefreshResult failure(String message) {
        return new RefreshResult(false, message);
    }
}
