package com.demo.churn.service.refresh;

/** Runs the upstream refresh. Retries and timeouts are the implementation's business. */
public interface RefreshExecutor {

    RefreshResult execute(RefreshTarget target);
}
