package com.demo.churn.controller.dto;

import java.time.Instant;

public class RefreshStatusResponse {
    public String procedure;
    public String key;
    public Instant lastRun;        // null when never run
    public long ttlHours;
    public boolean due;
}
