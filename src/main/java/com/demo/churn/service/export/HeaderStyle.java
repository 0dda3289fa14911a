package com.demo.churn.service.export;

public enum HeaderStyle {
    FRIENDLY,
    TECHNICAL
}
