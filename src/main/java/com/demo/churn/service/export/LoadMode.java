package com.demo.churn.service.export;

/** What to do when the prediction table already exists. */
public enum LoadMode {
    APPEND,
    REPLACE,
    FAIL
}
