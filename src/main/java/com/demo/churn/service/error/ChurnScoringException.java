package com.demo.churn.service.error;

/** Base type for errors that abort a scoring run. */
public class ChurnScoringException extends RuntimeException {

    public ChurnScoringException(String message) {
        super(message);
    }

    public ChurnScoringException(String message, Throwable cause) {
        super(message, cause);
    }
}
