package com.demo.churn.service.error;

/** The churn model could not be fit on the supplied matrix and labels. */
public class TrainingException extends ChurnScoringException {

    public TrainingException(String message) {
        super(message);
    }

    public TrainingException(String message, Throwable cause) {
        super(message, cause);
    }
}
