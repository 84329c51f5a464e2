package com.di.healthnova.exception;

import java.time.Duration;

/**
 * An insight evaluation cycle exceeded its execution budget.
 */
public class EvaluationTimeoutException extends RuntimeException {

    public EvaluationTimeoutException(String userId, Duration budget) {
        super("Insight evaluation for user '" + userId + "' exceeded its budget of " + budget);
    }
}
