package com.di.healthnova.exception;

/**
 * An insight evaluation cycle was cancelled cooperatively (e.g. the user is being deleted).
 */
public class EvaluationCancelledException extends RuntimeException {

    public EvaluationCancelledException(String userId) {
        super("Insight evaluation for user '" + userId + "' was cancelled");
    }
}
