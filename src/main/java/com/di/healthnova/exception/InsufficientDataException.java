package com.di.healthnova.exception;

/**
 * Not enough paired samples, or a series without variance, to compute a correlation.
 * Suppresses the affected insight for the current cycle; never surfaced to the user.
 */
public class InsufficientDataException extends Exception {

    private final int sampleCount;

    public InsufficientDataException(String message, int sampleCount) {
        super(message);
        this.sampleCount = sampleCount;
    }

    public int getSampleCount() {
        return sampleCount;
    }
}
