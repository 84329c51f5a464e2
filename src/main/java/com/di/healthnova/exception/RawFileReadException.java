package com.di.healthnova.exception;

/**
 * The raw file could not be read (missing, I/O failure). Job-level; the worker pool may retry.
 */
public class RawFileReadException extends RuntimeException {

    public RawFileReadException(String message) {
        super(message);
    }

    public RawFileReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
