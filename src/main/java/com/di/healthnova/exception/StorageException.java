package com.di.healthnova.exception;

/**
 * The time-series store rejected a write. Job-level; the worker pool may retry.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
