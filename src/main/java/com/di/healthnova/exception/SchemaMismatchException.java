package com.di.healthnova.exception;

/**
 * A raw record does not fit the canonical schema: ambiguous or unknown unit, unparseable timestamp.
 * Record-level; the record is skipped and counted.
 */
public class SchemaMismatchException extends RuntimeException {

    public SchemaMismatchException(String message) {
        super(message);
    }

    public SchemaMismatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
