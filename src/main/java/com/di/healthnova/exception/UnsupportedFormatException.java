package com.di.healthnova.exception;

/**
 * The file's structural envelope is not one the selected adapter understands (wrong root element,
 * missing header, non-array JSON, unknown provider). Fatal for the whole file and never retried.
 */
public class UnsupportedFormatException extends RuntimeException {

    public UnsupportedFormatException(String message) {
        super(message);
    }

    public UnsupportedFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
