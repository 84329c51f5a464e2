package com.di.healthnova.exception;

/**
 * A raw value could not be converted to its canonical unit (not numeric, not finite).
 * Record-level; the record is skipped and counted.
 */
public class UnitConversionException extends RuntimeException {

    public UnitConversionException(String message) {
        super(message);
    }

    public UnitConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
