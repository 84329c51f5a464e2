package com.di.healthnova.exception;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Standardized error categories for ingestion and insight evaluation.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>The {@code retryable} flag is what the external worker pool consults before scheduling another
 * attempt. Record-level categories never reach the worker pool; they only label skipped records.
 * To add a new category: add the enum constant (before UNKNOWN) and a matcher in {@link #MATCHERS}.
 */
public enum ErrorCategory {

    UNSUPPORTED_FORMAT("Unsupported format", "File envelope not recognized by any adapter", false, false),
    FILE_READ_ERROR("File read error", "Raw file missing or unreadable", true, false),
    MALFORMED_RECORD("Malformed record", "Row or entry does not have the shape its format requires", false, true),
    SCHEMA_MISMATCH("Schema mismatch", "Record does not fit the canonical schema", false, true),
    VALUE_OUT_OF_RANGE("Value out of range", "Converted value outside the plausible range", false, true),
    UNIT_CONVERSION("Unit conversion error", "Value could not be converted to its canonical unit", false, true),
    CONNECTION_ERROR("Store connection error", "Failed to reach the time-series store", true, false),
    CONSTRAINT_VIOLATION("Store constraint violation", "Store rejected a record", false, false),
    STORAGE_ERROR("Storage error", "General time-series store failure", true, false),
    TIMEOUT_ERROR("Timeout error", "Operation exceeded its execution budget", true, false),
    CANCELLED("Cancelled", "Operation cancelled cooperatively", false, false),
    INSUFFICIENT_DATA("Insufficient data", "Not enough samples for a statistic", false, false),
    VALIDATION_ERROR("Validation error", "Input validation or state machine violation", false, false),
    APPLICATION_ERROR("Application error", "General application error", false, false),
    UNKNOWN("Unknown error", "Unclassified or unknown error type", false, false);

    private final String name;
    private final String description;
    private final boolean retryable;
    private final boolean recordLevel;

    ErrorCategory(String name, String description, boolean retryable, boolean recordLevel) {
        this.name = name;
        this.description = description;
        this.retryable = retryable;
        this.recordLevel = recordLevel;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public boolean isRecordLevel() {
        return recordLevel;
    }

    /** Order matters: first match wins. ValueOutOfRange must precede its parent UnitConversion. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(t -> t instanceof UnsupportedFormatException, UNSUPPORTED_FORMAT);
        MATCHERS.put(t -> t instanceof RawFileReadException, FILE_READ_ERROR);
        MATCHERS.put(t -> t instanceof SchemaMismatchException, SCHEMA_MISMATCH);
        MATCHERS.put(t -> t instanceof ValueOutOfRangeException, VALUE_OUT_OF_RANGE);
        MATCHERS.put(t -> t instanceof UnitConversionException, UNIT_CONVERSION);
        MATCHERS.put(t -> t instanceof EvaluationTimeoutException, TIMEOUT_ERROR);
        MATCHERS.put(t -> t instanceof EvaluationCancelledException, CANCELLED);
        MATCHERS.put(t -> t instanceof InsufficientDataException, INSUFFICIENT_DATA);
        MATCHERS.put(ErrorCategory::isTimeoutError, TIMEOUT_ERROR);
        MATCHERS.put(ErrorCategory::isValidationError, VALIDATION_ERROR);
        MATCHERS.put(ErrorCategory::isDataAccessError, STORAGE_ERROR);
    }

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        if (exception instanceof StorageException && exception.getCause() != null) {
            ErrorCategory byCause = categorize(exception.getCause());
            return byCause == APPLICATION_ERROR ? STORAGE_ERROR : byCause;
        }
        if (exception instanceof StorageException) {
            return STORAGE_ERROR;
        }
        if (exception instanceof SQLException) {
            return categorizeSqlException((SQLException) exception);
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        return APPLICATION_ERROR;
    }

    private static ErrorCategory categorizeSqlException(SQLException sqlEx) {
        String sqlState = sqlEx.getSQLState();
        if (sqlState != null) {
            ErrorCategory byState = SQL_STATE_PREFIX.get(sqlState.substring(0, Math.min(2, sqlState.length())));
            if (byState != null) {
                return byState;
            }
        }
        String msg = sqlEx.getMessage();
        if (msg != null) {
            String lower = msg.toLowerCase();
            if (containsAny(lower, "connection", "timeout", "refused", "closed")) return CONNECTION_ERROR;
            if (containsAny(lower, "constraint", "unique", "foreign key")) return CONSTRAINT_VIOLATION;
        }
        return STORAGE_ERROR;
    }

    private static final Map<String, ErrorCategory> SQL_STATE_PREFIX = Map.of(
            "08", CONNECTION_ERROR,
            "23", CONSTRAINT_VIOLATION,
            "40", STORAGE_ERROR
    );

    // --- Matcher helpers ---

    private static boolean isTimeoutError(Throwable t) {
        return t instanceof java.util.concurrent.TimeoutException
                || (t.getMessage() != null && t.getMessage().toLowerCase().contains("timeout"));
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof IllegalArgumentException
                || t instanceof IllegalStateException;
    }

    private static boolean isDataAccessError(Throwable t) {
        return t instanceof org.springframework.dao.DataAccessException;
    }

    private static boolean containsAny(String text, String... keywords) {
        if (text == null) return false;
        for (String k : keywords) {
            if (text.contains(k)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return name();
    }
}
