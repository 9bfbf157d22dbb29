package com.di.logingest.exception;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Standardized error categories for load logging and REST error bodies.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>To add a new category: add the enum constant (before APPLICATION_ERROR) and a matcher in
 * {@link #MATCHERS}. Matchers walk the cause chain, so wrapped failures keep their category.
 */
public enum ErrorCategory {

    STORAGE_ERROR("Object storage error", "Source object could not be opened, listed or described"),
    DECODE_ERROR("Decode error", "Source object is not a valid JSON value sequence"),
    POLICY_ERROR("Policy error", "Policy evaluation failed or returned an unexpected shape"),
    VALIDATION_ERROR("Validation error", "Structured log or request input failed validation"),
    CONFIGURATION_ERROR("Configuration error", "Unsupported parser, compression or partition unit"),
    SCHEMA_CONFLICT("Schema conflict", "Observed values of a field have no common column type"),
    WAREHOUSE_ERROR("Warehouse error", "Warehouse metadata or insert call failed"),
    LOAD_FAILED("Load failed", "One or more sources or destinations failed during a load"),
    NETWORK_ERROR("Network error", "Network communication failure"),
    TIMEOUT_ERROR("Timeout error", "Operation exceeded maximum time limit"),
    APPLICATION_ERROR("Application error", "General application error"),
    UNKNOWN("Unknown error", "Unclassified or unknown error type");

    private final String name;
    private final String description;

    ErrorCategory(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Order matters: first match wins. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(t -> t instanceof LoadFailedException, LOAD_FAILED);
        MATCHERS.put(t -> t instanceof UnsupportedSourceException
                || t instanceof InvalidPartitionException, CONFIGURATION_ERROR);
        MATCHERS.put(t -> t instanceof SchemaConflictException, SCHEMA_CONFLICT);
        MATCHERS.put(t -> t instanceof InvalidLogException, VALIDATION_ERROR);
        MATCHERS.put(t -> t instanceof ObjectDecodeException, DECODE_ERROR);
        MATCHERS.put(t -> t instanceof ObjectStoreException, STORAGE_ERROR);
        MATCHERS.put(t -> t instanceof PolicyEvaluationException, POLICY_ERROR);
        MATCHERS.put(t -> t instanceof WarehouseException
                || t instanceof IngestFailedException, WAREHOUSE_ERROR);
        MATCHERS.put(ErrorCategory::isTimeoutError, TIMEOUT_ERROR);
        MATCHERS.put(ErrorCategory::isNetworkError, NETWORK_ERROR);
        MATCHERS.put(ErrorCategory::isValidationError, VALIDATION_ERROR);
    }

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        Throwable cause = exception.getCause();
        if (cause != null && cause != exception) {
            ErrorCategory byCause = categorize(cause);
            if (byCause != APPLICATION_ERROR) {
                return byCause;
            }
        }
        return APPLICATION_ERROR;
    }

    // --- Matcher helpers ---

    private static boolean isNetworkError(Throwable t) {
        return t instanceof java.net.SocketTimeoutException
                || t instanceof java.net.ConnectException
                || t instanceof java.net.UnknownHostException
                || t instanceof java.net.SocketException;
    }

    private static boolean isTimeoutError(Throwable t) {
        return t instanceof java.util.concurrent.TimeoutException
                || t instanceof java.net.SocketTimeoutException
                || (t.getMessage() != null && t.getMessage().toLowerCase().contains("timeout"));
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof IllegalArgumentException
                || t instanceof IllegalStateException;
    }

    @Override
    public String toString() {
        return name();
    }
}
