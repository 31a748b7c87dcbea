package com.di.schemanova.aspect;

import com.di.schemanova.exception.RunNotFoundException;
import com.di.schemanova.exception.ShapeException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Standardized error categories for per-dataset status, transaction events and REST errors.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>To add a new category: add the enum constant (before UNKNOWN) and a matcher in
 * {@link #MATCHERS}.
 */
public enum ErrorCategory {

    SHAPE_ERROR("Dataset shape error", "Structurally invalid dataset, e.g. no columns"),
    NOT_FOUND("Not found", "Requested analysis run or dataset does not exist"),
    VALIDATION_ERROR("Validation error", "Input validation or business rule violation"),
    SERIALIZATION_ERROR("Serialization error", "Request or response body could not be (de)serialized"),
    CONCURRENCY_ERROR("Concurrency error", "Worker pool task was interrupted, rejected or failed"),
    CONFIGURATION_ERROR("Configuration error", "Application configuration issue"),
    RESOURCE_ERROR("Resource error", "System resource exhaustion or unavailability"),
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
        MATCHERS.put(t -> t instanceof ShapeException, SHAPE_ERROR);
        MATCHERS.put(t -> t instanceof RunNotFoundException, NOT_FOUND);
        MATCHERS.put(ErrorCategory::isTimeoutError, TIMEOUT_ERROR);
        MATCHERS.put(ErrorCategory::isConcurrencyError, CONCURRENCY_ERROR);
        MATCHERS.put(ErrorCategory::isSerializationError, SERIALIZATION_ERROR);
        MATCHERS.put(ErrorCategory::isValidationError, VALIDATION_ERROR);
        MATCHERS.put(ErrorCategory::isConfigurationError, CONFIGURATION_ERROR);
        MATCHERS.put(ErrorCategory::isResourceError, RESOURCE_ERROR);
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
        return APPLICATION_ERROR;
    }

    // --- Matcher helpers ---

    private static boolean isTimeoutError(Throwable t) {
        return t instanceof java.util.concurrent.TimeoutException
                || (t.getMessage() != null && t.getMessage().toLowerCase().contains("timeout"));
    }

    private static boolean isConcurrencyError(Throwable t) {
        return t instanceof InterruptedException
                || t instanceof java.util.concurrent.ExecutionException
                || t instanceof java.util.concurrent.RejectedExecutionException
                || t instanceof java.util.concurrent.CancellationException;
    }

    private static boolean isSerializationError(Throwable t) {
        return t instanceof com.fasterxml.jackson.core.JsonProcessingException
                || t instanceof org.springframework.http.converter.HttpMessageNotReadableException;
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof IllegalArgumentException
                || t instanceof IllegalStateException
                || t instanceof org.springframework.web.bind.MethodArgumentNotValidException
                || t instanceof jakarta.validation.ConstraintViolationException
                || t instanceof java.util.NoSuchElementException
                || t instanceof IndexOutOfBoundsException;
    }

    private static boolean isConfigurationError(Throwable t) {
        return t instanceof org.springframework.beans.factory.BeanCreationException
                || t instanceof org.springframework.context.ApplicationContextException;
    }

    private static boolean isResourceError(Throwable t) {
        return t instanceof OutOfMemoryError
                || t instanceof StackOverflowError;
    }

    @Override
    public String toString() {
        return name();
    }
}
