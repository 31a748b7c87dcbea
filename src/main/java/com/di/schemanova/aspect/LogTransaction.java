package com.di.schemanova.aspect;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method for automatic start / completion / failure event logging by
 * {@link TransactionEventAspect}.
 *
 * <pre>
 * {@code
 * @LogTransaction(eventType = "SCHEMA_INFERENCE", transactionContext = "schema_inference", transactionIdPrefix = "run-")
 * public AnalysisResult analyze(Map<String, RawDataset> datasets) { ... }
 * }
 * </pre>
 * produces {@code SCHEMA_INFERENCE_STARTED}, {@code SCHEMA_INFERENCE_COMPLETED} or
 * {@code SCHEMA_INFERENCE_FAILED}.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface LogTransaction {

    /** Event type prefix. */
    String eventType();

    /** What is being done, e.g. "schema_inference". */
    String transactionContext() default "";

    /** MDC key holding the transaction id. Falls back to {@code runId}, then {@code requestId}. */
    String transactionIdKey() default "runId";

    /**
     * When set and {@link #transactionIdKey()} is absent from MDC, a new id with this prefix is
     * put under that key for the duration of the call, so the method and its events share it.
     */
    String transactionIdPrefix() default "";

    /** Whether to add the result type to the completed event. */
    boolean includeResult() default false;
}
