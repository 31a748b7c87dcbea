package com.di.schemanova.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Writes structured, single-line JSON events for milestones of an operation
 * (started / completed / failed). Each application instance carries a unique id so that
 * events from several instances can be told apart.
 */
@Slf4j
@Component
public class TransactionEventLogger {

    private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;
    private static final int STACK_TRACE_LINES = 5;

    private final String applicationId;
    private final ObjectMapper objectMapper;

    public TransactionEventLogger(@Value("${spring.application.name:schemanova}") String applicationName,
                                  ObjectMapper objectMapper) {
        this.applicationId = applicationName + "-" + UUID.randomUUID().toString().substring(0, 8);
        this.objectMapper = objectMapper;
        log.info("[TX] TransactionEventLogger initialized with applicationId: {}", applicationId);
    }

    public void logEvent(String eventType, Map<String, Object> context, String transactionId, String transactionContext) {
        logEvent(eventType, context, transactionId, transactionContext, null);
    }

    /**
     * Logs one event. Safe to call from any thread; the thread name is recorded.
     *
     * @param eventType          e.g. SCHEMA_INFERENCE_COMPLETED
     * @param context            free-form details (run id, dataset count, duration)
     * @param transactionId      correlation id from MDC, may be null
     * @param transactionContext what is being done, may be empty
     * @param exception          failure cause for *_FAILED events, may be null
     */
    public void logEvent(String eventType, Map<String, Object> context, String transactionId,
                         String transactionContext, Throwable exception) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("eventType", eventType);
        event.put("timestamp", ISO_FORMATTER.format(Instant.now()));
        event.put("applicationId", applicationId);
        event.put("transactionId", transactionId != null ? transactionId : "unknown");
        event.put("threadName", Thread.currentThread().getName());
        if (transactionContext != null && !transactionContext.isEmpty()) {
            event.put("transactionContext", transactionContext);
        }
        if (context != null && !context.isEmpty()) {
            event.put("context", context);
        }
        if (exception != null) {
            event.put("stackTraceSummary", stackTraceSummary(exception));
        }

        if (exception != null) {
            log.warn("[TX] EVENT: {}", toJson(event));
        } else {
            log.info("[TX] EVENT: {}", toJson(event));
        }
    }

    private String toJson(Map<String, Object> event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.debug("[TX] event not serializable, falling back to toString: {}", e.getMessage());
            return event.toString();
        }
    }

    private static String stackTraceSummary(Throwable exception) {
        return exception + " at " + Arrays.stream(exception.getStackTrace())
                .limit(STACK_TRACE_LINES)
                .map(StackTraceElement::toString)
                .collect(Collectors.joining(" <- "));
    }
}
