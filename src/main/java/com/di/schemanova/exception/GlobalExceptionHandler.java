package com.di.schemanova.exception;

import com.di.schemanova.aspect.ErrorCategory;
import com.di.schemanova.util.TransactionEventLogger;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps exceptions escaping the REST layer to a consistent {@link ErrorResponse}, categorized with
 * {@link ErrorCategory} and logged through {@link TransactionEventLogger}.
 * <p>Per-dataset failures, shape errors included, never reach this handler: the inference
 * service records them on the dataset's status. Only request-level problems do.
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    private final TransactionEventLogger eventLogger;

    public GlobalExceptionHandler(TransactionEventLogger eventLogger) {
        this.eventLogger = eventLogger;
    }

    @ExceptionHandler(RunNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(RunNotFoundException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        log.debug("Not found: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(buildErrorResponse(category, e, HttpStatus.NOT_FOUND));
    }

    /**
     * Bean validation failures on the request body; one detail per rejected field.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("VALIDATION_EXCEPTION", category, e);
        ErrorResponse response = buildErrorResponse(category, e, HttpStatus.BAD_REQUEST);
        Map<String, String> fields = new LinkedHashMap<>();
        for (FieldError error : e.getBindingResult().getFieldErrors()) {
            fields.put(error.getField(), error.getDefaultMessage());
        }
        response.setMessage("Request validation failed");
        response.addDetail("fields", fields);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("SERIALIZATION_EXCEPTION", category, e);
        ErrorResponse response = buildErrorResponse(category, e, HttpStatus.BAD_REQUEST);
        response.setMessage("Malformed request body");
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler({IllegalArgumentException.class, IllegalStateException.class})
    public ResponseEntity<ErrorResponse> handleValidationException(Exception e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("VALIDATION_EXCEPTION", category, e);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(buildErrorResponse(category, e, HttpStatus.BAD_REQUEST));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("UNHANDLED_EXCEPTION", category, e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(buildErrorResponse(category, e, HttpStatus.INTERNAL_SERVER_ERROR));
    }

    private void logError(String eventType, ErrorCategory category, Throwable exception) {
        String transactionId = MDC.get("runId");
        if (transactionId == null) {
            transactionId = MDC.get("requestId");
        }

        Map<String, Object> context = new HashMap<>();
        context.put("errorMessage", exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName());
        context.put("errorType", exception.getClass().getName());
        context.put("errorCategory", category.name());
        context.put("errorCategoryDescription", category.getDescription());
        context.put("handler", "GlobalExceptionHandler");

        Throwable rootCause = getRootCause(exception);
        if (rootCause != exception) {
            context.put("rootCauseType", rootCause.getClass().getSimpleName());
            context.put("rootCauseMessage", rootCause.getMessage());
        }

        eventLogger.logEvent(eventType, context, transactionId, "global_exception_handler", exception);
        log.error("GlobalExceptionHandler caught exception: {} [{}]",
                exception.getClass().getSimpleName(), category.getName(), exception);
    }

    private ErrorResponse buildErrorResponse(ErrorCategory category, Throwable exception, HttpStatus status) {
        ErrorResponse response = new ErrorResponse();
        response.setTimestamp(Instant.now().toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setMessage(exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName());
        response.setErrorCategory(category.name());
        response.setErrorCategoryDescription(category.getDescription());
        response.setPath(getRequestPath());
        response.addDetail("exceptionType", exception.getClass().getSimpleName());
        return response;
    }

    private static Throwable getRootCause(Throwable exception) {
        Throwable current = exception;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }

    private static String getRequestPath() {
        String path = MDC.get("requestPath");
        return path != null ? path : "/unknown";
    }

    /**
     * Structured error response for API endpoints.
     */
    public static class ErrorResponse {
        private String timestamp;
        private int status;
        private String error;
        private String message;
        private String errorCategory;
        private String errorCategoryDescription;
        private String path;
        private Map<String, Object> details = new LinkedHashMap<>();

        public String getTimestamp() {
            return timestamp;
        }

        public void setTimestamp(String timestamp) {
            this.timestamp = timestamp;
        }

        public int getStatus() {
            return status;
        }

        public void setStatus(int status) {
            this.status = status;
        }

        public String getError() {
            return error;
        }

        public void setError(String error) {
            this.error = error;
        }

        public String getMessage() {
            return message;
        }

        public void setMessage(String message) {
            this.message = message;
        }

        public String getErrorCategory() {
            return errorCategory;
        }

        public void setErrorCategory(String errorCategory) {
            this.errorCategory = errorCategory;
        }

        public String getErrorCategoryDescription() {
            return errorCategoryDescription;
        }

        public void setErrorCategoryDescription(String errorCategoryDescription) {
            this.errorCategoryDescription = errorCategoryDescription;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public Map<String, Object> getDetails() {
            return details;
        }

        public void setDetails(Map<String, Object> details) {
            this.details = details;
        }

        public void addDetail(String key, Object value) {
            this.details.put(key, value);
        }
    }
}
