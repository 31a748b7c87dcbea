package com.di.schemanova.aspect;

import com.di.schemanova.util.TransactionEventLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Emits {@code _STARTED}, {@code _COMPLETED} and {@code _FAILED} events around every method
 * annotated with {@link LogTransaction}. Failures are categorized with {@link ErrorCategory}
 * and re-thrown unchanged. With {@link LogTransaction#transactionIdPrefix()} set, the aspect opens
 * the transaction id itself when the caller has none.
 */
@Slf4j
@Aspect
@Component
@RequiredArgsConstructor
public class TransactionEventAspect {

    private final TransactionEventLogger eventLogger;

    @Around("@annotation(com.di.schemanova.aspect.LogTransaction)")
    public Object logTransaction(ProceedingJoinPoint joinPoint) throws Throwable {
        Method method = ((MethodSignature) joinPoint.getSignature()).getMethod();
        LogTransaction annotation = method.getAnnotation(LogTransaction.class);
        String eventType = annotation.eventType();
        String transactionContext = annotation.transactionContext();
        String transactionIdKey = annotation.transactionIdKey();
        boolean ownsTransactionId = MDC.get(transactionIdKey) == null && !annotation.transactionIdPrefix().isEmpty();
        if (ownsTransactionId) {
            MDC.put(transactionIdKey, annotation.transactionIdPrefix() + UUID.randomUUID().toString().substring(0, 8));
        }
        String transactionId = resolveTransactionId(transactionIdKey);
        long startTime = System.currentTimeMillis();

        Map<String, Object> context = extractContext(joinPoint, method);
        eventLogger.logEvent(eventType + "_STARTED", context, transactionId, transactionContext);

        try {
            Object result = joinPoint.proceed();
            long durationMs = System.currentTimeMillis() - startTime;
            if (result != null && annotation.includeResult()) {
                context.put("resultType", result.getClass().getSimpleName());
            }
            context.put("durationMs", durationMs);
            eventLogger.logEvent(eventType + "_COMPLETED", context, transactionId, transactionContext);
            return result;
        } catch (Throwable e) {
            long durationMs = System.currentTimeMillis() - startTime;
            ErrorCategory category = ErrorCategory.categorize(e);
            context.put("errorMessage", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            context.put("errorType", e.getClass().getSimpleName());
            context.put("errorCategory", category.name());
            context.put("errorCategoryDescription", category.getDescription());
            context.put("durationMs", durationMs);
            eventLogger.logEvent(eventType + "_FAILED", context, transactionId, transactionContext, e);
            throw e;
        } finally {
            if (ownsTransactionId) {
                MDC.remove(transactionIdKey);
            }
        }
    }

    private static String resolveTransactionId(String key) {
        String id = MDC.get(key);
        if (id == null) id = MDC.get("runId");
        if (id == null) id = MDC.get("requestId");
        return id;
    }

    /**
     * Records argument sizes rather than values: datasets can be large.
     */
    private static Map<String, Object> extractContext(ProceedingJoinPoint joinPoint, Method method) {
        Map<String, Object> context = new HashMap<>();
        Object[] args = joinPoint.getArgs();
        var parameters = method.getParameters();
        for (int i = 0; i < parameters.length && i < args.length; i++) {
            Object arg = args[i];
            String name = parameters[i].getName();
            if (arg instanceof Map<?, ?> map) {
                context.put(name + "Size", map.size());
            } else if (arg instanceof Collection<?> collection) {
                context.put(name + "Size", collection.size());
            } else if (arg instanceof CharSequence || arg instanceof Number || arg instanceof Boolean) {
                context.put(name, arg);
            }
        }
        context.put("method", method.getName());
        context.put("className", method.getDeclaringClass().getSimpleName());
        return context;
    }
}
