package com.di.schemanova.util;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for TransactionEventLogger, reading the emitted JSON back from a list appender.
 */
@DisplayName("TransactionEventLogger Tests")
class TransactionEventLoggerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private Logger logbackLogger;
    private ListAppender<ILoggingEvent> appender;
    private TransactionEventLogger eventLogger;

    @BeforeEach
    void setUp() {
        logbackLogger = (Logger) LoggerFactory.getLogger(TransactionEventLogger.class);
        appender = new ListAppender<>();
        appender.start();
        logbackLogger.addAppender(appender);
        eventLogger = new TransactionEventLogger("schemanova", objectMapper);
        appender.list.clear();
    }

    @AfterEach
    void tearDown() {
        logbackLogger.detachAppender(appender);
    }

    private JsonNode lastEvent() throws Exception {
        String message = appender.list.get(appender.list.size() - 1).getFormattedMessage();
        return objectMapper.readTree(message.substring(message.indexOf('{')));
    }

    @Test
    @DisplayName("Application id should carry the application name and stay stable across events")
    void testApplicationId() throws Exception {
        eventLogger.logEvent("A", Map.of(), "run-1", "");
        String first = lastEvent().get("applicationId").asText();
        eventLogger.logEvent("B", Map.of(), "run-1", "");

        assertTrue(first.matches("schemanova-[0-9a-f]{8}"));
        assertEquals(first, lastEvent().get("applicationId").asText());
    }

    @Test
    @DisplayName("Should log a single-line JSON event at info")
    void testLogEvent_Info() throws Exception {
        eventLogger.logEvent("SCHEMA_INFERENCE_COMPLETED", Map.of("datasetsSize", 2), "run-1", "schema_inference");

        assertEquals(Level.INFO, appender.list.get(0).getLevel());
        JsonNode event = lastEvent();
        assertEquals("SCHEMA_INFERENCE_COMPLETED", event.get("eventType").asText());
        assertEquals("run-1", event.get("transactionId").asText());
        assertEquals("schema_inference", event.get("transactionContext").asText());
        assertEquals(2, event.get("context").get("datasetsSize").asInt());
        assertTrue(event.get("applicationId").asText().startsWith("schemanova-"));
        assertFalse(event.has("stackTraceSummary"));
    }

    @Test
    @DisplayName("Should log failures at warn with a stack trace summary")
    void testLogEvent_Failure() throws Exception {
        eventLogger.logEvent("SCHEMA_INFERENCE_FAILED", Map.of(), null, "", new IllegalStateException("boom"));

        assertEquals(Level.WARN, appender.list.get(0).getLevel());
        JsonNode event = lastEvent();
        assertEquals("unknown", event.get("transactionId").asText());
        assertFalse(event.has("transactionContext"));
        assertFalse(event.has("context"));
        assertTrue(event.get("stackTraceSummary").asText().startsWith("java.lang.IllegalStateException: boom"));
    }
}
