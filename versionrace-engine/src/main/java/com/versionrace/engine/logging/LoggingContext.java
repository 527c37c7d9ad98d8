package com.versionrace.engine.logging;

import com.versionrace.core.model.IsolationLevel;
import org.slf4j.MDC;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures race and store logs carry the entity key, writer and isolation level.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forWriter(key, "writer-A", IsolationLevel.READ_COMMITTED, traceId)) {
 *     log.info("First attempt done"); // Automatically includes entityKey, writer, isolation
 * }
 * </pre>
 *
 * Closing a context restores every key to the value it had when the context
 * was opened, so pooled writer and request threads never keep a stale trace ID.
 *
 * Log output with MDC:
 * 2024-01-15 10:30:45.123 [race-writer-1] INFO  c.v.e.c.RaceCoordinator - First attempt done
 *   entityKey=abc-123 writer=writer-A isolation=READ_COMMITTED traceId=9f2c41d0
 */
public final class LoggingContext implements AutoCloseable {

    public static final String ENTITY_KEY = "entityKey";
    public static final String WRITER = "writer";
    public static final String ISOLATION = "isolation";
    public static final String TRACE_ID = "traceId";

    private static final String[] KEYS = {ENTITY_KEY, WRITER, ISOLATION, TRACE_ID};

    private final Map<String, String> previous = new HashMap<>();

    private LoggingContext() {
        // Private constructor - use static factory methods
        for (String key : KEYS) {
            previous.put(key, MDC.get(key));
        }
    }

    /**
     * Create a logging context for store and scenario operations on one entity.
     */
    public static LoggingContext forEntity(UUID entityKey, IsolationLevel isolationLevel) {
        LoggingContext ctx = new LoggingContext();
        if (entityKey != null) {
            MDC.put(ENTITY_KEY, entityKey.toString());
        }
        if (isolationLevel != null) {
            MDC.put(ISOLATION, isolationLevel.name());
        }
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for one racing writer.
     * Writers run on pool threads, so the caller's trace ID is handed over explicitly.
     */
    public static LoggingContext forWriter(UUID entityKey, String writer, IsolationLevel isolationLevel, String traceId) {
        LoggingContext ctx = new LoggingContext();
        if (traceId != null) {
            MDC.put(TRACE_ID, traceId);
        }
        if (entityKey != null) {
            MDC.put(ENTITY_KEY, entityKey.toString());
        }
        if (isolationLevel != null) {
            MDC.put(ISOLATION, isolationLevel.name());
        }
        if (writer != null) {
            MDC.put(WRITER, writer);
        }
        ensureTraceId();
        return ctx;
    }

    /**
     * Get current entity key from context.
     */
    public static String getEntityKey() {
        return MDC.get(ENTITY_KEY);
    }

    /**
     * Get current writer from context.
     */
    public static String getWriter() {
        return MDC.get(WRITER);
    }

    /**
     * Get current trace ID from context.
     */
    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    /**
     * Ensure a trace ID exists in the context.
     */
    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        for (Map.Entry<String, String> entry : previous.entrySet()) {
            if (entry.getValue() == null) {
                MDC.remove(entry.getKey());
            } else {
                MDC.put(entry.getKey(), entry.getValue());
            }
        }
    }

    /**
     * Clear all MDC context, including keys set outside any LoggingContext.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
