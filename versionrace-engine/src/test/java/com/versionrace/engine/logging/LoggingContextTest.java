package com.versionrace.engine.logging;

import com.versionrace.core.model.IsolationLevel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

public class LoggingContextTest {

    @AfterEach
    void tearDown() {
        LoggingContext.clearAll();
    }

    @Test
    @DisplayName("Writer context should expose key, writer and the handed-over trace ID")
    void testWriterContext() {
        UUID key = UUID.randomUUID();

        try (LoggingContext ctx = LoggingContext.forWriter(key, "writer-A", IsolationLevel.SERIALIZABLE, "abc12345")) {
            assertThat(LoggingContext.getEntityKey()).isEqualTo(key.toString());
            assertThat(LoggingContext.getWriter()).isEqualTo("writer-A");
            assertThat(MDC.get(LoggingContext.ISOLATION)).isEqualTo("SERIALIZABLE");
            assertThat(LoggingContext.getTraceId()).isEqualTo("abc12345");
        }

        assertThat(LoggingContext.getEntityKey()).isNull();
        assertThat(LoggingContext.getWriter()).isNull();
        assertThat(LoggingContext.getTraceId()).isNull();
    }

    @Test
    @DisplayName("Entity context should create a trace ID and drop it again on close")
    void testEntityContextCreatesTraceId() {
        try (LoggingContext ctx = LoggingContext.forEntity(UUID.randomUUID(), IsolationLevel.READ_COMMITTED)) {
            assertThat(LoggingContext.getTraceId()).hasSize(8);
        }

        assertThat(LoggingContext.getTraceId()).isNull();
    }

    @Test
    @DisplayName("Closing a context should restore the values that were there before it")
    void testCloseRestoresOuterValues() {
        MDC.put(LoggingContext.TRACE_ID, "request-1");
        UUID outerKey = UUID.randomUUID();

        try (LoggingContext outer = LoggingContext.forEntity(outerKey, IsolationLevel.READ_COMMITTED)) {
            assertThat(LoggingContext.getTraceId()).isEqualTo("request-1");

            try (LoggingContext inner = LoggingContext.forWriter(
                    UUID.randomUUID(), "writer-B", IsolationLevel.SERIALIZABLE, "race-2")) {
                assertThat(LoggingContext.getTraceId()).isEqualTo("race-2");
            }

            assertThat(LoggingContext.getEntityKey()).isEqualTo(outerKey.toString());
            assertThat(LoggingContext.getWriter()).isNull();
            assertThat(MDC.get(LoggingContext.ISOLATION)).isEqualTo("READ_COMMITTED");
            assertThat(LoggingContext.getTraceId()).isEqualTo("request-1");
        }

        assertThat(LoggingContext.getEntityKey()).isNull();
        assertThat(LoggingContext.getTraceId()).isEqualTo("request-1");
    }
}
