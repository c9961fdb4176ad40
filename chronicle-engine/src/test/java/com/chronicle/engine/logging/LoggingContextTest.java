package com.chronicle.engine.logging;

import org.junit.jupiter.api.*;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Logging Context Tests")
public class LoggingContextTest {

    @AfterEach
    void tearDown() {
        LoggingContext.clearAll();
    }

    @Test
    @DisplayName("Transaction context sets and removes its keys")
    void testTransactionContext() {
        try (LoggingContext ctx = LoggingContext.forTransaction("tx-1", "alice")) {
            assertEquals("tx-1", LoggingContext.getTransactionId());
            assertEquals("alice", MDC.get(LoggingContext.SUBMITTER));
            assertNotNull(LoggingContext.getTraceId());
        }

        assertNull(LoggingContext.getTransactionId());
        assertNull(MDC.get(LoggingContext.SUBMITTER));
    }

    @Test
    @DisplayName("Closing an operation context keeps the enclosing transaction")
    void testNestedOperationContext() {
        try (LoggingContext tx = LoggingContext.forTransaction("tx-2", "alice")) {
            String traceId = LoggingContext.getTraceId();
            try (LoggingContext op = LoggingContext.forOperation("chronicle:ns:n:1", "START_ACTIVITY")) {
                assertEquals("START_ACTIVITY", MDC.get(LoggingContext.OPERATION));
                assertEquals(traceId, LoggingContext.getTraceId());
            }
            assertNull(MDC.get(LoggingContext.OPERATION));
            assertNull(MDC.get(LoggingContext.NAMESPACE));
            assertEquals("tx-2", LoggingContext.getTransactionId());
        }
    }

    @Test
    @DisplayName("Trace id survives context close until cleared")
    void testTraceIdKept() {
        try (LoggingContext ctx = LoggingContext.forTransaction("tx-3", null)) {
            assertNull(MDC.get(LoggingContext.SUBMITTER));
        }

        assertNotNull(LoggingContext.getTraceId());
        LoggingContext.clearAll();
        assertNull(LoggingContext.getTraceId());
    }
}
