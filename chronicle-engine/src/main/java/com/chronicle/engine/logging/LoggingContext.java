package com.chronicle.engine.logging;

import org.slf4j.MDC;
import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures all logs include relevant correlation IDs for tracing.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forTransaction(transactionId, submitter)) {
 *     log.info("Validating transaction"); // Automatically includes transactionId
 * }
 * </pre>
 */
public final class LoggingContext implements AutoCloseable {

    public static final String TRANSACTION_ID = "transactionId";
    public static final String SUBMITTER = "submitter";
    public static final String NAMESPACE = "namespace";
    public static final String OPERATION = "operation";
    public static final String TRACE_ID = "traceId";

    private final String[] keys;

    private LoggingContext(String... keys) {
        this.keys = keys;
    }

    /**
     * Create a logging context for transaction-level processing.
     */
    public static LoggingContext forTransaction(String transactionId, String submitter) {
        if (transactionId != null) {
            MDC.put(TRANSACTION_ID, transactionId);
        }
        if (submitter != null) {
            MDC.put(SUBMITTER, submitter);
        }
        ensureTraceId();
        return new LoggingContext(TRANSACTION_ID, SUBMITTER);
    }

    /**
     * Create a logging context for a single operation inside a transaction.
     * Closing it leaves the enclosing transaction context in place.
     */
    public static LoggingContext forOperation(String namespace, String operation) {
        if (namespace != null) {
            MDC.put(NAMESPACE, namespace);
        }
        if (operation != null) {
            MDC.put(OPERATION, operation);
        }
        ensureTraceId();
        return new LoggingContext(NAMESPACE, OPERATION);
    }

    public static String getTransactionId() {
        return MDC.get(TRANSACTION_ID);
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        // Keep TRACE_ID for request-scoped tracing
    }

    /**
     * Clear all MDC context. Call at the end of a request or worker loop.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
