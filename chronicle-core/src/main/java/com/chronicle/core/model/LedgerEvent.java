package com.chronicle.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable record of a transaction outcome.
 *
 * Invariants:
 * - sequenceNumber is contiguous across the log
 * - events are never deleted or modified
 */
public record LedgerEvent(
    UUID eventId,
    String transactionId,
    long sequenceNumber,
    LedgerEventType type,
    Instant timestamp,
    JsonNode payload,
    String submitter,
    String traceId
) {

    public static LedgerEvent create(
            String transactionId,
            long sequenceNumber,
            LedgerEventType type,
            JsonNode payload,
            String submitter,
            String traceId) {
        return new LedgerEvent(
            UUID.randomUUID(),
            transactionId,
            sequenceNumber,
            type,
            Instant.now(),
            payload,
            submitter,
            traceId
        );
    }

    public boolean isCommitted() {
        return type == LedgerEventType.COMMITTED;
    }
}
