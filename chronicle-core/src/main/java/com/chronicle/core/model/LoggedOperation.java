package com.chronicle.core.model;

import com.chronicle.core.id.NamespaceId;
import com.chronicle.core.operation.ChronicleOperation;
import java.time.Instant;

/**
 * A committed operation in a namespace's operation log.
 */
public record LoggedOperation(
    NamespaceId namespace,
    long sequenceNumber,
    String transactionId,
    ChronicleOperation operation,
    Instant recordedAt
) {

    public static LoggedOperation create(
            long sequenceNumber,
            String transactionId,
            ChronicleOperation operation) {
        return new LoggedOperation(operation.namespace(), sequenceNumber, transactionId, operation, Instant.now());
    }
}
