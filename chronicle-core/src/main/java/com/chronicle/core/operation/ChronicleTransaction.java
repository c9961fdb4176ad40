package com.chronicle.core.operation;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * An ordered batch of operations submitted to the ledger as one all-or-nothing unit.
 */
public record ChronicleTransaction(String transactionId, List<ChronicleOperation> operations, String submitter) {

    public ChronicleTransaction {
        Objects.requireNonNull(transactionId, "transactionId");
        operations = operations == null ? List.of() : List.copyOf(operations);
    }

    public static ChronicleTransaction create(List<ChronicleOperation> operations, String submitter) {
        return new ChronicleTransaction(UUID.randomUUID().toString(), operations, submitter);
    }

    public static ChronicleTransaction create(String submitter, ChronicleOperation... operations) {
        return create(List.of(operations), submitter);
    }
}
