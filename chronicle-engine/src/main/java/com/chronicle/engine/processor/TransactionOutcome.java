package com.chronicle.engine.processor;

import com.chronicle.core.exception.Contradiction;
import com.chronicle.core.ledger.LedgerAddress;
import com.chronicle.core.model.ProvModel;
import com.chronicle.core.operation.OperationType;

import java.util.List;

/**
 * Result of validating one transaction.
 *
 * A committed outcome carries the addresses written and the delta model built from them.
 * A contradicted outcome carries the contradiction and the failing operation; nothing was written.
 */
public record TransactionOutcome(
    String transactionId,
    Status status,
    long eventSequence,
    List<LedgerAddress> writtenAddresses,
    ProvModel delta,
    Contradiction contradiction,
    int failedOperationIndex,
    OperationType failedOperation
) {

    public enum Status {
        COMMITTED,
        CONTRADICTED
    }

    public TransactionOutcome {
        writtenAddresses = writtenAddresses == null ? List.of() : List.copyOf(writtenAddresses);
    }

    public static TransactionOutcome committed(
            String transactionId,
            long eventSequence,
            List<LedgerAddress> writtenAddresses,
            ProvModel delta) {
        return new TransactionOutcome(transactionId, Status.COMMITTED, eventSequence,
            writtenAddresses, delta, null, -1, null);
    }

    public static TransactionOutcome contradicted(
            String transactionId,
            long eventSequence,
            Contradiction contradiction,
            int failedOperationIndex,
            OperationType failedOperation) {
        return new TransactionOutcome(transactionId, Status.CONTRADICTED, eventSequence,
            List.of(), new ProvModel(), contradiction, failedOperationIndex, failedOperation);
    }

    public boolean isCommitted() {
        return status == Status.COMMITTED;
    }
}
