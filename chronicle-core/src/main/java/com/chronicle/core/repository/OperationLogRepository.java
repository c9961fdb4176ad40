package com.chronicle.core.repository;

import com.chronicle.core.id.NamespaceId;
import com.chronicle.core.model.LoggedOperation;
import com.chronicle.core.operation.ChronicleOperation;
import java.util.List;

/**
 * Append-only log of committed operations, sequenced per namespace.
 */
public interface OperationLogRepository {

    /**
     * Append the operations of a committed transaction in submission order.
     *
     * @param transactionId The committed transaction
     * @param operations The operations to append
     * @return The logged entries with their assigned sequence numbers
     */
    List<LoggedOperation> appendAll(String transactionId, List<ChronicleOperation> operations);

    /**
     * Get all logged operations for a namespace in order.
     *
     * @param namespace The namespace
     * @return Operations ordered by sequence number
     */
    List<LoggedOperation> findByNamespace(NamespaceId namespace);

    /**
     * Get logged operations for a namespace starting from a sequence number.
     *
     * @param namespace The namespace
     * @param fromSequence Start sequence number (inclusive)
     * @return Operations from the given sequence number
     */
    List<LoggedOperation> findByNamespaceFrom(NamespaceId namespace, long fromSequence);

    /**
     * Get the next sequence number for a namespace.
     *
     * @return Next sequence number (0 if nothing is logged)
     */
    long getNextSequenceNumber(NamespaceId namespace);
}
