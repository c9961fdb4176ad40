package com.chronicle.core.repository;

import com.chronicle.core.model.LedgerEvent;
import com.chronicle.core.model.LedgerEventType;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for ledger outcome events.
 * Events are append-only and immutable.
 */
public interface LedgerEventRepository {

    /**
     * Append a new event to the log.
     *
     * @param event The event to append
     */
    void append(LedgerEvent event);

    Optional<LedgerEvent> findById(UUID eventId);

    /**
     * Find the outcome event of a transaction.
     *
     * @param transactionId The transaction ID
     * @return The event if the transaction has been processed
     */
    Optional<LedgerEvent> findByTransactionId(String transactionId);

    /**
     * All events ordered by sequence number.
     */
    List<LedgerEvent> findAll();

    List<LedgerEvent> findByType(LedgerEventType type);

    /**
     * Get the next sequence number.
     *
     * @return Next sequence number (0 if no events exist)
     */
    long getNextSequenceNumber();

    Map<LedgerEventType, Long> countByType();
}
