package com.chronicle.engine.persistence;

import com.chronicle.core.model.LedgerEvent;
import com.chronicle.core.model.LedgerEventType;
import com.chronicle.core.repository.LedgerEventRepository;
import org.springframework.stereotype.Repository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * In-memory implementation of LedgerEventRepository.
 * For demonstration and testing purposes.
 */
@Repository
public class InMemoryLedgerEventRepository implements LedgerEventRepository {

    private final Map<UUID, LedgerEvent> events = new ConcurrentHashMap<>();
    private final Map<String, LedgerEvent> byTransactionId = new ConcurrentHashMap<>();
    private final AtomicLong sequenceCounter = new AtomicLong(0);

    @Override
    public void append(LedgerEvent event) {
        events.put(event.eventId(), event);
        byTransactionId.put(event.transactionId(), event);
    }

    @Override
    public Optional<LedgerEvent> findById(UUID eventId) {
        return Optional.ofNullable(events.get(eventId));
    }

    @Override
    public Optional<LedgerEvent> findByTransactionId(String transactionId) {
        return Optional.ofNullable(byTransactionId.get(transactionId));
    }

    @Override
    public List<LedgerEvent> findAll() {
        return events.values().stream()
            .sorted(Comparator.comparing(LedgerEvent::sequenceNumber))
            .collect(Collectors.toList());
    }

    @Override
    public List<LedgerEvent> findByType(LedgerEventType type) {
        return events.values().stream()
            .filter(e -> e.type() == type)
            .sorted(Comparator.comparing(LedgerEvent::sequenceNumber))
            .collect(Collectors.toList());
    }

    @Override
    public long getNextSequenceNumber() {
        return sequenceCounter.getAndIncrement();
    }

    @Override
    public Map<LedgerEventType, Long> countByType() {
        return events.values().stream()
            .collect(Collectors.groupingBy(LedgerEvent::type, Collectors.counting()));
    }
}
