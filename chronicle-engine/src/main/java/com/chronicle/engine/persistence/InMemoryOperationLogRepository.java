package com.chronicle.engine.persistence;

import com.chronicle.core.id.NamespaceId;
import com.chronicle.core.model.LoggedOperation;
import com.chronicle.core.operation.ChronicleOperation;
import com.chronicle.core.repository.OperationLogRepository;
import org.springframework.stereotype.Repository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of OperationLogRepository.
 * Each namespace has its own list, so appends to different namespaces do not contend.
 */
@Repository
public class InMemoryOperationLogRepository implements OperationLogRepository {

    private final Map<NamespaceId, List<LoggedOperation>> logs = new ConcurrentHashMap<>();

    @Override
    public List<LoggedOperation> appendAll(String transactionId, List<ChronicleOperation> operations) {
        List<LoggedOperation> appended = new ArrayList<>();
        for (ChronicleOperation operation : operations) {
            List<LoggedOperation> log = logs.computeIfAbsent(operation.namespace(), k -> new ArrayList<>());
            synchronized (log) {
                LoggedOperation entry = LoggedOperation.create(log.size(), transactionId, operation);
                log.add(entry);
                appended.add(entry);
            }
        }
        return appended;
    }

    @Override
    public List<LoggedOperation> findByNamespace(NamespaceId namespace) {
        return findByNamespaceFrom(namespace, 0);
    }

    @Override
    public List<LoggedOperation> findByNamespaceFrom(NamespaceId namespace, long fromSequence) {
        List<LoggedOperation> log = logs.get(namespace);
        if (log == null) {
            return List.of();
        }
        synchronized (log) {
            return log.stream()
                .filter(e -> e.sequenceNumber() >= fromSequence)
                .collect(Collectors.toList());
        }
    }

    @Override
    public long getNextSequenceNumber(NamespaceId namespace) {
        List<LoggedOperation> log = logs.get(namespace);
        if (log == null) {
            return 0;
        }
        synchronized (log) {
            return log.size();
        }
    }
}
