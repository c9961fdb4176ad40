package com.chronicle.engine.history;

import com.chronicle.core.id.NamespaceId;
import com.chronicle.core.ledger.ProvSnapshot;
import com.chronicle.core.model.LoggedOperation;
import com.chronicle.core.model.ProvModel;
import com.chronicle.core.repository.LedgerStateRepository;
import com.chronicle.core.repository.OperationLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Read-only view of the folded provenance model for a namespace.
 *
 * Provides:
 * - The current model, combined from stored per-address fragments
 * - The model rebuilt by replaying the committed operation log
 * - Replay up to a given log sequence number
 */
@Service
public class ProvenanceQueryService {

    private static final Logger log = LoggerFactory.getLogger(ProvenanceQueryService.class);

    private final LedgerStateRepository stateRepository;
    private final OperationLogRepository operationLogRepository;

    public ProvenanceQueryService(LedgerStateRepository stateRepository,
                                  OperationLogRepository operationLogRepository) {
        this.stateRepository = stateRepository;
        this.operationLogRepository = operationLogRepository;
    }

    /**
     * Combine every stored fragment of the namespace.
     */
    public ProvModel currentModel(NamespaceId namespace) {
        List<ProvModel> fragments = stateRepository.findByNamespace(namespace);
        log.debug("Combining {} fragments for {}", fragments.size(), namespace);
        return ProvSnapshot.combine(fragments);
    }

    /**
     * Rebuild the namespace by replaying its whole committed operation log.
     */
    public ProvModel replay(NamespaceId namespace) {
        return replayToSequence(namespace, Long.MAX_VALUE);
    }

    /**
     * Rebuild the namespace as it stood after the operation at {@code targetSequence}.
     * Committed operations never contradict when replayed in log order.
     */
    public ProvModel replayToSequence(NamespaceId namespace, long targetSequence) {
        log.info("Replaying namespace {} to sequence {}", namespace, targetSequence);

        List<LoggedOperation> entries = operationLogRepository.findByNamespace(namespace).stream()
            .filter(e -> e.sequenceNumber() <= targetSequence)
            .collect(Collectors.toList());

        return ProvModel.fromOperations(entries.stream()
            .map(LoggedOperation::operation)
            .collect(Collectors.toList()));
    }

    /**
     * Check that fragment storage and the operation log agree for a namespace.
     */
    public boolean isConsistent(NamespaceId namespace) {
        boolean consistent = currentModel(namespace).equals(replay(namespace));
        if (!consistent) {
            log.warn("Stored fragments for {} diverge from the operation log", namespace);
        }
        return consistent;
    }
}
