package com.chronicle.engine.processor;

import com.chronicle.core.exception.AddressViolationException;
import com.chronicle.core.exception.Contradiction;
import com.chronicle.core.exception.ContradictionDetail;
import com.chronicle.core.exception.ContradictionException;
import com.chronicle.core.exception.TransactionRejectedException;
import com.chronicle.core.ledger.Dependencies;
import com.chronicle.core.ledger.LedgerAddress;
import com.chronicle.core.ledger.OperationProcessor;
import com.chronicle.core.ledger.OperationState;
import com.chronicle.core.ledger.ProcessResult;
import com.chronicle.core.ledger.ProvSnapshot;
import com.chronicle.core.ledger.StateOutput;
import com.chronicle.core.model.LedgerEvent;
import com.chronicle.core.model.LedgerEventType;
import com.chronicle.core.model.ProvModel;
import com.chronicle.core.operation.ChronicleOperation;
import com.chronicle.core.operation.ChronicleTransaction;
import com.chronicle.core.repository.LedgerEventRepository;
import com.chronicle.core.repository.LedgerStateRepository;
import com.chronicle.core.repository.OperationLogRepository;
import com.chronicle.engine.config.LedgerProperties;
import com.chronicle.engine.logging.LoggingContext;
import com.chronicle.engine.metrics.LedgerMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Ledger host for Chronicle transactions.
 *
 * For each transaction:
 * 1. Compute the union of the operations' dependency addresses
 * 2. Load stored fragments for those addresses into an OperationState
 * 3. Process every operation in submission order against one working model
 * 4. On contradiction, record a CONTRADICTED event and write nothing
 * 5. Otherwise write only the dirty fragments and record a COMMITTED event
 *
 * Safe to call concurrently for transactions whose dependency sets are disjoint.
 */
@Service
public class TransactionProcessor {

    private static final Logger log = LoggerFactory.getLogger(TransactionProcessor.class);

    private final OperationProcessor operationProcessor;
    private final LedgerStateRepository stateRepository;
    private final LedgerEventRepository eventRepository;
    private final OperationLogRepository operationLogRepository;
    private final LedgerMetrics metrics;
    private final LedgerProperties properties;
    private final ObjectMapper objectMapper;

    public TransactionProcessor(
            OperationProcessor operationProcessor,
            LedgerStateRepository stateRepository,
            LedgerEventRepository eventRepository,
            OperationLogRepository operationLogRepository,
            LedgerMetrics metrics,
            LedgerProperties properties,
            ObjectMapper objectMapper) {
        this.operationProcessor = operationProcessor;
        this.stateRepository = stateRepository;
        this.eventRepository = eventRepository;
        this.operationLogRepository = operationLogRepository;
        this.metrics = metrics;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    /**
     * Validate and commit a transaction.
     *
     * @return the outcome; contradictions are reported here, never thrown
     * @throws TransactionRejectedException if the transaction has no operations
     * @throws AddressViolationException if processing produced state outside the declared dependencies
     */
    public TransactionOutcome submit(ChronicleTransaction transaction) {
        if (transaction.operations().isEmpty()) {
            throw new TransactionRejectedException(transaction.transactionId(), "no operations");
        }

        try (LoggingContext ctx = LoggingContext.forTransaction(transaction.transactionId(), transaction.submitter())) {
            long startNanos = System.nanoTime();
            List<ChronicleOperation> operations = transaction.operations();
            log.info("Validating transaction {} with {} operations", transaction.transactionId(), operations.size());

            List<LedgerAddress> dependencies = Dependencies.union(operations);
            Map<LedgerAddress, ProvModel> loaded = stateRepository.loadAll(dependencies);

            OperationState<LedgerAddress> state = new OperationState<>();
            state.updateState(loaded);
            log.debug("Loaded {} of {} dependency addresses", loaded.values().stream().filter(v -> v != null).count(),
                dependencies.size());

            ProvModel model = new ProvModel();
            for (int index = 0; index < operations.size(); index++) {
                ChronicleOperation operation = operations.get(index);
                try (LoggingContext opCtx = LoggingContext.forOperation(
                        operation.namespace().toIri(), operation.type().name())) {
                    ProcessResult result = operationProcessor.process(operation, model, state.input());
                    model = result.model();
                    state.updateStateFromOutput(result.outputs());
                    metrics.operationApplied(operation.type());
                } catch (ContradictionException e) {
                    return rejectContradicted(transaction, index, operation, e.getContradiction(), elapsed(startNanos));
                }
            }

            List<StateOutput<LedgerAddress>> dirty = state.dirty();
            checkAddresses(transaction.transactionId(), dependencies, dirty);

            stateRepository.writeAll(dirty);
            if (properties.recordOperationLog()) {
                operationLogRepository.appendAll(transaction.transactionId(), operations);
            }

            List<LedgerAddress> written = dirty.stream().map(StateOutput::address).collect(Collectors.toList());
            LedgerEvent event = LedgerEvent.create(
                transaction.transactionId(),
                eventRepository.getNextSequenceNumber(),
                LedgerEventType.COMMITTED,
                committedPayload(transaction, written),
                transaction.submitter(),
                LoggingContext.getTraceId()
            );
            eventRepository.append(event);

            Duration duration = elapsed(startNanos);
            metrics.transactionCommitted(written.size(), duration);
            log.info("Committed transaction {}: {} addresses written in {} ms",
                transaction.transactionId(), written.size(), duration.toMillis());

            return TransactionOutcome.committed(
                transaction.transactionId(), event.sequenceNumber(), written, ProvSnapshot.combineOutputs(dirty));
        }
    }

    private TransactionOutcome rejectContradicted(
            ChronicleTransaction transaction,
            int index,
            ChronicleOperation operation,
            Contradiction contradiction,
            Duration duration) {
        log.warn("Transaction {} contradicted at operation {} ({}): {}",
            transaction.transactionId(), index, operation.type(), contradiction.describe());

        LedgerEvent event = LedgerEvent.create(
            transaction.transactionId(),
            eventRepository.getNextSequenceNumber(),
            LedgerEventType.CONTRADICTED,
            contradictedPayload(transaction, index, operation, contradiction),
            transaction.submitter(),
            LoggingContext.getTraceId()
        );
        eventRepository.append(event);
        metrics.transactionContradicted(operation.type(), kindOf(contradiction), duration);

        return TransactionOutcome.contradicted(
            transaction.transactionId(), event.sequenceNumber(), contradiction, index, operation.type());
    }

    private static void checkAddresses(
            String transactionId,
            List<LedgerAddress> dependencies,
            List<StateOutput<LedgerAddress>> dirty) {
        Set<LedgerAddress> declared = new HashSet<>(dependencies);
        for (StateOutput<LedgerAddress> output : dirty) {
            if (!declared.contains(output.address())) {
                log.error("Dirty output {} is outside the declared dependencies", output.address());
                throw new AddressViolationException(transactionId, output.address().toString());
            }
        }
    }

    private ObjectNode committedPayload(ChronicleTransaction transaction, List<LedgerAddress> written) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("transactionId", transaction.transactionId());
        payload.put("operationCount", transaction.operations().size());

        ArrayNode namespaces = payload.putArray("namespaces");
        transaction.operations().stream()
            .map(op -> op.namespace().toIri())
            .collect(Collectors.toCollection(TreeSet::new))
            .forEach(namespaces::add);

        ArrayNode addresses = payload.putArray("writtenAddresses");
        written.forEach(address -> addresses.add(address.toString()));
        return payload;
    }

    private ObjectNode contradictedPayload(
            ChronicleTransaction transaction,
            int index,
            ChronicleOperation operation,
            Contradiction contradiction) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("transactionId", transaction.transactionId());
        payload.put("operationIndex", index);
        payload.put("operationType", operation.type().name());
        payload.put("errorCode", ContradictionException.ERROR_CODE);
        payload.put("resource", contradiction.id().toIri());
        payload.put("namespace", contradiction.namespace().toIri());
        payload.put("message", contradiction.describe());

        ArrayNode details = payload.putArray("details");
        for (ContradictionDetail detail : contradiction.details()) {
            ObjectNode node = details.addObject();
            node.put("kind", detail.getClass().getSimpleName());
            node.put("description", detail.describe());
        }
        return payload;
    }

    private static String kindOf(Contradiction contradiction) {
        return contradiction.details().isEmpty()
            ? "unknown"
            : contradiction.details().get(0).getClass().getSimpleName();
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
