package com.chronicle.engine.processor;

import com.chronicle.core.exception.ContradictionDetail;
import com.chronicle.core.exception.TransactionRejectedException;
import com.chronicle.core.id.NamespaceId;
import com.chronicle.core.ledger.LedgerAddress;
import com.chronicle.core.model.LedgerEvent;
import com.chronicle.core.model.LedgerEventType;
import com.chronicle.core.model.ProvModel;
import com.chronicle.core.operation.ActivityUses;
import com.chronicle.core.operation.ChronicleOperation;
import com.chronicle.core.operation.ChronicleTransaction;
import com.chronicle.core.operation.CreateNamespace;
import com.chronicle.core.operation.EndActivity;
import com.chronicle.core.operation.OperationType;
import com.chronicle.core.operation.SetEntityAttributes;
import com.chronicle.core.operation.StartActivity;
import com.chronicle.core.operation.WasAssociatedWith;
import com.chronicle.core.operation.WasGeneratedBy;
import com.chronicle.engine.config.LedgerProperties;
import com.chronicle.engine.metrics.LedgerMetrics;
import com.chronicle.engine.test.LedgerHarness;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.*;

import java.util.List;

import static com.chronicle.engine.test.LedgerHarness.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Transaction validation against ledger state.
 *
 * Verifies:
 * 1. Committed transactions write exactly their changed fragments
 * 2. A contradiction anywhere in a transaction writes nothing
 * 3. Every transaction leaves one ledger event
 */
@DisplayName("Transaction Processor Tests")
public class TransactionProcessorTest {

    private static final NamespaceId NS = LedgerHarness.namespace("processor");

    private LedgerHarness ledger;

    @BeforeEach
    void setUp() {
        ledger = new LedgerHarness();
    }

    private TransactionOutcome submit(ChronicleOperation... operations) {
        return ledger.processor.submit(ChronicleTransaction.create("alice", operations));
    }

    // ========== Commit Tests ==========

    @Test
    @DisplayName("Committed transaction writes its fragments and records an event")
    void testCommitWritesState() {
        TransactionOutcome outcome = submit(
            CreateNamespace.of(NS),
            StartActivity.of(NS, BUILD, T),
            ActivityUses.of(NS, SOURCE, BUILD));

        assertTrue(outcome.isCommitted());
        assertThat(outcome.writtenAddresses()).containsExactlyInAnyOrder(
            LedgerAddress.namespace(NS),
            LedgerAddress.inNamespace(NS, BUILD),
            LedgerAddress.inNamespace(NS, SOURCE));
        assertEquals(3, ledger.stateRepository.count());

        LedgerEvent event = ledger.eventRepository.findByTransactionId(outcome.transactionId()).orElseThrow();
        assertEquals(LedgerEventType.COMMITTED, event.type());
        assertEquals(outcome.eventSequence(), event.sequenceNumber());
        assertEquals(3, event.payload().get("operationCount").asInt());
        assertEquals(NS.toIri(), event.payload().get("namespaces").get(0).asText());
    }

    @Test
    @DisplayName("Delta holds exactly the written fragments")
    void testDeltaMatchesWrittenState() {
        TransactionOutcome outcome = submit(WasGeneratedBy.of(NS, ARTIFACT, BUILD));

        ProvModel delta = outcome.delta();
        assertTrue(delta.activity(NS, BUILD).isPresent());
        assertTrue(delta.entity(NS, ARTIFACT).isPresent());
        assertThat(delta.generated(NS, BUILD)).hasSize(1);
        assertThat(delta.generation(NS, ARTIFACT)).hasSize(1);
    }

    @Test
    @DisplayName("Later transactions see state committed by earlier ones")
    void testStateCarriesAcrossTransactions() {
        submit(StartActivity.of(NS, BUILD, T));

        TransactionOutcome outcome = submit(EndActivity.of(NS, BUILD, T.minusSeconds(1)));

        assertFalse(outcome.isCommitted());
        assertEquals(new ContradictionDetail.InvalidRange(T, T.minusSeconds(1)),
            outcome.contradiction().details().get(0));

        assertTrue(submit(EndActivity.of(NS, BUILD, T.plusSeconds(1))).isCommitted());
        ProvModel stored = ledger.stateRepository
            .findByAddress(LedgerAddress.inNamespace(NS, BUILD)).orElseThrow();
        assertEquals(T.plusSeconds(1), stored.activity(NS, BUILD).orElseThrow().ended());
    }

    @Test
    @DisplayName("Reasserting known provenance writes nothing")
    void testIdempotentResubmissionWritesNothing() {
        submit(WasAssociatedWith.create(NS, BUILD, ALICE, "operator"));

        TransactionOutcome repeat = submit(WasAssociatedWith.create(NS, BUILD, ALICE, "operator"));

        assertTrue(repeat.isCommitted());
        assertThat(repeat.writtenAddresses()).isEmpty();
        assertTrue(repeat.delta().isEmpty());
    }

    @Test
    @DisplayName("Only changed fragments are rewritten")
    void testOnlyDirtyFragmentsWritten() {
        submit(CreateNamespace.of(NS), ActivityUses.of(NS, SOURCE, BUILD));

        TransactionOutcome outcome = submit(StartActivity.of(NS, BUILD, T));

        assertEquals(List.of(LedgerAddress.inNamespace(NS, BUILD)), outcome.writtenAddresses());
    }

    // ========== Contradiction Tests ==========

    @Test
    @DisplayName("Contradicted transaction writes nothing, including earlier operations")
    void testContradictionIsAtomic() {
        submit(SetEntityAttributes.of(NS, ARTIFACT, text("color", "red")));
        long storedBefore = ledger.stateRepository.count();

        TransactionOutcome outcome = submit(
            StartActivity.of(NS, BUILD, T),
            SetEntityAttributes.of(NS, ARTIFACT, text("color", "blue")));

        assertFalse(outcome.isCommitted());
        assertEquals(1, outcome.failedOperationIndex());
        assertEquals(OperationType.SET_ENTITY_ATTRIBUTES, outcome.failedOperation());
        assertEquals(storedBefore, ledger.stateRepository.count());
        assertTrue(ledger.stateRepository.findByAddress(LedgerAddress.inNamespace(NS, BUILD)).isEmpty());

        ProvModel artifact = ledger.stateRepository
            .findByAddress(LedgerAddress.inNamespace(NS, ARTIFACT)).orElseThrow();
        assertEquals("red", artifact.entity(NS, ARTIFACT).orElseThrow().attributes().get("color").value().asText());
    }

    @Test
    @DisplayName("Contradiction is recorded as an event with its details")
    void testContradictionEvent() {
        submit(StartActivity.of(NS, BUILD, T));

        TransactionOutcome outcome = submit(StartActivity.of(NS, BUILD, T.plusSeconds(5)));

        LedgerEvent event = ledger.eventRepository.findByTransactionId(outcome.transactionId()).orElseThrow();
        assertEquals(LedgerEventType.CONTRADICTED, event.type());
        JsonNode payload = event.payload();
        assertEquals(0, payload.get("operationIndex").asInt());
        assertEquals("START_ACTIVITY", payload.get("operationType").asText());
        assertEquals("CONTRADICTION", payload.get("errorCode").asText());
        assertEquals(BUILD.toIri(), payload.get("resource").asText());
        assertEquals("StartAlteration", payload.get("details").get(0).get("kind").asText());
        assertThat(ledger.operationLog.findByNamespace(NS)).hasSize(1);
    }

    @Test
    @DisplayName("Empty transaction is rejected")
    void testEmptyTransactionRejected() {
        TransactionRejectedException e = assertThrows(TransactionRejectedException.class,
            () -> ledger.processor.submit(ChronicleTransaction.create(List.of(), "alice")));

        assertEquals(TransactionRejectedException.ERROR_CODE, e.getErrorCode());
        assertTrue(ledger.eventRepository.findAll().isEmpty());
    }

    // ========== Operation Log & Metrics Tests ==========

    @Test
    @DisplayName("Committed operations are appended to the namespace log in order")
    void testOperationLogAppended() {
        submit(StartActivity.of(NS, BUILD, T), EndActivity.of(NS, BUILD, T.plusSeconds(1)));
        submit(ActivityUses.of(NS, SOURCE, BUILD));

        assertThat(ledger.operationLog.findByNamespace(NS))
            .extracting(entry -> entry.operation().type())
            .containsExactly(OperationType.START_ACTIVITY, OperationType.END_ACTIVITY, OperationType.ACTIVITY_USES);
        assertEquals(3, ledger.operationLog.getNextSequenceNumber(NS));
    }

    @Test
    @DisplayName("Operation log can be disabled")
    void testOperationLogDisabled() {
        LedgerHarness quiet = new LedgerHarness(new LedgerProperties(1, null, false));

        quiet.processor.submit(ChronicleTransaction.create("alice", StartActivity.of(NS, BUILD, T)));

        assertTrue(quiet.operationLog.findByNamespace(NS).isEmpty());
        assertEquals(2, quiet.stateRepository.count());
    }

    @Test
    @DisplayName("Outcomes are counted by metrics")
    void testMetricsRecorded() {
        submit(StartActivity.of(NS, BUILD, T));
        submit(StartActivity.of(NS, BUILD, T.plusSeconds(1)));

        assertEquals(1.0, ledger.meterRegistry.get(LedgerMetrics.TRANSACTIONS_COMMITTED).counter().count());
        assertEquals(1.0, ledger.meterRegistry.get(LedgerMetrics.TRANSACTIONS_CONTRADICTED)
            .tag("kind", "StartAlteration").counter().count());
        assertEquals(1.0, ledger.meterRegistry.get(LedgerMetrics.OPERATIONS_APPLIED)
            .tag("type", "START_ACTIVITY").counter().count());
        assertEquals(2.0, ledger.meterRegistry.get(LedgerMetrics.DIRTY_ADDRESSES).counter().count());
    }
}
