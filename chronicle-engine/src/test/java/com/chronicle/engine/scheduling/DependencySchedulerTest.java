package com.chronicle.engine.scheduling;

import com.chronicle.core.exception.TransactionRejectedException;
import com.chronicle.core.id.ActivityId;
import com.chronicle.core.id.NamespaceId;
import com.chronicle.core.ledger.OperationProcessor;
import com.chronicle.core.operation.ActivityUses;
import com.chronicle.core.operation.ChronicleTransaction;
import com.chronicle.core.operation.EndActivity;
import com.chronicle.core.operation.SetEntityAttributes;
import com.chronicle.core.operation.StartActivity;
import com.chronicle.engine.config.LedgerProperties;
import com.chronicle.engine.history.ProvenanceQueryService;
import com.chronicle.engine.processor.TransactionOutcome;
import com.chronicle.engine.processor.TransactionProcessor;
import com.chronicle.engine.test.LedgerHarness;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static com.chronicle.engine.test.LedgerHarness.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Parallel validation of independent transactions.
 *
 * Transactions sharing an address must see each other's effects in submission order;
 * transactions in different namespaces never conflict.
 */
@DisplayName("Dependency Scheduler Tests")
public class DependencySchedulerTest {

    private static final NamespaceId NS_A = LedgerHarness.namespace("a");
    private static final NamespaceId NS_B = LedgerHarness.namespace("b");

    private LedgerHarness ledger;
    private DependencyScheduler scheduler;

    @BeforeEach
    void setUp() {
        ledger = new LedgerHarness();
        scheduler = new DependencyScheduler(ledger.processor,
            new LedgerProperties(4, Duration.ofSeconds(5), true));
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    // ========== Partition Tests ==========

    @Test
    @DisplayName("Transactions in different namespaces share a wave")
    void testDisjointTransactionsShareWave() {
        ChronicleTransaction a = ChronicleTransaction.create("alice", StartActivity.of(NS_A, BUILD, T));
        ChronicleTransaction b = ChronicleTransaction.create("bob", StartActivity.of(NS_B, BUILD, T));

        List<List<ChronicleTransaction>> waves = DependencyScheduler.partition(List.of(a, b));

        assertEquals(List.of(List.of(a, b)), waves);
    }

    @Test
    @DisplayName("Conflicting transactions run in later waves, in submission order")
    void testConflictingTransactionsAreOrdered() {
        ChronicleTransaction first = ChronicleTransaction.create("alice", StartActivity.of(NS_A, BUILD, T));
        ChronicleTransaction other = ChronicleTransaction.create("bob", StartActivity.of(NS_B, BUILD, T));
        ChronicleTransaction second = ChronicleTransaction.create("alice",
            EndActivity.of(NS_A, BUILD, T.plusSeconds(1)));
        ChronicleTransaction third = ChronicleTransaction.create("alice",
            ActivityUses.of(NS_A, SOURCE, BUILD));

        List<List<ChronicleTransaction>> waves = DependencyScheduler.partition(
            List.of(first, other, second, third));

        assertEquals(List.of(List.of(first, other), List.of(second), List.of(third)), waves);
    }

    @Test
    @DisplayName("Empty batch has no waves")
    void testEmptyBatch() {
        assertTrue(DependencyScheduler.partition(List.of()).isEmpty());
        assertTrue(scheduler.submitAll(List.of()).isEmpty());
    }

    // ========== Submission Tests ==========

    @Test
    @DisplayName("Outcomes are returned in submission order")
    void testOutcomesInSubmissionOrder() {
        List<ChronicleTransaction> batch = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            NamespaceId ns = LedgerHarness.namespace("ns-" + (i % 5));
            batch.add(ChronicleTransaction.create("alice",
                StartActivity.of(ns, ActivityId.fromExternalId("activity-" + i), T)));
        }

        List<TransactionOutcome> outcomes = scheduler.submitAll(batch);

        assertThat(outcomes).extracting(TransactionOutcome::transactionId)
            .containsExactlyElementsOf(batch.stream().map(ChronicleTransaction::transactionId).collect(Collectors.toList()));
        assertThat(outcomes).allMatch(TransactionOutcome::isCommitted);
    }

    @Test
    @DisplayName("Parallel validation matches serial validation")
    void testEquivalentToSerialValidation() {
        List<ChronicleTransaction> batch = List.of(
            ChronicleTransaction.create("alice", SetEntityAttributes.of(NS_A, ARTIFACT, text("color", "red"))),
            ChronicleTransaction.create("bob", SetEntityAttributes.of(NS_B, ARTIFACT, text("color", "blue"))),
            ChronicleTransaction.create("alice", SetEntityAttributes.of(NS_A, ARTIFACT, text("color", "blue"))),
            ChronicleTransaction.create("bob", StartActivity.of(NS_B, BUILD, T)),
            ChronicleTransaction.create("bob", EndActivity.of(NS_B, BUILD, T.minusSeconds(1))));

        List<TransactionOutcome> parallel = scheduler.submitAll(batch);

        LedgerHarness serialLedger = new LedgerHarness();
        List<TransactionOutcome> serial = new ArrayList<>();
        for (ChronicleTransaction transaction : batch) {
            serial.add(serialLedger.processor.submit(transaction));
        }

        assertThat(parallel).extracting(TransactionOutcome::status)
            .containsExactlyElementsOf(serial.stream().map(TransactionOutcome::status).collect(Collectors.toList()));
        assertThat(parallel).extracting(TransactionOutcome::status).containsExactly(
            TransactionOutcome.Status.COMMITTED,
            TransactionOutcome.Status.COMMITTED,
            TransactionOutcome.Status.CONTRADICTED,
            TransactionOutcome.Status.COMMITTED,
            TransactionOutcome.Status.CONTRADICTED);

        for (NamespaceId ns : List.of(NS_A, NS_B)) {
            assertEquals(
                new ProvenanceQueryService(serialLedger.stateRepository, serialLedger.operationLog).currentModel(ns),
                new ProvenanceQueryService(ledger.stateRepository, ledger.operationLog).currentModel(ns));
        }
    }

    @Test
    @DisplayName("Batches are rejected after shutdown")
    void testRejectedAfterShutdown() {
        scheduler.shutdown();

        assertFalse(scheduler.isRunning());
        assertThrows(TransactionRejectedException.class, () -> scheduler.submit(
            ChronicleTransaction.create("alice", StartActivity.of(NS_A, BUILD, T))));
    }

    // ========== Failure Tests ==========

    @Test
    @DisplayName("A batch containing an empty transaction is rejected before anything is validated")
    void testMixedBatchRejectedUpfront() {
        ChronicleTransaction valid = ChronicleTransaction.create("alice", StartActivity.of(NS_A, BUILD, T));
        ChronicleTransaction empty = ChronicleTransaction.create(List.of(), "alice");

        assertThrows(TransactionRejectedException.class, () -> scheduler.submitAll(List.of(valid, empty)));

        assertEquals(0, ledger.stateRepository.count());
        assertTrue(ledger.eventRepository.findAll().isEmpty());
    }

    @Test
    @DisplayName("A batch repeating a transaction id is rejected before anything is validated")
    void testDuplicateTransactionIdRejected() {
        ChronicleTransaction first = new ChronicleTransaction("dup", List.of(StartActivity.of(NS_A, BUILD, T)), "alice");
        ChronicleTransaction second = new ChronicleTransaction("dup", List.of(StartActivity.of(NS_B, BUILD, T)), "bob");

        TransactionRejectedException error = assertThrows(TransactionRejectedException.class,
            () -> scheduler.submitAll(List.of(first, second)));

        assertThat(error.getMessage()).contains("dup");
        assertEquals(0, ledger.stateRepository.count());
        assertTrue(ledger.eventRepository.findAll().isEmpty());
    }

    @Test
    @DisplayName("An unexpected failure finishes its wave, skips later waves and reports partial outcomes")
    void testUnexpectedFailureAbortsBatch() {
        TransactionProcessor failing = new TransactionProcessor(new OperationProcessor(),
                ledger.stateRepository, ledger.eventRepository, ledger.operationLog,
                ledger.metrics, LedgerProperties.defaults(), new ObjectMapper()) {
            @Override
            public TransactionOutcome submit(ChronicleTransaction transaction) {
                if (transaction.transactionId().equals("broken")) {
                    throw new IllegalStateException("storage unavailable");
                }
                return super.submit(transaction);
            }
        };
        DependencyScheduler failingScheduler = new DependencyScheduler(failing,
            new LedgerProperties(4, Duration.ofSeconds(5), true));

        ChronicleTransaction first = ChronicleTransaction.create("alice", StartActivity.of(NS_A, BUILD, T));
        ChronicleTransaction broken = new ChronicleTransaction("broken",
            List.of(StartActivity.of(NS_B, BUILD, T)), "bob");
        ChronicleTransaction later = ChronicleTransaction.create("alice",
            EndActivity.of(NS_A, BUILD, T.plusSeconds(1)));

        try {
            BatchAbortedException error = assertThrows(BatchAbortedException.class,
                () -> failingScheduler.submitAll(List.of(first, broken, later)));

            assertEquals(BatchAbortedException.ERROR_CODE, error.getErrorCode());
            assertEquals(1, error.getFailedIndex());
            assertThat(error.getCause()).isInstanceOf(IllegalStateException.class);

            List<TransactionOutcome> outcomes = error.getOutcomes();
            assertEquals(3, outcomes.size());
            assertEquals(first.transactionId(), outcomes.get(0).transactionId());
            assertTrue(outcomes.get(0).isCommitted());
            assertNull(outcomes.get(1));
            assertNull(outcomes.get(2));
            assertTrue(ledger.eventRepository.findByTransactionId(later.transactionId()).isEmpty());
        } finally {
            failingScheduler.shutdown();
        }
    }
}
