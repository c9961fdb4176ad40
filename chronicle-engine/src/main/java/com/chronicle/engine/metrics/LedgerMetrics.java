package com.chronicle.engine.metrics;

import com.chronicle.core.operation.OperationType;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.time.Duration;

/**
 * Metrics for the ledger host.
 *
 * Metrics exposed:
 * - Committed and contradicted transaction counts
 * - Operations applied, by type
 * - Dirty addresses written
 * - Transaction processing latency
 *
 * Recording is a no-op until the binder is bound to a registry.
 */
public class LedgerMetrics implements MeterBinder {

    public static final String TRANSACTIONS_COMMITTED = "chronicle.transactions.committed";
    public static final String TRANSACTIONS_CONTRADICTED = "chronicle.transactions.contradicted";
    public static final String OPERATIONS_APPLIED = "chronicle.operations.applied";
    public static final String DIRTY_ADDRESSES = "chronicle.state.dirty_addresses";
    public static final String PROCESSING_DURATION = "chronicle.transaction.duration";

    private MeterRegistry registry;

    private Counter committed;
    private Counter dirtyAddresses;

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        committed = Counter.builder(TRANSACTIONS_COMMITTED)
            .description("Total transactions committed")
            .register(registry);
        dirtyAddresses = Counter.builder(DIRTY_ADDRESSES)
            .description("Total state addresses rewritten")
            .register(registry);
    }

    public void transactionCommitted(int writtenAddresses, Duration duration) {
        if (registry == null) {
            return;
        }
        committed.increment();
        dirtyAddresses.increment(writtenAddresses);
        processingTimer("committed").record(duration);
    }

    public void transactionContradicted(OperationType operation, String contradictionKind, Duration duration) {
        if (registry == null) {
            return;
        }
        Counter.builder(TRANSACTIONS_CONTRADICTED)
            .tag("operation", operation.name())
            .tag("kind", contradictionKind)
            .description("Total transactions rejected by a contradiction")
            .register(registry)
            .increment();

        processingTimer("contradicted").record(duration);
    }

    public void operationApplied(OperationType operation) {
        if (registry == null) {
            return;
        }
        Counter.builder(OPERATIONS_APPLIED)
            .tag("type", operation.name())
            .description("Total operations applied to a working model")
            .register(registry)
            .increment();
    }

    private Timer processingTimer(String outcome) {
        return Timer.builder(PROCESSING_DURATION)
            .tag("outcome", outcome)
            .description("Transaction validation duration")
            .register(registry);
    }
}
