package com.chronicle.engine.scheduling;

import com.chronicle.core.exception.ChronicleException;
import com.chronicle.core.exception.TransactionRejectedException;
import com.chronicle.core.ledger.Dependencies;
import com.chronicle.core.ledger.LedgerAddress;
import com.chronicle.core.operation.ChronicleTransaction;
import com.chronicle.engine.config.LedgerProperties;
import com.chronicle.engine.processor.TransactionOutcome;
import com.chronicle.engine.processor.TransactionProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Validates batches of transactions in parallel where their dependencies allow.
 *
 * A batch is partitioned into waves: a transaction joins the wave after the latest
 * earlier transaction whose address set intersects its own. Transactions within a
 * wave share no address and are validated concurrently without locking; waves run
 * in order. The result is the same as validating the batch serially.
 */
public class DependencyScheduler {

    private static final Logger log = LoggerFactory.getLogger(DependencyScheduler.class);

    private final TransactionProcessor processor;
    private final ExecutorService executor;
    private final Duration shutdownTimeout;
    private volatile boolean running = true;

    public DependencyScheduler(TransactionProcessor processor, LedgerProperties properties) {
        this.processor = processor;
        this.shutdownTimeout = properties.shutdownTimeout();
        this.executor = Executors.newFixedThreadPool(properties.validatorThreads(), new ValidatorThreadFactory());
        log.info("Dependency scheduler started with {} validator threads", properties.validatorThreads());
    }

    /**
     * Partition a batch into conflict-free waves, preserving submission order within each wave.
     */
    public static List<List<ChronicleTransaction>> partition(List<ChronicleTransaction> batch) {
        List<List<ChronicleTransaction>> waves = new ArrayList<>();
        for (List<Integer> wave : partitionIndexes(batch)) {
            List<ChronicleTransaction> transactions = new ArrayList<>(wave.size());
            for (int index : wave) {
                transactions.add(batch.get(index));
            }
            waves.add(transactions);
        }
        return waves;
    }

    private static List<List<Integer>> partitionIndexes(List<ChronicleTransaction> batch) {
        List<List<Integer>> waves = new ArrayList<>();
        List<Set<LedgerAddress>> addressSets = new ArrayList<>();
        List<Integer> assigned = new ArrayList<>();

        for (int index = 0; index < batch.size(); index++) {
            Set<LedgerAddress> addresses = new HashSet<>(Dependencies.union(batch.get(index).operations()));

            int wave = 0;
            for (int earlier = 0; earlier < addressSets.size(); earlier++) {
                if (!Collections.disjoint(addressSets.get(earlier), addresses)) {
                    wave = Math.max(wave, assigned.get(earlier) + 1);
                }
            }

            addressSets.add(addresses);
            assigned.add(wave);
            while (waves.size() <= wave) {
                waves.add(new ArrayList<>());
            }
            waves.get(wave).add(index);
        }
        return waves;
    }

    /**
     * Validate a batch. Outcomes are returned in submission order.
     *
     * The whole batch is checked before anything is validated: a batch containing an
     * empty transaction or a repeated transaction id is rejected without side effects.
     *
     * @throws TransactionRejectedException if the scheduler has been shut down or the batch is malformed
     * @throws BatchAbortedException if validating a transaction fails with an unexpected error
     */
    public List<TransactionOutcome> submitAll(List<ChronicleTransaction> batch) {
        if (!running) {
            throw new TransactionRejectedException("Scheduler is shut down; batch of "
                + batch.size() + " transactions rejected");
        }
        checkBatch(batch);

        List<List<Integer>> waves = partitionIndexes(batch);
        log.debug("Batch of {} transactions partitioned into {} waves", batch.size(), waves.size());

        List<TransactionOutcome> outcomes = new ArrayList<>(Collections.nCopies(batch.size(), null));
        for (List<Integer> wave : waves) {
            List<Future<TransactionOutcome>> futures = new ArrayList<>(wave.size());
            for (int index : wave) {
                ChronicleTransaction transaction = batch.get(index);
                futures.add(executor.submit(() -> processor.submit(transaction)));
            }

            int failedIndex = -1;
            Throwable failure = null;
            for (int i = 0; i < wave.size(); i++) {
                int index = wave.get(i);
                try {
                    outcomes.set(index, await(futures.get(i)));
                } catch (RuntimeException e) {
                    log.error("Validation of transaction {} failed", batch.get(index).transactionId(), e);
                    if (failure == null) {
                        failedIndex = index;
                        failure = e;
                    }
                }
            }

            if (failure != null) {
                throw new BatchAbortedException(failedIndex, batch.get(failedIndex).transactionId(),
                    outcomes, failure);
            }
        }
        return outcomes;
    }

    public TransactionOutcome submit(ChronicleTransaction transaction) {
        return submitAll(List.of(transaction)).get(0);
    }

    private static void checkBatch(List<ChronicleTransaction> batch) {
        Set<String> ids = new HashSet<>();
        for (ChronicleTransaction transaction : batch) {
            if (transaction.operations().isEmpty()) {
                throw new TransactionRejectedException(transaction.transactionId(), "no operations");
            }
            if (!ids.add(transaction.transactionId())) {
                throw new TransactionRejectedException(transaction.transactionId(), "duplicate transaction id in batch");
            }
        }
    }

    private static TransactionOutcome await(Future<TransactionOutcome> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChronicleException("VALIDATION_INTERRUPTED", "Interrupted while awaiting validation", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new ChronicleException("VALIDATION_FAILED", "Transaction validation failed", e.getCause());
        }
    }

    /**
     * Stop accepting batches and wait for in-flight validation to finish.
     */
    public void shutdown() {
        running = false;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Validators did not finish within {}; forcing shutdown", shutdownTimeout);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Dependency scheduler stopped");
    }

    public boolean isRunning() {
        return running;
    }

    private static final class ValidatorThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "ledger-validator-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
