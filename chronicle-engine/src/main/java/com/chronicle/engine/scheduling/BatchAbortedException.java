package com.chronicle.engine.scheduling;

import com.chronicle.core.exception.ChronicleException;
import com.chronicle.engine.processor.TransactionOutcome;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Thrown when validating a transaction fails with an error other than a contradiction.
 *
 * Every transaction of the failing wave has been awaited; later waves were not run.
 * {@link #getOutcomes()} is indexed like the submitted batch and holds null for
 * transactions that failed or were never validated.
 */
public class BatchAbortedException extends ChronicleException {

    public static final String ERROR_CODE = "BATCH_ABORTED";

    private final List<TransactionOutcome> outcomes;
    private final int failedIndex;

    public BatchAbortedException(int failedIndex, String transactionId, List<TransactionOutcome> outcomes,
                                 Throwable cause) {
        super(ERROR_CODE, String.format("Batch aborted at transaction %d (%s): %s",
            failedIndex, transactionId, cause.getMessage()), cause);
        this.failedIndex = failedIndex;
        this.outcomes = Collections.unmodifiableList(new ArrayList<>(outcomes));
    }

    public List<TransactionOutcome> getOutcomes() {
        return outcomes;
    }

    public int getFailedIndex() {
        return failedIndex;
    }
}
