package com.chronicle.core.exception;

/**
 * Thrown when a transaction cannot be accepted for validation.
 */
public class TransactionRejectedException extends ChronicleException {

    public static final String ERROR_CODE = "TRANSACTION_REJECTED";

    public TransactionRejectedException(String message) {
        super(ERROR_CODE, message);
    }

    public TransactionRejectedException(String transactionId, String reason) {
        super(ERROR_CODE, String.format("Transaction %s rejected: %s", transactionId, reason));
    }
}
