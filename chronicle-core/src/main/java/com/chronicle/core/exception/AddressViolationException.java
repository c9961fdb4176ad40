package com.chronicle.core.exception;

/**
 * Thrown when processing produces state outside the transaction's declared dependencies.
 */
public class AddressViolationException extends ChronicleException {

    public static final String ERROR_CODE = "ADDRESS_VIOLATION";

    private final String address;

    public AddressViolationException(String transactionId, String address) {
        super(ERROR_CODE, String.format(
            "Transaction %s produced output for undeclared address %s", transactionId, address));
        this.address = address;
    }

    public String getAddress() {
        return address;
    }
}
