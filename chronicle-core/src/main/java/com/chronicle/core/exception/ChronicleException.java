package com.chronicle.core.exception;

/**
 * Base exception for all Chronicle errors.
 */
public class ChronicleException extends RuntimeException {

    private final String errorCode;

    public ChronicleException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ChronicleException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
