package com.chronicle.core.exception;

/**
 * Thrown when an operation conflicts with recorded provenance.
 * The working model must be discarded; nothing is written.
 */
public class ContradictionException extends ChronicleException {

    public static final String ERROR_CODE = "CONTRADICTION";

    private final Contradiction contradiction;

    public ContradictionException(Contradiction contradiction) {
        super(ERROR_CODE, contradiction.describe());
        this.contradiction = contradiction;
    }

    public Contradiction getContradiction() {
        return contradiction;
    }
}
