package com.chronicle.core.model;

/**
 * Outcomes recorded in the ledger event log.
 */
public enum LedgerEventType {
    COMMITTED,
    CONTRADICTED
}
