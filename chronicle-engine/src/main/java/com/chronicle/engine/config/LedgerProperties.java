package com.chronicle.engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Ledger host settings, bound from {@code chronicle.ledger.*}.
 *
 * @param validatorThreads size of the pool validating independent transactions
 * @param shutdownTimeout how long to wait for in-flight validation on shutdown
 * @param recordOperationLog whether committed operations are appended to the operation log
 */
@ConfigurationProperties(prefix = "chronicle.ledger")
public record LedgerProperties(
    Integer validatorThreads,
    Duration shutdownTimeout,
    Boolean recordOperationLog
) {

    public static final int DEFAULT_VALIDATOR_THREADS = 4;
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    public LedgerProperties {
        if (validatorThreads == null || validatorThreads <= 0) {
            validatorThreads = DEFAULT_VALIDATOR_THREADS;
        }
        if (shutdownTimeout == null || shutdownTimeout.isNegative()) {
            shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;
        }
        if (recordOperationLog == null) {
            recordOperationLog = Boolean.TRUE;
        }
    }

    public static LedgerProperties defaults() {
        return new LedgerProperties(null, null, null);
    }
}
