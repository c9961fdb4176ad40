package com.chronicle.engine.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics configuration for the ledger host.
 *
 * Configures:
 * - Common tags for all metrics
 * - The ledger meter binder
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> registry.config()
            .commonTags("application", "chronicle-ledger");
    }

    @Bean
    public LedgerMetrics ledgerMetrics() {
        return new LedgerMetrics();
    }
}
