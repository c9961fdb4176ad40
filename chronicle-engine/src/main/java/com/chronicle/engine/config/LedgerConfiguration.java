package com.chronicle.engine.config;

import com.chronicle.core.ledger.OperationProcessor;
import com.chronicle.engine.processor.TransactionProcessor;
import com.chronicle.engine.scheduling.DependencyScheduler;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the ledger host: processor, repositories, scheduler and query services.
 */
@Configuration
@ComponentScan(basePackages = "com.chronicle.engine")
@EnableConfigurationProperties(LedgerProperties.class)
public class LedgerConfiguration {

    @Bean
    public OperationProcessor operationProcessor() {
        return new OperationProcessor();
    }

    @Bean
    public ObjectMapper ledgerObjectMapper() {
        return new ObjectMapper();
    }

    @Bean(destroyMethod = "shutdown")
    public DependencyScheduler dependencyScheduler(TransactionProcessor transactionProcessor,
                                                   LedgerProperties properties) {
        return new DependencyScheduler(transactionProcessor, properties);
    }
}
