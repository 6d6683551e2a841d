package org.influence.analytics.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Thread pools of the engine. Warehouse plans, enrichment fetches and exports each get their
 * own bounded pool so a slow dependency cannot starve the others.
 */
@Configuration
public class ExecutorConfig {

    @Value("${engine.executor.warehouse.core-size:4}")
    private int warehouseCoreSize;

    @Value("${engine.executor.warehouse.max-size:8}")
    private int warehouseMaxSize;

    @Value("${engine.executor.enrichment.core-size:4}")
    private int enrichmentCoreSize;

    @Value("${engine.executor.enrichment.max-size:8}")
    private int enrichmentMaxSize;

    @Value("${engine.executor.export.core-size:2}")
    private int exportCoreSize;

    @Value("${engine.executor.export.max-size:4}")
    private int exportMaxSize;

    @Value("${engine.executor.queue-capacity:100}")
    private int queueCapacity;

    @Bean(name = "warehouseExecutor")
    public Executor warehouseExecutor() {
        return pool(warehouseCoreSize, warehouseMaxSize, "warehouse-");
    }

    @Bean(name = "enrichmentExecutor")
    public Executor enrichmentExecutor() {
        return pool(enrichmentCoreSize, enrichmentMaxSize, "enrichment-");
    }

    @Bean(name = "exportExecutor")
    public Executor exportExecutor() {
        return pool(exportCoreSize, exportMaxSize, "export-");
    }

    private ThreadPoolTaskExecutor pool(int coreSize, int maxSize, String prefix) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(prefix);
        executor.initialize();
        return executor;
    }
}
