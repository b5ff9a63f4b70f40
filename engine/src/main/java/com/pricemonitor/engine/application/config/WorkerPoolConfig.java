package com.pricemonitor.engine.application.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Fixed-size pool that runs product groups. Keep {@code engine.ingestion.parallelism} at or below
 * the Hikari pool size, since every running group holds a connection while it writes.
 */
@Configuration
public class WorkerPoolConfig {

    @Bean
    public ThreadPoolTaskExecutor ingestWorkerPool(EngineProperties properties) {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.ingestion().parallelism());
        executor.setMaxPoolSize(properties.ingestion().parallelism());
        executor.setThreadNamePrefix("ingest-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
