package com.pricemonitor.engine.application.config;

import com.pricemonitor.engine.infrastructure.batch.BatchInbox;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class BatchConfig {

    @Bean
    public BatchInbox batchInbox(EngineProperties properties) {
        var batch = properties.batch();
        return new BatchInbox(batch.inboxDir(), batch.processedDir(), batch.failedDir());
    }
}
