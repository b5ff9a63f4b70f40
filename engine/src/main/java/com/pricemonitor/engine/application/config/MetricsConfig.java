package com.pricemonitor.engine.application.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricsConfig {

    @Bean
    public IngestMetrics ingestMetrics(MeterRegistry registry) {
        return new IngestMetrics(
                counter(registry, "engine.snapshots.received", "Raw records read from batch files"),
                counter(registry, "engine.snapshots.accepted", "Snapshots appended to price history"),
                counter(registry, "engine.snapshots.skipped", "Unchanged, stale or duplicate snapshots"),
                counter(registry, "engine.snapshots.rejected", "Records that failed normalization"),
                counter(registry, "engine.changes.recorded", "Change records persisted"),
                counter(registry, "engine.anomalies.detected", "Changes classified as anomalies"),
                counter(registry, "engine.alerts.fired", "Alerts persisted and handed to the notifier"),
                counter(registry, "engine.products.failed", "Product groups that ended with an error"),
                counter(registry, "engine.batches.failed", "Batch files that could not be ingested"));
    }

    private static Counter counter(MeterRegistry registry, String name, String description) {
        return Counter.builder(name).description(description).register(registry);
    }
}
