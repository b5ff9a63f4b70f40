package com.pricemonitor.engine.application.config;

import com.pricemonitor.engine.domain.anomaly.AnomalyDetector;
import com.pricemonitor.engine.domain.anomaly.AnomalySettings;
import com.pricemonitor.engine.domain.classification.ChangeClassifier;
import com.pricemonitor.engine.domain.classification.ClassifierSettings;
import com.pricemonitor.engine.domain.history.HistoryStore;
import com.pricemonitor.engine.domain.ingestion.IngestionCoordinator;
import com.pricemonitor.engine.domain.ingestion.IngestionSettings;
import com.pricemonitor.engine.domain.ingestion.ProductGroupProcessor;
import com.pricemonitor.engine.domain.ingestion.ProductLockRegistry;
import com.pricemonitor.engine.domain.ingestion.RetryPolicy;
import com.pricemonitor.engine.domain.ingestion.StoreRetrier;
import com.pricemonitor.engine.domain.notification.AlertNotifier;
import com.pricemonitor.engine.domain.rule.AlertRuleEngine;
import com.pricemonitor.engine.domain.rule.RuleSource;
import com.pricemonitor.engine.domain.snapshot.NormalizerSettings;
import com.pricemonitor.engine.domain.snapshot.SnapshotNormalizer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Builds the framework-free engine from {@link EngineProperties}.
 */
@Configuration
@EnableConfigurationProperties(EngineProperties.class)
public class EngineConfig {

    @Bean
    public SnapshotNormalizer snapshotNormalizer(EngineProperties properties) {
        var normalizer = properties.normalizer();
        return new SnapshotNormalizer(NormalizerSettings.builder()
                .trackingParameters(normalizer.trackingParameters())
                .defaultCurrency(normalizer.defaultCurrency())
                .build());
    }

    @Bean
    public ChangeClassifier changeClassifier(EngineProperties properties) {
        var classifier = properties.classifier();
        return new ChangeClassifier(ClassifierSettings.builder()
                .epsilon(classifier.epsilon())
                .mediumSignificance(classifier.mediumSignificance())
                .highSignificance(classifier.highSignificance())
                .build());
    }

    @Bean
    public AnomalyDetector anomalyDetector(EngineProperties properties) {
        var anomaly = properties.anomaly();
        return new AnomalyDetector(AnomalySettings.builder()
                .windowSize(anomaly.windowSize())
                .minWindowSize(anomaly.minWindowSize())
                .deviationFactor(anomaly.deviationFactor())
                .jumpFactor(anomaly.jumpFactor())
                .minRelativeDeviation(anomaly.minRelativeDeviation())
                .build());
    }

    @Bean
    public AlertRuleEngine alertRuleEngine() {
        return new AlertRuleEngine();
    }

    @Bean
    public StoreRetrier storeRetrier(EngineProperties properties) {
        var retry = properties.retry();
        return new StoreRetrier(new RetryPolicy(retry.maxAttempts(), retry.initialBackoff(), retry.multiplier()));
    }

    @Bean
    public ProductLockRegistry productLockRegistry() {
        return new ProductLockRegistry();
    }

    @Bean
    public ProductGroupProcessor productGroupProcessor(
            HistoryStore historyStore,
            RuleSource ruleSource,
            ChangeClassifier changeClassifier,
            AnomalyDetector anomalyDetector,
            AlertRuleEngine alertRuleEngine,
            AlertNotifier alertNotifier,
            StoreRetrier storeRetrier,
            ProductLockRegistry productLockRegistry,
            EngineProperties properties) {
        return new ProductGroupProcessor(
                historyStore,
                ruleSource,
                changeClassifier,
                anomalyDetector,
                alertRuleEngine,
                alertNotifier,
                storeRetrier,
                productLockRegistry,
                properties.ingestion().reconfirmInterval());
    }

    @Bean
    public IngestionCoordinator ingestionCoordinator(
            SnapshotNormalizer snapshotNormalizer,
            ProductGroupProcessor productGroupProcessor,
            ThreadPoolTaskExecutor ingestWorkerPool,
            EngineProperties properties) {
        var ingestion = properties.ingestion();
        return new IngestionCoordinator(
                snapshotNormalizer,
                productGroupProcessor,
                IngestionSettings.builder()
                        .dedupTolerance(ingestion.dedupTolerance())
                        .reconfirmInterval(ingestion.reconfirmInterval())
                        .productTimeout(ingestion.productTimeout())
                        .build(),
                ingestWorkerPool.getThreadPoolExecutor());
    }
}
