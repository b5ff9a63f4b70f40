package com.pricemonitor.engine.application.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "engine")
public record EngineProperties(
        @NotNull @Valid Normalizer normalizer,
        @NotNull @Valid Ingestion ingestion,
        @NotNull @Valid Classifier classifier,
        @NotNull @Valid Anomaly anomaly,
        @NotNull @Valid Retry retry,
        @NotNull @Valid Batch batch) {

    public record Normalizer(@NotNull List<String> trackingParameters, @NotBlank String defaultCurrency) {}

    public record Ingestion(
            @NotNull Duration dedupTolerance,
            @NotNull Duration reconfirmInterval,
            @Min(1) int parallelism,
            @NotNull Duration productTimeout) {}

    public record Classifier(
            @NotNull @PositiveOrZero BigDecimal epsilon,
            @NotNull @Positive BigDecimal mediumSignificance,
            @NotNull @Positive BigDecimal highSignificance) {}

    public record Anomaly(
            @Min(2) int windowSize,
            @Min(2) int minWindowSize,
            @Positive double deviationFactor,
            @DecimalMin("1.0") double jumpFactor,
            @PositiveOrZero double minRelativeDeviation) {}

    public record Retry(@Min(1) int maxAttempts, @NotNull Duration initialBackoff, @DecimalMin("1.0") double multiplier) {}

    /** {@code cron} set to {@code -} disables the scheduled job. */
    public record Batch(
            @NotNull Path inboxDir,
            @NotNull Path processedDir,
            @NotNull Path failedDir,
            @NotBlank String cron) {}
}
