package com.nevis.chunking.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Finished jobs stay queryable for {@code finishedJobRetention}, then their status is dropped.
 */
@Validated
@ConfigurationProperties(prefix = "app.batch")
public record BatchProperties(
    @NotNull @Min(1) Integer batchSize,
    @NotNull @Min(1) Integer maxConcurrentBatches,
    @NotNull @Min(1) Integer maxInFlightArticles,
    @NotNull Double backpressureThreshold,
    boolean retryFailedArticles,
    @NotNull @Min(0) Integer maxRetries,
    @NotNull @Min(1) Integer maxConcurrentJobs,
    @NotNull @Min(1) Integer jobSize,
    @NotNull Duration finishedJobRetention
) {}
