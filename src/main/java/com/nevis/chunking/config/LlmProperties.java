package com.nevis.chunking.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "app.llm")
public record LlmProperties(
    String apiKey,
    @NotBlank String modelName,
    @NotNull Duration timeout,
    @NotNull @Min(0) Integer maxRetries,
    @NotNull Duration baseDelay,
    @NotNull Duration maxDelay,
    @NotNull @Min(1) Integer breakerThreshold,
    @NotNull Duration breakerTimeout,
    @NotNull @DecimalMin("0.0") @DecimalMax("2.0") Double temperature,
    @NotNull @Min(1) Integer maxOutputTokens,
    boolean logRequests
) {}
