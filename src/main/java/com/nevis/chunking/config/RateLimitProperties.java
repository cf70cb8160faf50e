package com.nevis.chunking.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.rate-limit")
public record RateLimitProperties(
    @NotNull @Min(1) Integer callsPerMinute,
    @NotNull @Min(1) Integer callsPerDomainPerMinute,
    @NotNull @Min(1) Integer maxCallsPerBatch,
    @NotNull @DecimalMin("0.0") @DecimalMax("1.0") Double maxShareOfBatch,
    @NotNull @DecimalMin("0.0") Double dailyCostLimit,
    @NotNull @DecimalMin("0.0") Double costPerInputToken,
    @NotNull @DecimalMin("0.0") Double costPerOutputToken,
    @NotBlank String costZone
) {}
