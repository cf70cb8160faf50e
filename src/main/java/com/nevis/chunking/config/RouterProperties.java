package com.nevis.chunking.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.router")
public record RouterProperties(
    @NotNull @DecimalMin("0.0") @DecimalMax("1.0") Double boundaryWeight,
    @NotNull @DecimalMin("0.0") @DecimalMax("1.0") Double sizeWeight,
    @NotNull @DecimalMin("0.0") @DecimalMax("1.0") Double complexityWeight,
    @NotNull @DecimalMin("0.0") @DecimalMax("1.0") Double confidenceMin
) {}
