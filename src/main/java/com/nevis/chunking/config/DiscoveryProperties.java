package com.nevis.chunking.config;

import com.nevis.chunking.model.JobPriority;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.discovery")
public record DiscoveryProperties(
    boolean enabled,
    @NotNull @Min(1) Integer batchLimit,
    @NotNull JobPriority priority
) {}
