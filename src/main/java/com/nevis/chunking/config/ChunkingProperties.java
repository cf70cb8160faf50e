package com.nevis.chunking.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.chunking")
public record ChunkingProperties(
    @NotNull @Min(1) Integer targetWords,
    @NotNull @Min(0) Integer overlapWords,
    @NotNull @Min(1) Integer minWords,
    @NotNull @Min(1) Integer maxWords,
    @NotNull @Min(0) Integer minChars,
    @NotNull @Min(0) Integer maxOffset
) {}
