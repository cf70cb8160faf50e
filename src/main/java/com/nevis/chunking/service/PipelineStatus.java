package com.nevis.chunking.service;

import com.nevis.chunking.infra.CircuitBreakerSnapshot;
import com.nevis.chunking.infra.RateLimiterSnapshot;
import com.nevis.chunking.model.JobCounts;

public record PipelineStatus(
    CircuitBreakerSnapshot circuitBreaker,
    RateLimiterSnapshot rateLimiter,
    JobCounts jobs,
    int articlesInFlight,
    long settingsVersion
) {
}
