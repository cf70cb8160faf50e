package com.nevis.chunking.infra;

import java.time.Instant;

public record CircuitBreakerSnapshot(
    BreakerState state,
    int failedCalls,
    Instant lastTransitionAt
) {
}
