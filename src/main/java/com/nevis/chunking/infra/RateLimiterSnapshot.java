package com.nevis.chunking.infra;

import java.time.LocalDate;
import java.util.Map;

public record RateLimiterSnapshot(
    long globalCallsLeft,
    Map<String, Long> domainCallsLeft,
    Map<String, BatchUsage> batches,
    LocalDate costDay,
    double costSpent,
    double costReserved
) {

    public record BatchUsage(int used, int limit) {}
}
