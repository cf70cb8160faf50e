package com.nevis.chunking.model;

import java.time.Duration;
import java.util.List;

/**
 * Aggregate outcome of one {@code processBatch} run. Every input article ends up processed, failed
 * or cancelled (never started because the run was cancelled). Rate-limit denials and open-circuit skips
 * are counted separately and never appear in {@link #errors()}.
 */
public record BatchResult(
    int articlesProcessed,
    int articlesFailed,
    int articlesCancelled,
    int chunksCreated,
    int llmRequests,
    int chunksRefined,
    int deniedByRateLimit,
    int skippedByOpenCircuit,
    int refinementFailures,
    int retryRounds,
    Duration elapsed,
    List<ArticleError> errors
) {
    public BatchResult {
        errors = List.copyOf(errors);
    }

    public static BatchResult empty() {
        return new BatchResult(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, Duration.ZERO, List.of());
    }
}
