package com.nevis.chunking.service;

import com.nevis.chunking.model.ArticleError;
import com.nevis.chunking.model.BatchResult;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Thread-safe accumulator behind a {@link BatchResult}.
 */
class BatchTally {

    private int articlesProcessed;
    private int articlesFailed;
    private int articlesCancelled;
    private int chunksCreated;
    private int llmRequests;
    private int chunksRefined;
    private int deniedByRateLimit;
    private int skippedByOpenCircuit;
    private int refinementFailures;
    private final List<ArticleError> errors = new ArrayList<>();

    synchronized void succeeded(ArticleOutcome outcome) {
        articlesProcessed++;
        chunksCreated += outcome.chunksCreated();
        llmRequests += outcome.llmRequests();
        chunksRefined += outcome.chunksRefined();
        deniedByRateLimit += outcome.deniedByRateLimit();
        skippedByOpenCircuit += outcome.skippedByOpenCircuit();
        refinementFailures += outcome.refinementFailures();
        errors.addAll(outcome.warnings());
    }

    synchronized void failedPermanently(ArticleError error) {
        articlesFailed++;
        errors.add(error);
    }

    synchronized void cancelled(int articles) {
        articlesCancelled += articles;
    }

    synchronized BatchResult toResult(int retryRounds, Duration elapsed) {
        return new BatchResult(articlesProcessed, articlesFailed, articlesCancelled, chunksCreated, llmRequests, chunksRefined,
            deniedByRateLimit, skippedByOpenCircuit, refinementFailures, retryRounds, elapsed, errors);
    }
}
