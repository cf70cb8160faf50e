package com.nevis.chunking.service;

import com.nevis.chunking.model.Article;
import com.nevis.chunking.model.ArticleError;

import java.util.List;

/**
 * Per-article counters. {@code failure} is set when the article did not make it to storage.
 */
record ArticleOutcome(
    Article article,
    int chunksCreated,
    int llmRequests,
    int chunksRefined,
    int deniedByRateLimit,
    int skippedByOpenCircuit,
    int refinementFailures,
    List<ArticleError> warnings,
    ArticleError failure
) {

    static ArticleOutcome failed(Article article, ArticleError failure) {
        return new ArticleOutcome(article, 0, 0, 0, 0, 0, 0, List.of(), failure);
    }

    boolean succeeded() {
        return failure == null;
    }
}
