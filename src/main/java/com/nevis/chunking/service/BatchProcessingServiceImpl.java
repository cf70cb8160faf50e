package com.nevis.chunking.service;

import com.nevis.chunking.config.BatchProperties;
import com.nevis.chunking.config.PipelineSettings;
import com.nevis.chunking.config.PipelineSettingsHolder;
import com.nevis.chunking.exception.ChunkingException;
import com.nevis.chunking.infra.BackpressureGate;
import com.nevis.chunking.infra.RateLimiter;
import com.nevis.chunking.model.Article;
import com.nevis.chunking.model.ArticleError;
import com.nevis.chunking.model.BatchResult;
import com.nevis.chunking.model.ErrorKind;
import com.nevis.chunking.model.ProcessingContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Splits articles into batches and runs up to {@code maxConcurrentBatches} of them at once.
 * <p>
 * Each batch works in two phases. First every article is chunked and routed, which fixes the
 * batch's chunk total and with it the share of chunks allowed to reach the provider. Then the
 * flagged chunks are refined, articles in parallel, and the results are stored.
 */
@Service
@Slf4j
public class BatchProcessingServiceImpl implements BatchProcessingService {

    private final ArticleProcessor articleProcessor;
    private final PipelineSettingsHolder settingsHolder;
    private final RateLimiter rateLimiter;
    private final BackpressureGate backpressureGate;
    private final Executor batchExecutor;
    private final Executor articleExecutor;
    private final Clock clock;
    private final AtomicLong batchSequence = new AtomicLong();

    public BatchProcessingServiceImpl(
        ArticleProcessor articleProcessor,
        PipelineSettingsHolder settingsHolder,
        @Qualifier("llmRateLimiter") RateLimiter rateLimiter,
        BackpressureGate backpressureGate,
        @Qualifier("batchTaskExecutor") Executor batchExecutor,
        @Qualifier("articleTaskExecutor") Executor articleExecutor,
        Clock clock
    ) {
        this.articleProcessor = articleProcessor;
        this.settingsHolder = settingsHolder;
        this.rateLimiter = rateLimiter;
        this.backpressureGate = backpressureGate;
        this.batchExecutor = batchExecutor;
        this.articleExecutor = articleExecutor;
        this.clock = clock;
    }

    @Override
    public BatchResult processBatch(List<Article> articles, ProcessingContext context) {
        Instant started = clock.instant();
        BatchProperties batch = settingsHolder.current().batch();
        BatchTally tally = new BatchTally();

        log.info("Job {}: processing {} articles in batches of {}", context.jobId(), articles.size(), batch.batchSize());

        List<Article> pending = articles;
        int round = 0;
        while (true) {
            Map<UUID, ArticleOutcome> failed = runRound(pending, batch, context, tally);
            if (failed.isEmpty()) {
                break;
            }
            boolean retry = batch.retryFailedArticles() && round < batch.maxRetries() && !context.isCancelled();
            if (!retry) {
                failed.values().forEach(outcome -> tally.failedPermanently(outcome.failure()));
                break;
            }
            round++;
            log.info("Job {}: retrying {} failed articles, round {} of {}", context.jobId(), failed.size(), round, batch.maxRetries());
            pending = failed.values().stream().map(ArticleOutcome::article).toList();
        }

        BatchResult result = tally.toResult(round, Duration.between(started, clock.instant()));
        log.info("Job {}: {} articles processed, {} failed, {} cancelled, {} chunks, {} refined, {} denied by rate limit, {} skipped by open circuit",
            context.jobId(), result.articlesProcessed(), result.articlesFailed(), result.articlesCancelled(), result.chunksCreated(),
            result.chunksRefined(), result.deniedByRateLimit(), result.skippedByOpenCircuit());
        return result;
    }

    private Map<UUID, ArticleOutcome> runRound(List<Article> articles, BatchProperties batch, ProcessingContext context, BatchTally tally) {
        Map<UUID, ArticleOutcome> failed = new LinkedHashMap<>();
        Semaphore batchSlots = new Semaphore(batch.maxConcurrentBatches());
        List<CompletableFuture<List<ArticleOutcome>>> running = new ArrayList<>();
        int started = 0;

        try {
            for (int from = 0; from < articles.size(); from += batch.batchSize()) {
                if (context.isCancelled()) {
                    log.info("Job {}: cancelled, no further batches are started", context.jobId());
                    break;
                }
                List<Article> slice = articles.subList(from, Math.min(from + batch.batchSize(), articles.size()));

                batchSlots.acquire();
                if (!backpressureGate.enter(slice.size(), context::isCancelled)) {
                    batchSlots.release();
                    break;
                }

                String batchId = context.jobId() + "-" + batchSequence.incrementAndGet();
                started += slice.size();
                running.add(CompletableFuture.supplyAsync(() -> {
                    try {
                        return runBatch(batchId, slice, context, tally);
                    } finally {
                        backpressureGate.leave(slice.size());
                        batchSlots.release();
                    }
                }, batchExecutor));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Job {}: interrupted while waiting for batch capacity", context.jobId());
        }
        tally.cancelled(articles.size() - started);

        for (CompletableFuture<List<ArticleOutcome>> future : running) {
            for (ArticleOutcome outcome : future.join()) {
                if (outcome.succeeded()) {
                    tally.succeeded(outcome);
                } else {
                    failed.put(outcome.article().id(), outcome);
                }
            }
        }
        return failed;
    }

    private List<ArticleOutcome> runBatch(String batchId, List<Article> articles, ProcessingContext context, BatchTally tally) {
        List<CompletableFuture<Preparation>> preparing = new ArrayList<>();
        for (Article article : articles) {
            if (context.isCancelled()) {
                break;
            }
            PipelineSettings settings = settingsHolder.current();
            preparing.add(CompletableFuture.supplyAsync(() -> prepare(article, settings), articleExecutor));
        }
        tally.cancelled(articles.size() - preparing.size());

        List<ArticleOutcome> outcomes = new ArrayList<>();
        List<PreparedArticle> prepared = new ArrayList<>();
        for (CompletableFuture<Preparation> future : preparing) {
            Preparation result = future.join();
            if (result.failure() == null) {
                prepared.add(result.ready());
            } else {
                outcomes.add(result.failure());
            }
        }

        int totalChunks = prepared.stream().mapToInt(p -> p.chunks().size()).sum();
        rateLimiter.beginBatch(batchId, totalChunks);
        try {
            List<CompletableFuture<ArticleOutcome>> completing = prepared.stream()
                .map(p -> CompletableFuture.supplyAsync(() -> complete(p, batchId), articleExecutor))
                .toList();
            completing.forEach(future -> outcomes.add(future.join()));
        } finally {
            rateLimiter.endBatch(batchId);
        }
        log.debug("Batch {} finished: {} articles, {} chunks", batchId, outcomes.size(), totalChunks);
        return outcomes;
    }

    private Preparation prepare(Article article, PipelineSettings settings) {
        try {
            return new Preparation(articleProcessor.prepare(article, settings), null);
        } catch (ChunkingException e) {
            log.error("Chunking failed for article {}: {}", article.id(), e.getMessage());
            return new Preparation(null, ArticleOutcome.failed(article,
                new ArticleError(article.id(), ErrorKind.CHUNKING_FAILED, e.getMessage())));
        } catch (RuntimeException e) {
            log.error("Unexpected failure preparing article {}", article.id(), e);
            return new Preparation(null, ArticleOutcome.failed(article,
                new ArticleError(article.id(), ErrorKind.UNEXPECTED, e.getMessage())));
        }
    }

    private ArticleOutcome complete(PreparedArticle prepared, String batchId) {
        try {
            return articleProcessor.complete(prepared, batchId);
        } catch (RuntimeException e) {
            Article article = prepared.article();
            log.error("Unexpected failure processing article {}", article.id(), e);
            return ArticleOutcome.failed(article, new ArticleError(article.id(), ErrorKind.UNEXPECTED, e.getMessage()));
        }
    }

    private record Preparation(PreparedArticle ready, ArticleOutcome failure) {}
}
