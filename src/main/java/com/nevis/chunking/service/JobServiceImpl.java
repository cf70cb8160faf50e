package com.nevis.chunking.service;

import com.nevis.chunking.config.PipelineSettingsHolder;
import com.nevis.chunking.exception.CoordinatorException;
import com.nevis.chunking.exception.JobNotFoundException;
import com.nevis.chunking.model.Article;
import com.nevis.chunking.model.ArticleError;
import com.nevis.chunking.model.BatchJob;
import com.nevis.chunking.model.BatchResult;
import com.nevis.chunking.model.ErrorKind;
import com.nevis.chunking.model.JobCounts;
import com.nevis.chunking.model.JobPriority;
import com.nevis.chunking.model.JobStatus;
import com.nevis.chunking.model.JobStatusSnapshot;
import com.nevis.chunking.repository.ArticleRepository;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executor;

/**
 * Priority queue of batch jobs. Jobs start in priority order, first come first served within a
 * priority, with at most {@code maxConcurrentJobs} running at a time. Finished jobs are forgotten
 * once {@code finishedJobRetention} has passed since they ended.
 */
@Service
@Slf4j
public class JobServiceImpl implements JobService {

    private final ArticleRepository articleRepository;
    private final BatchProcessingService batchProcessingService;
    private final PipelineSettingsHolder settingsHolder;
    private final Executor jobExecutor;
    private final Clock clock;

    private final Object lock = new Object();
    private final Map<UUID, BatchJob> jobs = new HashMap<>();
    private final PriorityQueue<BatchJob> queue = new PriorityQueue<>(
        Comparator.comparing(BatchJob::getPriority).thenComparingLong(BatchJob::getSequence));
    private final Set<BatchJob> runningJobs = new HashSet<>();
    // in order of completion, oldest first
    private final Deque<BatchJob> finishedJobs = new ArrayDeque<>();
    private long sequence;
    private int finishedTotal;
    private boolean shutdown;

    public JobServiceImpl(
        ArticleRepository articleRepository,
        BatchProcessingService batchProcessingService,
        PipelineSettingsHolder settingsHolder,
        @Qualifier("jobTaskExecutor") Executor jobExecutor,
        Clock clock
    ) {
        this.articleRepository = articleRepository;
        this.batchProcessingService = batchProcessingService;
        this.settingsHolder = settingsHolder;
        this.jobExecutor = jobExecutor;
        this.clock = clock;
    }

    @Override
    public UUID submitJob(List<UUID> articleIds, JobPriority priority) {
        if (articleIds == null || articleIds.isEmpty()) {
            throw new IllegalArgumentException("A job needs at least one article id");
        }
        BatchJob job;
        synchronized (lock) {
            if (shutdown) {
                throw new IllegalStateException("Coordinator is shutting down");
            }
            evictExpiredJobs();
            job = new BatchJob(UUID.randomUUID(), articleIds, priority, ++sequence, clock.instant());
            jobs.put(job.getId(), job);
            queue.add(job);
        }
        log.info("Job {} queued with {} articles at priority {}", job.getId(), articleIds.size(), priority);
        startQueuedJobs();
        return job.getId();
    }

    @Override
    public List<UUID> submitJobs(List<UUID> articleIds, JobPriority priority) {
        int jobSize = settingsHolder.current().batch().jobSize();
        List<UUID> jobIds = new ArrayList<>();
        for (int from = 0; from < articleIds.size(); from += jobSize) {
            jobIds.add(submitJob(articleIds.subList(from, Math.min(from + jobSize, articleIds.size())), priority));
        }
        return jobIds;
    }

    @Override
    public JobStatusSnapshot getJobStatus(UUID jobId) {
        synchronized (lock) {
            evictExpiredJobs();
            return findJob(jobId).snapshot();
        }
    }

    @Override
    public boolean cancelJob(UUID jobId) {
        synchronized (lock) {
            BatchJob job = findJob(jobId);
            switch (job.getStatus()) {
                case QUEUED -> {
                    queue.remove(job);
                    job.finish(JobStatus.CANCELLED, null, clock.instant());
                    recordFinished(job);
                    log.info("Job {} cancelled before it started", jobId);
                    return true;
                }
                case RUNNING -> {
                    job.getContext().cancel();
                    log.info("Job {} cancellation requested, waiting for in-flight articles", jobId);
                    return true;
                }
                default -> {
                    return false;
                }
            }
        }
    }

    @Override
    public JobCounts counts() {
        synchronized (lock) {
            evictExpiredJobs();
            return new JobCounts(queue.size(), runningJobs.size(), finishedTotal);
        }
    }

    @Override
    public Set<UUID> activeArticleIds() {
        synchronized (lock) {
            Set<UUID> ids = new HashSet<>();
            queue.forEach(job -> ids.addAll(job.getArticleIds()));
            runningJobs.forEach(job -> ids.addAll(job.getArticleIds()));
            return ids;
        }
    }

    @PreDestroy
    public void shutdown() {
        synchronized (lock) {
            shutdown = true;
            while (!queue.isEmpty()) {
                BatchJob job = queue.poll();
                job.finish(JobStatus.CANCELLED, null, clock.instant());
                recordFinished(job);
            }
            runningJobs.forEach(job -> job.getContext().cancel());
        }
        log.info("Coordinator stopped, queued jobs cancelled");
    }

    private void startQueuedJobs() {
        List<BatchJob> toStart = new ArrayList<>();
        synchronized (lock) {
            int limit = settingsHolder.current().batch().maxConcurrentJobs();
            while (!shutdown && runningJobs.size() < limit && !queue.isEmpty()) {
                BatchJob job = queue.poll();
                job.markRunning(clock.instant());
                runningJobs.add(job);
                toStart.add(job);
            }
        }
        toStart.forEach(job -> jobExecutor.execute(() -> runJob(job)));
    }

    private void runJob(BatchJob job) {
        log.info("Job {} started", job.getId());
        try {
            List<Article> articles = loadArticles(job);
            BatchResult result = batchProcessingService.processBatch(articles, job.getContext());
            JobStatus terminal = job.getContext().isCancelled() ? JobStatus.CANCELLED : JobStatus.COMPLETED;
            synchronized (lock) {
                job.finish(terminal, result, clock.instant());
                recordFinished(job);
            }
            log.info("Job {} finished as {}", job.getId(), terminal);
        } catch (CoordinatorException e) {
            log.error("Job {} failed: {}", job.getId(), e.getMessage());
            failJob(job, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Job {} failed unexpectedly", job.getId(), e);
            failJob(job, e.getMessage());
        } finally {
            startQueuedJobs();
        }
    }

    private void failJob(BatchJob job, String message) {
        synchronized (lock) {
            job.fail(message, clock.instant());
            recordFinished(job);
        }
    }

    // callers hold the lock
    private void recordFinished(BatchJob job) {
        runningJobs.remove(job);
        finishedJobs.addLast(job);
        finishedTotal++;
    }

    // callers hold the lock
    private void evictExpiredJobs() {
        Instant cutoff = clock.instant().minus(settingsHolder.current().batch().finishedJobRetention());
        while (!finishedJobs.isEmpty() && !finishedJobs.peekFirst().getFinishedAt().isAfter(cutoff)) {
            BatchJob expired = finishedJobs.pollFirst();
            jobs.remove(expired.getId());
            log.debug("Job {} evicted after retention", expired.getId());
        }
    }

    private List<Article> loadArticles(BatchJob job) {
        List<Article> articles;
        try {
            articles = articleRepository.loadArticles(job.getArticleIds());
        } catch (RuntimeException e) {
            throw new CoordinatorException(job.getId(), "article store failed: " + e.getMessage(), e);
        }
        if (articles.isEmpty()) {
            throw new CoordinatorException(job.getId(), "none of the " + job.getArticleIds().size() + " articles could be loaded", null);
        }

        Set<UUID> loaded = new HashSet<>();
        articles.forEach(article -> loaded.add(article.id()));
        List<ArticleError> missing = job.getArticleIds().stream()
            .filter(id -> !loaded.contains(id))
            .map(id -> new ArticleError(id, ErrorKind.ARTICLE_NOT_FOUND, "Article not found: " + id))
            .toList();
        if (!missing.isEmpty()) {
            log.warn("Job {}: {} of {} articles not found", job.getId(), missing.size(), job.getArticleIds().size());
            synchronized (lock) {
                job.addErrors(missing);
            }
        }
        return articles;
    }

    private BatchJob findJob(UUID jobId) {
        BatchJob job = jobs.get(jobId);
        if (job == null) {
            throw new JobNotFoundException(jobId);
        }
        return job;
    }
}
