package com.nevis.chunking.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Coordinator-owned job record. Every mutation happens under the coordinator's lock.
 */
public class BatchJob {

    private final UUID id;
    private final List<UUID> articleIds;
    private final JobPriority priority;
    private final long sequence;
    private final Instant submittedAt;
    private final ProcessingContext context;
    private final List<ArticleError> errors = new ArrayList<>();

    private JobStatus status = JobStatus.QUEUED;
    private Instant startedAt;
    private Instant finishedAt;
    private BatchResult result;
    private String failureMessage;

    public BatchJob(UUID id, List<UUID> articleIds, JobPriority priority, long sequence, Instant submittedAt) {
        this.id = id;
        this.articleIds = List.copyOf(articleIds);
        this.priority = priority;
        this.sequence = sequence;
        this.submittedAt = submittedAt;
        this.context = new ProcessingContext(id);
    }

    public UUID getId() {
        return id;
    }

    public List<UUID> getArticleIds() {
        return articleIds;
    }

    public JobPriority getPriority() {
        return priority;
    }

    public long getSequence() {
        return sequence;
    }

    public ProcessingContext getContext() {
        return context;
    }

    public JobStatus getStatus() {
        return status;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public int getRetryCount() {
        return result == null ? 0 : result.retryRounds();
    }

    public void markRunning(Instant now) {
        this.status = JobStatus.RUNNING;
        this.startedAt = now;
    }

    public void finish(JobStatus terminal, BatchResult batchResult, Instant now) {
        this.status = terminal;
        this.result = batchResult;
        this.finishedAt = now;
        if (batchResult != null) {
            errors.addAll(batchResult.errors());
        }
    }

    public void fail(String message, Instant now) {
        this.status = JobStatus.FAILED;
        this.failureMessage = message;
        this.finishedAt = now;
    }

    public void addErrors(List<ArticleError> newErrors) {
        errors.addAll(newErrors);
    }

    public JobStatusSnapshot snapshot() {
        return new JobStatusSnapshot(id, status, priority, articleIds.size(), submittedAt, startedAt, finishedAt,
            result, List.copyOf(errors), failureMessage);
    }
}
