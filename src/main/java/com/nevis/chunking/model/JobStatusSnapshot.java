package com.nevis.chunking.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record JobStatusSnapshot(
    UUID jobId,
    JobStatus status,
    JobPriority priority,
    int articleCount,
    Instant submittedAt,
    Instant startedAt,
    Instant finishedAt,
    BatchResult result,
    List<ArticleError> errors,
    String failureMessage
) {
}
