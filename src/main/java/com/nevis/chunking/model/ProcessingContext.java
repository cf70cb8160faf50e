package com.nevis.chunking.model;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Carries the owning job id and its cancellation flag through one processing run.
 */
public final class ProcessingContext {

    private final UUID jobId;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public ProcessingContext(UUID jobId) {
        this.jobId = jobId;
    }

    public static ProcessingContext standalone() {
        return new ProcessingContext(UUID.randomUUID());
    }

    public UUID jobId() {
        return jobId;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void cancel() {
        cancelled.set(true);
    }
}
