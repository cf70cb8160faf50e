package com.nevis.chunking.infra;

/**
 * Multi-axis quota guarding the completion provider. {@link #admit} never blocks: callers that are
 * turned away keep their chunk as it is.
 */
public interface RateLimiter {

    /**
     * Opens the per-batch quota. The share axis allows {@code floor(totalChunks * maxShare)} calls.
     */
    void beginBatch(String batchId, int totalChunks);

    void endBatch(String batchId);

    Admission admit(String domain, String batchId, double estimatedCost);

    /**
     * Settles a granted admission once the provider answered or failed for good.
     */
    void record(Admission admission, double actualCost);

    /**
     * Returns every unit a granted admission consumed. Used when the call never happened.
     */
    void release(Admission admission);

    RateLimiterSnapshot snapshot();
}
