package com.nevis.chunking.config;

import com.nevis.chunking.exception.ConfigurationException;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable view of every tunable the pipeline reads while processing an article.
 */
public record PipelineSettings(
    ChunkingProperties chunking,
    RouterProperties router,
    FeatureProperties features,
    LlmProperties llm,
    RateLimitProperties rateLimit,
    BatchProperties batch
) {

    static final double WEIGHT_TOLERANCE = 1e-6;

    /**
     * Cross-field checks that bean validation on the individual records cannot express.
     *
     * @throws ConfigurationException listing every violated constraint
     */
    public PipelineSettings validate() {
        List<String> violations = new ArrayList<>();

        int min = chunking.minWords();
        int target = chunking.targetWords();
        int max = chunking.maxWords();
        if (!(min < target && target < max)) {
            violations.add("chunking words must satisfy min < target < max, got " + min + "/" + target + "/" + max);
        }
        if (chunking.overlapWords() >= min) {
            violations.add("overlap-words (" + chunking.overlapWords() + ") must be below min-words (" + min + ")");
        }
        if (target + min > max) {
            violations.add("max-words (" + max + ") must be at least target-words + min-words (" + (target + min) + ")");
        }

        double weightSum = router.boundaryWeight() + router.sizeWeight() + router.complexityWeight();
        if (Math.abs(weightSum - 1.0) > WEIGHT_TOLERANCE) {
            violations.add("router weights must sum to 1.0, got " + weightSum);
        }

        if (llm.baseDelay().isNegative() || llm.maxDelay().compareTo(llm.baseDelay()) < 0) {
            violations.add("llm max-delay must not be below base-delay");
        }
        if (llm.breakerTimeout().isNegative() || llm.breakerTimeout().isZero()) {
            violations.add("llm breaker-timeout must be positive");
        }

        double threshold = batch.backpressureThreshold();
        if (!(threshold > 0.0 && threshold <= 1.0)) {
            violations.add("backpressure-threshold must lie in (0, 1], got " + threshold);
        }
        if (batch.finishedJobRetention().isNegative()) {
            violations.add("finished-job-retention must not be negative");
        }

        try {
            ZoneId.of(rateLimit.costZone());
        } catch (DateTimeException e) {
            violations.add("unknown cost-zone " + rateLimit.costZone());
        }

        if (!violations.isEmpty()) {
            throw new ConfigurationException(violations);
        }
        return this;
    }
}
