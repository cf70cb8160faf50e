package com.nevis.chunking.config;

import java.time.Duration;
import java.util.Set;

/**
 * Settings matching application.yml, for tests that build components by hand.
 */
public final class TestSettings {

    private TestSettings() {
    }

    public static ChunkingProperties chunking() {
        return new ChunkingProperties(400, 80, 200, 600, 800, 120);
    }

    public static RouterProperties router() {
        return new RouterProperties(0.4, 0.3, 0.3, 0.6);
    }

    public static FeatureProperties features() {
        return new FeatureProperties(true, true, false, Set.of());
    }

    public static LlmProperties llm() {
        return new LlmProperties("test-key", "gemini-test", Duration.ofSeconds(30), 3, Duration.ofSeconds(1),
            Duration.ofSeconds(60), 5, Duration.ofSeconds(60), 0.1, 256, false);
    }

    public static RateLimitProperties rateLimit() {
        return new RateLimitProperties(60, 10, 100, 0.3, 10.0, 0.000125, 0.000375, "UTC");
    }

    public static BatchProperties batch() {
        return new BatchProperties(10, 4, 100, 0.8, true, 2, 2, 100, Duration.ofHours(1));
    }

    public static PipelineSettings settings() {
        return new PipelineSettings(chunking(), router(), features(), llm(), rateLimit(), batch());
    }
}
