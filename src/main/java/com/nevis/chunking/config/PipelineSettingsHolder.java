package com.nevis.chunking.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Publishes versioned {@link PipelineSettings} snapshots. Readers take one snapshot per article,
 * so a reload never changes the rules halfway through an article.
 */
@Component
@Slf4j
public class PipelineSettingsHolder {

    private final AtomicReference<Versioned> current;

    @Autowired
    public PipelineSettingsHolder(
        ChunkingProperties chunking,
        RouterProperties router,
        FeatureProperties features,
        LlmProperties llm,
        RateLimitProperties rateLimit,
        BatchProperties batch
    ) {
        this(new PipelineSettings(chunking, router, features, llm, rateLimit, batch));
    }

    public PipelineSettingsHolder(PipelineSettings initial) {
        this.current = new AtomicReference<>(new Versioned(1, initial.validate()));
    }

    public PipelineSettings current() {
        return current.get().settings();
    }

    public long version() {
        return current.get().version();
    }

    /**
     * Validates and installs a new snapshot. An invalid snapshot leaves the current one in place.
     * Nothing in the service calls this on its own; an embedding application decides when to.
     * <p>
     * Only readers of {@link #current()} see the change: chunking, routing, feature flags, batch
     * sizing, job size and job retention. The rate limiter, circuit breaker, retry template,
     * backpressure gate and article executor are built once from the startup properties and keep
     * those limits until restart.
     */
    public long reload(PipelineSettings next) {
        next.validate();
        Versioned installed = current.updateAndGet(previous -> new Versioned(previous.version() + 1, next));
        log.info("Pipeline settings reloaded, now at version {}", installed.version());
        return installed.version();
    }

    private record Versioned(long version, PipelineSettings settings) {}
}
