package com.nevis.chunking.service;

import com.nevis.chunking.config.PipelineSettingsHolder;
import com.nevis.chunking.infra.BackpressureGate;
import com.nevis.chunking.infra.LlmCircuitBreaker;
import com.nevis.chunking.infra.RateLimiter;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

@Service
public class PipelineStatusService {

    private final LlmCircuitBreaker circuitBreaker;
    private final RateLimiter rateLimiter;
    private final JobService jobService;
    private final BackpressureGate backpressureGate;
    private final PipelineSettingsHolder settingsHolder;

    public PipelineStatusService(
        LlmCircuitBreaker circuitBreaker,
        @Qualifier("llmRateLimiter") RateLimiter rateLimiter,
        JobService jobService,
        BackpressureGate backpressureGate,
        PipelineSettingsHolder settingsHolder
    ) {
        this.circuitBreaker = circuitBreaker;
        this.rateLimiter = rateLimiter;
        this.jobService = jobService;
        this.backpressureGate = backpressureGate;
        this.settingsHolder = settingsHolder;
    }

    public PipelineStatus snapshot() {
        return new PipelineStatus(
            circuitBreaker.snapshot(),
            rateLimiter.snapshot(),
            jobService.counts(),
            backpressureGate.inFlight(),
            settingsHolder.version()
        );
    }
}
