package com.nevis.chunking.infra;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Breaker in front of the completion provider.
 * <p>
 * {@code threshold} consecutive failures open it. Once {@code timeout} has passed, the next
 * {@link #allow()} moves it to half-open and lets exactly one probe through; every other caller
 * is refused until the probe reports back.
 */
@Slf4j
public class LlmCircuitBreaker {

    private final CircuitBreaker breaker;
    private final AtomicReference<Instant> lastTransitionAt;

    public LlmCircuitBreaker(String name, int threshold, Duration timeout, Clock clock) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
            .slidingWindowType(SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(threshold)
            .minimumNumberOfCalls(threshold)
            .failureRateThreshold(100.0f)
            .slowCallRateThreshold(100.0f)
            .slowCallDurationThreshold(Duration.ofDays(1))
            .waitDurationInOpenState(timeout)
            .permittedNumberOfCallsInHalfOpenState(1)
            .automaticTransitionFromOpenToHalfOpenEnabled(false)
            .clock(clock)
            .build();

        this.breaker = CircuitBreaker.of(name, config);
        this.lastTransitionAt = new AtomicReference<>(clock.instant());

        breaker.getEventPublisher().onStateTransition(event -> {
            lastTransitionAt.set(clock.instant());
            if (event.getStateTransition().getToState() == CircuitBreaker.State.OPEN) {
                log.warn("Circuit breaker '{}' opened: {}", name, event.getStateTransition());
            } else {
                log.info("Circuit breaker '{}' transition: {}", name, event.getStateTransition());
            }
        });
    }

    public boolean allow() {
        return breaker.tryAcquirePermission();
    }

    public void onSuccess(Duration elapsed) {
        breaker.onSuccess(elapsed.toNanos(), TimeUnit.NANOSECONDS);
    }

    public void onFailure(Duration elapsed, Throwable cause) {
        breaker.onError(elapsed.toNanos(), TimeUnit.NANOSECONDS, cause);
    }

    public BreakerState state() {
        return switch (breaker.getState()) {
            case OPEN, FORCED_OPEN -> BreakerState.OPEN;
            case HALF_OPEN -> BreakerState.HALF_OPEN;
            default -> BreakerState.CLOSED;
        };
    }

    public CircuitBreakerSnapshot snapshot() {
        return new CircuitBreakerSnapshot(state(), breaker.getMetrics().getNumberOfFailedCalls(), lastTransitionAt.get());
    }
}
