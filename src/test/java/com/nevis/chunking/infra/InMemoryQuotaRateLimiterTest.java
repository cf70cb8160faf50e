package com.nevis.chunking.infra;

import com.nevis.chunking.config.RateLimitProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class InMemoryQuotaRateLimiterTest {

    private static final Instant START = Instant.parse("2025-01-15T10:00:00Z");

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
    }

    private InMemoryQuotaRateLimiter limiter(int perMinute, int perDomain, int perBatch, double share, double dailyCost) {
        return new InMemoryQuotaRateLimiter(
            new RateLimitProperties(perMinute, perDomain, perBatch, share, dailyCost, 0.000125, 0.000375, "UTC"), clock);
    }

    @Nested
    @DisplayName("Minute windows")
    class MinuteWindows {

        @Test
        @DisplayName("Should deny once the global per-minute limit is used up")
        void shouldEnforceGlobalLimit() {
            InMemoryQuotaRateLimiter limiter = limiter(5, 100, 100, 1.0, 10.0);

            for (int i = 0; i < 5; i++) {
                assertThat(limiter.admit("domain-" + i, null, 0.0).granted()).isTrue();
            }
            Admission denied = limiter.admit("domain-9", null, 0.0);

            assertThat(denied.granted()).isFalse();
            assertThat(denied.reason()).isEqualTo(DenialReason.GLOBAL_RATE);
        }

        @Test
        @DisplayName("Should admit again after the minute window refills")
        void shouldRefillAfterOneMinute() {
            InMemoryQuotaRateLimiter limiter = limiter(2, 100, 100, 1.0, 10.0);
            limiter.admit("news", null, 0.0);
            limiter.admit("news", null, 0.0);
            assertThat(limiter.admit("news", null, 0.0).granted()).isFalse();

            clock.advance(Duration.ofSeconds(61));

            assertThat(limiter.admit("news", null, 0.0).granted()).isTrue();
        }

        @Test
        @DisplayName("Should deny per domain and refund the global token")
        void shouldEnforceDomainLimit() {
            InMemoryQuotaRateLimiter limiter = limiter(100, 2, 100, 1.0, 10.0);

            assertThat(limiter.admit("news", null, 0.0).granted()).isTrue();
            assertThat(limiter.admit(" NEWS ", null, 0.0).granted()).isTrue();
            Admission denied = limiter.admit("news", null, 0.0);

            assertThat(denied.reason()).isEqualTo(DenialReason.DOMAIN_RATE);
            assertThat(limiter.snapshot().globalCallsLeft()).isEqualTo(98);
            assertThat(limiter.admit("sports", null, 0.0).granted()).isTrue();
        }

        @Test
        @DisplayName("Should group blank domains under one key")
        void shouldNormalizeMissingDomain() {
            InMemoryQuotaRateLimiter limiter = limiter(100, 1, 100, 1.0, 10.0);

            assertThat(limiter.admit(null, null, 0.0).granted()).isTrue();
            assertThat(limiter.admit("  ", null, 0.0).reason()).isEqualTo(DenialReason.DOMAIN_RATE);
            assertThat(limiter.snapshot().domainCallsLeft()).containsEntry("unknown", 0L);
        }

        @Test
        @DisplayName("Should forget domains that stayed idle for a whole window")
        void shouldEvictIdleDomains() {
            InMemoryQuotaRateLimiter limiter = limiter(100, 2, 100, 1.0, 10.0);
            limiter.admit("news", null, 0.0);
            limiter.admit("news", null, 0.0);
            limiter.admit("sports", null, 0.0);

            clock.advance(Duration.ofSeconds(30));
            limiter.admit("markets", null, 0.0);
            assertThat(limiter.snapshot().domainCallsLeft()).containsOnlyKeys("news", "sports", "markets");

            clock.advance(Duration.ofSeconds(31));
            limiter.admit("weather", null, 0.0);

            assertThat(limiter.snapshot().domainCallsLeft()).containsOnlyKeys("markets", "weather");
            assertThat(limiter.admit("news", null, 0.0).granted()).isTrue();
        }
    }

    @Nested
    @DisplayName("Batch quota")
    class BatchQuota {

        @Test
        @DisplayName("Should cap a batch at its share of chunks")
        void shouldEnforceBatchShare() {
            InMemoryQuotaRateLimiter limiter = limiter(1000, 1000, 1000, 0.3, 100.0);
            limiter.beginBatch("job-1", 100);

            int granted = 0;
            Admission last = null;
            for (int i = 0; i < 100; i++) {
                last = limiter.admit("news", "job-1", 0.0);
                if (last.granted()) {
                    granted++;
                }
            }

            assertThat(granted).isEqualTo(30);
            assertThat(last.reason()).isEqualTo(DenialReason.BATCH_SHARE);
        }

        @Test
        @DisplayName("Should allow nothing when the share rounds down to zero")
        void shouldFloorShareLimit() {
            InMemoryQuotaRateLimiter limiter = limiter(1000, 1000, 1000, 0.3, 100.0);
            limiter.beginBatch("job-1", 3);

            assertThat(limiter.admit("news", "job-1", 0.0).reason()).isEqualTo(DenialReason.BATCH_SHARE);
        }

        @Test
        @DisplayName("Should cap a batch at the absolute call limit")
        void shouldEnforceBatchCalls() {
            InMemoryQuotaRateLimiter limiter = limiter(1000, 1000, 3, 1.0, 100.0);
            limiter.beginBatch("job-1", 100);

            for (int i = 0; i < 3; i++) {
                assertThat(limiter.admit("news", "job-1", 0.0).granted()).isTrue();
            }

            assertThat(limiter.admit("news", "job-1", 0.0).reason()).isEqualTo(DenialReason.BATCH_CALLS);
            assertThat(limiter.snapshot().batches().get("job-1").used()).isEqualTo(3);
        }

        @Test
        @DisplayName("Should keep batches independent and forget them once ended")
        void shouldIsolateBatches() {
            InMemoryQuotaRateLimiter limiter = limiter(1000, 1000, 1, 1.0, 100.0);
            limiter.beginBatch("job-1", 10);
            limiter.beginBatch("job-2", 10);

            assertThat(limiter.admit("news", "job-1", 0.0).granted()).isTrue();
            assertThat(limiter.admit("news", "job-2", 0.0).granted()).isTrue();

            limiter.endBatch("job-1");

            assertThat(limiter.snapshot().batches()).containsOnlyKeys("job-2");
        }
    }

    @Nested
    @DisplayName("Daily cost")
    class DailyCost {

        @Test
        @DisplayName("Should count reservations against the daily budget")
        void shouldEnforceDailyCost() {
            InMemoryQuotaRateLimiter limiter = limiter(100, 100, 100, 1.0, 1.0);

            Admission first = limiter.admit("news", null, 0.6);
            assertThat(first.granted()).isTrue();
            assertThat(limiter.admit("news", null, 0.6).reason()).isEqualTo(DenialReason.DAILY_COST);

            limiter.record(first, 0.3);

            assertThat(limiter.admit("news", null, 0.6).granted()).isTrue();
            RateLimiterSnapshot snapshot = limiter.snapshot();
            assertThat(snapshot.costSpent()).isCloseTo(0.3, within(1e-9));
            assertThat(snapshot.costReserved()).isCloseTo(0.6, within(1e-9));
        }

        @Test
        @DisplayName("Should reset spending when the day rolls over")
        void shouldRollOverAtMidnight() {
            InMemoryQuotaRateLimiter limiter = limiter(100, 100, 100, 1.0, 1.0);
            Admission admission = limiter.admit("news", null, 0.9);
            limiter.record(admission, 0.9);
            assertThat(limiter.admit("news", null, 0.5).reason()).isEqualTo(DenialReason.DAILY_COST);

            clock.advance(Duration.ofHours(14));

            assertThat(limiter.admit("news", null, 0.5).granted()).isTrue();
            RateLimiterSnapshot snapshot = limiter.snapshot();
            assertThat(snapshot.costDay()).isEqualTo(LocalDate.of(2025, 1, 16));
            assertThat(snapshot.costSpent()).isZero();
        }

        @Test
        @DisplayName("Should ignore settling a reservation made before the rollover")
        void shouldDropStaleReservation() {
            InMemoryQuotaRateLimiter limiter = limiter(100, 100, 100, 1.0, 1.0);
            Admission yesterday = limiter.admit("news", null, 0.4);

            clock.advance(Duration.ofHours(14));
            Admission today = limiter.admit("news", null, 0.2);
            limiter.record(yesterday, 0.4);

            RateLimiterSnapshot snapshot = limiter.snapshot();
            assertThat(snapshot.costReserved()).isCloseTo(today.reservedCost(), within(1e-9));
            assertThat(snapshot.costSpent()).isCloseTo(0.4, within(1e-9));
        }
    }

    @Test
    @DisplayName("Should return every unit on release")
    void shouldRefundOnRelease() {
        InMemoryQuotaRateLimiter limiter = limiter(1, 1, 1, 1.0, 1.0);
        limiter.beginBatch("job-1", 10);

        Admission admission = limiter.admit("news", "job-1", 0.8);
        assertThat(admission.granted()).isTrue();
        assertThat(limiter.admit("news", "job-1", 0.1).granted()).isFalse();

        limiter.release(admission);

        RateLimiterSnapshot snapshot = limiter.snapshot();
        assertThat(snapshot.costReserved()).isZero();
        assertThat(snapshot.batches().get("job-1").used()).isZero();
        assertThat(limiter.admit("news", "job-1", 0.8).granted()).isTrue();
    }

    @Test
    @DisplayName("Should ignore record and release for denied admissions")
    void shouldIgnoreDeniedAdmission() {
        InMemoryQuotaRateLimiter limiter = limiter(1, 1, 1, 1.0, 1.0);
        limiter.admit("news", null, 0.0);
        Admission denied = limiter.admit("news", null, 0.0);

        limiter.release(denied);
        limiter.record(denied, 5.0);

        assertThat(limiter.snapshot().globalCallsLeft()).isZero();
        assertThat(limiter.snapshot().costSpent()).isZero();
    }

    @Test
    @DisplayName("Should never admit more than the ceiling under concurrent callers")
    void shouldHandleConcurrentAccess() {
        InMemoryQuotaRateLimiter limiter = limiter(50, 1000, 1000, 1.0, 100.0);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<CompletableFuture<Admission>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                String domain = "domain-" + (i % 7);
                futures.add(CompletableFuture.supplyAsync(() -> limiter.admit(domain, null, 0.01), executor));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            long granted = futures.stream().map(CompletableFuture::join).filter(Admission::granted).count();

            assertThat(granted).isEqualTo(50);
            assertThat(limiter.snapshot().costReserved()).isCloseTo(0.5, within(1e-6));
        } finally {
            executor.shutdownNow();
        }
    }
}
