package com.nevis.chunking.infra;

import com.nevis.chunking.config.RateLimitProperties;
import com.nevis.chunking.infra.RateLimiterSnapshot.BatchUsage;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import io.github.bucket4j.TimeMeter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-node limiter. Every axis is checked and consumed under one lock, so parallel callers
 * can never push a counter past its ceiling.
 */
@Slf4j
public class InMemoryQuotaRateLimiter implements RateLimiter {

    private static final String UNKNOWN_DOMAIN = "unknown";
    private static final Duration WINDOW = Duration.ofMinutes(1);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, DomainWindow> domainWindows = new HashMap<>();
    private final Map<String, BatchQuota> batchQuotas = new HashMap<>();

    private final Clock clock;
    private final ZoneId costZone;
    private final TimeMeter timeMeter;
    private final Bucket globalBucket;

    private final int callsPerDomainPerMinute;
    private final int maxCallsPerBatch;
    private final double maxShareOfBatch;
    private final double dailyCostLimit;

    private Instant lastSweep;
    private LocalDate costDay;
    private double costSpent;
    private double costReserved;

    public InMemoryQuotaRateLimiter(RateLimitProperties properties, Clock clock) {
        this.clock = clock;
        this.costZone = ZoneId.of(properties.costZone());
        this.timeMeter = new ClockTimeMeter(clock);
        this.callsPerDomainPerMinute = properties.callsPerDomainPerMinute();
        this.maxCallsPerBatch = properties.maxCallsPerBatch();
        this.maxShareOfBatch = properties.maxShareOfBatch();
        this.dailyCostLimit = properties.dailyCostLimit();
        this.globalBucket = createMinuteBucket(properties.callsPerMinute());
        this.costDay = LocalDate.now(clock.withZone(costZone));
        this.lastSweep = clock.instant();
    }

    private Bucket createMinuteBucket(int limit) {
        return Bucket.builder()
            .addLimit(Bandwidth.classic(limit, Refill.intervally(limit, WINDOW)))
            .withCustomTimePrecision(timeMeter)
            .build();
    }

    @Override
    public void beginBatch(String batchId, int totalChunks) {
        int shareLimit = (int) Math.floor(totalChunks * maxShareOfBatch + 1e-9);
        lock.lock();
        try {
            batchQuotas.put(batchId, new BatchQuota(shareLimit));
        } finally {
            lock.unlock();
        }
        log.debug("Batch {} opened: {} chunks, share limit {}, call limit {}", batchId, totalChunks, shareLimit, maxCallsPerBatch);
    }

    @Override
    public void endBatch(String batchId) {
        lock.lock();
        try {
            batchQuotas.remove(batchId);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Admission admit(String domain, String batchId, double estimatedCost) {
        String domainKey = normalize(domain);
        lock.lock();
        try {
            rollCostDay();
            sweepIdleDomains();

            BatchQuota quota = batchId == null ? null : batchQuotas.get(batchId);
            if (quota != null) {
                if (quota.used >= maxCallsPerBatch) {
                    return deny(DenialReason.BATCH_CALLS, domainKey, batchId);
                }
                if (quota.used >= quota.shareLimit) {
                    return deny(DenialReason.BATCH_SHARE, domainKey, batchId);
                }
            }

            if (costSpent + costReserved + estimatedCost > dailyCostLimit) {
                return deny(DenialReason.DAILY_COST, domainKey, batchId);
            }

            if (!globalBucket.tryConsume(1)) {
                return deny(DenialReason.GLOBAL_RATE, domainKey, batchId);
            }

            DomainWindow window = domainWindows.computeIfAbsent(domainKey,
                k -> new DomainWindow(createMinuteBucket(callsPerDomainPerMinute)));
            window.lastUsed = clock.instant();
            if (!window.bucket.tryConsume(1)) {
                globalBucket.addTokens(1);
                return deny(DenialReason.DOMAIN_RATE, domainKey, batchId);
            }

            if (quota != null) {
                quota.used++;
            }
            costReserved += estimatedCost;
            return Admission.granted(domainKey, batchId, estimatedCost, costDay);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void record(Admission admission, double actualCost) {
        if (!admission.granted()) {
            return;
        }
        lock.lock();
        try {
            rollCostDay();
            unreserve(admission);
            costSpent += actualCost;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void release(Admission admission) {
        if (!admission.granted()) {
            return;
        }
        lock.lock();
        try {
            rollCostDay();
            unreserve(admission);
            globalBucket.addTokens(1);
            DomainWindow window = domainWindows.get(admission.domain());
            if (window != null) {
                window.bucket.addTokens(1);
            }
            BatchQuota quota = admission.batchId() == null ? null : batchQuotas.get(admission.batchId());
            if (quota != null && quota.used > 0) {
                quota.used--;
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public RateLimiterSnapshot snapshot() {
        lock.lock();
        try {
            rollCostDay();
            Map<String, Long> domains = new HashMap<>();
            domainWindows.forEach((domain, window) -> domains.put(domain, window.bucket.getAvailableTokens()));
            Map<String, BatchUsage> batches = new HashMap<>();
            batchQuotas.forEach((id, quota) -> batches.put(id, new BatchUsage(quota.used, Math.min(quota.shareLimit, maxCallsPerBatch))));
            return new RateLimiterSnapshot(globalBucket.getAvailableTokens(), Map.copyOf(domains), Map.copyOf(batches),
                costDay, costSpent, costReserved);
        } finally {
            lock.unlock();
        }
    }

    private void unreserve(Admission admission) {
        // reservations from a previous day were dropped at rollover
        if (costDay.equals(admission.costDay())) {
            costReserved = Math.max(0.0, costReserved - admission.reservedCost());
        }
    }

    /**
     * Forgets domains idle for longer than a window. Their buckets have refilled by then, so a
     * fresh bucket behaves the same.
     */
    private void sweepIdleDomains() {
        Instant now = clock.instant();
        if (Duration.between(lastSweep, now).compareTo(WINDOW) < 0) {
            return;
        }
        lastSweep = now;
        Instant idleBefore = now.minus(WINDOW);
        int before = domainWindows.size();
        domainWindows.values().removeIf(window -> window.lastUsed.isBefore(idleBefore)
            && window.bucket.getAvailableTokens() >= callsPerDomainPerMinute);
        if (domainWindows.size() < before) {
            log.debug("Evicted {} idle domain windows", before - domainWindows.size());
        }
    }

    private void rollCostDay() {
        LocalDate today = LocalDate.now(clock.withZone(costZone));
        if (!today.equals(costDay)) {
            log.info("Daily LLM cost window rolled over from {} (spent {}) to {}", costDay, costSpent, today);
            costDay = today;
            costSpent = 0.0;
            costReserved = 0.0;
        }
    }

    private Admission deny(DenialReason reason, String domain, String batchId) {
        log.debug("LLM call denied for domain {} in batch {}: {}", domain, batchId, reason);
        return Admission.denied(reason, domain, batchId);
    }

    private static String normalize(String domain) {
        return domain == null || domain.isBlank() ? UNKNOWN_DOMAIN : domain.trim().toLowerCase(Locale.ROOT);
    }

    private static final class DomainWindow {
        private final Bucket bucket;
        private Instant lastUsed;

        private DomainWindow(Bucket bucket) {
            this.bucket = bucket;
        }
    }

    private static final class BatchQuota {
        private final int shareLimit;
        private int used;

        private BatchQuota(int shareLimit) {
            this.shareLimit = shareLimit;
        }
    }
}
