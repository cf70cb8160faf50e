package com.nevis.chunking.infra;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

/**
 * Counts articles in flight across every running job. New work is admitted only while the count
 * sits below {@code threshold * maxInFlight}.
 */
public class BackpressureGate {

    private static final Duration RECHECK_INTERVAL = Duration.ofMillis(50);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition capacityFreed = lock.newCondition();
    private final int admitBelow;
    private int inFlight;

    public BackpressureGate(int maxInFlight, double threshold) {
        this.admitBelow = Math.max(1, (int) Math.floor(maxInFlight * threshold));
    }

    /**
     * Waits until there is room, then counts {@code articles} as in flight.
     *
     * @return {@code false} when {@code cancelled} turned true while waiting; nothing is counted then
     */
    public boolean enter(int articles, BooleanSupplier cancelled) throws InterruptedException {
        lock.lock();
        try {
            while (inFlight >= admitBelow) {
                if (cancelled.getAsBoolean()) {
                    return false;
                }
                capacityFreed.await(RECHECK_INTERVAL.toMillis(), TimeUnit.MILLISECONDS);
            }
            if (cancelled.getAsBoolean()) {
                return false;
            }
            inFlight += articles;
            return true;
        } finally {
            lock.unlock();
        }
    }

    public void leave(int articles) {
        lock.lock();
        try {
            inFlight = Math.max(0, inFlight - articles);
            capacityFreed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public int inFlight() {
        lock.lock();
        try {
            return inFlight;
        } finally {
            lock.unlock();
        }
    }
}
