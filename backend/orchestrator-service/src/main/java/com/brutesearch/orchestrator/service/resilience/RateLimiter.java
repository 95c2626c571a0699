package com.brutesearch.orchestrator.service.resilience;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Paces outbound calls to a shared concurrency ceiling and a maximum call rate.
 *
 * <p>{@link #acquire()} blocks until a concurrency slot is free and at least
 * {@code 1 / requestsPerSecond} seconds have passed since the previous admitted call.
 * The returned {@link Permit} gives the slot back when closed.
 *
 * <p>동시성 슬롯 획득 후 pacing 계산과 watermark 갱신은 하나의 lock 안에서 수행됩니다.
 */
@Slf4j
public class RateLimiter {

    private final int maxConcurrent;
    private final double requestsPerSecond;
    private final long minIntervalNanos;
    private final Semaphore slots;
    private final ReentrantLock pacingLock = new ReentrantLock(true);

    // guarded by pacingLock
    private long lastRequestTime;
    private boolean hasPreviousRequest;

    public RateLimiter(int maxConcurrent, double requestsPerSecond) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be >= 1: " + maxConcurrent);
        }
        if (!(requestsPerSecond > 0)) {
            throw new IllegalArgumentException("requestsPerSecond must be > 0: " + requestsPerSecond);
        }
        this.maxConcurrent = maxConcurrent;
        this.requestsPerSecond = requestsPerSecond;
        this.minIntervalNanos = (long) (TimeUnit.SECONDS.toNanos(1) / requestsPerSecond);
        this.slots = new Semaphore(maxConcurrent, true);
    }

    /**
     * Blocks until the call may proceed. Never fails on its own; interruption is the
     * only way out without a permit.
     */
    public Permit acquire() {
        try {
            slots.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for a rate limiter slot", e);
        }

        try {
            pace();
        } catch (RuntimeException e) {
            slots.release();
            throw e;
        }
        return new Permit();
    }

    /**
     * Wraps a call so that it only subscribes once a permit is held, and the permit
     * is returned on completion, error or cancellation. The blocking wait runs on
     * the bounded elastic scheduler.
     */
    public <T> Mono<T> withPermit(Mono<T> call) {
        return Mono.using(this::acquire, permit -> call, Permit::close)
                .subscribeOn(Schedulers.boundedElastic());
    }

    private void pace() {
        try {
            pacingLock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the pacing lock", e);
        }
        try {
            long now = System.nanoTime();
            if (hasPreviousRequest) {
                long waitNanos = lastRequestTime + minIntervalNanos - now;
                if (waitNanos > 0) {
                    log.trace("Rate limiter delaying call by {}ms", TimeUnit.NANOSECONDS.toMillis(waitNanos));
                    TimeUnit.NANOSECONDS.sleep(waitNanos);
                    now = System.nanoTime();
                }
            }
            lastRequestTime = now;
            hasPreviousRequest = true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while pacing", e);
        } finally {
            pacingLock.unlock();
        }
    }

    public int availablePermits() {
        return slots.availablePermits();
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public double getRequestsPerSecond() {
        return requestsPerSecond;
    }

    /**
     * One held concurrency slot. Closing twice releases once.
     */
    public final class Permit implements AutoCloseable {

        private final AtomicBoolean released = new AtomicBoolean(false);

        private Permit() {
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                slots.release();
            }
        }
    }
}
