package com.coinledger.common;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Token-bucket rate limiter with a bucket of one: callers reserve the next free slot and sleep until it.
 * Used to keep CoinGecko calls under the free-tier request budget.
 */
public class RateLimiter {

    private final long intervalNanos;
    private final AtomicLong nextSlotNanos;

    /**
     * @param permitsPerMinute e.g. 25 for 25 requests per minute
     */
    public RateLimiter(int permitsPerMinute) {
        if (permitsPerMinute <= 0) {
            throw new IllegalArgumentException("permitsPerMinute must be positive");
        }
        this.intervalNanos = TimeUnit.MINUTES.toNanos(1) / permitsPerMinute;
        this.nextSlotNanos = new AtomicLong(System.nanoTime());
    }

    /**
     * Reserves a slot and blocks until it starts.
     */
    public void acquire() {
        long now = System.nanoTime();
        long slot = nextSlotNanos.getAndUpdate(next -> Math.max(next, now) + intervalNanos);
        long waitNanos = Math.max(slot, now) - now;
        if (waitNanos <= 0) {
            return;
        }
        try {
            TimeUnit.NANOSECONDS.sleep(waitNanos);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Rate limiter interrupted", e);
        }
    }

    /**
     * Takes a permit only if one is free right now.
     */
    public boolean tryAcquire() {
        long now = System.nanoTime();
        long next = nextSlotNanos.get();
        return next <= now && nextSlotNanos.compareAndSet(next, now + intervalNanos);
    }

    public long intervalMillis() {
        return TimeUnit.NANOSECONDS.toMillis(intervalNanos);
    }
}
