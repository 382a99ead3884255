package io.fetchbox.worker;

import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Token bucket refilled continuously at {@code permitsPerSecond}, holding at most
 * one second of tokens (never less than one). A non-positive rate disables it.
 */
public final class TokenBucketRateLimiter {
    private final double permitsPerSecond;
    private final double capacity;
    private final LongSupplier nanoClock;
    private final Sleeper sleeper;
    private double tokens;
    private long lastRefillNanos;

    public TokenBucketRateLimiter(double permitsPerSecond) {
        this(permitsPerSecond, System::nanoTime, TimeUnit.NANOSECONDS::sleep);
    }

    TokenBucketRateLimiter(double permitsPerSecond, LongSupplier nanoClock, Sleeper sleeper) {
        this.permitsPerSecond = Double.isNaN(permitsPerSecond) ? 0.0d : Math.max(0.0d, permitsPerSecond);
        this.capacity = Math.max(1.0d, this.permitsPerSecond);
        this.nanoClock = nanoClock;
        this.sleeper = sleeper;
        this.tokens = capacity;
        this.lastRefillNanos = nanoClock.getAsLong();
    }

    public boolean disabled() {
        return permitsPerSecond <= 0.0d;
    }

    public double permitsPerSecond() {
        return permitsPerSecond;
    }

    public synchronized boolean tryAcquire() {
        if (disabled()) {
            return true;
        }
        refill();
        if (tokens >= 1.0d) {
            tokens -= 1.0d;
            return true;
        }
        return false;
    }

    /**
     * Blocks until a token is available.
     *
     * @return nanoseconds spent waiting
     */
    public long acquire() throws InterruptedException {
        if (disabled()) {
            return 0L;
        }
        long waited = 0L;
        while (true) {
            long waitNanos;
            synchronized (this) {
                refill();
                if (tokens >= 1.0d) {
                    tokens -= 1.0d;
                    return waited;
                }
                waitNanos = (long) Math.ceil(((1.0d - tokens) / permitsPerSecond) * 1_000_000_000d);
            }
            sleeper.sleepNanos(Math.max(1L, waitNanos));
            waited += waitNanos;
        }
    }

    private void refill() {
        long now = nanoClock.getAsLong();
        long elapsed = now - lastRefillNanos;
        if (elapsed <= 0L) {
            return;
        }
        tokens = Math.min(capacity, tokens + (elapsed / 1_000_000_000d) * permitsPerSecond);
        lastRefillNanos = now;
    }

    interface Sleeper {
        void sleepNanos(long nanos) throws InterruptedException;
    }
}
