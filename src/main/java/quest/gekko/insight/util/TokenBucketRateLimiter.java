package quest.gekko.insight.util;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Token bucket holding up to {@code capacity} permits, refilled continuously at
 * {@code refillPerSecond}. {@link #acquire()} loops: take a permit if one is available, otherwise
 * compute the wait, sleep outside the monitor and try again.
 */
@Slf4j
public class TokenBucketRateLimiter {

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long nanos) throws InterruptedException;
    }

    private final int capacity;
    private final double refillPerNano;
    private final LongSupplier clock;
    private final Sleeper sleeper;

    private double tokens;
    private long lastRefill;

    public TokenBucketRateLimiter(int capacity, double refillPerSecond) {
        this(capacity, refillPerSecond, System::nanoTime, TimeUnit.NANOSECONDS::sleep);
    }

    public TokenBucketRateLimiter(int capacity, double refillPerSecond, LongSupplier clock, Sleeper sleeper) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be at least 1");
        if (refillPerSecond <= 0) throw new IllegalArgumentException("refillPerSecond must be positive");
        this.capacity = capacity;
        this.refillPerNano = refillPerSecond / 1_000_000_000d;
        this.clock = clock;
        this.sleeper = sleeper;
        this.tokens = capacity;
        this.lastRefill = clock.getAsLong();
    }

    /** Blocks the calling thread until a permit has been taken. */
    public void acquire() throws InterruptedException {
        while (true) {
            long waitNanos = tryAcquireOrWait();
            if (waitNanos == 0) return;
            log.debug("Rate limit reached, waiting {} ms", TimeUnit.NANOSECONDS.toMillis(waitNanos));
            sleeper.sleep(waitNanos);
        }
    }

    /** Takes a permit without waiting. */
    public synchronized boolean tryAcquire() {
        refill();
        if (tokens >= 1) {
            tokens -= 1;
            return true;
        }
        return false;
    }

    public synchronized double availableTokens() {
        refill();
        return tokens;
    }

    public int capacity() {
        return capacity;
    }

    private synchronized long tryAcquireOrWait() {
        refill();
        if (tokens >= 1) {
            tokens -= 1;
            return 0;
        }
        return Math.max(1, (long) Math.ceil((1 - tokens) / refillPerNano));
    }

    private void refill() {
        long now = clock.getAsLong();
        long elapsed = now - lastRefill;
        if (elapsed > 0) {
            tokens = Math.min(capacity, tokens + elapsed * refillPerNano);
            lastRefill = now;
        }
    }
}
