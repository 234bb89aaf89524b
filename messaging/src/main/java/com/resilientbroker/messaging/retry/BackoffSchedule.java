/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.messaging.retry;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Stateful delay sequence for one retry loop.
 *
 * <p>Each call to {@link #nextDelay()} returns {@code currentDelay} plus a random jitter in
 * {@code [0, currentDelay * multiplier)}, capped at {@code maxDelay}, then grows
 * {@code currentDelay} by the multiplier (also capped). {@code currentDelay} starts at
 * {@code baseDelay}. Not thread-safe; create one per loop.</p>
 */
public final class BackoffSchedule {

    private final long baseNanos;
    private final long maxNanos;
    private final double multiplier;
    private long currentNanos;

    public BackoffSchedule(RetryPolicy policy) {
        this.baseNanos = policy.getBaseDelay().toNanos();
        this.maxNanos = policy.getMaxDelay().toNanos();
        this.multiplier = policy.getBackoffMultiplier();
        this.currentNanos = baseNanos;
    }

    public Duration nextDelay() {
        long spread = saturatedMultiply(currentNanos, multiplier);
        long jitter = spread > 0 ? ThreadLocalRandom.current().nextLong(spread) : 0L;
        long delay = Math.min(saturatedAdd(currentNanos, jitter), maxNanos);
        currentNanos = Math.min(saturatedMultiply(currentNanos, multiplier), maxNanos);
        return Duration.ofNanos(delay);
    }

    /** Start over from the base delay, e.g. after a successful reconnect. */
    public void reset() {
        currentNanos = baseNanos;
    }

    private static long saturatedAdd(long a, long b) {
        long sum = a + b;
        return sum < 0 ? Long.MAX_VALUE : sum;
    }

    private static long saturatedMultiply(long value, double factor) {
        double product = value * factor;
        return product >= Long.MAX_VALUE ? Long.MAX_VALUE : (long) product;
    }
}
