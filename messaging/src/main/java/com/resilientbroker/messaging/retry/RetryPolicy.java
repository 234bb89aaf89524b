/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.messaging.retry;

import com.resilientbroker.common.exception.InvalidConfigurationException;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable retry policy: bounded attempts with exponential backoff.
 *
 * <p>Defaults: 3 attempts, 10ms base delay, 100ms max delay, multiplier 2.
 * Validation happens in {@link Builder#build()}, never when the policy is used.</p>
 */
public final class RetryPolicy {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofMillis(10);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofMillis(100);
    public static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0;

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double backoffMultiplier;

    private RetryPolicy(Builder b) {
        this.maxAttempts = b.maxAttempts;
        this.baseDelay = b.baseDelay;
        this.maxDelay = b.maxDelay;
        this.backoffMultiplier = b.backoffMultiplier;
    }

    public static RetryPolicy defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .maxAttempts(maxAttempts)
                .baseDelay(baseDelay)
                .maxDelay(maxDelay)
                .backoffMultiplier(backoffMultiplier);
    }

    public int getMaxAttempts() { return maxAttempts; }
    public Duration getBaseDelay() { return baseDelay; }
    public Duration getMaxDelay() { return maxDelay; }
    public double getBackoffMultiplier() { return backoffMultiplier; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RetryPolicy)) return false;
        RetryPolicy that = (RetryPolicy) o;
        return maxAttempts == that.maxAttempts
                && Double.compare(that.backoffMultiplier, backoffMultiplier) == 0
                && baseDelay.equals(that.baseDelay)
                && maxDelay.equals(that.maxDelay);
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxAttempts, baseDelay, maxDelay, backoffMultiplier);
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxAttempts=" + maxAttempts + ", baseDelay=" + baseDelay.toMillis()
                + "ms, maxDelay=" + maxDelay.toMillis() + "ms, multiplier=" + backoffMultiplier + "}";
    }

    public static final class Builder {
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private Duration baseDelay = DEFAULT_BASE_DELAY;
        private Duration maxDelay = DEFAULT_MAX_DELAY;
        private double backoffMultiplier = DEFAULT_BACKOFF_MULTIPLIER;

        private Builder() {}

        public Builder maxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; return this; }
        public Builder baseDelay(Duration baseDelay) { this.baseDelay = baseDelay; return this; }
        public Builder maxDelay(Duration maxDelay) { this.maxDelay = maxDelay; return this; }
        public Builder backoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; return this; }

        public RetryPolicy build() {
            if (maxAttempts <= 0) {
                throw new InvalidConfigurationException("maxAttempts must be > 0, got " + maxAttempts);
            }
            if (baseDelay == null || baseDelay.isNegative() || baseDelay.isZero()) {
                throw new InvalidConfigurationException("baseDelay must be > 0, got " + baseDelay);
            }
            if (maxDelay == null || maxDelay.isNegative() || maxDelay.isZero()) {
                throw new InvalidConfigurationException("maxDelay must be > 0, got " + maxDelay);
            }
            if (baseDelay.compareTo(maxDelay) > 0) {
                throw new InvalidConfigurationException(
                        "baseDelay (" + baseDelay + ") cannot exceed maxDelay (" + maxDelay + ")");
            }
            if (Double.isNaN(backoffMultiplier) || backoffMultiplier < 1.0) {
                throw new InvalidConfigurationException("backoffMultiplier must be >= 1, got " + backoffMultiplier);
            }
            return new RetryPolicy(this);
        }
    }
}
