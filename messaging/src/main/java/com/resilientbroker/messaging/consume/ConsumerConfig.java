/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.messaging.consume;

import com.resilientbroker.common.exception.InvalidConfigurationException;
import com.resilientbroker.messaging.retry.RetryPolicy;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Consumer pool tuning. Built with {@link #builder(String)}; invalid combinations fail at
 * {@link Builder#build()}.
 */
public final class ConsumerConfig {

    public static final String DEFAULT_CONSUMER_TAG = "consumer";
    public static final Duration DEFAULT_STARTUP_TIMEOUT = Duration.ofSeconds(30);

    private final String queue;
    private final String consumerTag;
    private final int workers;
    private final int prefetchCount;
    private final int bufferCapacity;
    private final boolean autoAck;
    private final boolean ackMultiple;
    private final boolean nackMultiple;
    private final Map<String, Object> arguments;
    private final RetryPolicy retryPolicy;
    private final RetryPolicy restartPolicy;
    private final Duration startupTimeout;
    private final ExhaustionAction exhaustionAction;

    private ConsumerConfig(Builder b) {
        this.queue = b.queue;
        this.consumerTag = b.consumerTag;
        this.workers = b.workers;
        this.prefetchCount = b.prefetchCount;
        this.bufferCapacity = b.bufferCapacity > 0 ? b.bufferCapacity : Math.max(b.prefetchCount, b.workers);
        this.autoAck = b.autoAck;
        this.ackMultiple = b.ackMultiple;
        this.nackMultiple = b.nackMultiple;
        this.arguments = Collections.unmodifiableMap(new LinkedHashMap<>(b.arguments));
        this.retryPolicy = b.retryPolicy;
        this.restartPolicy = b.restartPolicy;
        this.startupTimeout = b.startupTimeout;
        this.exhaustionAction = b.exhaustionAction;
    }

    public static Builder builder(String queue) {
        return new Builder(queue);
    }

    public String getQueue() { return queue; }
    public String getConsumerTag() { return consumerTag; }
    public int getWorkers() { return workers; }
    /** Broker-side unacked limit for the channel; 0 means unlimited. */
    public int getPrefetchCount() { return prefetchCount; }
    public int getBufferCapacity() { return bufferCapacity; }
    public boolean isAutoAck() { return autoAck; }
    public boolean isAckMultiple() { return ackMultiple; }
    public boolean isNackMultiple() { return nackMultiple; }
    public Map<String, Object> getArguments() { return arguments; }
    public RetryPolicy getRetryPolicy() { return retryPolicy; }
    public RetryPolicy getRestartPolicy() { return restartPolicy; }
    public Duration getStartupTimeout() { return startupTimeout; }
    public ExhaustionAction getExhaustionAction() { return exhaustionAction; }

    @Override
    public String toString() {
        return "ConsumerConfig{queue='" + queue + "', tag='" + consumerTag + "', workers=" + workers
                + ", prefetch=" + prefetchCount + ", autoAck=" + autoAck + ", onExhaustion=" + exhaustionAction + "}";
    }

    public static final class Builder {
        private final String queue;
        private String consumerTag = DEFAULT_CONSUMER_TAG;
        private int workers = 1;
        private int prefetchCount;
        private int bufferCapacity;
        private boolean autoAck;
        private boolean ackMultiple;
        private boolean nackMultiple;
        private final Map<String, Object> arguments = new LinkedHashMap<>();
        private RetryPolicy retryPolicy = RetryPolicy.defaults();
        private RetryPolicy restartPolicy = RetryPolicy.builder()
                .maxAttempts(Integer.MAX_VALUE)
                .baseDelay(Duration.ofMillis(100))
                .maxDelay(Duration.ofSeconds(30))
                .build();
        private Duration startupTimeout = DEFAULT_STARTUP_TIMEOUT;
        private ExhaustionAction exhaustionAction = ExhaustionAction.REJECT;

        private Builder(String queue) {
            this.queue = queue;
        }

        public Builder consumerTag(String consumerTag) { this.consumerTag = consumerTag; return this; }
        public Builder workers(int workers) { this.workers = workers; return this; }
        public Builder prefetchCount(int prefetchCount) { this.prefetchCount = prefetchCount; return this; }
        public Builder bufferCapacity(int bufferCapacity) { this.bufferCapacity = bufferCapacity; return this; }
        public Builder autoAck(boolean autoAck) { this.autoAck = autoAck; return this; }
        public Builder ackMultiple(boolean ackMultiple) { this.ackMultiple = ackMultiple; return this; }
        public Builder nackMultiple(boolean nackMultiple) { this.nackMultiple = nackMultiple; return this; }
        public Builder argument(String name, Object value) { this.arguments.put(name, value); return this; }
        public Builder retryPolicy(RetryPolicy retryPolicy) { this.retryPolicy = retryPolicy; return this; }
        public Builder restartPolicy(RetryPolicy restartPolicy) { this.restartPolicy = restartPolicy; return this; }
        public Builder startupTimeout(Duration startupTimeout) { this.startupTimeout = startupTimeout; return this; }
        public Builder exhaustionAction(ExhaustionAction action) { this.exhaustionAction = action; return this; }

        public ConsumerConfig build() {
            if (queue == null || queue.isBlank()) {
                throw new InvalidConfigurationException("Consumer queue name is required");
            }
            if (consumerTag == null) consumerTag = DEFAULT_CONSUMER_TAG;
            if (workers <= 0) {
                throw new InvalidConfigurationException("workers must be positive: " + workers);
            }
            if ((ackMultiple || nackMultiple) && workers > 1) {
                throw new InvalidConfigurationException(
                        "ackMultiple/nackMultiple require a single worker; settling out of order would cover other workers' tags");
            }
            if (prefetchCount < 0 || prefetchCount > 65535) {
                throw new InvalidConfigurationException("prefetchCount must be within 0..65535: " + prefetchCount);
            }
            if (bufferCapacity < 0) {
                throw new InvalidConfigurationException("bufferCapacity must not be negative: " + bufferCapacity);
            }
            if (retryPolicy == null || restartPolicy == null) {
                throw new InvalidConfigurationException("retryPolicy and restartPolicy are required");
            }
            if (startupTimeout == null || startupTimeout.isNegative() || startupTimeout.isZero()) {
                throw new InvalidConfigurationException("startupTimeout must be positive: " + startupTimeout);
            }
            if (exhaustionAction == null) exhaustionAction = ExhaustionAction.REJECT;
            return new ConsumerConfig(this);
        }
    }
}
