/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.messaging.client;

import com.resilientbroker.common.config.BrokerClientProperties;
import com.resilientbroker.common.exception.InvalidConfigurationException;
import com.resilientbroker.messaging.consume.ConsumerConfig;
import com.resilientbroker.messaging.consume.ExhaustionAction;
import com.resilientbroker.messaging.core.BrokerEndpoint;
import com.resilientbroker.messaging.core.TlsSettings;
import com.resilientbroker.messaging.deadletter.DeadLetterDestination;
import com.resilientbroker.messaging.publish.PublisherConfig;
import com.resilientbroker.messaging.retry.RetryPolicy;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Everything a {@link BrokerClient} needs: where to connect, how hard to retry, and the
 * optional default consumer and dead-letter destination.
 *
 * <h3>Property keys</h3>
 * <pre>
 * broker.uri | broker.host, broker.port, broker.virtual-host
 * broker.username, broker.password, broker.connection-name
 * broker.connect-timeout, broker.heartbeat
 * broker.tls.enabled, broker.tls.format (PEM|JKS|PKCS12), broker.tls.protocol
 * broker.tls.ca-cert, broker.tls.client-cert, broker.tls.client-key
 * broker.tls.keystore, broker.tls.keystore-password, broker.tls.truststore, broker.tls.truststore-password
 * broker.reconnect.*            base-delay, max-delay, multiplier (attempts are unbounded)
 * broker.publish.*              max-attempts, base-delay, max-delay, multiplier,
 *                               content-type, confirms, confirm-timeout
 * broker.consumer.queue         enables the default consumer settings
 * broker.consumer.*             consumer-tag, workers, prefetch, buffer, auto-ack, ack-multiple,
 *                               nack-multiple, startup-timeout, on-exhaustion (ACK|REJECT)
 * broker.consumer.retry.*       handler retry policy
 * broker.consumer.restart.*     restart backoff between consume cycles
 * broker.consumer.args.*        x-arguments passed to basic.consume
 * broker.dlq.routing-key        enables dead-lettering
 * broker.dlq.exchange, broker.dlq.content-type, broker.dlq.retry.*
 * </pre>
 */
public final class BrokerClientConfig {

    /** Reconnect backoff: starts fast, settles at one attempt every 30 seconds. */
    public static final RetryPolicy DEFAULT_RECONNECT_POLICY = RetryPolicy.builder()
            .maxAttempts(Integer.MAX_VALUE)
            .baseDelay(Duration.ofMillis(500))
            .maxDelay(Duration.ofSeconds(30))
            .backoffMultiplier(2.0)
            .build();

    private final BrokerEndpoint endpoint;
    private final RetryPolicy reconnectPolicy;
    private final PublisherConfig publisherConfig;
    private final ConsumerConfig consumerConfig;
    private final DeadLetterDestination deadLetterDestination;
    private final RetryPolicy deadLetterRetryPolicy;

    private BrokerClientConfig(Builder b) {
        this.endpoint = b.endpoint;
        this.reconnectPolicy = b.reconnectPolicy;
        this.publisherConfig = b.publisherConfig;
        this.consumerConfig = b.consumerConfig;
        this.deadLetterDestination = b.deadLetterDestination;
        this.deadLetterRetryPolicy = b.deadLetterRetryPolicy;
    }

    public static Builder builder(BrokerEndpoint endpoint) {
        return new Builder(endpoint);
    }

    public BrokerEndpoint getEndpoint() { return endpoint; }
    public RetryPolicy getReconnectPolicy() { return reconnectPolicy; }
    public PublisherConfig getPublisherConfig() { return publisherConfig; }
    /** Default consumer settings, or {@code null} when none were configured. */
    public ConsumerConfig getConsumerConfig() { return consumerConfig; }
    /** Dead-letter target, or {@code null} when dead-lettering is off. */
    public DeadLetterDestination getDeadLetterDestination() { return deadLetterDestination; }
    public RetryPolicy getDeadLetterRetryPolicy() { return deadLetterRetryPolicy; }

    // ─── Property Binding ───────────────────────────────────────────

    public static BrokerClientConfig fromProperties(BrokerClientProperties props) {
        Builder builder = builder(endpoint(props))
                .reconnectPolicy(retryPolicy(props, "broker.reconnect.", DEFAULT_RECONNECT_POLICY))
                .publisherConfig(new PublisherConfig(
                        props.getString("broker.publish.content-type", PublisherConfig.DEFAULT_CONTENT_TYPE),
                        retryPolicy(props, "broker.publish.", RetryPolicy.defaults()),
                        props.getBoolean("broker.publish.confirms", false),
                        props.getDuration("broker.publish.confirm-timeout", PublisherConfig.DEFAULT_CONFIRM_TIMEOUT)));

        String queue = props.getString("broker.consumer.queue", null);
        if (queue != null) {
            builder.consumerConfig(consumer(props, queue));
        }
        String dlqKey = props.getString("broker.dlq.routing-key", null);
        if (dlqKey != null) {
            builder.deadLetter(new DeadLetterDestination(
                            props.getString("broker.dlq.exchange", ""),
                            dlqKey,
                            props.getString("broker.dlq.content-type", DeadLetterDestination.DEFAULT_CONTENT_TYPE)),
                    retryPolicy(props, "broker.dlq.retry.", RetryPolicy.defaults()));
        }
        return builder.build();
    }

    static BrokerEndpoint endpoint(BrokerClientProperties props) {
        BrokerEndpoint.Builder b = BrokerEndpoint.builder()
                .uri(props.getString("broker.uri", null))
                .host(props.getString("broker.host", null))
                .virtualHost(props.getString("broker.virtual-host", "/"))
                .username(props.getString("broker.username", "guest"))
                .password(props.getString("broker.password", "guest"))
                .connectionName(props.getString("broker.connection-name", "resilient-broker-client"))
                .connectTimeout(props.getDuration("broker.connect-timeout", BrokerEndpoint.DEFAULT_CONNECT_TIMEOUT))
                .heartbeat(props.getDuration("broker.heartbeat", BrokerEndpoint.DEFAULT_HEARTBEAT));
        TlsSettings tls = tls(props);
        if (tls != null) b.tls(tls);
        int port = props.getInt("broker.port", 0);
        if (port > 0) b.port(port);
        return b.build();
    }

    private static TlsSettings tls(BrokerClientProperties props) {
        if (!props.getBoolean("broker.tls.enabled", false)) return null;
        String formatName = props.getString("broker.tls.format", "PEM").toUpperCase(Locale.ROOT);
        TlsSettings.Format format;
        try {
            format = TlsSettings.Format.valueOf(formatName);
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException("Unknown broker.tls.format '" + formatName + "'", e);
        }
        TlsSettings settings = format == TlsSettings.Format.PEM
                ? TlsSettings.pem(path(props, "broker.tls.ca-cert"), path(props, "broker.tls.client-cert"),
                        path(props, "broker.tls.client-key"))
                : TlsSettings.keystore(format, path(props, "broker.tls.keystore"),
                        props.getString("broker.tls.keystore-password", null),
                        path(props, "broker.tls.truststore"),
                        props.getString("broker.tls.truststore-password", null));
        return settings.withProtocol(props.getString("broker.tls.protocol", TlsSettings.DEFAULT_PROTOCOL));
    }

    private static Path path(BrokerClientProperties props, String key) {
        String value = props.getString(key, null);
        return value != null ? Path.of(value) : null;
    }

    static ConsumerConfig consumer(BrokerClientProperties props, String queue) {
        String p = "broker.consumer.";
        ConsumerConfig.Builder b = ConsumerConfig.builder(queue)
                .consumerTag(props.getString(p + "consumer-tag", ConsumerConfig.DEFAULT_CONSUMER_TAG))
                .workers(props.getInt(p + "workers", 1))
                .prefetchCount(props.getInt(p + "prefetch", 0))
                .bufferCapacity(props.getInt(p + "buffer", 0))
                .autoAck(props.getBoolean(p + "auto-ack", false))
                .ackMultiple(props.getBoolean(p + "ack-multiple", false))
                .nackMultiple(props.getBoolean(p + "nack-multiple", false))
                .startupTimeout(props.getDuration(p + "startup-timeout", ConsumerConfig.DEFAULT_STARTUP_TIMEOUT))
                .retryPolicy(retryPolicy(props, p + "retry.", RetryPolicy.defaults()));
        if (props.hasProperty(p + "restart.base-delay") || props.hasProperty(p + "restart.max-delay")
                || props.hasProperty(p + "restart.multiplier")) {
            b.restartPolicy(retryPolicy(props, p + "restart.", DEFAULT_RECONNECT_POLICY));
        }
        String action = props.getString(p + "on-exhaustion", ExhaustionAction.REJECT.name());
        try {
            b.exhaustionAction(ExhaustionAction.valueOf(action.toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException("Unknown " + p + "on-exhaustion '" + action + "'", e);
        }
        for (Map.Entry<String, String> arg : props.getSubProperties(p + "args.").entrySet()) {
            b.argument(arg.getKey(), arg.getValue());
        }
        return b.build();
    }

    /** Read a retry policy under {@code prefix}, falling back field by field to {@code defaults}. */
    static RetryPolicy retryPolicy(BrokerClientProperties props, String prefix, RetryPolicy defaults) {
        return defaults.toBuilder()
                .maxAttempts(props.getInt(prefix + "max-attempts", defaults.getMaxAttempts()))
                .baseDelay(props.getDuration(prefix + "base-delay", defaults.getBaseDelay()))
                .maxDelay(props.getDuration(prefix + "max-delay", defaults.getMaxDelay()))
                .backoffMultiplier(props.getDouble(prefix + "multiplier", defaults.getBackoffMultiplier()))
                .build();
    }

    public static final class Builder {
        private final BrokerEndpoint endpoint;
        private RetryPolicy reconnectPolicy = DEFAULT_RECONNECT_POLICY;
        private PublisherConfig publisherConfig = PublisherConfig.defaults();
        private ConsumerConfig consumerConfig;
        private DeadLetterDestination deadLetterDestination;
        private RetryPolicy deadLetterRetryPolicy = RetryPolicy.defaults();

        private Builder(BrokerEndpoint endpoint) {
            this.endpoint = endpoint;
        }

        public Builder reconnectPolicy(RetryPolicy policy) { this.reconnectPolicy = policy; return this; }
        public Builder publisherConfig(PublisherConfig config) { this.publisherConfig = config; return this; }
        public Builder consumerConfig(ConsumerConfig config) { this.consumerConfig = config; return this; }

        public Builder deadLetter(DeadLetterDestination destination, RetryPolicy retryPolicy) {
            this.deadLetterDestination = destination;
            if (retryPolicy != null) this.deadLetterRetryPolicy = retryPolicy;
            return this;
        }

        public BrokerClientConfig build() {
            if (endpoint == null) {
                throw new InvalidConfigurationException("A broker endpoint is required");
            }
            if (reconnectPolicy == null || publisherConfig == null) {
                throw new InvalidConfigurationException("reconnectPolicy and publisherConfig are required");
            }
            return new BrokerClientConfig(this);
        }
    }
}
