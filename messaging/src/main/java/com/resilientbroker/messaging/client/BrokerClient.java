/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.messaging.client;

import com.resilientbroker.common.concurrent.CancellationToken;
import com.resilientbroker.common.config.BrokerClientProperties;
import com.resilientbroker.common.exception.InvalidConfigurationException;
import com.resilientbroker.messaging.consume.ConsumerConfig;
import com.resilientbroker.messaging.consume.ConsumerPool;
import com.resilientbroker.messaging.core.ConnectionDialer;
import com.resilientbroker.messaging.core.ConnectionState;
import com.resilientbroker.messaging.core.ConnectionStateListener;
import com.resilientbroker.messaging.core.ConnectionSupervisor;
import com.resilientbroker.messaging.core.LoggingConnectionStateListener;
import com.resilientbroker.messaging.deadletter.DeadLetterDestination;
import com.resilientbroker.messaging.deadletter.DeadLetterSink;
import com.resilientbroker.messaging.publish.Publisher;
import com.resilientbroker.messaging.publish.PublisherConfig;
import com.resilientbroker.messaging.rabbitmq.RabbitMQConnectionDialer;
import com.resilientbroker.messaging.rabbitmq.RabbitMQErrorClassifier;
import com.resilientbroker.messaging.retry.RetryExecutor;
import com.resilientbroker.messaging.topology.TopologyManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: owns the connection supervisor and hands out publishers, consumer pools,
 * dead-letter sinks and the topology manager that share it.
 *
 * <pre>{@code
 * try (BrokerClient client = BrokerClient.connect(BrokerClientConfig.fromProperties(BrokerClientProperties.load()))) {
 *     client.publisher().publish(PublishRequest.of("orders", "created", body));
 * }
 * }</pre>
 */
public class BrokerClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BrokerClient.class);

    private final BrokerClientConfig config;
    private final ConnectionSupervisor supervisor;
    private final RetryExecutor retryExecutor;
    private final Publisher publisher;
    private final DeadLetterSink deadLetterSink;
    private final TopologyManager topology;

    BrokerClient(BrokerClientConfig config, ConnectionSupervisor supervisor) {
        this.config = config;
        this.supervisor = supervisor;
        this.retryExecutor = new RetryExecutor(new RabbitMQErrorClassifier());
        this.publisher = new Publisher(supervisor, retryExecutor, config.getPublisherConfig());
        this.deadLetterSink = config.getDeadLetterDestination() != null
                ? newDeadLetterSink(config.getDeadLetterDestination())
                : null;
        this.topology = new TopologyManager(supervisor);
    }

    /** Connect using {@code broker-client.properties} from the classpath. */
    public static BrokerClient connect() {
        return connect(BrokerClientConfig.fromProperties(BrokerClientProperties.load()));
    }

    /**
     * Start supervising a connection and wait for the first one.
     *
     * @throws com.resilientbroker.common.exception.ConnectionNotReadyException if the broker is not
     *         reachable within the endpoint's connect timeout
     */
    public static BrokerClient connect(BrokerClientConfig config) {
        return connect(config, new RabbitMQConnectionDialer(config.getEndpoint()));
    }

    static BrokerClient connect(BrokerClientConfig config, ConnectionDialer dialer) {
        ConnectionSupervisor supervisor = new ConnectionSupervisor(dialer, config.getReconnectPolicy());
        supervisor.addListener(new LoggingConnectionStateListener(config.getEndpoint().getConnectionName()));
        supervisor.start();
        try {
            supervisor.awaitOpen(config.getEndpoint().getConnectTimeout(), CancellationToken.none());
        } catch (RuntimeException e) {
            supervisor.shutdown();
            throw e;
        }
        log.info("Broker client connected to {}", dialer.describe());
        return new BrokerClient(config, supervisor);
    }

    // ─── Components ───────────────────────────────────────────────────────────

    /** The shared publisher built from the client's publisher settings. */
    public Publisher publisher() { return publisher; }

    public Publisher newPublisher(PublisherConfig publisherConfig) {
        return new Publisher(supervisor, retryExecutor, publisherConfig);
    }

    /** The configured dead-letter sink, or {@code null} when dead-lettering is off. */
    public DeadLetterSink deadLetterSink() { return deadLetterSink; }

    public DeadLetterSink newDeadLetterSink(DeadLetterDestination destination) {
        PublisherConfig dlqPublisher = config.getPublisherConfig()
                .withContentType(destination.contentType())
                .withRetryPolicy(config.getDeadLetterRetryPolicy());
        return new DeadLetterSink(newPublisher(dlqPublisher), destination);
    }

    /** A pool for the configured default consumer, dead-lettering through the configured sink. */
    public ConsumerPool newConsumerPool() {
        if (config.getConsumerConfig() == null) {
            throw new InvalidConfigurationException("No default consumer configured (broker.consumer.queue)");
        }
        return newConsumerPool(config.getConsumerConfig());
    }

    public ConsumerPool newConsumerPool(ConsumerConfig consumerConfig) {
        return new ConsumerPool(supervisor, retryExecutor, consumerConfig, deadLetterSink);
    }

    /** @param sink may be {@code null} to disable dead-lettering for this pool */
    public ConsumerPool newConsumerPool(ConsumerConfig consumerConfig, DeadLetterSink sink) {
        return new ConsumerPool(supervisor, retryExecutor, consumerConfig, sink);
    }

    public TopologyManager topology() { return topology; }

    public RetryExecutor retryExecutor() { return retryExecutor; }

    // ─── State ────────────────────────────────────────────────────────────────

    public boolean isHealthy() { return supervisor.isHealthy(); }

    public ConnectionState state() { return supervisor.state(); }

    public long generation() { return supervisor.generation(); }

    public void addConnectionStateListener(ConnectionStateListener listener) {
        supervisor.addListener(listener);
    }

    public BrokerClientConfig getConfig() { return config; }

    /** Shut down the connection. Running consumer pools stop with a client-closed error. Idempotent. */
    @Override
    public void close() {
        supervisor.shutdown();
    }
}
