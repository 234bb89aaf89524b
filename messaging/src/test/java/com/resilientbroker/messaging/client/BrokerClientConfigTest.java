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
import com.resilientbroker.messaging.core.TlsSettings;
import com.resilientbroker.messaging.retry.RetryPolicy;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BrokerClientConfigTest {

    private static BrokerClientConfig config(Map<String, String> values) {
        return BrokerClientConfig.fromProperties(BrokerClientProperties.fromMap(values));
    }

    @Test
    void minimalPropertiesUseDefaults() {
        BrokerClientConfig config = config(Map.of("broker.host", "rabbit"));

        assertThat(config.getEndpoint().getHost()).isEqualTo("rabbit");
        assertThat(config.getEndpoint().getPort()).isEqualTo(5672);
        assertThat(config.getReconnectPolicy()).isEqualTo(BrokerClientConfig.DEFAULT_RECONNECT_POLICY);
        assertThat(config.getPublisherConfig().retryPolicy()).isEqualTo(RetryPolicy.defaults());
        assertThat(config.getPublisherConfig().publisherConfirms()).isFalse();
        assertThat(config.getConsumerConfig()).isNull();
        assertThat(config.getDeadLetterDestination()).isNull();
    }

    @Test
    void readsEndpointAndPublisherSettings() {
        Map<String, String> values = new HashMap<>();
        values.put("broker.uri", "amqp://app:pw@rabbit:5673/orders");
        values.put("broker.connection-name", "billing");
        values.put("broker.heartbeat", "30s");
        values.put("broker.reconnect.base-delay", "250ms");
        values.put("broker.reconnect.max-delay", "1m");
        values.put("broker.publish.max-attempts", "5");
        values.put("broker.publish.content-type", "application/json");
        values.put("broker.publish.confirms", "true");
        values.put("broker.publish.confirm-timeout", "2s");

        BrokerClientConfig config = config(values);

        assertThat(config.getEndpoint().describe()).isEqualTo("amqp://rabbit:5673/orders");
        assertThat(config.getEndpoint().getConnectionName()).isEqualTo("billing");
        assertThat(config.getEndpoint().getHeartbeat()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.getReconnectPolicy().getBaseDelay()).isEqualTo(Duration.ofMillis(250));
        assertThat(config.getReconnectPolicy().getMaxDelay()).isEqualTo(Duration.ofMinutes(1));
        assertThat(config.getReconnectPolicy().getMaxAttempts()).isEqualTo(Integer.MAX_VALUE);
        assertThat(config.getPublisherConfig().retryPolicy().getMaxAttempts()).isEqualTo(5);
        assertThat(config.getPublisherConfig().contentType()).isEqualTo("application/json");
        assertThat(config.getPublisherConfig().publisherConfirms()).isTrue();
        assertThat(config.getPublisherConfig().confirmTimeout()).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    void consumerIsConfiguredByQueueName() {
        Map<String, String> values = new HashMap<>();
        values.put("broker.host", "rabbit");
        values.put("broker.consumer.queue", "orders");
        values.put("broker.consumer.workers", "4");
        values.put("broker.consumer.prefetch", "20");
        values.put("broker.consumer.on-exhaustion", "ack");
        values.put("broker.consumer.retry.max-attempts", "5");
        values.put("broker.consumer.restart.max-delay", "10s");
        values.put("broker.consumer.args.x-priority", "5");

        ConsumerConfig consumer = config(values).getConsumerConfig();

        assertThat(consumer.getQueue()).isEqualTo("orders");
        assertThat(consumer.getConsumerTag()).isEqualTo(ConsumerConfig.DEFAULT_CONSUMER_TAG);
        assertThat(consumer.getWorkers()).isEqualTo(4);
        assertThat(consumer.getPrefetchCount()).isEqualTo(20);
        assertThat(consumer.getBufferCapacity()).isEqualTo(20);
        assertThat(consumer.getExhaustionAction()).isEqualTo(ExhaustionAction.ACK);
        assertThat(consumer.getRetryPolicy().getMaxAttempts()).isEqualTo(5);
        assertThat(consumer.getRestartPolicy().getMaxDelay()).isEqualTo(Duration.ofSeconds(10));
        assertThat(consumer.getArguments()).containsEntry("x-priority", "5");
    }

    @Test
    void deadLetterIsConfiguredByRoutingKey() {
        BrokerClientConfig config = config(Map.of(
                "broker.host", "rabbit",
                "broker.dlq.exchange", "dlx",
                "broker.dlq.routing-key", "orders.dead",
                "broker.dlq.retry.max-attempts", "10"));

        assertThat(config.getDeadLetterDestination().exchange()).isEqualTo("dlx");
        assertThat(config.getDeadLetterDestination().routingKey()).isEqualTo("orders.dead");
        assertThat(config.getDeadLetterRetryPolicy().getMaxAttempts()).isEqualTo(10);
    }

    @Test
    void tlsSettingsAreRead() {
        BrokerClientConfig config = config(Map.of(
                "broker.host", "rabbit",
                "broker.tls.enabled", "true",
                "broker.tls.ca-cert", "/etc/rabbit/ca.pem"));

        TlsSettings tls = config.getEndpoint().getTls();
        assertThat(tls.format()).isEqualTo(TlsSettings.Format.PEM);
        assertThat(tls.caCertPath()).isEqualTo(Path.of("/etc/rabbit/ca.pem"));
        assertThat(config.getEndpoint().getPort()).isEqualTo(5671);
    }

    @Test
    void invalidValuesAreConfigurationErrors() {
        assertThatThrownBy(() -> config(Map.of())).isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> config(Map.of("broker.host", "rabbit", "broker.port", "amqp")))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> config(Map.of(
                "broker.host", "rabbit",
                "broker.consumer.queue", "orders",
                "broker.consumer.on-exhaustion", "requeue")))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("on-exhaustion");
    }
}
