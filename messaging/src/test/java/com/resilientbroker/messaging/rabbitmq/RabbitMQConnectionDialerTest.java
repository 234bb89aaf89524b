/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.messaging.rabbitmq;

import com.rabbitmq.client.ConnectionFactory;
import com.resilientbroker.common.exception.InvalidConfigurationException;
import com.resilientbroker.messaging.core.BrokerEndpoint;
import com.resilientbroker.messaging.core.TlsSettings;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class RabbitMQConnectionDialerTest {

    @Test
    void configuresFactoryFromHostEndpoint() {
        BrokerEndpoint endpoint = BrokerEndpoint.builder()
                .host("rabbit")
                .port(5673)
                .virtualHost("orders")
                .username("app")
                .password("pw")
                .connectTimeout(Duration.ofSeconds(3))
                .heartbeat(Duration.ofSeconds(15))
                .build();

        ConnectionFactory factory = new RabbitMQConnectionDialer(endpoint).getFactory();

        assertEquals("rabbit", factory.getHost());
        assertEquals(5673, factory.getPort());
        assertEquals("orders", factory.getVirtualHost());
        assertEquals("app", factory.getUsername());
        assertEquals(3000, factory.getConnectionTimeout());
        assertEquals(3000, factory.getHandshakeTimeout());
        assertEquals(15, factory.getRequestedHeartbeat());
    }

    @Test
    void libraryRecoveryIsDisabled() {
        ConnectionFactory factory = new RabbitMQConnectionDialer(
                BrokerEndpoint.builder().host("rabbit").build()).getFactory();

        assertFalse(factory.isAutomaticRecoveryEnabled());
        assertFalse(factory.isTopologyRecoveryEnabled());
    }

    @Test
    void configuresFactoryFromUri() {
        ConnectionFactory factory = new RabbitMQConnectionDialer(
                BrokerEndpoint.builder().uri("amqp://app:pw@broker:5674/billing").build()).getFactory();

        assertEquals("broker", factory.getHost());
        assertEquals(5674, factory.getPort());
        assertEquals("billing", factory.getVirtualHost());
        assertEquals("app", factory.getUsername());
    }

    @Test
    void dialUsesTheConnectionName() throws Exception {
        ConnectionFactory factory = mock(ConnectionFactory.class);
        BrokerEndpoint endpoint = BrokerEndpoint.builder().host("rabbit").connectionName("billing-service").build();

        new RabbitMQConnectionDialer(endpoint, factory).dial();

        verify(factory).newConnection("billing-service");
    }

    @Test
    void unreadableTlsMaterialIsAConfigurationError() {
        BrokerEndpoint endpoint = BrokerEndpoint.builder()
                .host("rabbit")
                .tls(TlsSettings.pem(Path.of("/nonexistent/ca.pem"), null, null))
                .build();

        assertThrows(InvalidConfigurationException.class, () -> new RabbitMQConnectionDialer(endpoint));
    }
}
