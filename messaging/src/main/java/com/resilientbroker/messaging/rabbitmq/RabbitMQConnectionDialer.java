/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.messaging.rabbitmq;

import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.resilientbroker.common.exception.InvalidConfigurationException;
import com.resilientbroker.messaging.core.BrokerEndpoint;
import com.resilientbroker.messaging.core.ConnectionDialer;
import com.resilientbroker.messaging.core.SslHelper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Dials AMQP 0-9-1 connections with the RabbitMQ Java client.
 *
 * <p>The library's automatic recovery is switched off: the
 * {@link com.resilientbroker.messaging.core.ConnectionSupervisor} owns reconnection, so a lost
 * connection must surface as a shutdown signal instead of being healed behind our back.</p>
 */
public class RabbitMQConnectionDialer implements ConnectionDialer {

    private static final Logger log = LoggerFactory.getLogger(RabbitMQConnectionDialer.class);

    private final ConnectionFactory factory;
    private final BrokerEndpoint endpoint;

    public RabbitMQConnectionDialer(BrokerEndpoint endpoint) {
        this(endpoint, new ConnectionFactory());
    }

    RabbitMQConnectionDialer(BrokerEndpoint endpoint, ConnectionFactory factory) {
        this.endpoint = endpoint;
        this.factory = factory;
        configure();
    }

    private void configure() {
        try {
            if (endpoint.getUri() != null) {
                factory.setUri(endpoint.getUri());
            } else {
                factory.setHost(endpoint.getHost());
                factory.setPort(endpoint.getPort());
                factory.setVirtualHost(endpoint.getVirtualHost());
                factory.setUsername(endpoint.getUsername());
                factory.setPassword(endpoint.getPassword());
            }
            if (endpoint.isTlsEnabled()) {
                factory.useSslProtocol(SslHelper.createSslContext(endpoint.getTls()));
                log.info("TLS enabled for broker {}", endpoint.describe());
            }
        } catch (InvalidConfigurationException e) {
            throw e;
        } catch (Exception e) {
            throw new InvalidConfigurationException("Invalid broker endpoint " + endpoint.describe(), e);
        }
        factory.setConnectionTimeout((int) endpoint.getConnectTimeout().toMillis());
        factory.setHandshakeTimeout((int) endpoint.getConnectTimeout().toMillis());
        factory.setRequestedHeartbeat((int) endpoint.getHeartbeat().toSeconds());
        factory.setAutomaticRecoveryEnabled(false);
        factory.setTopologyRecoveryEnabled(false);
    }

    @Override
    public Connection dial() throws IOException, TimeoutException {
        return factory.newConnection(endpoint.getConnectionName());
    }

    @Override
    public String describe() {
        return endpoint.describe();
    }

    ConnectionFactory getFactory() { return factory; }
}
