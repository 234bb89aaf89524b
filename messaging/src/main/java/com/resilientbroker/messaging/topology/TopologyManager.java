/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.messaging.topology;

import com.rabbitmq.client.BuiltinExchangeType;
import com.resilientbroker.messaging.core.ConnectionSupervisor;
import com.resilientbroker.messaging.core.Session;
import com.resilientbroker.messaging.deadletter.DeadLetterDestination;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Declares exchanges, queues and bindings. Each call leases its own session and releases it
 * before returning. Declarations are idempotent on the broker as long as the parameters match;
 * a mismatch closes the channel and surfaces as an {@link IOException}.
 */
public class TopologyManager {

    private static final Logger log = LoggerFactory.getLogger(TopologyManager.class);

    private final ConnectionSupervisor supervisor;

    public TopologyManager(ConnectionSupervisor supervisor) {
        this.supervisor = supervisor;
    }

    public void declareExchange(ExchangeSpec spec) throws IOException {
        try (Session session = supervisor.acquireSession()) {
            session.declareExchange(spec.name(), spec.type(), spec.durable(), spec.autoDelete(), spec.internal(),
                    spec.arguments());
        }
        log.info("Declared {} exchange '{}'", spec.type().getType(), spec.name());
    }

    /** Declare the queue and, when {@code spec} names an exchange, bind it. Returns the queue name. */
    public String declareQueue(QueueSpec spec) throws IOException {
        String queue;
        try (Session session = supervisor.acquireSession()) {
            queue = session.declareQueue(spec.name(), spec.durable(), spec.exclusive(), spec.autoDelete(),
                    spec.arguments());
            if (spec.hasBinding()) {
                session.bindQueue(queue, spec.bindExchange(), spec.routingKey(), null);
            }
        }
        if (spec.hasBinding()) {
            log.info("Declared queue '{}' bound to '{}' with key '{}'", queue, spec.bindExchange(), spec.routingKey());
        } else {
            log.info("Declared queue '{}'", queue);
        }
        return queue;
    }

    /**
     * Make sure dead-letter envelopes sent to {@code destination} land in a durable queue.
     * With the default exchange the queue is the routing key and {@code queueName} is ignored.
     */
    public String declareDeadLetterTopology(DeadLetterDestination destination, String queueName) throws IOException {
        if (destination.exchange().isEmpty()) {
            return declareQueue(QueueSpec.durable(destination.routingKey()));
        }
        declareExchange(ExchangeSpec.durable(destination.exchange(), BuiltinExchangeType.DIRECT));
        return declareQueue(QueueSpec.durable(queueName).boundTo(destination.exchange(), destination.routingKey()));
    }
}
