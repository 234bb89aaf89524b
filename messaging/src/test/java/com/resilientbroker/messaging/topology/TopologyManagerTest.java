/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.messaging.topology;

import com.rabbitmq.client.BuiltinExchangeType;
import com.resilientbroker.common.exception.InvalidConfigurationException;
import com.resilientbroker.messaging.core.ConnectionSupervisor;
import com.resilientbroker.messaging.core.Session;
import com.resilientbroker.messaging.deadletter.DeadLetterDestination;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class TopologyManagerTest {

    private ConnectionSupervisor supervisor;
    private Session session;
    private TopologyManager topology;

    @BeforeEach
    void setUp() throws IOException {
        supervisor = mock(ConnectionSupervisor.class);
        session = mock(Session.class);
        when(supervisor.acquireSession()).thenReturn(session);
        when(session.declareQueue(anyString(), anyBoolean(), anyBoolean(), anyBoolean(), any()))
                .thenAnswer(inv -> inv.getArgument(0));
        topology = new TopologyManager(supervisor);
    }

    @Test
    void declaresExchangeAndReleasesTheSession() throws IOException {
        topology.declareExchange(ExchangeSpec.durable("events", BuiltinExchangeType.TOPIC));

        verify(session).declareExchange("events", BuiltinExchangeType.TOPIC, true, false, false, Map.of());
        verify(session).close();
    }

    @Test
    void declaresAndBindsQueue() throws IOException {
        String name = topology.declareQueue(QueueSpec.durable("orders")
                .withArgument("x-queue-type", "quorum")
                .boundTo("events", "orders.*"));

        assertEquals("orders", name);
        verify(session).declareQueue("orders", true, false, false, Map.of("x-queue-type", "quorum"));
        verify(session).bindQueue("orders", "events", "orders.*", null);
        verify(session).close();
    }

    @Test
    void unboundQueueIsNotBound() throws IOException {
        topology.declareQueue(QueueSpec.durable("orders"));

        verify(session, never()).bindQueue(anyString(), anyString(), anyString(), any());
    }

    @Test
    void deadLetterQueueOnTheDefaultExchange() throws IOException {
        String queue = topology.declareDeadLetterTopology(DeadLetterDestination.queue("orders.dlq"), "ignored");

        assertEquals("orders.dlq", queue);
        verify(session, never()).declareExchange(anyString(), any(), anyBoolean(), anyBoolean(), anyBoolean(), any());
        verify(session).declareQueue("orders.dlq", true, false, false, Map.of());
    }

    @Test
    void deadLetterExchangeGetsABoundQueue() throws IOException {
        topology.declareDeadLetterTopology(DeadLetterDestination.of("dlx", "orders.dead"), "orders.dlq");

        verify(session).declareExchange("dlx", BuiltinExchangeType.DIRECT, true, false, false, Map.of());
        verify(session).declareQueue("orders.dlq", true, false, false, Map.of());
        verify(session).bindQueue("orders.dlq", "dlx", "orders.dead", null);
    }

    @Test
    void declarationErrorsPropagate() throws IOException {
        doThrow(new IOException("PRECONDITION_FAILED - inequivalent arg 'durable'"))
                .when(session).declareExchange(anyString(), any(), anyBoolean(), anyBoolean(), anyBoolean(), any());

        assertThrows(IOException.class,
                () -> topology.declareExchange(ExchangeSpec.durable("events", BuiltinExchangeType.FANOUT)));
        verify(session).close();
    }

    @Test
    void exchangeNeedsAName() {
        assertThrows(InvalidConfigurationException.class,
                () -> ExchangeSpec.durable("", BuiltinExchangeType.DIRECT));
    }
}
