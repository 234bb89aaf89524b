/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.messaging.core;

import com.rabbitmq.client.Channel;
import com.resilientbroker.common.concurrent.CancellationToken;
import com.resilientbroker.common.exception.ChannelLostException;
import com.resilientbroker.common.exception.ClientClosedException;
import com.resilientbroker.common.exception.ConnectionNotReadyException;
import com.resilientbroker.common.exception.OperationCancelledException;
import com.resilientbroker.messaging.retry.RetryPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.resilientbroker.messaging.core.FakeBroker.awaitCondition;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

class ConnectionSupervisorTest {

    private static final Duration WAIT = Duration.ofSeconds(5);
    private static final RetryPolicy FAST_RECONNECT = RetryPolicy.builder()
            .maxAttempts(Integer.MAX_VALUE)
            .baseDelay(Duration.ofMillis(5))
            .maxDelay(Duration.ofMillis(20))
            .build();

    private final FakeBroker broker = new FakeBroker();
    private final ConnectionSupervisor supervisor = new ConnectionSupervisor(broker, FAST_RECONNECT);
    private final List<String> transitions = new CopyOnWriteArrayList<>();

    @AfterEach
    void tearDown() {
        supervisor.shutdown();
    }

    private void recordTransitions() {
        supervisor.addListener((previous, current, generation, cause) ->
                transitions.add(previous + "->" + current + "#" + generation));
    }

    @Test
    void startsInConnectingAndRefusesSessions() {
        assertEquals(ConnectionState.CONNECTING, supervisor.state());
        assertFalse(supervisor.isHealthy());
        assertEquals(0, supervisor.generation());

        ConnectionNotReadyException e = assertThrows(ConnectionNotReadyException.class, supervisor::acquireSession);
        assertEquals("BRK_NOT_READY", e.getErrorCode());
    }

    @Test
    void connectsAndLeasesSessionsOnCurrentGeneration() {
        recordTransitions();
        supervisor.start();
        supervisor.awaitOpen(WAIT, CancellationToken.none());

        assertTrue(supervisor.isHealthy());
        assertEquals(1, supervisor.generation());
        try (Session session = supervisor.acquireSession()) {
            assertEquals(1, session.generation());
            assertTrue(session.isOpen());
        }
        assertThat(transitions).containsExactly("CONNECTING->OPEN#1");
    }

    @Test
    void startIsIdempotent() throws InterruptedException {
        supervisor.start();
        supervisor.start();
        supervisor.awaitOpen(WAIT, CancellationToken.none());
        Thread.sleep(50);

        assertEquals(1, broker.dials.get());
        assertEquals(1, broker.connections.size());
    }

    @Test
    void keepsDialingUntilTheBrokerAnswers() {
        broker.failNextDials(3);

        supervisor.start();
        supervisor.awaitOpen(WAIT, CancellationToken.none());

        assertEquals(4, broker.dials.get());
        assertEquals(1, supervisor.generation());
        assertNull(supervisor.lastFailure());
    }

    @Test
    void reconnectsAfterConnectionLoss() throws InterruptedException {
        recordTransitions();
        supervisor.start();
        supervisor.awaitOpen(WAIT, CancellationToken.none());
        FakeBroker.FakeConnection first = broker.latest();

        first.drop();
        awaitCondition(() -> supervisor.generation() == 2 && supervisor.isHealthy(), WAIT);

        FakeBroker.FakeConnection second = broker.latest();
        assertNotSame(first, second);
        try (Session session = supervisor.acquireSession()) {
            assertEquals(2, session.generation());
        }
        assertThat(first.channels).isEmpty();
        assertThat(second.channels).hasSize(1);
        assertThat(transitions).containsExactly(
                "CONNECTING->OPEN#1",
                "OPEN->CONNECTING#1",
                "CONNECTING->OPEN#2");
    }

    @Test
    void refusesSessionsWhileReconnecting() throws InterruptedException {
        supervisor.start();
        supervisor.awaitOpen(WAIT, CancellationToken.none());
        broker.setDown(true);

        broker.latest().drop();
        awaitCondition(() -> supervisor.state() == ConnectionState.CONNECTING, WAIT);

        assertThrows(ConnectionNotReadyException.class, supervisor::acquireSession);
        awaitCondition(() -> broker.dials.get() >= 3, WAIT);
        assertNotNull(supervisor.lastFailure());

        broker.setDown(false);
        supervisor.awaitOpen(WAIT, CancellationToken.none());
        assertEquals(2, supervisor.generation());
    }

    @Test
    void repeatedDropsNeverLeaveTwoCurrentConnections() throws InterruptedException {
        supervisor.start();
        supervisor.awaitOpen(WAIT, CancellationToken.none());

        for (int round = 2; round <= 5; round++) {
            broker.latest().drop();
            final int expected = round;
            awaitCondition(() -> supervisor.generation() == expected && supervisor.isHealthy(), WAIT);
        }

        assertEquals(5, broker.connections.size());
        long open = broker.connections.stream().filter(FakeBroker.FakeConnection::isOpen).count();
        assertEquals(1, open);
        assertTrue(broker.latest().isOpen());
    }

    @Test
    void channelOpenFailureSurfacesAsChannelLost() throws IOException {
        supervisor.start();
        supervisor.awaitOpen(WAIT, CancellationToken.none());
        doThrow(new IOException("connection reset")).when(broker.latest().connection).createChannel();

        ChannelLostException e = assertThrows(ChannelLostException.class, supervisor::acquireSession);
        assertInstanceOf(IOException.class, e.getCause());
    }

    @Test
    void refusedChannelSurfacesAsChannelLost() throws IOException {
        supervisor.start();
        supervisor.awaitOpen(WAIT, CancellationToken.none());
        doReturn(null).when(broker.latest().connection).createChannel();

        assertThrows(ChannelLostException.class, supervisor::acquireSession);
    }

    @Test
    void awaitOpenTimesOutWithLastDialError() {
        broker.setDown(true);
        supervisor.start();

        ConnectionNotReadyException e = assertThrows(ConnectionNotReadyException.class,
                () -> supervisor.awaitOpen(Duration.ofMillis(100), CancellationToken.none()));

        assertThat(e.getMessage()).contains("amqp://fake:5672/");
    }

    @Test
    void awaitOpenReturnsPromptlyOnCancellation() throws InterruptedException {
        broker.setDown(true);
        supervisor.start();
        CancellationToken token = CancellationToken.create();
        Thread canceller = new Thread(() -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            token.cancel("caller stop");
        });
        long start = System.nanoTime();
        canceller.start();

        assertThrows(OperationCancelledException.class, () -> supervisor.awaitOpen(Duration.ofSeconds(30), token));

        assertTrue(System.nanoTime() - start < TimeUnit.SECONDS.toNanos(5));
        canceller.join();
    }

    @Test
    void shutdownIsTerminalAndIdempotent() throws IOException {
        recordTransitions();
        supervisor.start();
        supervisor.awaitOpen(WAIT, CancellationToken.none());
        FakeBroker.FakeConnection connection = broker.latest();

        supervisor.shutdown();
        supervisor.shutdown();
        supervisor.close();

        assertEquals(ConnectionState.CLOSED, supervisor.state());
        assertTrue(supervisor.shutdownToken().isCancelled());
        verify(connection.connection, times(1)).close(anyInt());
        assertThrows(ClientClosedException.class, supervisor::acquireSession);
        assertThrows(ClientClosedException.class, () -> supervisor.awaitOpen(WAIT, CancellationToken.none()));
        assertThat(transitions).containsExactly("CONNECTING->OPEN#1", "OPEN->CLOSED#1");
    }

    @Test
    void awaitOpenReleasesOnlyAfterListenersWereTold() {
        supervisor.addListener((previous, current, generation, cause) -> {
            if (current == ConnectionState.OPEN) pause(100);
            transitions.add(previous + "->" + current + "#" + generation);
        });
        supervisor.start();

        supervisor.awaitOpen(WAIT, CancellationToken.none());

        assertThat(transitions).containsExactly("CONNECTING->OPEN#1");
    }

    @Test
    void shutdownDuringOpenNotificationIsDeliveredAfterIt() throws InterruptedException {
        CountDownLatch openNotifying = new CountDownLatch(1);
        supervisor.addListener((previous, current, generation, cause) -> {
            if (current == ConnectionState.OPEN) {
                openNotifying.countDown();
                pause(100);
            }
            transitions.add(previous + "->" + current + "#" + generation);
        });
        supervisor.start();
        assertTrue(openNotifying.await(5, TimeUnit.SECONDS));

        supervisor.shutdown();

        assertThat(transitions).containsExactly("CONNECTING->OPEN#1", "OPEN->CLOSED#1");
    }

    private static void pause(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Test
    void shutdownStopsAnOngoingDialLoop() throws InterruptedException {
        broker.setDown(true);
        supervisor.start();
        awaitCondition(() -> broker.dials.get() >= 2, WAIT);

        supervisor.shutdown();
        Thread.sleep(60);
        int dialsAfterShutdown = broker.dials.get();
        Thread.sleep(100);

        assertEquals(dialsAfterShutdown, broker.dials.get());
        assertEquals(ConnectionState.CLOSED, supervisor.state());
    }

    @Test
    void startAfterShutdownDoesNothing() throws InterruptedException {
        supervisor.shutdown();
        supervisor.start();
        Thread.sleep(50);

        assertEquals(0, broker.dials.get());
        assertEquals(ConnectionState.CLOSED, supervisor.state());
    }

    @Test
    void droppedSessionChannelDoesNotAffectTheConnection() throws Exception {
        supervisor.start();
        supervisor.awaitOpen(WAIT, CancellationToken.none());
        Session session = supervisor.acquireSession();
        Channel channel = session.getChannel();

        session.close();
        session.close();

        verify(channel, times(1)).close();
        assertTrue(supervisor.isHealthy());
    }
}
