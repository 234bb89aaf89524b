/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.messaging.core;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ShutdownSignalException;
import com.resilientbroker.common.exception.ChannelLostException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * One physical broker connection as seen by the supervisor.
 *
 * <p>The transport's shutdown notification is turned into a one-shot
 * {@link #closeSignal()} future that the supervisor's watcher awaits.</p>
 */
public final class LogicalConnection {

    private static final Logger log = LoggerFactory.getLogger(LogicalConnection.class);
    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

    private final long generation;
    private final Connection connection;
    private final CompletableFuture<ShutdownSignalException> closeSignal = new CompletableFuture<>();
    private volatile ConnectionState state = ConnectionState.OPEN;

    LogicalConnection(long generation, Connection connection) {
        this.generation = generation;
        this.connection = connection;
        connection.addShutdownListener(cause -> {
            state = ConnectionState.CLOSED;
            closeSignal.complete(cause);
        });
        // the connection may have died before the listener was attached
        if (!connection.isOpen()) {
            state = ConnectionState.CLOSED;
            closeSignal.complete(connection.getCloseReason());
        }
    }

    public long generation() { return generation; }

    public ConnectionState state() { return state; }

    public boolean isOpen() {
        return state == ConnectionState.OPEN && connection.isOpen();
    }

    /** Completes, possibly with {@code null}, once the transport reports the connection closed. */
    public CompletableFuture<ShutdownSignalException> closeSignal() {
        return closeSignal;
    }

    Session openSession() throws IOException {
        Channel channel = connection.createChannel();
        if (channel == null) {
            throw new ChannelLostException("Broker refused a new channel (channel_max reached) on generation " + generation);
        }
        return new Session(this, channel);
    }

    void close() {
        if (state == ConnectionState.CLOSED) return;
        state = ConnectionState.CLOSING;
        try {
            if (connection.isOpen()) {
                connection.close((int) CLOSE_TIMEOUT.toMillis());
            }
        } catch (IOException | ShutdownSignalException e) {
            log.debug("Error closing connection generation {}: {}", generation, e.toString());
        } finally {
            state = ConnectionState.CLOSED;
        }
    }

    @Override
    public String toString() {
        return "LogicalConnection{generation=" + generation + ", state=" + state + "}";
    }
}
