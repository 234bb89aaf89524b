/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.messaging.core;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Consumer;
import com.rabbitmq.client.ShutdownListener;
import com.rabbitmq.client.ShutdownSignalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A leased AMQP channel tied to one connection generation.
 *
 * <p>Used by exactly one leaser at a time and closed by it, normally through
 * try-with-resources. All calls are synchronous and fail with {@link IOException} or a
 * {@link ShutdownSignalException} once the channel or its connection is gone.</p>
 */
public class Session implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Session.class);

    private final LogicalConnection owner;
    private final Channel channel;
    private final AtomicBoolean closed = new AtomicBoolean();
    private boolean confirmsEnabled;

    Session(LogicalConnection owner, Channel channel) {
        this.owner = owner;
        this.channel = channel;
    }

    public long generation() { return owner.generation(); }

    public boolean isOpen() {
        return !closed.get() && channel.isOpen();
    }

    /** The underlying channel, for consumer callbacks that need it. */
    public Channel getChannel() { return channel; }

    public void addShutdownListener(ShutdownListener listener) {
        channel.addShutdownListener(listener);
    }

    // ─── Publishing ───────────────────────────────────────────────────────────

    public void publish(String exchange, String routingKey, AMQP.BasicProperties properties, byte[] body)
            throws IOException {
        channel.basicPublish(exchange, routingKey, false, properties, body);
    }

    /** Switch the channel to publisher-confirm mode; a no-op after the first call. */
    public void enableConfirms() throws IOException {
        if (confirmsEnabled) return;
        channel.confirmSelect();
        confirmsEnabled = true;
    }

    /** Wait for every outstanding publish to be confirmed; a nack closes the channel and throws. */
    public void awaitConfirms(Duration timeout) throws IOException, InterruptedException, TimeoutException {
        channel.waitForConfirmsOrDie(timeout.toMillis());
    }

    // ─── Consuming ────────────────────────────────────────────────────────────

    public void qos(int prefetchCount) throws IOException {
        channel.basicQos(prefetchCount);
    }

    public String consume(String queue, String consumerTag, boolean autoAck, Map<String, Object> args,
                          Consumer consumer) throws IOException {
        return channel.basicConsume(queue, autoAck, consumerTag, false, false, args, consumer);
    }

    public void cancelConsumer(String consumerTag) throws IOException {
        channel.basicCancel(consumerTag);
    }

    public void ack(long deliveryTag, boolean multiple) throws IOException {
        channel.basicAck(deliveryTag, multiple);
    }

    public void nack(long deliveryTag, boolean multiple, boolean requeue) throws IOException {
        channel.basicNack(deliveryTag, multiple, requeue);
    }

    // ─── Topology ─────────────────────────────────────────────────────────────

    public void declareExchange(String name, BuiltinExchangeType type, boolean durable, boolean autoDelete,
                                boolean internal, Map<String, Object> args) throws IOException {
        channel.exchangeDeclare(name, type, durable, autoDelete, internal, args);
    }

    public String declareQueue(String name, boolean durable, boolean exclusive, boolean autoDelete,
                               Map<String, Object> args) throws IOException {
        return channel.queueDeclare(name, durable, exclusive, autoDelete, args).getQueue();
    }

    public void bindQueue(String queue, String exchange, String routingKey, Map<String, Object> args)
            throws IOException {
        channel.queueBind(queue, exchange, routingKey, args);
    }

    // ─── Lifecycle ────────────────────────────────────────────────────────────

    /** Force-close the channel to unblock a thread stuck in a call on it. */
    public void abort() {
        closed.set(true);
        try {
            channel.abort();
        } catch (IOException | ShutdownSignalException e) {
            log.debug("Error aborting channel {} on generation {}: {}", channel.getChannelNumber(), generation(), e.toString());
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        try {
            if (channel.isOpen()) channel.close();
        } catch (IOException | TimeoutException | ShutdownSignalException e) {
            log.debug("Error closing channel {} on generation {}: {}", channel.getChannelNumber(), generation(), e.toString());
        }
    }
}
