/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.messaging.consume;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Envelope;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A message received from the broker.
 *
 * <p>The broker owns it until it is settled. Only the {@link ConsumerPool} settles a delivery
 * (ack or nack), exactly once; a second settlement fails with {@link IllegalStateException}.</p>
 */
public final class Delivery {

    /** Header carrying the broker's redelivery count on quorum queues. */
    public static final String DELIVERY_COUNT_HEADER = "x-delivery-count";

    private final byte[] body;
    private final String queue;
    private final String consumerTag;
    private final String exchange;
    private final String routingKey;
    private final String messageId;
    private final String contentType;
    private final Map<String, Object> headers;
    private final long deliveryTag;
    private final boolean redelivered;
    private final int redeliveryCount;
    private final Settler settler;
    private final AtomicBoolean settled = new AtomicBoolean();

    private Delivery(Builder b) {
        this.body = b.body != null ? b.body : new byte[0];
        this.queue = b.queue;
        this.consumerTag = b.consumerTag;
        this.exchange = b.exchange;
        this.routingKey = b.routingKey;
        this.messageId = b.messageId;
        this.contentType = b.contentType;
        this.headers = b.headers != null ? Collections.unmodifiableMap(new HashMap<>(b.headers)) : Map.of();
        this.deliveryTag = b.deliveryTag;
        this.redelivered = b.redelivered;
        this.redeliveryCount = redeliveryCount(this.headers, b.redelivered);
        this.settler = b.settler;
    }

    static Delivery fromAmqp(String queue, String consumerTag, Envelope envelope, AMQP.BasicProperties properties,
                             byte[] body, Settler settler) {
        Builder builder = builder()
                .queue(queue)
                .consumerTag(consumerTag)
                .exchange(envelope.getExchange())
                .routingKey(envelope.getRoutingKey())
                .deliveryTag(envelope.getDeliveryTag())
                .redelivered(envelope.isRedeliver())
                .body(body)
                .settler(settler);
        if (properties != null) {
            builder.messageId(properties.getMessageId())
                    .contentType(properties.getContentType())
                    .headers(properties.getHeaders());
        }
        return builder.build();
    }

    private static int redeliveryCount(Map<String, Object> headers, boolean redelivered) {
        Object count = headers.get(DELIVERY_COUNT_HEADER);
        if (count instanceof Number) {
            return ((Number) count).intValue();
        }
        return redelivered ? 1 : 0;
    }

    public static Builder builder() {
        return new Builder();
    }

    public byte[] getBody() { return body; }
    public String getBodyAsString() { return new String(body, StandardCharsets.UTF_8); }
    public String getQueue() { return queue; }
    public String getConsumerTag() { return consumerTag; }
    public String getExchange() { return exchange; }
    public String getRoutingKey() { return routingKey; }
    public String getMessageId() { return messageId; }
    public String getContentType() { return contentType; }
    public Map<String, Object> getHeaders() { return headers; }
    public long getDeliveryTag() { return deliveryTag; }
    public boolean isRedelivered() { return redelivered; }
    public int getRedeliveryCount() { return redeliveryCount; }
    public boolean isSettled() { return settled.get(); }

    void ack(boolean multiple) throws IOException {
        markSettled();
        settler.ack(deliveryTag, multiple);
    }

    void nack(boolean multiple, boolean requeue) throws IOException {
        markSettled();
        settler.nack(deliveryTag, multiple, requeue);
    }

    /** Record that the broker settled the delivery itself (auto-ack mode). */
    void markAutoAcked() {
        markSettled();
    }

    private void markSettled() {
        if (!settled.compareAndSet(false, true)) {
            throw new IllegalStateException("Delivery " + deliveryTag + " on " + queue + " is already settled");
        }
    }

    @Override
    public String toString() {
        return "Delivery{queue='" + queue + "', tag=" + deliveryTag + ", routingKey='" + routingKey
                + "', messageId=" + messageId + ", redeliveries=" + redeliveryCount + "}";
    }

    /** Channel-side settlement of a delivery tag. */
    interface Settler {
        void ack(long deliveryTag, boolean multiple) throws IOException;

        void nack(long deliveryTag, boolean multiple, boolean requeue) throws IOException;

        Settler DETACHED = new Settler() {
            @Override
            public void ack(long deliveryTag, boolean multiple) throws IOException {
                throw new IOException("Delivery is not attached to a channel");
            }

            @Override
            public void nack(long deliveryTag, boolean multiple, boolean requeue) throws IOException {
                throw new IOException("Delivery is not attached to a channel");
            }
        };
    }

    public static final class Builder {
        private byte[] body;
        private String queue;
        private String consumerTag;
        private String exchange = "";
        private String routingKey = "";
        private String messageId;
        private String contentType;
        private Map<String, Object> headers;
        private long deliveryTag;
        private boolean redelivered;
        private Settler settler = Settler.DETACHED;

        private Builder() {}

        public Builder body(byte[] body) { this.body = body; return this; }
        public Builder body(String text) { this.body = text.getBytes(StandardCharsets.UTF_8); return this; }
        public Builder queue(String queue) { this.queue = queue; return this; }
        public Builder consumerTag(String consumerTag) { this.consumerTag = consumerTag; return this; }
        public Builder exchange(String exchange) { this.exchange = exchange; return this; }
        public Builder routingKey(String routingKey) { this.routingKey = routingKey; return this; }
        public Builder messageId(String messageId) { this.messageId = messageId; return this; }
        public Builder contentType(String contentType) { this.contentType = contentType; return this; }
        public Builder headers(Map<String, Object> headers) { this.headers = headers; return this; }
        public Builder deliveryTag(long deliveryTag) { this.deliveryTag = deliveryTag; return this; }
        public Builder redelivered(boolean redelivered) { this.redelivered = redelivered; return this; }

        Builder settler(Settler settler) { this.settler = settler; return this; }

        public Delivery build() {
            return new Delivery(this);
        }
    }
}
