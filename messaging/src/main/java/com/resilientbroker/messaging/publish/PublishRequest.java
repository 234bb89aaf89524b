/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.messaging.publish;

import com.resilientbroker.common.exception.InvalidRequestException;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One message to send. Built per call and never reused by the publisher.
 *
 * <p>An empty exchange name addresses the broker's default exchange, which routes by queue
 * name.</p>
 */
public final class PublishRequest {

    /** AMQP short-string limit for exchange names and routing keys. */
    public static final int MAX_NAME_BYTES = 255;

    private final String exchange;
    private final String routingKey;
    private final byte[] body;
    private final Map<String, Object> headers;
    private final Duration expiration;
    private final String contentType;
    private final String messageId;
    private final boolean persistent;

    private PublishRequest(Builder b) {
        this.exchange = b.exchange;
        this.routingKey = b.routingKey;
        this.body = b.body;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(b.headers));
        this.expiration = b.expiration;
        this.contentType = b.contentType;
        this.messageId = b.messageId;
        this.persistent = b.persistent;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Shorthand for a request with only a routing key and a body. */
    public static PublishRequest of(String exchange, String routingKey, byte[] body) {
        return builder().exchange(exchange).routingKey(routingKey).body(body).build();
    }

    /**
     * Reject requests the broker would refuse.
     *
     * @throws InvalidRequestException for a null routing key or body, an over-long name or a
     *                                 negative expiration
     */
    public void validate() {
        if (exchange == null) {
            throw new InvalidRequestException("Exchange must not be null (use \"\" for the default exchange)");
        }
        if (routingKey == null) {
            throw new InvalidRequestException("Routing key must not be null");
        }
        checkLength("Exchange", exchange);
        checkLength("Routing key", routingKey);
        if (body == null) {
            throw new InvalidRequestException("Message body must not be null");
        }
        if (expiration != null && expiration.isNegative()) {
            throw new InvalidRequestException("Expiration must not be negative: " + expiration);
        }
    }

    private static void checkLength(String what, String value) {
        int length = value.getBytes(StandardCharsets.UTF_8).length;
        if (length > MAX_NAME_BYTES) {
            throw new InvalidRequestException(what + " is " + length + " bytes, limit is " + MAX_NAME_BYTES);
        }
    }

    public String getExchange() { return exchange; }
    public String getRoutingKey() { return routingKey; }
    public byte[] getBody() { return body; }
    public Map<String, Object> getHeaders() { return headers; }
    public Duration getExpiration() { return expiration; }
    public String getContentType() { return contentType; }
    public String getMessageId() { return messageId; }
    public boolean isPersistent() { return persistent; }

    @Override
    public String toString() {
        return "PublishRequest{exchange='" + exchange + "', routingKey='" + routingKey + "', bytes="
                + (body != null ? body.length : -1) + ", messageId=" + messageId + "}";
    }

    public static final class Builder {
        private String exchange = "";
        private String routingKey;
        private byte[] body;
        private final Map<String, Object> headers = new LinkedHashMap<>();
        private Duration expiration;
        private String contentType;
        private String messageId;
        private boolean persistent = true;

        private Builder() {}

        public Builder exchange(String exchange) { this.exchange = exchange; return this; }
        public Builder routingKey(String routingKey) { this.routingKey = routingKey; return this; }
        public Builder body(byte[] body) { this.body = body; return this; }
        public Builder header(String name, Object value) { this.headers.put(name, value); return this; }
        public Builder expiration(Duration expiration) { this.expiration = expiration; return this; }
        public Builder contentType(String contentType) { this.contentType = contentType; return this; }
        public Builder messageId(String messageId) { this.messageId = messageId; return this; }
        public Builder persistent(boolean persistent) { this.persistent = persistent; return this; }

        public Builder headers(Map<String, Object> headers) {
            if (headers != null) this.headers.putAll(headers);
            return this;
        }

        public Builder body(String text) {
            this.body = text == null ? null : text.getBytes(StandardCharsets.UTF_8);
            return this;
        }

        /** Validation happens in {@link PublishRequest#validate()} so that bad requests fail on publish. */
        public PublishRequest build() {
            return new PublishRequest(this);
        }
    }
}
