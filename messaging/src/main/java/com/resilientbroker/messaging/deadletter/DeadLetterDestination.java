/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.messaging.deadletter;

import com.resilientbroker.common.exception.InvalidConfigurationException;

/**
 * Where dead-letter envelopes are published.
 *
 * @param exchange    target exchange, {@code ""} for the default exchange
 * @param routingKey  routing key (the DLQ name when using the default exchange)
 * @param contentType content type stamped on envelopes
 */
public record DeadLetterDestination(String exchange, String routingKey, String contentType) {

    public static final String DEFAULT_CONTENT_TYPE = "application/json";

    public DeadLetterDestination {
        if (exchange == null) exchange = "";
        if (routingKey == null || (exchange.isEmpty() && routingKey.isEmpty())) {
            throw new InvalidConfigurationException("Dead-letter destination needs a routing key");
        }
        if (contentType == null || contentType.isBlank()) contentType = DEFAULT_CONTENT_TYPE;
    }

    /** A queue addressed through the default exchange. */
    public static DeadLetterDestination queue(String queueName) {
        return new DeadLetterDestination("", queueName, DEFAULT_CONTENT_TYPE);
    }

    public static DeadLetterDestination of(String exchange, String routingKey) {
        return new DeadLetterDestination(exchange, routingKey, DEFAULT_CONTENT_TYPE);
    }

    @Override
    public String toString() {
        return (exchange.isEmpty() ? "(default)" : exchange) + "/" + routingKey;
    }
}
