/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.messaging.deadletter;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.resilientbroker.messaging.consume.Delivery;

import java.time.Instant;
import java.util.Base64;

/**
 * JSON record of a message that could not be processed. The original body travels
 * Base64-encoded in {@code data_base64} so binary payloads survive.
 */
public record DeadLetterEnvelope(
        @JsonProperty("original_topic") String originalTopic,
        @JsonProperty("original_exchange") String originalExchange,
        @JsonProperty("original_routing_key") String originalRoutingKey,
        @JsonProperty("error") String error,
        @JsonProperty("attempt_count") int attemptCount,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("data_base64") String dataBase64) {

    public static DeadLetterEnvelope of(Delivery delivery, Throwable error, int attemptCount, Instant timestamp) {
        return new DeadLetterEnvelope(
                delivery.getQueue(),
                delivery.getExchange(),
                delivery.getRoutingKey(),
                describe(error),
                attemptCount,
                timestamp,
                Base64.getEncoder().encodeToString(delivery.getBody()));
    }

    static String describe(Throwable error) {
        if (error == null) return "unknown error";
        return error.getMessage() != null ? error.getMessage() : error.getClass().getName();
    }

    /** The original message body. */
    @JsonIgnore
    public byte[] decodeBody() {
        return Base64.getDecoder().decode(dataBase64);
    }
}
