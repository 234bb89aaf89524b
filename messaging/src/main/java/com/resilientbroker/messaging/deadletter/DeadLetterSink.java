/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.messaging.deadletter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.io.JsonStringEncoder;
import com.resilientbroker.common.concurrent.CancellationToken;
import com.resilientbroker.common.exception.ClientClosedException;
import com.resilientbroker.common.exception.DeadLetterException;
import com.resilientbroker.common.exception.OperationCancelledException;
import com.resilientbroker.common.util.JsonUtil;
import com.resilientbroker.messaging.consume.Delivery;
import com.resilientbroker.messaging.publish.PublishRequest;
import com.resilientbroker.messaging.publish.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;

/**
 * Publishes {@link DeadLetterEnvelope}s for messages whose processing failed terminally.
 *
 * <p>The envelope is JSON. If it cannot be encoded a plain fallback document is sent instead
 * so the message is never silently lost. Send failures propagate to the caller, which decides
 * whether to acknowledge the original delivery. Thread-safe.</p>
 */
public class DeadLetterSink {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterSink.class);

    static final String HEADER_ORIGINAL_QUEUE = "x-original-queue";
    static final String HEADER_ATTEMPTS = "x-attempt-count";

    private final Publisher publisher;
    private final DeadLetterDestination destination;
    private final EnvelopeEncoder encoder;
    private final Clock clock;

    public DeadLetterSink(Publisher publisher, DeadLetterDestination destination) {
        this(publisher, destination, JsonUtil::toJsonBytes, Clock.systemUTC());
    }

    DeadLetterSink(Publisher publisher, DeadLetterDestination destination, EnvelopeEncoder encoder, Clock clock) {
        this.publisher = publisher;
        this.destination = destination;
        this.encoder = encoder;
        this.clock = clock;
    }

    public DeadLetterDestination getDestination() { return destination; }

    /**
     * Dead-letter {@code delivery}.
     *
     * @param error        the last handler failure
     * @param attemptCount how many times the handler ran
     * @throws DeadLetterException          if the envelope could not be published
     * @throws OperationCancelledException  if {@code token} was cancelled first
     */
    public void publishFailure(Delivery delivery, Throwable error, int attemptCount, CancellationToken token) {
        DeadLetterEnvelope envelope = DeadLetterEnvelope.of(delivery, error, attemptCount, Instant.now(clock));
        PublishRequest request = PublishRequest.builder()
                .exchange(destination.exchange())
                .routingKey(destination.routingKey())
                .contentType(destination.contentType())
                .messageId(delivery.getMessageId())
                .header(HEADER_ORIGINAL_QUEUE, delivery.getQueue())
                .header(HEADER_ATTEMPTS, attemptCount)
                .body(encode(envelope, delivery, error))
                .build();
        try {
            publisher.publish(request, token);
        } catch (OperationCancelledException | ClientClosedException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DeadLetterException("Failed to dead-letter " + delivery + " to " + destination, e);
        }
        log.debug("Dead-lettered {} to {} after {} attempt(s)", delivery, destination, attemptCount);
    }

    byte[] encode(DeadLetterEnvelope envelope, Delivery delivery, Throwable error) {
        try {
            return encoder.encode(envelope);
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("Failed to encode dead-letter envelope for {}, sending fallback payload", delivery, e);
            return fallbackPayload(delivery.getBody(), DeadLetterEnvelope.describe(error));
        }
    }

    static byte[] fallbackPayload(byte[] rawBody, String errorText) {
        JsonStringEncoder quoter = JsonStringEncoder.getInstance();
        String raw = new String(quoter.quoteAsString(new String(rawBody, StandardCharsets.UTF_8)));
        String err = new String(quoter.quoteAsString(errorText));
        return ("{\"status\":\"marshal_error\",\"raw_data\":\"" + raw + "\",\"error\":\"" + err + "\"}")
                .getBytes(StandardCharsets.UTF_8);
    }

    @FunctionalInterface
    interface EnvelopeEncoder {
        byte[] encode(DeadLetterEnvelope envelope) throws JsonProcessingException;
    }
}
