/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.messaging.publish;

import com.rabbitmq.client.AMQP;
import com.resilientbroker.common.concurrent.CancellationToken;
import com.resilientbroker.common.exception.ClientClosedException;
import com.resilientbroker.common.exception.OperationCancelledException;
import com.resilientbroker.messaging.core.ConnectionSupervisor;
import com.resilientbroker.messaging.core.Session;
import com.resilientbroker.messaging.retry.RetryExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.Date;
import java.util.HashMap;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Sends messages through the supervised connection with bounded retry.
 *
 * <p>Every attempt leases its own {@link Session} and releases it on every path, so a
 * connection drop between attempts is recovered transparently once the supervisor has
 * reconnected. Cancelling the token while a send or confirm wait is blocked aborts that
 * session and the call returns with {@link OperationCancelledException}. Client shutdown
 * interrupts the same waits, including the backoff between attempts, and surfaces as
 * {@link ClientClosedException}.</p>
 *
 * <p>Thread-safe; one instance is meant to be shared.</p>
 */
public class Publisher {

    private static final Logger log = LoggerFactory.getLogger(Publisher.class);

    private static final int DELIVERY_MODE_TRANSIENT = 1;
    private static final int DELIVERY_MODE_PERSISTENT = 2;

    private final ConnectionSupervisor supervisor;
    private final RetryExecutor retryExecutor;
    private final PublisherConfig config;

    private final AtomicLong publishedCount = new AtomicLong();
    private final AtomicLong failedCount = new AtomicLong();
    private volatile Instant lastPublishTime;

    public Publisher(ConnectionSupervisor supervisor, RetryExecutor retryExecutor, PublisherConfig config) {
        this.supervisor = supervisor;
        this.retryExecutor = retryExecutor;
        this.config = config;
    }

    public PublisherConfig getConfig() { return config; }

    public void publish(PublishRequest request) {
        publish(request, CancellationToken.none());
    }

    /**
     * Validate and send {@code request}, retrying transient failures under the configured
     * policy.
     *
     * @throws com.resilientbroker.common.exception.InvalidRequestException      without any attempt
     * @throws com.resilientbroker.common.exception.RetryExhaustedException      when every attempt failed
     * @throws com.resilientbroker.common.exception.OperationCancelledException  on cancellation
     * @throws com.resilientbroker.common.exception.ClientClosedException        after client shutdown
     */
    public void publish(PublishRequest request, CancellationToken token) {
        request.validate();
        AMQP.BasicProperties properties = toProperties(request);
        String target = describe(request);
        CancellationToken shutdown = supervisor.shutdownToken();
        try (CancellationToken linked = CancellationToken.anyOf(token, shutdown)) {
            retryExecutor.run("publish to " + target, () -> sendOnce(request, properties, linked),
                    config.retryPolicy(), linked);
        } catch (OperationCancelledException e) {
            failedCount.incrementAndGet();
            if (!token.isCancelled() && shutdown.isCancelled()) {
                throw new ClientClosedException();
            }
            throw e;
        } catch (RuntimeException e) {
            failedCount.incrementAndGet();
            throw e;
        }
        publishedCount.incrementAndGet();
        lastPublishTime = Instant.now();
        log.debug("Published {} bytes to {}", request.getBody().length, target);
    }

    private void sendOnce(PublishRequest request, AMQP.BasicProperties properties, CancellationToken token)
            throws IOException, InterruptedException, TimeoutException {
        try (Session session = supervisor.acquireSession();
             CancellationToken.Registration ignored = token.onCancel(session::abort)) {
            if (config.publisherConfirms()) {
                session.enableConfirms();
            }
            session.publish(request.getExchange(), request.getRoutingKey(), properties, request.getBody());
            if (config.publisherConfirms()) {
                session.awaitConfirms(config.confirmTimeout());
            }
        }
    }

    AMQP.BasicProperties toProperties(PublishRequest request) {
        AMQP.BasicProperties.Builder builder = new AMQP.BasicProperties.Builder()
                .contentType(request.getContentType() != null ? request.getContentType() : config.contentType())
                .deliveryMode(request.isPersistent() ? DELIVERY_MODE_PERSISTENT : DELIVERY_MODE_TRANSIENT)
                .timestamp(new Date());
        if (request.getMessageId() != null) {
            builder.messageId(request.getMessageId());
        }
        if (!request.getHeaders().isEmpty()) {
            builder.headers(new HashMap<>(request.getHeaders()));
        }
        if (request.getExpiration() != null && !request.getExpiration().isZero()) {
            builder.expiration(Long.toString(request.getExpiration().toMillis()));
        }
        return builder.build();
    }

    private static String describe(PublishRequest request) {
        String exchange = request.getExchange().isEmpty() ? "(default)" : request.getExchange();
        return exchange + "/" + request.getRoutingKey();
    }

    public PublisherStats getStats() {
        return new PublisherStats(publishedCount.get(), failedCount.get(), lastPublishTime);
    }

    /** Counters since construction. */
    public record PublisherStats(long published, long failed, Instant lastPublishTime) {}
}
