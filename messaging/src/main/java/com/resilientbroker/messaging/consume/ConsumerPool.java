/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.messaging.consume;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import com.resilientbroker.common.concurrent.CancellationToken;
import com.resilientbroker.common.exception.ChannelLostException;
import com.resilientbroker.common.exception.ClientClosedException;
import com.resilientbroker.common.exception.ConnectionNotReadyException;
import com.resilientbroker.common.exception.InvalidConfigurationException;
import com.resilientbroker.common.exception.OperationCancelledException;
import com.resilientbroker.common.exception.OperationFailedException;
import com.resilientbroker.common.exception.RetryExhaustedException;
import com.resilientbroker.messaging.core.ConnectionSupervisor;
import com.resilientbroker.messaging.core.Session;
import com.resilientbroker.messaging.deadletter.DeadLetterSink;
import com.resilientbroker.messaging.retry.BackoffSchedule;
import com.resilientbroker.messaging.retry.RetryExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Consumes one queue with a fixed pool of worker threads and at-least-once processing.
 *
 * <h3>Lifecycle</h3>
 * {@link #start(MessageHandler, CancellationToken)} waits for the connection, then runs consume
 * cycles until the caller's token is cancelled or the client shuts down. A cycle owns one
 * session: broker callbacks push deliveries into a bounded buffer and the workers drain it.
 * When the channel dies the cycle ends, buffered deliveries are dropped unacknowledged (the
 * broker redelivers them) and a new cycle starts after a backoff, once the connection is
 * healthy again.
 *
 * <h3>Per-message policy</h3>
 * <ol>
 *   <li>The handler runs under the consume retry policy.</li>
 *   <li>Success acks the delivery.</li>
 *   <li>Terminal failure with a dead-letter sink publishes an envelope, then acks. If the
 *       envelope cannot be published the delivery is left unacknowledged.</li>
 *   <li>Terminal failure without a sink acks or rejects (no requeue) per
 *       {@link ExhaustionAction}.</li>
 *   <li>Cancellation while handling leaves the delivery unsettled.</li>
 * </ol>
 */
public class ConsumerPool {

    private static final Logger log = LoggerFactory.getLogger(ConsumerPool.class);

    private static final long WORKER_POLL_MILLIS = 200;
    private static final long BUFFER_OFFER_MILLIS = 100;

    private final ConnectionSupervisor supervisor;
    private final RetryExecutor retryExecutor;
    private final ConsumerConfig config;
    private final DeadLetterSink deadLetterSink;

    private final AtomicBoolean running = new AtomicBoolean();
    private final AtomicLong receivedCount = new AtomicLong();
    private final AtomicLong ackedCount = new AtomicLong();
    private final AtomicLong deadLetteredCount = new AtomicLong();
    private final AtomicLong rejectedCount = new AtomicLong();
    private final AtomicLong leftUnackedCount = new AtomicLong();
    private final AtomicLong restartCount = new AtomicLong();

    /**
     * @param deadLetterSink may be {@code null}; failed messages then follow the configured
     *                       {@link ExhaustionAction}
     * @throws InvalidConfigurationException if a sink is combined with multiple-settlement acks,
     *                                       which could settle a delivery whose envelope was never published
     */
    public ConsumerPool(ConnectionSupervisor supervisor, RetryExecutor retryExecutor, ConsumerConfig config,
                        DeadLetterSink deadLetterSink) {
        if (deadLetterSink != null && (config.isAckMultiple() || config.isNackMultiple())) {
            throw new InvalidConfigurationException("Consumer pool for queue '" + config.getQueue()
                    + "' cannot use ackMultiple/nackMultiple with a dead-letter sink");
        }
        this.supervisor = supervisor;
        this.retryExecutor = retryExecutor;
        this.config = config;
        this.deadLetterSink = deadLetterSink;
    }

    public ConsumerConfig getConfig() { return config; }

    public boolean isRunning() { return running.get(); }

    /**
     * Consume until cancelled. Never returns normally.
     *
     * @throws OperationCancelledException  once {@code token} is cancelled
     * @throws ClientClosedException        once the client shuts down
     * @throws ConnectionNotReadyException  if no connection is available within the startup timeout
     */
    public void start(MessageHandler handler, CancellationToken token) {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Consumer pool for queue '" + config.getQueue() + "' is already running");
        }
        log.info("Starting consumer pool: {}", config);
        try (CancellationToken runToken = CancellationToken.anyOf(token, supervisor.shutdownToken())) {
            supervisor.awaitOpen(config.getStartupTimeout(), token);
            BackoffSchedule restartBackoff = new BackoffSchedule(config.getRestartPolicy());
            while (true) {
                Exception failure = null;
                try {
                    consumeCycle(handler, runToken, restartBackoff::reset);
                } catch (ClientClosedException e) {
                    throw e;
                } catch (IOException | RuntimeException e) {
                    failure = e;
                }
                checkStopped(token);

                restartCount.incrementAndGet();
                Duration delay = restartBackoff.nextDelay();
                log.warn("Consume cycle on queue '{}' ended: {}; restarting in {}ms", config.getQueue(),
                        failure != null ? failure.toString() : "channel closed", delay.toMillis());
                if (runToken.await(delay)) {
                    checkStopped(token);
                }
                awaitHealthy(token);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("consumer pool for '" + config.getQueue() + "' interrupted");
        } finally {
            running.set(false);
            log.info("Consumer pool for queue '{}' stopped: {}", config.getQueue(), getStats());
        }
    }

    /** Run {@link #start(MessageHandler, CancellationToken)} on a dedicated daemon thread. */
    public CompletableFuture<Void> startAsync(MessageHandler handler, CancellationToken token) {
        return CompletableFuture.runAsync(() -> start(handler, token), task -> {
            Thread t = new Thread(task, "consumer-pool-" + config.getQueue());
            t.setDaemon(true);
            t.start();
        });
    }

    private void checkStopped(CancellationToken token) {
        if (token.isCancelled()) throw new OperationCancelledException(token.reason());
        if (supervisor.isClosed()) throw new ClientClosedException();
    }

    /** Readiness gate between cycles so restarts never spin against a broker that is down. */
    private void awaitHealthy(CancellationToken token) {
        Duration step = config.getRestartPolicy().getMaxDelay();
        while (!supervisor.isHealthy()) {
            try {
                supervisor.awaitOpen(step, token);
            } catch (ConnectionNotReadyException e) {
                log.debug("Queue '{}' still waiting for the broker connection", config.getQueue());
            }
        }
    }

    // ─── Consume Cycle ────────────────────────────────────────────────────────

    private void consumeCycle(MessageHandler handler, CancellationToken runToken, Runnable onSubscribed)
            throws IOException, InterruptedException {
        try (Session session = supervisor.acquireSession();
             CancellationToken cycleToken = runToken.child()) {
            if (config.getPrefetchCount() > 0) {
                session.qos(config.getPrefetchCount());
            }
            BlockingQueue<Delivery> buffer = new ArrayBlockingQueue<>(config.getBufferCapacity());
            CompletableFuture<ChannelLostException> cycleEnd = new CompletableFuture<>();
            CycleConsumer consumer = new CycleConsumer(session, buffer, cycleEnd, cycleToken);
            String tag = session.consume(config.getQueue(), config.getConsumerTag(), config.isAutoAck(),
                    config.getArguments(), consumer);
            onSubscribed.run();
            log.info("Consuming queue '{}' as '{}' on connection generation {} with {} worker(s)",
                    config.getQueue(), tag, session.generation(), config.getWorkers());

            ExecutorService workers = newWorkerPool();
            for (int i = 0; i < config.getWorkers(); i++) {
                workers.execute(() -> workerLoop(buffer, cycleToken, handler, runToken));
            }

            try {
                CompletableFuture.anyOf(cycleEnd, runToken.whenCancelled()).get();
            } catch (ExecutionException e) {
                throw new IllegalStateException("Cycle signal completed exceptionally", e);
            } finally {
                cycleToken.cancel("consume cycle ending");
                cancelConsumer(session, tag);
                joinWorkers(workers);
                int dropped = buffer.size();
                buffer.clear();
                if (dropped > 0) {
                    leftUnackedCount.addAndGet(dropped);
                    log.info("Dropped {} buffered deliveries from '{}'; the broker will redeliver them",
                            dropped, config.getQueue());
                }
            }

            ChannelLostException lost = cycleEnd.getNow(null);
            if (lost != null) throw lost;
        }
    }

    private ExecutorService newWorkerPool() {
        AtomicInteger index = new AtomicInteger();
        return Executors.newFixedThreadPool(config.getWorkers(), r -> {
            Thread t = new Thread(r, "consumer-" + config.getQueue() + "-" + index.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    private void cancelConsumer(Session session, String tag) {
        if (!session.isOpen()) return;
        try {
            session.cancelConsumer(tag);
        } catch (IOException | ShutdownSignalException e) {
            log.debug("Could not cancel consumer '{}': {}", tag, e.toString());
        }
    }

    private void joinWorkers(ExecutorService workers) throws InterruptedException {
        workers.shutdown();
        while (!workers.awaitTermination(1, TimeUnit.SECONDS)) {
            log.info("Waiting for in-flight handlers on queue '{}' to finish", config.getQueue());
        }
    }

    private void workerLoop(BlockingQueue<Delivery> buffer, CancellationToken cycleToken, MessageHandler handler,
                            CancellationToken runToken) {
        while (!cycleToken.isCancelled()) {
            Delivery delivery;
            try {
                delivery = buffer.poll(WORKER_POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (delivery != null) {
                process(delivery, handler, runToken);
            }
        }
    }

    // ─── Per-message Policy ───────────────────────────────────────────────────

    void process(Delivery delivery, MessageHandler handler, CancellationToken token) {
        MDC.put("queue", delivery.getQueue());
        MDC.put("consumerTag", delivery.getConsumerTag());
        MDC.put("deliveryTag", Long.toString(delivery.getDeliveryTag()));
        if (delivery.getMessageId() != null) MDC.put("messageId", delivery.getMessageId());
        try {
            if (config.isAutoAck()) {
                processAutoAck(delivery, handler, token);
                return;
            }
            AtomicInteger attempts = new AtomicInteger();
            Throwable failure;
            try {
                retryExecutor.run("handler for " + config.getQueue(), () -> {
                    attempts.incrementAndGet();
                    handler.handle(delivery, token);
                }, config.getRetryPolicy(), token, HandlerErrorClassifier.INSTANCE);
                ack(delivery);
                return;
            } catch (OperationCancelledException | ClientClosedException e) {
                leftUnackedCount.incrementAndGet();
                log.debug("Processing of {} stopped, leaving it unsettled: {}", delivery, e.getMessage());
                return;
            } catch (RetryExhaustedException | OperationFailedException e) {
                failure = e.getCause() != null ? e.getCause() : e;
            } catch (RuntimeException e) {
                failure = e;
            }
            onTerminalFailure(delivery, failure, attempts.get(), token);
        } finally {
            MDC.remove("queue");
            MDC.remove("consumerTag");
            MDC.remove("deliveryTag");
            MDC.remove("messageId");
        }
    }

    private void processAutoAck(Delivery delivery, MessageHandler handler, CancellationToken token) {
        delivery.markAutoAcked();
        try {
            retryExecutor.run("handler for " + config.getQueue(), () -> handler.handle(delivery, token),
                    config.getRetryPolicy(), token, HandlerErrorClassifier.INSTANCE);
        } catch (OperationCancelledException e) {
            log.debug("Auto-acked {} abandoned: {}", delivery, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Handler failed for auto-acked {}, message is lost: {}", delivery, e.toString());
        }
    }

    private void onTerminalFailure(Delivery delivery, Throwable failure, int attempts, CancellationToken token) {
        if (deadLetterSink != null) {
            try {
                deadLetterSink.publishFailure(delivery, failure, attempts, token);
            } catch (OperationCancelledException e) {
                leftUnackedCount.incrementAndGet();
                log.debug("Dead-lettering of {} cancelled, leaving it unsettled", delivery);
                return;
            } catch (RuntimeException e) {
                leftUnackedCount.incrementAndGet();
                log.error("Dead-lettering failed for {} after {} attempt(s); leaving it unacknowledged for redelivery",
                        delivery, attempts, e);
                return;
            }
            deadLetteredCount.incrementAndGet();
            ack(delivery);
            return;
        }

        if (config.getExhaustionAction() == ExhaustionAction.ACK) {
            log.warn("Dropping {} after {} attempt(s): {}", delivery, attempts, failure.toString());
            ack(delivery);
        } else {
            log.warn("Rejecting {} after {} attempt(s): {}", delivery, attempts, failure.toString());
            reject(delivery);
        }
    }

    private void ack(Delivery delivery) {
        try {
            delivery.ack(config.isAckMultiple());
            ackedCount.incrementAndGet();
        } catch (IOException | ShutdownSignalException e) {
            log.error("Ack failed for {}", delivery, e);
        }
    }

    private void reject(Delivery delivery) {
        try {
            delivery.nack(config.isNackMultiple(), false);
            rejectedCount.incrementAndGet();
        } catch (IOException | ShutdownSignalException e) {
            log.error("Nack failed for {}", delivery, e);
        }
    }

    // ─── Stats ────────────────────────────────────────────────────────────────

    public ConsumerStats getStats() {
        return new ConsumerStats(receivedCount.get(), ackedCount.get(), deadLetteredCount.get(),
                rejectedCount.get(), leftUnackedCount.get(), restartCount.get(), running.get());
    }

    /** Counters since construction; {@code acked} includes acks sent after dead-lettering. */
    public record ConsumerStats(long received, long acked, long deadLettered, long rejected,
                                long leftUnacked, long restarts, boolean running) {}

    // ─── Broker Callbacks ─────────────────────────────────────────────────────

    private final class CycleConsumer extends DefaultConsumer {

        private final Session session;
        private final BlockingQueue<Delivery> buffer;
        private final CompletableFuture<ChannelLostException> cycleEnd;
        private final CancellationToken cycleToken;
        private final Delivery.Settler settler;

        CycleConsumer(Session session, BlockingQueue<Delivery> buffer,
                      CompletableFuture<ChannelLostException> cycleEnd, CancellationToken cycleToken) {
            super(session.getChannel());
            this.session = session;
            this.buffer = buffer;
            this.cycleEnd = cycleEnd;
            this.cycleToken = cycleToken;
            this.settler = new Delivery.Settler() {
                @Override
                public void ack(long deliveryTag, boolean multiple) throws IOException {
                    session.ack(deliveryTag, multiple);
                }

                @Override
                public void nack(long deliveryTag, boolean multiple, boolean requeue) throws IOException {
                    session.nack(deliveryTag, multiple, requeue);
                }
            };
        }

        @Override
        public void handleDelivery(String consumerTag, Envelope envelope, AMQP.BasicProperties properties,
                                   byte[] body) {
            receivedCount.incrementAndGet();
            Delivery delivery = Delivery.fromAmqp(config.getQueue(), consumerTag, envelope, properties, body, settler);
            try {
                // blocks the connection's dispatch thread while the buffer is full
                while (!buffer.offer(delivery, BUFFER_OFFER_MILLIS, TimeUnit.MILLISECONDS)) {
                    if (cycleToken.isCancelled()) {
                        leftUnackedCount.incrementAndGet();
                        return;
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                leftUnackedCount.incrementAndGet();
            }
        }

        @Override
        public void handleShutdownSignal(String consumerTag, ShutdownSignalException sig) {
            if (cycleEnd.complete(new ChannelLostException(
                    "Channel for consumer '" + consumerTag + "' closed on generation " + session.generation(), sig))) {
                log.debug("Consumer '{}' saw channel shutdown: {}", consumerTag, sig.getMessage());
            }
        }

        @Override
        public void handleCancel(String consumerTag) {
            log.warn("Broker cancelled consumer '{}' on queue '{}'", consumerTag, config.getQueue());
            cycleEnd.complete(new ChannelLostException("Consumer '" + consumerTag + "' cancelled by the broker"));
        }
    }
}
