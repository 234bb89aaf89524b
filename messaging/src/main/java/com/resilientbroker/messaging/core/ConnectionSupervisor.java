/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.messaging.core;

import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ShutdownSignalException;
import com.resilientbroker.common.concurrent.CancellationToken;
import com.resilientbroker.common.exception.ChannelLostException;
import com.resilientbroker.common.exception.ClientClosedException;
import com.resilientbroker.common.exception.ConnectionNotReadyException;
import com.resilientbroker.common.exception.OperationCancelledException;
import com.resilientbroker.messaging.retry.BackoffSchedule;
import com.resilientbroker.messaging.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Owns the single logical broker connection and keeps it alive.
 *
 * <h3>States</h3>
 * <ul>
 *   <li>{@code CONNECTING} (initial): the reconnect loop dials with unbounded attempts and
 *       exponential backoff until it succeeds or the supervisor shuts down.</li>
 *   <li>{@code OPEN}: sessions can be leased. A dedicated watcher per connection waits for
 *       the transport's close signal and moves back to {@code CONNECTING}.</li>
 *   <li>{@code CLOSED} (terminal): entered only by {@link #shutdown()}.</li>
 * </ul>
 *
 * <p>The current connection is guarded by a read/write lock: {@link #acquireSession()} holds
 * the read lock, installing a new connection takes the write lock. A superseded connection is
 * closed on a background thread, outside the lock.</p>
 *
 * <p>Transitions are applied and announced to listeners one at a time under a single monitor,
 * so listeners observe them in order. {@link #awaitOpen} only releases once the listeners have
 * been told about the open connection.</p>
 */
public class ConnectionSupervisor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConnectionSupervisor.class);

    private final ConnectionDialer dialer;
    private final RetryPolicy reconnectPolicy;
    private final CancellationToken shutdownToken = CancellationToken.create();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Object stateMonitor = new Object();
    private final Object transitionLock = new Object();
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean reconnecting = new AtomicBoolean();
    private final List<ConnectionStateListener> listeners = new CopyOnWriteArrayList<>();
    private final ExecutorService background;

    // guarded by lock
    private LogicalConnection current;
    private long generation;
    private volatile ConnectionState state = ConnectionState.CONNECTING;
    // last state delivered to listeners
    private volatile ConnectionState announcedState = ConnectionState.CONNECTING;
    private volatile Throwable lastFailure;

    public ConnectionSupervisor(ConnectionDialer dialer, RetryPolicy reconnectPolicy) {
        this.dialer = dialer;
        this.reconnectPolicy = reconnectPolicy;
        AtomicInteger threadIndex = new AtomicInteger();
        this.background = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "broker-supervisor-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /** Begin connecting in the background. Calling it again has no effect. */
    public void start() {
        if (!started.compareAndSet(false, true)) return;
        if (shutdownToken.isCancelled()) return;
        log.info("Connection supervisor starting for {}", dialer.describe());
        startReconnectLoop();
    }

    // ─── Accessors ────────────────────────────────────────────────────────────

    public ConnectionState state() { return state; }

    public boolean isHealthy() { return state == ConnectionState.OPEN; }

    public boolean isClosed() { return state == ConnectionState.CLOSED; }

    /** Generation of the current connection; increases by one with every successful (re)connect. */
    public long generation() {
        lock.readLock().lock();
        try {
            return generation;
        } finally {
            lock.readLock().unlock();
        }
    }

    /** The most recent dial or connection failure, for diagnostics. */
    public Throwable lastFailure() { return lastFailure; }

    /** Cancelled once {@link #shutdown()} is called. */
    public CancellationToken shutdownToken() { return shutdownToken; }

    /**
     * Listeners run on the thread making the transition, one transition at a time and before
     * {@link #awaitOpen} waiters are released. They must not block.
     */
    public void addListener(ConnectionStateListener listener) { listeners.add(listener); }

    public void removeListener(ConnectionStateListener listener) { listeners.remove(listener); }

    // ─── Sessions ─────────────────────────────────────────────────────────────

    /**
     * Lease a session on the current connection.
     *
     * @throws ClientClosedException        after shutdown
     * @throws ConnectionNotReadyException  while (re)connecting
     * @throws ChannelLostException         if the connection died before the channel opened
     */
    public Session acquireSession() {
        lock.readLock().lock();
        try {
            if (state == ConnectionState.CLOSED) {
                throw new ClientClosedException();
            }
            LogicalConnection conn = current;
            if (state != ConnectionState.OPEN || conn == null) {
                throw new ConnectionNotReadyException("Broker connection is not ready (state " + state + ")");
            }
            try {
                return conn.openSession();
            } catch (ShutdownSignalException e) {
                throw new ChannelLostException("Connection generation " + conn.generation() + " is gone", e);
            } catch (IOException e) {
                throw new ChannelLostException("Failed to open channel on generation " + conn.generation(), e);
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Block until the supervisor is {@code OPEN}.
     *
     * @throws ConnectionNotReadyException  if {@code timeout} elapses first
     * @throws ClientClosedException        if the supervisor is shut down
     * @throws OperationCancelledException  if {@code token} is cancelled
     */
    public void awaitOpen(Duration timeout, CancellationToken token) {
        long deadline = System.nanoTime() + timeout.toNanos();
        try (CancellationToken.Registration ignored = token.onCancel(this::wakeWaiters)) {
            synchronized (stateMonitor) {
                while (true) {
                    ConnectionState s = state;
                    if (s == ConnectionState.CLOSED) throw new ClientClosedException();
                    if (s == ConnectionState.OPEN && announcedState == ConnectionState.OPEN) return;
                    token.throwIfCancelled();
                    long remaining = deadline - System.nanoTime();
                    if (remaining <= 0) {
                        throw new ConnectionNotReadyException(
                                "Broker connection to " + dialer.describe() + " not established within " + timeout,
                                lastFailure);
                    }
                    TimeUnit.NANOSECONDS.timedWait(stateMonitor, remaining);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("interrupted while waiting for broker connection");
        }
    }

    // ─── Reconnect Loop ───────────────────────────────────────────────────────

    private void startReconnectLoop() {
        if (!reconnecting.compareAndSet(false, true)) return;
        try {
            background.execute(this::reconnectLoop);
        } catch (RejectedExecutionException e) {
            reconnecting.set(false);
            log.debug("Reconnect loop not started, supervisor is shutting down");
        }
    }

    private void reconnectLoop() {
        BackoffSchedule backoff = new BackoffSchedule(reconnectPolicy);
        boolean installed = false;
        try {
            for (int attempt = 1; !shutdownToken.isCancelled(); attempt++) {
                Connection raw;
                try {
                    raw = dialer.dial();
                } catch (Exception e) {
                    lastFailure = e;
                    Duration delay = backoff.nextDelay();
                    log.warn("Dial attempt {} to {} failed: {}; next attempt in {}ms",
                            attempt, dialer.describe(), e.toString(), delay.toMillis());
                    if (shutdownToken.await(delay)) return;
                    continue;
                }
                installed = install(raw);
                return;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            if (!installed) reconnecting.set(false);
        }
    }

    /** Swap in a freshly dialed connection. Returns {@code false} if the supervisor closed meanwhile. */
    private boolean install(Connection raw) {
        LogicalConnection fresh;
        LogicalConnection superseded;
        synchronized (transitionLock) {
            ConnectionState previous;
            long gen;
            lock.writeLock().lock();
            try {
                if (state == ConnectionState.CLOSED) {
                    fresh = null;
                    superseded = null;
                    previous = state;
                    gen = generation;
                } else {
                    gen = ++generation;
                    fresh = new LogicalConnection(gen, raw);
                    superseded = current;
                    current = fresh;
                    previous = state;
                    state = ConnectionState.OPEN;
                }
            } finally {
                lock.writeLock().unlock();
            }
            if (fresh != null) {
                lastFailure = null;
                announce(previous, ConnectionState.OPEN, gen, null);
            }
        }

        if (fresh == null) {
            closeQuietly(raw);
            return false;
        }
        reconnecting.set(false);
        wakeWaiters();
        if (superseded != null) closeAsync(superseded);
        watch(fresh);
        return true;
    }

    /** One watcher task per connection, racing its close signal against shutdown. */
    private void watch(LogicalConnection conn) {
        Runnable watcher = () -> {
            CompletableFuture.anyOf(conn.closeSignal(), shutdownToken.whenCancelled()).join();
            if (shutdownToken.isCancelled()) return;
            onConnectionLost(conn, conn.closeSignal().getNow(null));
        };
        try {
            background.execute(watcher);
        } catch (RejectedExecutionException e) {
            log.debug("Watcher for generation {} not started, supervisor is shutting down", conn.generation());
        }
    }

    private void onConnectionLost(LogicalConnection conn, ShutdownSignalException cause) {
        synchronized (transitionLock) {
            lock.writeLock().lock();
            try {
                if (state == ConnectionState.CLOSED || current != conn) return;
                current = null;
                state = ConnectionState.CONNECTING;
            } finally {
                lock.writeLock().unlock();
            }
            lastFailure = cause;
            log.warn("Connection generation {} to {} lost: {}", conn.generation(), dialer.describe(),
                    cause != null ? cause.getMessage() : "closed");
            announce(ConnectionState.OPEN, ConnectionState.CONNECTING, conn.generation(), cause);
        }
        wakeWaiters();
        startReconnectLoop();
    }

    // ─── Shutdown ─────────────────────────────────────────────────────────────

    /**
     * Stop supervising: abandon dial waits, close the current connection, schedule no further
     * reconnects. Idempotent.
     */
    public void shutdown() {
        if (!shutdownToken.cancel("broker client shutdown")) return;
        LogicalConnection toClose;
        synchronized (transitionLock) {
            ConnectionState previous;
            long gen;
            lock.writeLock().lock();
            try {
                previous = state;
                state = ConnectionState.CLOSED;
                toClose = current;
                current = null;
                gen = generation;
            } finally {
                lock.writeLock().unlock();
            }
            announce(previous, ConnectionState.CLOSED, gen, null);
        }
        wakeWaiters();
        if (toClose != null) toClose.close();
        background.shutdownNow();
        log.info("Connection supervisor for {} shut down", dialer.describe());
    }

    @Override
    public void close() {
        shutdown();
    }

    // ─── Helpers ──────────────────────────────────────────────────────────────

    private void wakeWaiters() {
        synchronized (stateMonitor) {
            stateMonitor.notifyAll();
        }
    }

    private void closeAsync(LogicalConnection superseded) {
        try {
            background.execute(superseded::close);
        } catch (RejectedExecutionException e) {
            superseded.close();
        }
    }

    private void closeQuietly(Connection raw) {
        try {
            raw.abort();
        } catch (RuntimeException e) {
            log.debug("Error aborting connection dialed during shutdown: {}", e.toString());
        }
    }

    // caller holds transitionLock
    private void announce(ConnectionState previous, ConnectionState next, long gen, Throwable cause) {
        for (ConnectionStateListener listener : listeners) {
            try {
                listener.onStateChange(previous, next, gen, cause);
            } catch (RuntimeException e) {
                log.warn("Connection state listener {} failed", listener, e);
            }
        }
        announcedState = next;
    }
}
