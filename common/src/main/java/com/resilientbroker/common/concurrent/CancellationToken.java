/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.common.concurrent;

import com.resilientbroker.common.exception.OperationCancelledException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Cooperative cancellation signal shared between a caller and the operations it starts.
 *
 * <p>A token is cancelled at most once, either explicitly via {@link #cancel(String)},
 * by a deadline ({@link #withTimeout(Duration)}) or because one of its parents was
 * cancelled ({@link #child()}, {@link #anyOf(CancellationToken...)}). Every blocking wait
 * in the client races its token through {@link #await(Duration)}, so a cancellation wakes
 * the waiter immediately instead of after the full sleep.</p>
 *
 * <p>Closing a derived token detaches it from its parents and drops its deadline; it does
 * not cancel it. Root tokens have nothing to detach and {@link #close()} is a no-op for them.</p>
 *
 * <pre>{@code
 *   try (CancellationToken linked = CancellationToken.anyOf(callerToken, shutdownToken)) {
 *       retryExecutor.execute(op, policy, linked);
 *   }
 * }</pre>
 */
public final class CancellationToken implements AutoCloseable {

    private static final ScheduledExecutorService DEADLINES = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "cancellation-deadline");
        t.setDaemon(true);
        return t;
    });

    private final CompletableFuture<String> signal = new CompletableFuture<>();
    private final List<Runnable> callbacks = new ArrayList<>();
    private final List<Registration> parentLinks = new ArrayList<>();
    private volatile ScheduledFuture<?> deadline;

    private CancellationToken() {}

    /** A fresh root token that is cancelled only when someone calls {@link #cancel(String)}. */
    public static CancellationToken create() {
        return new CancellationToken();
    }

    /** A root token nobody else holds; useful for calls made without a caller token. */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    /** A root token that cancels itself once {@code timeout} elapses. */
    public static CancellationToken withTimeout(Duration timeout) {
        CancellationToken token = new CancellationToken();
        token.scheduleDeadline(timeout);
        return token;
    }

    /** A token cancelled as soon as any of the given tokens is cancelled. */
    public static CancellationToken anyOf(CancellationToken... parents) {
        CancellationToken token = new CancellationToken();
        for (CancellationToken parent : parents) {
            if (parent == null) continue;
            token.link(parent);
        }
        return token;
    }

    /** A token cancelled with this one, that can also be cancelled on its own. */
    public CancellationToken child() {
        return anyOf(this);
    }

    /** A child of this token that additionally cancels itself after {@code timeout}. */
    public CancellationToken childWithTimeout(Duration timeout) {
        CancellationToken token = child();
        token.scheduleDeadline(timeout);
        return token;
    }

    /**
     * Cancel this token. Returns {@code true} if this call performed the cancellation,
     * {@code false} if the token was already cancelled.
     */
    public boolean cancel(String reason) {
        List<Runnable> toRun;
        synchronized (this) {
            if (!signal.complete(reason != null ? reason : "cancelled")) return false;
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        ScheduledFuture<?> d = deadline;
        if (d != null) d.cancel(false);
        for (Runnable r : toRun) r.run();
        return true;
    }

    public boolean isCancelled() {
        return signal.isDone();
    }

    /** The cancellation reason, or {@code null} while not cancelled. */
    public String reason() {
        return signal.getNow(null);
    }

    public void throwIfCancelled() {
        if (isCancelled()) throw new OperationCancelledException(reason());
    }

    /**
     * Wait up to {@code timeout} for cancellation.
     *
     * @return {@code true} if the token is cancelled, {@code false} if the timeout elapsed first
     */
    public boolean await(Duration timeout) throws InterruptedException {
        if (isCancelled()) return true;
        if (timeout.isNegative() || timeout.isZero()) return false;
        try {
            signal.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            // signal is never completed exceptionally
            throw new IllegalStateException(e);
        }
    }

    /** A future completed with the reason when this token is cancelled. */
    public CompletableFuture<String> whenCancelled() {
        return signal.copy();
    }

    /**
     * Run {@code action} when this token is cancelled, immediately if it already is.
     * Closing the returned registration removes the action.
     */
    public Registration onCancel(Runnable action) {
        synchronized (this) {
            if (!signal.isDone()) {
                callbacks.add(action);
                return () -> {
                    synchronized (CancellationToken.this) {
                        callbacks.remove(action);
                    }
                };
            }
        }
        action.run();
        return () -> { };
    }

    /** Detach from parents and drop any pending deadline. Does not cancel. */
    @Override
    public void close() {
        List<Registration> links;
        synchronized (this) {
            links = new ArrayList<>(parentLinks);
            parentLinks.clear();
        }
        links.forEach(Registration::close);
        ScheduledFuture<?> d = deadline;
        if (d != null) d.cancel(false);
    }

    private void link(CancellationToken parent) {
        Registration registration = parent.onCancel(() -> cancel(parent.reason()));
        synchronized (this) {
            parentLinks.add(registration);
        }
    }

    private void scheduleDeadline(Duration timeout) {
        deadline = DEADLINES.schedule(() -> { cancel("deadline of " + timeout + " exceeded"); },
                Math.max(0, timeout.toNanos()), TimeUnit.NANOSECONDS);
    }

    /** Handle for a callback registered via {@link #onCancel(Runnable)}. */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
