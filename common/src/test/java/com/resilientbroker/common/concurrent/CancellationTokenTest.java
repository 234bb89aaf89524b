/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.resilientbroker.common.concurrent;

import com.resilientbroker.common.exception.OperationCancelledException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CancellationTokenTest {

    @Test
    void cancelIsReportedOnceWithReason() {
        CancellationToken token = CancellationToken.create();
        assertFalse(token.isCancelled());
        assertNull(token.reason());

        assertTrue(token.cancel("stop"));
        assertFalse(token.cancel("again"));

        assertTrue(token.isCancelled());
        assertEquals("stop", token.reason());
        OperationCancelledException e = assertThrows(OperationCancelledException.class, token::throwIfCancelled);
        assertEquals("BRK_CANCELLED", e.getErrorCode());
    }

    @Test
    void childFollowsParentButNotTheOtherWayRound() {
        CancellationToken parent = CancellationToken.create();
        CancellationToken child = parent.child();
        CancellationToken sibling = parent.child();

        child.cancel("child only");
        assertFalse(parent.isCancelled());
        assertFalse(sibling.isCancelled());

        parent.cancel("parent");
        assertTrue(sibling.isCancelled());
        assertEquals("parent", sibling.reason());
    }

    @Test
    void anyOfFiresOnFirstSource() {
        CancellationToken a = CancellationToken.create();
        CancellationToken b = CancellationToken.create();
        CancellationToken either = CancellationToken.anyOf(a, null, b);

        b.cancel("b fired");

        assertTrue(either.isCancelled());
        assertEquals("b fired", either.reason());
        assertFalse(a.isCancelled());
    }

    @Test
    void closedChildIsDetachedFromParent() {
        CancellationToken parent = CancellationToken.create();
        CancellationToken child = parent.child();
        child.close();

        parent.cancel("late");

        assertFalse(child.isCancelled());
    }

    @Test
    void timeoutCancelsByItself() throws InterruptedException {
        CancellationToken token = CancellationToken.withTimeout(Duration.ofMillis(30));

        assertTrue(token.await(Duration.ofSeconds(2)));
        assertTrue(token.reason().contains("deadline"));
    }

    @Test
    void awaitReturnsFalseWhenTimeoutElapses() throws InterruptedException {
        CancellationToken token = CancellationToken.create();
        long start = System.nanoTime();

        assertFalse(token.await(Duration.ofMillis(20)));
        assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(20));
    }

    @Test
    void awaitWakesUpOnCancellation() throws Exception {
        CancellationToken token = CancellationToken.create();
        Thread canceller = new Thread(() -> {
            try {
                Thread.sleep(30);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            token.cancel("woken");
        });
        long start = System.nanoTime();
        canceller.start();

        assertTrue(token.await(Duration.ofSeconds(10)));
        assertTrue(System.nanoTime() - start < TimeUnit.SECONDS.toNanos(5));
        canceller.join();
    }

    @Test
    void onCancelRunsOnceAndCanBeRemoved() {
        CancellationToken token = CancellationToken.create();
        AtomicInteger kept = new AtomicInteger();
        AtomicInteger removed = new AtomicInteger();
        token.onCancel(kept::incrementAndGet);
        CancellationToken.Registration registration = token.onCancel(removed::incrementAndGet);
        registration.close();

        token.cancel("go");
        token.cancel("go again");

        assertEquals(1, kept.get());
        assertEquals(0, removed.get());
    }

    @Test
    void onCancelAfterCancellationRunsImmediately() {
        CancellationToken token = CancellationToken.create();
        token.cancel("already");
        AtomicInteger ran = new AtomicInteger();

        token.onCancel(ran::incrementAndGet);

        assertEquals(1, ran.get());
    }

    @Test
    void whenCancelledCompletesWithReason() {
        CancellationToken token = CancellationToken.create();
        var future = token.whenCancelled();
        assertFalse(future.isDone());

        token.cancel("done");

        assertEquals("done", future.join());
    }
}
