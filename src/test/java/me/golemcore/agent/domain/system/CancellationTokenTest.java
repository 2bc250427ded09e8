package me.golemcore.agent.domain.system;

import me.golemcore.agent.domain.model.CancellationReason;
import me.golemcore.agent.domain.model.TurnCancelledException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CancellationTokenTest {

    private ScheduledThreadPoolExecutor scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new ScheduledThreadPoolExecutor(1);
        scheduler.setRemoveOnCancelPolicy(true);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void shouldCancelOnlyOnce() {
        CancellationToken token = CancellationToken.create();

        assertTrue(token.cancel(CancellationReason.ABORT));
        assertFalse(token.cancel(CancellationReason.CLOSE));

        assertTrue(token.isCancelled());
        assertEquals(CancellationReason.ABORT, token.getReason());
    }

    @Test
    void shouldDefaultReasonToAbort() {
        CancellationToken token = CancellationToken.create();

        token.cancel(null);

        assertEquals(CancellationReason.ABORT, token.getReason());
    }

    @Test
    void shouldRunCallbacksExactlyOnce() {
        CancellationToken token = CancellationToken.create();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(calls::incrementAndGet);

        token.cancel(CancellationReason.ABORT);
        token.cancel(CancellationReason.ABORT);

        assertEquals(1, calls.get());
    }

    @Test
    void shouldRunCallbackImmediatelyWhenRegisteredAfterCancel() {
        CancellationToken token = CancellationToken.create();
        token.cancel(CancellationReason.INTERRUPT);
        AtomicInteger calls = new AtomicInteger();

        token.onCancel(calls::incrementAndGet);

        assertEquals(1, calls.get());
    }

    @Test
    void shouldNotRunClosedRegistration() {
        CancellationToken token = CancellationToken.create();
        AtomicInteger calls = new AtomicInteger();
        CancellationToken.Registration registration = token.onCancel(calls::incrementAndGet);

        registration.close();
        token.cancel(CancellationReason.ABORT);

        assertEquals(0, calls.get());
    }

    @Test
    void shouldContinueAfterFailingCallback() {
        CancellationToken token = CancellationToken.create();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(() -> {
            throw new IllegalStateException("broken");
        });
        token.onCancel(calls::incrementAndGet);

        token.cancel(CancellationReason.ABORT);

        assertEquals(1, calls.get());
    }

    @Test
    void shouldRunEveryCallbackRegisteredConcurrentlyWithCancel() throws Exception {
        int registrations = 50;
        for (int round = 0; round < 200; round++) {
            CancellationToken token = CancellationToken.create();
            AtomicInteger calls = new AtomicInteger();
            CountDownLatch start = new CountDownLatch(1);
            Thread registrar = new Thread(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                for (int i = 0; i < registrations; i++) {
                    token.onCancel(calls::incrementAndGet);
                }
            });
            registrar.start();

            start.countDown();
            token.cancel(CancellationReason.ABORT);
            registrar.join(5000);

            assertEquals(registrations, calls.get(), "round " + round);
        }
    }

    @Test
    void shouldPropagateToChildWithParentReason() {
        CancellationToken parent = CancellationToken.create();
        CancellationToken child = parent.child();

        parent.cancel(CancellationReason.CLOSE);

        assertTrue(child.isCancelled());
        assertEquals(CancellationReason.CLOSE, child.getReason());
    }

    @Test
    void shouldNotPropagateFromChildToParent() {
        CancellationToken parent = CancellationToken.create();
        CancellationToken child = parent.child();

        child.cancel(CancellationReason.ABORT);

        assertFalse(parent.isCancelled());
    }

    @Test
    void shouldDetachReleasedChild() {
        CancellationToken parent = CancellationToken.create();
        CancellationToken child = parent.child();

        child.release();
        parent.cancel(CancellationReason.ABORT);

        assertFalse(child.isCancelled());
    }

    @Test
    void shouldThrowWhenCancelled() {
        CancellationToken token = CancellationToken.create();
        token.throwIfCancelled();

        token.cancel(CancellationReason.DEADLINE);

        TurnCancelledException thrown = assertThrows(TurnCancelledException.class, token::throwIfCancelled);
        assertEquals(CancellationReason.DEADLINE, thrown.getReason());
    }

    // ===== Deadlines =====

    @Test
    void shouldCancelWithDeadlineReasonWhenTimerFires() throws InterruptedException {
        CancellationToken root = CancellationToken.create();
        CancellationToken token = root.withDeadline(Duration.ofMillis(50), scheduler);
        CountDownLatch cancelled = new CountDownLatch(1);
        token.onCancel(cancelled::countDown);

        assertTrue(cancelled.await(5, TimeUnit.SECONDS));
        assertEquals(CancellationReason.DEADLINE, token.getReason());
        assertFalse(root.isCancelled());
    }

    @Test
    void shouldStopTimerOnRelease() {
        CancellationToken token = CancellationToken.create().withDeadline(Duration.ofMinutes(5), scheduler);
        assertTrue(token.hasActiveTimer());

        token.release();

        assertFalse(token.hasActiveTimer());
        assertTrue(scheduler.getQueue().isEmpty());
        assertFalse(token.isCancelled());
    }

    @Test
    void shouldStopTimerOnEarlierCancel() {
        CancellationToken token = CancellationToken.create().withDeadline(Duration.ofMinutes(5), scheduler);

        token.cancel(CancellationReason.ABORT);

        assertFalse(token.hasActiveTimer());
        assertTrue(scheduler.getQueue().isEmpty());
        assertEquals(CancellationReason.ABORT, token.getReason());
    }

    @Test
    void shouldSkipTimerForMissingTimeout() {
        CancellationToken token = CancellationToken.create().withDeadline(Duration.ZERO, scheduler);

        assertFalse(token.hasActiveTimer());
        assertTrue(scheduler.getQueue().isEmpty());
    }
}
