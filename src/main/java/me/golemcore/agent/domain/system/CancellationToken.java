package me.golemcore.agent.domain.system;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.CancellationReason;
import me.golemcore.agent.domain.model.TurnCancelledException;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation signal threaded through every suspension point of a
 * turn.
 *
 * <p>
 * Callbacks registered with {@link #onCancel(Runnable)} run exactly once, on
 * the cancelling thread, or immediately when registered after cancellation. A
 * deadline is the same mechanism driven by a scheduled timer, so a timeout and
 * an explicit abort are indistinguishable downstream.
 */
@Slf4j
public final class CancellationToken {

    private final AtomicReference<CancellationReason> reason = new AtomicReference<>();
    private final List<Callback> callbacks = new CopyOnWriteArrayList<>();
    private final AtomicReference<ScheduledFuture<?>> deadlineTask = new AtomicReference<>();
    private volatile Registration parentRegistration;

    private CancellationToken() {
    }

    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * Creates a token that is cancelled (with the same reason) whenever this one
     * is.
     */
    public CancellationToken child() {
        CancellationToken child = new CancellationToken();
        child.parentRegistration = onCancel(() -> child.cancel(getReason()));
        return child;
    }

    /**
     * Creates a child token that additionally cancels itself with
     * {@link CancellationReason#DEADLINE} after {@code timeout}. The timer is
     * cancelled by {@link #release()} or by any earlier cancellation.
     */
    public CancellationToken withDeadline(Duration timeout, ScheduledExecutorService scheduler) {
        CancellationToken child = child();
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return child;
        }
        ScheduledFuture<?> task = scheduler.schedule(() -> child.cancel(CancellationReason.DEADLINE),
                timeout.toMillis(), TimeUnit.MILLISECONDS);
        child.deadlineTask.set(task);
        if (child.isCancelled()) {
            task.cancel(false);
        }
        return child;
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public CancellationReason getReason() {
        return reason.get();
    }

    /**
     * Cancels the token. Only the first call has an effect.
     *
     * @return true if this call cancelled the token
     */
    public boolean cancel(CancellationReason cancellationReason) {
        if (!reason.compareAndSet(null, cancellationReason != null ? cancellationReason : CancellationReason.ABORT)) {
            return false;
        }
        cancelTimer();
        List<Callback> pending = List.copyOf(callbacks);
        for (Callback callback : pending) {
            callback.fire();
        }
        // only what was fired; a registration racing with cancel fires itself
        callbacks.removeAll(pending);
        return true;
    }

    /**
     * Registers a callback run on cancellation. Closing the returned
     * registration removes it.
     */
    public Registration onCancel(Runnable action) {
        Callback callback = new Callback(action);
        callbacks.add(callback);
        if (isCancelled()) {
            callbacks.remove(callback);
            callback.fire();
        }
        return () -> callbacks.remove(callback);
    }

    public void throwIfCancelled() {
        CancellationReason current = reason.get();
        if (current != null) {
            throw new TurnCancelledException(current);
        }
    }

    /**
     * Releases the token's resources without cancelling it: stops the deadline
     * timer, detaches from the parent and drops pending callbacks.
     */
    public void release() {
        cancelTimer();
        Registration registration = parentRegistration;
        if (registration != null) {
            registration.close();
        }
        callbacks.clear();
    }

    public boolean hasActiveTimer() {
        ScheduledFuture<?> task = deadlineTask.get();
        return task != null && !task.isDone();
    }

    private void cancelTimer() {
        ScheduledFuture<?> task = deadlineTask.getAndSet(null);
        if (task != null) {
            task.cancel(false);
        }
    }

    /**
     * Handle for a registered cancellation callback.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {

        @Override
        void close();
    }

    private static final class Callback {

        private final Runnable action;
        private final AtomicBoolean fired = new AtomicBoolean(false);

        private Callback(Runnable action) {
            this.action = action;
        }

        private void fire() {
            if (!fired.compareAndSet(false, true)) {
                return;
            }
            try {
                action.run();
            } catch (RuntimeException e) { // NOSONAR - one failing callback must not block the rest
                log.warn("[Cancel] cancellation callback failed: {}", e.getMessage(), e);
            }
        }
    }
}
