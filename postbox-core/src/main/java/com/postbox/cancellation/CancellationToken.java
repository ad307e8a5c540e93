package com.postbox.cancellation;

import com.postbox.exception.OperationCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A cancellation scope threaded through mailboxes, agents and per-call operations.
 * <p>
 * A token starts out active and can be cancelled exactly once. Callbacks registered with
 * {@link #onCancel(Runnable)} run once, in registration order, on the thread that cancels.
 * Derived tokens created with {@link #createLinked()} fire when their parent fires and can
 * additionally be cancelled on their own, for example by a timer.
 *
 * <pre>{@code
 * CancellationToken token = CancellationToken.create();
 * try (CancellationToken call = token.createLinked()) {
 *     call.cancelAfter(Duration.ofSeconds(1), scheduler);
 *     call.onCancel(() -> future.cancel(false));
 *     ...
 * }
 * }</pre>
 */
public final class CancellationToken implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(CancellationToken.class);

    private static final CancellationToken NONE = new CancellationToken(false);

    private final boolean cancellable;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<CallbackRegistration> callbacks = new CopyOnWriteArrayList<>();

    private volatile Registration parentRegistration;
    private volatile ScheduledFuture<?> timer;

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    /**
     * Creates a new independent token.
     *
     * @return an active, cancellable token
     */
    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    /**
     * Returns the shared token that can never be cancelled.
     *
     * @return the never-cancelled token
     */
    public static CancellationToken none() {
        return NONE;
    }

    /**
     * Creates a token that is cancelled whenever this token is cancelled.
     * Closing the returned token detaches it from this one.
     *
     * @return a new derived token
     */
    public CancellationToken createLinked() {
        CancellationToken child = new CancellationToken(true);
        if (cancellable) {
            child.parentRegistration = onCancel(child::cancel);
        }
        return child;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean canBeCancelled() {
        return cancellable;
    }

    /**
     * Cancels this token. Only the first call has an effect.
     * <p>
     * Every registered callback runs even if an earlier one throws; the first failure is rethrown
     * afterwards with the rest attached as suppressed exceptions.
     *
     * @throws IllegalStateException if this is the {@link #none()} token
     */
    public void cancel() {
        if (!cancellable) {
            throw new IllegalStateException("Token cannot be cancelled");
        }
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        ScheduledFuture<?> pending = timer;
        if (pending != null) {
            pending.cancel(false);
        }

        RuntimeException failure = null;
        for (CallbackRegistration registration : callbacks) {
            try {
                registration.fire();
            } catch (RuntimeException e) {
                logger.warn("Cancellation callback failed: {}", e.getMessage(), e);
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        callbacks.clear();
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * Schedules {@link #cancel()} after the given delay. A later {@link #close()} cancels the timer.
     *
     * @param delay the delay before cancelling
     * @param scheduler the scheduler running the timer
     */
    public void cancelAfter(Duration delay, ScheduledExecutorService scheduler) {
        Objects.requireNonNull(delay, "delay cannot be null");
        Objects.requireNonNull(scheduler, "scheduler cannot be null");
        if (!cancellable) {
            throw new IllegalStateException("Token cannot be cancelled");
        }
        if (isCancelled()) {
            return;
        }
        ScheduledFuture<?> previous = timer;
        if (previous != null) {
            previous.cancel(false);
        }
        timer = scheduler.schedule(this::cancel, delay.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Registers a callback to run when this token is cancelled.
     * If the token is already cancelled the callback runs immediately on the calling thread.
     *
     * @param callback the callback
     * @return a registration that removes the callback when closed
     */
    public Registration onCancel(Runnable callback) {
        Objects.requireNonNull(callback, "callback cannot be null");
        CallbackRegistration registration = new CallbackRegistration(callback);
        if (!cancellable) {
            return registration;
        }
        callbacks.add(registration);
        // cancel() may have run between the add and here
        if (isCancelled()) {
            callbacks.remove(registration);
            registration.fire();
        }
        return registration;
    }

    /**
     * Throws if this token has been cancelled.
     *
     * @throws OperationCancelledException if cancelled
     */
    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new OperationCancelledException(this);
        }
    }

    /**
     * Detaches this token from its parent and stops a pending timer.
     * Does not cancel the token.
     */
    @Override
    public void close() {
        Registration link = parentRegistration;
        if (link != null) {
            link.close();
            parentRegistration = null;
        }
        ScheduledFuture<?> pending = timer;
        if (pending != null) {
            pending.cancel(false);
            timer = null;
        }
    }

    @Override
    public String toString() {
        if (!cancellable) {
            return "CancellationToken{none}";
        }
        return "CancellationToken{cancelled=" + isCancelled() + ", callbacks=" + callbacks.size() + "}";
    }

    /**
     * Handle to a registered cancellation callback.
     */
    public interface Registration extends AutoCloseable {

        /**
         * Removes the callback. Has no effect once the callback has run.
         */
        @Override
        void close();
    }

    private final class CallbackRegistration implements Registration {
        private final Runnable callback;
        private final AtomicBoolean done = new AtomicBoolean(false);

        private CallbackRegistration(Runnable callback) {
            this.callback = callback;
        }

        void fire() {
            if (done.compareAndSet(false, true)) {
                callback.run();
            }
        }

        @Override
        public void close() {
            if (done.compareAndSet(false, true)) {
                callbacks.remove(this);
            }
        }
    }

    /**
     * Returns the number of callbacks still waiting for cancellation.
     */
    int pendingCallbacks() {
        return callbacks.size();
    }
}
