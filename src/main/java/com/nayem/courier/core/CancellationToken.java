package com.nayem.courier.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal passed along with a request.
 * <p>
 * The dispatcher checks the token before each attempt and while waiting between
 * attempts; handlers receive the same token and may observe it as well.
 * Cancellation is one-way: once requested it cannot be undone.
 * </p>
 */
public final class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private static final CancellationToken NONE = new CancellationToken(false);

    private final boolean cancellable;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    /**
     * @return a new token that can be cancelled with {@link #cancel()}
     */
    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    /**
     * @return a shared token that is never cancelled
     */
    public static CancellationToken none() {
        return NONE;
    }

    /**
     * Creates a token that cancels itself once the timeout elapses.
     */
    public static CancellationToken cancelAfter(Duration timeout, ScheduledExecutorService scheduler) {
        CancellationToken token = create();
        var timer = scheduler.schedule(token::cancel, timeout.toMillis(), TimeUnit.MILLISECONDS);
        token.register(() -> timer.cancel(false));
        return token;
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }

    /**
     * Requests cancellation and runs the registered callbacks on the calling thread.
     *
     * @return true if this call cancelled the token, false if it was already cancelled
     * @throws UnsupportedOperationException on {@link #none()}
     */
    public boolean cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("The 'none' token cannot be cancelled");
        }
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        // whoever removes a callback runs it, so a concurrent register() cannot lose it
        for (Runnable callback : callbacks) {
            if (callbacks.remove(callback)) {
                runCallback(callback);
            }
        }
        return true;
    }

    /**
     * Registers a callback run once when cancellation is requested. If the token
     * is already cancelled the callback runs immediately.
     *
     * @return a handle removing the callback
     */
    public Registration register(Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        if (!cancellable) {
            return Registration.EMPTY;
        }
        callbacks.add(callback);
        if (cancelled.get() && callbacks.remove(callback)) {
            runCallback(callback);
        }
        return () -> callbacks.remove(callback);
    }

    private static void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation callback failed", e);
        }
    }

    /**
     * Handle returned by {@link #register(Runnable)}.
     */
    @FunctionalInterface
    public interface Registration {
        Registration EMPTY = () -> {
        };

        void unregister();
    }
}
