package com.nayem.courier.core;

import com.nayem.courier.error.DispatchCancelledException;
import com.nayem.courier.error.DispatchException;
import com.nayem.courier.error.InvalidRetryDelayException;
import com.nayem.courier.error.InvocationContractException;
import com.nayem.courier.error.RetryExhaustedException;
import com.nayem.courier.handler.HandlerInvocation;
import com.nayem.courier.handler.HandlerRegistry;
import com.nayem.courier.handler.HandlerResolver;
import com.nayem.courier.retry.BackoffCalculator;
import com.nayem.courier.retry.DelayStrategy;
import com.nayem.courier.retry.LoggingRetryListener;
import com.nayem.courier.retry.RetryAlgorithm;
import com.nayem.courier.retry.RetryListener;
import com.nayem.courier.retry.RetryPredicate;
import com.nayem.courier.retry.RetrySettings;
import com.nayem.courier.retry.RetrySettingsValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Dispatches requests of one {@link RequestKind} to their handler and retries
 * failed attempts according to the {@link RetrySettings}.
 * <p>
 * Each call runs independently: attempts of one request never overlap, and the
 * wait between two attempts is scheduled rather than slept, so no thread is
 * held while a request waits for its next attempt.
 * </p>
 *
 * <h3>Lifecycle of a dispatch</h3>
 * <ol>
 * <li>The retry settings are validated.</li>
 * <li>The single handler of the request is resolved.</li>
 * <li>The handler is invoked. On failure the {@link RetryPredicate} decides
 * whether to retry, the {@link DelayStrategy} computes the wait, and the settings
 * decide whether the retry budget is exhausted.</li>
 * </ol>
 * Configuration and resolution failures are never retried.
 */
public class RequestDispatcher {

    private static final Logger log = LoggerFactory.getLogger(RequestDispatcher.class);

    private final RequestKind kind;
    private final HandlerResolver resolver;
    private final RetrySettings settings;
    private final RetryPredicate retryPredicate;
    private final DelayStrategy delayStrategy;
    private final RetryListener retryListener;
    private final ScheduledExecutorService scheduler;
    private final DispatchMetrics metrics;

    private RequestDispatcher(Builder builder) {
        this.kind = Objects.requireNonNull(builder.kind, "kind");
        this.resolver = Objects.requireNonNull(builder.resolver, "resolver");
        this.settings = Objects.requireNonNull(builder.settings, "settings");
        this.scheduler = Objects.requireNonNull(builder.scheduler, "scheduler");
        this.retryPredicate = builder.retryPredicate != null ? builder.retryPredicate : RetryPredicate.always();
        this.delayStrategy = builder.delayStrategy != null
                ? builder.delayStrategy
                : DelayStrategy.backoff(builder.settings,
                        builder.backoffCalculator != null ? builder.backoffCalculator : new BackoffCalculator());
        this.retryListener = builder.retryListener != null ? builder.retryListener : new LoggingRetryListener();
        this.metrics = builder.metrics != null ? builder.metrics : DispatchMetrics.noOp();
    }

    public RequestKind getKind() {
        return kind;
    }

    /**
     * Dispatches a request to its handler.
     * <p>
     * Every failure is reported through the returned future: invalid settings,
     * resolution failures, the handler's own error when it is not retried,
     * {@link RetryExhaustedException} when the retry budget is spent, and
     * {@link DispatchCancelledException} when the token is cancelled. Cancelling the
     * returned future stops further attempts.
     * </p>
     *
     * @param request           the request to dispatch
     * @param cancellationToken observed before each attempt and during each wait
     * @return the handler's result
     */
    public <R> CompletableFuture<R> dispatch(Request<R> request, CancellationToken cancellationToken) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(cancellationToken, "cancellationToken");

        HandlerInvocation<R> handler;
        try {
            RetrySettingsValidator.ensureValid(settings);
            handler = resolver.resolve(kind, request);
        } catch (DispatchException e) {
            metrics.recordFailure(kind, 0);
            return CompletableFuture.failedFuture(e);
        }

        Execution<R> execution = new Execution<>(request, handler, cancellationToken);
        execution.invoke();
        return execution.result;
    }

    private boolean isExhausted(int attempt, long delay) {
        return settings.algorithm() == RetryAlgorithm.NONE
                || (settings.maximumRetries() > 0 && attempt > settings.maximumRetries())
                || (settings.maximumDelay() > 0 && delay > settings.maximumDelay());
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * State of one dispatch call. Attempts run one after the other, so the
     * fields are never written concurrently.
     */
    private final class Execution<R> {
        private final Request<R> request;
        private final Class<?> requestType;
        private final HandlerInvocation<R> handler;
        private final CancellationToken cancellationToken;
        private final long startTime = System.currentTimeMillis();
        private final CompletableFuture<R> result = new CompletableFuture<>();

        private volatile int attempt;
        private volatile Future<?> pendingRetry;
        private volatile CancellationToken.Registration registration = CancellationToken.Registration.EMPTY;

        Execution(Request<R> request, HandlerInvocation<R> handler, CancellationToken cancellationToken) {
            this.request = request;
            this.requestType = request.getClass();
            this.handler = handler;
            this.cancellationToken = cancellationToken;

            result.whenComplete((value, error) -> {
                registration.unregister();
                Future<?> pending = pendingRetry;
                if (pending != null) {
                    pending.cancel(false);
                }
            });
        }

        void invoke() {
            if (result.isDone()) {
                return;
            }
            if (cancellationToken.isCancellationRequested()) {
                cancel();
                return;
            }

            attempt++;
            CompletableFuture<R> call;
            try {
                call = handler.invoke(request, cancellationToken);
            } catch (RuntimeException e) {
                onFailure(e);
                return;
            }
            if (call == null) {
                onFailure(new InvocationContractException("The handler of " + kind.getDisplayName().toLowerCase(Locale.ROOT)
                        + " '" + requestType.getName() + "' must return a CompletableFuture."));
                return;
            }

            call.whenComplete((value, error) -> {
                if (error == null) {
                    succeed(value);
                } else {
                    onFailure(unwrap(error));
                }
            });
        }

        private void onFailure(Throwable error) {
            if (result.isDone()) {
                return;
            }
            try {
                if (!retryPredicate.shouldRetry(request, error)) {
                    log.debug("{} '{}' failed at attempt {} and will not be retried",
                            kind.getDisplayName(), requestType.getName(), attempt);
                    fail(error);
                    return;
                }

                long delay = delayStrategy.delayMillis(request, error, attempt);
                if (delay < 0) {
                    fail(new InvalidRetryDelayException(delay, error));
                    return;
                }
                if (isExhausted(attempt, delay)) {
                    log.error("{} '{}' failed after {} attempts: {}",
                            kind.getDisplayName(), requestType.getName(), attempt, error.getMessage());
                    fail(new RetryExhaustedException(kind, requestType, attempt, error));
                    return;
                }

                notifyRetry(delay, error);
                metrics.recordRetry(kind);
                scheduleRetry(delay);
            } catch (RuntimeException e) {
                if (e != error) {
                    e.addSuppressed(error);
                }
                fail(e);
            }
        }

        private void notifyRetry(long delay, Throwable error) {
            try {
                if (retryListener.isEnabled()) {
                    retryListener.onRetry(kind, requestType, attempt, delay, error);
                }
            } catch (RuntimeException e) {
                log.warn("Retry listener failed for {} '{}'", kind.getDisplayName(), requestType.getName(), e);
            }
        }

        private void scheduleRetry(long delay) {
            registration = cancellationToken.register(this::cancel);
            pendingRetry = scheduler.schedule(() -> {
                registration.unregister();
                invoke();
            }, delay, TimeUnit.MILLISECONDS);
            if (result.isDone()) {
                pendingRetry.cancel(false);
            }
        }

        private void cancel() {
            Future<?> pending = pendingRetry;
            if (pending != null) {
                pending.cancel(false);
            }
            fail(new DispatchCancelledException(requestType, attempt));
        }

        private void succeed(R value) {
            if (result.complete(value)) {
                metrics.recordSuccess(kind, System.currentTimeMillis() - startTime);
            }
        }

        private void fail(Throwable error) {
            if (result.completeExceptionally(error)) {
                metrics.recordFailure(kind, System.currentTimeMillis() - startTime);
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link RequestDispatcher}.
     * <p>
     * The kind, the handlers (either a {@link HandlerRegistry} or a
     * {@link HandlerResolver}) and the retry scheduler are required. Defaults:
     * settings that never retry, a predicate retrying every failure, delays from
     * a {@link BackoffCalculator}, and a {@link LoggingRetryListener}.
     * </p>
     */
    public static class Builder {
        private RequestKind kind;
        private HandlerResolver resolver;
        private RetrySettings settings = RetrySettings.none();
        private RetryPredicate retryPredicate;
        private DelayStrategy delayStrategy;
        private BackoffCalculator backoffCalculator;
        private RetryListener retryListener;
        private ScheduledExecutorService scheduler;
        private DispatchMetrics metrics;

        public Builder kind(RequestKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder handlers(HandlerRegistry registry) {
            this.resolver = new HandlerResolver(registry);
            return this;
        }

        public Builder resolver(HandlerResolver resolver) {
            this.resolver = resolver;
            return this;
        }

        public Builder settings(RetrySettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder retryPredicate(RetryPredicate retryPredicate) {
            this.retryPredicate = retryPredicate;
            return this;
        }

        /**
         * Replaces the delay computation. When set, {@link #backoffCalculator} is ignored.
         */
        public Builder delayStrategy(DelayStrategy delayStrategy) {
            this.delayStrategy = delayStrategy;
            return this;
        }

        public Builder backoffCalculator(BackoffCalculator backoffCalculator) {
            this.backoffCalculator = backoffCalculator;
            return this;
        }

        public Builder retryListener(RetryListener retryListener) {
            this.retryListener = retryListener;
            return this;
        }

        public Builder scheduler(ScheduledExecutorService scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder metrics(DispatchMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public RequestDispatcher build() {
            return new RequestDispatcher(this);
        }
    }
}
