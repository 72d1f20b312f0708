package com.nayem.courier.core;

import com.nayem.courier.error.DispatchCancelledException;
import com.nayem.courier.error.HandlerResolutionException;
import com.nayem.courier.error.InvalidRetryDelayException;
import com.nayem.courier.error.InvalidRetrySettingsException;
import com.nayem.courier.error.InvocationContractException;
import com.nayem.courier.error.RetryExhaustedException;
import com.nayem.courier.handler.InMemoryHandlerRegistry;
import com.nayem.courier.retry.DelayStrategy;
import com.nayem.courier.retry.RetryAlgorithm;
import com.nayem.courier.retry.RetryListener;
import com.nayem.courier.retry.RetryPredicate;
import com.nayem.courier.retry.RetrySettings;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class RequestDispatcherTest {

    record Ping(String value) implements Command<String> {
    }

    record Unhandled() implements Command<Unit> {
    }

    record RetryEvent(RequestKind kind, Class<?> requestType, int attempt, long delayMillis, Throwable error) {
    }

    static class RecordingRetryListener implements RetryListener {
        final List<RetryEvent> events = new CopyOnWriteArrayList<>();

        @Override
        public void onRetry(RequestKind kind, Class<?> requestType, int attempt, long delayMillis, Throwable error) {
            events.add(new RetryEvent(kind, requestType, attempt, delayMillis, error));
        }
    }

    private static final RetrySettings FIXED_10MS_TWO_RETRIES = RetrySettings.builder()
            .algorithm(RetryAlgorithm.FIXED)
            .delay(10)
            .maximumRetries(2)
            .build();

    private ScheduledExecutorService scheduler;
    private InMemoryHandlerRegistry registry;
    private RecordingRetryListener listener;
    private AtomicInteger attempts;

    @BeforeEach
    void setUp() {
        scheduler = RetrySchedulers.newScheduler(2, "courier-test-");
        registry = new InMemoryHandlerRegistry();
        listener = new RecordingRetryListener();
        attempts = new AtomicInteger();
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    private RequestDispatcher.Builder dispatcher(RetrySettings settings) {
        return RequestDispatcher.builder()
                .kind(RequestKind.COMMAND)
                .handlers(registry)
                .settings(settings)
                .retryListener(listener)
                .scheduler(scheduler);
    }

    private void handle(RequestHandler<Ping, String> handler) {
        registry.registerCommandHandler(Ping.class, String.class, handler);
    }

    private void alwaysFail(RuntimeException error) {
        handle((command, token) -> {
            attempts.incrementAndGet();
            return CompletableFuture.failedFuture(error);
        });
    }

    private static Throwable failureOf(CompletableFuture<?> future) throws Exception {
        ExecutionException thrown = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        return thrown.getCause();
    }

    @Test
    void testSuccessOnFirstAttemptNeverComputesDelay() throws Exception {
        DelayStrategy delayStrategy = mock(DelayStrategy.class);
        handle((command, token) -> {
            attempts.incrementAndGet();
            return CompletableFuture.completedFuture(command.value() + "-pong");
        });
        RequestDispatcher dispatcher = dispatcher(FIXED_10MS_TWO_RETRIES).delayStrategy(delayStrategy).build();

        String result = dispatcher.dispatch(new Ping("ping"), CancellationToken.none()).get(5, TimeUnit.SECONDS);

        assertEquals("ping-pong", result);
        assertEquals(1, attempts.get());
        assertTrue(listener.events.isEmpty());
        verify(delayStrategy, never()).delayMillis(any(), any(), anyInt());
    }

    @Test
    void testRetriesUntilHandlerSucceeds() throws Exception {
        handle((command, token) -> {
            if (attempts.incrementAndGet() < 3) {
                return CompletableFuture.failedFuture(new IllegalStateException("transient"));
            }
            return CompletableFuture.completedFuture("done");
        });
        RequestDispatcher dispatcher = dispatcher(RetrySettings.builder()
                .algorithm(RetryAlgorithm.FIXED)
                .delay(10)
                .maximumRetries(5)
                .build()).build();

        String result = dispatcher.dispatch(new Ping("x"), CancellationToken.none()).get(5, TimeUnit.SECONDS);

        assertEquals("done", result);
        assertEquals(3, attempts.get());
        assertEquals(2, listener.events.size());
        assertEquals(1, listener.events.get(0).attempt());
        assertEquals(2, listener.events.get(1).attempt());
        assertEquals(10, listener.events.get(0).delayMillis());
        assertEquals(RequestKind.COMMAND, listener.events.get(0).kind());
        assertEquals(Ping.class, listener.events.get(0).requestType());
    }

    @Test
    void testRetryExhaustedAfterMaximumRetries() throws Exception {
        IllegalStateException error = new IllegalStateException("down");
        alwaysFail(error);
        RequestDispatcher dispatcher = dispatcher(FIXED_10MS_TWO_RETRIES).build();

        Throwable failure = failureOf(dispatcher.dispatch(new Ping("x"), CancellationToken.none()));

        RetryExhaustedException exhausted = assertInstanceOf(RetryExhaustedException.class, failure);
        assertEquals(3, exhausted.getAttempts());
        assertEquals(Ping.class, exhausted.getRequestType());
        assertSame(error, exhausted.getCause());
        assertEquals("Command '" + Ping.class.getName()
                + "' execution failed after 3 attempts. See the cause for more detail.", exhausted.getMessage());
        assertEquals(3, attempts.get());
        assertEquals(2, listener.events.size());
        assertSame(error, listener.events.get(1).error());
    }

    @Test
    void testNoneAlgorithmNeverRetries() throws Exception {
        alwaysFail(new IllegalStateException("down"));
        RequestDispatcher dispatcher = dispatcher(RetrySettings.none()).build();

        Throwable failure = failureOf(dispatcher.dispatch(new Ping("x"), CancellationToken.none()));

        RetryExhaustedException exhausted = assertInstanceOf(RetryExhaustedException.class, failure);
        assertEquals(1, exhausted.getAttempts());
        assertEquals(1, attempts.get());
        assertTrue(listener.events.isEmpty());
    }

    @Test
    void testNonRetryableErrorIsRethrownAsIs() throws Exception {
        UnsupportedOperationException error = new UnsupportedOperationException("permanent");
        alwaysFail(error);
        RequestDispatcher dispatcher = dispatcher(FIXED_10MS_TWO_RETRIES)
                .retryPredicate(RetryPredicate.nonRetryable(UnsupportedOperationException.class))
                .build();

        Throwable failure = failureOf(dispatcher.dispatch(new Ping("x"), CancellationToken.none()));

        assertSame(error, failure);
        assertEquals(1, attempts.get());
        assertTrue(listener.events.isEmpty());
    }

    @Test
    void testMaximumDelayStopsExponentialBackoff() throws Exception {
        alwaysFail(new IllegalStateException("down"));
        RequestDispatcher dispatcher = dispatcher(RetrySettings.builder()
                .algorithm(RetryAlgorithm.EXPONENTIAL)
                .delay(20)
                .exponentialBase(2)
                .maximumDelay(60)
                .build()).build();

        Throwable failure = failureOf(dispatcher.dispatch(new Ping("x"), CancellationToken.none()));

        // 20ms, 40ms, then 80ms exceeds the limit
        RetryExhaustedException exhausted = assertInstanceOf(RetryExhaustedException.class, failure);
        assertEquals(3, exhausted.getAttempts());
        assertEquals(List.of(20L, 40L), listener.events.stream().map(RetryEvent::delayMillis).toList());
    }

    @Test
    void testNegativeDelayFailsDispatch() throws Exception {
        IllegalStateException error = new IllegalStateException("down");
        alwaysFail(error);
        RequestDispatcher dispatcher = dispatcher(FIXED_10MS_TWO_RETRIES)
                .delayStrategy((request, e, attempt) -> -5)
                .build();

        Throwable failure = failureOf(dispatcher.dispatch(new Ping("x"), CancellationToken.none()));

        InvalidRetryDelayException invalid = assertInstanceOf(InvalidRetryDelayException.class, failure);
        assertEquals(-5, invalid.getDelay());
        assertSame(error, invalid.getCause());
        assertEquals("The retry delay '-5' should be greater than or equal to 0ms.", invalid.getMessage());
        assertEquals(1, attempts.get());
    }

    @Test
    void testInvalidSettingsFailBeforeInvokingHandler() throws Exception {
        alwaysFail(new IllegalStateException("down"));
        RequestDispatcher dispatcher = dispatcher(RetrySettings.builder()
                .algorithm(RetryAlgorithm.EXPONENTIAL)
                .build()).build();

        Throwable failure = failureOf(dispatcher.dispatch(new Ping("x"), CancellationToken.none()));

        InvalidRetrySettingsException invalid = assertInstanceOf(InvalidRetrySettingsException.class, failure);
        assertEquals(List.of("'Delay' must be greater than 0.", "'ExponentialBase' must be greater than 1."),
                invalid.getViolations());
        assertEquals(0, attempts.get());
    }

    @Test
    void testMissingHandlerIsNotRetried() throws Exception {
        RequestDispatcher dispatcher = dispatcher(FIXED_10MS_TWO_RETRIES).build();

        Throwable failure = failureOf(dispatcher.dispatch(new Unhandled(), CancellationToken.none()));

        HandlerResolutionException resolution = assertInstanceOf(HandlerResolutionException.class, failure);
        assertEquals(0, resolution.getHandlerCount());
        assertTrue(listener.events.isEmpty());
    }

    @Test
    void testHandlerThrowingSynchronouslyIsRetried() throws Exception {
        handle((command, token) -> {
            if (attempts.incrementAndGet() == 1) {
                throw new IllegalStateException("thrown");
            }
            return CompletableFuture.completedFuture("recovered");
        });
        RequestDispatcher dispatcher = dispatcher(FIXED_10MS_TWO_RETRIES).build();

        assertEquals("recovered", dispatcher.dispatch(new Ping("x"), CancellationToken.none()).get(5, TimeUnit.SECONDS));
        assertEquals(1, listener.events.size());
        assertEquals("thrown", listener.events.get(0).error().getMessage());
    }

    @Test
    void testNullFutureIsReportedAsContractViolation() throws Exception {
        handle((command, token) -> {
            attempts.incrementAndGet();
            return null;
        });
        RequestDispatcher dispatcher = dispatcher(FIXED_10MS_TWO_RETRIES).build();

        Throwable failure = failureOf(dispatcher.dispatch(new Ping("x"), CancellationToken.none()));

        RetryExhaustedException exhausted = assertInstanceOf(RetryExhaustedException.class, failure);
        assertInstanceOf(InvocationContractException.class, exhausted.getCause());
        assertEquals(3, attempts.get());
    }

    @Test
    void testCompletionExceptionIsUnwrapped() throws Exception {
        IllegalStateException error = new IllegalStateException("wrapped");
        AtomicReference<Throwable> seen = new AtomicReference<>();
        alwaysFail(new CompletionException(error));
        RequestDispatcher dispatcher = dispatcher(FIXED_10MS_TWO_RETRIES)
                .retryPredicate((request, e) -> {
                    seen.set(e);
                    return false;
                })
                .build();

        Throwable failure = failureOf(dispatcher.dispatch(new Ping("x"), CancellationToken.none()));

        assertSame(error, failure);
        assertSame(error, seen.get());
    }

    @Test
    void testListenerFailureDoesNotStopRetries() throws Exception {
        handle((command, token) -> {
            if (attempts.incrementAndGet() == 1) {
                return CompletableFuture.failedFuture(new IllegalStateException("transient"));
            }
            return CompletableFuture.completedFuture("ok");
        });
        RequestDispatcher dispatcher = dispatcher(FIXED_10MS_TWO_RETRIES)
                .retryListener((kind, type, attempt, delay, error) -> {
                    throw new IllegalStateException("listener broke");
                })
                .build();

        assertEquals("ok", dispatcher.dispatch(new Ping("x"), CancellationToken.none()).get(5, TimeUnit.SECONDS));
        assertEquals(2, attempts.get());
    }

    @Test
    void testRetriedAttemptsRunOnSchedulerThreads() throws Exception {
        List<String> threads = new CopyOnWriteArrayList<>();
        handle((command, token) -> {
            threads.add(Thread.currentThread().getName());
            if (attempts.incrementAndGet() == 1) {
                return CompletableFuture.failedFuture(new IllegalStateException("transient"));
            }
            return CompletableFuture.completedFuture("ok");
        });
        RequestDispatcher dispatcher = dispatcher(FIXED_10MS_TWO_RETRIES).build();

        dispatcher.dispatch(new Ping("x"), CancellationToken.none()).get(5, TimeUnit.SECONDS);

        assertEquals(Thread.currentThread().getName(), threads.get(0));
        assertTrue(threads.get(1).startsWith("courier-test-"), threads.get(1));
    }

    @Test
    void testZeroDelayRetriesImmediately() throws Exception {
        handle((command, token) -> {
            if (attempts.incrementAndGet() < 4) {
                return CompletableFuture.failedFuture(new IllegalStateException("transient"));
            }
            return CompletableFuture.completedFuture("ok");
        });
        RequestDispatcher dispatcher = dispatcher(RetrySettings.builder()
                .algorithm(RetryAlgorithm.FIXED)
                .delay(0)
                .build()).build();

        assertEquals("ok", dispatcher.dispatch(new Ping("x"), CancellationToken.none()).get(5, TimeUnit.SECONDS));
        assertTrue(listener.events.stream().allMatch(event -> event.delayMillis() == 0));
    }

    @Test
    void testCancellationDuringAttemptKeepsRefusedError() throws Exception {
        IllegalStateException error = new IllegalStateException("original");
        CancellationToken token = CancellationToken.create();
        handle((command, t) -> {
            attempts.incrementAndGet();
            t.cancel();
            return CompletableFuture.failedFuture(error);
        });
        RequestDispatcher dispatcher = dispatcher(FIXED_10MS_TWO_RETRIES)
                .retryPredicate(RetryPredicate.never())
                .build();

        Throwable failure = failureOf(dispatcher.dispatch(new Ping("x"), token));

        assertSame(error, failure);
        assertEquals(1, attempts.get());
    }

    @Test
    void testCancellationDuringAttemptStillExhaustsNoneAlgorithm() throws Exception {
        IllegalStateException error = new IllegalStateException("original");
        CancellationToken token = CancellationToken.create();
        handle((command, t) -> {
            attempts.incrementAndGet();
            t.cancel();
            return CompletableFuture.failedFuture(error);
        });
        RequestDispatcher dispatcher = dispatcher(RetrySettings.none()).build();

        Throwable failure = failureOf(dispatcher.dispatch(new Ping("x"), token));

        RetryExhaustedException exhausted = assertInstanceOf(RetryExhaustedException.class, failure);
        assertSame(error, exhausted.getCause());
        assertEquals(1, exhausted.getAttempts());
    }

    @Test
    void testCancellationDuringAttemptAbortsScheduledRetry() {
        CancellationToken token = CancellationToken.create();
        handle((command, t) -> {
            attempts.incrementAndGet();
            t.cancel();
            return CompletableFuture.failedFuture(new IllegalStateException("original"));
        });
        RequestDispatcher dispatcher = dispatcher(FIXED_10MS_TWO_RETRIES).build();

        CompletableFuture<String> future = dispatcher.dispatch(new Ping("x"), token);

        DispatchCancelledException cancelled = assertThrows(DispatchCancelledException.class,
                () -> future.get(5, TimeUnit.SECONDS));
        assertEquals(1, cancelled.getAttempts());
        assertEquals(1, attempts.get());
        assertEquals(1, listener.events.size());
    }

    @Test
    void testCancelledTokenPreventsFirstAttempt() throws Exception {
        alwaysFail(new IllegalStateException("down"));
        CancellationToken token = CancellationToken.create();
        token.cancel();
        RequestDispatcher dispatcher = dispatcher(FIXED_10MS_TWO_RETRIES).build();

        CompletableFuture<String> future = dispatcher.dispatch(new Ping("x"), token);

        DispatchCancelledException cancelled = assertThrows(DispatchCancelledException.class, future::join);
        assertEquals(0, cancelled.getAttempts());
        assertTrue(future.isCancelled());
        assertEquals(0, attempts.get());
    }

    @Test
    void testCancellationDuringWaitAbortsRetry() throws Exception {
        alwaysFail(new IllegalStateException("down"));
        CancellationToken token = CancellationToken.create();
        RequestDispatcher dispatcher = dispatcher(RetrySettings.builder()
                .algorithm(RetryAlgorithm.FIXED)
                .delay(60_000)
                .build()).build();

        CompletableFuture<String> future = dispatcher.dispatch(new Ping("x"), token);
        assertFalse(future.isDone());
        token.cancel();

        DispatchCancelledException cancelled = assertThrows(DispatchCancelledException.class,
                () -> future.get(1, TimeUnit.SECONDS));
        assertEquals(1, cancelled.getAttempts());
        assertEquals(Ping.class, cancelled.getRequestType());
        assertEquals(1, attempts.get());
    }

    @Test
    void testTimeoutTokenStopsUnboundedRetries() {
        alwaysFail(new IllegalStateException("down"));
        CancellationToken token = CancellationToken.cancelAfter(Duration.ofMillis(100), scheduler);
        RequestDispatcher dispatcher = dispatcher(RetrySettings.builder()
                .algorithm(RetryAlgorithm.FIXED)
                .delay(10)
                .build()).build();

        CompletableFuture<String> future = dispatcher.dispatch(new Ping("x"), token);

        assertThrows(DispatchCancelledException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertTrue(attempts.get() > 1);
    }

    @Test
    void testCancellingResultStopsFurtherAttempts() throws Exception {
        alwaysFail(new IllegalStateException("down"));
        RequestDispatcher dispatcher = dispatcher(RetrySettings.builder()
                .algorithm(RetryAlgorithm.FIXED)
                .delay(50)
                .build()).build();

        CompletableFuture<String> future = dispatcher.dispatch(new Ping("x"), CancellationToken.none());
        future.cancel(false);
        Thread.sleep(200);

        assertEquals(1, attempts.get());
    }

    @Test
    void testMetricsRecordOutcomes() throws Exception {
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        handle((command, token) -> {
            if (attempts.incrementAndGet() == 1) {
                return CompletableFuture.failedFuture(new IllegalStateException("transient"));
            }
            return CompletableFuture.completedFuture("ok");
        });
        RequestDispatcher dispatcher = dispatcher(FIXED_10MS_TWO_RETRIES)
                .metrics(new DispatchMetrics(meterRegistry))
                .build();

        dispatcher.dispatch(new Ping("x"), CancellationToken.none()).get(5, TimeUnit.SECONDS);
        failureOf(dispatcher.dispatch(new Unhandled(), CancellationToken.none()));

        assertEquals(1.0, meterRegistry.get("courier.dispatch.succeeded").tag("kind", "command").counter().count());
        assertEquals(1.0, meterRegistry.get("courier.dispatch.retries").tag("kind", "command").counter().count());
        assertEquals(1.0, meterRegistry.get("courier.dispatch.failed").tag("kind", "command").counter().count());
        assertEquals(2, meterRegistry.get("courier.dispatch.duration").tag("kind", "command").timer().count());
    }

    @Test
    void testConcurrentDispatchesKeepIndependentAttemptCounts() throws Exception {
        Map<String, AtomicInteger> perRequest = new ConcurrentHashMap<>();
        handle((command, token) -> {
            int attempt = perRequest.computeIfAbsent(command.value(), k -> new AtomicInteger()).incrementAndGet();
            if (attempt < 3) {
                return CompletableFuture.failedFuture(new IllegalStateException("transient " + attempt));
            }
            return CompletableFuture.completedFuture(command.value());
        });
        RequestDispatcher dispatcher = dispatcher(RetrySettings.builder()
                .algorithm(RetryAlgorithm.RANDOM)
                .delay(5)
                .randomVariation(4)
                .maximumRetries(2)
                .build()).build();

        List<CompletableFuture<String>> futures = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            String id = "req-" + i;
            futures.add(CompletableFuture.supplyAsync(() -> id)
                    .thenCompose(value -> dispatcher.dispatch(new Ping(value), CancellationToken.none())));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(10, TimeUnit.SECONDS);

        for (int i = 0; i < 100; i++) {
            assertEquals("req-" + i, futures.get(i).get());
            assertEquals(3, perRequest.get("req-" + i).get());
        }
        assertEquals(200, listener.events.size());
    }

    @Test
    void testBuilderRequiresScheduler() {
        assertThrows(NullPointerException.class, () -> RequestDispatcher.builder()
                .kind(RequestKind.COMMAND)
                .handlers(registry)
                .build());
    }
}
