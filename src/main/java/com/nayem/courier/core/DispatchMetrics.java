package com.nayem.courier.core;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters describing dispatch outcomes, tagged by request kind.
 */
public class DispatchMetrics {

    private final Map<RequestKind, Counter> succeeded = new EnumMap<>(RequestKind.class);
    private final Map<RequestKind, Counter> failed = new EnumMap<>(RequestKind.class);
    private final Map<RequestKind, Counter> retries = new EnumMap<>(RequestKind.class);
    private final Map<RequestKind, Timer> durations = new EnumMap<>(RequestKind.class);

    public DispatchMetrics(MeterRegistry registry) {
        if (registry == null) {
            return;
        }
        for (RequestKind kind : RequestKind.values()) {
            String tag = kind.name().toLowerCase(Locale.ROOT);

            succeeded.put(kind, Counter.builder("courier.dispatch.succeeded")
                    .description("Number of requests completed successfully")
                    .tag("kind", tag)
                    .register(registry));

            failed.put(kind, Counter.builder("courier.dispatch.failed")
                    .description("Number of requests completed with an error")
                    .tag("kind", tag)
                    .register(registry));

            retries.put(kind, Counter.builder("courier.dispatch.retries")
                    .description("Number of retried attempts")
                    .tag("kind", tag)
                    .register(registry));

            durations.put(kind, Timer.builder("courier.dispatch.duration")
                    .description("Time from dispatch to completion, including retries")
                    .tag("kind", tag)
                    .register(registry));
        }
    }

    public void recordSuccess(RequestKind kind, long durationMs) {
        increment(succeeded, kind);
        recordDuration(kind, durationMs);
    }

    public void recordFailure(RequestKind kind, long durationMs) {
        increment(failed, kind);
        recordDuration(kind, durationMs);
    }

    public void recordRetry(RequestKind kind) {
        increment(retries, kind);
    }

    private void recordDuration(RequestKind kind, long durationMs) {
        Timer timer = durations.get(kind);
        if (timer != null) {
            timer.record(durationMs, TimeUnit.MILLISECONDS);
        }
    }

    private static void increment(Map<RequestKind, Counter> counters, RequestKind kind) {
        Counter counter = counters.get(kind);
        if (counter != null) {
            counter.increment();
        }
    }

    public static DispatchMetrics noOp() {
        return new DispatchMetrics(null);
    }
}
