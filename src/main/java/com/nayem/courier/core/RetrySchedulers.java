package com.nayem.courier.core;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory for the executors that run delayed retries.
 */
public final class RetrySchedulers {

    private RetrySchedulers() {
    }

    /**
     * Creates a scheduler backed by daemon threads named {@code threadNamePrefix + n}.
     * Cancelled waits are removed from the queue immediately.
     */
    public static ScheduledExecutorService newScheduler(int poolSize, String threadNamePrefix) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, threadNamePrefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(poolSize, threadFactory);
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }
}
