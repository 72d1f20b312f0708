package com.nayem.courier.core;

import java.util.concurrent.CompletableFuture;

/**
 * The result of a command that returns nothing.
 */
public enum Unit {
    VALUE;

    private static final CompletableFuture<Unit> COMPLETED = CompletableFuture.completedFuture(VALUE);

    /**
     * @return an already completed future holding {@link #VALUE}
     */
    public static CompletableFuture<Unit> completed() {
        return COMPLETED.copy();
    }

    @Override
    public String toString() {
        return "()";
    }
}
