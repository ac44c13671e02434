package com.sailfish.pool;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Represents a unit of work that can be executed asynchronously by the pool.
 * Implementations start their operation and return a stage that settles when it ends.
 * The same instance is invoked again for every retry attempt.
 *
 * @param <T> The type of the value produced on success.
 */
@FunctionalInterface
public interface AsyncTask<T> {

    /**
     * Starts the task.
     *
     * @return A stage completing with the result, or exceptionally with the failure.
     * @throws Exception if the task cannot even be started; counted as a failed attempt.
     */
    CompletionStage<T> execute() throws Exception;

    /**
     * Adapts blocking work. The callable runs on the pool's task executor thread.
     *
     * @param callable The blocking work.
     * @param <T> The result type.
     * @return A task that completes with the callable's value.
     */
    static <T> AsyncTask<T> fromCallable(Callable<T> callable) {
        Objects.requireNonNull(callable, "callable cannot be null");
        return () -> CompletableFuture.completedFuture(callable.call());
    }
}
