package com.sailfish.pool.service;

import com.sailfish.pool.AsyncTask;
import com.sailfish.pool.factory.TaskSource;
import com.sailfish.pool.model.DrainResult;
import com.sailfish.pool.model.PoolStats;
import com.sailfish.pool.model.TaskRecord;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Service interface for running asynchronous tasks under a concurrency cap with bounded retries.
 */
public interface TaskScheduler<T> {

    /**
     * Submits a task under a generated id.
     *
     * @param task The task to run.
     * @return The generated id.
     * @throws com.sailfish.pool.exception.PoolClosedException if the pool has been closed.
     */
    String submit(AsyncTask<T> task);

    /**
     * Submits a task under a caller-supplied id. The id stays the same across retries.
     *
     * @param id The task id, or null to generate one.
     * @param task The task to run.
     * @return The id the task was queued under.
     * @throws com.sailfish.pool.exception.PoolClosedException if the pool has been closed.
     * @throws IllegalArgumentException if the id is blank or belongs to a task that is still live.
     */
    String submit(String id, AsyncTask<T> task);

    /**
     * Submits a task whose every attempt is raced against {@code timeout}.
     * Losing the race counts as a failed attempt.
     */
    String submit(String id, AsyncTask<T> task, Duration timeout);

    /**
     * Submits a task and returns a future for that task alone. It completes with the value of the
     * successful attempt, or exceptionally with the TaskException that abandoned the task
     * (a TaskCancelledException if it was cancelled).
     *
     * @param id The task id, or null to generate one.
     * @throws com.sailfish.pool.exception.PoolClosedException if the pool has been closed.
     */
    CompletableFuture<T> submitForResult(String id, AsyncTask<T> task);

    /**
     * Submits every task of the source under its key, in the source's order.
     *
     * @return The ids queued.
     */
    List<String> submitAll(TaskSource<T> source);

    /**
     * Cancels a task.
     *
     * @param id The task id.
     * @return true iff the task was queued and is now abandoned. A running task is not interrupted;
     * its eventual outcome is recorded as cancelled instead.
     */
    boolean cancel(String id);

    /**
     * Stops accepting submissions. Queued and running tasks still complete.
     */
    void close();

    boolean isClosed();

    PoolStats stats();

    Optional<TaskRecord<T>> getRecord(String id);

    /**
     * @return A future for the outcome of the task with this id, already completed if the task is
     * terminal, or empty if no record of it is kept.
     */
    Optional<CompletableFuture<T>> resultOf(String id);

    /**
     * Returns a future completing the next time the pool is drained, or already completed if it is
     * drained now. Waiters registered before the same drain all receive the same result.
     */
    CompletableFuture<DrainResult<T>> waitForDrain();

    /**
     * Removes terminal records so the next drain result only covers later work.
     */
    void resetResults();

    /**
     * Closes the pool and shuts down the executors it owns.
     *
     * @param timeoutSeconds Time to wait for tasks to complete before forceful shutdown.
     */
    void shutdown(long timeoutSeconds);
}
