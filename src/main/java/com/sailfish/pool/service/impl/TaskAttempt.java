package com.sailfish.pool.service.impl;

import com.sailfish.pool.AsyncTask;
import com.sailfish.pool.exception.TaskTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * A Runnable responsible for starting a single attempt of a task and exposing its outcome.
 *
 * The outcome settles exactly once: with the task's value, with its failure, or with a
 * {@link TaskTimeoutException} if the optional timer fires first. Whatever loses the race is ignored.
 */
class TaskAttempt<T> implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(TaskAttempt.class);

    private final String taskId;
    private final int attempt;
    private final AsyncTask<T> task;
    private final Duration timeout; // null = untimed
    private final ScheduledExecutorService timerExecutor;
    private final CompletableFuture<T> outcome = new CompletableFuture<>();

    TaskAttempt(String taskId, int attempt, AsyncTask<T> task, Duration timeout,
                ScheduledExecutorService timerExecutor) {
        this.taskId = Objects.requireNonNull(taskId, "taskId cannot be null");
        this.attempt = attempt;
        this.task = Objects.requireNonNull(task, "task cannot be null");
        this.timeout = timeout;
        this.timerExecutor = Objects.requireNonNull(timerExecutor, "timerExecutor cannot be null");
    }

    @Override
    public void run() {
        log.debug("Starting attempt {} of task {}", attempt, taskId);
        startTimer();
        try {
            CompletionStage<T> stage = task.execute();
            if (stage == null) {
                throw new IllegalStateException("Task " + taskId + " returned a null stage");
            }
            stage.whenComplete((value, error) -> {
                boolean won = error == null ? outcome.complete(value) : outcome.completeExceptionally(unwrap(error));
                if (!won) {
                    log.warn("Task {} attempt {} settled after its outcome was already decided; ignoring", taskId, attempt);
                }
            });
        } catch (Throwable t) {
            // thrown before a stage existed: the attempt failed synchronously
            outcome.completeExceptionally(t);
        }
    }

    /**
     * Fails the attempt without running it, e.g. when the task executor rejects it.
     */
    void fail(Throwable error) {
        outcome.completeExceptionally(error);
    }

    CompletableFuture<T> outcome() {
        return outcome;
    }

    String getTaskId() {
        return taskId;
    }

    int getAttempt() {
        return attempt;
    }

    private void startTimer() {
        if (timeout == null) {
            return;
        }
        try {
            ScheduledFuture<?> timer = timerExecutor.schedule(() -> {
                if (outcome.completeExceptionally(new TaskTimeoutException(taskId, attempt, timeout))) {
                    log.warn("Task {} attempt {} timed out after {}", taskId, attempt, timeout);
                }
            }, timeout.toMillis(), TimeUnit.MILLISECONDS);
            outcome.whenComplete((value, error) -> timer.cancel(false));
        } catch (RejectedExecutionException e) {
            log.error("Timer executor rejected the timeout of task {} attempt {}; running untimed", taskId, attempt, e);
        }
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
