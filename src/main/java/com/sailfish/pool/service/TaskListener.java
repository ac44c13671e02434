package com.sailfish.pool.service;

import com.sailfish.pool.model.DrainResult;
import com.sailfish.pool.model.TaskRecord;

import java.time.Duration;

/**
 * Listener for task lifecycle events. All methods have default no-op implementations.
 * Listeners are invoked in registration order, outside the scheduler's critical sections.
 * Exceptions thrown by listener methods are logged and otherwise ignored.
 */
public interface TaskListener<T> {

    /**
     * Called when a task has been queued.
     */
    default void onSubmitted(TaskRecord<T> record) {}

    /**
     * Called when a task has been admitted and its attempt is about to start.
     */
    default void onStarted(TaskRecord<T> record) {}

    default void onSucceeded(TaskRecord<T> record) {}

    /**
     * Called when a failed attempt will be retried after {@code delay}.
     */
    default void onRetryScheduled(TaskRecord<T> record, Duration delay) {}

    /**
     * Called when a task is abandoned: attempts exhausted, policy declined, or cancelled.
     */
    default void onAbandoned(TaskRecord<T> record) {}

    /**
     * Called once per drain cycle, after waiters have been resolved.
     */
    default void onDrained(DrainResult<T> result) {}
}
