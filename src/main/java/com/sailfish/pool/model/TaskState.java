package com.sailfish.pool.model;

/**
 * Represents the possible states of a task inside the pool.
 */
public enum TaskState {
    /**
     * Task is waiting in the admission queue.
     */
    QUEUED,
    /**
     * Task occupies a concurrency slot and its attempt is in flight.
     */
    RUNNING,
    /**
     * Task execution completed successfully.
     */
    SUCCEEDED,
    /**
     * The last attempt failed and the task is waiting out its backoff before being requeued.
     */
    FAILED,
    /**
     * Task failed permanently: attempts exhausted, the policy declined, or it was cancelled.
     */
    ABANDONED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == ABANDONED;
    }
}
