package com.sailfish.pool.exception;

import java.time.Duration;

/**
 * Recorded when an attempt did not settle within its timeout.
 * Handled exactly like any other failure by the retry policy.
 */
public class TaskTimeoutException extends TaskException {

    private static final long serialVersionUID = 1L;

    private final Duration timeout;

    public TaskTimeoutException(String taskId, int attempt, Duration timeout) {
        super(taskId, attempt, "Task " + taskId + " timed out after " + timeout.toMillis()
                + "ms on attempt " + attempt, null);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
