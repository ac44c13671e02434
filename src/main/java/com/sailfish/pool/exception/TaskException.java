package com.sailfish.pool.exception;

/**
 * Wraps the failure of a single task attempt.
 * Never thrown to the submitter; recorded on the task record and reported in drain results.
 */
public class TaskException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String taskId;
    private final int attempt;

    public TaskException(String taskId, int attempt, String message, Throwable cause) {
        super(message, cause);
        this.taskId = taskId;
        this.attempt = attempt;
    }

    public TaskException(String taskId, int attempt, Throwable cause) {
        this(taskId, attempt, "Task " + taskId + " failed on attempt " + attempt + ": "
                + (cause == null ? "unknown error" : cause.getMessage()), cause);
    }

    public String getTaskId() {
        return taskId;
    }

    public int getAttempt() {
        return attempt;
    }
}
