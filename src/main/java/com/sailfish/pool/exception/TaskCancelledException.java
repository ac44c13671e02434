package com.sailfish.pool.exception;

/**
 * Recorded on a task that was abandoned through {@code cancel}.
 */
public class TaskCancelledException extends TaskException {

    private static final long serialVersionUID = 1L;

    public TaskCancelledException(String taskId, int attempt) {
        super(taskId, attempt, "Task " + taskId + " was cancelled", null);
    }
}
