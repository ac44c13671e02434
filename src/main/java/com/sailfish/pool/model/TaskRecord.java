package com.sailfish.pool.model;

import com.sailfish.pool.exception.TaskException;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of a task's lifecycle. Every transition returns a new instance,
 * so a reader holding a record never observes a half-updated one.
 *
 * @param <T> The type of the task result.
 */
public final class TaskRecord<T> {

    private final String id;
    private final TaskState state;
    private final int attempts; // number of execution starts
    private final T result; // present iff SUCCEEDED
    private final TaskException lastError; // present iff ever failed
    private final LocalDateTime createdAt;
    private final LocalDateTime updatedAt;

    private TaskRecord(String id, TaskState state, int attempts, T result, TaskException lastError,
                       LocalDateTime createdAt, LocalDateTime updatedAt) {
        this.id = id;
        this.state = state;
        this.attempts = attempts;
        this.result = result;
        this.lastError = lastError;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public static <T> TaskRecord<T> queued(String id) {
        Objects.requireNonNull(id, "id cannot be null");
        LocalDateTime now = LocalDateTime.now();
        return new TaskRecord<>(id, TaskState.QUEUED, 0, null, null, now, now);
    }

    // --- Transitions ---

    public TaskRecord<T> toRunning() {
        requireState(TaskState.QUEUED);
        return copy(TaskState.RUNNING, attempts + 1, null, lastError);
    }

    public TaskRecord<T> toSucceeded(T value) {
        requireState(TaskState.RUNNING);
        return copy(TaskState.SUCCEEDED, attempts, value, lastError);
    }

    public TaskRecord<T> toFailed(TaskException error) {
        requireState(TaskState.RUNNING);
        return copy(TaskState.FAILED, attempts, null, Objects.requireNonNull(error, "error cannot be null"));
    }

    public TaskRecord<T> toRequeued() {
        requireState(TaskState.FAILED);
        return copy(TaskState.QUEUED, attempts, null, lastError);
    }

    /**
     * Abandons the task. Allowed from any non-terminal state.
     */
    public TaskRecord<T> toAbandoned(TaskException error) {
        if (state.isTerminal()) {
            throw new IllegalStateException("Task " + id + " is already terminal: " + state);
        }
        return copy(TaskState.ABANDONED, attempts, null, Objects.requireNonNull(error, "error cannot be null"));
    }

    private TaskRecord<T> copy(TaskState newState, int newAttempts, T newResult, TaskException newError) {
        return new TaskRecord<>(id, newState, newAttempts, newResult, newError, createdAt, LocalDateTime.now());
    }

    private void requireState(TaskState expected) {
        if (state != expected) {
            throw new IllegalStateException("Task " + id + " is " + state + ", expected " + expected);
        }
    }

    // --- Getters ---

    public String getId() {
        return id;
    }

    public TaskState getState() {
        return state;
    }

    public int getAttempts() {
        return attempts;
    }

    public Optional<T> getResult() {
        return Optional.ofNullable(result);
    }

    public Optional<TaskException> getLastError() {
        return Optional.ofNullable(lastError);
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    // --- equals, hashCode, toString ---

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TaskRecord<?> that = (TaskRecord<?>) o;
        return attempts == that.attempts
                && Objects.equals(id, that.id)
                && state == that.state
                && Objects.equals(result, that.result)
                && Objects.equals(lastError, that.lastError);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, state, attempts);
    }

    @Override
    public String toString() {
        return "TaskRecord{" +
               "id='" + id + '\'' +
               ", state=" + state +
               ", attempts=" + attempts +
               ", lastError=" + (lastError == null ? null : lastError.getMessage()) +
               ", createdAt=" + createdAt +
               ", updatedAt=" + updatedAt +
               '}';
    }
}
