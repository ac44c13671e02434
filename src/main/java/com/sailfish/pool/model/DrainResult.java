package com.sailfish.pool.model;

import com.sailfish.pool.exception.TaskException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Partition of every terminal task into succeeded (with its value) or failed (with its last error),
 * taken at the moment the pool drained.
 *
 * @param <T> The type of the task results.
 */
public final class DrainResult<T> {

    private final Map<String, T> succeeded;
    private final Map<String, TaskException> failed;

    public DrainResult(Map<String, T> succeeded, Map<String, TaskException> failed) {
        this.succeeded = Collections.unmodifiableMap(new LinkedHashMap<>(succeeded));
        this.failed = Collections.unmodifiableMap(new LinkedHashMap<>(failed));
    }

    public Map<String, T> getSucceeded() {
        return succeeded;
    }

    public Map<String, TaskException> getFailed() {
        return failed;
    }

    public int size() {
        return succeeded.size() + failed.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DrainResult<?> that = (DrainResult<?>) o;
        return succeeded.equals(that.succeeded) && failed.equals(that.failed);
    }

    @Override
    public int hashCode() {
        return Objects.hash(succeeded, failed);
    }

    @Override
    public String toString() {
        return "DrainResult{succeeded=" + succeeded.keySet() + ", failed=" + failed.keySet() + '}';
    }
}
