package com.sailfish.pool.repository;

import com.sailfish.pool.exception.TaskException;
import com.sailfish.pool.model.DrainResult;
import com.sailfish.pool.model.PoolStats;
import com.sailfish.pool.model.TaskRecord;
import com.sailfish.pool.model.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Heap-backed {@link ResultStore}. Records are immutable, so returning them from under the
 * monitor is safe; the monitor only guards the map itself.
 */
public class InMemoryResultStore<T> implements ResultStore<T> {

    private static final Logger log = LoggerFactory.getLogger(InMemoryResultStore.class);

    private final Map<String, TaskRecord<T>> records = new LinkedHashMap<>();

    @Override
    public synchronized TaskRecord<T> save(TaskRecord<T> record) {
        Objects.requireNonNull(record, "record cannot be null");
        TaskRecord<T> previous = records.get(record.getId());
        if (previous != null && previous.isTerminal() && !record.isTerminal()) {
            // a resubmitted id starts over at the end of the iteration order
            records.remove(record.getId());
        }
        records.put(record.getId(), record);
        log.debug("Saved record {} in state {} (attempts={})", record.getId(), record.getState(), record.getAttempts());
        return record;
    }

    @Override
    public synchronized Optional<TaskRecord<T>> findById(String id) {
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public synchronized PoolStats stats() {
        int queued = 0;
        int running = 0;
        int succeeded = 0;
        int abandoned = 0;
        for (TaskRecord<T> record : records.values()) {
            switch (record.getState()) {
                case QUEUED:
                    queued++;
                    break;
                case RUNNING:
                case FAILED:
                    running++;
                    break;
                case SUCCEEDED:
                    succeeded++;
                    break;
                case ABANDONED:
                    abandoned++;
                    break;
                default:
                    throw new IllegalStateException("Unexpected state: " + record.getState());
            }
        }
        return new PoolStats(queued, running, succeeded, abandoned);
    }

    @Override
    public synchronized DrainResult<T> partition() {
        Map<String, T> succeeded = new LinkedHashMap<>();
        Map<String, TaskException> failed = new LinkedHashMap<>();
        for (TaskRecord<T> record : records.values()) {
            if (record.getState() == TaskState.SUCCEEDED) {
                succeeded.put(record.getId(), record.getResult().orElse(null));
            } else if (record.getState() == TaskState.ABANDONED) {
                failed.put(record.getId(), record.getLastError().orElse(null));
            }
        }
        return new DrainResult<>(succeeded, failed);
    }

    @Override
    public synchronized int clearTerminal() {
        int removed = 0;
        Iterator<TaskRecord<T>> it = records.values().iterator();
        while (it.hasNext()) {
            if (it.next().isTerminal()) {
                it.remove();
                removed++;
            }
        }
        log.info("Cleared {} terminal records", removed);
        return removed;
    }
}
