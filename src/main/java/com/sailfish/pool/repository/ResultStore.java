package com.sailfish.pool.repository;

import com.sailfish.pool.model.DrainResult;
import com.sailfish.pool.model.PoolStats;
import com.sailfish.pool.model.TaskRecord;

import java.util.Optional;

/**
 * Keyed storage of task record snapshots.
 * Implementations must be safe for readers on any thread while the scheduler writes.
 *
 * @param <T> The type of task results.
 */
public interface ResultStore<T> {

    /**
     * Saves the latest snapshot of a record, replacing any previous snapshot with the same id.
     *
     * @param record The snapshot to store.
     * @return The stored snapshot.
     */
    TaskRecord<T> save(TaskRecord<T> record);

    /**
     * Finds the latest snapshot of a task.
     *
     * @param id The task id.
     * @return An Optional containing the snapshot if known, empty otherwise.
     */
    Optional<TaskRecord<T>> findById(String id);

    /**
     * Counts snapshots by state. Records waiting out a retry backoff are counted as running.
     */
    PoolStats stats();

    /**
     * Partitions the terminal records into succeeded and failed. Live records are not included.
     */
    DrainResult<T> partition();

    /**
     * Removes all terminal records. Live records are kept.
     *
     * @return The number of records removed.
     */
    int clearTerminal();
}
