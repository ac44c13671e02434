package com.sailfish.pool.factory;

import com.sailfish.pool.AsyncTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A simple implementation of {@link TaskSource} using an insertion-ordered Map.
 * Tasks are registered before the source is handed to the scheduler.
 */
public class MapTaskSource<T> implements TaskSource<T> {

    private static final Logger log = LoggerFactory.getLogger(MapTaskSource.class);

    private final Map<String, AsyncTask<T>> registry = new LinkedHashMap<>();

    /**
     * Registers a task under the id it will be submitted with.
     *
     * @param id   The unique task id.
     * @param task The task closure.
     * @return this source, for chaining.
     */
    public synchronized MapTaskSource<T> registerTask(String id, AsyncTask<T> task) {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("id cannot be blank");
        }
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        if (registry.containsKey(id)) {
            throw new IllegalArgumentException("A task is already registered under id '" + id + "'");
        }
        log.debug("Registering task '{}'", id);
        registry.put(id, task);
        return this;
    }

    @Override
    public synchronized Map<String, AsyncTask<T>> tasks() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(registry));
    }
}
