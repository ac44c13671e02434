package com.sailfish.pool.factory;

import com.sailfish.pool.AsyncTask;

import java.util.Map;

/**
 * Supplies task closures to the pool, keyed by the id each should be submitted under.
 *
 * Implementations could use a Map, a directory listing, or any other mechanism; the pool makes no
 * assumptions about what the tasks do internally.
 */
public interface TaskSource<T> {

    /**
     * Returns the tasks to submit, in the order they should be admitted.
     *
     * @return An ordered view of id to task.
     */
    Map<String, AsyncTask<T>> tasks();
}
