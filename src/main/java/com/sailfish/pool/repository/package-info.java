/**
 * Defines the result storage layer, {@link com.sailfish.pool.repository.ResultStore},
 * responsible for keeping task record snapshots and aggregate statistics.
 */
package com.sailfish.pool.repository;
