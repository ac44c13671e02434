package com.sailfish.pool.exception;

/**
 * Thrown by {@code submit} once the pool has been closed.
 */
public class PoolClosedException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public PoolClosedException(String message) {
        super(message);
    }
}
