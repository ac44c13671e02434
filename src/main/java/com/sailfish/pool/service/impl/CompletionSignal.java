package com.sailfish.pool.service.impl;

import com.sailfish.pool.model.DrainResult;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Re-armable "pool drained" signal.
 *
 * <p>
 *  NOTE: not thread-safe. The owning scheduler calls every method while holding its state lock,
 *  and runs the trigger returned by {@link #markDrained(DrainResult)} after releasing it.
 * </p>
 */
public final class CompletionSignal<T> {

    private CompletableFuture<DrainResult<T>> current;
    private boolean drained;

    /**
     * Creates a signal in the drained state, resolved with {@code initial}.
     */
    public CompletionSignal(DrainResult<T> initial) {
        this.current = CompletableFuture.completedFuture(Objects.requireNonNull(initial, "initial cannot be null"));
        this.drained = true;
    }

    public boolean isDrained() {
        return drained;
    }

    /**
     * Leaves the drained state. Waiters obtained from now on wait for the next drain;
     * waiters of the previous cycle keep their result.
     */
    public void arm() {
        if (drained) {
            drained = false;
            current = new CompletableFuture<>();
        }
    }

    /**
     * Enters the drained state for this cycle.
     *
     * @return A trigger resolving this cycle's waiters with {@code snapshot}, or null if the cycle
     * has already drained.
     */
    public Runnable markDrained(DrainResult<T> snapshot) {
        Objects.requireNonNull(snapshot, "snapshot cannot be null");
        if (drained) {
            return null;
        }
        drained = true;
        CompletableFuture<DrainResult<T>> cycle = current;
        return () -> cycle.complete(snapshot);
    }

    /**
     * Replaces the result seen by later waiters while drained, e.g. after results were reset.
     * Has no effect while armed.
     */
    public void refresh(DrainResult<T> snapshot) {
        if (drained) {
            current = CompletableFuture.completedFuture(Objects.requireNonNull(snapshot, "snapshot cannot be null"));
        }
    }

    /**
     * @return The future of the current cycle. Callers hand out copies, never this instance.
     */
    public CompletableFuture<DrainResult<T>> future() {
        return current;
    }
}
