package com.sailfish.pool.model;

import java.util.Objects;

/**
 * Point-in-time counts of records by state. FAILED records waiting out a backoff still hold
 * their slot and are counted as running.
 */
public final class PoolStats {

    private final int queued;
    private final int running;
    private final int succeeded;
    private final int abandoned;

    public PoolStats(int queued, int running, int succeeded, int abandoned) {
        this.queued = queued;
        this.running = running;
        this.succeeded = succeeded;
        this.abandoned = abandoned;
    }

    public int getQueued() {
        return queued;
    }

    public int getRunning() {
        return running;
    }

    public int getSucceeded() {
        return succeeded;
    }

    public int getAbandoned() {
        return abandoned;
    }

    public int getTotal() {
        return queued + running + succeeded + abandoned;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PoolStats that = (PoolStats) o;
        return queued == that.queued && running == that.running
                && succeeded == that.succeeded && abandoned == that.abandoned;
    }

    @Override
    public int hashCode() {
        return Objects.hash(queued, running, succeeded, abandoned);
    }

    @Override
    public String toString() {
        return "PoolStats{queued=" + queued + ", running=" + running + ", succeeded=" + succeeded
                + ", abandoned=" + abandoned + ", total=" + getTotal() + '}';
    }
}
