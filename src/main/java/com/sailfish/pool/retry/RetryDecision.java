package com.sailfish.pool.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of a {@link RetryPolicy}: whether to retry and how long to wait before requeueing.
 */
public final class RetryDecision {

    private static final RetryDecision GIVE_UP = new RetryDecision(false, Duration.ZERO);

    private final boolean retry;
    private final Duration delay;

    private RetryDecision(boolean retry, Duration delay) {
        this.retry = retry;
        this.delay = delay;
    }

    public static RetryDecision retryAfter(Duration delay) {
        Objects.requireNonNull(delay, "delay cannot be null");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative");
        }
        return new RetryDecision(true, delay);
    }

    public static RetryDecision giveUp() {
        return GIVE_UP;
    }

    public boolean isRetry() {
        return retry;
    }

    public Duration getDelay() {
        return delay;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RetryDecision that = (RetryDecision) o;
        return retry == that.retry && delay.equals(that.delay);
    }

    @Override
    public int hashCode() {
        return Objects.hash(retry, delay);
    }

    @Override
    public String toString() {
        return retry ? "RetryDecision{retry after " + delay + '}' : "RetryDecision{give up}";
    }
}
