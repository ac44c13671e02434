package com.sailfish.pool.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Computes the delay to wait before a failed task re-enters the queue.
 */
@FunctionalInterface
public interface Backoff {

    /**
     * @param attempt The number of the attempt that just failed, starting at 1.
     * @return The delay; never null or negative.
     */
    Duration delayFor(int attempt);

    static Backoff none() {
        return attempt -> Duration.ZERO;
    }

    static Backoff constant(Duration delay) {
        Objects.requireNonNull(delay, "delay cannot be null");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative");
        }
        return attempt -> delay;
    }
}
