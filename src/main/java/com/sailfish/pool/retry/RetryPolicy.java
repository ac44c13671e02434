package com.sailfish.pool.retry;

/**
 * Decides whether a failed attempt should be retried.
 * Implementations must be deterministic in the retry flag: the same attempt number and
 * error class always produce the same decision.
 */
@FunctionalInterface
public interface RetryPolicy {

    /**
     * @param attempt The number of the attempt that just failed, starting at 1.
     * @param error The failure raised by the task, or a timeout.
     * @return The decision; never null.
     */
    RetryDecision decide(int attempt, Throwable error);
}
