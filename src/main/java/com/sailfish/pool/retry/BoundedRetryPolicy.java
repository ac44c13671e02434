package com.sailfish.pool.retry;

import com.sailfish.pool.exception.ConfigurationException;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Default policy: retry while {@code attempt < maxAttempts}, waiting {@code backoff.delayFor(attempt)}.
 * All errors are retryable unless a classifier says otherwise.
 */
public class BoundedRetryPolicy implements RetryPolicy {

    private final int maxAttempts;
    private final Backoff backoff;
    private final Predicate<Throwable> retryable;

    public BoundedRetryPolicy(int maxAttempts, Backoff backoff) {
        this(maxAttempts, backoff, error -> true);
    }

    public BoundedRetryPolicy(int maxAttempts, Backoff backoff, Predicate<Throwable> retryable) {
        if (maxAttempts < 1) {
            throw new ConfigurationException("maxAttempts must be at least 1, was " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.backoff = Objects.requireNonNull(backoff, "backoff cannot be null");
        this.retryable = Objects.requireNonNull(retryable, "retryable cannot be null");
    }

    /**
     * Returns a copy that only retries errors assignable to one of the given types.
     */
    @SafeVarargs
    public final BoundedRetryPolicy retryOnlyOn(Class<? extends Throwable>... types) {
        List<Class<? extends Throwable>> allowed = Arrays.asList(types);
        return new BoundedRetryPolicy(maxAttempts, backoff,
                retryable.and(error -> allowed.stream().anyMatch(type -> type.isInstance(error))));
    }

    /**
     * Returns a copy that never retries errors assignable to one of the given types.
     */
    @SafeVarargs
    public final BoundedRetryPolicy neverRetryOn(Class<? extends Throwable>... types) {
        List<Class<? extends Throwable>> denied = Arrays.asList(types);
        return new BoundedRetryPolicy(maxAttempts, backoff,
                retryable.and(error -> denied.stream().noneMatch(type -> type.isInstance(error))));
    }

    @Override
    public RetryDecision decide(int attempt, Throwable error) {
        if (attempt >= maxAttempts || !retryable.test(error)) {
            return RetryDecision.giveUp();
        }
        Duration delay = backoff.delayFor(attempt);
        return RetryDecision.retryAfter(delay == null ? Duration.ZERO : delay);
    }
}
