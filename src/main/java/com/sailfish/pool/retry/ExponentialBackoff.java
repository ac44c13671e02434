package com.sailfish.pool.retry;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * A backoff implementing exponential growth with optional cap and jitter.
 */
public class ExponentialBackoff implements Backoff {

    private final Duration initialDelay;
    private final double multiplier;
    private final Duration maxDelay; // Optional: Cap the maximum delay
    private final boolean addJitter;

    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(1);
    public static final double DEFAULT_MULTIPLIER = 2.0;
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(60);

    /**
     * Creates a default ExponentialBackoff.
     * Initial Delay: 1 second
     * Multiplier: 2.0
     * Max Delay: 60 seconds
     * Jitter: false
     */
    public ExponentialBackoff() {
        this(DEFAULT_INITIAL_DELAY, DEFAULT_MULTIPLIER, DEFAULT_MAX_DELAY, false);
    }

    /**
     * Creates a configurable ExponentialBackoff.
     *
     * @param initialDelay Delay after the first failed attempt.
     * @param multiplier Factor by which the delay increases for each subsequent attempt.
     * @param maxDelay Optional maximum delay cap. Set to null or Duration.ZERO to disable.
     * @param addJitter If true, adds a random variation of up to +/-10% to the delay.
     */
    public ExponentialBackoff(Duration initialDelay, double multiplier, Duration maxDelay, boolean addJitter) {
        if (initialDelay == null || initialDelay.isNegative() || initialDelay.isZero()) throw new IllegalArgumentException("initialDelay must be positive");
        if (multiplier < 1.0) throw new IllegalArgumentException("multiplier must be at least 1.0");

        this.initialDelay = initialDelay;
        this.multiplier = multiplier;
        this.maxDelay = (maxDelay != null && !maxDelay.isNegative() && !maxDelay.isZero()) ? maxDelay : null;
        this.addJitter = addJitter;
    }

    @Override
    public Duration delayFor(int attempt) {
        int exponent = Math.max(0, attempt - 1);
        double raw = initialDelay.toMillis() * Math.pow(multiplier, exponent);
        long delayMillis = raw >= Long.MAX_VALUE ? Long.MAX_VALUE : (long) raw;

        if (maxDelay != null && delayMillis > maxDelay.toMillis()) {
            delayMillis = maxDelay.toMillis();
        }

        if (addJitter && delayMillis > 0) {
            long jitter = (long) (delayMillis * 0.1 * (ThreadLocalRandom.current().nextDouble() * 2 - 1)); // Range [-0.1, 0.1]
            delayMillis = Math.max(1, delayMillis + jitter);
        }
        return Duration.ofMillis(delayMillis);
    }
}
