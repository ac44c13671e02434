package com.sailfish.pool.config;

import com.sailfish.pool.exception.ConfigurationException;
import com.sailfish.pool.retry.Backoff;
import com.sailfish.pool.retry.ExponentialBackoff;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

public final class SchedulerConfig {
    public static final int DEFAULT_MAX_CONCURRENCY = 3;
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);
    public static final String DEFAULT_RESOURCE = "sailfish-pool.properties";

    public static final String KEY_MAX_CONCURRENCY = "pool.max-concurrency";
    public static final String KEY_MAX_ATTEMPTS = "pool.max-attempts";
    public static final String KEY_BACKOFF_INITIAL_MS = "pool.backoff.initial-ms";
    public static final String KEY_BACKOFF_MULTIPLIER = "pool.backoff.multiplier";
    public static final String KEY_BACKOFF_MAX_MS = "pool.backoff.max-ms";
    public static final String KEY_TASK_TIMEOUT_MS = "pool.task-timeout-ms";
    public static final String KEY_SHUTDOWN_TIMEOUT_MS = "pool.shutdown-timeout-ms";

    private final int maxConcurrency;
    private final int maxAttempts;
    private final Backoff backoff;
    private final Duration taskTimeout; // null = no timeout
    private final Duration shutdownTimeout;

    private SchedulerConfig(int maxConcurrency, int maxAttempts, Backoff backoff,
                            Duration taskTimeout, Duration shutdownTimeout) {
        if (maxConcurrency < 1) {
            throw new ConfigurationException("maxConcurrency must be at least 1, was " + maxConcurrency);
        }
        if (maxAttempts < 1) {
            throw new ConfigurationException("maxAttempts must be at least 1, was " + maxAttempts);
        }
        if (backoff == null) {
            throw new ConfigurationException("backoff cannot be null");
        }
        if (taskTimeout != null && (taskTimeout.isNegative() || taskTimeout.isZero())) {
            throw new ConfigurationException("taskTimeout must be positive, was " + taskTimeout);
        }
        if (shutdownTimeout == null || shutdownTimeout.isNegative()) {
            throw new ConfigurationException("shutdownTimeout must not be negative");
        }
        this.maxConcurrency = maxConcurrency;
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
        this.taskTimeout = taskTimeout;
        this.shutdownTimeout = shutdownTimeout;
    }

    public static SchedulerConfig defaults() {
        return configure(DEFAULT_MAX_CONCURRENCY, DEFAULT_MAX_ATTEMPTS, new ExponentialBackoff());
    }

    /**
     * @throws ConfigurationException if either bound is below 1 or backoff is null.
     */
    public static SchedulerConfig configure(int maxConcurrency, int maxAttempts, Backoff backoff) {
        return new SchedulerConfig(maxConcurrency, maxAttempts, backoff, null, DEFAULT_SHUTDOWN_TIMEOUT);
    }

    public SchedulerConfig withTaskTimeout(Duration timeout) {
        return new SchedulerConfig(maxConcurrency, maxAttempts, backoff, timeout, shutdownTimeout);
    }

    public SchedulerConfig withShutdownTimeout(Duration timeout) {
        return new SchedulerConfig(maxConcurrency, maxAttempts, backoff, taskTimeout, timeout);
    }

    /**
     * Loads {@value #DEFAULT_RESOURCE} from the classpath, falling back to the defaults.
     */
    public static SchedulerConfig load() {
        return load(DEFAULT_RESOURCE);
    }

    /**
     * Loads a properties file from the classpath. A missing resource yields the defaults.
     */
    public static SchedulerConfig load(String resource) {
        Properties props = new Properties();
        try (InputStream in = SchedulerConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read scheduler configuration: " + resource, e);
        }
        return fromProperties(props);
    }

    public static SchedulerConfig fromProperties(Properties props) {
        Objects.requireNonNull(props, "props cannot be null");
        int maxConcurrency = intValue(props, KEY_MAX_CONCURRENCY, DEFAULT_MAX_CONCURRENCY);
        int maxAttempts = intValue(props, KEY_MAX_ATTEMPTS, DEFAULT_MAX_ATTEMPTS);

        long initialMs = longValue(props, KEY_BACKOFF_INITIAL_MS, ExponentialBackoff.DEFAULT_INITIAL_DELAY.toMillis());
        double multiplier = doubleValue(props, KEY_BACKOFF_MULTIPLIER, ExponentialBackoff.DEFAULT_MULTIPLIER);
        long maxMs = longValue(props, KEY_BACKOFF_MAX_MS, ExponentialBackoff.DEFAULT_MAX_DELAY.toMillis());
        Backoff backoff;
        try {
            backoff = initialMs == 0L
                    ? Backoff.none()
                    : new ExponentialBackoff(Duration.ofMillis(initialMs), multiplier, Duration.ofMillis(maxMs), false);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid backoff settings: " + e.getMessage(), e);
        }

        long timeoutMs = longValue(props, KEY_TASK_TIMEOUT_MS, 0L);
        long shutdownMs = longValue(props, KEY_SHUTDOWN_TIMEOUT_MS, DEFAULT_SHUTDOWN_TIMEOUT.toMillis());
        return new SchedulerConfig(maxConcurrency, maxAttempts, backoff,
                timeoutMs > 0L ? Duration.ofMillis(timeoutMs) : null,
                Duration.ofMillis(shutdownMs));
    }

    private static String raw(Properties props, String key) {
        String value = props.getProperty(key);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static int intValue(Properties props, String key, int fallback) {
        String value = raw(props, key);
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid integer for " + key + ": " + value, e);
        }
    }

    private static long longValue(Properties props, String key, long fallback) {
        String value = raw(props, key);
        if (value == null) {
            return fallback;
        }
        try {
            long parsed = Long.parseLong(value);
            if (parsed < 0L) {
                throw new ConfigurationException("Negative value for " + key + ": " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid number for " + key + ": " + value, e);
        }
    }

    private static double doubleValue(Properties props, String key, double fallback) {
        String value = raw(props, key);
        if (value == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid number for " + key + ": " + value, e);
        }
    }

    public int maxConcurrency() {
        return maxConcurrency;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public Backoff backoff() {
        return backoff;
    }

    /**
     * @return The default per-attempt timeout, or null when attempts are not timed.
     */
    public Duration taskTimeout() {
        return taskTimeout;
    }

    public Duration shutdownTimeout() {
        return shutdownTimeout;
    }

    @Override
    public String toString() {
        return "SchedulerConfig{maxConcurrency=" + maxConcurrency + ", maxAttempts=" + maxAttempts
                + ", taskTimeout=" + taskTimeout + ", shutdownTimeout=" + shutdownTimeout + '}';
    }
}
