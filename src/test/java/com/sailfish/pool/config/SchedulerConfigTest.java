package com.sailfish.pool.config;

import com.sailfish.pool.exception.ConfigurationException;
import com.sailfish.pool.retry.Backoff;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SchedulerConfigTest {

    @Test
    void configureRejectsBoundsBelowOne() {
        assertThrows(ConfigurationException.class, () -> SchedulerConfig.configure(0, 3, Backoff.none()));
        assertThrows(ConfigurationException.class, () -> SchedulerConfig.configure(2, 0, Backoff.none()));
        assertThrows(ConfigurationException.class, () -> SchedulerConfig.configure(-1, -1, Backoff.none()));
        assertThrows(ConfigurationException.class, () -> SchedulerConfig.configure(2, 2, null));
    }

    @Test
    void configurationErrorIsAnIllegalArgument() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> SchedulerConfig.configure(0, 1, Backoff.none()));
        assertTrue(e.getMessage().contains("maxConcurrency"));
    }

    @Test
    void withTaskTimeoutValidatesAndCopies() {
        SchedulerConfig base = SchedulerConfig.configure(2, 3, Backoff.none());
        SchedulerConfig timed = base.withTaskTimeout(Duration.ofMillis(100));

        assertNull(base.taskTimeout());
        assertEquals(Duration.ofMillis(100), timed.taskTimeout());
        assertEquals(2, timed.maxConcurrency());
        assertEquals(3, timed.maxAttempts());
        assertThrows(ConfigurationException.class, () -> base.withTaskTimeout(Duration.ZERO));
    }

    @Test
    void emptyPropertiesYieldDefaults() {
        SchedulerConfig config = SchedulerConfig.fromProperties(new Properties());

        assertEquals(SchedulerConfig.DEFAULT_MAX_CONCURRENCY, config.maxConcurrency());
        assertEquals(SchedulerConfig.DEFAULT_MAX_ATTEMPTS, config.maxAttempts());
        assertEquals(Duration.ofSeconds(1), config.backoff().delayFor(1));
        assertEquals(Duration.ofSeconds(2), config.backoff().delayFor(2));
        assertNull(config.taskTimeout());
        assertEquals(SchedulerConfig.DEFAULT_SHUTDOWN_TIMEOUT, config.shutdownTimeout());
    }

    @Test
    void loadsClasspathResource() {
        SchedulerConfig config = SchedulerConfig.load("sailfish-pool-test.properties");

        assertEquals(4, config.maxConcurrency());
        assertEquals(5, config.maxAttempts());
        assertEquals(Duration.ofMillis(200), config.backoff().delayFor(1));
        assertEquals(Duration.ofMillis(600), config.backoff().delayFor(2));
        assertEquals(Duration.ofMillis(1000), config.backoff().delayFor(3));
        assertEquals(Duration.ofMillis(2500), config.taskTimeout());
    }

    @Test
    void missingResourceYieldsDefaults() {
        SchedulerConfig config = SchedulerConfig.load("does-not-exist.properties");
        assertEquals(SchedulerConfig.DEFAULT_MAX_CONCURRENCY, config.maxConcurrency());
    }

    @Test
    void defaultsMatchTheDefaultResourceFallback() {
        SchedulerConfig defaults = SchedulerConfig.defaults();
        SchedulerConfig loaded = SchedulerConfig.load();

        assertEquals(defaults.maxConcurrency(), loaded.maxConcurrency());
        assertEquals(defaults.maxAttempts(), loaded.maxAttempts());
        assertEquals(defaults.backoff().delayFor(3), loaded.backoff().delayFor(3));
    }

    @Test
    void zeroInitialBackoffMeansImmediateRetry() {
        Properties props = new Properties();
        props.setProperty(SchedulerConfig.KEY_BACKOFF_INITIAL_MS, "0");
        assertEquals(Duration.ZERO, SchedulerConfig.fromProperties(props).backoff().delayFor(4));
    }

    @Test
    void malformedPropertiesAreConfigurationErrors() {
        Properties notANumber = new Properties();
        notANumber.setProperty(SchedulerConfig.KEY_MAX_CONCURRENCY, "many");
        assertThrows(ConfigurationException.class, () -> SchedulerConfig.fromProperties(notANumber));

        Properties zero = new Properties();
        zero.setProperty(SchedulerConfig.KEY_MAX_ATTEMPTS, "0");
        assertThrows(ConfigurationException.class, () -> SchedulerConfig.fromProperties(zero));

        Properties negative = new Properties();
        negative.setProperty(SchedulerConfig.KEY_TASK_TIMEOUT_MS, "-5");
        assertThrows(ConfigurationException.class, () -> SchedulerConfig.fromProperties(negative));

        Properties badMultiplier = new Properties();
        badMultiplier.setProperty(SchedulerConfig.KEY_BACKOFF_MULTIPLIER, "0.5");
        assertThrows(ConfigurationException.class, () -> SchedulerConfig.fromProperties(badMultiplier));
    }
}
