package com.sailfish.pool.retry;

import com.sailfish.pool.exception.ConfigurationException;
import com.sailfish.pool.exception.TaskTimeoutException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BoundedRetryPolicyTest {

    private final RuntimeException boom = new RuntimeException("boom");

    @Test
    void retriesWhileAttemptIsBelowMax() {
        BoundedRetryPolicy policy = new BoundedRetryPolicy(3, attempt -> Duration.ofMillis(10L * attempt));

        RetryDecision first = policy.decide(1, boom);
        RetryDecision second = policy.decide(2, boom);
        RetryDecision third = policy.decide(3, boom);

        assertTrue(first.isRetry());
        assertEquals(Duration.ofMillis(10), first.getDelay());
        assertTrue(second.isRetry());
        assertEquals(Duration.ofMillis(20), second.getDelay());
        assertFalse(third.isRetry());
    }

    @Test
    void singleAttemptNeverRetries() {
        BoundedRetryPolicy policy = new BoundedRetryPolicy(1, Backoff.none());
        assertFalse(policy.decide(1, boom).isRetry());
    }

    @Test
    void sameInputGivesSameDecision() {
        BoundedRetryPolicy policy = new BoundedRetryPolicy(4, Backoff.constant(Duration.ofMillis(5)));
        assertEquals(policy.decide(2, new IllegalStateException("a")), policy.decide(2, new IllegalStateException("b")));
    }

    @Test
    void neverRetryOnSkipsClassifiedErrors() {
        BoundedRetryPolicy policy = new BoundedRetryPolicy(5, Backoff.none())
                .neverRetryOn(IllegalArgumentException.class);

        assertFalse(policy.decide(1, new IllegalArgumentException("bad input")).isRetry());
        assertFalse(policy.decide(1, new NumberFormatException("subtype")).isRetry());
        assertTrue(policy.decide(1, new IOException("flaky")).isRetry());
    }

    @Test
    void retryOnlyOnRestrictsToListedErrors() {
        BoundedRetryPolicy policy = new BoundedRetryPolicy(5, Backoff.none())
                .retryOnlyOn(IOException.class, TaskTimeoutException.class);

        assertTrue(policy.decide(1, new IOException("flaky")).isRetry());
        assertTrue(policy.decide(1, new TaskTimeoutException("t", 1, Duration.ofMillis(5))).isRetry());
        assertFalse(policy.decide(1, boom).isRetry());
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThrows(ConfigurationException.class, () -> new BoundedRetryPolicy(0, Backoff.none()));
        assertThrows(NullPointerException.class, () -> new BoundedRetryPolicy(1, null));
    }

    @Test
    void decisionRejectsNegativeDelay() {
        assertThrows(IllegalArgumentException.class, () -> RetryDecision.retryAfter(Duration.ofMillis(-1)));
        assertThrows(IllegalArgumentException.class, () -> Backoff.constant(Duration.ofMillis(-1)));
    }
}
