package com.sailfish.pool.service.impl;

import com.sailfish.pool.exception.TaskTimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TaskAttemptTest {

    private final ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor();

    @AfterEach
    void tearDown() {
        timer.shutdownNow();
    }

    @Test
    void completesWithTaskValue() throws Exception {
        TaskAttempt<String> attempt = new TaskAttempt<>("a", 1, () -> CompletableFuture.completedFuture("ok"), null, timer);
        attempt.run();
        assertEquals("ok", attempt.outcome().get(1, TimeUnit.SECONDS));
    }

    @Test
    void synchronousThrowFailsTheAttempt() {
        IOException boom = new IOException("boom");
        TaskAttempt<String> attempt = new TaskAttempt<>("a", 1, () -> { throw boom; }, null, timer);
        attempt.run();

        ExecutionException e = assertThrows(ExecutionException.class, () -> attempt.outcome().get(1, TimeUnit.SECONDS));
        assertSame(boom, e.getCause());
    }

    @Test
    void nullStageFailsTheAttempt() {
        TaskAttempt<String> attempt = new TaskAttempt<>("a", 1, () -> null, null, timer);
        attempt.run();

        ExecutionException e = assertThrows(ExecutionException.class, () -> attempt.outcome().get(1, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    void timerWinsAgainstAHangingTask() {
        TaskAttempt<String> attempt = new TaskAttempt<>("a", 2, CompletableFuture::new, Duration.ofMillis(30), timer);
        attempt.run();

        ExecutionException e = assertThrows(ExecutionException.class, () -> attempt.outcome().get(2, TimeUnit.SECONDS));
        TaskTimeoutException timeout = assertInstanceOf(TaskTimeoutException.class, e.getCause());
        assertEquals("a", timeout.getTaskId());
        assertEquals(2, timeout.getAttempt());
    }

    @Test
    void lateCompletionIsIgnored() throws Exception {
        CompletableFuture<String> body = new CompletableFuture<>();
        TaskAttempt<String> attempt = new TaskAttempt<>("a", 1, () -> body, Duration.ofMillis(20), timer);
        attempt.run();
        assertThrows(ExecutionException.class, () -> attempt.outcome().get(2, TimeUnit.SECONDS));

        body.complete("too late");
        assertInstanceOf(TaskTimeoutException.class, attempt.outcome().handle((v, err) -> err).get());
    }

    @Test
    void unwrapStripsCompletionWrappers() {
        IllegalStateException root = new IllegalStateException("root");
        assertSame(root, TaskAttempt.unwrap(new CompletionException(new ExecutionException(root))));
        assertSame(root, TaskAttempt.unwrap(root));
    }
}
