package com.sailfish.pool.service.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Waits out a retry backoff and then hands the task back to the scheduler for requeueing.
 */
class RetryTimer {

    private static final Logger log = LoggerFactory.getLogger(RetryTimer.class);

    private final ScheduledExecutorService schedulerExecutor;

    RetryTimer(ScheduledExecutorService schedulerExecutor) {
        this.schedulerExecutor = Objects.requireNonNull(schedulerExecutor, "schedulerExecutor cannot be null");
    }

    /**
     * Runs {@code requeue} after {@code delay}. If the executor is no longer accepting work the
     * requeue runs immediately on the calling thread, so the task is never stranded in backoff.
     */
    void schedule(String taskId, Duration delay, Runnable requeue) {
        long delayMillis = Math.max(0L, delay.toMillis());
        try {
            schedulerExecutor.schedule(() -> {
                try {
                    requeue.run();
                } catch (RuntimeException e) {
                    log.error("Failed to requeue task {} after backoff: {}", taskId, e.getMessage(), e);
                }
            }, delayMillis, TimeUnit.MILLISECONDS);
            log.debug("Task {} will be requeued in {}ms", taskId, delayMillis);
        } catch (RejectedExecutionException e) {
            log.error("Scheduler executor rejected the backoff of task {}. Requeueing immediately.", taskId, e);
            requeue.run();
        }
    }
}
