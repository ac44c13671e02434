package com.sailfish.pool.service.impl;

import com.sailfish.pool.AsyncTask;
import com.sailfish.pool.config.SchedulerConfig;
import com.sailfish.pool.exception.PoolClosedException;
import com.sailfish.pool.exception.TaskCancelledException;
import com.sailfish.pool.exception.TaskException;
import com.sailfish.pool.factory.TaskSource;
import com.sailfish.pool.model.DrainResult;
import com.sailfish.pool.model.PoolStats;
import com.sailfish.pool.model.TaskRecord;
import com.sailfish.pool.model.TaskState;
import com.sailfish.pool.repository.InMemoryResultStore;
import com.sailfish.pool.repository.ResultStore;
import com.sailfish.pool.retry.BoundedRetryPolicy;
import com.sailfish.pool.retry.RetryDecision;
import com.sailfish.pool.retry.RetryPolicy;
import com.sailfish.pool.service.TaskListener;
import com.sailfish.pool.service.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Default implementation of the TaskScheduler.
 * Admits queued tasks in FIFO order while fewer than {@code maxConcurrency} are active, refers
 * failures to the RetryPolicy, records outcomes in the ResultStore and fires the CompletionSignal
 * whenever nothing is queued or active.
 *
 * All bookkeeping (queue, active count, closed flag, live records, signal) is mutated only while
 * holding {@code stateLock}. Task bodies, listeners and drain waiters always run outside it.
 */
public class BoundedRetryScheduler<T> implements TaskScheduler<T> {

    private static final Logger log = LoggerFactory.getLogger(BoundedRetryScheduler.class);

    private final SchedulerConfig config;
    private final ResultStore<T> resultStore;
    private final ExecutorService taskExecutor; // Runs task attempts
    private final ScheduledExecutorService schedulerExecutor; // Backoff and timeout timers
    private final RetryPolicy retryPolicy;
    private final RetryTimer retryTimer;
    private final boolean ownsExecutors;
    private final List<TaskListener<T>> listeners = new CopyOnWriteArrayList<>();

    private final ReentrantLock stateLock = new ReentrantLock();
    // --- guarded by stateLock ---
    private final Deque<String> queue = new ArrayDeque<>();
    private final Map<String, LiveTask<T>> live = new HashMap<>();
    private final CompletionSignal<T> completionSignal;
    private int activeCount;
    private boolean closed;
    private long idSequence;
    private boolean dispatching; // a thread is running the admission loop
    private boolean redispatch; // another pass was requested while it ran

    /**
     * Creates a scheduler with an in-memory store, the config's bounded retry policy and
     * executors owned (and shut down) by this instance.
     */
    public BoundedRetryScheduler(SchedulerConfig config) {
        this(config,
             new InMemoryResultStore<>(),
             Executors.newFixedThreadPool(config.maxConcurrency(), namedThreads("sailfish-pool-worker")),
             Executors.newSingleThreadScheduledExecutor(namedThreads("sailfish-pool-timer")),
             new BoundedRetryPolicy(config.maxAttempts(), config.backoff()),
             true);
    }

    /**
     * Creates a scheduler on injected collaborators. The executors are not shut down by this
     * instance.
     */
    public BoundedRetryScheduler(SchedulerConfig config,
                                 ResultStore<T> resultStore,
                                 ExecutorService taskExecutor,
                                 ScheduledExecutorService schedulerExecutor,
                                 RetryPolicy retryPolicy) {
        this(config, resultStore, taskExecutor, schedulerExecutor, retryPolicy, false);
    }

    private BoundedRetryScheduler(SchedulerConfig config,
                                  ResultStore<T> resultStore,
                                  ExecutorService taskExecutor,
                                  ScheduledExecutorService schedulerExecutor,
                                  RetryPolicy retryPolicy,
                                  boolean ownsExecutors) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.resultStore = Objects.requireNonNull(resultStore, "resultStore cannot be null");
        this.taskExecutor = Objects.requireNonNull(taskExecutor, "taskExecutor cannot be null");
        this.schedulerExecutor = Objects.requireNonNull(schedulerExecutor, "schedulerExecutor cannot be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy cannot be null");
        this.retryTimer = new RetryTimer(schedulerExecutor);
        this.ownsExecutors = ownsExecutors;
        this.completionSignal = new CompletionSignal<>(resultStore.partition());
        log.info("BoundedRetryScheduler initialized with {}", config);
    }

    /**
     * Registers a listener. Listeners are notified in registration order.
     */
    public BoundedRetryScheduler<T> addListener(TaskListener<T> listener) {
        listeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
        return this;
    }

    @PostConstruct
    public void start() {
        log.info("BoundedRetryScheduler started with {} slots and up to {} attempts per task.",
                config.maxConcurrency(), config.maxAttempts());
        if (taskExecutor.isShutdown() || taskExecutor.isTerminated()) {
            log.error("FATAL: Task executor is not operational on startup!");
        }
        if (schedulerExecutor.isShutdown() || schedulerExecutor.isTerminated()) {
            log.error("FATAL: Scheduler executor is not operational on startup!");
        }
        int threads = workerThreadLimit();
        if (threads < config.maxConcurrency()) {
            log.warn("Task executor allows {} threads but maxConcurrency is {}; admitted attempts will wait for a thread.",
                    threads, config.maxConcurrency());
        }
    }

    /**
     * @return The most attempts the task executor can run at once, or {@link Integer#MAX_VALUE} if it
     * does not say.
     */
    int workerThreadLimit() {
        if (taskExecutor instanceof ThreadPoolExecutor) {
            return ((ThreadPoolExecutor) taskExecutor).getMaximumPoolSize();
        }
        return Integer.MAX_VALUE;
    }

    // --- Submission ---

    @Override
    public String submit(AsyncTask<T> task) {
        return submit(null, task, config.taskTimeout());
    }

    @Override
    public String submit(String id, AsyncTask<T> task) {
        return submit(id, task, config.taskTimeout());
    }

    @Override
    public String submit(String id, AsyncTask<T> task, Duration timeout) {
        return enqueue(id, task, timeout).record.getId();
    }

    @Override
    public CompletableFuture<T> submitForResult(String id, AsyncTask<T> task) {
        return enqueue(id, task, config.taskTimeout()).result.copy();
    }

    private LiveTask<T> enqueue(String id, AsyncTask<T> task, Duration timeout) {
        Objects.requireNonNull(task, "task cannot be null");
        if (id != null && id.trim().isEmpty()) {
            throw new IllegalArgumentException("id cannot be blank");
        }
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("timeout must be positive");
        }

        LiveTask<T> entry;
        stateLock.lock();
        try {
            if (closed) {
                throw new PoolClosedException("Pool is closed; task " + (id == null ? "" : id + " ") + "rejected");
            }
            String taskId = id == null ? nextId() : id;
            if (live.containsKey(taskId)) {
                throw new IllegalArgumentException("Task " + taskId + " is already queued or running");
            }
            entry = new LiveTask<>(task, timeout, resultStore.save(TaskRecord.queued(taskId)));
            live.put(taskId, entry);
            queue.addLast(taskId);
            completionSignal.arm();
        } finally {
            stateLock.unlock();
        }

        TaskRecord<T> record = entry.record;
        log.debug("Task {} queued", record.getId());
        notifyListeners(l -> l.onSubmitted(record));
        dispatch();
        return entry;
    }

    @Override
    public List<String> submitAll(TaskSource<T> source) {
        Objects.requireNonNull(source, "source cannot be null");
        List<String> ids = new ArrayList<>();
        for (Map.Entry<String, AsyncTask<T>> entry : source.tasks().entrySet()) {
            ids.add(submit(entry.getKey(), entry.getValue()));
        }
        log.info("Submitted {} tasks from {}", ids.size(), source.getClass().getSimpleName());
        return ids;
    }

    private String nextId() {
        String candidate;
        do {
            candidate = "task-" + (++idSequence);
        } while (live.containsKey(candidate));
        return candidate;
    }

    // --- Dispatch ---

    /**
     * Runs admission passes until no further pass is requested. Only one thread runs the loop at a
     * time; a call made while it runs, from a settlement on the same stack or from another thread,
     * just requests one more pass. The stack depth therefore stays constant however many attempts
     * settle inline.
     */
    private void dispatch() {
        stateLock.lock();
        try {
            if (dispatching) {
                redispatch = true;
                return;
            }
            dispatching = true;
        } finally {
            stateLock.unlock();
        }

        boolean done = false;
        try {
            while (!done) {
                admitAndLaunch();
                stateLock.lock();
                try {
                    if (redispatch) {
                        redispatch = false;
                    } else {
                        dispatching = false;
                        done = true;
                    }
                } finally {
                    stateLock.unlock();
                }
            }
        } finally {
            if (!done) {
                stateLock.lock();
                try {
                    dispatching = false;
                } finally {
                    stateLock.unlock();
                }
            }
        }
    }

    /**
     * Admits queued tasks while slots are free, then checks for drain. Bookkeeping for every
     * admission completes under the lock before any of the admitted attempts is started.
     */
    private void admitAndLaunch() {
        List<TaskAttempt<T>> admitted = new ArrayList<>();
        List<TaskRecord<T>> started = new ArrayList<>();
        DrainResult<T> drained = null;
        Runnable drainTrigger = null;

        stateLock.lock();
        try {
            while (activeCount < config.maxConcurrency() && !queue.isEmpty()) {
                String taskId = queue.pollFirst();
                LiveTask<T> entry = live.get(taskId);
                entry.record = resultStore.save(entry.record.toRunning());
                activeCount++;
                admitted.add(new TaskAttempt<>(taskId, entry.record.getAttempts(), entry.task, entry.timeout, schedulerExecutor));
                started.add(entry.record);
                log.debug("Admitted task {} attempt {} ({} of {} slots in use)",
                        taskId, entry.record.getAttempts(), activeCount, config.maxConcurrency());
            }
            if (activeCount == 0 && queue.isEmpty() && !completionSignal.isDrained()) {
                drained = resultStore.partition();
                drainTrigger = completionSignal.markDrained(drained);
            }
        } finally {
            stateLock.unlock();
        }

        for (int i = 0; i < admitted.size(); i++) {
            TaskRecord<T> record = started.get(i);
            notifyListeners(l -> l.onStarted(record));
            launch(admitted.get(i));
        }
        if (drainTrigger != null) {
            DrainResult<T> result = drained;
            log.info("Pool drained: {} succeeded, {} failed", result.getSucceeded().size(), result.getFailed().size());
            drainTrigger.run();
            notifyListeners(l -> l.onDrained(result));
        }
    }

    private void launch(TaskAttempt<T> attempt) {
        attempt.outcome().whenComplete((value, error) -> settle(attempt, value, error));
        try {
            taskExecutor.execute(attempt);
        } catch (RejectedExecutionException e) {
            log.error("Task executor rejected task {} attempt {}: {}", attempt.getTaskId(), attempt.getAttempt(), e.getMessage());
            attempt.fail(e);
        }
    }

    // --- Settlement ---

    private void settle(TaskAttempt<T> attempt, T value, Throwable error) {
        String taskId = attempt.getTaskId();
        int attemptNo = attempt.getAttempt();
        TaskException failure = error == null ? null : toTaskException(taskId, attemptNo, TaskAttempt.unwrap(error));

        TaskRecord<T> record;
        LiveTask<T> entry;
        Duration retryDelay = null;
        stateLock.lock();
        try {
            entry = live.get(taskId);
            if (entry == null || entry.record.getState() != TaskState.RUNNING || entry.record.getAttempts() != attemptNo) {
                log.warn("Ignoring stale outcome of task {} attempt {}", taskId, attemptNo);
                return;
            }
            if (entry.cancelRequested) {
                record = finish(entry, entry.record.toAbandoned(new TaskCancelledException(taskId, attemptNo)));
            } else if (failure == null) {
                record = finish(entry, entry.record.toSucceeded(value));
            } else {
                RetryDecision decision = decide(taskId, attemptNo, failure);
                if (decision.isRetry() && attemptNo < config.maxAttempts()) {
                    // keeps its slot until requeued
                    entry.record = resultStore.save(entry.record.toFailed(failure));
                    record = entry.record;
                    retryDelay = decision.getDelay();
                } else {
                    record = finish(entry, entry.record.toAbandoned(failure));
                }
            }
        } finally {
            stateLock.unlock();
        }

        if (retryDelay != null) {
            Duration delay = retryDelay;
            log.warn("Task {} failed on attempt {}. Retrying in {}ms: {}",
                    taskId, attemptNo, delay.toMillis(), failure.getCause() == null ? failure.getMessage() : failure.getCause().toString());
            notifyListeners(l -> l.onRetryScheduled(record, delay));
            retryTimer.schedule(taskId, delay, () -> requeue(taskId, attemptNo));
            return;
        }
        if (record.getState() == TaskState.SUCCEEDED) {
            log.info("Task {} succeeded on attempt {}", taskId, attemptNo);
            notifyListeners(l -> l.onSucceeded(record));
        } else {
            log.error("Task {} abandoned after {} attempt(s): {}", taskId, attemptNo,
                    record.getLastError().map(Throwable::getMessage).orElse("unknown error"));
            notifyListeners(l -> l.onAbandoned(record));
        }
        resolve(entry.result, record);
        dispatch();
    }

    private RetryDecision decide(String taskId, int attemptNo, TaskException failure) {
        Throwable cause = failure.getCause() == null ? failure : failure.getCause();
        try {
            RetryDecision decision = retryPolicy.decide(attemptNo, cause);
            return decision == null ? RetryDecision.giveUp() : decision;
        } catch (RuntimeException e) {
            log.error("Retry policy failed for task {} attempt {}; not retrying", taskId, attemptNo, e);
            return RetryDecision.giveUp();
        }
    }

    /**
     * Moves a task that waited out its backoff to the tail of the queue and frees its slot.
     */
    private void requeue(String taskId, int attemptNo) {
        TaskRecord<T> abandoned = null;
        LiveTask<T> entry;
        stateLock.lock();
        try {
            entry = live.get(taskId);
            if (entry == null || entry.record.getState() != TaskState.FAILED || entry.record.getAttempts() != attemptNo) {
                log.warn("Task {} is no longer waiting for retry {}; skipping requeue", taskId, attemptNo + 1);
                return;
            }
            if (entry.cancelRequested) {
                abandoned = finish(entry, entry.record.toAbandoned(new TaskCancelledException(taskId, attemptNo)));
            } else {
                entry.record = resultStore.save(entry.record.toRequeued());
                queue.addLast(taskId);
                activeCount--;
                log.debug("Task {} requeued for attempt {}", taskId, attemptNo + 1);
            }
        } finally {
            stateLock.unlock();
        }
        if (abandoned != null) {
            TaskRecord<T> record = abandoned;
            log.info("Task {} cancelled during backoff", taskId);
            notifyListeners(l -> l.onAbandoned(record));
            resolve(entry.result, record);
        }
        dispatch();
    }

    /**
     * Stores a terminal record, forgets the live entry and releases its slot. Caller holds stateLock.
     */
    private TaskRecord<T> finish(LiveTask<T> entry, TaskRecord<T> terminal) {
        entry.record = resultStore.save(terminal);
        live.remove(terminal.getId());
        activeCount--;
        return terminal;
    }

    /**
     * Completes a per-task future from a terminal record: the value on success, the recorded
     * TaskException otherwise.
     */
    private static <T> void resolve(CompletableFuture<T> result, TaskRecord<T> terminal) {
        if (terminal.getState() == TaskState.SUCCEEDED) {
            result.complete(terminal.getResult().orElse(null));
        } else {
            result.completeExceptionally(terminal.getLastError()
                    .orElseGet(() -> new TaskException(terminal.getId(), terminal.getAttempts(), "Task abandoned", null)));
        }
    }

    private static TaskException toTaskException(String taskId, int attemptNo, Throwable error) {
        if (error instanceof TaskException) {
            return (TaskException) error;
        }
        return new TaskException(taskId, attemptNo, error);
    }

    // --- Control ---

    @Override
    public boolean cancel(String id) {
        TaskRecord<T> abandoned;
        LiveTask<T> entry;
        stateLock.lock();
        try {
            entry = live.get(id);
            if (entry == null) {
                return false;
            }
            if (entry.record.getState() != TaskState.QUEUED) {
                entry.cancelRequested = true;
                log.info("Task {} is {}; its outcome will be recorded as cancelled", id, entry.record.getState());
                return false;
            }
            queue.remove(id);
            abandoned = resultStore.save(entry.record.toAbandoned(new TaskCancelledException(id, entry.record.getAttempts())));
            entry.record = abandoned;
            live.remove(id);
        } finally {
            stateLock.unlock();
        }
        log.info("Task {} cancelled before running", id);
        notifyListeners(l -> l.onAbandoned(abandoned));
        resolve(entry.result, abandoned);
        dispatch();
        return true;
    }

    @Override
    public void close() {
        stateLock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
        } finally {
            stateLock.unlock();
        }
        log.info("Pool closed; no further submissions accepted");
    }

    @Override
    public boolean isClosed() {
        stateLock.lock();
        try {
            return closed;
        } finally {
            stateLock.unlock();
        }
    }

    // --- Queries ---

    @Override
    public PoolStats stats() {
        stateLock.lock();
        try {
            PoolStats stored = resultStore.stats();
            return new PoolStats(queue.size(), activeCount, stored.getSucceeded(), stored.getAbandoned());
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public Optional<TaskRecord<T>> getRecord(String id) {
        return resultStore.findById(id);
    }

    @Override
    public Optional<CompletableFuture<T>> resultOf(String id) {
        stateLock.lock();
        try {
            LiveTask<T> entry = live.get(id);
            if (entry != null) {
                return Optional.of(entry.result.copy());
            }
        } finally {
            stateLock.unlock();
        }
        return resultStore.findById(id)
                .filter(TaskRecord::isTerminal)
                .map(record -> {
                    CompletableFuture<T> result = new CompletableFuture<>();
                    resolve(result, record);
                    return result;
                });
    }

    @Override
    public CompletableFuture<DrainResult<T>> waitForDrain() {
        stateLock.lock();
        try {
            return completionSignal.future().copy();
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public void resetResults() {
        stateLock.lock();
        try {
            resultStore.clearTerminal();
            completionSignal.refresh(resultStore.partition());
        } finally {
            stateLock.unlock();
        }
    }

    // --- Shutdown ---

    @PreDestroy
    public void shutdown() {
        shutdown(config.shutdownTimeout().getSeconds());
    }

    @Override
    public void shutdown(long timeoutSeconds) {
        close();
        if (!ownsExecutors) {
            log.info("Executors are managed externally; leaving them running.");
            return;
        }
        shutdownExecutor("Task Executor", taskExecutor, timeoutSeconds);
        shutdownExecutor("Scheduler Executor", schedulerExecutor, timeoutSeconds);
    }

    /** Helper method to shutdown an executor service */
    private void shutdownExecutor(String name, ExecutorService executor, long timeoutSeconds) {
        PoolStats pending = stats();
        log.info("Shutting down {} with {} queued and {} active tasks...", name, pending.getQueued(), pending.getRunning());
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
                log.warn("{} did not terminate in {} seconds.", name, timeoutSeconds);
                List<Runnable> droppedTasks = executor.shutdownNow();
                log.warn("Forcefully shutting down {}. {} tasks were dropped.", name, droppedTasks.size());
                if (!executor.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
                    log.error("{} did not terminate even after forceful shutdown.", name);
                }
            } else {
                log.info("{} terminated gracefully.", name);
            }
        } catch (InterruptedException ie) {
            log.warn("{} shutdown interrupted. Forcing shutdown now.", name);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // --- Helpers ---

    private void notifyListeners(Consumer<TaskListener<T>> event) {
        for (TaskListener<T> listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Listener {} threw: {}", listener.getClass().getName(), e.getMessage(), e);
            }
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /** Mutable bookkeeping for a task that has not reached a terminal state. Guarded by stateLock. */
    private static final class LiveTask<T> {
        private final AsyncTask<T> task;
        private final Duration timeout;
        private final CompletableFuture<T> result = new CompletableFuture<>(); // completed outside stateLock
        private TaskRecord<T> record;
        private boolean cancelRequested;

        private LiveTask(AsyncTask<T> task, Duration timeout, TaskRecord<T> record) {
            this.task = task;
            this.timeout = timeout;
            this.record = record;
        }
    }
}
