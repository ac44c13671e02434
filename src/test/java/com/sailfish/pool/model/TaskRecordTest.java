package com.sailfish.pool.model;

import com.sailfish.pool.exception.TaskException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskRecordTest {

    @Test
    void retryCycleKeepsIdentityAndCountsStarts() {
        TaskException failure = new TaskException("a", 1, new RuntimeException("boom"));

        TaskRecord<String> queued = TaskRecord.queued("a");
        TaskRecord<String> failed = queued.toRunning().toFailed(failure);
        TaskRecord<String> done = failed.toRequeued().toRunning().toSucceeded("ok");

        assertEquals(0, queued.getAttempts());
        assertEquals(TaskState.FAILED, failed.getState());
        assertEquals(1, failed.getAttempts());
        assertEquals("a", done.getId());
        assertEquals(2, done.getAttempts());
        assertEquals("ok", done.getResult().orElseThrow());
        assertSame(failure, done.getLastError().orElseThrow());
        assertTrue(done.isTerminal());
    }

    @Test
    void transitionsAreImmutable() {
        TaskRecord<String> queued = TaskRecord.queued("a");
        queued.toRunning();
        assertEquals(TaskState.QUEUED, queued.getState());
        assertFalse(queued.getResult().isPresent());
        assertFalse(queued.getLastError().isPresent());
    }

    @Test
    void illegalTransitionsAreRejected() {
        TaskException failure = new TaskException("a", 1, new RuntimeException("boom"));
        TaskRecord<String> queued = TaskRecord.queued("a");
        TaskRecord<String> succeeded = queued.toRunning().toSucceeded("ok");

        assertThrows(IllegalStateException.class, () -> queued.toSucceeded("x"));
        assertThrows(IllegalStateException.class, () -> queued.toFailed(failure));
        assertThrows(IllegalStateException.class, succeeded::toRunning);
        assertThrows(IllegalStateException.class, () -> succeeded.toAbandoned(failure));
    }

    @Test
    void queuedRecordMayBeAbandonedDirectly() {
        TaskRecord<String> abandoned = TaskRecord.<String>queued("a")
                .toAbandoned(new TaskException("a", 0, new RuntimeException("cancelled")));
        assertEquals(TaskState.ABANDONED, abandoned.getState());
        assertEquals(0, abandoned.getAttempts());
    }
}
