package com.sailfish.pool.service.impl;

import com.sailfish.pool.model.DrainResult;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CompletionSignalTest {

    private final DrainResult<String> empty = new DrainResult<>(Collections.emptyMap(), Collections.emptyMap());
    private final DrainResult<String> first = new DrainResult<>(Collections.singletonMap("a", "1"), Collections.emptyMap());
    private final DrainResult<String> second = new DrainResult<>(Collections.singletonMap("b", "2"), Collections.emptyMap());

    @Test
    void startsDrainedWithInitialResult() {
        CompletionSignal<String> signal = new CompletionSignal<>(empty);

        assertTrue(signal.isDrained());
        assertSame(empty, signal.future().getNow(null));
    }

    @Test
    void firesOncePerCycleToAllWaiters() {
        CompletionSignal<String> signal = new CompletionSignal<>(empty);
        signal.arm();
        CompletableFuture<DrainResult<String>> w1 = signal.future().copy();
        CompletableFuture<DrainResult<String>> w2 = signal.future().copy();
        assertFalse(w1.isDone());

        Runnable trigger = signal.markDrained(first);
        assertNull(signal.markDrained(second));
        trigger.run();

        assertSame(first, w1.getNow(null));
        assertSame(first, w2.getNow(null));
    }

    @Test
    void armingStartsANewCycleWithoutDisturbingOldWaiters() {
        CompletionSignal<String> signal = new CompletionSignal<>(empty);
        signal.arm();
        CompletableFuture<DrainResult<String>> cycleOne = signal.future();
        signal.markDrained(first).run();

        signal.arm();
        signal.arm();
        CompletableFuture<DrainResult<String>> cycleTwo = signal.future();

        assertNotSame(cycleOne, cycleTwo);
        assertFalse(cycleTwo.isDone());
        signal.markDrained(second).run();
        assertSame(first, cycleOne.getNow(null));
        assertSame(second, cycleTwo.getNow(null));
    }

    @Test
    void triggerRunAfterRearmStillResolvesItsOwnCycle() {
        CompletionSignal<String> signal = new CompletionSignal<>(empty);
        signal.arm();
        CompletableFuture<DrainResult<String>> cycleOne = signal.future();
        Runnable trigger = signal.markDrained(first);

        signal.arm();
        trigger.run();

        assertSame(first, cycleOne.getNow(null));
        assertFalse(signal.future().isDone());
    }

    @Test
    void refreshOnlyAppliesWhileDrained() {
        CompletionSignal<String> signal = new CompletionSignal<>(first);
        signal.refresh(second);
        assertSame(second, signal.future().getNow(null));

        signal.arm();
        signal.refresh(first);
        assertFalse(signal.future().isDone());
    }
}
