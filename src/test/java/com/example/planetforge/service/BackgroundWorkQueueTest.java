package com.example.planetforge.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class BackgroundWorkQueueTest {

    private BackgroundWorkQueue queue;

    @BeforeEach
    void setUp() {
        queue = new BackgroundWorkQueue();
        ReflectionTestUtils.setField(queue, "retryBackoffMs", 10L);
    }

    @AfterEach
    void tearDown() {
        queue.stop();
    }

    @Test
    void testDrainPending_RunsTasksInOrder() {
        // Given
        List<String> ran = new CopyOnWriteArrayList<>();
        queue.submit("first", () -> ran.add("first"));
        queue.submit("second", () -> ran.add("second"));

        // When
        int drained = queue.drainPending();

        // Then
        assertEquals(2, drained);
        assertEquals(List.of("first", "second"), ran);
        assertEquals(0, queue.pendingCount());
    }

    @Test
    void testDrainPending_RetriesUntilSuccess() {
        // Given
        AtomicInteger calls = new AtomicInteger();
        queue.submit("flaky", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new IllegalStateException("not yet");
            }
        });

        // When
        queue.drainPending();

        // Then
        assertEquals(3, calls.get());
        Map<String, Object> stats = queue.getStats();
        assertEquals(1L, stats.get("completed"));
        assertEquals(2L, stats.get("retried"));
        assertEquals(0L, stats.get("failed"));
    }

    @Test
    void testDrainPending_DropsAfterMaxAttempts() {
        // Given
        AtomicInteger calls = new AtomicInteger();
        queue.submit("doomed", () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("always");
        });

        // When
        queue.drainPending();

        // Then
        assertEquals(3, calls.get());
        assertEquals(1L, queue.getStats().get("failed"));
    }

    @Test
    void testSubmit_SingleAttemptIsNotRetried() {
        // Given
        AtomicInteger calls = new AtomicInteger();
        queue.submit("once", () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("cache down");
        }, 1);

        // When
        queue.drainPending();

        // Then
        assertEquals(1, calls.get());
    }

    @Test
    void testSubmit_RejectsWhenFull() {
        // Given
        ReflectionTestUtils.setField(queue, "capacity", 1);

        // When
        boolean first = queue.submit("a", () -> { });
        boolean second = queue.submit("b", () -> { });

        // Then
        assertTrue(first);
        assertFalse(second);
        assertEquals(1L, queue.getStats().get("rejected"));
    }

    @Test
    void testStart_ConsumerRunsTasksInBackground() throws InterruptedException {
        // Given
        queue.start();
        CountDownLatch done = new CountDownLatch(2);

        // When
        queue.submit("one", done::countDown);
        queue.submit("two", done::countDown);

        // Then
        assertTrue(done.await(5, TimeUnit.SECONDS));
    }

    @Test
    void testStart_ConsumerRetriesFailedTask() throws InterruptedException {
        // Given
        queue.start();
        CountDownLatch succeeded = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();

        // When
        queue.submit("flaky", () -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("first attempt fails");
            }
            succeeded.countDown();
        });

        // Then
        assertTrue(succeeded.await(5, TimeUnit.SECONDS));
        assertEquals(2, calls.get());
    }
}
