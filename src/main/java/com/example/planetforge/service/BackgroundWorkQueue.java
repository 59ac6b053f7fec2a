package com.example.planetforge.service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded queue with one dedicated consumer thread for work that must not block the caller:
 * durable writes, session hand-off to the evolution engine.
 *
 * Items that fail are re-queued until they run out of attempts, then dropped with a warning.
 * A full queue rejects new items; {@link #submit} reports that to the caller instead of blocking.
 */
@Service
public class BackgroundWorkQueue {

    private static final Logger logger = LoggerFactory.getLogger(BackgroundWorkQueue.class);

    @Value("${app.queue.capacity:1000}")
    private int capacity = 1000;

    @Value("${app.queue.max-attempts:3}")
    private int maxAttempts = 3;

    @Value("${app.queue.retry-backoff-ms:250}")
    private long retryBackoffMs = 250L;

    private volatile BlockingQueue<WorkItem> queue;
    private volatile Thread consumer;
    private volatile boolean running;

    private final AtomicLong submitted = new AtomicLong();
    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong retried = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();

    @PostConstruct
    public synchronized void start() {
        if (running) {
            return;
        }
        ensureQueue();
        running = true;
        consumer = new Thread(this::consumeLoop, "background-work-queue");
        consumer.setDaemon(true);
        consumer.start();
        logger.info("Background work queue started (capacity={}, maxAttempts={})", capacity, maxAttempts);
    }

    @PreDestroy
    public void stop() {
        running = false;
        Thread t = consumer;
        if (t != null) {
            t.interrupt();
            try {
                t.join(TimeUnit.SECONDS.toMillis(2));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        int flushed = drainPending();
        logger.info("Background work queue stopped, flushed {} pending items", flushed);
    }

    /**
     * Queues a task using the configured retry budget.
     *
     * @return false when the queue is full and the task was rejected
     */
    public boolean submit(String description, Runnable task) {
        return submit(description, task, maxAttempts);
    }

    /**
     * Queues a task. {@code attempts} of 1 means fire-and-forget: a failure is logged and the task dropped.
     */
    public boolean submit(String description, Runnable task, int attempts) {
        WorkItem item = new WorkItem(description, task, Math.max(1, attempts));
        boolean accepted = ensureQueue().offer(item);
        if (accepted) {
            submitted.incrementAndGet();
            logger.debug("Queued background work: {}", description);
        } else {
            rejected.incrementAndGet();
            logger.warn("Background work queue full ({}), rejected: {}", capacity, description);
        }
        return accepted;
    }

    /**
     * Runs every queued item on the calling thread, retrying failures immediately.
     * Used on shutdown and by tests that need queued work to have happened.
     *
     * @return number of items taken off the queue
     */
    public int drainPending() {
        BlockingQueue<WorkItem> q = ensureQueue();
        int count = 0;
        WorkItem item;
        while ((item = q.poll()) != null) {
            count++;
            while (!execute(item) && item.remainingAttempts() > 0) {
                retried.incrementAndGet();
            }
        }
        return count;
    }

    public int pendingCount() {
        return ensureQueue().size();
    }

    public Map<String, Object> getStats() {
        return Map.of(
                "capacity", capacity,
                "pending", pendingCount(),
                "submitted", submitted.get(),
                "completed", completed.get(),
                "retried", retried.get(),
                "failed", failed.get(),
                "rejected", rejected.get(),
                "timestamp", Instant.now()
        );
    }

    private void consumeLoop() {
        while (running) {
            WorkItem item;
            try {
                item = queue.poll(500, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (item == null) {
                continue;
            }
            if (!execute(item) && item.remainingAttempts() > 0) {
                retried.incrementAndGet();
                backoff();
                if (!queue.offer(item)) {
                    failed.incrementAndGet();
                    logger.warn("Could not re-queue '{}' for retry, queue full; dropping", item.description());
                }
            }
        }
    }

    /**
     * @return true when the item ran successfully
     */
    private boolean execute(WorkItem item) {
        item.attempt();
        try {
            item.task().run();
            completed.incrementAndGet();
            return true;
        } catch (Exception e) {
            if (item.remainingAttempts() > 0) {
                logger.warn("Background work '{}' failed (attempt {}), will retry: {}",
                        item.description(), item.attempts(), e.getMessage());
            } else {
                failed.incrementAndGet();
                logger.warn("Background work '{}' failed after {} attempts, dropping", item.description(), item.attempts(), e);
            }
            return false;
        }
    }

    private void backoff() {
        try {
            Thread.sleep(retryBackoffMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private BlockingQueue<WorkItem> ensureQueue() {
        BlockingQueue<WorkItem> q = queue;
        if (q == null) {
            synchronized (this) {
                if (queue == null) {
                    queue = new ArrayBlockingQueue<>(Math.max(1, capacity));
                }
                q = queue;
            }
        }
        return q;
    }

    private static final class WorkItem {
        private final String description;
        private final Runnable task;
        private final int maxAttempts;
        private int attempts;

        WorkItem(String description, Runnable task, int maxAttempts) {
            this.description = description;
            this.task = task;
            this.maxAttempts = maxAttempts;
        }

        String description() { return description; }
        Runnable task() { return task; }
        int attempts() { return attempts; }
        void attempt() { attempts++; }
        int remainingAttempts() { return maxAttempts - attempts; }
    }
}
