package com.catalog.picklist.service;

import com.catalog.picklist.dto.MismatchInput;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded queue between the request path and the mismatch table.
 *
 * Observations are flushed when the queue reaches the flush size (on the
 * {@code mismatchFlushExecutor}), on a fixed timer, and once more at shutdown. Only one
 * flush runs at a time. Each item is written in its own transaction, so items that were
 * already written are never counted twice. A failed item goes to the back of the queue and
 * the flush moves on. Items that fail while others are written count a failed attempt and are
 * dropped with an ERROR log after {@code max-attempts}. A run of consecutive failures is taken
 * as a database outage: the flush stops and no attempts are counted.
 */
@Component
public class MismatchWriteBuffer {

    private static final Logger logger = LoggerFactory.getLogger(MismatchWriteBuffer.class);

    static final int DEFAULT_MAX_ATTEMPTS = 5;
    static final int MAX_CONSECUTIVE_FAILURES = 3;

    private final BlockingQueue<Pending> queue;
    private final MismatchUpsertStore upsertStore;
    private final TaskExecutor flushExecutor;
    private final int flushSize;
    private final int maxAttempts;
    private final AtomicBoolean flushing = new AtomicBoolean(false);
    private final AtomicLong dropped = new AtomicLong();
    private volatile boolean shuttingDown;

    @Autowired
    public MismatchWriteBuffer(MismatchUpsertStore upsertStore,
                               @Qualifier("mismatchFlushExecutor") TaskExecutor flushExecutor,
                               @Value("${app.mismatch.buffer.capacity:5000}") int capacity,
                               @Value("${app.mismatch.buffer.flush-size:50}") int flushSize,
                               @Value("${app.mismatch.buffer.max-attempts:5}") int maxAttempts) {
        this.upsertStore = upsertStore;
        this.flushExecutor = flushExecutor;
        this.queue = new LinkedBlockingQueue<>(Math.max(1, capacity));
        this.flushSize = Math.max(1, flushSize);
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    public MismatchWriteBuffer(MismatchUpsertStore upsertStore, TaskExecutor flushExecutor, int capacity, int flushSize) {
        this(upsertStore, flushExecutor, capacity, flushSize, DEFAULT_MAX_ATTEMPTS);
    }

    /**
     * Adds an observation without blocking on the database. When the queue is full a synchronous
     * flush makes room and the offer is retried once.
     *
     * @return false when the observation could not be buffered (logged at ERROR)
     */
    public boolean enqueue(MismatchInput input) {
        if (queue.offer(new Pending(input, 0))) {
            if (queue.size() >= flushSize) {
                dispatchFlush();
            }
            return true;
        }
        logger.warn("Mismatch buffer full ({} items); flushing synchronously", queue.size());
        flush();
        if (queue.offer(new Pending(input, 0))) {
            return true;
        }
        dropped.incrementAndGet();
        logger.error("Mismatch buffer still full after flush; lost observation {}", input.key());
        return false;
    }

    @Scheduled(fixedDelayString = "${app.mismatch.buffer.flush-interval-ms:10000}",
            initialDelayString = "${app.mismatch.buffer.flush-interval-ms:10000}")
    public void scheduledFlush() {
        if (shuttingDown) {
            return;
        }
        flush();
    }

    /**
     * Writes everything currently queued.
     *
     * @return number of observations written; 0 when the queue was empty or another flush was running
     */
    public int flush() {
        if (!flushing.compareAndSet(false, true)) {
            logger.debug("Mismatch flush already in progress; skipping.");
            return 0;
        }
        try {
            return drain();
        } finally {
            flushing.set(false);
        }
    }

    public int pendingCount() {
        return queue.size();
    }

    /**
     * Observations given up on since startup: rejected by a full queue or failing too often.
     */
    public long droppedCount() {
        return dropped.get();
    }

    @PreDestroy
    public void shutdown() {
        shuttingDown = true;
        int written = flush();
        logger.info("Final mismatch flush wrote {} item(s); {} left unwritten", written, queue.size());
    }

    private int drain() {
        List<Pending> batch = new ArrayList<>(queue.size());
        queue.drainTo(batch);
        if (batch.isEmpty()) {
            return 0;
        }
        int written = 0;
        int consecutiveFailures = 0;
        List<Pending> failed = new ArrayList<>();
        List<Pending> untried = List.of();
        for (int i = 0; i < batch.size(); i++) {
            Pending pending = batch.get(i);
            try {
                upsertStore.upsert(pending.input());
                written++;
                consecutiveFailures = 0;
            } catch (RuntimeException e) {
                failed.add(pending);
                consecutiveFailures++;
                logger.warn("Failed to persist mismatch {} (attempt {}): {}",
                        pending.input().key(), pending.attempts() + 1, e.getMessage());
                if (consecutiveFailures >= MAX_CONSECUTIVE_FAILURES && i + 1 < batch.size()) {
                    untried = batch.subList(i + 1, batch.size());
                    logger.error("{} consecutive mismatch writes failed; postponing {} item(s) to the next flush",
                            consecutiveFailures, untried.size(), e);
                    break;
                }
            }
        }
        requeue(untried);
        // Failures only count against an item when the database took other writes in the same flush.
        requeueFailed(failed, written > 0 && untried.isEmpty());
        logger.info("Flushed {} of {} buffered mismatch(es)", written, batch.size());
        return written;
    }

    private void requeueFailed(List<Pending> failed, boolean countAttempt) {
        List<Pending> retry = new ArrayList<>(failed.size());
        for (Pending pending : failed) {
            Pending next = countAttempt ? pending.nextAttempt() : pending;
            if (next.attempts() >= maxAttempts) {
                dropped.incrementAndGet();
                logger.error("Dropping mismatch {} after {} failed attempt(s)", next.input().key(), next.attempts());
            } else {
                retry.add(next);
            }
        }
        requeue(retry);
    }

    private void requeue(List<Pending> items) {
        for (Pending pending : items) {
            if (!queue.offer(pending)) {
                dropped.incrementAndGet();
                logger.error("Mismatch buffer full while requeueing; lost observation {}", pending.input().key());
            }
        }
    }

    private void dispatchFlush() {
        try {
            flushExecutor.execute(this::flush);
        } catch (TaskRejectedException e) {
            logger.debug("Size-triggered flush not dispatched: {}", e.getMessage());
        }
    }

    private record Pending(MismatchInput input, int attempts) {

        Pending nextAttempt() {
            return new Pending(input, attempts + 1);
        }
    }
}
