package com.evg.replay;

import com.evg.buffer.RetryBuffer;
import com.evg.buffer.RetryBufferEntry;
import com.evg.buffer.RetryBufferListener;
import com.evg.common.TransientIOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Re-applies buffered writes in sequence order.
 * <p>
 * A pass drains every ready entry and commits them one by one. When an entry fails, that entry and every
 * later entry of the same repository are requeued, so within a repository a later sequence is never
 * committed ahead of an earlier one. Other repositories keep replaying.
 * <p>
 * The worker thread wakes on every buffer push and otherwise every {@code idleWaitMs}, which is how requeued
 * entries get retried. {@link #shutdown(long)} takes effect between passes; a commit in progress always
 * completes.
 */
public class ReplayCoordinator implements RetryBufferListener, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ReplayCoordinator.class);
    private static final Object SIGNAL = new Object();

    private final RetryBuffer buffer;
    private final ReplayTarget target;
    private final long idleWaitMs;

    private final BlockingQueue<Object> signals = new LinkedBlockingQueue<>();
    private final Object passLock = new Object();
    private final AtomicLong totalApplied = new AtomicLong();
    private final AtomicLong totalRequeued = new AtomicLong();

    private volatile ReplayState state = ReplayState.IDLE;
    private volatile boolean running = false;
    private volatile ReplayStats lastStats = ReplayStats.EMPTY;
    private Thread worker;

    public ReplayCoordinator(RetryBuffer buffer, ReplayTarget target, long idleWaitMs) {
        this.buffer = Objects.requireNonNull(buffer, "buffer");
        this.target = Objects.requireNonNull(target, "target");
        if (idleWaitMs < 1) throw new IllegalArgumentException("idleWaitMs must be >= 1");
        this.idleWaitMs = idleWaitMs;
    }

    /** Starts the worker and schedules an immediate pass for entries restored before start. */
    public synchronized void start() {
        if (running) return;
        running = true;
        worker = new Thread(this::runLoop, "evg-replay");
        worker.setDaemon(true);
        worker.start();
        signals.offer(SIGNAL);
        logger.info("Replay coordinator started (idleWait={}ms, buffered={})", idleWaitMs, buffer.size());
    }

    @Override
    public void onPush(RetryBufferEntry entry) {
        signals.offer(SIGNAL);
    }

    private void runLoop() {
        while (running) {
            try {
                signals.poll(idleWaitMs, TimeUnit.MILLISECONDS);
                signals.clear();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Replay worker interrupted, stopping");
                break;
            }
            if (!running) break;
            try {
                drainOnce();
            } catch (RuntimeException e) {
                logger.error("Replay pass aborted", e);
            }
        }
        logger.info("Replay worker stopped");
    }

    /**
     * Runs one pass synchronously. Passes never overlap, whether started by the worker or by a caller.
     */
    public ReplayStats drainOnce() {
        synchronized (passLock) {
            state = ReplayState.DRAINING;
            List<RetryBufferEntry> batch = buffer.drainReady();
            if (batch.isEmpty()) {
                state = ReplayState.IDLE;
                return ReplayStats.EMPTY;
            }

            int applied = 0;
            int requeued = 0;
            long maxSequence = 0L;
            Set<String> blocked = new HashSet<>();
            for (RetryBufferEntry entry : batch) {
                if (blocked.contains(entry.getRepoId())) {
                    buffer.requeue(entry);
                    requeued++;
                    continue;
                }
                state = ReplayState.COMMITTING;
                try {
                    target.replay(entry);
                } catch (RuntimeException e) {
                    state = ReplayState.REQUEUING;
                    if (e instanceof TransientIOException) {
                        logger.warn("Replay of seq={} repo={} failed (attempt {}): {}", entry.getSequence(),
                                entry.getRepoId(), entry.getAttemptCount() + 1, e.getMessage());
                    } else {
                        logger.error("Replay of seq={} repo={} failed", entry.getSequence(), entry.getRepoId(), e);
                    }
                    blocked.add(entry.getRepoId());
                    buffer.requeue(entry);
                    requeued++;
                    continue;
                }
                buffer.complete(entry);
                applied++;
                maxSequence = Math.max(maxSequence, entry.getSequence());
            }

            ReplayStats stats = new ReplayStats(applied, requeued, maxSequence);
            totalApplied.addAndGet(applied);
            totalRequeued.addAndGet(requeued);
            lastStats = stats;
            state = ReplayState.IDLE;
            if (requeued > 0) {
                logger.warn("Replay pass incomplete: {}", stats);
            } else {
                logger.info("Replay pass complete: {}", stats);
            }
            return stats;
        }
    }

    /**
     * Stops the worker after its current pass.
     *
     * @return true if the worker stopped within {@code timeoutMs}
     */
    public boolean shutdown(long timeoutMs) {
        Thread w;
        synchronized (this) {
            running = false;
            w = worker;
        }
        signals.offer(SIGNAL);
        if (w == null) return true;
        try {
            w.join(Math.max(1L, timeoutMs));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        boolean stopped = !w.isAlive();
        if (!stopped) {
            logger.warn("Replay worker still committing after {}ms", timeoutMs);
        }
        return stopped;
    }

    public ReplayState state() {
        return state;
    }

    public boolean isRunning() {
        Thread w = worker;
        return running && w != null && w.isAlive();
    }

    public ReplayStats lastStats() {
        return lastStats;
    }

    public long totalApplied() {
        return totalApplied.get();
    }

    public long totalRequeued() {
        return totalRequeued.get();
    }

    @Override
    public void close() {
        shutdown(TimeUnit.SECONDS.toMillis(10));
    }
}
