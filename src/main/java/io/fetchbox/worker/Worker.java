package io.fetchbox.worker;

import io.fetchbox.model.QueueEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * A single execution slot: takes leased entries from its bounded inbox one at a
 * time, waits for a rate-limit token, and runs the pipeline.
 */
public final class Worker implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(Worker.class);

    private final String workerId;
    private final BlockingQueue<QueueEntry> inbox;
    private final TokenBucketRateLimiter rateLimiter;
    private final TaskPipeline pipeline;
    private final long pollIntervalMs;
    private final Consumer<PipelineOutcome> outcomeListener;
    private final AtomicBoolean running;
    private final AtomicBoolean busy;
    private final AtomicLong processed;
    private final AtomicReference<QueueEntry> inFlight;

    public Worker(String workerId,
                  int inboxCapacity,
                  TokenBucketRateLimiter rateLimiter,
                  TaskPipeline pipeline,
                  long pollIntervalMs,
                  Consumer<PipelineOutcome> outcomeListener) {
        this.workerId = workerId;
        this.inbox = new ArrayBlockingQueue<>(Math.max(1, inboxCapacity));
        this.rateLimiter = rateLimiter;
        this.pipeline = pipeline;
        this.pollIntervalMs = Math.max(1L, pollIntervalMs);
        this.outcomeListener = outcomeListener == null ? outcome -> { } : outcomeListener;
        this.running = new AtomicBoolean(true);
        this.busy = new AtomicBoolean(false);
        this.processed = new AtomicLong();
        this.inFlight = new AtomicReference<>();
    }

    public String workerId() {
        return workerId;
    }

    /**
     * Non-blocking hand-off from the broker.
     *
     * @return false when the inbox is full or the worker is stopping
     */
    public boolean offer(QueueEntry entry) {
        if (!running.get()) {
            return false;
        }
        return inbox.offer(entry);
    }

    public int inboxSize() {
        return inbox.size();
    }

    public int remainingCapacity() {
        return inbox.remainingCapacity();
    }

    public boolean busy() {
        return busy.get();
    }

    public long processed() {
        return processed.get();
    }

    /**
     * Entries whose lease this worker currently holds: the one being run, if
     * any, followed by those still waiting in the inbox.
     */
    public List<QueueEntry> heldLeases() {
        List<QueueEntry> out = new ArrayList<>(inbox.size() + 1);
        QueueEntry current = inFlight.get();
        if (current != null) {
            out.add(current);
        }
        out.addAll(inbox);
        return out;
    }

    @Override
    public void run() {
        log.debug("Worker {} started", workerId);
        while (running.get()) {
            QueueEntry entry;
            try {
                entry = inbox.poll(pollIntervalMs, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (entry == null) {
                continue;
            }
            inFlight.set(entry);
            busy.set(true);
            try {
                if (!rateLimiter.disabled()) {
                    rateLimiter.acquire();
                }
                runOne(entry);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Worker {} interrupted before starting seq={}; lease left to expire", workerId, entry.sequence());
                break;
            } finally {
                busy.set(false);
                inFlight.set(null);
            }
        }
        log.debug("Worker {} stopped", workerId);
    }

    /**
     * Runs one entry on the calling thread. Exceptions escaping the pipeline
     * (the queue itself failing) are logged; the lease is then left to expire.
     */
    public PipelineOutcome runOne(QueueEntry entry) {
        try {
            PipelineOutcome outcome = pipeline.process(entry, workerId);
            processed.incrementAndGet();
            if (outcome.disposition() == PipelineOutcome.Disposition.STALE_LEASE) {
                log.warn("Worker {} lost lease on seq={} before reporting", workerId, entry.sequence());
            }
            outcomeListener.accept(outcome);
            return outcome;
        } catch (RuntimeException e) {
            log.error("Worker {} failed to report seq={}", workerId, entry.sequence(), e);
            return null;
        }
    }

    public void stop() {
        running.set(false);
    }

    /**
     * Removes every entry that has not started yet.
     */
    public List<QueueEntry> drainUnstarted() {
        List<QueueEntry> out = new ArrayList<>();
        inbox.drainTo(out);
        return out;
    }
}
