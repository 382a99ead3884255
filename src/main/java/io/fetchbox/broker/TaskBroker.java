package io.fetchbox.broker;

import io.fetchbox.model.QueueEntry;
import io.fetchbox.model.Task;
import io.fetchbox.storage.DurableQueue;
import io.fetchbox.worker.PipelineOutcome;
import io.fetchbox.worker.Worker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;

/**
 * Single owner of dispatch. Leases entries from the durable queue on behalf of
 * a worker and places them in that worker's inbox, round-robin, skipping full
 * inboxes. When every inbox is full nothing more is leased, so excess work stays
 * pending in the queue.
 *
 * <p>While running, the dispatcher renews the lease of every entry a worker
 * holds (in its inbox or in flight) every third of the lease TTL, so the
 * periodic expiry scan only reclaims leases whose holder is gone.
 */
public final class TaskBroker {
    private static final Logger log = LoggerFactory.getLogger(TaskBroker.class);

    private final DurableQueue queue;
    private final List<Worker> workers;
    private final LongSupplier clock;
    private final long pollIntervalMs;
    private final long recoveryScanIntervalMs;
    private final AtomicBoolean leasing;
    private final Object wakeup;
    private final List<Thread> workerThreads;
    private Thread dispatcherThread;
    private int cursor = 0;
    private long lastRecoveryScanMs = 0L;
    private long lastRenewalMs = 0L;

    public TaskBroker(DurableQueue queue,
                      List<Worker> workers,
                      LongSupplier clock,
                      long pollIntervalMs,
                      long recoveryScanIntervalMs) {
        if (workers == null || workers.isEmpty()) {
            throw new IllegalArgumentException("At least one worker is required");
        }
        this.queue = queue;
        this.workers = List.copyOf(workers);
        this.clock = clock;
        this.pollIntervalMs = Math.max(1L, pollIntervalMs);
        this.recoveryScanIntervalMs = Math.max(1L, recoveryScanIntervalMs);
        this.leasing = new AtomicBoolean(false);
        this.wakeup = new Object();
        this.workerThreads = new ArrayList<>();
    }

    /**
     * @throws io.fetchbox.storage.QueueFullException when the queue is at capacity
     */
    public long enqueue(Task task) {
        long sequence = queue.enqueue(task, clock.getAsLong());
        synchronized (wakeup) {
            wakeup.notifyAll();
        }
        return sequence;
    }

    public List<Worker> workers() {
        return workers;
    }

    public boolean leasing() {
        return leasing.get();
    }

    /**
     * Fills inboxes until either the queue has nothing eligible or every inbox is
     * full. Not thread-safe; called from the dispatcher thread or by a caller
     * driving dispatch by hand.
     */
    public DispatchOutcome dispatchOnce(long nowMs) {
        int dispatched = 0;
        while (true) {
            Worker target = nextWithCapacity();
            if (target == null) {
                return new DispatchOutcome(dispatched, true);
            }
            Optional<QueueEntry> leased = queue.leaseNext(target.workerId(), nowMs);
            if (leased.isEmpty()) {
                return new DispatchOutcome(dispatched, false);
            }
            QueueEntry entry = leased.get();
            if (!target.offer(entry)) {
                // Worker stopped between the capacity check and the hand-off.
                queue.release(entry.sequence(), target.workerId(), entry.leaseEpoch(), clock.getAsLong());
                return new DispatchOutcome(dispatched, true);
            }
            log.debug("Dispatched seq={} to {}", entry.sequence(), target.workerId());
            dispatched++;
        }
    }

    /**
     * Processes every entry visible at the time of the call on the calling
     * thread, spreading leases across worker ids. Entries requeued with a backoff
     * become visible later and are not picked up again by this call.
     */
    public List<PipelineOutcome> drainVisible(int maxEntries) {
        List<PipelineOutcome> outcomes = new ArrayList<>();
        int limit = Math.max(1, maxEntries);
        while (outcomes.size() < limit) {
            Worker worker = workers.get(Math.floorMod(cursor++, workers.size()));
            Optional<QueueEntry> leased = queue.leaseNext(worker.workerId(), clock.getAsLong());
            if (leased.isEmpty()) {
                break;
            }
            PipelineOutcome outcome = worker.runOne(leased.get());
            if (outcome != null) {
                outcomes.add(outcome);
            }
        }
        return outcomes;
    }

    public synchronized void start() {
        if (leasing.get()) {
            return;
        }
        queue.recoverExpiredLeases(clock.getAsLong());
        lastRecoveryScanMs = clock.getAsLong();
        lastRenewalMs = lastRecoveryScanMs;
        leasing.set(true);
        for (Worker worker : workers) {
            Thread thread = new Thread(worker, "fetchbox-" + worker.workerId());
            thread.setDaemon(true);
            thread.start();
            workerThreads.add(thread);
        }
        dispatcherThread = new Thread(this::dispatchLoop, "fetchbox-dispatcher");
        dispatcherThread.setDaemon(true);
        dispatcherThread.start();
        log.info("Broker started with {} workers", workers.size());
    }

    /**
     * Stops leasing, hands never-started inbox entries back to the queue, then
     * waits up to {@code graceMs} for in-flight entries. Whatever is still running
     * after that is abandoned; renewal stopped with the dispatcher, so its lease
     * expires and is recovered on next start.
     */
    public synchronized ShutdownOutcome shutdown(long graceMs) {
        leasing.set(false);
        synchronized (wakeup) {
            wakeup.notifyAll();
        }
        joinQuietly(dispatcherThread, pollIntervalMs * 10L);
        int released = 0;
        for (Worker worker : workers) {
            worker.stop();
            for (QueueEntry entry : worker.drainUnstarted()) {
                if (queue.release(entry.sequence(), worker.workerId(), entry.leaseEpoch(), clock.getAsLong())) {
                    released++;
                }
            }
        }
        long deadline = System.currentTimeMillis() + Math.max(0L, graceMs);
        List<String> abandoned = new ArrayList<>();
        for (int i = 0; i < workerThreads.size(); i++) {
            Thread thread = workerThreads.get(i);
            joinQuietly(thread, Math.max(1L, deadline - System.currentTimeMillis()));
            if (thread.isAlive()) {
                abandoned.add(workers.get(i).workerId());
            }
        }
        workerThreads.clear();
        dispatcherThread = null;
        if (!abandoned.isEmpty()) {
            log.warn("Shutdown grace {}ms elapsed; abandoning in-flight work on {}", graceMs, abandoned);
        }
        log.info("Broker stopped: released={} abandoned={}", released, abandoned.size());
        return new ShutdownOutcome(released, abandoned);
    }

    private void dispatchLoop() {
        while (leasing.get()) {
            long now = clock.getAsLong();
            try {
                if (now - lastRenewalMs >= renewalIntervalMs()) {
                    lastRenewalMs = now;
                    renewHeldLeases(now);
                }
                if (now - lastRecoveryScanMs >= recoveryScanIntervalMs) {
                    lastRecoveryScanMs = now;
                    queue.recoverExpiredLeases(now);
                }
                DispatchOutcome outcome = dispatchOnce(now);
                if (outcome.dispatched() > 0 && !outcome.backpressured()) {
                    continue;
                }
            } catch (RuntimeException e) {
                log.error("Dispatch cycle failed", e);
            }
            synchronized (wakeup) {
                if (!leasing.get()) {
                    break;
                }
                try {
                    wakeup.wait(pollIntervalMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
    }

    /**
     * Extends the lease of every entry held by a worker. Returns how many leases
     * were still held and got extended.
     */
    public int renewHeldLeases(long nowMs) {
        int renewed = 0;
        for (Worker worker : workers) {
            for (QueueEntry entry : worker.heldLeases()) {
                if (queue.renewLease(entry.sequence(), worker.workerId(), entry.leaseEpoch(), nowMs)) {
                    renewed++;
                } else {
                    log.debug("Lease on seq={} no longer held by {}", entry.sequence(), worker.workerId());
                }
            }
        }
        return renewed;
    }

    private long renewalIntervalMs() {
        return Math.max(1L, queue.leaseTtlMs() / 3L);
    }

    private Worker nextWithCapacity() {
        for (int i = 0; i < workers.size(); i++) {
            Worker candidate = workers.get(Math.floorMod(cursor, workers.size()));
            cursor++;
            if (candidate.remainingCapacity() > 0) {
                return candidate;
            }
        }
        return null;
    }

    private static void joinQuietly(Thread thread, long timeoutMs) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeoutMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public record DispatchOutcome(int dispatched, boolean backpressured) {
    }

    public record ShutdownOutcome(int released, List<String> abandonedWorkers) {
    }
}
