package io.fetchbox.runtime;

import io.fetchbox.broker.TaskBroker;
import io.fetchbox.config.FetchBoxConfig;
import io.fetchbox.config.FetchBoxSettings;
import io.fetchbox.config.SettingsLoader;
import io.fetchbox.model.DeadLetterEntry;
import io.fetchbox.model.QueueEntry;
import io.fetchbox.model.QueueStatus;
import io.fetchbox.model.ResolvedProxyPool;
import io.fetchbox.model.Task;
import io.fetchbox.proxy.ProxyResolver;
import io.fetchbox.retry.BackoffEngine;
import io.fetchbox.storage.Database;
import io.fetchbox.storage.DeadLetterStore;
import io.fetchbox.storage.DurableQueue;
import io.fetchbox.storage.QueueFullException;
import io.fetchbox.worker.Downloader;
import io.fetchbox.worker.HttpDownloader;
import io.fetchbox.worker.JsonlLedger;
import io.fetchbox.worker.Ledger;
import io.fetchbox.worker.LocalObjectStorage;
import io.fetchbox.worker.ObjectStorage;
import io.fetchbox.worker.PipelineOutcome;
import io.fetchbox.worker.TaskPipeline;
import io.fetchbox.worker.TokenBucketRateLimiter;
import io.fetchbox.worker.Worker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Composition root: owns the database, settings, queue, dead-letter store and
 * collaborators, and builds brokers from the current settings.
 */
public final class FetchBoxRuntime {
    private static final Logger log = LoggerFactory.getLogger(FetchBoxRuntime.class);

    private final FetchBoxConfig config;
    private final Database database;
    private final SettingsLoader settingsLoader;
    private final DeadLetterStore deadLetterStore;
    private final DurableQueue queue;
    private final ProxyResolver proxyResolver;
    private final BackoffEngine backoffEngine;
    private final LongSupplier clock;
    private final ObjectStorage storage;
    private final Ledger ledger;
    private volatile Downloader downloader;
    private volatile long lastPruneAtMs;

    public FetchBoxRuntime(FetchBoxConfig config) {
        this(config, null, null, null, new BackoffEngine(), System::currentTimeMillis);
    }

    /**
     * Collaborators left {@code null} get the defaults: {@link HttpDownloader} built
     * from settings on {@link #init()}, {@link LocalObjectStorage} under
     * {@code objects/}, {@link JsonlLedger} under {@code ledger/}.
     */
    public FetchBoxRuntime(FetchBoxConfig config,
                           Downloader downloader,
                           ObjectStorage storage,
                           Ledger ledger,
                           BackoffEngine backoffEngine,
                           LongSupplier clock) {
        this.config = config;
        this.database = new Database(config);
        this.settingsLoader = new SettingsLoader(config.settingsFile());
        this.deadLetterStore = new DeadLetterStore(database);
        FetchBoxSettings defaults = settingsLoader.current();
        this.queue = new DurableQueue(database, deadLetterStore, defaults.queueCapacity(), defaults.leaseTtlMs());
        this.proxyResolver = new ProxyResolver(defaults.proxyPools());
        this.backoffEngine = backoffEngine;
        this.clock = clock;
        this.downloader = downloader;
        this.storage = storage == null ? new LocalObjectStorage(config.objectsDir()) : storage;
        this.ledger = ledger == null ? new JsonlLedger(config.ledgerDir()) : ledger;
        this.lastPruneAtMs = 0L;
    }

    public void init() {
        database.init();
        settingsLoader.load();
        applySettings(settingsLoader.current());
        if (downloader == null) {
            FetchBoxSettings settings = settingsLoader.current();
            downloader = new HttpDownloader(
                    Duration.ofMillis(settings.connectTimeoutMs()),
                    Duration.ofMillis(settings.requestTimeoutMs()),
                    settings.userAgent()
            );
        }
    }

    public FetchBoxConfig config() {
        return config;
    }

    public FetchBoxSettings settings() {
        return settingsLoader.current();
    }

    public DurableQueue queue() {
        return queue;
    }

    public DeadLetterStore deadLetterStore() {
        return deadLetterStore;
    }

    public SettingsLoader.ReloadOutcome reloadSettings() {
        SettingsLoader.ReloadOutcome out = settingsLoader.load();
        applySettings(settingsLoader.current());
        return out;
    }

    /**
     * Checks the settings file at most once per {@code minIntervalMs}. A change
     * swaps the proxy graph (dropping cached resolutions) and queue limits;
     * worker count and HTTP timeouts take effect on the next broker.
     */
    public SettingsLoader.ReloadOutcome maybeReloadSettings(long minIntervalMs) {
        SettingsLoader.ReloadOutcome out = settingsLoader.maybeReload(minIntervalMs);
        if (out.changed()) {
            applySettings(settingsLoader.current());
        }
        return out;
    }

    public EnqueueOutcome enqueue(Task task) {
        long sequence = queue.enqueue(task, clock.getAsLong());
        return new EnqueueOutcome(sequence, task.jobId(), task.id());
    }

    /**
     * Enqueues in order and stops at the first capacity rejection; the tasks
     * after it are reported as rejected.
     */
    public BatchEnqueueOutcome enqueueAll(List<Task> tasks) {
        List<EnqueueOutcome> accepted = new ArrayList<>();
        for (Task task : tasks) {
            try {
                accepted.add(enqueue(task));
            } catch (QueueFullException e) {
                log.warn("Queue full after {} of {} tasks", accepted.size(), tasks.size());
                return new BatchEnqueueOutcome(accepted, tasks.size() - accepted.size(), true);
            }
        }
        return new BatchEnqueueOutcome(accepted, 0, false);
    }

    public TaskBroker newBroker() {
        FetchBoxSettings settings = settingsLoader.current();
        TaskPipeline pipeline = new TaskPipeline(
                queue,
                proxyResolver,
                downloader,
                storage,
                ledger,
                backoffEngine,
                settingsLoader::current,
                clock
        );
        List<Worker> workers = new ArrayList<>(settings.workerCount());
        for (int i = 0; i < settings.workerCount(); i++) {
            workers.add(new Worker(
                    "worker-" + i,
                    settings.maxInflightPerWorker(),
                    new TokenBucketRateLimiter(settings.rateLimitPerWorker()),
                    pipeline,
                    settings.pollIntervalMs(),
                    null
            ));
        }
        return new TaskBroker(queue, workers, clock, settings.pollIntervalMs(), settings.recoveryScanIntervalMs());
    }

    /**
     * Recovers expired leases, then processes every currently visible entry on
     * the calling thread.
     */
    public RunOnceOutcome runOnce(int maxEntries) {
        int recovered = queue.recoverExpiredLeases(clock.getAsLong());
        List<PipelineOutcome> outcomes = newBroker().drainVisible(maxEntries);
        Map<String, Integer> byDisposition = new LinkedHashMap<>();
        for (PipelineOutcome.Disposition d : PipelineOutcome.Disposition.values()) {
            byDisposition.put(d.name(), 0);
        }
        for (PipelineOutcome outcome : outcomes) {
            byDisposition.merge(outcome.disposition().name(), 1, Integer::sum);
        }
        return new RunOnceOutcome(recovered, outcomes.size(), byDisposition, outcomes);
    }

    /**
     * Periodic housekeeping for a long-running process: settings reload and,
     * once per prune interval, retention pruning.
     */
    public MaintenanceOutcome runMaintenance(long settingsCheckIntervalMs) {
        SettingsLoader.ReloadOutcome reload = maybeReloadSettings(settingsCheckIntervalMs);
        long now = clock.getAsLong();
        PruneOutcome prune = null;
        if (now - lastPruneAtMs >= settingsLoader.current().pruneIntervalMs()) {
            prune = prune();
        }
        return new MaintenanceOutcome(reload.changed(), prune);
    }

    public PruneOutcome prune() {
        FetchBoxSettings settings = settingsLoader.current();
        long now = clock.getAsLong();
        lastPruneAtMs = now;
        long cutoff = now - Duration.ofDays(settings.jobTtlDays()).toMillis();
        int queueRows = queue.prune(cutoff);
        int ledgerFiles = 0;
        if (ledger instanceof JsonlLedger) {
            ledgerFiles = ((JsonlLedger) ledger).prune(settings.logsTtlDays());
        }
        if (queueRows > 0 || ledgerFiles > 0) {
            log.info("Pruned {} queue entries and {} ledger files", queueRows, ledgerFiles);
        }
        return new PruneOutcome(queueRows, ledgerFiles, cutoff);
    }

    public StatsOutcome stats() {
        return new StatsOutcome(queue.stats(), deadLetterStore.count());
    }

    public Optional<QueueEntry> entry(long sequence) {
        return queue.get(sequence);
    }

    public List<QueueEntry> entries(String status, int limit) {
        return queue.list(status == null || status.isBlank() ? null : QueueStatus.fromString(status), limit);
    }

    public List<DeadLetterEntry> deadLetters(long afterSequence, int limit) {
        return deadLetterStore.list(afterSequence, limit);
    }

    public Optional<DeadLetterEntry> deadLetter(long sequence) {
        return deadLetterStore.get(sequence);
    }

    public DeadLetterStore.ReplayOutcome replay(long sequence) {
        return deadLetterStore.replay(sequence, queue, clock.getAsLong());
    }

    public DeadLetterStore.BatchReplayOutcome replayAll(int limit) {
        DeadLetterStore.BatchReplayOutcome out = deadLetterStore.replayAll(queue, limit, clock.getAsLong());
        log.info("Replayed {} of {} dead letters", out.replayed().size(), out.candidates());
        return out;
    }

    public ResolvedProxyPool resolveProxy(String poolName) {
        return proxyResolver.resolve(poolName);
    }

    private void applySettings(FetchBoxSettings settings) {
        queue.updateLimits(settings.queueCapacity(), settings.leaseTtlMs());
        proxyResolver.reload(settings.proxyPools());
    }

    public record EnqueueOutcome(long sequence, String jobId, String resourceId) {
    }

    public record BatchEnqueueOutcome(List<EnqueueOutcome> accepted, int rejected, boolean queueFull) {
    }

    public record RunOnceOutcome(int recoveredLeases, int processed, Map<String, Integer> byDisposition,
                                 List<PipelineOutcome> outcomes) {
    }

    public record PruneOutcome(int queueEntriesPruned, int ledgerFilesPruned, long cutoffMs) {
    }

    public record MaintenanceOutcome(boolean settingsChanged, PruneOutcome prune) {
    }

    public record StatsOutcome(DurableQueue.QueueStats queue, int deadLetters) {
    }
}
