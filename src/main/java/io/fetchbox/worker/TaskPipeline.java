package io.fetchbox.worker;

import io.fetchbox.config.FetchBoxSettings;
import io.fetchbox.config.HandlerConfig;
import io.fetchbox.model.Header;
import io.fetchbox.model.ProxyEndpoint;
import io.fetchbox.model.QueueEntry;
import io.fetchbox.model.ResolvedProxyPool;
import io.fetchbox.model.Task;
import io.fetchbox.proxy.ProxyResolver;
import io.fetchbox.retry.BackoffEngine;
import io.fetchbox.retry.FailureCode;
import io.fetchbox.retry.RetryDecision;
import io.fetchbox.retry.TaskFailure;
import io.fetchbox.storage.DurableQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * One attempt at one leased entry: resolve proxies, download with tier fallback,
 * stream into storage, then report the outcome to the queue and the ledger.
 *
 * <p>Endpoint failures that are retryable move on to the next endpoint within the
 * same attempt. The attempt fails with the last such error once every tier is
 * used up. Non-retryable errors end the attempt at once.
 */
public final class TaskPipeline {
    private static final Logger log = LoggerFactory.getLogger(TaskPipeline.class);

    private final DurableQueue queue;
    private final ProxyResolver proxyResolver;
    private final Downloader downloader;
    private final ObjectStorage storage;
    private final Ledger ledger;
    private final BackoffEngine backoffEngine;
    private final Supplier<FetchBoxSettings> settings;
    private final LongSupplier clock;

    public TaskPipeline(DurableQueue queue,
                        ProxyResolver proxyResolver,
                        Downloader downloader,
                        ObjectStorage storage,
                        Ledger ledger,
                        BackoffEngine backoffEngine,
                        Supplier<FetchBoxSettings> settings,
                        LongSupplier clock) {
        this.queue = queue;
        this.proxyResolver = proxyResolver;
        this.downloader = downloader;
        this.storage = storage;
        this.ledger = ledger;
        this.backoffEngine = backoffEngine;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Never throws for task-level problems; anything unexpected is reported as a
     * {@code system.internal_fault} and dead-lettered. Queue failures (database
     * unavailable) still propagate, leaving the lease to expire.
     */
    public PipelineOutcome process(QueueEntry entry, String workerId) {
        List<String> tried = new ArrayList<>();
        Stored stored;
        try {
            stored = execute(entry.task(), tried);
        } catch (TaskFailure failure) {
            return dispose(entry, workerId, failure, tried);
        } catch (RuntimeException e) {
            log.error("Internal fault processing seq={} job={} resource={}",
                    entry.sequence(), entry.task().jobId(), entry.task().id(), e);
            return dispose(entry, workerId, TaskFailure.internalFault(e), tried);
        }
        return complete(entry, workerId, stored, tried);
    }

    private Stored execute(Task task, List<String> tried) throws TaskFailure {
        FetchBoxSettings current = settings.get();
        Optional<HandlerConfig> handler = current.handler(task.jobType());
        ResolvedProxyPool pool = resolvePool(task, handler);
        if (pool.structurallyEmpty()) {
            throw TaskFailure.of(FailureCode.DOWNLOAD_PROXY_TIERS_EXHAUSTED,
                    "No proxy endpoints configured for pool " + task.proxyPool().orElse(handler.map(HandlerConfig::proxyPool).orElse("")));
        }
        List<Header> headers = mergeHeaders(handler.map(HandlerConfig::defaultHeaders).orElse(Map.of()), task.headers());
        TaskFailure last = null;
        for (int tierIndex = 0; tierIndex < pool.tiers().size(); tierIndex++) {
            for (ProxyEndpoint endpoint : pool.tiers().get(tierIndex)) {
                tried.add(endpoint.uri());
                DownloadResponse response;
                try {
                    response = downloader.fetch(task.url(), headers, endpoint);
                } catch (TaskFailure failure) {
                    if (!failure.retryable()) {
                        throw failure;
                    }
                    log.debug("Endpoint {} (tier {}) failed for {}: {}", endpoint, tierIndex, task.url(), failure.failureCode());
                    last = failure;
                    continue;
                }
                return upload(task, handler, current, response);
            }
        }
        throw last;
    }

    private ResolvedProxyPool resolvePool(Task task, Optional<HandlerConfig> handler) {
        Optional<String> poolName = task.proxyPool();
        if (poolName.isEmpty() && handler.isPresent()) {
            poolName = Optional.ofNullable(handler.get().proxyPool());
        }
        if (poolName.isEmpty()) {
            return ResolvedProxyPool.direct();
        }
        return proxyResolver.resolve(poolName.get());
    }

    private Stored upload(Task task, Optional<HandlerConfig> handler, FetchBoxSettings current,
                          DownloadResponse response) throws TaskFailure {
        StorageDestination destination = StorageTargets.destinationFor(task, handler, current.storageBucket());
        Map<String, String> metadata = StorageTargets.metadataFor(task);
        if (response.contentType() != null && !response.contentType().isBlank()) {
            metadata.put("content_type", response.contentType());
        }
        try (DownloadResponse body = response; SourceStream source = new SourceStream(body.body())) {
            UploadedRef ref;
            try {
                ref = storage.upload(source, destination, metadata);
            } catch (TaskFailure failure) {
                if (source.readFailure() != null) {
                    throw TaskFailure.of(FailureCode.DOWNLOAD_CONNECTION,
                            "Download stream broke after " + source.bytesRead() + " bytes: " + source.readFailure().getMessage(),
                            source.readFailure());
                }
                throw failure;
            }
            return new Stored(ref, source.sha256Hex(), source.bytesRead());
        } catch (IOException e) {
            log.debug("Failed to close download stream for {}", task.url(), e);
            throw TaskFailure.of(FailureCode.DOWNLOAD_CONNECTION, "Failed to close download stream: " + e.getMessage(), e);
        }
    }

    private PipelineOutcome complete(QueueEntry entry, String workerId, Stored stored, List<String> tried) {
        Task task = entry.task();
        long now = clock.getAsLong();
        int attempts = entry.attemptCount() + 1;
        if (!queue.ack(entry.sequence(), workerId, entry.leaseEpoch(), now)) {
            return outcome(entry, PipelineOutcome.Disposition.STALE_LEASE, attempts, null, null, null, tried, stored);
        }
        log.info("Completed seq={} job={} resource={} bytes={} sha256={}",
                entry.sequence(), task.jobId(), task.id(), stored.bytes(), stored.sha256());
        ledger.onTaskCompleted(task.jobId(), task.id());
        return outcome(entry, PipelineOutcome.Disposition.COMPLETED, attempts, null, null, null, tried, stored);
    }

    private PipelineOutcome dispose(QueueEntry entry, String workerId, TaskFailure failure, List<String> tried) {
        Task task = entry.task();
        long now = clock.getAsLong();
        int attempts = entry.attemptCount() + 1;
        int phaseFailures = entry.failuresIn(failure.phase()) + 1;
        RetryDecision decision = backoffEngine.decide(failure, phaseFailures, settings.get().retryLimits());
        if (decision.shouldRetry()) {
            long visibleAfter = now + decision.delayMs();
            if (!queue.requeue(entry.sequence(), workerId, entry.leaseEpoch(), failure.phase(), visibleAfter, now)) {
                return outcome(entry, PipelineOutcome.Disposition.STALE_LEASE, attempts,
                        failure.failureCode(), failure.getMessage(), null, tried, null);
            }
            log.info("Requeued seq={} job={} resource={} attempt={} code={} delayMs={}",
                    entry.sequence(), task.jobId(), task.id(), attempts, failure.failureCode(), decision.delayMs());
            return outcome(entry, PipelineOutcome.Disposition.REQUEUED, attempts,
                    failure.failureCode(), failure.getMessage(), visibleAfter, tried, null);
        }
        Optional<Task> dead = queue.deadLetter(entry.sequence(), workerId, entry.leaseEpoch(), failure.phase(),
                failure.failureCode(), failure.getMessage(), now);
        if (dead.isEmpty()) {
            return outcome(entry, PipelineOutcome.Disposition.STALE_LEASE, attempts,
                    failure.failureCode(), failure.getMessage(), null, tried, null);
        }
        log.warn("Dead-lettered seq={} job={} resource={} attempts={} code={}: {}",
                entry.sequence(), task.jobId(), task.id(), attempts, failure.failureCode(), failure.getMessage());
        ledger.onTaskFailed(task.jobId(), task.id(), failure.failureCode(), failure.getMessage());
        return outcome(entry, PipelineOutcome.Disposition.DEAD_LETTERED, attempts,
                failure.failureCode(), failure.getMessage(), null, tried, null);
    }

    /**
     * Handler defaults first, then the task's own headers. A task header replaces
     * every default of the same name (case-insensitive); repeated task headers
     * are all kept.
     */
    static List<Header> mergeHeaders(Map<String, String> defaults, List<Header> taskHeaders) {
        Set<String> overridden = new HashSet<>();
        for (Header header : taskHeaders) {
            overridden.add(header.name().toLowerCase(Locale.ROOT));
        }
        List<Header> merged = new ArrayList<>(defaults.size() + taskHeaders.size());
        for (Map.Entry<String, String> def : defaults.entrySet()) {
            if (!overridden.contains(def.getKey().toLowerCase(Locale.ROOT))) {
                merged.add(new Header(def.getKey(), def.getValue()));
            }
        }
        merged.addAll(taskHeaders);
        return merged;
    }

    private static PipelineOutcome outcome(QueueEntry entry, PipelineOutcome.Disposition disposition, int attempts,
                                           String code, String message, Long retryAt, List<String> tried, Stored stored) {
        return new PipelineOutcome(
                entry.sequence(),
                entry.task().jobId(),
                entry.task().id(),
                disposition,
                attempts,
                code,
                message,
                retryAt,
                List.copyOf(tried),
                stored == null ? null : stored.ref().key(),
                stored == null ? null : stored.sha256(),
                stored == null ? 0L : stored.bytes()
        );
    }

    private record Stored(UploadedRef ref, String sha256, long bytes) {
    }
}
