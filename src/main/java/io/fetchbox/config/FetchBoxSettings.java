package io.fetchbox.config;

import io.fetchbox.retry.RetryLimits;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Effective tunables after defaults and minimums are applied. Immutable; a
 * reload produces a new instance.
 */
public record FetchBoxSettings(
        int workerCount,
        int maxInflightPerWorker,
        double rateLimitPerWorker,
        int queueCapacity,
        long leaseTtlMs,
        int downloadRetryLimit,
        int storageRetryLimit,
        long baseBackoffMs,
        long maxBackoffMs,
        long pollIntervalMs,
        long shutdownGraceMs,
        long recoveryScanIntervalMs,
        long pruneIntervalMs,
        long connectTimeoutMs,
        long requestTimeoutMs,
        String userAgent,
        String storageBucket,
        int jobTtlDays,
        int logsTtlDays,
        Map<String, ProxyPoolConfig> proxyPools,
        Map<String, HandlerConfig> handlers
) {
    public FetchBoxSettings {
        proxyPools = proxyPools == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(proxyPools));
        handlers = handlers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(handlers));
    }

    public static FetchBoxSettings defaults() {
        return new FetchBoxSettings(
                FetchBoxConfig.DEFAULT_WORKER_COUNT,
                FetchBoxConfig.DEFAULT_MAX_INFLIGHT_PER_WORKER,
                FetchBoxConfig.DEFAULT_RATE_LIMIT_PER_WORKER,
                FetchBoxConfig.DEFAULT_QUEUE_CAPACITY,
                FetchBoxConfig.DEFAULT_LEASE_TTL_MS,
                FetchBoxConfig.DEFAULT_DOWNLOAD_RETRY_LIMIT,
                FetchBoxConfig.DEFAULT_STORAGE_RETRY_LIMIT,
                FetchBoxConfig.DEFAULT_BASE_BACKOFF_MS,
                FetchBoxConfig.DEFAULT_MAX_BACKOFF_MS,
                FetchBoxConfig.DEFAULT_POLL_INTERVAL_MS,
                FetchBoxConfig.DEFAULT_SHUTDOWN_GRACE_MS,
                FetchBoxConfig.DEFAULT_RECOVERY_SCAN_INTERVAL_MS,
                FetchBoxConfig.DEFAULT_PRUNE_INTERVAL_MS,
                FetchBoxConfig.DEFAULT_CONNECT_TIMEOUT_MS,
                FetchBoxConfig.DEFAULT_REQUEST_TIMEOUT_MS,
                FetchBoxConfig.DEFAULT_USER_AGENT,
                FetchBoxConfig.DEFAULT_BUCKET,
                FetchBoxConfig.DEFAULT_JOB_TTL_DAYS,
                FetchBoxConfig.DEFAULT_LOGS_TTL_DAYS,
                Map.of(),
                Map.of()
        );
    }

    static FetchBoxSettings fromFile(SettingsFile file, FetchBoxSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long baseBackoff = sanitizeLong(file.baseBackoffMs(), defaults.baseBackoffMs(), 1L);
        long maxBackoff = sanitizeLong(file.maxBackoffMs(), defaults.maxBackoffMs(), baseBackoff);
        return new FetchBoxSettings(
                sanitizeInt(file.workerCount(), defaults.workerCount(), 1),
                sanitizeInt(file.maxInflightPerWorker(), defaults.maxInflightPerWorker(), 1),
                sanitizeDouble(file.rateLimitPerWorker(), defaults.rateLimitPerWorker(), 0.0d),
                sanitizeInt(file.queueCapacity(), defaults.queueCapacity(), 1),
                sanitizeLong(file.leaseTtlMs(), defaults.leaseTtlMs(), 1_000L),
                sanitizeInt(file.downloadRetryLimit(), defaults.downloadRetryLimit(), 1),
                sanitizeInt(file.storageRetryLimit(), defaults.storageRetryLimit(), 1),
                baseBackoff,
                maxBackoff,
                sanitizeLong(file.pollIntervalMs(), defaults.pollIntervalMs(), 10L),
                sanitizeLong(file.shutdownGraceMs(), defaults.shutdownGraceMs(), 0L),
                sanitizeLong(file.recoveryScanIntervalMs(), defaults.recoveryScanIntervalMs(), 100L),
                sanitizeLong(file.pruneIntervalMs(), defaults.pruneIntervalMs(), 1_000L),
                sanitizeLong(file.connectTimeoutMs(), defaults.connectTimeoutMs(), 100L),
                sanitizeLong(file.requestTimeoutMs(), defaults.requestTimeoutMs(), 100L),
                sanitizeText(file.userAgent(), defaults.userAgent()),
                sanitizeText(file.storageBucket(), defaults.storageBucket()),
                sanitizeInt(file.jobTtlDays(), defaults.jobTtlDays(), 1),
                sanitizeInt(file.logsTtlDays(), defaults.logsTtlDays(), 1),
                file.proxyPools() == null ? defaults.proxyPools() : file.proxyPools(),
                file.handlers() == null ? defaults.handlers() : file.handlers()
        );
    }

    public RetryLimits retryLimits() {
        return new RetryLimits(downloadRetryLimit, storageRetryLimit, baseBackoffMs, maxBackoffMs);
    }

    public Optional<HandlerConfig> handler(String jobType) {
        if (jobType == null || jobType.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(handlers.get(jobType));
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static double sanitizeDouble(Double raw, double fallback, double min) {
        if (raw == null || raw.isNaN()) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static String sanitizeText(String raw, String fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return raw.trim();
    }
}
