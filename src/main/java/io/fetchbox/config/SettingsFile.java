package io.fetchbox.config;

import java.util.Map;

/**
 * Raw shape of {@code fetchbox-settings.json}. Every field is optional.
 */
record SettingsFile(
        Integer workerCount,
        Integer maxInflightPerWorker,
        Double rateLimitPerWorker,
        Integer queueCapacity,
        Long leaseTtlMs,
        Integer downloadRetryLimit,
        Integer storageRetryLimit,
        Long baseBackoffMs,
        Long maxBackoffMs,
        Long pollIntervalMs,
        Long shutdownGraceMs,
        Long recoveryScanIntervalMs,
        Long pruneIntervalMs,
        Long connectTimeoutMs,
        Long requestTimeoutMs,
        String userAgent,
        String storageBucket,
        Integer jobTtlDays,
        Integer logsTtlDays,
        Map<String, ProxyPoolConfig> proxyPools,
        Map<String, HandlerConfig> handlers
) {
}
