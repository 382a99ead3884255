package io.fetchbox.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class FetchBoxConfig {
    public static final int DEFAULT_WORKER_COUNT = 4;
    public static final int DEFAULT_MAX_INFLIGHT_PER_WORKER = 32;
    public static final double DEFAULT_RATE_LIMIT_PER_WORKER = 0.0d;
    public static final int DEFAULT_QUEUE_CAPACITY = 10_000;
    public static final long DEFAULT_LEASE_TTL_MS = 300_000L;
    public static final int DEFAULT_DOWNLOAD_RETRY_LIMIT = 3;
    public static final int DEFAULT_STORAGE_RETRY_LIMIT = 3;
    public static final long DEFAULT_BASE_BACKOFF_MS = 500L;
    public static final long DEFAULT_MAX_BACKOFF_MS = 60_000L;
    public static final long DEFAULT_POLL_INTERVAL_MS = 100L;
    public static final long DEFAULT_SHUTDOWN_GRACE_MS = 15_000L;
    public static final long DEFAULT_RECOVERY_SCAN_INTERVAL_MS = 5_000L;
    public static final long DEFAULT_PRUNE_INTERVAL_MS = 3_600_000L;
    public static final long DEFAULT_CONNECT_TIMEOUT_MS = 10_000L;
    public static final long DEFAULT_REQUEST_TIMEOUT_MS = 60_000L;
    public static final String DEFAULT_USER_AGENT = "FetchBox/0.1.0";
    public static final String DEFAULT_BUCKET = "fetchbox-default";
    public static final int DEFAULT_JOB_TTL_DAYS = 30;
    public static final int DEFAULT_LOGS_TTL_DAYS = 30;

    private final Path rootDir;

    public FetchBoxConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static FetchBoxConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        return new FetchBoxConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("fetchbox.db");
    }

    public Path settingsFile() {
        return rootDir.resolve("fetchbox-settings.json");
    }

    public Path ledgerDir() {
        return rootDir.resolve("ledger");
    }

    public Path objectsDir() {
        return rootDir.resolve("objects");
    }
}
