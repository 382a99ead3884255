package io.fetchbox.retry;

/**
 * Attempt budgets per failing phase plus the backoff curve. System failures are
 * never retried, so they have no budget.
 */
public record RetryLimits(
        int downloadRetryLimit,
        int uploadRetryLimit,
        long baseBackoffMs,
        long maxBackoffMs
) {
    public RetryLimits {
        downloadRetryLimit = Math.max(1, downloadRetryLimit);
        uploadRetryLimit = Math.max(1, uploadRetryLimit);
        baseBackoffMs = Math.max(1L, baseBackoffMs);
        maxBackoffMs = Math.max(baseBackoffMs, maxBackoffMs);
    }

    public int limitFor(FailurePhase phase) {
        return switch (phase) {
            case DOWNLOAD -> downloadRetryLimit;
            case UPLOAD -> uploadRetryLimit;
            case SYSTEM -> 0;
        };
    }
}
