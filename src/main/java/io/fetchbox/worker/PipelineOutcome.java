package io.fetchbox.worker;

import java.util.List;

/**
 * What happened to one leased entry. {@code attemptCount} is the count after this
 * attempt; {@code STALE_LEASE} means the queue rejected the report because the
 * lease had already been recovered.
 */
public record PipelineOutcome(
        long sequence,
        String jobId,
        String resourceId,
        Disposition disposition,
        int attemptCount,
        String failureCode,
        String failureMessage,
        Long retryAtMs,
        List<String> endpointsTried,
        String storageKey,
        String sha256,
        long bytes
) {
    public enum Disposition { COMPLETED, REQUEUED, DEAD_LETTERED, STALE_LEASE }
}
