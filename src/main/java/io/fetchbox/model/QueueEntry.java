package io.fetchbox.model;

import io.fetchbox.retry.FailurePhase;

/**
 * Queue-side view of a task. {@code leaseOwner}, {@code leaseExpiresAtMs} are
 * only set while the entry is {@link QueueStatus#LEASED}; {@code leaseEpoch}
 * grows with every grant and fences outcome reports from superseded leases.
 * {@code attemptCount} counts every reported outcome; the per-phase failure
 * counters feed the separate download and upload retry budgets.
 */
public record QueueEntry(
        long sequence,
        Task task,
        int attemptCount,
        int downloadFailures,
        int uploadFailures,
        QueueStatus status,
        String leaseOwner,
        Long leaseExpiresAtMs,
        long leaseEpoch,
        long visibleAfterMs,
        long createdAtMs,
        long updatedAtMs
) {
    public boolean leasedBy(String workerId) {
        return status == QueueStatus.LEASED && leaseOwner != null && leaseOwner.equals(workerId);
    }

    /** Failures already recorded in {@code phase}; zero for {@link FailurePhase#SYSTEM}. */
    public int failuresIn(FailurePhase phase) {
        return switch (phase) {
            case DOWNLOAD -> downloadFailures;
            case UPLOAD -> uploadFailures;
            case SYSTEM -> 0;
        };
    }
}
