package io.fetchbox.worker;

/**
 * Receives per-task status deltas. Calls are fire-and-forget; implementations
 * must not throw back into the pipeline.
 */
public interface Ledger {
    void onTaskCompleted(String jobId, String resourceId);

    void onTaskFailed(String jobId, String resourceId, String failureCode, String failureMessage);
}
