package io.fetchbox.worker;

import io.fetchbox.config.HandlerConfig;
import io.fetchbox.model.StorageHint;
import io.fetchbox.model.Task;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Where a task's body goes and what metadata travels with it.
 *
 * <p>Key: {@code <keyPrefix>/<resourceId>} when the task's storage hint has a
 * prefix, otherwise {@code resources/<jobType>/<jobId>/<resourceId>}. Bucket:
 * hint, then handler override, then the configured default.
 */
public final class StorageTargets {
    static final String DEFAULT_JOB_TYPE = "default";

    private StorageTargets() {
    }

    public static StorageDestination destinationFor(Task task, Optional<HandlerConfig> handler, String defaultBucket) {
        StorageHint hint = task.storageHint();
        String bucket = defaultBucket;
        if (handler.isPresent() && handler.get().storageBucket() != null) {
            bucket = handler.get().storageBucket();
        }
        if (hint != null && !hint.bucket().isEmpty()) {
            bucket = hint.bucket();
        }
        return new StorageDestination(bucket, keyFor(task));
    }

    public static String keyFor(Task task) {
        StorageHint hint = task.storageHint();
        if (hint != null && !hint.keyPrefix().isEmpty()) {
            return hint.keyPrefix() + "/" + task.id();
        }
        String jobType = task.jobType().isEmpty() ? DEFAULT_JOB_TYPE : task.jobType();
        return "resources/" + jobType + "/" + task.jobId() + "/" + task.id();
    }

    public static Map<String, String> metadataFor(Task task) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("job_id", task.jobId());
        metadata.put("job_type", task.jobType());
        metadata.put("resource_id", task.id());
        metadata.put("source_url", task.url());
        if (!task.traceId().isEmpty()) {
            metadata.put("trace_id", task.traceId());
        }
        for (Map.Entry<String, String> tag : task.tags().entrySet()) {
            metadata.put("tag." + tag.getKey(), tag.getValue());
        }
        if (task.storageHint() != null) {
            metadata.putAll(task.storageHint().metadata());
        }
        return metadata;
    }
}
