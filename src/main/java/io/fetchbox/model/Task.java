package io.fetchbox.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One unit of download-and-store work. Immutable once built; the queue wraps it
 * in a {@link QueueEntry} for bookkeeping.
 *
 * <p>{@code id} is the resource identifier within the job. Headers keep their
 * order and may repeat a name.
 */
public record Task(
        String id,
        String jobId,
        String jobType,
        String url,
        List<Header> headers,
        String proxyHint,
        StorageHint storageHint,
        Map<String, String> tags,
        JsonNode attributes,
        String traceId
) {
    public Task {
        id = requireText(id, "id");
        jobId = requireText(jobId, "jobId");
        url = requireText(url, "url");
        jobType = jobType == null ? "" : jobType.trim();
        headers = headers == null ? List.of() : List.copyOf(headers);
        proxyHint = proxyHint == null || proxyHint.isBlank() ? null : proxyHint.trim();
        tags = tags == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tags));
        attributes = attributes == null ? null : attributes.deepCopy();
        traceId = traceId == null ? "" : traceId.trim();
    }

    /** A copy; the task's own tree never leaves the record. */
    @Override
    public JsonNode attributes() {
        return attributes == null ? null : attributes.deepCopy();
    }

    public static Task of(String id, String jobId, String url) {
        return new Task(id, jobId, "", url, List.of(), null, null, Map.of(), null, "");
    }

    public Task withHeaders(List<Header> newHeaders) {
        return new Task(id, jobId, jobType, url, newHeaders, proxyHint, storageHint, tags, attributes, traceId);
    }

    public Task withProxyHint(String pool) {
        return new Task(id, jobId, jobType, url, headers, pool, storageHint, tags, attributes, traceId);
    }

    public Task withJobType(String type) {
        return new Task(id, jobId, type, url, headers, proxyHint, storageHint, tags, attributes, traceId);
    }

    public Task withStorageHint(StorageHint hint) {
        return new Task(id, jobId, jobType, url, headers, proxyHint, hint, tags, attributes, traceId);
    }

    public Optional<String> proxyPool() {
        return Optional.ofNullable(proxyHint);
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value.trim();
    }
}
