package io.fetchbox.worker;

import io.fetchbox.retry.TaskFailure;

import java.io.InputStream;
import java.util.Map;

public interface ObjectStorage {
    /**
     * Consumes {@code body} to the end and stores it under {@code destination}.
     * Failures are classified with the {@code UPLOAD_*} failure codes.
     */
    UploadedRef upload(InputStream body, StorageDestination destination, Map<String, String> metadata) throws TaskFailure;
}
