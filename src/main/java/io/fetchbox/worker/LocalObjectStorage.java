package io.fetchbox.worker;

import io.fetchbox.retry.FailureCode;
import io.fetchbox.retry.TaskFailure;
import io.fetchbox.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Filesystem-backed object storage: {@code <root>/<bucket>/<key>}, written through
 * a temp file and moved into place, with metadata in a {@code .meta.json}
 * sidecar.
 */
public final class LocalObjectStorage implements ObjectStorage {
    private static final Logger log = LoggerFactory.getLogger(LocalObjectStorage.class);

    private final Path root;

    public LocalObjectStorage(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public UploadedRef upload(InputStream body, StorageDestination destination, Map<String, String> metadata) throws TaskFailure {
        Path target = resolveTarget(destination);
        Path tmp = null;
        try {
            Files.createDirectories(target.getParent());
            tmp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
            long size = Files.copy(body, tmp, StandardCopyOption.REPLACE_EXISTING);
            moveIntoPlace(tmp, target);
            tmp = null;
            writeSidecar(target, destination, metadata, size);
            return new UploadedRef(destination.bucket(), destination.key(), size, target.toUri().toString());
        } catch (AccessDeniedException e) {
            throw TaskFailure.of(FailureCode.UPLOAD_ACCESS_DENIED, "Access denied writing " + target, e);
        } catch (IOException e) {
            throw TaskFailure.of(FailureCode.UPLOAD_NETWORK, "I/O error writing " + target + ": " + e.getMessage(), e);
        } finally {
            if (tmp != null) {
                deleteQuietly(tmp);
            }
        }
    }

    public Path root() {
        return root;
    }

    public Path pathOf(String bucket, String key) {
        return root.resolve(bucket).resolve(key).normalize();
    }

    private Path resolveTarget(StorageDestination destination) throws TaskFailure {
        String bucket = destination.bucket();
        String key = destination.key();
        if (bucket == null || bucket.isBlank() || bucket.contains("/") || bucket.contains("\\") || bucket.startsWith(".")) {
            throw TaskFailure.of(FailureCode.UPLOAD_INVALID_DESTINATION, "Invalid bucket: " + bucket);
        }
        if (key == null || key.isBlank() || key.startsWith("/") || key.endsWith("/")) {
            throw TaskFailure.of(FailureCode.UPLOAD_INVALID_DESTINATION, "Invalid key: " + key);
        }
        for (String segment : key.split("/")) {
            if (segment.isEmpty() || ".".equals(segment) || "..".equals(segment)) {
                throw TaskFailure.of(FailureCode.UPLOAD_INVALID_DESTINATION, "Invalid key: " + key);
            }
        }
        Path bucketDir = root.resolve(bucket).normalize();
        Path target = bucketDir.resolve(key).normalize();
        if (!target.startsWith(bucketDir)) {
            throw TaskFailure.of(FailureCode.UPLOAD_INVALID_DESTINATION, "Key escapes bucket: " + key);
        }
        return target;
    }

    private void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void writeSidecar(Path target, StorageDestination destination, Map<String, String> metadata, long size)
            throws IOException {
        Map<String, Object> sidecar = new LinkedHashMap<>();
        sidecar.put("bucket", destination.bucket());
        sidecar.put("key", destination.key());
        sidecar.put("size_bytes", size);
        sidecar.put("metadata", metadata == null ? Map.of() : metadata);
        Path metaPath = target.resolveSibling(target.getFileName() + ".meta.json");
        Files.writeString(metaPath, Jsons.toJson(sidecar), StandardCharsets.UTF_8);
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.debug("Failed to delete temp upload {}", path, e);
        }
    }
}
