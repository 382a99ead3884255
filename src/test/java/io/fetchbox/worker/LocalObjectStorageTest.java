package io.fetchbox.worker;

import com.fasterxml.jackson.databind.JsonNode;
import io.fetchbox.retry.FailureCode;
import io.fetchbox.retry.TaskFailure;
import io.fetchbox.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.stream.Stream;

final class LocalObjectStorageTest {

    @Test
    void writesObjectAndSidecar() throws Exception {
        Path root = Files.createTempDirectory("fetchbox-test-objects-");
        try {
            LocalObjectStorage storage = new LocalObjectStorage(root);
            UploadedRef ref = storage.upload(
                    new ByteArrayInputStream("content".getBytes(StandardCharsets.UTF_8)),
                    new StorageDestination("bucket-a", "resources/default/job/r1"),
                    Map.of("job_id", "job")
            );

            Path stored = storage.pathOf("bucket-a", "resources/default/job/r1");
            Assertions.assertEquals("content", Files.readString(stored, StandardCharsets.UTF_8));
            Assertions.assertEquals(7L, ref.sizeBytes());
            JsonNode sidecar = Jsons.mapper().readTree(stored.resolveSibling("r1.meta.json").toFile());
            Assertions.assertEquals("job", sidecar.path("metadata").path("job_id").asText());
            Assertions.assertEquals(7L, sidecar.path("size_bytes").asLong());
            try (Stream<Path> files = Files.list(stored.getParent())) {
                Assertions.assertEquals(2L, files.count());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void rejectsKeysThatEscapeTheBucket() throws Exception {
        Path root = Files.createTempDirectory("fetchbox-test-objects-bad-");
        try {
            LocalObjectStorage storage = new LocalObjectStorage(root);
            for (String key : new String[]{"../outside", "/abs", "a//b", "trailing/", ""}) {
                TaskFailure failure = Assertions.assertThrows(TaskFailure.class, () -> storage.upload(
                        new ByteArrayInputStream(new byte[0]), new StorageDestination("bucket", key), Map.of()));
                Assertions.assertEquals(FailureCode.UPLOAD_INVALID_DESTINATION, failure.code(), key);
                Assertions.assertFalse(failure.retryable());
            }
            TaskFailure badBucket = Assertions.assertThrows(TaskFailure.class, () -> storage.upload(
                    new ByteArrayInputStream(new byte[0]), new StorageDestination("../b", "k"), Map.of()));
            Assertions.assertEquals(FailureCode.UPLOAD_INVALID_DESTINATION, badBucket.code());
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
