package io.fetchbox.worker;

import com.fasterxml.jackson.databind.JsonNode;
import io.fetchbox.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Stream;

final class JsonlLedgerTest {

    @Test
    void appendsOneLinePerDelta() throws Exception {
        Path root = Files.createTempDirectory("fetchbox-test-ledger-");
        try {
            Clock clock = Clock.fixed(Instant.parse("2024-03-05T10:15:30Z"), ZoneOffset.UTC);
            JsonlLedger ledger = new JsonlLedger(root, clock);
            ledger.onTaskCompleted("job_X", "r1");
            ledger.onTaskFailed("job_X", "r2", "download.timeout", "timed out");

            List<String> lines = Files.readAllLines(ledger.fileFor(LocalDate.of(2024, 3, 5)), StandardCharsets.UTF_8);
            Assertions.assertEquals(2, lines.size());
            JsonNode completed = Jsons.mapper().readTree(lines.get(0));
            Assertions.assertEquals("task_completed", completed.path("event").asText());
            Assertions.assertEquals("r1", completed.path("resource_id").asText());
            JsonNode failed = Jsons.mapper().readTree(lines.get(1));
            Assertions.assertEquals("task_failed", failed.path("event").asText());
            Assertions.assertEquals("download.timeout", failed.path("failure_code").asText());
            Assertions.assertEquals("2024-03-05T10:15:30Z", failed.path("timestamp").asText());

            String content = Files.readString(ledger.fileFor(LocalDate.of(2024, 3, 5)), StandardCharsets.UTF_8);
            Assertions.assertFalse(content.contains("\r"));
            Assertions.assertTrue(content.endsWith("}\n"));
            Assertions.assertEquals(2L, content.chars().filter(ch -> ch == '\n').count());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void pruneDeletesDaysPastRetention() throws Exception {
        Path root = Files.createTempDirectory("fetchbox-test-ledger-prune-");
        try {
            Clock clock = Clock.fixed(Instant.parse("2024-03-31T00:00:00Z"), ZoneOffset.UTC);
            JsonlLedger ledger = new JsonlLedger(root, clock);
            Files.writeString(ledger.fileFor(LocalDate.of(2024, 3, 1)), "{}\n");
            Files.writeString(ledger.fileFor(LocalDate.of(2024, 3, 25)), "{}\n");
            Files.writeString(root.resolve("ledger-notes.jsonl"), "{}\n");

            Assertions.assertEquals(1, ledger.prune(7));
            Assertions.assertFalse(Files.exists(ledger.fileFor(LocalDate.of(2024, 3, 1))));
            Assertions.assertTrue(Files.exists(ledger.fileFor(LocalDate.of(2024, 3, 25))));
            Assertions.assertTrue(Files.exists(root.resolve("ledger-notes.jsonl")));
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
