package io.fetchbox.worker;

import io.fetchbox.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSONL ledger, one file per UTC day ({@code ledger-YYYY-MM-DD.jsonl}).
 * Write failures are logged and dropped.
 */
public final class JsonlLedger implements Ledger {
    private static final Logger log = LoggerFactory.getLogger(JsonlLedger.class);
    private static final String FILE_PREFIX = "ledger-";
    private static final String FILE_SUFFIX = ".jsonl";

    private final Path dir;
    private final Clock clock;

    public JsonlLedger(Path dir) {
        this(dir, Clock.systemUTC());
    }

    JsonlLedger(Path dir, Clock clock) {
        this.dir = dir;
        this.clock = clock;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize ledger directory: " + dir, e);
        }
    }

    @Override
    public void onTaskCompleted(String jobId, String resourceId) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("event", "task_completed");
        row.put("job_id", jobId);
        row.put("resource_id", resourceId);
        append(row);
    }

    @Override
    public void onTaskFailed(String jobId, String resourceId, String failureCode, String failureMessage) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("event", "task_failed");
        row.put("job_id", jobId);
        row.put("resource_id", resourceId);
        row.put("failure_code", failureCode);
        row.put("failure_message", failureMessage);
        append(row);
    }

    public Path fileFor(LocalDate day) {
        return dir.resolve(FILE_PREFIX + day + FILE_SUFFIX);
    }

    /**
     * Deletes day files older than {@code ttlDays} days.
     *
     * @return number of files removed
     */
    public synchronized int prune(int ttlDays) {
        LocalDate cutoff = LocalDate.now(clock).minusDays(Math.max(1, ttlDays));
        List<Path> expired = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, FILE_PREFIX + "*" + FILE_SUFFIX)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                String datePart = name.substring(FILE_PREFIX.length(), name.length() - FILE_SUFFIX.length());
                try {
                    if (LocalDate.parse(datePart).isBefore(cutoff)) {
                        expired.add(file);
                    }
                } catch (DateTimeParseException e) {
                    log.debug("Ignoring unexpected ledger file {}", file);
                }
            }
            for (Path file : expired) {
                Files.deleteIfExists(file);
            }
            return expired.size();
        } catch (IOException e) {
            throw new RuntimeException("Failed to prune ledger directory: " + dir, e);
        }
    }

    private synchronized void append(Map<String, Object> row) {
        Instant now = clock.instant();
        row.put("timestamp", now.toString());
        Path file = fileFor(LocalDate.ofInstant(now, ZoneOffset.UTC));
        String line = Jsons.toCompactJson(row) + "\n";
        try {
            Files.writeString(file, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            log.warn("Failed to write ledger delta {} for job={} resource={}", row.get("event"), row.get("job_id"),
                    row.get("resource_id"), e);
        }
    }
}
