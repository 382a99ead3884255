package io.fetchbox.storage;

import io.fetchbox.model.DeadLetterEntry;
import io.fetchbox.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Tasks that will not succeed without operator intervention, keyed by the queue
 * sequence they failed under. Rows are written once and never modified; replay
 * enqueues a fresh copy of the task and records the link.
 */
public final class DeadLetterStore {
    private static final Logger log = LoggerFactory.getLogger(DeadLetterStore.class);

    private static final String COLUMNS = "sequence,task_json,failure_code,failure_message,attempts,failed_at_ms";

    private final Database database;

    public DeadLetterStore(Database database) {
        this.database = database;
    }

    /**
     * First write wins: a duplicate insert for the same sequence (a dead-letter
     * retried after a crash) is ignored.
     */
    void insert(Connection c, long sequence, String jobId, String resourceId, String taskJson,
                String failureCode, String failureMessage, int attempts, long failedAtMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT OR IGNORE INTO dead_letters(sequence,job_id,resource_id,task_json,failure_code,failure_message,attempts,failed_at_ms)
                VALUES(?,?,?,?,?,?,?,?)
                """)) {
            ps.setLong(1, sequence);
            ps.setString(2, jobId);
            ps.setString(3, resourceId);
            ps.setString(4, taskJson);
            ps.setString(5, failureCode);
            ps.setString(6, failureMessage == null ? "" : failureMessage);
            ps.setInt(7, attempts);
            ps.setLong(8, failedAtMs);
            ps.executeUpdate();
        }
    }

    public Optional<DeadLetterEntry> get(long sequence) {
        String sql = "SELECT " + COLUMNS + " FROM dead_letters WHERE sequence=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, sequence);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(toEntry(rs));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed get dead letter", e);
        }
    }

    /**
     * Dead letters in sequence order, starting after {@code afterSequence}
     * (use -1 for the beginning).
     */
    public List<DeadLetterEntry> list(long afterSequence, int limit) {
        String sql = "SELECT " + COLUMNS + " FROM dead_letters WHERE sequence>? ORDER BY sequence ASC LIMIT ?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, afterSequence);
            ps.setInt(2, Math.max(1, limit));
            return readAll(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed list dead letters", e);
        }
    }

    public List<DeadLetterEntry> listByJob(String jobId, int limit) {
        String sql = "SELECT " + COLUMNS + " FROM dead_letters WHERE job_id=? ORDER BY sequence ASC LIMIT ?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, jobId);
            ps.setInt(2, Math.max(1, limit));
            return readAll(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed list dead letters by job", e);
        }
    }

    public int count() {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM dead_letters");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed count dead letters", e);
        }
    }

    /**
     * Enqueues the dead-lettered task again as a new pending entry with zero
     * attempts. The dead letter itself stays as it was.
     *
     * @throws IllegalArgumentException when no dead letter has that sequence
     * @throws QueueFullException       when the queue is at capacity
     */
    public ReplayOutcome replay(long sequence, DurableQueue queue, long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement read = c.prepareStatement("SELECT task_json FROM dead_letters WHERE sequence=?");
                 PreparedStatement record = c.prepareStatement(
                         "INSERT INTO dead_letter_replays(dead_sequence,new_sequence,replayed_at_ms) VALUES(?,?,?)")) {
                read.setLong(1, sequence);
                String taskJson;
                try (ResultSet rs = read.executeQuery()) {
                    if (!rs.next()) {
                        throw new IllegalArgumentException("Unknown dead letter: " + sequence);
                    }
                    taskJson = rs.getString("task_json");
                }
                Task task = DurableQueue.decodeTask(sequence, taskJson);
                long newSequence = queue.insertPending(c, task, nowMs);
                record.setLong(1, sequence);
                record.setLong(2, newSequence);
                record.setLong(3, nowMs);
                record.executeUpdate();
                c.commit();
                log.info("Replayed dead letter seq={} as seq={}", sequence, newSequence);
                return new ReplayOutcome(sequence, newSequence, task.jobId(), task.id());
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (IllegalArgumentException | QueueFullException | QueueCorruptionException e) {
            throw e;
        } catch (Exception e) {
            throw new RuntimeException("Failed replay dead letter: " + sequence, e);
        }
    }

    /**
     * Replays up to {@code limit} dead letters that have never been replayed,
     * oldest first. Stops early when the queue fills up.
     */
    public BatchReplayOutcome replayAll(DurableQueue queue, int limit, long nowMs) {
        String sql = """
                SELECT d.sequence FROM dead_letters d
                WHERE NOT EXISTS (SELECT 1 FROM dead_letter_replays r WHERE r.dead_sequence=d.sequence)
                ORDER BY d.sequence ASC LIMIT ?
                """;
        List<Long> candidates = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    candidates.add(rs.getLong(1));
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed select replay candidates", e);
        }
        List<ReplayOutcome> replayed = new ArrayList<>();
        boolean queueFull = false;
        for (Long sequence : candidates) {
            try {
                replayed.add(replay(sequence, queue, nowMs));
            } catch (QueueFullException e) {
                queueFull = true;
                break;
            }
        }
        return new BatchReplayOutcome(candidates.size(), replayed, queueFull);
    }

    public List<ReplayRecord> replaysOf(long deadSequence) {
        String sql = "SELECT dead_sequence,new_sequence,replayed_at_ms FROM dead_letter_replays WHERE dead_sequence=? ORDER BY id ASC";
        List<ReplayRecord> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, deadSequence);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new ReplayRecord(rs.getLong("dead_sequence"), rs.getLong("new_sequence"), rs.getLong("replayed_at_ms")));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed list replays", e);
        }
    }

    private List<DeadLetterEntry> readAll(PreparedStatement ps) throws SQLException {
        List<DeadLetterEntry> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(toEntry(rs));
            }
        }
        return out;
    }

    private DeadLetterEntry toEntry(ResultSet rs) throws SQLException {
        long sequence = rs.getLong("sequence");
        return new DeadLetterEntry(
                sequence,
                DurableQueue.decodeTask(sequence, rs.getString("task_json")),
                rs.getString("failure_code"),
                rs.getString("failure_message"),
                rs.getInt("attempts"),
                rs.getLong("failed_at_ms")
        );
    }

    public record ReplayOutcome(long deadSequence, long newSequence, String jobId, String resourceId) {
    }

    public record BatchReplayOutcome(int candidates, List<ReplayOutcome> replayed, boolean stoppedOnQueueFull) {
    }

    public record ReplayRecord(long deadSequence, long newSequence, long replayedAtMs) {
    }
}
