package io.fetchbox.storage;

import io.fetchbox.model.QueueEntry;
import io.fetchbox.model.QueueStatus;
import io.fetchbox.model.Task;
import io.fetchbox.retry.FailureCode;
import io.fetchbox.retry.FailurePhase;
import io.fetchbox.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistent task queue keyed by a monotonically increasing sequence.
 *
 * <p>Entries move {@code PENDING -> LEASED -> COMPLETED | PENDING | DEAD_LETTERED}.
 * Every lease bumps {@code lease_epoch}; outcome reports must name the owner and
 * epoch they were granted, so a worker whose lease expired and was handed out
 * again cannot ack, requeue or dead-letter the entry.
 *
 * <p>{@code attempt_count} grows by one per reported outcome (ack, requeue or
 * dead-letter). Lease expiry recovery and shutdown release leave it untouched.
 * Failed outcomes also bump the counter of their phase
 * ({@code download_failures} or {@code upload_failures}); each phase has its own
 * retry budget.
 */
public final class DurableQueue {
    private static final Logger log = LoggerFactory.getLogger(DurableQueue.class);

    private static final String ENTRY_COLUMNS = """
            sequence,job_id,resource_id,task_json,attempt_count,download_failures,upload_failures,status,
            lease_owner,lease_expires_at_ms,lease_epoch,visible_after_ms,created_at_ms,updated_at_ms
            """;

    private final Database database;
    private final DeadLetterStore deadLetterStore;
    private volatile int capacity;
    private volatile long leaseTtlMs;

    public DurableQueue(Database database, DeadLetterStore deadLetterStore, int capacity, long leaseTtlMs) {
        this.database = database;
        this.deadLetterStore = deadLetterStore;
        this.capacity = Math.max(1, capacity);
        this.leaseTtlMs = Math.max(1L, leaseTtlMs);
    }

    public void updateLimits(int newCapacity, long newLeaseTtlMs) {
        this.capacity = Math.max(1, newCapacity);
        this.leaseTtlMs = Math.max(1L, newLeaseTtlMs);
    }

    public int capacity() {
        return capacity;
    }

    public long leaseTtlMs() {
        return leaseTtlMs;
    }

    public DeadLetterStore deadLetterStore() {
        return deadLetterStore;
    }

    /**
     * Persists a pending entry and returns its sequence.
     *
     * @throws QueueFullException when the number of pending and leased entries
     *                            has reached capacity
     */
    public synchronized long enqueue(Task task, long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                long sequence = insertPending(c, task, nowMs);
                c.commit();
                log.debug("Enqueued seq={} job={} resource={}", sequence, task.jobId(), task.id());
                return sequence;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (QueueFullException e) {
            throw e;
        } catch (Exception e) {
            throw new RuntimeException("Failed enqueue", e);
        }
    }

    /**
     * Runs inside the caller's transaction. Replays share it so the new entry
     * and the replay record commit together.
     */
    long insertPending(Connection c, Task task, long nowMs) throws SQLException {
        int limit = capacity;
        if (countActive(c) >= limit) {
            throw new QueueFullException(limit);
        }
        long sequence = allocateSequence(c);
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO queue_entries(sequence,job_id,resource_id,task_json,attempt_count,status,lease_owner,
                    lease_expires_at_ms,lease_epoch,visible_after_ms,created_at_ms,updated_at_ms)
                VALUES(?,?,?,?,0,?,NULL,NULL,0,?,?,?)
                """)) {
            ps.setLong(1, sequence);
            ps.setString(2, task.jobId());
            ps.setString(3, task.id());
            ps.setString(4, Jsons.toCompactJson(task));
            ps.setString(5, QueueStatus.PENDING.name());
            ps.setLong(6, nowMs);
            ps.setLong(7, nowMs);
            ps.setLong(8, nowMs);
            ps.executeUpdate();
        }
        return sequence;
    }

    /**
     * Leases the lowest-sequence pending entry visible at {@code nowMs}. Rows whose
     * task payload cannot be decoded are moved to the dead-letter store as
     * {@code system.queue_corruption} and skipped.
     */
    public synchronized Optional<QueueEntry> leaseNext(String workerId, long nowMs) {
        String select = "SELECT " + ENTRY_COLUMNS + " FROM queue_entries WHERE status=? AND visible_after_ms<=? ORDER BY sequence ASC LIMIT 1";
        String grant = "UPDATE queue_entries SET status=?,lease_owner=?,lease_expires_at_ms=?,lease_epoch=lease_epoch+1,updated_at_ms=? WHERE sequence=? AND status=?";
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement sel = c.prepareStatement(select);
                 PreparedStatement up = c.prepareStatement(grant)) {
                while (true) {
                    RawEntry raw;
                    sel.setString(1, QueueStatus.PENDING.name());
                    sel.setLong(2, nowMs);
                    try (ResultSet rs = sel.executeQuery()) {
                        if (!rs.next()) {
                            c.commit();
                            return Optional.empty();
                        }
                        raw = readRaw(rs);
                    }
                    Task task;
                    try {
                        task = decodeTask(raw.sequence(), raw.taskJson());
                    } catch (QueueCorruptionException e) {
                        quarantine(c, raw, e, nowMs);
                        continue;
                    }
                    long expiresAt = nowMs + leaseTtlMs;
                    up.setString(1, QueueStatus.LEASED.name());
                    up.setString(2, workerId);
                    up.setLong(3, expiresAt);
                    up.setLong(4, nowMs);
                    up.setLong(5, raw.sequence());
                    up.setString(6, QueueStatus.PENDING.name());
                    if (up.executeUpdate() == 0) {
                        continue;
                    }
                    c.commit();
                    return Optional.of(new QueueEntry(
                            raw.sequence(),
                            task,
                            raw.attemptCount(),
                            raw.downloadFailures(),
                            raw.uploadFailures(),
                            QueueStatus.LEASED,
                            workerId,
                            expiresAt,
                            raw.leaseEpoch() + 1L,
                            raw.visibleAfterMs(),
                            raw.createdAtMs(),
                            nowMs
                    ));
                }
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed lease next", e);
        }
    }

    public synchronized boolean ack(long sequence, String workerId, long leaseEpoch, long nowMs) {
        return finishLease(sequence, workerId, leaseEpoch, """
                UPDATE queue_entries SET status=?,attempt_count=attempt_count+1,lease_owner=NULL,lease_expires_at_ms=NULL,
                    updated_at_ms=? WHERE sequence=? AND status=? AND lease_owner=? AND lease_epoch=?
                """, QueueStatus.COMPLETED, new long[0], nowMs, "ack");
    }

    /**
     * Returns the entry to pending with one more recorded attempt and one more
     * failure in {@code phase}, invisible until {@code visibleAfterMs}. Fails
     * (returns false) unless the caller still holds the lease identified by
     * {@code workerId} and {@code leaseEpoch}.
     */
    public synchronized boolean requeue(long sequence, String workerId, long leaseEpoch, FailurePhase phase,
                                        long visibleAfterMs, long nowMs) {
        return finishLease(sequence, workerId, leaseEpoch, """
                UPDATE queue_entries SET status=?,attempt_count=attempt_count+1,download_failures=download_failures+?,
                    upload_failures=upload_failures+?,lease_owner=NULL,lease_expires_at_ms=NULL,visible_after_ms=?,
                    updated_at_ms=? WHERE sequence=? AND status=? AND lease_owner=? AND lease_epoch=?
                """, QueueStatus.PENDING,
                new long[]{downloadIncrement(phase), uploadIncrement(phase), visibleAfterMs}, nowMs, "requeue");
    }

    /**
     * Hands a leased entry back without counting an attempt. Used for entries
     * that were dispatched but never started.
     */
    public synchronized boolean release(long sequence, String workerId, long leaseEpoch, long nowMs) {
        return finishLease(sequence, workerId, leaseEpoch, """
                UPDATE queue_entries SET status=?,lease_owner=NULL,lease_expires_at_ms=NULL,
                    visible_after_ms=?,updated_at_ms=? WHERE sequence=? AND status=? AND lease_owner=? AND lease_epoch=?
                """, QueueStatus.PENDING, new long[]{nowMs}, nowMs, "release");
    }

    /**
     * Pushes the lease expiry of an entry still held by {@code workerId} under
     * {@code leaseEpoch} to {@code nowMs + leaseTtlMs}.
     *
     * @return false when the lease is no longer held
     */
    public synchronized boolean renewLease(long sequence, String workerId, long leaseEpoch, long nowMs) {
        String sql = "UPDATE queue_entries SET lease_expires_at_ms=? WHERE sequence=? AND status=? AND lease_owner=? AND lease_epoch=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, nowMs + leaseTtlMs);
            ps.setLong(2, sequence);
            ps.setString(3, QueueStatus.LEASED.name());
            ps.setString(4, workerId);
            ps.setLong(5, leaseEpoch);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed renew lease", e);
        }
    }

    /**
     * Moves a leased entry to the dead-letter store. The store insert and the
     * queue-side transition commit in one transaction, store first.
     *
     * @return the task, or empty when the caller no longer holds the lease
     */
    public synchronized Optional<Task> deadLetter(long sequence, String workerId, long leaseEpoch, FailurePhase phase,
                                                  String failureCode, String failureMessage, long nowMs) {
        String select = "SELECT " + ENTRY_COLUMNS + " FROM queue_entries WHERE sequence=?";
        String mark = """
                UPDATE queue_entries SET status=?,attempt_count=?,download_failures=download_failures+?,
                    upload_failures=upload_failures+?,lease_owner=NULL,lease_expires_at_ms=NULL,updated_at_ms=?
                WHERE sequence=? AND status=? AND lease_owner=? AND lease_epoch=?
                """;
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement sel = c.prepareStatement(select);
                 PreparedStatement up = c.prepareStatement(mark)) {
                sel.setLong(1, sequence);
                RawEntry raw;
                try (ResultSet rs = sel.executeQuery()) {
                    if (!rs.next()) {
                        c.commit();
                        return Optional.empty();
                    }
                    raw = readRaw(rs);
                }
                if (!QueueStatus.LEASED.name().equals(raw.status())
                        || !workerId.equals(raw.leaseOwner())
                        || raw.leaseEpoch() != leaseEpoch) {
                    c.commit();
                    log.info("Stale dead-letter ignored seq={} worker={} epoch={} (status={}, owner={}, epoch={})",
                            sequence, workerId, leaseEpoch, raw.status(), raw.leaseOwner(), raw.leaseEpoch());
                    return Optional.empty();
                }
                int attempts = raw.attemptCount() + 1;
                deadLetterStore.insert(c, sequence, raw.jobId(), raw.resourceId(), raw.taskJson(),
                        failureCode, failureMessage, attempts, nowMs);
                up.setString(1, QueueStatus.DEAD_LETTERED.name());
                up.setInt(2, attempts);
                up.setLong(3, downloadIncrement(phase));
                up.setLong(4, uploadIncrement(phase));
                up.setLong(5, nowMs);
                up.setLong(6, sequence);
                up.setString(7, QueueStatus.LEASED.name());
                up.setString(8, workerId);
                up.setLong(9, leaseEpoch);
                if (up.executeUpdate() == 0) {
                    c.rollback();
                    return Optional.empty();
                }
                Task task = decodeTask(sequence, raw.taskJson());
                c.commit();
                return Optional.of(task);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed dead letter", e);
        }
    }

    /**
     * Returns leased entries whose lease expired before {@code nowMs} to pending,
     * immediately visible and without an attempt increment.
     */
    public synchronized int recoverExpiredLeases(long nowMs) {
        String sql = """
                UPDATE queue_entries SET status=?,lease_owner=NULL,lease_expires_at_ms=NULL,visible_after_ms=?,updated_at_ms=?
                WHERE status=? AND lease_expires_at_ms IS NOT NULL AND lease_expires_at_ms<?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, QueueStatus.PENDING.name());
            ps.setLong(2, nowMs);
            ps.setLong(3, nowMs);
            ps.setString(4, QueueStatus.LEASED.name());
            ps.setLong(5, nowMs);
            int recovered = ps.executeUpdate();
            if (recovered > 0) {
                log.info("Recovered {} expired lease(s)", recovered);
            }
            return recovered;
        } catch (SQLException e) {
            throw new RuntimeException("Failed recover expired leases", e);
        }
    }

    /**
     * Deletes completed and dead-lettered entries last touched before
     * {@code cutoffMs}. Dead-letter store rows are kept.
     */
    public synchronized int prune(long cutoffMs) {
        String sql = "DELETE FROM queue_entries WHERE status IN (?,?) AND updated_at_ms<?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, QueueStatus.COMPLETED.name());
            ps.setString(2, QueueStatus.DEAD_LETTERED.name());
            ps.setLong(3, cutoffMs);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed prune queue", e);
        }
    }

    public Optional<QueueEntry> get(long sequence) {
        String sql = "SELECT " + ENTRY_COLUMNS + " FROM queue_entries WHERE sequence=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, sequence);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(toEntry(readRaw(rs)));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed get queue entry", e);
        }
    }

    public List<QueueEntry> list(QueueStatus status, int limit) {
        String sql = status == null
                ? "SELECT " + ENTRY_COLUMNS + " FROM queue_entries ORDER BY sequence ASC LIMIT ?"
                : "SELECT " + ENTRY_COLUMNS + " FROM queue_entries WHERE status=? ORDER BY sequence ASC LIMIT ?";
        List<QueueEntry> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int idx = 1;
            if (status != null) {
                ps.setString(idx++, status.name());
            }
            ps.setInt(idx, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(toEntry(readRaw(rs)));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed list queue entries", e);
        }
    }

    public QueueStats stats() {
        Map<String, Integer> byStatus = new LinkedHashMap<>();
        for (QueueStatus s : QueueStatus.values()) {
            byStatus.put(s.name(), 0);
        }
        try (Connection c = database.openConnection()) {
            try (PreparedStatement ps = c.prepareStatement("SELECT status,COUNT(*) AS c FROM queue_entries GROUP BY status");
                 ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    byStatus.put(rs.getString("status"), rs.getInt("c"));
                }
            }
            long next = readNextSequence(c);
            int active = byStatus.get(QueueStatus.PENDING.name()) + byStatus.get(QueueStatus.LEASED.name());
            return new QueueStats(byStatus, active, capacity, next);
        } catch (SQLException e) {
            throw new RuntimeException("Failed load queue stats", e);
        }
    }

    private int countActive(Connection c) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM queue_entries WHERE status IN (?,?)")) {
            ps.setString(1, QueueStatus.PENDING.name());
            ps.setString(2, QueueStatus.LEASED.name());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        }
    }

    private long allocateSequence(Connection c) throws SQLException {
        long next = readNextSequence(c);
        try (PreparedStatement ps = c.prepareStatement("UPDATE queue_metadata SET meta_value=? WHERE meta_key=?")) {
            ps.setLong(1, next + 1L);
            ps.setString(2, Database.NEXT_SEQUENCE_KEY);
            ps.executeUpdate();
        }
        return next;
    }

    private long readNextSequence(Connection c) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT meta_value FROM queue_metadata WHERE meta_key=?")) {
            ps.setString(1, Database.NEXT_SEQUENCE_KEY);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new QueueCorruptionException(-1L, "Sequence counter row is missing", null);
                }
                return rs.getLong(1);
            }
        }
    }

    private static long downloadIncrement(FailurePhase phase) {
        return phase == FailurePhase.DOWNLOAD ? 1L : 0L;
    }

    private static long uploadIncrement(FailurePhase phase) {
        return phase == FailurePhase.UPLOAD ? 1L : 0L;
    }

    /**
     * Binds {@code target}, then {@code leading} in order, then the update time and
     * the sequence/owner/epoch fence.
     */
    private boolean finishLease(long sequence, String workerId, long leaseEpoch, String sql,
                                QueueStatus target, long[] leading, long nowMs, String op) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int idx = 1;
            ps.setString(idx++, target.name());
            for (long value : leading) {
                ps.setLong(idx++, value);
            }
            ps.setLong(idx++, nowMs);
            ps.setLong(idx++, sequence);
            ps.setString(idx++, QueueStatus.LEASED.name());
            ps.setString(idx++, workerId);
            ps.setLong(idx, leaseEpoch);
            boolean applied = ps.executeUpdate() > 0;
            if (!applied) {
                log.info("Stale {} ignored seq={} worker={} epoch={}", op, sequence, workerId, leaseEpoch);
            }
            return applied;
        } catch (SQLException e) {
            throw new RuntimeException("Failed " + op, e);
        }
    }

    private void quarantine(Connection c, RawEntry raw, QueueCorruptionException cause, long nowMs) throws SQLException {
        log.error("Quarantining undecodable queue entry seq={}", raw.sequence(), cause);
        deadLetterStore.insert(c, raw.sequence(), raw.jobId(), raw.resourceId(), raw.taskJson(),
                FailureCode.SYSTEM_QUEUE_CORRUPTION.code(), cause.getMessage(), raw.attemptCount(), nowMs);
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE queue_entries SET status=?,updated_at_ms=? WHERE sequence=?")) {
            ps.setString(1, QueueStatus.DEAD_LETTERED.name());
            ps.setLong(2, nowMs);
            ps.setLong(3, raw.sequence());
            ps.executeUpdate();
        }
    }

    static Task decodeTask(long sequence, String json) {
        try {
            return Jsons.fromJson(json, Task.class);
        } catch (RuntimeException e) {
            throw new QueueCorruptionException(sequence, "Undecodable task payload at sequence " + sequence, e);
        }
    }

    private static RawEntry readRaw(ResultSet rs) throws SQLException {
        long expires = rs.getLong("lease_expires_at_ms");
        Long leaseExpiresAt = rs.wasNull() ? null : expires;
        return new RawEntry(
                rs.getLong("sequence"),
                rs.getString("job_id"),
                rs.getString("resource_id"),
                rs.getString("task_json"),
                rs.getInt("attempt_count"),
                rs.getInt("download_failures"),
                rs.getInt("upload_failures"),
                rs.getString("status"),
                rs.getString("lease_owner"),
                leaseExpiresAt,
                rs.getLong("lease_epoch"),
                rs.getLong("visible_after_ms"),
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }

    private static QueueEntry toEntry(RawEntry raw) {
        return new QueueEntry(
                raw.sequence(),
                decodeTask(raw.sequence(), raw.taskJson()),
                raw.attemptCount(),
                raw.downloadFailures(),
                raw.uploadFailures(),
                QueueStatus.fromString(raw.status()),
                raw.leaseOwner(),
                raw.leaseExpiresAtMs(),
                raw.leaseEpoch(),
                raw.visibleAfterMs(),
                raw.createdAtMs(),
                raw.updatedAtMs()
        );
    }

    private record RawEntry(
            long sequence,
            String jobId,
            String resourceId,
            String taskJson,
            int attemptCount,
            int downloadFailures,
            int uploadFailures,
            String status,
            String leaseOwner,
            Long leaseExpiresAtMs,
            long leaseEpoch,
            long visibleAfterMs,
            long createdAtMs,
            long updatedAtMs
    ) {
    }

    public record QueueStats(Map<String, Integer> byStatus, int active, int capacity, long nextSequence) {
    }
}
