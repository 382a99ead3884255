package io.fetchbox.storage;

import io.fetchbox.config.FetchBoxConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HashSet;
import java.util.Properties;
import java.util.Set;

/**
 * SQLite file holding the queue and the dead-letter store. Both live in one file
 * so that dead-lettering can commit the queue-side and store-side writes in a
 * single transaction.
 */
public final class Database {
    static final String NEXT_SEQUENCE_KEY = "next_seq";

    private final FetchBoxConfig config;
    private final String jdbcUrl;

    public Database(FetchBoxConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    /**
     * Write transactions start as {@code BEGIN IMMEDIATE} so concurrent writers
     * queue on the busy timeout instead of failing a lock upgrade.
     */
    public Connection openConnection() throws SQLException {
        Properties props = new Properties();
        props.setProperty("busy_timeout", "5000");
        props.setProperty("transaction_mode", "IMMEDIATE");
        return DriverManager.getConnection(jdbcUrl, props);
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.ledgerDir());
            Files.createDirectories(config.objectsDir());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS queue_entries (
                        sequence INTEGER PRIMARY KEY,
                        job_id TEXT NOT NULL,
                        resource_id TEXT NOT NULL,
                        task_json TEXT NOT NULL,
                        attempt_count INTEGER NOT NULL DEFAULT 0,
                        download_failures INTEGER NOT NULL DEFAULT 0,
                        upload_failures INTEGER NOT NULL DEFAULT 0,
                        status TEXT NOT NULL,
                        lease_owner TEXT,
                        lease_expires_at_ms INTEGER,
                        lease_epoch INTEGER NOT NULL DEFAULT 0,
                        visible_after_ms INTEGER NOT NULL,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            ensureQueueColumns(conn);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS queue_metadata (
                        meta_key TEXT PRIMARY KEY,
                        meta_value INTEGER NOT NULL
                    )
                    """);
            st.execute("INSERT OR IGNORE INTO queue_metadata(meta_key,meta_value) VALUES('" + NEXT_SEQUENCE_KEY + "',0)");
            st.execute("""
                    CREATE TABLE IF NOT EXISTS dead_letters (
                        sequence INTEGER PRIMARY KEY,
                        job_id TEXT NOT NULL,
                        resource_id TEXT NOT NULL,
                        task_json TEXT NOT NULL,
                        failure_code TEXT NOT NULL,
                        failure_message TEXT NOT NULL,
                        attempts INTEGER NOT NULL,
                        failed_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS dead_letter_replays (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        dead_sequence INTEGER NOT NULL,
                        new_sequence INTEGER NOT NULL,
                        replayed_at_ms INTEGER NOT NULL
                    )
                    """);

            st.execute("CREATE INDEX IF NOT EXISTS idx_queue_status_visible ON queue_entries(status, visible_after_ms, sequence)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_queue_status_lease_expiry ON queue_entries(status, lease_expires_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_queue_status_updated ON queue_entries(status, updated_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_dead_letters_job ON dead_letters(job_id, sequence)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_dead_letters_failed_at ON dead_letters(failed_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_replays_dead_sequence ON dead_letter_replays(dead_sequence)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite schema", e);
        }
    }

    private void ensureQueueColumns(Connection conn) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(queue_entries)")) {
            while (rs.next()) {
                columns.add(rs.getString("name").toLowerCase());
            }
        }
        try (Statement st = conn.createStatement()) {
            if (!columns.contains("download_failures")) {
                st.execute("ALTER TABLE queue_entries ADD COLUMN download_failures INTEGER NOT NULL DEFAULT 0");
            }
            if (!columns.contains("upload_failures")) {
                st.execute("ALTER TABLE queue_entries ADD COLUMN upload_failures INTEGER NOT NULL DEFAULT 0");
            }
        }
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }
}
