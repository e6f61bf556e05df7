package io.stocktake.storage;

import io.stocktake.config.StockTakeConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;

public final class Database {
    private static final String MIGRATION_SCHEMA_VERSION = "stocktake.schema.migration.v1";
    private final StockTakeConfig config;
    private final String jdbcUrl;

    public Database(StockTakeConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        // foreign_keys and busy_timeout are per-connection in SQLite.
        Properties props = new Properties();
        props.setProperty("foreign_keys", "true");
        props.setProperty("busy_timeout", "5000");
        return DriverManager.getConnection(jdbcUrl, props);
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
            Files.createDirectories(config.reportsRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS sessions (
                        session_id TEXT PRIMARY KEY,
                        session_code TEXT NOT NULL UNIQUE,
                        branch_id TEXT NOT NULL,
                        created_by TEXT NOT NULL,
                        is_multi_user INTEGER NOT NULL DEFAULT 1,
                        allowed_counters TEXT NOT NULL DEFAULT '[]',
                        assigned_shelves TEXT NOT NULL DEFAULT '{}',
                        notes TEXT,
                        status TEXT NOT NULL,
                        force_completed INTEGER NOT NULL DEFAULT 0,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        started_at_ms INTEGER,
                        paused_at_ms INTEGER,
                        completed_at_ms INTEGER,
                        cancelled_at_ms INTEGER,
                        CHECK (status IN ('DRAFT','ACTIVE','PAUSED','COMPLETED','CANCELLED'))
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS session_items (
                        session_id TEXT NOT NULL,
                        item_id TEXT NOT NULL,
                        baseline_quantity INTEGER,
                        shelf_location TEXT,
                        baseline_frozen_at_ms INTEGER,
                        created_at_ms INTEGER NOT NULL,
                        PRIMARY KEY(session_id, item_id),
                        FOREIGN KEY(session_id) REFERENCES sessions(session_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS count_entries (
                        seq INTEGER PRIMARY KEY AUTOINCREMENT,
                        entry_id TEXT NOT NULL UNIQUE,
                        session_id TEXT NOT NULL,
                        item_id TEXT NOT NULL,
                        counter_id TEXT NOT NULL,
                        counted_quantity INTEGER NOT NULL,
                        baseline_quantity INTEGER NOT NULL,
                        variance INTEGER NOT NULL,
                        shelf_location TEXT,
                        notes TEXT,
                        counted_at_ms INTEGER NOT NULL,
                        FOREIGN KEY(session_id, item_id) REFERENCES session_items(session_id, item_id)
                    )
                    """);
            ensureSessionColumns(conn);

            st.execute("""
                    CREATE TRIGGER IF NOT EXISTS trg_count_entries_no_update
                    BEFORE UPDATE ON count_entries
                    BEGIN
                        SELECT RAISE(ABORT, 'count_entries is append-only');
                    END
                    """);
            st.execute("""
                    CREATE TRIGGER IF NOT EXISTS trg_count_entries_no_delete
                    BEFORE DELETE ON count_entries
                    BEGIN
                        SELECT RAISE(ABORT, 'count_entries is append-only');
                    END
                    """);
            st.execute("""
                    CREATE TRIGGER IF NOT EXISTS trg_session_items_baseline_immutable
                    BEFORE UPDATE OF baseline_quantity ON session_items
                    WHEN OLD.baseline_quantity IS NOT NULL
                         AND (NEW.baseline_quantity IS NULL OR NEW.baseline_quantity <> OLD.baseline_quantity)
                    BEGIN
                        SELECT RAISE(ABORT, 'baseline_quantity is immutable once set');
                    END
                    """);

            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);

            st.execute("CREATE INDEX IF NOT EXISTS idx_sessions_branch_status ON sessions(branch_id, status)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_sessions_branch_created ON sessions(branch_id, created_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_count_entries_session_item ON count_entries(session_id, item_id, seq)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_count_entries_session_time ON count_entries(session_id, counted_at_ms)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite schema", e);
        }
    }

    private void ensureSessionColumns(Connection conn) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(sessions)")) {
            while (rs.next()) {
                columns.add(rs.getString("name").toLowerCase());
            }
        }
        try (Statement st = conn.createStatement()) {
            if (!columns.contains("force_completed")) {
                st.execute("ALTER TABLE sessions ADD COLUMN force_completed INTEGER NOT NULL DEFAULT 0");
            }
            if (!columns.contains("paused_at_ms")) {
                st.execute("ALTER TABLE sessions ADD COLUMN paused_at_ms INTEGER");
            }
        }
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
        }
    }

    private void applyVersionedMigrations(Connection conn) throws SQLException {
        List<MigrationStep> steps = new ArrayList<>();
        steps.add(new MigrationStep(
                "20260301_001_counter_history_index",
                "Index count history by counter for my-counts queries",
                List.of("CREATE INDEX IF NOT EXISTS idx_count_entries_session_counter ON count_entries(session_id, counter_id, seq)")
        ));
        steps.add(new MigrationStep(
                "20260301_002_session_code_lookup",
                "Case-insensitive session code lookup",
                List.of("CREATE INDEX IF NOT EXISTS idx_sessions_code_upper ON sessions(UPPER(session_code))")
        ));
        steps.add(new MigrationStep(
                "20260301_003_shelf_reviews",
                "Append-only shelf review decisions",
                List.of(
                        """
                        CREATE TABLE IF NOT EXISTS shelf_reviews (
                            seq INTEGER PRIMARY KEY AUTOINCREMENT,
                            review_id TEXT NOT NULL UNIQUE,
                            session_id TEXT NOT NULL,
                            shelf_location TEXT NOT NULL,
                            status TEXT NOT NULL,
                            reviewed_by TEXT NOT NULL,
                            rejection_reason TEXT,
                            reviewed_at_ms INTEGER NOT NULL,
                            CHECK (status IN ('APPROVED','REJECTED')),
                            FOREIGN KEY(session_id) REFERENCES sessions(session_id)
                        )
                        """,
                        """
                        CREATE TRIGGER IF NOT EXISTS trg_shelf_reviews_no_update
                        BEFORE UPDATE ON shelf_reviews
                        BEGIN
                            SELECT RAISE(ABORT, 'shelf_reviews is append-only');
                        END
                        """,
                        """
                        CREATE TRIGGER IF NOT EXISTS trg_shelf_reviews_no_delete
                        BEFORE DELETE ON shelf_reviews
                        BEGIN
                            SELECT RAISE(ABORT, 'shelf_reviews is append-only');
                        END
                        """,
                        "CREATE INDEX IF NOT EXISTS idx_shelf_reviews_session_shelf ON shelf_reviews(session_id, shelf_location, seq)"
                )
        ));
        for (MigrationStep step : steps) {
            if (isMigrationApplied(conn, step.version())) {
                continue;
            }
            applyMigration(conn, step);
        }
    }

    private boolean isMigrationApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schema_migrations WHERE version=? AND success=1 LIMIT 1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void applyMigration(Connection conn, MigrationStep step) throws SQLException {
        try (Statement st = conn.createStatement()) {
            for (String sql : step.sql()) {
                st.execute(sql);
            }
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
            ps.setString(1, step.version());
            ps.setString(2, step.description());
            ps.setString(3, checksum(step));
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.executeUpdate();
        }
    }

    private String checksum(MigrationStep step) {
        StringBuilder sb = new StringBuilder();
        sb.append(MIGRATION_SCHEMA_VERSION).append('|')
                .append(step.version()).append('|')
                .append(step.description()).append('|');
        for (String sql : step.sql()) {
            sb.append(sql).append(';');
        }
        return Integer.toHexString(sb.toString().hashCode());
    }

    private record MigrationStep(String version, String description, List<String> sql) {
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
            validatePragma(st, "foreign_keys", "1");
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

    public List<SchemaMigrationRow> listSchemaMigrations(int limit) {
        String sql = """
                SELECT version,description,checksum,applied_at_ms,success
                FROM schema_migrations
                ORDER BY applied_at_ms DESC, version DESC
                LIMIT ?
                """;
        List<SchemaMigrationRow> out = new ArrayList<>();
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new SchemaMigrationRow(
                            rs.getString("version"),
                            rs.getString("description"),
                            rs.getString("checksum"),
                            rs.getLong("applied_at_ms"),
                            rs.getInt("success") == 1
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list schema migrations", e);
        }
    }

    public record SchemaMigrationRow(
            String version,
            String description,
            String checksum,
            long appliedAtMs,
            boolean success
    ) {
    }
}
