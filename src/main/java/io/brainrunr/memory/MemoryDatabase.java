package io.brainrunr.memory;

import io.brainrunr.config.MemoryProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The single SQLite file holding every table of the memory engine.
 *
 * <p>Schema:</p>
 * <ul>
 *   <li>{@code memories}: content, tags, access statistics, media and camera metadata</li>
 *   <li>{@code embeddings}: float32 vectors, one per memory</li>
 *   <li>{@code links}: directed causal links</li>
 *   <li>{@code episodes}: named groups of memories</li>
 *   <li>{@code associations}: symmetric strengths keyed by (low id, high id)</li>
 *   <li>{@code coactivation_events}: retrieval co-occurrences awaiting consolidation</li>
 * </ul>
 *
 * <p>All access goes through {@link #read} or {@link #inTransaction}. The lock is held for one
 * statement group at a time, so readers interleave between writes and never observe a
 * transaction half-applied.</p>
 */
@Component
public class MemoryDatabase {

    private static final Logger log = LoggerFactory.getLogger(MemoryDatabase.class);

    private final String dbPath;
    private final ReentrantLock lock = new ReentrantLock();
    private Connection connection;

    @Autowired
    public MemoryDatabase(MemoryProperties properties) {
        Path dir = Path.of(properties.path());
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            log.error("Failed to create memory directory: {}", dir, e);
        }
        this.dbPath = dir.resolve("brain.db").toString();
    }

    /** Constructor for testing with explicit db path. */
    public MemoryDatabase(String dbPath, boolean isDirect) {
        this.dbPath = dbPath;
    }

    @PostConstruct
    public void init() {
        try {
            connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
            try (var stmt = connection.createStatement()) {
                stmt.execute("PRAGMA journal_mode=WAL");
                stmt.execute("PRAGMA busy_timeout=5000");
                stmt.execute("PRAGMA foreign_keys=ON");
            }
            createSchema();
            log.info("MemoryDatabase initialized at: {}", dbPath);
        } catch (SQLException e) {
            log.error("Failed to initialize memory database at {}", dbPath, e);
            throw new StoreIOException("Memory store initialization failed", e);
        }
    }

    private void createSchema() throws SQLException {
        try (var stmt = connection.createStatement()) {
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS memories (
                    id TEXT PRIMARY KEY,
                    content TEXT NOT NULL,
                    emotion TEXT NOT NULL,
                    category TEXT NOT NULL,
                    importance INTEGER NOT NULL CHECK(importance BETWEEN 1 AND 5),
                    created_at INTEGER NOT NULL,
                    last_accessed INTEGER,
                    access_count INTEGER NOT NULL DEFAULT 0,
                    media_type TEXT,
                    media_path TEXT,
                    media_transcript TEXT,
                    camera_pan REAL,
                    camera_tilt REAL,
                    episode_id TEXT,
                    tags TEXT NOT NULL DEFAULT '[]'
                )
                """);
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_memories_category ON memories(category)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_memories_emotion ON memories(emotion)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_memories_created ON memories(created_at)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_memories_accessed ON memories(last_accessed)");

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS embeddings (
                    memory_id TEXT PRIMARY KEY REFERENCES memories(id) ON DELETE CASCADE,
                    vector BLOB NOT NULL
                )
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS links (
                    source_id TEXT NOT NULL REFERENCES memories(id) ON DELETE CASCADE,
                    target_id TEXT NOT NULL REFERENCES memories(id) ON DELETE CASCADE,
                    link_type TEXT NOT NULL,
                    note TEXT,
                    created_at INTEGER NOT NULL,
                    PRIMARY KEY (source_id, target_id, link_type)
                )
                """);
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_links_target ON links(target_id)");

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS episodes (
                    id TEXT PRIMARY KEY,
                    title TEXT NOT NULL,
                    memory_ids TEXT NOT NULL,
                    participants TEXT NOT NULL DEFAULT '[]',
                    summary TEXT NOT NULL DEFAULT '',
                    start_time INTEGER NOT NULL,
                    end_time INTEGER NOT NULL,
                    emotion TEXT NOT NULL,
                    importance INTEGER NOT NULL,
                    created_at INTEGER NOT NULL
                )
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS associations (
                    low_id TEXT NOT NULL REFERENCES memories(id) ON DELETE CASCADE,
                    high_id TEXT NOT NULL REFERENCES memories(id) ON DELETE CASCADE,
                    strength REAL NOT NULL CHECK(strength >= 0.0),
                    updated_at INTEGER NOT NULL,
                    PRIMARY KEY (low_id, high_id),
                    CHECK(low_id < high_id)
                )
                """);
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_associations_high ON associations(high_id)");

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS coactivation_events (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    first_id TEXT NOT NULL REFERENCES memories(id) ON DELETE CASCADE,
                    second_id TEXT NOT NULL REFERENCES memories(id) ON DELETE CASCADE,
                    origin TEXT NOT NULL,
                    occurred_at INTEGER NOT NULL,
                    replayed_at INTEGER
                )
                """);
            stmt.execute("""
                CREATE INDEX IF NOT EXISTS idx_coactivation_pending
                ON coactivation_events(replayed_at, occurred_at)
                """);
        }
    }

    /**
     * Runs read-only work (or a single auto-committed statement) under the store lock.
     *
     * @throws StoreIOException if SQLite fails
     */
    public <T> T read(SqlWork<T> work) {
        lock.lock();
        try {
            return work.execute(ensureConnected());
        } catch (SQLException e) {
            log.error("Memory store read failed", e);
            throw new StoreIOException("Memory store read failed: " + e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs work as one transaction. Any exception rolls it back; {@link MemoryException}s
     * propagate unchanged, {@link SQLException}s surface as {@link StoreIOException}.
     */
    public <T> T inTransaction(SqlWork<T> work) {
        lock.lock();
        try {
            Connection conn = ensureConnected();
            boolean committed = false;
            try {
                conn.setAutoCommit(false);
                T result = work.execute(conn);
                conn.commit();
                committed = true;
                return result;
            } catch (SQLException e) {
                log.error("Memory store transaction failed", e);
                throw new StoreIOException("Memory store write failed: " + e.getMessage(), e);
            } finally {
                if (!committed) {
                    rollbackQuietly(conn);
                }
                restoreAutoCommit(conn);
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean healthCheck() {
        try {
            return read(conn -> {
                try (var stmt = conn.createStatement();
                     var rs = stmt.executeQuery("SELECT 1")) {
                    return rs.next();
                }
            });
        } catch (StoreIOException e) {
            return false;
        }
    }

    public String getDbPath() {
        return dbPath;
    }

    @PreDestroy
    public void close() {
        lock.lock();
        try {
            if (connection != null) {
                connection.close();
                connection = null;
                log.info("MemoryDatabase closed");
            }
        } catch (SQLException e) {
            log.error("Failed to close SQLite connection", e);
        } finally {
            lock.unlock();
        }
    }

    private Connection ensureConnected() {
        if (connection == null) {
            throw new StoreIOException("Memory store is not open", null);
        }
        return connection;
    }

    private void rollbackQuietly(Connection conn) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            log.error("Rollback failed", e);
        }
    }

    private void restoreAutoCommit(Connection conn) {
        try {
            conn.setAutoCommit(true);
        } catch (SQLException e) {
            log.error("Failed to restore auto-commit", e);
        }
    }

    /**
     * A unit of JDBC work against the memory database.
     */
    @FunctionalInterface
    public interface SqlWork<T> {
        T execute(Connection connection) throws SQLException;
    }
}
