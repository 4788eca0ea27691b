package io.brainrunr.graph;

import io.brainrunr.config.MemoryProperties;
import io.brainrunr.memory.MemoryDatabase;
import io.brainrunr.memory.ValidationException;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Weighted, undirected association graph between memories.
 *
 * <p>Each edge is stored once under its {@link IdPair} key, so {@code strength(a, b)} and
 * {@code strength(b, a)} always read the same row. Strengths only grow, up to the configured cap.</p>
 */
@Component
public class AssociationGraph {

    private final MemoryDatabase db;
    private final Clock clock;
    private final double cap;

    public AssociationGraph(MemoryDatabase db, MemoryProperties properties, Clock clock) {
        this.db = db;
        this.clock = clock;
        this.cap = properties.graph().cap();
    }

    /** Edge strength, 0 when there is no edge or the ids are equal. */
    public double strength(String a, String b) {
        if (a.equals(b)) {
            return 0.0;
        }
        IdPair key = IdPair.of(a, b);
        return db.read(conn -> readStrength(conn, key));
    }

    /** Neighbours by strength descending, ties by id. */
    public List<Neighbor> neighbors(String id, int topK) {
        return db.read(conn -> {
            List<Neighbor> result = new ArrayList<>();
            try (var stmt = conn.prepareStatement("""
                    SELECT CASE WHEN low_id = ? THEN high_id ELSE low_id END AS other, strength
                    FROM associations
                    WHERE (low_id = ? OR high_id = ?) AND strength > 0
                    ORDER BY strength DESC, other ASC
                    LIMIT ?
                    """)) {
                stmt.setString(1, id);
                stmt.setString(2, id);
                stmt.setString(3, id);
                stmt.setInt(4, Math.max(1, topK));
                try (var rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        result.add(new Neighbor(rs.getString("other"), rs.getDouble("strength")));
                    }
                }
            }
            return result;
        });
    }

    /** {@link #bump(String, String, double, double)} with the configured cap. */
    public double bump(String a, String b, double delta) {
        return bump(a, b, delta, cap);
    }

    /**
     * Strengthens an edge to {@code min(cap, strength + delta)} in its own transaction.
     *
     * @return the resulting strength
     * @throws ValidationException if delta or cap is negative
     */
    public double bump(String a, String b, double delta, double cap) {
        return db.inTransaction(conn -> bumpWithin(conn, a, b, delta, cap));
    }

    /**
     * Same as {@link #bump(String, String, double, double)} inside the caller's transaction.
     * Both memories must exist. Equal ids and a zero delta change nothing.
     */
    public double bumpWithin(Connection conn, String a, String b, double delta, double cap) throws SQLException {
        if (delta < 0 || cap < 0 || Double.isNaN(delta) || Double.isNaN(cap)) {
            throw new ValidationException("Association delta and cap must be non-negative: delta=%s, cap=%s"
                    .formatted(delta, cap));
        }
        if (a.equals(b)) {
            return 0.0;
        }
        IdPair key = IdPair.of(a, b);
        if (delta == 0) {
            return readStrength(conn, key);
        }
        long now = Instant.now(clock).toEpochMilli();
        try (var stmt = conn.prepareStatement("""
                INSERT INTO associations (low_id, high_id, strength, updated_at)
                VALUES (?, ?, MIN(?, ?), ?)
                ON CONFLICT(low_id, high_id) DO UPDATE
                SET strength = MAX(strength, MIN(?, strength + ?)), updated_at = excluded.updated_at
                """)) {
            stmt.setString(1, key.low());
            stmt.setString(2, key.high());
            stmt.setDouble(3, cap);
            stmt.setDouble(4, delta);
            stmt.setLong(5, now);
            stmt.setDouble(6, cap);
            stmt.setDouble(7, delta);
            stmt.executeUpdate();
        }
        return readStrength(conn, key);
    }

    public int edgeCount() {
        return db.read(conn -> {
            try (var stmt = conn.createStatement();
                 var rs = stmt.executeQuery("SELECT COUNT(*) FROM associations")) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        });
    }

    private static double readStrength(Connection conn, IdPair key) throws SQLException {
        try (var stmt = conn.prepareStatement("SELECT strength FROM associations WHERE low_id = ? AND high_id = ?")) {
            stmt.setString(1, key.low());
            stmt.setString(2, key.high());
            try (var rs = stmt.executeQuery()) {
                return rs.next() ? rs.getDouble(1) : 0.0;
            }
        }
    }
}
