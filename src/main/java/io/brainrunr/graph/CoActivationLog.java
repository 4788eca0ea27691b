package io.brainrunr.graph;

import io.brainrunr.graph.CoActivationEvent.Origin;
import io.brainrunr.memory.MemoryDatabase;
import io.brainrunr.memory.SQLiteRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Append-only log of co-activations produced by search and recall.
 * Events referencing missing memories are dropped on append.
 */
@Component
public class CoActivationLog {

    private static final Logger log = LoggerFactory.getLogger(CoActivationLog.class);

    private static final String INSERT_EVENT = """
            INSERT INTO coactivation_events (first_id, second_id, origin, occurred_at)
            SELECT ?, ?, ?, ?
            WHERE EXISTS (SELECT 1 FROM memories WHERE id = ?)
              AND EXISTS (SELECT 1 FROM memories WHERE id = ?)
            """;

    private final MemoryDatabase db;
    private final Clock clock;

    public CoActivationLog(MemoryDatabase db, Clock clock) {
        this.db = db;
        this.clock = clock;
    }

    /** Records one event for every unordered pair of distinct ids. */
    public int recordAllPairs(Collection<String> ids, Origin origin) {
        return record(allPairs(ids), origin);
    }

    public int record(Collection<IdPair> pairs, Origin origin) {
        return recordRetrieval(List.of(), pairs, origin);
    }

    /**
     * Marks the retrieved memories accessed and appends the co-activation events in one
     * transaction, so a failed append leaves the access statistics untouched too.
     *
     * @return number of events written
     */
    public int recordRetrieval(Collection<String> accessedIds, Collection<IdPair> pairs, Origin origin) {
        if (accessedIds.isEmpty() && pairs.isEmpty()) {
            return 0;
        }
        long now = Instant.now(clock).toEpochMilli();
        int written = db.inTransaction(conn -> {
            SQLiteRecordStore.markAccessed(conn, accessedIds, now);
            int count = 0;
            try (var stmt = conn.prepareStatement(INSERT_EVENT)) {
                for (IdPair pair : pairs) {
                    stmt.setString(1, pair.low());
                    stmt.setString(2, pair.high());
                    stmt.setString(3, origin.name());
                    stmt.setLong(4, now);
                    stmt.setString(5, pair.low());
                    stmt.setString(6, pair.high());
                    count += stmt.executeUpdate();
                }
            }
            return count;
        });
        log.debug("Logged {} {} co-activation events, {} memories accessed", written, origin, accessedIds.size());
        return written;
    }

    /** Every unordered pair of distinct ids, in first-seen order. */
    public static List<IdPair> allPairs(Collection<String> ids) {
        List<String> distinct = new ArrayList<>(new LinkedHashSet<>(ids));
        List<IdPair> pairs = new ArrayList<>();
        for (int i = 0; i < distinct.size(); i++) {
            for (int j = i + 1; j < distinct.size(); j++) {
                pairs.add(IdPair.of(distinct.get(i), distinct.get(j)));
            }
        }
        return pairs;
    }

    /** Unreplayed events that occurred at or after {@code since}, oldest first. */
    public List<CoActivationEvent> pending(Instant since, int limit) {
        return db.read(conn -> {
            List<CoActivationEvent> events = new ArrayList<>();
            try (var stmt = conn.prepareStatement("""
                    SELECT id, first_id, second_id, origin, occurred_at
                    FROM coactivation_events
                    WHERE replayed_at IS NULL AND occurred_at >= ?
                    ORDER BY occurred_at, id
                    LIMIT ?
                    """)) {
                stmt.setLong(1, since.toEpochMilli());
                stmt.setInt(2, limit);
                try (var rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        events.add(new CoActivationEvent(
                                rs.getLong("id"),
                                new IdPair(rs.getString("first_id"), rs.getString("second_id")),
                                Origin.valueOf(rs.getString("origin")),
                                Instant.ofEpochMilli(rs.getLong("occurred_at")),
                                null));
                    }
                }
            }
            return events;
        });
    }

    /** Marks an event consumed, inside the caller's transaction. */
    public void markReplayed(Connection conn, long eventId) throws SQLException {
        try (var stmt = conn.prepareStatement("UPDATE coactivation_events SET replayed_at = ? WHERE id = ?")) {
            stmt.setLong(1, Instant.now(clock).toEpochMilli());
            stmt.setLong(2, eventId);
            stmt.executeUpdate();
        }
    }

    public int pendingCount() {
        return db.read(conn -> {
            try (var stmt = conn.createStatement();
                 var rs = stmt.executeQuery("SELECT COUNT(*) FROM coactivation_events WHERE replayed_at IS NULL")) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        });
    }
}
