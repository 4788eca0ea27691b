package io.brainrunr.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.brainrunr.config.MemoryProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * SQLite-backed record store. Memories, embeddings, causal links and episodes all live in
 * the one {@link MemoryDatabase} file.
 */
@Component
public class SQLiteRecordStore implements RecordStore {

    private static final Logger log = LoggerFactory.getLogger(SQLiteRecordStore.class);

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final int MAX_CHAIN_DEPTH = 10;
    private static final int MAX_LINK_DEPTH = 5;
    private static final int IN_CLAUSE_CHUNK = 500;

    private static final String SELECT_MEMORY = """
            SELECT m.*, e.vector
            FROM memories m
            LEFT JOIN embeddings e ON e.memory_id = m.id
            """;

    private final MemoryDatabase db;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int dimension;
    private final AtomicLong contentVersion = new AtomicLong();

    public SQLiteRecordStore(MemoryDatabase db, MemoryProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.db = db;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.dimension = properties.embeddingDimension();
    }

    @Override
    public MemoryRecord create(NewMemory memory) {
        return create(memory, List.of());
    }

    @Override
    public MemoryRecord create(NewMemory memory, Collection<String> similarIds) {
        validate(memory);

        String id = UUID.randomUUID().toString();
        Instant now = now();
        MemoryRecord record = new MemoryRecord(
                id, memory.content(), memory.embedding().clone(), memory.emotion(), memory.category(),
                memory.importance(), now, null, 0, memory.media(), memory.camera(), null, memory.tags());

        String sql = """
                INSERT INTO memories (id, content, emotion, category, importance, created_at, last_accessed,
                                      access_count, media_type, media_path, media_transcript,
                                      camera_pan, camera_tilt, episode_id, tags)
                VALUES (?, ?, ?, ?, ?, ?, NULL, 0, ?, ?, ?, ?, ?, NULL, ?)
                """;
        String tagsJson = writeList(record.tags());

        int links = db.inTransaction(conn -> {
            try (var stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, id);
                stmt.setString(2, record.content());
                stmt.setString(3, record.emotion().name());
                stmt.setString(4, record.category().name());
                stmt.setInt(5, record.importance());
                stmt.setLong(6, now.toEpochMilli());
                MediaReference media = record.media();
                stmt.setString(7, media != null ? media.type().name() : null);
                stmt.setString(8, media != null ? media.path() : null);
                stmt.setString(9, media != null ? media.transcript() : null);
                setNullableDouble(stmt, 10, record.camera() != null ? record.camera().pan() : null);
                setNullableDouble(stmt, 11, record.camera() != null ? record.camera().tilt() : null);
                stmt.setString(12, tagsJson);
                stmt.executeUpdate();
            }
            try (var stmt = conn.prepareStatement("INSERT INTO embeddings (memory_id, vector) VALUES (?, ?)")) {
                stmt.setString(1, id);
                stmt.setBytes(2, VectorCodec.encode(record.embedding()));
                stmt.executeUpdate();
            }
            int linked = 0;
            for (String other : new LinkedHashSet<>(similarIds)) {
                if (other.equals(id) || !exists(conn, other)) {
                    continue;
                }
                insertLink(conn, new CausalLink(id, other, CausalLink.SIMILAR, null, now));
                insertLink(conn, new CausalLink(other, id, CausalLink.SIMILAR, null, now));
                linked++;
            }
            return linked;
        });

        contentVersion.incrementAndGet();
        log.debug("Stored memory {}: category={}, emotion={}, importance={}, similar links={}",
                id, record.category(), record.emotion(), record.importance(), links);
        return record;
    }

    @Override
    public MemoryRecord get(String id) {
        return find(id).orElseThrow(() -> NotFoundException.memory(id));
    }

    @Override
    public Optional<MemoryRecord> find(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return db.read(conn -> fetchById(conn, id));
    }

    @Override
    public List<MemoryRecord> getAll(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        return db.read(conn -> fetchByIds(conn, ids));
    }

    @Override
    public void updateAccess(String id) {
        updateAccess(List.of(id));
    }

    @Override
    public void updateAccess(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return;
        }
        long now = now().toEpochMilli();
        db.inTransaction(conn -> {
            markAccessed(conn, ids, now);
            return null;
        });
    }

    @Override
    public List<MemoryRecord> listRecent(int limit, MemoryCategory category) {
        int safeLimit = Math.max(1, limit);
        return db.read(conn -> {
            String sql = category != null
                    ? SELECT_MEMORY + " WHERE m.category = ? ORDER BY m.created_at DESC, m.rowid DESC LIMIT ?"
                    : SELECT_MEMORY + " ORDER BY m.created_at DESC, m.rowid DESC LIMIT ?";
            try (var stmt = conn.prepareStatement(sql)) {
                int idx = 1;
                if (category != null) {
                    stmt.setString(idx++, category.name());
                }
                stmt.setInt(idx, safeLimit);
                return readRecords(stmt);
            }
        });
    }

    @Override
    public List<MemoryRecord> candidates(SearchFilters filters) {
        SearchFilters f = filters != null ? filters : SearchFilters.none();
        List<String> conditions = new ArrayList<>();
        List<Object> params = new ArrayList<>();
        if (f.category() != null) {
            conditions.add("m.category = ?");
            params.add(f.category().name());
        }
        if (f.emotion() != null) {
            conditions.add("m.emotion = ?");
            params.add(f.emotion().name());
        }
        if (f.createdFrom() != null) {
            conditions.add("m.created_at >= ?");
            params.add(f.createdFrom().toEpochMilli());
        }
        if (f.createdTo() != null) {
            conditions.add("m.created_at <= ?");
            params.add(f.createdTo().toEpochMilli());
        }
        String where = conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);

        return db.read(conn -> {
            try (var stmt = conn.prepareStatement(SELECT_MEMORY + where)) {
                for (int i = 0; i < params.size(); i++) {
                    stmt.setObject(i + 1, params.get(i));
                }
                return readRecords(stmt);
            }
        });
    }

    @Override
    public CausalLink createLink(String sourceId, String targetId, String linkType, String note) {
        if (linkType == null || linkType.isBlank()) {
            throw new ValidationException("Link type is required");
        }
        CausalLink link = new CausalLink(sourceId, targetId, linkType.trim(), note, now());

        CausalLink stored = db.inTransaction(conn -> {
            if (!exists(conn, sourceId)) throw NotFoundException.memory(sourceId);
            if (!exists(conn, targetId)) throw NotFoundException.memory(targetId);
            insertLink(conn, link);
            try (var stmt = conn.prepareStatement(
                    "SELECT * FROM links WHERE source_id = ? AND target_id = ? AND link_type = ?")) {
                stmt.setString(1, sourceId);
                stmt.setString(2, targetId);
                stmt.setString(3, link.linkType());
                try (var rs = stmt.executeQuery()) {
                    rs.next();
                    return toLink(rs);
                }
            }
        });
        log.debug("Linked {} -[{}]-> {}", sourceId, stored.linkType(), targetId);
        return stored;
    }

    @Override
    public List<CausalLink> linksFrom(String id) {
        return db.read(conn -> queryLinks(conn, "source_id", id));
    }

    @Override
    public List<CausalLink> linksTo(String id) {
        return db.read(conn -> queryLinks(conn, "target_id", id));
    }

    @Override
    public List<ChainNode> getCausalChain(String id, ChainDirection direction, int maxDepth) {
        int depthLimit = Math.max(1, Math.min(MAX_CHAIN_DEPTH, maxDepth));
        MemoryRecord start = get(id);

        List<ChainNode> chain = new ArrayList<>();
        chain.add(new ChainNode(start, null, 0));
        Set<String> visited = new HashSet<>();
        visited.add(start.id());
        List<String> frontier = List.of(start.id());

        for (int depth = 1; depth <= depthLimit && !frontier.isEmpty(); depth++) {
            List<String> next = new ArrayList<>();
            for (String current : frontier) {
                List<CausalLink> links = direction == ChainDirection.BACKWARD ? linksTo(current) : linksFrom(current);
                for (CausalLink link : links) {
                    String nextId = direction == ChainDirection.BACKWARD ? link.sourceId() : link.targetId();
                    if (!visited.add(nextId)) {
                        continue;
                    }
                    Optional<MemoryRecord> reached = find(nextId);
                    if (reached.isPresent()) {
                        chain.add(new ChainNode(reached.get(), link.linkType(), depth));
                        next.add(nextId);
                    }
                }
            }
            frontier = next;
        }
        return chain;
    }

    @Override
    public List<MemoryRecord> getLinkedMemories(String id, int depth) {
        int hops = Math.max(1, Math.min(MAX_LINK_DEPTH, depth));
        MemoryRecord start = get(id);

        List<String> order = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        visited.add(start.id());
        List<String> frontier = List.of(start.id());
        for (int hop = 1; hop <= hops && !frontier.isEmpty(); hop++) {
            List<String> next = new ArrayList<>();
            for (String current : frontier) {
                for (CausalLink link : linksFrom(current)) {
                    if (visited.add(link.targetId())) {
                        next.add(link.targetId());
                    }
                }
                for (CausalLink link : linksTo(current)) {
                    if (visited.add(link.sourceId())) {
                        next.add(link.sourceId());
                    }
                }
            }
            order.addAll(next);
            frontier = next;
        }

        Map<String, MemoryRecord> byId = new HashMap<>();
        getAll(order).forEach(r -> byId.put(r.id(), r));
        return order.stream().filter(byId::containsKey).map(byId::get).toList();
    }

    @Override
    public Episode createEpisode(String title, List<String> memoryIds, List<String> participants, String summary) {
        if (title == null || title.isBlank()) {
            throw new ValidationException("Episode title is required");
        }
        if (memoryIds == null || memoryIds.isEmpty()) {
            throw new ValidationException("memory_ids cannot be empty");
        }
        List<String> members = List.copyOf(new LinkedHashSet<>(memoryIds));
        String episodeId = UUID.randomUUID().toString();
        Instant now = now();

        Episode episode = db.inTransaction(conn -> {
            List<MemoryRecord> records = fetchByIds(conn, members);
            Set<String> found = new HashSet<>();
            for (MemoryRecord r : records) {
                found.add(r.id());
                if (r.episodeId() != null) {
                    throw new ValidationException("Memory %s already belongs to episode %s".formatted(r.id(), r.episodeId()));
                }
            }
            for (String memberId : members) {
                if (!found.contains(memberId)) throw NotFoundException.memory(memberId);
            }

            MemoryRecord mostImportant = records.stream()
                    .max(Comparator.comparingInt(MemoryRecord::importance)
                            .thenComparing(MemoryRecord::createdAt, Comparator.reverseOrder()))
                    .orElseThrow();
            Instant start = records.stream().map(MemoryRecord::createdAt).min(Comparator.naturalOrder()).orElse(now);
            Instant end = records.stream().map(MemoryRecord::createdAt).max(Comparator.naturalOrder()).orElse(now);

            Episode created = new Episode(episodeId, title.trim(), members, participants,
                    summary != null ? summary : "", start, end, mostImportant.emotion(), mostImportant.importance());

            try (var stmt = conn.prepareStatement("""
                    INSERT INTO episodes (id, title, memory_ids, participants, summary, start_time, end_time,
                                          emotion, importance, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                    """)) {
                stmt.setString(1, created.id());
                stmt.setString(2, created.title());
                stmt.setString(3, writeList(created.memoryIds()));
                stmt.setString(4, writeList(created.participants()));
                stmt.setString(5, created.summary());
                stmt.setLong(6, start.toEpochMilli());
                stmt.setLong(7, end.toEpochMilli());
                stmt.setString(8, created.emotion().name());
                stmt.setInt(9, created.importance());
                stmt.setLong(10, now.toEpochMilli());
                stmt.executeUpdate();
            }
            try (var stmt = conn.prepareStatement("UPDATE memories SET episode_id = ? WHERE id = ?")) {
                for (String memberId : members) {
                    stmt.setString(1, episodeId);
                    stmt.setString(2, memberId);
                    stmt.addBatch();
                }
                stmt.executeBatch();
            }
            return created;
        });

        log.info("Created episode '{}' with {} memories", episode.title(), episode.memoryIds().size());
        return episode;
    }

    @Override
    public Episode getEpisode(String episodeId) {
        return db.read(conn -> {
            try (var stmt = conn.prepareStatement("SELECT * FROM episodes WHERE id = ?")) {
                stmt.setString(1, episodeId);
                try (var rs = stmt.executeQuery()) {
                    if (rs.next()) {
                        return toEpisode(rs);
                    }
                }
            }
            throw NotFoundException.episode(episodeId);
        });
    }

    @Override
    public List<Episode> listEpisodes() {
        return db.read(conn -> {
            List<Episode> episodes = new ArrayList<>();
            try (var stmt = conn.createStatement();
                 var rs = stmt.executeQuery("SELECT * FROM episodes ORDER BY start_time DESC, rowid DESC")) {
                while (rs.next()) {
                    episodes.add(toEpisode(rs));
                }
            }
            return episodes;
        });
    }

    @Override
    public boolean deleteEpisode(String episodeId) {
        boolean deleted = db.inTransaction(conn -> {
            try (var stmt = conn.prepareStatement("UPDATE memories SET episode_id = NULL WHERE episode_id = ?")) {
                stmt.setString(1, episodeId);
                stmt.executeUpdate();
            }
            try (var stmt = conn.prepareStatement("DELETE FROM episodes WHERE id = ?")) {
                stmt.setString(1, episodeId);
                return stmt.executeUpdate() > 0;
            }
        });
        if (deleted) {
            log.info("Deleted episode {}", episodeId);
        }
        return deleted;
    }

    @Override
    public void delete(String id) {
        db.inTransaction(conn -> {
            Optional<MemoryRecord> existing = fetchById(conn, id);
            if (existing.isEmpty()) {
                throw NotFoundException.memory(id);
            }
            String episodeId = existing.get().episodeId();
            if (episodeId != null) {
                removeEpisodeMember(conn, episodeId, id);
            }
            // embeddings, links, associations and pending events cascade
            try (var stmt = conn.prepareStatement("DELETE FROM memories WHERE id = ?")) {
                stmt.setString(1, id);
                stmt.executeUpdate();
            }
            return null;
        });
        contentVersion.incrementAndGet();
        log.info("Deleted memory {}", id);
    }

    @Override
    public int count() {
        return db.read(conn -> {
            try (var stmt = conn.createStatement();
                 var rs = stmt.executeQuery("SELECT COUNT(*) FROM memories")) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        });
    }

    @Override
    public MemoryStats stats() {
        return db.read(conn -> {
            Map<MemoryCategory, Integer> byCategory = new EnumMap<>(MemoryCategory.class);
            Map<Emotion, Integer> byEmotion = new EnumMap<>(Emotion.class);
            int total = 0;
            try (var stmt = conn.createStatement();
                 var rs = stmt.executeQuery("SELECT category, emotion, COUNT(*) FROM memories GROUP BY category, emotion")) {
                while (rs.next()) {
                    int n = rs.getInt(3);
                    byCategory.merge(MemoryCategory.valueOf(rs.getString(1)), n, Integer::sum);
                    byEmotion.merge(Emotion.valueOf(rs.getString(2)), n, Integer::sum);
                    total += n;
                }
            }
            Instant oldest = null;
            Instant newest = null;
            try (var stmt = conn.createStatement();
                 var rs = stmt.executeQuery("SELECT MIN(created_at), MAX(created_at) FROM memories")) {
                if (rs.next()) {
                    oldest = readInstant(rs, 1);
                    newest = readInstant(rs, 2);
                }
            }
            return new MemoryStats(total, byCategory, byEmotion, oldest, newest);
        });
    }

    @Override
    public List<MemoryRecord> findImportant(int minImportance, int minAccessCount, int limit) {
        return db.read(conn -> {
            try (var stmt = conn.prepareStatement(SELECT_MEMORY + """
                     WHERE m.importance >= ? AND m.access_count >= ?
                    ORDER BY COALESCE(m.last_accessed, m.created_at) DESC
                    LIMIT ?
                    """)) {
                stmt.setInt(1, minImportance);
                stmt.setInt(2, minAccessCount);
                stmt.setInt(3, Math.max(1, limit));
                return readRecords(stmt);
            }
        });
    }

    @Override
    public List<AccessStat> accessStatistics(int limit) {
        return db.read(conn -> {
            List<AccessStat> stats = new ArrayList<>();
            try (var stmt = conn.prepareStatement("""
                    SELECT id, access_count, last_accessed, created_at
                    FROM memories
                    ORDER BY COALESCE(last_accessed, created_at) DESC
                    LIMIT ?
                    """)) {
                stmt.setInt(1, Math.max(1, limit));
                try (var rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        stats.add(new AccessStat(
                                rs.getString("id"),
                                rs.getInt("access_count"),
                                readInstant(rs, "last_accessed"),
                                readInstant(rs, "created_at")));
                    }
                }
            }
            return stats;
        });
    }

    @Override
    public int decayAccessCounts(double factor) {
        if (!(factor > 0.0 && factor <= 1.0)) {
            throw new ValidationException("Decay factor must be in (0, 1]: " + factor);
        }
        int changed = db.inTransaction(conn -> {
            try (var stmt = conn.prepareStatement("""
                    UPDATE memories SET access_count = CAST(access_count * ? AS INTEGER)
                    WHERE CAST(access_count * ? AS INTEGER) <> access_count
                    """)) {
                stmt.setDouble(1, factor);
                stmt.setDouble(2, factor);
                return stmt.executeUpdate();
            }
        });
        log.info("Decayed access counts by {} on {} memories", factor, changed);
        return changed;
    }

    @Override
    public Map<String, String> contents() {
        return db.read(conn -> {
            Map<String, String> contents = new HashMap<>();
            try (var stmt = conn.createStatement();
                 var rs = stmt.executeQuery("SELECT id, content FROM memories")) {
                while (rs.next()) {
                    contents.put(rs.getString(1), rs.getString(2));
                }
            }
            return contents;
        });
    }

    @Override
    public long contentVersion() {
        return contentVersion.get();
    }

    @Override
    public boolean healthCheck() {
        return db.healthCheck();
    }

    /**
     * Whether a memory exists, for use inside a caller's transaction.
     */
    public static boolean exists(Connection conn, String id) throws SQLException {
        try (var stmt = conn.prepareStatement("SELECT 1 FROM memories WHERE id = ?")) {
            stmt.setString(1, id);
            try (var rs = stmt.executeQuery()) {
                return rs.next();
            }
        }
    }

    /**
     * Increments the access count and sets the last access time of each id, inside a caller's
     * transaction. Unknown ids are ignored.
     */
    public static void markAccessed(Connection conn, Collection<String> ids, long nowMillis) throws SQLException {
        if (ids.isEmpty()) {
            return;
        }
        try (var stmt = conn.prepareStatement(
                "UPDATE memories SET access_count = access_count + 1, last_accessed = ? WHERE id = ?")) {
            for (String id : new LinkedHashSet<>(ids)) {
                stmt.setLong(1, nowMillis);
                stmt.setString(2, id);
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
    }

    /**
     * Inserts a link inside a caller's transaction. Both memories must exist.
     *
     * @return false if the same (source, target, type) link already existed
     */
    public static boolean insertLink(Connection conn, CausalLink link) throws SQLException {
        try (var stmt = conn.prepareStatement("""
                INSERT OR IGNORE INTO links (source_id, target_id, link_type, note, created_at)
                VALUES (?, ?, ?, ?, ?)
                """)) {
            stmt.setString(1, link.sourceId());
            stmt.setString(2, link.targetId());
            stmt.setString(3, link.linkType());
            stmt.setString(4, link.note());
            stmt.setLong(5, link.createdAt().toEpochMilli());
            return stmt.executeUpdate() > 0;
        }
    }

    private void validate(NewMemory memory) {
        if (memory == null) {
            throw new ValidationException("Memory is required");
        }
        if (memory.content() == null || memory.content().isBlank()) {
            throw new ValidationException("Memory content is required");
        }
        if (memory.emotion() == null) {
            throw new ValidationException("Emotion is required");
        }
        if (memory.category() == null) {
            throw new ValidationException("Category is required");
        }
        if (memory.importance() < 1 || memory.importance() > 5) {
            throw new ValidationException("Importance must be between 1 and 5: " + memory.importance());
        }
        float[] embedding = memory.embedding();
        if (embedding == null || embedding.length != dimension) {
            throw new ValidationException("Embedding dimension must be %d, got %d"
                    .formatted(dimension, embedding == null ? 0 : embedding.length));
        }
        for (float v : embedding) {
            if (!Float.isFinite(v)) {
                throw new ValidationException("Embedding contains a non-finite value");
            }
        }
    }

    private Optional<MemoryRecord> fetchById(Connection conn, String id) throws SQLException {
        try (var stmt = conn.prepareStatement(SELECT_MEMORY + " WHERE m.id = ?")) {
            stmt.setString(1, id);
            List<MemoryRecord> found = readRecords(stmt);
            return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
        }
    }

    private List<MemoryRecord> fetchByIds(Connection conn, Collection<String> ids) throws SQLException {
        List<String> distinct = new ArrayList<>(new LinkedHashSet<>(ids));
        List<MemoryRecord> records = new ArrayList<>();
        for (int from = 0; from < distinct.size(); from += IN_CLAUSE_CHUNK) {
            List<String> chunk = distinct.subList(from, Math.min(distinct.size(), from + IN_CLAUSE_CHUNK));
            StringJoiner placeholders = new StringJoiner(",", "(", ")");
            chunk.forEach(x -> placeholders.add("?"));
            try (var stmt = conn.prepareStatement(SELECT_MEMORY + " WHERE m.id IN " + placeholders)) {
                for (int i = 0; i < chunk.size(); i++) {
                    stmt.setString(i + 1, chunk.get(i));
                }
                records.addAll(readRecords(stmt));
            }
        }
        return records;
    }

    private List<CausalLink> queryLinks(Connection conn, String column, String id) throws SQLException {
        List<CausalLink> links = new ArrayList<>();
        try (var stmt = conn.prepareStatement(
                "SELECT * FROM links WHERE " + column + " = ? ORDER BY created_at, rowid")) {
            stmt.setString(1, id);
            try (var rs = stmt.executeQuery()) {
                while (rs.next()) {
                    links.add(toLink(rs));
                }
            }
        }
        return links;
    }

    private void removeEpisodeMember(Connection conn, String episodeId, String memoryId) throws SQLException {
        List<String> members;
        try (var stmt = conn.prepareStatement("SELECT memory_ids FROM episodes WHERE id = ?")) {
            stmt.setString(1, episodeId);
            try (var rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return;
                }
                members = new ArrayList<>(readList(rs.getString(1)));
            }
        }
        members.remove(memoryId);
        try (var stmt = conn.prepareStatement("UPDATE episodes SET memory_ids = ? WHERE id = ?")) {
            stmt.setString(1, writeList(members));
            stmt.setString(2, episodeId);
            stmt.executeUpdate();
        }
    }

    private List<MemoryRecord> readRecords(PreparedStatement stmt) throws SQLException {
        List<MemoryRecord> records = new ArrayList<>();
        try (var rs = stmt.executeQuery()) {
            while (rs.next()) {
                records.add(toRecord(rs));
            }
        }
        return records;
    }

    private MemoryRecord toRecord(ResultSet rs) throws SQLException {
        String mediaType = rs.getString("media_type");
        MediaReference media = mediaType == null ? null : new MediaReference(
                MediaReference.MediaType.valueOf(mediaType),
                rs.getString("media_path"),
                rs.getString("media_transcript"));

        double pan = rs.getDouble("camera_pan");
        boolean noCamera = rs.wasNull();
        double tilt = rs.getDouble("camera_tilt");
        CameraPose camera = noCamera || rs.wasNull() ? null : new CameraPose(pan, tilt);

        return new MemoryRecord(
                rs.getString("id"),
                rs.getString("content"),
                VectorCodec.decode(rs.getBytes("vector")),
                Emotion.valueOf(rs.getString("emotion")),
                MemoryCategory.valueOf(rs.getString("category")),
                rs.getInt("importance"),
                readInstant(rs, "created_at"),
                readInstant(rs, "last_accessed"),
                rs.getInt("access_count"),
                media,
                camera,
                rs.getString("episode_id"),
                readList(rs.getString("tags"))
        );
    }

    private CausalLink toLink(ResultSet rs) throws SQLException {
        return new CausalLink(
                rs.getString("source_id"),
                rs.getString("target_id"),
                rs.getString("link_type"),
                rs.getString("note"),
                readInstant(rs, "created_at"));
    }

    private Episode toEpisode(ResultSet rs) throws SQLException {
        return new Episode(
                rs.getString("id"),
                rs.getString("title"),
                readList(rs.getString("memory_ids")),
                readList(rs.getString("participants")),
                rs.getString("summary"),
                readInstant(rs, "start_time"),
                readInstant(rs, "end_time"),
                Emotion.valueOf(rs.getString("emotion")),
                rs.getInt("importance"));
    }

    private Instant now() {
        return Instant.now(clock).truncatedTo(ChronoUnit.MILLIS);
    }

    private static Instant readInstant(ResultSet rs, String column) throws SQLException {
        long millis = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(millis);
    }

    private static Instant readInstant(ResultSet rs, int column) throws SQLException {
        long millis = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(millis);
    }

    private static void setNullableDouble(PreparedStatement stmt, int idx, Double value) throws SQLException {
        if (value == null) {
            stmt.setNull(idx, Types.REAL);
        } else {
            stmt.setDouble(idx, value);
        }
    }

    private String writeList(List<String> values) {
        try {
            return objectMapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Cannot serialize list: " + e.getMessage());
        }
    }

    private List<String> readList(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring malformed list column: {}", e.getMessage());
            return List.of();
        }
    }
}
