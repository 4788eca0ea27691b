package io.brainrunr.tool;

import io.brainrunr.consolidation.ConsolidationStats;
import io.brainrunr.episode.EpisodeManager;
import io.brainrunr.graph.DivergentDiagnostics;
import io.brainrunr.graph.DivergentRecall;
import io.brainrunr.graph.DivergentRecallEngine;
import io.brainrunr.graph.RecallResult;
import io.brainrunr.memory.AssociatedRecall;
import io.brainrunr.memory.CameraPose;
import io.brainrunr.memory.CausalLink;
import io.brainrunr.memory.ChainDirection;
import io.brainrunr.memory.ChainNode;
import io.brainrunr.memory.Emotion;
import io.brainrunr.memory.Episode;
import io.brainrunr.memory.MediaReference;
import io.brainrunr.memory.MemoryCategory;
import io.brainrunr.memory.MemoryRecord;
import io.brainrunr.memory.MemoryService;
import io.brainrunr.memory.MemoryStats;
import io.brainrunr.memory.SearchFilters;
import io.brainrunr.memory.ValidationException;
import io.brainrunr.search.ScoredMemory;
import io.brainrunr.workingset.WorkingSetEntry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Tools for storing, searching, associating and consolidating memories.
 */
@Component
public class MemoryTools {

    private static final Logger log = LoggerFactory.getLogger(MemoryTools.class);

    private static final String EMOTIONS = "[\"happy\", \"sad\", \"surprised\", \"moved\", \"excited\", \"nostalgic\", \"curious\", \"neutral\"]";
    private static final String CATEGORIES = "[\"daily\", \"philosophical\", \"technical\", \"memory\", \"observation\", \"feeling\", \"conversation\"]";

    private final ToolRegistry toolRegistry;
    private final MemoryService memory;
    private final EpisodeManager episodes;

    public MemoryTools(ToolRegistry toolRegistry, MemoryService memory, EpisodeManager episodes) {
        this.toolRegistry = toolRegistry;
        this.memory = memory;
        this.episodes = episodes;
    }

    @PostConstruct
    public void registerTools() {
        toolRegistry.register("remember",
                "Save a memory to long-term storage: experiences, conversations, observations or learnings.",
                """
                {"type": "object", "properties": {
                  "content": {"type": "string", "description": "The memory content to save"},
                  "emotion": {"type": "string", "default": "neutral", "enum": %s},
                  "importance": {"type": "integer", "default": 3, "minimum": 1, "maximum": 5},
                  "category": {"type": "string", "default": "daily", "enum": %s},
                  "tags": {"type": "array", "items": {"type": "string"}},
                  "image_path": {"type": "string", "description": "Image captured with this memory"},
                  "audio_path": {"type": "string", "description": "Audio captured with this memory"},
                  "transcript": {"type": "string", "description": "Transcript of the audio"},
                  "camera_pan": {"type": "number", "description": "Camera pan in degrees"},
                  "camera_tilt": {"type": "number", "description": "Camera tilt in degrees"},
                  "auto_link": {"type": "boolean", "default": true, "description": "Link to similar existing memories"},
                  "link_threshold": {"type": "number", "default": 0.8, "minimum": 0, "maximum": 2,
                                     "description": "Cosine distance at most this links; lower demands closer memories"}
                }, "required": ["content"]}
                """.formatted(EMOTIONS, CATEGORIES),
                this::remember);

        toolRegistry.register("search_memories",
                "Search memories by meaning and wording, with optional filters.",
                """
                {"type": "object", "properties": {
                  "query": {"type": "string"},
                  "n_results": {"type": "integer", "default": 5, "minimum": 1, "maximum": 50},
                  "emotion_filter": {"type": "string", "enum": %s},
                  "category_filter": {"type": "string", "enum": %s},
                  "date_from": {"type": "string", "description": "ISO 8601 date or instant"},
                  "date_to": {"type": "string", "description": "ISO 8601 date or instant"}
                }, "required": ["query"]}
                """.formatted(EMOTIONS, CATEGORIES),
                this::searchMemories);

        toolRegistry.register("recall",
                "Recall memories relevant to the current conversation context. "
                        + "Recent, emotional and important memories come first.",
                """
                {"type": "object", "properties": {
                  "context": {"type": "string"},
                  "n_results": {"type": "integer", "default": 3, "minimum": 1, "maximum": 10}
                }, "required": ["context"]}
                """,
                this::recall);

        toolRegistry.register("recall_with_associations",
                "Recall memories for the context together with the memories linked to them.",
                """
                {"type": "object", "properties": {
                  "context": {"type": "string"},
                  "n_results": {"type": "integer", "default": 3, "minimum": 1, "maximum": 10},
                  "chain_depth": {"type": "integer", "default": 1, "minimum": 1, "maximum": 3}
                }, "required": ["context"]}
                """,
                this::recallWithAssociations);

        toolRegistry.register("get_memory_chain",
                "A memory and every memory linked to it, in either direction.",
                """
                {"type": "object", "properties": {
                  "memory_id": {"type": "string"},
                  "depth": {"type": "integer", "default": 2, "minimum": 1, "maximum": 5}
                }, "required": ["memory_id"]}
                """,
                this::memoryChain);

        toolRegistry.register("search_important_memories",
                "Memories that are both important and often recalled, most recently accessed first.",
                """
                {"type": "object", "properties": {
                  "min_importance": {"type": "integer", "default": 4, "minimum": 1, "maximum": 5},
                  "min_access_count": {"type": "integer", "default": 5, "minimum": 0},
                  "n_results": {"type": "integer", "default": 10, "minimum": 1, "maximum": 100}
                }}
                """,
                this::searchImportant);

        toolRegistry.register("decay_access_counts",
                "Scale every access count down so old habits fade from the working set.",
                """
                {"type": "object", "properties": {
                  "factor": {"type": "number", "default": 0.5, "exclusiveMinimum": 0, "maximum": 1}
                }}
                """,
                this::decayAccessCounts);

        toolRegistry.register("list_recent_memories",
                "List the most recently created memories.",
                """
                {"type": "object", "properties": {
                  "limit": {"type": "integer", "default": 10, "minimum": 1, "maximum": 100},
                  "category_filter": {"type": "string", "enum": %s}
                }}
                """.formatted(CATEGORIES),
                this::listRecent);

        toolRegistry.register("get_memory_stats",
                "Counts of stored memories by category and emotion.",
                "{\"type\": \"object\", \"properties\": {}}",
                args -> stats());

        toolRegistry.register("recall_divergent",
                "Surface memories associated with the context through the association graph. "
                        + "Higher temperature explores weaker associations.",
                """
                {"type": "object", "properties": {
                  "context": {"type": "string"},
                  "n_results": {"type": "integer", "default": 5, "minimum": 1, "maximum": 20},
                  "max_branches": {"type": "integer", "default": 3, "minimum": 1, "maximum": 8},
                  "max_depth": {"type": "integer", "default": 3, "minimum": 1, "maximum": 5},
                  "temperature": {"type": "number", "default": 0.7, "minimum": 0, "maximum": 10}
                }, "required": ["context"]}
                """,
                this::recallDivergent);

        toolRegistry.register("get_association_diagnostics",
                "Inspect how divergent recall would branch for a context, without recording anything.",
                """
                {"type": "object", "properties": {
                  "context": {"type": "string"},
                  "sample_size": {"type": "integer", "default": 20, "minimum": 3, "maximum": 20}
                }, "required": ["context"]}
                """,
                this::associationDiagnostics);

        toolRegistry.register("consolidate_memories",
                "Replay recent co-activations into the association graph.",
                """
                {"type": "object", "properties": {
                  "window_hours": {"type": "integer", "default": 24, "minimum": 1},
                  "max_replay_events": {"type": "integer", "default": 200, "minimum": 1},
                  "link_update_strength": {"type": "number", "default": 0.2, "minimum": 0.05, "maximum": 1.0}
                }}
                """,
                this::consolidate);

        toolRegistry.register("link_memories",
                "Create a directed causal link between two memories.",
                """
                {"type": "object", "properties": {
                  "source_id": {"type": "string"},
                  "target_id": {"type": "string"},
                  "link_type": {"type": "string", "default": "caused_by", "description": "caused_by, leads_to, related, ..."},
                  "note": {"type": "string"}
                }, "required": ["source_id", "target_id"]}
                """,
                this::linkMemories);

        toolRegistry.register("get_causal_chain",
                "Follow causal links from a memory, forward to effects or backward to causes.",
                """
                {"type": "object", "properties": {
                  "memory_id": {"type": "string"},
                  "direction": {"type": "string", "default": "forward", "enum": ["forward", "backward"]},
                  "max_depth": {"type": "integer", "default": 3, "minimum": 1, "maximum": 10}
                }, "required": ["memory_id"]}
                """,
                this::causalChain);

        toolRegistry.register("create_episode",
                "Group memories into a named episode.",
                """
                {"type": "object", "properties": {
                  "title": {"type": "string"},
                  "memory_ids": {"type": "array", "items": {"type": "string"}},
                  "participants": {"type": "array", "items": {"type": "string"}},
                  "summary": {"type": "string"}
                }, "required": ["title", "memory_ids"]}
                """,
                this::createEpisode);

        toolRegistry.register("get_episode_memories",
                "List the memories of an episode in chronological order.",
                """
                {"type": "object", "properties": {"episode_id": {"type": "string"}}, "required": ["episode_id"]}
                """,
                this::episodeMemories);

        toolRegistry.register("search_episodes",
                "Search episodes by title and summary.",
                """
                {"type": "object", "properties": {
                  "query": {"type": "string"},
                  "n_results": {"type": "integer", "default": 5, "minimum": 1}
                }, "required": ["query"]}
                """,
                this::searchEpisodes);

        toolRegistry.register("get_working_set",
                "The memories currently most active.",
                """
                {"type": "object", "properties": {"refresh": {"type": "boolean", "default": false}}}
                """,
                this::workingSet);

        log.info("Registered {} memory tools", toolRegistry.getAllToolNames().size());
    }

    private ToolResult remember(Map<String, Object> args) {
        String content = requiredString(args, "content");
        MediaReference media = null;
        String imagePath = stringArg(args, "image_path", "");
        String audioPath = stringArg(args, "audio_path", "");
        if (!audioPath.isBlank()) {
            media = MediaReference.audio(audioPath, stringArg(args, "transcript", null));
        } else if (!imagePath.isBlank()) {
            media = MediaReference.image(imagePath);
        }
        CameraPose camera = args.containsKey("camera_pan") || args.containsKey("camera_tilt")
                ? new CameraPose(doubleArg(args, "camera_pan", 0.0), doubleArg(args, "camera_tilt", 0.0))
                : null;

        Emotion emotion = Emotion.fromString(stringArg(args, "emotion", ""));
        MemoryCategory category = MemoryCategory.fromString(stringArg(args, "category", ""));
        int importance = intArg(args, "importance", 3);
        List<String> tags = listArg(args, "tags");
        if (!boolArg(args, "auto_link", true)) {
            MemoryRecord record = memory.remember(content, emotion, category, importance, media, camera, tags);
            return ToolResult.of(saved(record));
        }
        MemoryRecord record = memory.rememberWithAutoLink(content, emotion, category, importance, media, camera, tags,
                doubleArg(args, "link_threshold", MemoryService.DEFAULT_LINK_THRESHOLD));
        int linked = memory.linkedMemories(record.id(), 1).size();
        return ToolResult.of(linked == 0 ? saved(record) : saved(record) + ", linked to %d similar memories".formatted(linked));
    }

    private static String saved(MemoryRecord record) {
        return "Memory saved (id: %s) [%s|%s|importance %d]".formatted(
                record.id(), record.category().tag(), record.emotion().tag(), record.importance());
    }

    private ToolResult searchMemories(Map<String, Object> args) {
        String query = requiredString(args, "query");
        String emotion = stringArg(args, "emotion_filter", "");
        String category = stringArg(args, "category_filter", "");
        SearchFilters filters = new SearchFilters(
                category.isBlank() ? null : MemoryCategory.fromString(category),
                emotion.isBlank() ? null : Emotion.fromString(emotion),
                instantArg(args, "date_from", false),
                instantArg(args, "date_to", true));
        List<ScoredMemory> results = memory.search(query, filters, intArg(args, "n_results", 5));
        return formatScored(query, results);
    }

    private ToolResult recall(Map<String, Object> args) {
        String context = requiredString(args, "context");
        int n = Math.max(1, Math.min(10, intArg(args, "n_results", 3)));
        return formatScored(context, memory.recall(context, n));
    }

    private ToolResult recallWithAssociations(Map<String, Object> args) {
        String context = requiredString(args, "context");
        AssociatedRecall recall = memory.recallWithAssociations(context,
                Math.max(1, Math.min(10, intArg(args, "n_results", 3))), intArg(args, "chain_depth", 1));
        if (recall.primary().isEmpty()) {
            return ToolResult.of("No memories found matching: " + context);
        }
        StringJoiner output = new StringJoiner("\n");
        output.add("Recalled %d memories with %d linked associations:".formatted(
                recall.primary().size(), recall.linked().size()));
        for (ScoredMemory s : recall.primary()) {
            output.add("%s [%d%%]".formatted(describe(s.record()), (int) Math.round(s.score() * 100)));
        }
        if (!recall.linked().isEmpty()) {
            output.add("Linked:");
            recall.linked().forEach(r -> output.add("  " + describe(r)));
        }
        return ToolResult.of(output.toString());
    }

    private ToolResult memoryChain(Map<String, Object> args) {
        String id = requiredString(args, "memory_id");
        MemoryRecord start = memory.get(id);
        List<MemoryRecord> linked = memory.linkedMemories(id, intArg(args, "depth", 2));
        StringJoiner output = new StringJoiner("\n");
        output.add("Memory chain from %s (%d linked):".formatted(id, linked.size()));
        output.add(describe(start));
        if (linked.isEmpty()) {
            output.add("No linked memories found.");
        }
        linked.forEach(r -> output.add("  " + describe(r)));
        return ToolResult.of(output.toString());
    }

    private ToolResult searchImportant(Map<String, Object> args) {
        List<MemoryRecord> records = memory.findImportant(intArg(args, "min_importance", 4),
                intArg(args, "min_access_count", 5), intArg(args, "n_results", 10));
        if (records.isEmpty()) {
            return ToolResult.of("No important memories yet.");
        }
        StringJoiner output = new StringJoiner("\n");
        output.add("%d important memories:".formatted(records.size()));
        records.forEach(r -> output.add("%s (accessed %d times)".formatted(describe(r), r.accessCount())));
        return ToolResult.of(output.toString());
    }

    private ToolResult decayAccessCounts(Map<String, Object> args) {
        double factor = doubleArg(args, "factor", 0.5);
        int changed = memory.decayAccessCounts(factor);
        return ToolResult.of("Access counts scaled by %.2f: %d memories changed".formatted(factor, changed));
    }

    private ToolResult listRecent(Map<String, Object> args) {
        String category = stringArg(args, "category_filter", "");
        List<MemoryRecord> records = memory.listRecent(intArg(args, "limit", 10),
                category.isBlank() ? null : MemoryCategory.fromString(category));
        if (records.isEmpty()) {
            return ToolResult.of("No memories yet.");
        }
        StringJoiner output = new StringJoiner("\n");
        output.add("%d recent memories:".formatted(records.size()));
        records.forEach(r -> output.add(describe(r)));
        return ToolResult.of(output.toString());
    }

    private ToolResult stats() {
        MemoryStats stats = memory.stats();
        StringJoiner output = new StringJoiner("\n");
        output.add("Total memories: " + stats.totalCount());
        stats.byCategory().forEach((c, n) -> output.add("- %s: %d".formatted(c.tag(), n)));
        stats.byEmotion().forEach((e, n) -> output.add("- %s: %d".formatted(e.tag(), n)));
        if (stats.oldest() != null) {
            output.add("Span: %s .. %s".formatted(stats.oldest(), stats.newest()));
        }
        return ToolResult.of(output.toString());
    }

    private ToolResult recallDivergent(Map<String, Object> args) {
        String context = requiredString(args, "context");
        DivergentRecall recall = memory.recallDivergent(context,
                intArg(args, "n_results", DivergentRecallEngine.DEFAULT_RESULTS),
                intArg(args, "max_branches", DivergentRecallEngine.DEFAULT_BRANCHES),
                intArg(args, "max_depth", DivergentRecallEngine.DEFAULT_DEPTH),
                doubleArg(args, "temperature", DivergentRecallEngine.DEFAULT_TEMPERATURE));
        if (recall.results().isEmpty()) {
            return ToolResult.of("No associations found for: " + context);
        }
        StringJoiner output = new StringJoiner("\n");
        output.add("%d associated memories:".formatted(recall.results().size()));
        for (RecallResult r : recall.results()) {
            output.add("%s (activation %.3f, %d hops from %s)".formatted(
                    describe(r.record()), r.activation(), r.hops(), r.seedId()));
        }
        return ToolResult.of(output.toString());
    }

    private ToolResult associationDiagnostics(Map<String, Object> args) {
        DivergentDiagnostics d = memory.associationDiagnostics(requiredString(args, "context"),
                intArg(args, "sample_size", 20));
        return ToolResult.of("""
                seeds: %d
                step budget: %d
                expanded nodes: %d
                traversal steps: %d
                visited nodes: %d
                average branching: %.2f
                deepest hop: %d
                temperature: %.2f""".formatted(d.seedCount(), d.stepBudget(), d.expandedNodes(),
                d.traversalSteps(), d.visitedNodes(), d.averageBranching(), d.deepestHop(), d.temperature()));
    }

    private ToolResult consolidate(Map<String, Object> args) {
        ConsolidationStats stats = memory.consolidate(
                intArg(args, "window_hours", 24),
                intArg(args, "max_replay_events", 200),
                doubleArg(args, "link_update_strength", 0.2));
        return ToolResult.of("Consolidation: %d events replayed, %d edge updates, %d links added, %d skipped, %d memories refreshed"
                .formatted(stats.replayEvents(), stats.edgeUpdates(), stats.linkUpdates(),
                        stats.skippedEvents(), stats.refreshedMemories()));
    }

    private ToolResult linkMemories(Map<String, Object> args) {
        CausalLink link = memory.link(requiredString(args, "source_id"), requiredString(args, "target_id"),
                stringArg(args, "link_type", CausalLink.CAUSED_BY), stringArg(args, "note", null));
        return ToolResult.of("Linked %s -[%s]-> %s".formatted(link.sourceId(), link.linkType(), link.targetId()));
    }

    private ToolResult causalChain(Map<String, Object> args) {
        ChainDirection direction = ChainDirection.fromString(stringArg(args, "direction", ""));
        List<ChainNode> chain = memory.causalChain(requiredString(args, "memory_id"), direction,
                intArg(args, "max_depth", 3));
        StringJoiner output = new StringJoiner("\n");
        output.add("Causal chain (%s, %d memories):".formatted(direction.name().toLowerCase(), chain.size()));
        for (ChainNode node : chain) {
            String via = node.linkType() == null ? "start" : node.linkType();
            output.add("%s[%d, %s] %s".formatted("  ".repeat(node.depth()), node.depth(), via, describe(node.record())));
        }
        return ToolResult.of(output.toString());
    }

    private ToolResult createEpisode(Map<String, Object> args) {
        Episode episode = episodes.create(requiredString(args, "title"), listArg(args, "memory_ids"),
                listArg(args, "participants"), stringArg(args, "summary", null));
        return ToolResult.of("Episode created (id: %s): %s, %d memories".formatted(
                episode.id(), episode.title(), episode.memoryIds().size()));
    }

    private ToolResult episodeMemories(Map<String, Object> args) {
        String episodeId = requiredString(args, "episode_id");
        Episode episode = episodes.get(episodeId);
        List<MemoryRecord> members = episodes.getEpisodeMemories(episodeId);
        StringJoiner output = new StringJoiner("\n");
        output.add("Episode '%s' (%d memories):".formatted(episode.title(), members.size()));
        members.forEach(m -> output.add(describe(m)));
        return ToolResult.of(output.toString());
    }

    private ToolResult searchEpisodes(Map<String, Object> args) {
        String query = requiredString(args, "query");
        List<Episode> found = episodes.search(query, intArg(args, "n_results", 5));
        if (found.isEmpty()) {
            return ToolResult.of("No episodes found matching: " + query);
        }
        StringJoiner output = new StringJoiner("\n");
        for (Episode e : found) {
            output.add("- %s (id: %s, %d memories): %s".formatted(e.title(), e.id(), e.memoryIds().size(),
                    truncate(e.summary(), 150)));
        }
        return ToolResult.of(output.toString());
    }

    private ToolResult workingSet(Map<String, Object> args) {
        List<WorkingSetEntry> entries = memory.workingSet(boolArg(args, "refresh", false));
        if (entries.isEmpty()) {
            return ToolResult.of("Working set is empty.");
        }
        StringJoiner output = new StringJoiner("\n");
        for (WorkingSetEntry entry : entries) {
            output.add("- %s (score %.3f, last active %s)".formatted(entry.id(), entry.score(), entry.lastActivation()));
        }
        return ToolResult.of(output.toString());
    }

    private ToolResult formatScored(String query, List<ScoredMemory> results) {
        if (results.isEmpty()) {
            return ToolResult.of("No memories found matching: " + query);
        }
        StringJoiner output = new StringJoiner("\n");
        output.add("Found %d memories:".formatted(results.size()));
        for (ScoredMemory s : results) {
            output.add("%s [%d%%]".formatted(describe(s.record()), (int) Math.round(s.score() * 100)));
        }
        return ToolResult.of(output.toString());
    }

    private static String describe(MemoryRecord r) {
        return "- (%s) [%s|%s|%d] %s".formatted(r.id(), r.category().tag(), r.emotion().tag(), r.importance(),
                truncate(r.content(), 200));
    }

    private static String requiredString(Map<String, Object> args, String key) {
        String value = stringArg(args, key, "");
        if (value.isBlank()) {
            throw new ValidationException("'%s' is required.".formatted(key));
        }
        return value;
    }

    private static String stringArg(Map<String, Object> args, String key, String defaultValue) {
        Object val = args.get(key);
        return val != null ? val.toString() : defaultValue;
    }

    private static int intArg(Map<String, Object> args, String key, int defaultValue) {
        Object val = args.get(key);
        if (val == null) return defaultValue;
        if (val instanceof Number n) return n.intValue();
        try {
            return Integer.parseInt(val.toString().trim());
        } catch (NumberFormatException e) {
            throw new ValidationException("'%s' must be an integer: %s".formatted(key, val));
        }
    }

    private static double doubleArg(Map<String, Object> args, String key, double defaultValue) {
        Object val = args.get(key);
        if (val == null) return defaultValue;
        if (val instanceof Number n) return n.doubleValue();
        try {
            return Double.parseDouble(val.toString().trim());
        } catch (NumberFormatException e) {
            throw new ValidationException("'%s' must be a number: %s".formatted(key, val));
        }
    }

    private static boolean boolArg(Map<String, Object> args, String key, boolean defaultValue) {
        Object val = args.get(key);
        if (val instanceof Boolean b) return b;
        return val != null ? Boolean.parseBoolean(val.toString()) : defaultValue;
    }

    private static List<String> listArg(Map<String, Object> args, String key) {
        Object val = args.get(key);
        if (val == null) return List.of();
        if (val instanceof List<?> list) {
            return list.stream().filter(x -> x != null).map(Object::toString).toList();
        }
        throw new ValidationException("'%s' must be an array".formatted(key));
    }

    /** ISO instant, or an ISO date taken as the start (or end) of that UTC day. */
    private static Instant instantArg(Map<String, Object> args, String key, boolean endOfDay) {
        String val = stringArg(args, key, "");
        if (val.isBlank()) return null;
        try {
            return Instant.parse(val);
        } catch (DateTimeParseException e) {
            try {
                LocalDate date = LocalDate.parse(val);
                return endOfDay
                        ? date.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant().minusMillis(1)
                        : date.atStartOfDay(ZoneOffset.UTC).toInstant();
            } catch (DateTimeParseException notADate) {
                throw new ValidationException("'%s' must be an ISO 8601 date or instant: %s".formatted(key, val));
            }
        }
    }

    private static String truncate(String s, int maxLen) {
        if (s == null) return "";
        return s.length() <= maxLen ? s : s.substring(0, maxLen) + "...";
    }
}
