package io.brainrunr.memory;

import io.brainrunr.config.MemoryProperties;
import io.brainrunr.consolidation.ConsolidationEngine;
import io.brainrunr.consolidation.ConsolidationStats;
import io.brainrunr.graph.DivergentDiagnostics;
import io.brainrunr.graph.DivergentRecall;
import io.brainrunr.graph.DivergentRecallEngine;
import io.brainrunr.search.EmbeddingFunction;
import io.brainrunr.search.HybridRetriever;
import io.brainrunr.search.ScoredMemory;
import io.brainrunr.search.SimilarityRanker;
import io.brainrunr.workingset.WorkingSetCache;
import io.brainrunr.workingset.WorkingSetEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Entry point for callers of the memory engine. Embeds content on the way in and routes
 * reads to the retriever or the recall engine.
 */
@Service
public class MemoryService {

    private static final Logger log = LoggerFactory.getLogger(MemoryService.class);

    public static final int MAX_AUTO_LINKS = 5;
    public static final double DEFAULT_LINK_THRESHOLD = 0.8;

    private final RecordStore store;
    private final EmbeddingFunction embeddingFunction;
    private final HybridRetriever retriever;
    private final SimilarityRanker similarityRanker;
    private final DivergentRecallEngine recallEngine;
    private final ConsolidationEngine consolidationEngine;
    private final WorkingSetCache workingSet;
    private final MemoryProperties.Consolidation consolidationDefaults;

    public MemoryService(RecordStore store, EmbeddingFunction embeddingFunction, HybridRetriever retriever,
                         SimilarityRanker similarityRanker, DivergentRecallEngine recallEngine,
                         ConsolidationEngine consolidationEngine, WorkingSetCache workingSet,
                         MemoryProperties properties) {
        this.store = store;
        this.embeddingFunction = embeddingFunction;
        this.retriever = retriever;
        this.similarityRanker = similarityRanker;
        this.recallEngine = recallEngine;
        this.consolidationEngine = consolidationEngine;
        this.workingSet = workingSet;
        this.consolidationDefaults = properties.consolidation();
    }

    public MemoryRecord remember(String content, Emotion emotion, MemoryCategory category, int importance,
                                 MediaReference media, CameraPose camera, List<String> tags) {
        if (content == null || content.isBlank()) {
            throw new ValidationException("Memory content is required");
        }
        float[] embedding = embeddingFunction.embed(content);
        MemoryRecord record = store.create(new NewMemory(content, embedding, emotion, category, importance, media, camera, tags));
        log.info("Remembered [{}|{}] importance {}: {}", record.category().tag(), record.emotion().tag(),
                record.importance(), abbreviate(record.content()));
        return record;
    }

    /**
     * Stores a memory and links it both ways to up to {@value #MAX_AUTO_LINKS} existing memories
     * whose cosine distance to it ({@code 1 - cosine}) is at most {@code linkThreshold}.
     *
     * @param linkThreshold distance in [0, 2]; lower demands closer memories
     */
    public MemoryRecord rememberWithAutoLink(String content, Emotion emotion, MemoryCategory category, int importance,
                                             MediaReference media, CameraPose camera, List<String> tags,
                                             double linkThreshold) {
        if (content == null || content.isBlank()) {
            throw new ValidationException("Memory content is required");
        }
        float[] embedding = embeddingFunction.embed(content);
        List<String> similar = similarIds(embedding, Math.max(0.0, Math.min(2.0, linkThreshold)));
        MemoryRecord record = store.create(
                new NewMemory(content, embedding, emotion, category, importance, media, camera, tags), similar);
        log.info("Remembered [{}|{}] importance {} with {} similar links: {}", record.category().tag(),
                record.emotion().tag(), record.importance(), similar.size(), abbreviate(record.content()));
        return record;
    }

    public MemoryRecord get(String id) {
        return store.get(id);
    }

    public List<MemoryRecord> listRecent(int limit, MemoryCategory category) {
        return store.listRecent(Math.max(1, Math.min(100, limit)), category);
    }

    public List<ScoredMemory> search(String query, SearchFilters filters, int nResults) {
        return retriever.search(query, filters, nResults);
    }

    /** Context recall weighted by recency, emotion and importance. */
    public List<ScoredMemory> recall(String context, int nResults) {
        return retriever.recall(context, nResults);
    }

    /**
     * Context recall plus every memory linked to a recalled one within {@code chainDepth} hops.
     *
     * @param chainDepth clamped to 1..3
     */
    public AssociatedRecall recallWithAssociations(String context, int nResults, int chainDepth) {
        List<ScoredMemory> primary = retriever.recall(context, nResults);
        int depth = Math.max(1, Math.min(3, chainDepth));
        Set<String> seen = new HashSet<>();
        primary.forEach(p -> seen.add(p.id()));
        List<MemoryRecord> linked = new ArrayList<>();
        for (ScoredMemory hit : primary) {
            for (MemoryRecord record : store.getLinkedMemories(hit.id(), depth)) {
                if (seen.add(record.id())) {
                    linked.add(record);
                }
            }
        }
        return new AssociatedRecall(primary, linked);
    }

    public List<MemoryRecord> linkedMemories(String id, int depth) {
        return store.getLinkedMemories(id, depth);
    }

    public DivergentRecall recallDivergent(String context, int nResults, int maxBranches, int maxDepth,
                                           double temperature) {
        return recallEngine.recall(context, nResults, maxBranches, maxDepth, temperature);
    }

    public DivergentDiagnostics associationDiagnostics(String context, int sampleSize) {
        return recallEngine.diagnose(context, sampleSize);
    }

    public ConsolidationStats consolidate(int windowHours, int maxReplayEvents, double linkUpdateStrength) {
        ConsolidationStats stats = consolidationEngine.consolidate(windowHours, maxReplayEvents, linkUpdateStrength);
        workingSet.refresh();
        return stats;
    }

    /** Consolidation with the configured window, batch size and strength. */
    public ConsolidationStats consolidate() {
        return consolidate(consolidationDefaults.windowHours(), consolidationDefaults.maxReplayEvents(),
                consolidationDefaults.linkUpdateStrength());
    }

    public CausalLink link(String sourceId, String targetId, String linkType, String note) {
        return store.createLink(sourceId, targetId, linkType, note);
    }

    public List<ChainNode> causalChain(String id, ChainDirection direction, int maxDepth) {
        return store.getCausalChain(id, direction, maxDepth);
    }

    public List<WorkingSetEntry> workingSet(boolean refresh) {
        return refresh ? workingSet.refresh() : workingSet.get();
    }

    public MemoryStats stats() {
        return store.stats();
    }

    public List<MemoryRecord> findImportant(int minImportance, int minAccessCount, int limit) {
        return store.findImportant(minImportance, minAccessCount, limit);
    }

    public int decayAccessCounts(double factor) {
        return store.decayAccessCounts(factor);
    }

    public void delete(String id) {
        store.delete(id);
    }

    public boolean healthCheck() {
        return store.healthCheck();
    }

    private List<String> similarIds(float[] embedding, double linkThreshold) {
        List<MemoryRecord> candidates = store.candidates(SearchFilters.none());
        if (candidates.isEmpty()) {
            return List.of();
        }
        Map<String, Double> similarity = similarityRanker.score(embedding, candidates);
        return similarity.entrySet().stream()
                .filter(e -> 1.0 - e.getValue() <= linkThreshold)
                .sorted(Map.Entry.<String, Double>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(MAX_AUTO_LINKS)
                .map(Map.Entry::getKey)
                .toList();
    }

    private static String abbreviate(String s) {
        return s.length() <= 60 ? s : s.substring(0, 60) + "...";
    }
}
