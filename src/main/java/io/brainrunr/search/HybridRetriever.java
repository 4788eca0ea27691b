package io.brainrunr.search;

import io.brainrunr.config.MemoryProperties;
import io.brainrunr.graph.CoActivationEvent.Origin;
import io.brainrunr.graph.CoActivationLog;
import io.brainrunr.memory.MemoryRecord;
import io.brainrunr.memory.RecordStore;
import io.brainrunr.memory.SearchFilters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Fuses embedding similarity with bigram BM25.
 *
 * <p>Both raw scores are max-normalized over the filtered candidate set (negative cosine counts
 * as zero), then combined as {@code alpha * similarity + (1 - alpha) * lexical}.</p>
 */
@Component
public class HybridRetriever {

    private static final Logger log = LoggerFactory.getLogger(HybridRetriever.class);

    static final int MAX_RESULTS = 50;

    private final RecordStore store;
    private final EmbeddingFunction embeddingFunction;
    private final SimilarityRanker similarityRanker;
    private final LexicalRanker lexicalRanker;
    private final CoActivationLog coActivationLog;
    private final Clock clock;
    private final double alpha;

    public HybridRetriever(RecordStore store, EmbeddingFunction embeddingFunction,
                           SimilarityRanker similarityRanker, LexicalRanker lexicalRanker,
                           CoActivationLog coActivationLog, MemoryProperties properties, Clock clock) {
        this.store = store;
        this.embeddingFunction = embeddingFunction;
        this.similarityRanker = similarityRanker;
        this.lexicalRanker = lexicalRanker;
        this.coActivationLog = coActivationLog;
        this.clock = clock;
        this.alpha = Math.max(0.0, Math.min(1.0, properties.search().alpha()));
    }

    /**
     * Ranks and records the retrieval: every returned memory gets an access, and every pair of
     * returned memories a co-activation event, both in one transaction.
     */
    public List<ScoredMemory> search(String query, SearchFilters filters, int nResults) {
        List<ScoredMemory> results = rank(query, filters, nResults);
        recordRetrieval(results);
        log.debug("Search '{}' returned {} results", query, results.size());
        return results;
    }

    /**
     * Context recall: ranks three times the requested number of hits, rescores each with
     * {@link RecallScoring} so recent, emotional and important memories come first, then keeps
     * the best {@code nResults}. Records the retrieval like {@link #search}.
     */
    public List<ScoredMemory> recall(String context, int nResults) {
        int limit = Math.max(1, Math.min(MAX_RESULTS, nResults));
        Instant now = Instant.now(clock);
        List<ScoredMemory> results = rank(context, SearchFilters.none(), Math.min(limit * 3, MAX_RESULTS)).stream()
                .map(hit -> new ScoredMemory(hit.record(), RecallScoring.score(hit, now), hit.similarity(), hit.lexical()))
                .sorted(ScoredMemory.ORDER)
                .limit(limit)
                .toList();
        recordRetrieval(results);
        log.debug("Recall '{}' returned {} results", context, results.size());
        return results;
    }

    /**
     * Ranks without touching access statistics or the co-activation log.
     * Scores are non-increasing along the result.
     */
    public List<ScoredMemory> rank(String query, SearchFilters filters, int nResults) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        int limit = Math.max(1, Math.min(MAX_RESULTS, nResults));
        List<MemoryRecord> candidates = store.candidates(filters);
        if (candidates.isEmpty()) {
            return List.of();
        }

        float[] queryVector = embeddingFunction.embed(query);
        Map<String, Double> similarity = similarityRanker.score(queryVector, candidates);
        Map<String, Double> lexical = lexicalRanker.score(query,
                candidates.stream().map(MemoryRecord::id).toList());

        double maxSimilarity = similarity.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        double maxLexical = lexical.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);

        List<ScoredMemory> scored = new ArrayList<>();
        for (MemoryRecord record : candidates) {
            double sim = normalize(similarity.getOrDefault(record.id(), 0.0), maxSimilarity);
            double lex = normalize(lexical.getOrDefault(record.id(), 0.0), maxLexical);
            double score = alpha * sim + (1.0 - alpha) * lex;
            if (score > 0.0) {
                scored.add(new ScoredMemory(record, score, sim, lex));
            }
        }
        scored.sort(ScoredMemory.ORDER);
        return scored.size() > limit ? List.copyOf(scored.subList(0, limit)) : scored;
    }

    private void recordRetrieval(List<ScoredMemory> results) {
        if (!results.isEmpty()) {
            List<String> ids = results.stream().map(ScoredMemory::id).toList();
            coActivationLog.recordRetrieval(ids, CoActivationLog.allPairs(ids), Origin.SEARCH);
        }
    }

    private static double normalize(double value, double max) {
        if (max <= 0.0 || value <= 0.0) {
            return 0.0;
        }
        return Math.min(1.0, value / max);
    }
}
