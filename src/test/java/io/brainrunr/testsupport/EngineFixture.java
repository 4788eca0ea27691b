package io.brainrunr.testsupport;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.brainrunr.config.MemoryProperties;
import io.brainrunr.consolidation.ConsolidationEngine;
import io.brainrunr.episode.EpisodeManager;
import io.brainrunr.graph.AssociationGraph;
import io.brainrunr.graph.CoActivationLog;
import io.brainrunr.graph.DivergentRecallEngine;
import io.brainrunr.graph.SoftmaxSampler;
import io.brainrunr.memory.Emotion;
import io.brainrunr.memory.MemoryCategory;
import io.brainrunr.memory.MemoryDatabase;
import io.brainrunr.memory.MemoryRecord;
import io.brainrunr.memory.MemoryService;
import io.brainrunr.memory.NewMemory;
import io.brainrunr.memory.SQLiteRecordStore;
import io.brainrunr.search.HybridRetriever;
import io.brainrunr.search.LexicalRanker;
import io.brainrunr.search.SimilarityRanker;
import io.brainrunr.workingset.WorkingSetCache;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Random;

/**
 * The whole engine wired by hand over a temporary SQLite file, with a vocabulary embedding
 * and a clock that advances one minute per stored memory.
 */
public class EngineFixture implements AutoCloseable {

    public static final int DIMENSIONS = 128;
    public static final Instant START = Instant.parse("2026-01-01T00:00:00Z");

    public final MemoryProperties properties;
    public final MutableClock clock = new MutableClock(START);
    public final VocabularyEmbeddingFunction embedding = new VocabularyEmbeddingFunction(DIMENSIONS);
    public final MemoryDatabase db;
    public final SQLiteRecordStore store;
    public final CoActivationLog coActivationLog;
    public final AssociationGraph graph;
    public final SimilarityRanker similarityRanker = new SimilarityRanker();
    public final HybridRetriever retriever;
    public final WorkingSetCache workingSet;
    public final ConsolidationEngine consolidation;
    public final EpisodeManager episodes;

    private EngineFixture(Path dir, MemoryProperties properties) {
        this.properties = properties;
        this.db = new MemoryDatabase(dir.resolve("brain.db").toString(), true);
        db.init();
        this.store = new SQLiteRecordStore(db, properties, new ObjectMapper(), clock);
        this.coActivationLog = new CoActivationLog(db, clock);
        this.graph = new AssociationGraph(db, properties, clock);
        this.retriever = new HybridRetriever(store, embedding, similarityRanker,
                new LexicalRanker(store, properties), coActivationLog, properties, clock);
        this.workingSet = new WorkingSetCache(store, properties, clock);
        this.consolidation = new ConsolidationEngine(db, coActivationLog, graph, properties, clock);
        this.episodes = new EpisodeManager(store, properties);
    }

    public static EngineFixture open(Path dir) {
        return open(dir, defaults(dir));
    }

    public static EngineFixture open(Path dir, MemoryProperties properties) {
        return new EngineFixture(dir, properties);
    }

    public static MemoryProperties defaults(Path dir) {
        return MemoryProperties.defaults(dir.toString(), DIMENSIONS);
    }

    public DivergentRecallEngine recallEngine(long seed) {
        return new DivergentRecallEngine(retriever, graph, store, coActivationLog,
                new SoftmaxSampler(new Random(seed)), properties);
    }

    public MemoryService service(long seed) {
        return new MemoryService(store, embedding, retriever, similarityRanker, recallEngine(seed), consolidation,
                workingSet, properties);
    }

    public MemoryRecord remember(String content) {
        return remember(content, 3);
    }

    public MemoryRecord remember(String content, int importance) {
        return remember(content, importance, MemoryCategory.DAILY);
    }

    public MemoryRecord remember(String content, int importance, MemoryCategory category) {
        return remember(content, importance, category, Emotion.NEUTRAL);
    }

    public MemoryRecord remember(String content, int importance, MemoryCategory category, Emotion emotion) {
        MemoryRecord record = store.create(new NewMemory(content, embedding.embed(content), emotion,
                category, importance));
        clock.advance(Duration.ofMinutes(1));
        return record;
    }

    @Override
    public void close() {
        db.close();
    }
}
