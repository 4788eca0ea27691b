package io.brainrunr.episode;

import io.brainrunr.config.MemoryProperties;
import io.brainrunr.memory.Episode;
import io.brainrunr.memory.MemoryRecord;
import io.brainrunr.memory.NotFoundException;
import io.brainrunr.memory.RecordStore;
import io.brainrunr.search.LexicalIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Groups memories into named episodes and searches them by title and summary.
 */
@Component
public class EpisodeManager {

    private static final Logger log = LoggerFactory.getLogger(EpisodeManager.class);

    static final int SUMMARY_SNIPPET = 50;
    static final String SUMMARY_SEPARATOR = " -> ";

    private static final Comparator<MemoryRecord> CHRONOLOGICAL = Comparator
            .comparing(MemoryRecord::createdAt)
            .thenComparing(MemoryRecord::id);

    private final RecordStore store;
    private final double bm25K1;
    private final double bm25B;

    public EpisodeManager(RecordStore store, MemoryProperties properties) {
        this.store = store;
        this.bm25K1 = properties.search().bm25K1();
        this.bm25B = properties.search().bm25B();
    }

    /**
     * Creates an episode. Without a summary, one is built from the opening of each member in
     * chronological order.
     */
    public Episode create(String title, List<String> memoryIds, List<String> participants, String summary) {
        String effectiveSummary = summary;
        if ((summary == null || summary.isBlank()) && memoryIds != null && !memoryIds.isEmpty()) {
            effectiveSummary = buildSummary(store.getAll(memoryIds));
        }
        return store.createEpisode(title, memoryIds, participants, effectiveSummary);
    }

    public Episode get(String episodeId) {
        return store.getEpisode(episodeId);
    }

    public List<Episode> list() {
        return store.listEpisodes();
    }

    /**
     * Members of an episode by creation time, regardless of the order they were given in.
     *
     * @throws NotFoundException if the episode does not exist
     */
    public List<MemoryRecord> getEpisodeMemories(String episodeId) {
        Episode episode = store.getEpisode(episodeId);
        return store.getAll(episode.memoryIds()).stream().sorted(CHRONOLOGICAL).toList();
    }

    /** Bigram BM25 search over episode titles and summaries. */
    public List<Episode> search(String query, int nResults) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        List<Episode> episodes = store.listEpisodes();
        LexicalIndex index = new LexicalIndex(bm25K1, bm25B);
        for (Episode episode : episodes) {
            index.add(episode.id(), episode.title() + " " + episode.summary());
        }
        Map<String, Double> scores = index.score(query);
        return episodes.stream()
                .filter(e -> scores.containsKey(e.id()))
                .sorted(Comparator.comparing((Episode e) -> scores.get(e.id())).reversed()
                        .thenComparing(Episode::id))
                .limit(Math.max(1, nResults))
                .toList();
    }

    /**
     * @throws NotFoundException if the episode does not exist
     */
    public void delete(String episodeId) {
        if (!store.deleteEpisode(episodeId)) {
            throw NotFoundException.episode(episodeId);
        }
        log.debug("Episode {} removed", episodeId);
    }

    static String buildSummary(List<MemoryRecord> members) {
        return members.stream()
                .sorted(CHRONOLOGICAL)
                .map(m -> m.content().length() > SUMMARY_SNIPPET ? m.content().substring(0, SUMMARY_SNIPPET) : m.content())
                .collect(Collectors.joining(SUMMARY_SEPARATOR));
    }
}
