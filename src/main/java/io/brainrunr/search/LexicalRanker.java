package io.brainrunr.search;

import io.brainrunr.config.MemoryProperties;
import io.brainrunr.memory.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Bigram BM25 ranking over memory content. When the store's content version moves, the index
 * adds the memories it has not seen and drops the ones that are gone. Content never changes in
 * place, so a known id needs no reindexing.
 */
@Component
public class LexicalRanker {

    private static final Logger log = LoggerFactory.getLogger(LexicalRanker.class);

    private final RecordStore store;
    private final LexicalIndex index;
    private final Set<String> indexedIds = new HashSet<>();
    private long indexedVersion = -1;

    public LexicalRanker(RecordStore store, MemoryProperties properties) {
        this.store = store;
        this.index = new LexicalIndex(properties.search().bm25K1(), properties.search().bm25B());
    }

    /** BM25 score per candidate id. Candidates with no matching bigram are absent. */
    public synchronized Map<String, Double> score(String query, Collection<String> candidateIds) {
        refreshIfStale();
        return index.score(query, candidateIds);
    }

    private void refreshIfStale() {
        long version = store.contentVersion();
        if (version == indexedVersion) {
            return;
        }
        Map<String, String> contents = store.contents();
        int removed = 0;
        for (var it = indexedIds.iterator(); it.hasNext(); ) {
            String id = it.next();
            if (!contents.containsKey(id)) {
                index.remove(id);
                it.remove();
                removed++;
            }
        }
        int added = 0;
        for (Map.Entry<String, String> entry : contents.entrySet()) {
            if (indexedIds.add(entry.getKey())) {
                index.add(entry.getKey(), entry.getValue());
                added++;
            }
        }
        indexedVersion = version;
        log.debug("Bigram index at version {}: {} added, {} removed, {} documents",
                version, added, removed, index.size());
    }
}
