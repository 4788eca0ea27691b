package io.brainrunr.search;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory BM25 inverted index over character bigrams. Not thread-safe; owners synchronize.
 */
public class LexicalIndex {

    private final double k1;
    private final double b;

    private final Map<String, Map<String, Integer>> postings = new HashMap<>();
    private final Map<String, Integer> docLengths = new HashMap<>();
    private long totalLength;

    public LexicalIndex(double k1, double b) {
        this.k1 = k1;
        this.b = b;
    }

    /** Adds or replaces a document. */
    public void add(String docId, String text) {
        remove(docId);
        List<String> tokens = BigramTokenizer.tokenize(text);
        Map<String, Integer> tf = new HashMap<>();
        for (String token : tokens) {
            tf.merge(token, 1, Integer::sum);
        }
        tf.forEach((term, freq) -> postings.computeIfAbsent(term, t -> new HashMap<>()).put(docId, freq));
        docLengths.put(docId, tokens.size());
        totalLength += tokens.size();
    }

    public void remove(String docId) {
        Integer length = docLengths.remove(docId);
        if (length == null) {
            return;
        }
        totalLength -= length;
        postings.values().removeIf(docs -> docs.remove(docId) != null && docs.isEmpty());
    }

    public int size() {
        return docLengths.size();
    }

    /**
     * BM25 scores of the query against every indexed document.
     * Documents sharing no bigram with the query are absent from the result.
     */
    public Map<String, Double> score(String query) {
        return score(query, null);
    }

    /**
     * BM25 scores restricted to the given documents; a null restriction means all documents.
     */
    public Map<String, Double> score(String query, Collection<String> restrictTo) {
        Map<String, Double> scores = new HashMap<>();
        int n = docLengths.size();
        if (n == 0) {
            return scores;
        }
        Set<String> allowed = restrictTo == null ? null : new HashSet<>(restrictTo);
        double avgLength = Math.max(1.0, (double) totalLength / n);

        for (String term : new HashSet<>(BigramTokenizer.tokenize(query))) {
            Map<String, Integer> docs = postings.get(term);
            if (docs == null) {
                continue;
            }
            int df = docs.size();
            double idf = Math.log(1.0 + (n - df + 0.5) / (df + 0.5));
            for (Map.Entry<String, Integer> posting : docs.entrySet()) {
                String docId = posting.getKey();
                if (allowed != null && !allowed.contains(docId)) {
                    continue;
                }
                int tf = posting.getValue();
                double norm = k1 * (1.0 - b + b * docLengths.get(docId) / avgLength);
                scores.merge(docId, idf * tf * (k1 + 1.0) / (tf + norm), Double::sum);
            }
        }
        return scores;
    }
}
