package io.brainrunr.search;

import io.brainrunr.memory.MemoryRecord;
import io.brainrunr.memory.ValidationException;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Cosine similarity between the query embedding and stored embeddings.
 */
@Component
public class SimilarityRanker {

    /**
     * Cosine similarity clamped to [-1, 1]. Zero when either vector has zero magnitude.
     *
     * @throws ValidationException if the vectors differ in length
     */
    public static double cosine(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new ValidationException("Vector dimensions differ: %d vs %d".formatted(a.length, b.length));
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        double cos = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        return Math.max(-1.0, Math.min(1.0, cos));
    }

    /** Raw cosine score per memory id. */
    public Map<String, Double> score(float[] query, Collection<MemoryRecord> candidates) {
        Map<String, Double> scores = new HashMap<>();
        for (MemoryRecord record : candidates) {
            scores.put(record.id(), cosine(query, record.embedding()));
        }
        return scores;
    }
}
