package io.brainrunr.testsupport;

import io.brainrunr.search.EmbeddingFunction;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Deterministic bag-of-words embedding: every distinct word gets its own axis, assigned in
 * order of first appearance. Texts sharing no word are orthogonal.
 */
public class VocabularyEmbeddingFunction implements EmbeddingFunction {

    private final int dimensions;
    private final Map<String, Integer> vocabulary = new HashMap<>();

    public VocabularyEmbeddingFunction(int dimensions) {
        this.dimensions = dimensions;
    }

    @Override
    public synchronized float[] embed(String text) {
        float[] vector = new float[dimensions];
        for (String word : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{Nd}]+")) {
            if (word.isEmpty()) {
                continue;
            }
            Integer axis = vocabulary.get(word);
            if (axis == null) {
                if (vocabulary.size() >= dimensions) {
                    throw new IllegalStateException("Vocabulary exceeds " + dimensions + " words");
                }
                axis = vocabulary.size();
                vocabulary.put(word, axis);
            }
            vector[axis] += 1f;
        }
        return vector;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }
}
