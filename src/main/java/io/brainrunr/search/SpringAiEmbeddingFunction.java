package io.brainrunr.search;

import io.brainrunr.memory.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;

/**
 * {@link EmbeddingFunction} backed by a Spring AI {@link EmbeddingModel}.
 * Vectors of the wrong dimension are rejected rather than stored.
 */
public class SpringAiEmbeddingFunction implements EmbeddingFunction {

    private static final Logger log = LoggerFactory.getLogger(SpringAiEmbeddingFunction.class);

    private final EmbeddingModel embeddingModel;
    private final int dimensions;

    public SpringAiEmbeddingFunction(EmbeddingModel embeddingModel, int dimensions) {
        this.embeddingModel = embeddingModel;
        this.dimensions = dimensions;
    }

    @Override
    public float[] embed(String text) {
        float[] vector = embeddingModel.embed(text);
        if (vector.length != dimensions) {
            log.error("Embedding model returned {} dimensions, expected {}", vector.length, dimensions);
            throw new ValidationException("Embedding dimension must be %d, got %d".formatted(dimensions, vector.length));
        }
        return vector;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }
}
