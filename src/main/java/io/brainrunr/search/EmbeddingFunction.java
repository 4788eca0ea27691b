package io.brainrunr.search;

/**
 * Maps text to a dense vector of fixed dimension. The engine never embeds anything itself.
 */
public interface EmbeddingFunction {

    float[] embed(String text);

    int dimensions();
}
