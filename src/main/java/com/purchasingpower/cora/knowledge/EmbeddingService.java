package com.purchasingpower.cora.knowledge;

import java.util.List;

/**
 * Service for turning chunk text and query text into embedding vectors.
 *
 * The same model must serve index time and query time, otherwise stored vectors and query
 * vectors are not comparable.
 *
 * @since 0.1.0
 */
public interface EmbeddingService {

    /**
     * Generate the embedding of one text.
     *
     * @param text non-empty text
     * @return embedding vector
     * @throws RuntimeException when the provider fails after its own retries
     */
    float[] embed(String text);

    /**
     * Generate embeddings for several texts in one call.
     *
     * @param texts non-empty texts
     * @return vectors in input order
     */
    List<float[]> embedAll(List<String> texts);
}
