package com.purchasingpower.cora.model.retrieval;

import com.purchasingpower.cora.model.index.Chunk;
import lombok.Builder;
import lombok.Value;

/**
 * A chunk returned by the hybrid store, with the fused score and both of its components.
 */
@Value
@Builder
public class RetrievalCandidate {

    Chunk chunk;

    /** Score the store ranked by. */
    double fusedScore;

    /** Cosine similarity to the query vector, 0 when either side has no vector. */
    double vectorScore;

    /** Token overlap between query text and chunk content, in [0,1]. */
    double lexicalScore;
}
