package com.purchasingpower.cora.knowledge.impl;

import com.purchasingpower.cora.model.index.Chunk;
import com.purchasingpower.cora.model.retrieval.RetrievalCandidate;
import com.purchasingpower.cora.util.LexicalTokens;

import java.util.Comparator;
import java.util.Set;

/**
 * Scores a chunk against a query the same way for every store, so that switching stores does not
 * change rankings.
 *
 * The fused score weighs cosine similarity and token overlap equally. Without a query vector it
 * is the token overlap alone; a chunk without a vector only contributes its token overlap.
 */
final class HybridScoring {

    static final double VECTOR_WEIGHT = 0.5;

    static final Comparator<RetrievalCandidate> BEST_FIRST = Comparator
            .comparingDouble(RetrievalCandidate::getFusedScore).reversed()
            .thenComparing(candidate -> candidate.getChunk().getId());

    private HybridScoring() {
    }

    /**
     * @return the scored candidate, null when the chunk does not match at all
     */
    static RetrievalCandidate score(Chunk chunk, Set<String> queryTokens, float[] queryVector) {
        String searchable = chunk.getCommentary() == null
                ? chunk.getContent() : chunk.getContent() + "\n" + chunk.getCommentary();
        double lexical = LexicalTokens.overlap(queryTokens, LexicalTokens.tokenize(searchable));
        double similarity = queryVector != null && chunk.hasEmbedding() ? cosine(queryVector, chunk.getEmbedding()) : 0.0;
        double fused = queryVector == null
                ? lexical
                : VECTOR_WEIGHT * Math.max(0.0, similarity) + (1 - VECTOR_WEIGHT) * lexical;
        if (fused <= 0) {
            return null;
        }
        return RetrievalCandidate.builder()
                .chunk(chunk)
                .fusedScore(fused)
                .vectorScore(similarity)
                .lexicalScore(lexical)
                .build();
    }

    static double cosine(float[] a, float[] b) {
        if (a.length != b.length || a.length == 0) {
            return 0.0;
        }
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
