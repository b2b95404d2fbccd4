package com.purchasingpower.cora.query;

import com.purchasingpower.cora.knowledge.EmbeddingService;
import com.purchasingpower.cora.knowledge.IndexStore;
import com.purchasingpower.cora.model.retrieval.QueryScope;
import com.purchasingpower.cora.model.retrieval.RetrievalCandidate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * First retrieval stage: embeds the query text and asks the store for its top chunks.
 *
 * If the embedding call fails the query runs lexical-only. Store failures propagate.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HybridRetriever {

    private final IndexStore indexStore;
    private final EmbeddingService embeddingService;

    public List<RetrievalCandidate> search(String queryText, QueryScope scope, int k) {
        log.info("Hybrid retrieval: query='{}', k={}", abbreviate(queryText), k);
        float[] vector = embedQuery(queryText);
        List<RetrievalCandidate> candidates = indexStore.hybridQuery(queryText, vector, scope, k);
        log.info("Hybrid retrieval returned {} candidates{}", candidates.size(),
                vector == null ? " (lexical only)" : "");
        return candidates;
    }

    private float[] embedQuery(String queryText) {
        try {
            return embeddingService.embed(queryText);
        } catch (RuntimeException e) {
            log.warn("⚠️  Query embedding failed, falling back to lexical retrieval: {}", e.getMessage());
            return null;
        }
    }

    private static String abbreviate(String text) {
        return text.length() > 80 ? text.substring(0, 80) + "..." : text;
    }
}
