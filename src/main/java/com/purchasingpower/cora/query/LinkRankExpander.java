package com.purchasingpower.cora.query;

import com.purchasingpower.cora.configuration.AppProperties;
import com.purchasingpower.cora.configuration.RankingProperties;
import com.purchasingpower.cora.knowledge.IndexStore;
import com.purchasingpower.cora.knowledge.ReferenceGraph;
import com.purchasingpower.cora.knowledge.ReferenceResolver;
import com.purchasingpower.cora.model.index.Chunk;
import com.purchasingpower.cora.model.retrieval.QueryScope;
import com.purchasingpower.cora.model.retrieval.RankedChunk;
import com.purchasingpower.cora.model.retrieval.RetrievalCandidate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Re-ranks retrieval candidates with the reference graph.
 *
 * <p>The subgraph holds the candidates and their one-hop neighbours in both directions.
 * Personalized PageRank seeded with the fused retrieval scores runs over it, and each chunk gets
 * {@code retrievalWeight * retrieval / maxRetrieval + linkWeight * rank / maxRank}. Candidates
 * always stay; a chunk reached only through an edge stays when its combined score reaches the
 * inclusion threshold.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LinkRankExpander {

    private final ReferenceResolver referenceResolver;
    private final IndexStore indexStore;
    private final AppProperties appProperties;

    public List<RankedChunk> expand(List<RetrievalCandidate> candidates, QueryScope scope) {
        if (candidates.isEmpty()) {
            return List.of();
        }
        RankingProperties ranking = appProperties.getRanking();

        Map<String, Chunk> chunks = new LinkedHashMap<>();
        Map<String, Double> retrieval = new LinkedHashMap<>();
        for (RetrievalCandidate candidate : candidates) {
            chunks.putIfAbsent(candidate.getChunk().getId(), candidate.getChunk());
            retrieval.merge(candidate.getChunk().getId(), candidate.getFusedScore(), Math::max);
        }

        ReferenceGraph graph = referenceResolver.buildGraph(retrieval.keySet(), scope);
        Set<String> neighbours = new LinkedHashSet<>();
        for (String chunkId : retrieval.keySet()) {
            neighbours.addAll(graph.neighbours(chunkId));
        }
        neighbours.removeAll(retrieval.keySet());
        for (Chunk chunk : indexStore.findChunksByIds(neighbours)) {
            chunks.putIfAbsent(chunk.getId(), chunk);
        }

        PersonalizedPageRank pageRank = new PersonalizedPageRank(
                ranking.getDamping(), ranking.getMaxIterations(), ranking.getTolerance());
        Map<String, Double> ranks = pageRank.rank(chunks.keySet(), graph, retrieval);

        double maxRetrieval = max(retrieval.values());
        double maxRank = max(ranks.values());

        List<RankedChunk> ranked = new ArrayList<>();
        int dropped = 0;
        for (Chunk chunk : chunks.values()) {
            boolean candidate = retrieval.containsKey(chunk.getId());
            double retrievalScore = retrieval.getOrDefault(chunk.getId(), 0.0);
            double rank = ranks.getOrDefault(chunk.getId(), 0.0);
            double combined = ranking.getRetrievalWeight() * normalize(retrievalScore, maxRetrieval)
                    + ranking.getLinkWeight() * normalize(rank, maxRank);

            if (!candidate && combined < ranking.getInclusionThreshold()) {
                dropped++;
                continue;
            }
            ranked.add(RankedChunk.builder()
                    .chunk(chunk)
                    .retrievalScore(retrievalScore)
                    .pageRank(rank)
                    .combinedScore(combined)
                    .candidate(candidate)
                    .build());
        }
        ranked.sort(RankedChunk.BY_RANK);

        log.info("Link-rank expansion: {} candidates, {} neighbours, {} edges, {} below threshold",
                retrieval.size(), chunks.size() - retrieval.size(), graph.edgeCount(), dropped);
        return ranked;
    }

    private static double max(Iterable<Double> values) {
        double max = 0;
        for (double value : values) {
            max = Math.max(max, value);
        }
        return max;
    }

    private static double normalize(double value, double max) {
        return max > 0 ? value / max : 0.0;
    }
}
