package com.purchasingpower.cora.model.retrieval;

import com.purchasingpower.cora.model.index.Chunk;
import lombok.Builder;
import lombok.Value;

import java.util.Comparator;

/**
 * A chunk after link-rank expansion.
 */
@Value
@Builder(toBuilder = true)
public class RankedChunk {

    /** Combined score descending, then file path and line start for stable output. */
    public static final Comparator<RankedChunk> BY_RANK = Comparator
            .comparingDouble(RankedChunk::getCombinedScore).reversed()
            .thenComparing(ranked -> ranked.getChunk().getFilePath())
            .thenComparingInt(ranked -> ranked.getChunk().getLineStart());

    Chunk chunk;

    /** Fused retrieval score, 0 for chunks reached only through the reference graph. */
    double retrievalScore;

    double pageRank;

    double combinedScore;

    /** True when the chunk came from retrieval, false when only expansion reached it. */
    boolean candidate;
}
