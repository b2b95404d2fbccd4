package com.purchasingpower.cora.model.query;

import lombok.Builder;
import lombok.Value;

/**
 * Metadata entry for a chunk that made it into the response, in selection order.
 */
@Value
@Builder
public class UsedChunk {

    String chunkId;
    String repoId;
    String filePath;
    int lineStart;
    int lineEnd;
    RenderMode renderMode;
    boolean boosted;
    double combinedScore;
}
