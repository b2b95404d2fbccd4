package com.purchasingpower.cora.model.index;

import lombok.Builder;
import lombok.Value;

/**
 * Authoritative record that an identifier is declared at a line range of one file version.
 */
@Value
@Builder
public class ContentEntityDefinition {

    String identifier;
    EntityType entityType;
    String repoId;
    String filePath;
    String fileVersionId;
    int lineStart;
    int lineEnd;

    /** Chunk containing the declaration, when known. */
    String chunkId;

    public String getId() {
        return fileVersionId + ":" + identifier + ":" + lineStart;
    }
}
