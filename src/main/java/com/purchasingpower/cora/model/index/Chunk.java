package com.purchasingpower.cora.model.index;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A contiguous, size-bounded excerpt of one file version: the unit of retrieval.
 *
 * Chunks store the full verbatim content of their line range; elision only happens when a
 * response is assembled. A chunk is never edited after it is stored, a changed file gets a new
 * set of chunks under its new version.
 */
@Value
@Builder(toBuilder = true)
public class Chunk {

    String id;
    String fileVersionId;
    String repoId;
    String filePath;

    /** Position of this chunk within its file version, starting at 0. */
    int ordinal;

    String content;
    String commentary;

    /** First line, 1-based, inclusive. */
    int lineStart;

    /** Last line, 1-based, inclusive. */
    int lineEnd;

    String language;
    String declarationType;

    /** Raw identifier tokens used inside the chunk. */
    @Singular
    List<String> referenceSymbols;

    /** Ids of chunks this chunk depends on, as resolved when the chunk was indexed. */
    @Singular
    List<String> referenceChunks;

    /** Null when the embedding provider failed; the chunk is then only lexically retrievable. */
    float[] embedding;

    public static String idOf(String fileVersionId, int ordinal) {
        return fileVersionId + "#" + ordinal;
    }

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }

    public int lineCount() {
        return lineEnd - lineStart + 1;
    }

    /** Rendered size of the chunk when included in full. */
    public int renderedLength() {
        return content.length() + (commentary == null ? 0 : commentary.length());
    }
}
