package com.purchasingpower.cora.knowledge;

import com.purchasingpower.cora.chunking.ChunkDraft;

import java.util.Optional;

/**
 * Generates a short natural-language commentary for a chunk, stored next to its content and
 * embedded together with it.
 *
 * @since 0.1.0
 */
public interface CommentaryGenerator {

    /**
     * @param filePath path of the file the chunk belongs to
     * @param language language id of the file
     * @param chunk    the chunk to describe
     * @return commentary, empty when none is produced
     */
    Optional<String> describe(String filePath, String language, ChunkDraft chunk);
}
