package com.purchasingpower.cora.chunking;

import com.purchasingpower.cora.model.parse.Language;
import com.purchasingpower.cora.model.parse.SyntaxTree;
import com.purchasingpower.cora.util.TextLines;

import java.util.List;
import java.util.Optional;

/**
 * Output of the chunk builder for one file.
 *
 * @param language  detected language
 * @param lines     line view of the content
 * @param tree      syntax tree when a grammar parsed the file, null otherwise
 * @param chunks    chunks in line order, covering every line exactly once
 */
public record ChunkedFile(Language language, TextLines lines, SyntaxTree tree, List<ChunkDraft> chunks) {

    public boolean isGrammarBased() {
        return tree != null;
    }

    public boolean isEmpty() {
        return chunks.isEmpty();
    }

    /** Chunk whose range contains {@code line}. */
    public Optional<ChunkDraft> chunkAt(int line) {
        return chunks.stream().filter(chunk -> chunk.containsLine(line)).findFirst();
    }
}
