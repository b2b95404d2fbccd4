package com.purchasingpower.cora.query;

import com.purchasingpower.cora.model.index.Chunk;
import com.purchasingpower.cora.util.TextLines;

/**
 * The part of a chunk that goes into the response: the whole chunk, or a line range of it.
 */
public record ContextSlice(Chunk chunk, int lineStart, int lineEnd, String content) {

    public static ContextSlice full(Chunk chunk) {
        return new ContextSlice(chunk, chunk.getLineStart(), chunk.getLineEnd(), chunk.getContent());
    }

    /**
     * Only one line of the chunk, used for a declaration boosted without its implementation.
     */
    public static ContextSlice line(Chunk chunk, int lineNumber) {
        int line = Math.max(chunk.getLineStart(), Math.min(chunk.getLineEnd(), lineNumber));
        TextLines lines = TextLines.of(chunk.getContent());
        int index = line - chunk.getLineStart() + 1;
        String text = index <= lines.count() ? lines.line(index) : "";
        return new ContextSlice(chunk, line, line, text);
    }

    public String chunkId() {
        return chunk.getId();
    }

    /** True when the slice covers the chunk's whole line range. */
    public boolean isWhole() {
        return lineStart == chunk.getLineStart() && lineEnd == chunk.getLineEnd();
    }

    public int length() {
        return content.length();
    }
}
