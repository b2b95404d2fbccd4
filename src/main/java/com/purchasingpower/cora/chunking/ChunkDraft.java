package com.purchasingpower.cora.chunking;

import com.purchasingpower.cora.model.parse.ContentItem;

import java.util.List;

/**
 * A chunk before it is bound to a file version and stored.
 *
 * @param ordinal         position within the file, starting at 0
 * @param lineStart       first line, 1-based, inclusive
 * @param lineEnd         last line, inclusive
 * @param content         verbatim text of the line range
 * @param declarationType kind of content, e.g. {@code class}, {@code mixed}, {@code section}, {@code block}
 * @param items           content items grouped into this chunk
 */
public record ChunkDraft(
        int ordinal,
        int lineStart,
        int lineEnd,
        String content,
        String declarationType,
        List<ContentItem> items
) {

    public boolean containsLine(int line) {
        return line >= lineStart && line <= lineEnd;
    }
}
