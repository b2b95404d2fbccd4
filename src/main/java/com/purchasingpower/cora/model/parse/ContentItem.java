package com.purchasingpower.cora.model.parse;

import com.purchasingpower.cora.model.index.EntityType;

/**
 * A unit the chunk builder sizes and merges: a declaration, a heading section or a top-level
 * key/value group. Line numbers are 1-based and inclusive.
 *
 * @param name       declared name, heading or key; null for anonymous windows
 * @param kind       entity kind, null for fixed windows
 * @param startLine  first line
 * @param endLine    last line
 * @param node       syntax node the item came from, null for heuristic items
 */
public record ContentItem(String name, EntityType kind, int startLine, int endLine, SyntaxNode node) {

    public static ContentItem heuristic(String name, EntityType kind, int startLine, int endLine) {
        return new ContentItem(name, kind, startLine, endLine, null);
    }

    public static ContentItem of(SyntaxNode node) {
        return new ContentItem(node.getName(), node.getDeclaration(), node.getStartLine(), node.getEndLine(), node);
    }
}
