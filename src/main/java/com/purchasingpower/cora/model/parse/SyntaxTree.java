package com.purchasingpower.cora.model.parse;

import java.util.List;

/**
 * Result of parsing one file with a grammar.
 *
 * @param language  language the grammar belongs to
 * @param root      file-level node
 * @param lineCount number of lines in the parsed text
 */
public record SyntaxTree(Language language, SyntaxNode root, int lineCount) {

    public List<SyntaxNode> topLevel() {
        return root.getChildren();
    }
}
