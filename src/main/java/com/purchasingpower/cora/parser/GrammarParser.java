package com.purchasingpower.cora.parser;

import com.purchasingpower.cora.model.parse.Language;
import com.purchasingpower.cora.model.parse.SyntaxTree;

import java.util.Set;

/**
 * Wraps a concrete-syntax-tree parser for one or more languages and converts its tree into the
 * grammar-neutral {@link com.purchasingpower.cora.model.parse.SyntaxNode} form: declarations are
 * named and typed, identifier usages are classified by syntactic context.
 *
 * Implementations must be safe to call from several indexing threads at once.
 */
public interface GrammarParser {

    Set<Language> supportedLanguages();

    /**
     * @throws ParseFailedException when the text does not parse cleanly; callers fall back to
     *                              heuristic splitting for the file
     */
    SyntaxTree parse(String text, Language language) throws ParseFailedException;
}
