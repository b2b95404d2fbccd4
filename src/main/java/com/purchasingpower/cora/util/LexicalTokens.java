package com.purchasingpower.cora.util;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Tokenizer for lexical scoring. Splits on non-alphanumerics and camelCase boundaries and keeps
 * the whole identifier too, so {@code parseConfigFile} matches both the identifier and "config".
 */
public final class LexicalTokens {

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}_]+");
    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("(?<=[a-z0-9])(?=[A-Z])|_");

    private LexicalTokens() {
    }

    public static Set<String> tokenize(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        if (text == null || text.isEmpty()) {
            return tokens;
        }
        for (String word : NON_WORD.split(text)) {
            if (word.isEmpty()) {
                continue;
            }
            add(tokens, word);
            for (String part : CAMEL_BOUNDARY.split(word)) {
                add(tokens, part);
            }
        }
        return tokens;
    }

    /**
     * Fraction of query tokens present in the document, in [0,1].
     */
    public static double overlap(Set<String> queryTokens, Set<String> documentTokens) {
        if (queryTokens.isEmpty()) {
            return 0.0;
        }
        long hits = queryTokens.stream().filter(documentTokens::contains).count();
        return (double) hits / queryTokens.size();
    }

    private static void add(Set<String> tokens, String token) {
        if (token.length() > 1) {
            tokens.add(token.toLowerCase(Locale.ROOT));
        }
    }
}
