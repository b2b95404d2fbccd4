package com.purchasingpower.cora.parser;

import lombok.Getter;

/**
 * Signals that a grammar could not produce a usable syntax tree for a file.
 * Callers fall back to heuristic splitting.
 */
@Getter
public class ParseFailedException extends Exception {

    private final String language;

    public ParseFailedException(String language, String message) {
        super(message);
        this.language = language;
    }

    public ParseFailedException(String language, String message, Throwable cause) {
        super(message, cause);
        this.language = language;
    }
}
