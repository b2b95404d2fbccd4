package com.purchasingpower.cora.model.parse;

/**
 * How a file is split into content items when no grammar is used.
 */
public enum FormatFamily {
    /** Source code: grammar first, fixed line windows as fallback. */
    CODE,
    /** Prose split at heading boundaries. */
    MARKDOWN,
    /** Configuration split at top-level key groups. */
    KEY_VALUE,
    /** Anything else: fixed line windows. */
    PLAIN
}
