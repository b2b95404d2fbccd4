package com.purchasingpower.cora.model.query;

/**
 * How a selected chunk appears in the response.
 */
public enum RenderMode {

    /** Complete content. */
    FULL,

    /** Line range and metadata only, body replaced by the elision marker. */
    ELIDED
}
