package com.purchasingpower.cora.model.index;

/**
 * Kind of a named declaration recorded as a {@link ContentEntityDefinition}.
 */
public enum EntityType {
    FUNCTION,
    METHOD,
    CLASS,
    INTERFACE,
    ENUM,
    TYPE,
    VARIABLE,
    /** Heading-delimited section of a prose document. */
    SECTION,
    /** Top-level key group of a key/value document. */
    KEY,
    /** A whole file, the target of imports and document links. */
    MODULE
}
