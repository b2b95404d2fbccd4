package com.purchasingpower.cora.model.index;

/**
 * Syntactic context in which an identifier is used.
 */
public enum ReferenceType {
    CALL,
    IMPORT,
    /** Inbound link from prose. */
    LINK,
    /** Re-export of a name imported from another module, possibly under an alias. */
    REEXPORT,
    MENTION
}
