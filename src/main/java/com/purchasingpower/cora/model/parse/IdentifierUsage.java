package com.purchasingpower.cora.model.parse;

import com.purchasingpower.cora.model.index.ReferenceType;

/**
 * An identifier used (not declared) at a line, with the syntactic context it appeared in.
 *
 * @param name       identifier as written
 * @param type       call, import, re-export, link or plain mention
 * @param line       1-based line of the usage
 * @param importPath module path for imports and re-exports, otherwise null
 * @param alias      local or exported alias, otherwise null
 */
public record IdentifierUsage(String name, ReferenceType type, int line, String importPath, String alias) {

    public static IdentifierUsage of(String name, ReferenceType type, int line) {
        return new IdentifierUsage(name, type, line, null, null);
    }
}
