package com.purchasingpower.cora.model.parse;

import com.purchasingpower.cora.model.index.EntityType;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.function.Consumer;

/**
 * Grammar-neutral view of one concrete syntax tree node.
 *
 * Adapters classify nodes while converting them: a node with a non-null {@link #declaration} is a
 * named declaration site, and {@link #usages} holds the identifier uses found directly in the
 * node (not in its children).
 */
@Value
@Builder
public class SyntaxNode {

    /** Grammar-specific node type, e.g. {@code function_declaration}. */
    String type;

    /** Declared name, null unless the node is a declaration. */
    String name;

    EntityType declaration;

    int startLine;
    int endLine;

    @Singular
    List<SyntaxNode> children;

    @Singular
    List<IdentifierUsage> usages;

    public boolean isDeclaration() {
        return declaration != null && name != null;
    }

    /** Pre-order walk over this node and all descendants. */
    public void walk(Consumer<SyntaxNode> visitor) {
        visitor.accept(this);
        for (SyntaxNode child : children) {
            child.walk(visitor);
        }
    }
}
