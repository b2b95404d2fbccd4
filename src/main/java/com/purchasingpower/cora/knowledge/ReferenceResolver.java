package com.purchasingpower.cora.knowledge;

import com.purchasingpower.cora.model.index.ContentEntityReference;
import com.purchasingpower.cora.model.retrieval.QueryScope;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Query-time resolution of identifier uses to definitions, and the chunk graph derived from it.
 *
 * <p>Resolution is approximate: candidates are definitions with exactly the used identifier,
 * restricted to the file versions visible in the scope. They are ordered by version distance,
 * then path distance, then definition id, so identical inputs always give the same list. An
 * import path hint narrows the candidates to the imported module when any of them live there;
 * when none do, re-exports of that module are followed once. Longer re-export chains stay
 * unresolved.
 */
public interface ReferenceResolver {

    List<ResolvedDefinition> resolve(String identifierUsed, ResolutionConstraints constraints);

    /**
     * Resolve a stored reference using its own file, import hint and version as constraints.
     */
    List<ResolvedDefinition> resolve(ContentEntityReference reference, QueryScope scope);

    /**
     * Chunk owning the top resolution candidate of a reference.
     */
    Optional<String> resolveToChunk(ContentEntityReference reference, QueryScope scope);

    /**
     * Edges between the given chunks and their one-hop neighbours in both directions: chunks the
     * given ones depend on, and chunks whose references resolve into the given ones.
     */
    ReferenceGraph buildGraph(Collection<String> chunkIds, QueryScope scope);
}
