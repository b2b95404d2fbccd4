package com.purchasingpower.cora.knowledge;

import com.purchasingpower.cora.model.index.EntityType;
import com.purchasingpower.cora.model.retrieval.QueryScope;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * What is known about the using side of an identifier when resolving it.
 */
@Value
@Builder(toBuilder = true)
public class ResolutionConstraints {

    /** Repositories and versions definitions may come from. */
    @Builder.Default
    QueryScope scope = QueryScope.latest();

    /** Only definitions of this kind, any kind when null. */
    EntityType entityType;

    /** Module the identifier was imported from, as written at the usage site. */
    String importPath;

    String referencingRepoId;

    String referencingFilePath;

    /** Creation time of the referencing file version; definitions created later rank lower. */
    Instant referencedAt;
}
