package com.purchasingpower.cora.model.retrieval;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Repositories a read may see and, per repository, the point in time it is pinned to.
 *
 * An unpinned repository is read at its latest published file versions. A pinned repository is
 * read as it was at the instant: for every path, the version recorded at the newest commit not
 * after that instant. An empty repository list means every repository.
 */
@Value
@Builder
public class QueryScope {

    @Singular
    List<String> repoIds;

    @Singular("pin")
    Map<String, Instant> pinnedAt;

    public static QueryScope latest(String... repoIds) {
        return QueryScope.builder().repoIds(List.of(repoIds)).build();
    }

    public boolean includes(String repoId) {
        return repoIds.isEmpty() || repoIds.contains(repoId);
    }

    /** Instant the repository is pinned to, null when it is read at its latest versions. */
    public Instant asOf(String repoId) {
        return pinnedAt.get(repoId);
    }
}
