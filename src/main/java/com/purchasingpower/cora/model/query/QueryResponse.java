package com.purchasingpower.cora.model.query;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Assembled context: repositories, then files, then sections in line order.
 */
@Value
@Builder(toBuilder = true)
public class QueryResponse {

    @Singular
    List<RepositoryContext> repositories;

    @Singular
    List<UsedChunk> usedChunks;

    /** Characters of rendered section content. */
    int renderedChars;

    /** The walk stopped early: tail cut or deadline. */
    boolean truncated;

    /** Part of the pipeline failed and the result is best effort. */
    boolean degraded;

    public static QueryResponse empty() {
        return QueryResponse.builder().build();
    }

    /** Distinct {@code repoId:filePath} entries of the used chunks, in selection order. */
    public List<String> usedFiles() {
        return usedChunks.stream()
                .map(used -> used.getRepoId() + ":" + used.getFilePath())
                .distinct()
                .collect(Collectors.toList());
    }
}
