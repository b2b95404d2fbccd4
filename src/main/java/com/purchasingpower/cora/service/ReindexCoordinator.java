package com.purchasingpower.cora.service;

import com.purchasingpower.cora.model.index.RepositoryRef;
import com.purchasingpower.cora.model.sync.FileIndexResult;
import com.purchasingpower.cora.model.sync.ReindexResult;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Keeps the index in step with repository checkouts.
 *
 * <p>Writes to one {@code (repoId, filePath)} are serialized; different files are indexed in
 * parallel. A new file version is written completely before it becomes the latest one, so a
 * failed write leaves the previous version in place.
 *
 * <p>USAGE:
 * <pre>
 * coordinator.registerRepository(repo);
 * ReindexResult result = coordinator.notifyChanged("shop", List.of("src/cart.ts")).join();
 * log.info("Reindex complete: {}", result.summary());
 * </pre>
 */
public interface ReindexCoordinator {

    void registerRepository(RepositoryRef repository);

    /**
     * Change notification from a file watcher. No paths means a full rescan.
     */
    CompletableFuture<ReindexResult> notifyChanged(String repoId, List<String> filePaths);

    /**
     * Explicit reindex request. With {@code force} unchanged content is re-extracted too.
     * No paths means a full rescan.
     */
    CompletableFuture<ReindexResult> refresh(String repoId, List<String> filePaths, boolean force);

    /**
     * Reindexes the files changed between the last indexed commit and HEAD, or everything when
     * the repository was never indexed at a commit.
     */
    CompletableFuture<ReindexResult> syncToHead(String repoId);

    /**
     * Reindexes one path on the calling thread.
     */
    FileIndexResult reindexFile(String repoId, String filePath, boolean force);
}
