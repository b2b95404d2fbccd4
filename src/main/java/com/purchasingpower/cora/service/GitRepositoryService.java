package com.purchasingpower.cora.service;

import com.purchasingpower.cora.model.sync.ChangedFile;

import java.io.File;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read-only access to the git history of a checkout.
 */
public interface GitRepositoryService {

    /** HEAD commit of a checkout. */
    record CommitInfo(String hash, Instant timestamp) {
    }

    boolean isGitRepository(File checkoutDir);

    /**
     * @return empty when the checkout is not a git repository or has no commit yet
     */
    Optional<CommitInfo> headCommit(File checkoutDir);

    /**
     * Paths of every file in the HEAD tree, relative to the repository root.
     */
    List<String> listTrackedFiles(File checkoutDir);

    /**
     * Files changed between two commits, deletions included.
     */
    List<ChangedFile> changedFilesBetween(File checkoutDir, String fromCommit, String toCommit);
}
