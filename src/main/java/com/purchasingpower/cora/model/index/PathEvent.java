package com.purchasingpower.cora.model.index;

import java.time.Instant;

/**
 * One change of what a path's latest version is: a version was published, or the path was
 * deleted. Replaying a path's events answers which version a reader pinned at an instant sees,
 * including reverts to an older version and deletions.
 *
 * @param fileVersionId published version, null when the path was deleted
 * @param commitHash    commit the change was indexed at, null outside git checkouts
 * @param timestamp     commit time, or when the change was indexed outside git checkouts
 */
public record PathEvent(
        String repoId,
        String projectDir,
        String filePath,
        String fileVersionId,
        String commitHash,
        Instant timestamp
) {

    public static PathEvent published(FileVersion version, String commitHash, Instant timestamp) {
        return new PathEvent(version.getRepoId(), version.getProjectDir(), version.getFilePath(), version.getId(),
                commitHash, timestamp);
    }

    public static PathEvent deleted(String repoId, String projectDir, String filePath, String commitHash,
                                    Instant timestamp) {
        return new PathEvent(repoId, projectDir, filePath, null, commitHash, timestamp);
    }

    public boolean isDeletion() {
        return fileVersionId == null;
    }

    public boolean hasCommit() {
        return commitHash != null;
    }
}
