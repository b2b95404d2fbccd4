package com.purchasingpower.cora.model.index;

import java.time.Instant;

/**
 * Records that a file version was the content of its path at a given commit.
 * A version unchanged across commits gets one row per commit.
 */
public record CommitFileVersion(
        String fileVersionId,
        String repoId,
        String filePath,
        String commitHash,
        Instant timestamp
) {
}
