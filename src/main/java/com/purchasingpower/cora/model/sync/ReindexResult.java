package com.purchasingpower.cora.model.sync;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.List;

/**
 * Result of a reindex pass over a repository.
 */
@Data
@Builder
public class ReindexResult {

    private final String repoId;
    private final SyncType syncType;
    private final String fromCommit;
    private final String toCommit;
    private final long totalTimeMs;

    @Singular
    private final List<FileIndexResult> files;

    public static ReindexResult error(String repoId, long totalTimeMs) {
        return ReindexResult.builder().repoId(repoId).syncType(SyncType.ERROR).totalTimeMs(totalTimeMs).build();
    }

    public long count(FileIndexOutcome outcome) {
        return files.stream().filter(file -> file.outcome() == outcome).count();
    }

    public int chunksCreated() {
        return files.stream().mapToInt(FileIndexResult::chunkCount).sum();
    }

    /**
     * Human-readable summary of the pass.
     */
    public String summary() {
        return String.format(
                "[%s] %s: %d files analyzed, %d indexed, %d unchanged, %d republished, %d retired, %d failed, %d chunks in %dms",
                syncType, repoId, files.size(), count(FileIndexOutcome.INDEXED), count(FileIndexOutcome.UNCHANGED),
                count(FileIndexOutcome.REPUBLISHED), count(FileIndexOutcome.RETIRED), count(FileIndexOutcome.FAILED),
                chunksCreated(), totalTimeMs
        );
    }

    /**
     * Returns true if the latest view of the repository changed.
     */
    public boolean hadChanges() {
        return count(FileIndexOutcome.INDEXED) + count(FileIndexOutcome.REPUBLISHED) + count(FileIndexOutcome.RETIRED) > 0;
    }

    public boolean isSuccess() {
        return syncType != SyncType.ERROR && count(FileIndexOutcome.FAILED) == 0;
    }
}
