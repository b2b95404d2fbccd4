package com.purchasingpower.cora.model.sync;

/**
 * Outcome of reindexing one path.
 *
 * @param fileVersionId version that is latest after the operation, null when there is none
 * @param chunkCount    chunks written, 0 unless a new version was indexed
 */
public record FileIndexResult(
        String filePath,
        FileIndexOutcome outcome,
        String fileVersionId,
        int chunkCount,
        String message
) {
    public static FileIndexResult of(String filePath, FileIndexOutcome outcome, String fileVersionId) {
        return new FileIndexResult(filePath, outcome, fileVersionId, 0, null);
    }

    public static FileIndexResult failed(String filePath, String message) {
        return new FileIndexResult(filePath, FileIndexOutcome.FAILED, null, 0, message);
    }
}
