package com.purchasingpower.cora.model.sync;

/**
 * A file that changed between two commits, path relative to the repository root.
 */
public record ChangedFile(
        String path,
        ChangeType changeType
) {
    public enum ChangeType {
        ADD,
        MODIFY,
        DELETE
    }
}
