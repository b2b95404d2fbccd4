package com.purchasingpower.cora.model.index;

import com.google.common.hash.Hashing;
import lombok.Builder;
import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * One immutable content snapshot of one file path. A new version is created only when the
 * content hash changes; older versions stay in the store for historical queries.
 */
@Value
@Builder
public class FileVersion {

    String repoId;
    String projectDir;
    String filePath;
    String contentHash;
    String language;
    int lineCount;

    /** Generation stamp: when this snapshot was first seen. */
    Instant createdAt;

    /**
     * Stable identifier derived from {@code (repoId, projectDir, filePath, contentHash)}, so the
     * same snapshot always maps to the same version.
     */
    public String getId() {
        return idOf(repoId, projectDir, filePath, contentHash);
    }

    public static String idOf(String repoId, String projectDir, String filePath, String contentHash) {
        String key = repoId + '\u0000' + (projectDir == null ? "" : projectDir) + '\u0000' + filePath
                + '\u0000' + contentHash;
        return Hashing.sha256().hashString(key, StandardCharsets.UTF_8).toString().substring(0, 24);
    }

    /** Directory part of the file path, empty for files at the project root. */
    public String getDirectory() {
        int slash = filePath.lastIndexOf('/');
        return slash < 0 ? "" : filePath.substring(0, slash);
    }
}
