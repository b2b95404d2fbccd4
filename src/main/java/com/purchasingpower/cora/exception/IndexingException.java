package com.purchasingpower.cora.exception;

import lombok.Getter;

/**
 * Raised when a single file could not be brought into the index.
 * The previous version of the file stays authoritative.
 */
@Getter
public class IndexingException extends RuntimeException {

    private final String repoId;
    private final String filePath;

    public IndexingException(String repoId, String filePath, String message, Throwable cause) {
        super(message, cause);
        this.repoId = repoId;
        this.filePath = filePath;
    }
}
