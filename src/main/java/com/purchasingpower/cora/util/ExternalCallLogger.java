package com.purchasingpower.cora.util;

import com.purchasingpower.cora.model.CallContext;
import com.purchasingpower.cora.model.ServiceType;
import org.slf4j.Logger;

/**
 * Starts {@link CallContext}s for calls to the index store, the embedding and commentary models
 * and git, and formats what those calls are about.
 *
 * <p>Every call names a target, usually {@code repoId:filePath}, so that a failing store write or
 * embedding batch in the log points at the file being indexed.
 */
public final class ExternalCallLogger {

    private ExternalCallLogger() {
    }

    public static CallContext startCall(ServiceType service, String operation, Logger logger) {
        return new CallContext(service, operation, null, logger);
    }

    public static CallContext startCall(ServiceType service, String operation, String target, Logger logger) {
        return new CallContext(service, operation, target, logger);
    }

    /** Target of a call made for one file of a repository. */
    public static String fileTarget(String repoId, String filePath) {
        if (filePath == null || filePath.isEmpty()) {
            return repoId;
        }
        return repoId + ":" + filePath;
    }

    /** Target of a call made for a line range of a file. */
    public static String linesTarget(String filePath, int lineStart, int lineEnd) {
        return filePath + "#L" + lineStart + "-" + lineEnd;
    }

    /**
     * Truncate large strings for logging (to avoid log spam)
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "(null)";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "... [+" + (text.length() - maxLength) + " chars]";
    }
}
