package com.purchasingpower.cora.knowledge;

import com.purchasingpower.cora.model.index.ContentEntityDefinition;
import com.purchasingpower.cora.model.index.FileVersion;
import lombok.Value;

/**
 * A resolution candidate with the distances it was ranked by.
 */
@Value
public class ResolvedDefinition {

    ContentEntityDefinition definition;
    FileVersion fileVersion;

    /** 0 when the defining version is not newer than the referencing one, 1 otherwise. */
    int versionDistance;

    /** 0 same file, 1 same directory, 2 same repository, 3 another repository. */
    int pathDistance;

    /** True when found by following a re-export of the imported module. */
    boolean viaReexport;

    public String getChunkId() {
        return definition.getChunkId();
    }
}
