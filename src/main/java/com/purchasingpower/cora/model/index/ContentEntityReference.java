package com.purchasingpower.cora.model.index;

import lombok.Builder;
import lombok.Value;

/**
 * A usage site of an identifier. Only facts about the using side are stored; the definition it
 * points at is resolved at query time so that it never goes stale when the target changes.
 */
@Value
@Builder
public class ContentEntityReference {

    String identifierUsed;
    ReferenceType referenceType;

    /** Module path the identifier was imported or re-exported from, as written in source. */
    String importPath;

    /** Name under which a re-exported identifier is visible to importers. */
    String alias;

    String repoId;
    String filePath;
    String fileVersionId;
    int line;
    String chunkId;

    /** Name importers of this file see: the alias of a re-export, otherwise the identifier. */
    public String exportedName() {
        return alias != null ? alias : identifierUsed;
    }
}
