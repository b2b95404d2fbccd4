package com.purchasingpower.cora.model.query;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A contiguous run of selected chunks of one file, rendered the same way.
 */
@Value
@Builder
public class ContextSection {

    int lineStart;
    int lineEnd;
    RenderMode renderMode;
    String content;

    /** Commentary of the merged chunks, in line order. */
    @Singular
    List<String> commentaries;

    @Singular
    List<String> chunkIds;
}
