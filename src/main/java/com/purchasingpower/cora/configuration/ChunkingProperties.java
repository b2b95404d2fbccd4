package com.purchasingpower.cora.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class ChunkingProperties {

    /** Items below this many characters are merged with their small neighbours. */
    @Min(1)
    private int minChunkChars = 400;

    /** Soft upper bound for merged chunks; a single oversized declaration may exceed it. */
    @Min(1)
    private int maxChunkChars = 4000;

    /** Window size for the fixed-window splitter. */
    @Min(1)
    private int windowLines = 60;
}
