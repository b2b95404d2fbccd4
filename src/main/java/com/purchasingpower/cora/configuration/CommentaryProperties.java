package com.purchasingpower.cora.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class CommentaryProperties {

    private boolean enabled = false;

    /** Chunk content beyond this length is cut before it is sent to the chat model. */
    @Min(1)
    private int maxInputChars = 6000;
}
