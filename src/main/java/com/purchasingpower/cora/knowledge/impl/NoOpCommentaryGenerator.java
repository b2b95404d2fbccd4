package com.purchasingpower.cora.knowledge.impl;

import com.purchasingpower.cora.chunking.ChunkDraft;
import com.purchasingpower.cora.knowledge.CommentaryGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Active while {@code app.commentary.enabled} is false: chunks are stored without commentary.
 */
@Service
@ConditionalOnProperty(name = "app.commentary.enabled", havingValue = "false", matchIfMissing = true)
public class NoOpCommentaryGenerator implements CommentaryGenerator {

    @Override
    public Optional<String> describe(String filePath, String language, ChunkDraft chunk) {
        return Optional.empty();
    }
}
