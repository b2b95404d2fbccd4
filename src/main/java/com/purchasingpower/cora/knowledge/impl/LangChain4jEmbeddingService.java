package com.purchasingpower.cora.knowledge.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.cora.knowledge.EmbeddingService;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * LangChain4j-based embedding service.
 *
 * The model (Ollama by default, see {@code LangChain4jConfiguration}) brings its own timeout and
 * retries; callers add backoff around whole chunks through the retry executor.
 *
 * @since 0.1.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LangChain4jEmbeddingService implements EmbeddingService {

    private final EmbeddingModel embeddingModel;

    @Override
    public float[] embed(String text) {
        Preconditions.checkArgument(text != null && !text.isEmpty(), "Text cannot be empty");

        log.debug("🔴 Generating embedding (length: {})", text.length());
        try {
            Response<Embedding> response = embeddingModel.embed(text);
            float[] vector = response.content().vector();
            log.debug("✅ Generated embedding ({} dimensions)", vector.length);
            return vector;
        } catch (Exception e) {
            log.error("❌ Failed to generate embedding after retries: {}", e.getMessage());
            throw new RuntimeException("Embedding generation failed", e);
        }
    }

    @Override
    public List<float[]> embedAll(List<String> texts) {
        Preconditions.checkArgument(texts.stream().noneMatch(text -> text == null || text.isEmpty()),
                "Texts cannot be empty");
        log.info("🔴 Generating embeddings for {} texts in batch", texts.size());

        List<TextSegment> segments = texts.stream()
                .map(TextSegment::from)
                .collect(Collectors.toList());
        try {
            Response<List<Embedding>> response = embeddingModel.embedAll(segments);
            List<float[]> vectors = response.content().stream()
                    .map(Embedding::vector)
                    .collect(Collectors.toList());
            log.info("✅ Generated {} embeddings", vectors.size());
            return vectors;
        } catch (Exception e) {
            log.error("❌ Batch embedding generation failed after retries: {}", e.getMessage());
            throw new RuntimeException("Batch embedding generation failed", e);
        }
    }
}
