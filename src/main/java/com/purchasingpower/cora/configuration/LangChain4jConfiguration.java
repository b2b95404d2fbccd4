package com.purchasingpower.cora.configuration;

import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Ollama models behind the embedding provider and the commentary generator.
 *
 * Both are built from {@code app.ollama}. The embedding model serves index time and query time
 * alike; the chat model is only created when commentary is enabled.
 *
 * @since 0.1.0
 */
@Slf4j
@Configuration
public class LangChain4jConfiguration {

    @Bean
    @ConditionalOnMissingBean(EmbeddingModel.class)
    public EmbeddingModel embeddingModel(AppProperties props) {
        OllamaProperties ollama = props.getOllama();
        log.info("🔴 Initializing Ollama embedding model");
        log.info("   - URL: {}", ollama.getBaseUrl());
        log.info("   - Model: {}", ollama.getEmbeddingModel());
        log.info("   - Timeout: {}s, max retries: {}", ollama.getTimeoutSeconds(), ollama.getMaxRetries());

        return OllamaEmbeddingModel.builder()
                .baseUrl(ollama.getBaseUrl())
                .modelName(ollama.getEmbeddingModel())
                .timeout(Duration.ofSeconds(ollama.getTimeoutSeconds()))
                .maxRetries(ollama.getMaxRetries())
                .logRequests(false)
                .logResponses(false)
                .build();
    }

    @Bean("commentaryModel")
    @ConditionalOnProperty(name = "app.commentary.enabled", havingValue = "true")
    public ChatLanguageModel commentaryModel(AppProperties props) {
        OllamaProperties ollama = props.getOllama();
        log.info("🟠 Initializing Ollama commentary model");
        log.info("   - URL: {}", ollama.getBaseUrl());
        log.info("   - Model: {}", ollama.getChatModel());

        return OllamaChatModel.builder()
                .baseUrl(ollama.getBaseUrl())
                .modelName(ollama.getChatModel())
                .timeout(Duration.ofSeconds(ollama.getTimeoutSeconds()))
                .temperature(0.0)
                .maxRetries(ollama.getMaxRetries())
                .logRequests(false)
                .logResponses(false)
                .build();
    }
}
