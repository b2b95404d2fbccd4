package com.purchasingpower.cora.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.cora.model.query.ContextSection;
import com.purchasingpower.cora.model.query.FileContext;
import com.purchasingpower.cora.model.query.QueryRequest;
import com.purchasingpower.cora.model.query.QueryResponse;
import com.purchasingpower.cora.model.query.RenderMode;
import com.purchasingpower.cora.model.query.RepositoryContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Wire and prompt renderings of query requests and responses.
 */
@Component
@RequiredArgsConstructor
public class ContextResponseSerializer {

    private final ObjectMapper objectMapper;

    public String toJson(QueryResponse response) {
        try {
            return objectMapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize query response", e);
        }
    }

    public QueryRequest readRequest(String json) {
        try {
            return objectMapper.readValue(json, QueryRequest.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed query request: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Plain-text rendering for prompts: one header per file, then its sections.
     */
    public String toText(QueryResponse response) {
        StringBuilder text = new StringBuilder();
        for (RepositoryContext repository : response.getRepositories()) {
            for (FileContext file : repository.getFiles()) {
                text.append("=== ").append(repository.getRepoId()).append(':').append(file.getFilePath())
                        .append(" ===\n");
                for (ContextSection section : file.getSections()) {
                    text.append("--- lines ").append(section.getLineStart()).append('-').append(section.getLineEnd());
                    if (section.getRenderMode() == RenderMode.ELIDED) {
                        text.append(" (elided)");
                    }
                    text.append(" ---\n");
                    for (String commentary : section.getCommentaries()) {
                        text.append("// ").append(commentary.replace("\n", "\n// ")).append('\n');
                    }
                    text.append(section.getContent());
                    if (!section.getContent().endsWith("\n")) {
                        text.append('\n');
                    }
                }
                text.append('\n');
            }
        }
        return text.toString();
    }
}
