package com.purchasingpower.cora.knowledge.impl;

import com.purchasingpower.cora.chunking.ChunkDraft;
import com.purchasingpower.cora.configuration.AppProperties;
import com.purchasingpower.cora.knowledge.CommentaryGenerator;
import com.purchasingpower.cora.model.CallContext;
import com.purchasingpower.cora.model.ServiceType;
import com.purchasingpower.cora.util.ExternalCallLogger;
import dev.langchain4j.model.chat.ChatLanguageModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Asks the commentary chat model for a short description of each chunk.
 *
 * A failed call yields no commentary; the chunk is indexed without it.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.commentary.enabled", havingValue = "true")
public class LangChain4jCommentaryGenerator implements CommentaryGenerator {

    private static final String PROMPT = """
            Describe in two or three sentences what the following excerpt of %s does and which \
            other parts of the code it relies on. Answer with the description only.

            ```%s
            %s
            ```
            """;

    private final ChatLanguageModel commentaryModel;
    private final AppProperties appProperties;

    public LangChain4jCommentaryGenerator(@Qualifier("commentaryModel") ChatLanguageModel commentaryModel,
                                          AppProperties appProperties) {
        this.commentaryModel = commentaryModel;
        this.appProperties = appProperties;
    }

    @Override
    public Optional<String> describe(String filePath, String language, ChunkDraft chunk) {
        int maxInput = appProperties.getCommentary().getMaxInputChars();
        String content = chunk.content().length() > maxInput ? chunk.content().substring(0, maxInput) : chunk.content();
        String prompt = String.format(PROMPT, filePath, language, content);

        CallContext call = ExternalCallLogger.startCall(ServiceType.COMMENTARY, "describe",
                ExternalCallLogger.linesTarget(filePath, chunk.lineStart(), chunk.lineEnd()), log);
        call.logRequest(language + ", " + content.length() + " chars");
        try {
            String commentary = commentaryModel.generate(prompt);
            call.logResponse(ExternalCallLogger.truncate(commentary, 120));
            return Optional.ofNullable(commentary).map(String::trim).filter(text -> !text.isEmpty());
        } catch (RuntimeException e) {
            call.logError("commentary failed for " + filePath, e);
            return Optional.empty();
        }
    }
}
