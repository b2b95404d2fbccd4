package com.purchasingpower.cora.model.query;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Singular;

import java.util.List;
import java.util.Optional;

/**
 * Context query as handed over by the API layer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryRequest {

    @Singular
    private List<QueryMessage> messages;

    /** Approximate number of characters the rendered context may take. */
    private int approxLength;

    @Singular
    private List<RepoSpec> repos;

    @Builder.Default
    private BoostDirectives boostDirectives = BoostDirectives.none();

    /** Deadline for the whole query in milliseconds, 0 for none. */
    private long timeoutMs;

    /** Content of the last user turn, which is what gets searched. */
    public Optional<String> latestUserContent() {
        if (messages == null) {
            return Optional.empty();
        }
        for (int i = messages.size() - 1; i >= 0; i--) {
            QueryMessage message = messages.get(i);
            if (message.isUser() && message.getContent() != null && !message.getContent().isBlank()) {
                return Optional.of(message.getContent());
            }
        }
        return Optional.empty();
    }
}
