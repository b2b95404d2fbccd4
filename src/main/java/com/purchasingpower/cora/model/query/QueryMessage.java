package com.purchasingpower.cora.model.query;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One conversation turn of a query request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryMessage {

    public static final String USER = "user";

    private String role; // "user" or "assistant"
    private String content;

    public static QueryMessage user(String content) {
        return new QueryMessage(USER, content);
    }

    public boolean isUser() {
        return USER.equalsIgnoreCase(role);
    }
}
