package com.purchasingpower.cora.model;

/**
 * Enumeration of external collaborator types for unified logging.
 *
 * Used by ExternalCallLogger to categorize and log calls to the index store,
 * the embedding and chat models, and git with consistent formatting.
 *
 * @see com.purchasingpower.cora.util.ExternalCallLogger
 */
public enum ServiceType {
    INDEX_STORE("🟢", "IndexStore"),
    EMBEDDING("🔴", "Embedding"),
    COMMENTARY("🟠", "Commentary"),
    GIT("🔷", "Git");

    private final String emoji;
    private final String name;

    ServiceType(String emoji, String name) {
        this.emoji = emoji;
        this.name = name;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getName() {
        return name;
    }
}
