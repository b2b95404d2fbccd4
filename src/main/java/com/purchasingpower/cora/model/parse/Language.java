package com.purchasingpower.cora.model.parse;

import java.util.List;
import java.util.Locale;

/**
 * Languages and formats the indexer recognizes, detected from the file name.
 */
public enum Language {
    JAVA("java", FormatFamily.CODE, List.of(".java")),
    TYPESCRIPT("typescript", FormatFamily.CODE, List.of(".ts", ".mts", ".cts")),
    JAVASCRIPT("javascript", FormatFamily.CODE, List.of(".js", ".mjs", ".cjs")),
    TSX("tsx", FormatFamily.CODE, List.of(".tsx", ".jsx")),
    PYTHON("python", FormatFamily.CODE, List.of(".py")),
    GO("go", FormatFamily.CODE, List.of(".go")),
    KOTLIN("kotlin", FormatFamily.CODE, List.of(".kt", ".kts")),
    RUST("rust", FormatFamily.CODE, List.of(".rs")),
    MARKDOWN("markdown", FormatFamily.MARKDOWN, List.of(".md", ".markdown", ".mdx")),
    YAML("yaml", FormatFamily.KEY_VALUE, List.of(".yml", ".yaml")),
    PROPERTIES("properties", FormatFamily.KEY_VALUE, List.of(".properties", ".ini", ".cfg", ".env")),
    TOML("toml", FormatFamily.KEY_VALUE, List.of(".toml")),
    JSON("json", FormatFamily.KEY_VALUE, List.of(".json", ".jsonc")),
    TEXT("text", FormatFamily.PLAIN, List.of());

    private final String id;
    private final FormatFamily family;
    private final List<String> extensions;

    Language(String id, FormatFamily family, List<String> extensions) {
        this.id = id;
        this.family = family;
        this.extensions = extensions;
    }

    public String getId() {
        return id;
    }

    public FormatFamily getFamily() {
        return family;
    }

    public List<String> getExtensions() {
        return extensions;
    }

    public static Language fromId(String id) {
        for (Language language : values()) {
            if (language.id.equals(id)) {
                return language;
            }
        }
        return TEXT;
    }

    public static Language detect(String filePath) {
        String lower = filePath.toLowerCase(Locale.ROOT);
        for (Language language : values()) {
            for (String extension : language.extensions) {
                if (lower.endsWith(extension)) {
                    return language;
                }
            }
        }
        return TEXT;
    }
}
