package com.purchasingpower.cora.parser;

import com.purchasingpower.cora.model.parse.Language;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Dispatches a language to the grammar parser that supports it.
 */
@Slf4j
@Component
public class GrammarParserRegistry {

    private final Map<Language, GrammarParser> parsers = new EnumMap<>(Language.class);

    public GrammarParserRegistry(List<GrammarParser> grammarParsers) {
        for (GrammarParser parser : grammarParsers) {
            for (Language language : parser.supportedLanguages()) {
                GrammarParser previous = parsers.putIfAbsent(language, parser);
                if (previous != null) {
                    log.warn("Language {} already handled by {}, ignoring {}", language,
                            previous.getClass().getSimpleName(), parser.getClass().getSimpleName());
                }
            }
        }
        log.info("Grammar parsers registered for {}", parsers.keySet());
    }

    public Optional<GrammarParser> forLanguage(Language language) {
        return Optional.ofNullable(parsers.get(language));
    }
}
