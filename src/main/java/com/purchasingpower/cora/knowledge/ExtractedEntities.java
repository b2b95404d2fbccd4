package com.purchasingpower.cora.knowledge;

import com.purchasingpower.cora.model.index.ContentEntityDefinition;
import com.purchasingpower.cora.model.index.ContentEntityReference;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Definitions and references extracted from one file version.
 */
public record ExtractedEntities(List<ContentEntityDefinition> definitions, List<ContentEntityReference> references) {

    /** Distinct identifiers used inside one chunk, in order of first use. */
    public List<String> symbolsUsedIn(String chunkId) {
        Set<String> symbols = references.stream()
                .filter(reference -> chunkId.equals(reference.getChunkId()))
                .map(ContentEntityReference::getIdentifierUsed)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        return List.copyOf(symbols);
    }
}
