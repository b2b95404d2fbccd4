package com.purchasingpower.cora.chunking;

import com.purchasingpower.cora.configuration.AppProperties;
import com.purchasingpower.cora.configuration.ChunkingProperties;
import com.purchasingpower.cora.model.index.EntityType;
import com.purchasingpower.cora.model.parse.ContentItem;
import com.purchasingpower.cora.model.parse.FormatFamily;
import com.purchasingpower.cora.model.parse.Language;
import com.purchasingpower.cora.model.parse.SyntaxNode;
import com.purchasingpower.cora.model.parse.SyntaxTree;
import com.purchasingpower.cora.parser.GrammarParser;
import com.purchasingpower.cora.parser.GrammarParserRegistry;
import com.purchasingpower.cora.parser.ParseFailedException;
import com.purchasingpower.cora.util.TextLines;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns the content of one file into an ordered list of chunks.
 *
 * <p>Content items come from the grammar when one is registered for the language (top-level
 * declarations), otherwise from the splitter of the language's format family. Items are then
 * grouped:
 * <ul>
 *   <li>consecutive items below {@code min-chunk-chars} merge while the group stays within
 *       {@code max-chunk-chars}</li>
 *   <li>any other item gets a chunk of its own, however large; declarations are never split</li>
 * </ul>
 * Lines between items belong to the chunk of the following item, lines after the last item to
 * the last chunk, so the chunk ranges cover the file exactly once.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChunkBuilder {

    private final GrammarParserRegistry grammarParserRegistry;
    private final List<ContentItemSplitter> splitters;
    private final FixedWindowContentItemSplitter fixedWindowSplitter;
    private final AppProperties appProperties;

    public ChunkedFile build(String filePath, String text) {
        Language language = Language.detect(filePath);
        TextLines lines = TextLines.of(text);
        if (lines.count() == 0) {
            return new ChunkedFile(language, lines, null, List.of());
        }

        SyntaxTree tree = null;
        List<ContentItem> items = List.of();
        if (language.getFamily() == FormatFamily.CODE) {
            Optional<GrammarParser> parser = grammarParserRegistry.forLanguage(language);
            if (parser.isPresent()) {
                try {
                    tree = parser.get().parse(text, language);
                    items = declarationItems(tree);
                } catch (ParseFailedException e) {
                    log.warn("⚠️  {} parse failed for {}, using line windows: {}",
                            e.getLanguage(), filePath, e.getMessage());
                } catch (RuntimeException e) {
                    log.warn("⚠️  {} grammar crashed on {}, using line windows", language.getId(), filePath, e);
                }
            }
        } else {
            items = splitterFor(language)
                    .map(splitter -> splitter.split(lines, language))
                    .orElse(List.of());
        }

        if (items.isEmpty()) {
            items = fixedWindowSplitter.split(lines, language);
        }

        List<List<ContentItem>> groups = group(normalize(items, lines.count()), lines);
        List<ChunkDraft> chunks = toDrafts(groups, lines);
        log.debug("Chunked {} ({}, {} lines) into {} chunks{}", filePath, language.getId(), lines.count(),
                chunks.size(), tree == null ? " [heuristic]" : "");
        return new ChunkedFile(language, lines, tree, chunks);
    }

    private Optional<ContentItemSplitter> splitterFor(Language language) {
        return splitters.stream()
                .filter(splitter -> splitter != fixedWindowSplitter)
                .filter(splitter -> splitter.supports(language))
                .findFirst();
    }

    private static List<ContentItem> declarationItems(SyntaxTree tree) {
        return tree.topLevel().stream()
                .filter(SyntaxNode::isDeclaration)
                .map(ContentItem::of)
                .collect(Collectors.toList());
    }

    /**
     * Sorts items, clamps them to the file and coalesces items sharing lines, so that the
     * grouping below works on disjoint spans.
     */
    private static List<ContentItem> normalize(List<ContentItem> items, int lineCount) {
        List<ContentItem> sorted = new ArrayList<>(items);
        sorted.sort(Comparator.comparingInt(ContentItem::startLine).thenComparingInt(ContentItem::endLine));

        List<ContentItem> result = new ArrayList<>();
        for (ContentItem item : sorted) {
            int start = Math.max(1, item.startLine());
            int end = Math.min(lineCount, item.endLine());
            if (end < start) {
                continue;
            }
            ContentItem last = result.isEmpty() ? null : result.get(result.size() - 1);
            if (last != null && start <= last.endLine()) {
                result.set(result.size() - 1, new ContentItem(last.name(), last.kind(), last.startLine(),
                        Math.max(last.endLine(), end), last.node()));
            } else {
                result.add(new ContentItem(item.name(), item.kind(), start, end, item.node()));
            }
        }
        return result;
    }

    private List<List<ContentItem>> group(List<ContentItem> items, TextLines lines) {
        ChunkingProperties chunking = appProperties.getChunking();
        List<List<ContentItem>> groups = new ArrayList<>();
        List<ContentItem> current = new ArrayList<>();
        boolean currentSmall = true;

        for (ContentItem item : items) {
            boolean small = lines.length(item.startLine(), item.endLine()) < chunking.getMinChunkChars();
            if (!current.isEmpty()) {
                int merged = lines.length(current.get(0).startLine(), item.endLine());
                if (small && currentSmall && merged <= chunking.getMaxChunkChars()) {
                    current.add(item);
                    continue;
                }
                groups.add(current);
                current = new ArrayList<>();
            }
            current.add(item);
            currentSmall = small;
        }
        if (!current.isEmpty()) {
            groups.add(current);
        }
        return groups;
    }

    private static List<ChunkDraft> toDrafts(List<List<ContentItem>> groups, TextLines lines) {
        List<ChunkDraft> drafts = new ArrayList<>(groups.size());
        int previousEnd = 0;
        for (int i = 0; i < groups.size(); i++) {
            List<ContentItem> group = groups.get(i);
            int start = previousEnd + 1;
            int end = i == groups.size() - 1 ? lines.count() : group.get(group.size() - 1).endLine();
            drafts.add(new ChunkDraft(i, start, end, lines.slice(start, end), declarationType(group),
                    List.copyOf(group)));
            previousEnd = end;
        }
        return drafts;
    }

    private static String declarationType(List<ContentItem> group) {
        Set<EntityType> kinds = group.stream()
                .map(ContentItem::kind)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        if (kinds.isEmpty()) {
            return "block";
        }
        if (kinds.size() > 1) {
            return "mixed";
        }
        return kinds.iterator().next().name().toLowerCase(Locale.ROOT);
    }
}
