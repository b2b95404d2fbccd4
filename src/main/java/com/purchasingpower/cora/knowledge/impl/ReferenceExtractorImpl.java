package com.purchasingpower.cora.knowledge.impl;

import com.purchasingpower.cora.chunking.ChunkDraft;
import com.purchasingpower.cora.chunking.ChunkedFile;
import com.purchasingpower.cora.chunking.HeadingContentItemSplitter;
import com.purchasingpower.cora.knowledge.ExtractedEntities;
import com.purchasingpower.cora.knowledge.ReferenceExtractor;
import com.purchasingpower.cora.model.index.Chunk;
import com.purchasingpower.cora.model.index.ContentEntityDefinition;
import com.purchasingpower.cora.model.index.ContentEntityReference;
import com.purchasingpower.cora.model.index.EntityType;
import com.purchasingpower.cora.model.index.FileVersion;
import com.purchasingpower.cora.model.index.ReferenceType;
import com.purchasingpower.cora.model.parse.ContentItem;
import com.purchasingpower.cora.model.parse.FormatFamily;
import com.purchasingpower.cora.model.parse.IdentifierUsage;
import com.purchasingpower.cora.util.TextLines;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
@Service
public class ReferenceExtractorImpl implements ReferenceExtractor {

    private static final Pattern MARKDOWN_LINK = Pattern.compile("\\[[^\\]]*]\\(\\s*([^)\\s]+)(?:\\s+\"[^\"]*\")?\\s*\\)");
    private static final Pattern URL_SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*:");

    private static final Pattern DECLARATION = Pattern.compile(
            "\\b(function|class|interface|enum|def|fn|func|type|struct|trait|object)\\s+([A-Za-z_$][\\w$]*)");
    private static final Pattern CALL = Pattern.compile("(?<![\\w$.])([A-Za-z_$][\\w$]*)\\s*\\(");
    private static final Pattern MEMBER_CALL = Pattern.compile("\\.([A-Za-z_$][\\w$]*)\\s*\\(");
    private static final Pattern PYTHON_IMPORT = Pattern.compile("^\\s*from\\s+([\\w.]+)\\s+import\\s+([\\w\\s,]+)");
    private static final Pattern ES_IMPORT = Pattern.compile("import\\s+\\{([^}]*)}\\s+from\\s+['\"]([^'\"]+)['\"]");

    private static final Set<String> KEYWORDS = Set.of(
            "if", "for", "while", "switch", "catch", "return", "function", "def", "fn", "func", "new",
            "typeof", "sizeof", "class", "elif", "else", "match", "when", "with", "assert", "super",
            "this", "await", "yield", "throw", "in", "not", "and", "or", "print", "lambda");

    private static final Map<String, EntityType> DECLARATION_KEYWORDS = Map.ofEntries(
            Map.entry("function", EntityType.FUNCTION),
            Map.entry("def", EntityType.FUNCTION),
            Map.entry("fn", EntityType.FUNCTION),
            Map.entry("func", EntityType.FUNCTION),
            Map.entry("class", EntityType.CLASS),
            Map.entry("struct", EntityType.CLASS),
            Map.entry("trait", EntityType.INTERFACE),
            Map.entry("object", EntityType.CLASS),
            Map.entry("interface", EntityType.INTERFACE),
            Map.entry("enum", EntityType.ENUM),
            Map.entry("type", EntityType.TYPE));

    @Override
    public ExtractedEntities extract(FileVersion fileVersion, ChunkedFile chunkedFile) {
        if (chunkedFile.isEmpty()) {
            return new ExtractedEntities(List.of(), List.of());
        }
        Extraction extraction = new Extraction(fileVersion, chunkedFile);
        extraction.define(moduleName(fileVersion.getFilePath()), EntityType.MODULE, 1, chunkedFile.lines().count());

        if (chunkedFile.isGrammarBased()) {
            extractFromTree(extraction, chunkedFile);
        } else if (chunkedFile.language().getFamily() == FormatFamily.MARKDOWN) {
            extractFromMarkdown(extraction, chunkedFile);
        } else if (chunkedFile.language().getFamily() == FormatFamily.KEY_VALUE) {
            extractFromKeys(extraction, chunkedFile);
        } else if (chunkedFile.language().getFamily() == FormatFamily.CODE) {
            extractFromCodeLines(extraction, chunkedFile);
        }

        ExtractedEntities entities = extraction.result();
        log.debug("Extracted {} definitions and {} references from {}", entities.definitions().size(),
                entities.references().size(), fileVersion.getFilePath());
        return entities;
    }

    private void extractFromTree(Extraction extraction, ChunkedFile chunkedFile) {
        // local name -> import it binds, so calls through an import carry the module hint
        Map<String, IdentifierUsage> imports = new HashMap<>();
        chunkedFile.tree().root().walk(node -> node.getUsages().stream()
                .filter(usage -> usage.type() == ReferenceType.IMPORT)
                .forEach(usage -> imports.put(usage.alias() != null ? usage.alias() : usage.name(), usage)));

        chunkedFile.tree().root().walk(node -> {
            if (node != chunkedFile.tree().root() && node.isDeclaration()) {
                extraction.define(node.getName(), node.getDeclaration(), node.getStartLine(), node.getEndLine());
            }
            for (IdentifierUsage usage : node.getUsages()) {
                extraction.reference(bindToImport(usage, imports));
            }
        });
    }

    private static IdentifierUsage bindToImport(IdentifierUsage usage, Map<String, IdentifierUsage> imports) {
        if (usage.type() != ReferenceType.CALL && usage.type() != ReferenceType.MENTION) {
            return usage;
        }
        IdentifierUsage imported = imports.get(usage.name());
        if (imported == null) {
            return usage;
        }
        String alias = imported.name().equals(usage.name()) ? null : usage.name();
        return new IdentifierUsage(imported.name(), usage.type(), usage.line(), imported.importPath(), alias);
    }

    private void extractFromMarkdown(Extraction extraction, ChunkedFile chunkedFile) {
        for (ChunkDraft chunk : chunkedFile.chunks()) {
            for (ContentItem item : chunk.items()) {
                if (item.kind() == EntityType.SECTION && item.name() != null) {
                    extraction.define(HeadingContentItemSplitter.slug(item.name()), EntityType.SECTION,
                            item.startLine(), item.endLine());
                }
            }
        }

        TextLines lines = chunkedFile.lines();
        for (int n = 1; n <= lines.count(); n++) {
            Matcher link = MARKDOWN_LINK.matcher(lines.line(n));
            while (link.find()) {
                String target = link.group(1);
                if (URL_SCHEME.matcher(target).find()) {
                    continue;
                }
                int hash = target.indexOf('#');
                String path = hash >= 0 ? target.substring(0, hash) : target;
                String anchor = hash >= 0 ? target.substring(hash + 1) : null;
                String identifier = anchor != null && !anchor.isEmpty() ? anchor : moduleName(path);
                if (identifier.isEmpty()) {
                    continue;
                }
                extraction.reference(new IdentifierUsage(identifier, ReferenceType.LINK, n,
                        path.isEmpty() ? null : path, null));
            }
        }
    }

    private void extractFromKeys(Extraction extraction, ChunkedFile chunkedFile) {
        for (ChunkDraft chunk : chunkedFile.chunks()) {
            for (ContentItem item : chunk.items()) {
                if (item.kind() == EntityType.KEY && item.name() != null) {
                    extraction.define(item.name(), EntityType.KEY, item.startLine(), item.endLine());
                }
            }
        }
    }

    /**
     * Line patterns for code no grammar could parse: declaration keywords define, call sites
     * and simple import statements reference.
     */
    private void extractFromCodeLines(Extraction extraction, ChunkedFile chunkedFile) {
        TextLines lines = chunkedFile.lines();
        for (int n = 1; n <= lines.count(); n++) {
            String line = lines.line(n);
            String declared = null;

            Matcher declaration = DECLARATION.matcher(line);
            if (declaration.find()) {
                declared = declaration.group(2);
                int end = chunkedFile.chunkAt(n).map(ChunkDraft::lineEnd).orElse(n);
                extraction.define(declared, DECLARATION_KEYWORDS.get(declaration.group(1)), n, end);
            }

            Matcher pythonImport = PYTHON_IMPORT.matcher(line);
            if (pythonImport.find()) {
                String module = pythonImport.group(1).replace('.', '/');
                for (String name : pythonImport.group(2).split(",")) {
                    String trimmed = name.trim().split("\\s+")[0];
                    if (!trimmed.isEmpty()) {
                        extraction.reference(new IdentifierUsage(trimmed, ReferenceType.IMPORT, n, module, null));
                    }
                }
                continue;
            }
            Matcher esImport = ES_IMPORT.matcher(line);
            if (esImport.find()) {
                for (String specifier : esImport.group(1).split(",")) {
                    String[] parts = specifier.trim().split("\\s+as\\s+");
                    if (!parts[0].isEmpty()) {
                        extraction.reference(new IdentifierUsage(parts[0], ReferenceType.IMPORT, n,
                                esImport.group(2), parts.length > 1 ? parts[1] : null));
                    }
                }
                continue;
            }

            for (Pattern pattern : List.of(CALL, MEMBER_CALL)) {
                Matcher call = pattern.matcher(line);
                while (call.find()) {
                    String name = call.group(1);
                    if (!KEYWORDS.contains(name) && !name.equals(declared)) {
                        extraction.reference(IdentifierUsage.of(name, ReferenceType.CALL, n));
                    }
                }
            }
        }
    }

    /** File name without directory and last extension. */
    static String moduleName(String path) {
        String name = path.substring(path.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    /** Collects records for one file version, assigning each to the chunk containing its line. */
    private static final class Extraction {

        private final FileVersion fileVersion;
        private final ChunkedFile chunkedFile;
        private final Map<String, ContentEntityDefinition> definitions = new LinkedHashMap<>();
        private final Map<String, ContentEntityReference> references = new LinkedHashMap<>();

        private Extraction(FileVersion fileVersion, ChunkedFile chunkedFile) {
            this.fileVersion = fileVersion;
            this.chunkedFile = chunkedFile;
        }

        void define(String identifier, EntityType entityType, int lineStart, int lineEnd) {
            if (identifier == null || identifier.isEmpty()) {
                return;
            }
            ContentEntityDefinition definition = ContentEntityDefinition.builder()
                    .identifier(identifier)
                    .entityType(entityType)
                    .repoId(fileVersion.getRepoId())
                    .filePath(fileVersion.getFilePath())
                    .fileVersionId(fileVersion.getId())
                    .lineStart(lineStart)
                    .lineEnd(lineEnd)
                    .chunkId(chunkIdAt(lineStart))
                    .build();
            definitions.putIfAbsent(definition.getId(), definition);
        }

        void reference(IdentifierUsage usage) {
            if (usage.name() == null || usage.name().isEmpty()) {
                return;
            }
            String chunkId = chunkIdAt(usage.line());
            String key = usage.name() + '|' + usage.type() + '|' + usage.line() + '|' + usage.importPath();
            references.putIfAbsent(key, ContentEntityReference.builder()
                    .identifierUsed(usage.name())
                    .referenceType(usage.type())
                    .importPath(usage.importPath())
                    .alias(usage.alias())
                    .repoId(fileVersion.getRepoId())
                    .filePath(fileVersion.getFilePath())
                    .fileVersionId(fileVersion.getId())
                    .line(usage.line())
                    .chunkId(chunkId)
                    .build());
        }

        private String chunkIdAt(int line) {
            return chunkedFile.chunkAt(line)
                    .map(chunk -> Chunk.idOf(fileVersion.getId(), chunk.ordinal()))
                    .orElse(null);
        }

        ExtractedEntities result() {
            return new ExtractedEntities(new ArrayList<>(definitions.values()), new ArrayList<>(references.values()));
        }
    }
}
