package com.purchasingpower.cora.parser;

import com.purchasingpower.cora.model.index.EntityType;
import com.purchasingpower.cora.model.index.ReferenceType;
import com.purchasingpower.cora.model.parse.IdentifierUsage;
import com.purchasingpower.cora.model.parse.Language;
import com.purchasingpower.cora.model.parse.SyntaxNode;
import com.purchasingpower.cora.model.parse.SyntaxTree;
import com.purchasingpower.cora.util.TextLines;
import org.springframework.stereotype.Component;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterTypescript;

import java.lang.ref.Reference;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * TypeScript and JavaScript grammar backed by Tree-sitter.
 *
 * Top-level declarations (also when wrapped in {@code export}) become declaration nodes, class
 * methods become their children. Imports and re-exports keep their module path so the resolver
 * can follow them.
 */
@Component
public class TreeSitterGrammarParser implements GrammarParser {

    private static final Map<String, EntityType> DECLARATIONS = Map.of(
            "function_declaration", EntityType.FUNCTION,
            "generator_function_declaration", EntityType.FUNCTION,
            "class_declaration", EntityType.CLASS,
            "abstract_class_declaration", EntityType.CLASS,
            "interface_declaration", EntityType.INTERFACE,
            "type_alias_declaration", EntityType.TYPE,
            "enum_declaration", EntityType.ENUM,
            "method_definition", EntityType.METHOD,
            "abstract_method_signature", EntityType.METHOD);

    private static final Set<String> VARIABLE_DECLARATIONS = Set.of("lexical_declaration", "variable_declaration");

    private static final Set<String> TOKEN_TYPES = Set.of(";", ",", "{", "}");

    private static final Set<String> FUNCTION_VALUES = Set.of(
            "arrow_function", "function_expression", "function", "generator_function");

    // Tree-sitter grammars are immutable and shareable, parsers are not
    private final TSLanguage typescript = new TreeSitterTypescript();

    @Override
    public Set<Language> supportedLanguages() {
        return Set.of(Language.TYPESCRIPT, Language.JAVASCRIPT);
    }

    @Override
    public SyntaxTree parse(String text, Language language) throws ParseFailedException {
        TSParser parser = new TSParser();
        if (!parser.setLanguage(typescript)) {
            throw new ParseFailedException(language.getId(), "Tree-sitter grammar could not be loaded");
        }
        TSTree tree = parser.parseString(null, text);
        try {
            TSNode root = tree.getRootNode();
            if (root.isNull() || root.hasError()) {
                throw new ParseFailedException(language.getId(), "syntax errors in source");
            }

            Source source = new Source(text.getBytes(StandardCharsets.UTF_8));
            int lineCount = TextLines.of(text).count();
            SyntaxNode.SyntaxNodeBuilder file = SyntaxNode.builder()
                    .type(root.getType())
                    .startLine(1)
                    .endLine(Math.max(1, lineCount));
            for (TSNode statement : children(root)) {
                if (!TOKEN_TYPES.contains(statement.getType())) {
                    file.child(topLevelNode(statement, source));
                }
            }
            return new SyntaxTree(language, file.build(), lineCount);
        } finally {
            // nodes point into the native tree, which is freed once the tree is collected
            Reference.reachabilityFence(tree);
        }
    }

    private SyntaxNode topLevelNode(TSNode node, Source source) {
        String type = node.getType();
        if ("export_statement".equals(type)) {
            TSNode declaration = node.getChildByFieldName("declaration");
            if (!declaration.isNull()) {
                // the export keyword belongs to the declaration's span
                return declarationNode(declaration, source, startLine(node), endLine(node));
            }
            return exportNode(node, source);
        }
        if ("import_statement".equals(type)) {
            return importNode(node, source);
        }
        return declarationNode(node, source, startLine(node), endLine(node));
    }

    private SyntaxNode declarationNode(TSNode node, Source source, int start, int end) {
        String type = node.getType();
        SyntaxNode.SyntaxNodeBuilder builder = SyntaxNode.builder()
                .type(type)
                .startLine(start)
                .endLine(end);

        EntityType entityType = DECLARATIONS.get(type);
        if (entityType != null) {
            builder.name(source.text(node.getChildByFieldName("name"))).declaration(entityType);
        } else if (VARIABLE_DECLARATIONS.contains(type)) {
            TSNode declarator = firstChildOfType(node, "variable_declarator");
            if (declarator != null) {
                TSNode value = declarator.getChildByFieldName("value");
                boolean function = !value.isNull() && FUNCTION_VALUES.contains(value.getType());
                builder.name(source.text(declarator.getChildByFieldName("name")))
                        .declaration(function ? EntityType.FUNCTION : EntityType.VARIABLE);
            }
        }

        if (entityType == EntityType.CLASS) {
            TSNode body = node.getChildByFieldName("body");
            if (!body.isNull()) {
                for (TSNode member : children(body)) {
                    if (DECLARATIONS.get(member.getType()) == EntityType.METHOD) {
                        builder.child(declarationNode(member, source, startLine(member), endLine(member)));
                    }
                }
            }
        }

        Set<IdentifierUsage> usages = new LinkedHashSet<>();
        collectUsages(node, source, usages, entityType == EntityType.CLASS);
        usages.forEach(builder::usage);
        return builder.build();
    }

    private SyntaxNode importNode(TSNode node, Source source) {
        SyntaxNode.SyntaxNodeBuilder builder = SyntaxNode.builder()
                .type(node.getType())
                .startLine(startLine(node))
                .endLine(endLine(node));
        String modulePath = unquote(source.text(node.getChildByFieldName("source")));
        TSNode clause = firstChildOfType(node, "import_clause");
        if (clause == null) {
            return builder.build();
        }
        for (TSNode part : children(clause)) {
            switch (part.getType()) {
                case "identifier" -> builder.usage(new IdentifierUsage("default", ReferenceType.IMPORT,
                        startLine(part), modulePath, source.text(part)));
                case "named_imports" -> {
                    for (TSNode specifier : children(part)) {
                        if (!"import_specifier".equals(specifier.getType())) {
                            continue;
                        }
                        TSNode alias = specifier.getChildByFieldName("alias");
                        builder.usage(new IdentifierUsage(source.text(specifier.getChildByFieldName("name")),
                                ReferenceType.IMPORT, startLine(specifier), modulePath,
                                alias.isNull() ? null : source.text(alias)));
                    }
                }
                default -> {
                    // namespace imports bind no individual identifier
                }
            }
        }
        return builder.build();
    }

    private SyntaxNode exportNode(TSNode node, Source source) {
        SyntaxNode.SyntaxNodeBuilder builder = SyntaxNode.builder()
                .type(node.getType())
                .startLine(startLine(node))
                .endLine(endLine(node));
        TSNode sourceNode = node.getChildByFieldName("source");
        String modulePath = sourceNode.isNull() ? null : unquote(source.text(sourceNode));
        TSNode clause = firstChildOfType(node, "export_clause");

        if (clause == null) {
            if (modulePath != null) {
                builder.usage(new IdentifierUsage("*", ReferenceType.REEXPORT, startLine(node), modulePath, null));
            }
            return builder.build();
        }
        for (TSNode specifier : children(clause)) {
            if (!"export_specifier".equals(specifier.getType())) {
                continue;
            }
            String name = source.text(specifier.getChildByFieldName("name"));
            TSNode alias = specifier.getChildByFieldName("alias");
            ReferenceType type = modulePath != null ? ReferenceType.REEXPORT : ReferenceType.MENTION;
            builder.usage(new IdentifierUsage(name, type, startLine(specifier), modulePath,
                    alias.isNull() ? null : source.text(alias)));
        }
        return builder.build();
    }

    /**
     * Collects calls, constructor invocations and type/heritage mentions below {@code node}.
     * For classes the walk stops at method definitions, which collect their own usages.
     */
    private void collectUsages(TSNode node, Source source, Set<IdentifierUsage> usages, boolean skipMethods) {
        for (TSNode child : children(node)) {
            String type = child.getType();
            if (skipMethods && DECLARATIONS.get(type) == EntityType.METHOD) {
                continue;
            }
            switch (type) {
                case "call_expression" -> {
                    String callee = calleeName(child.getChildByFieldName("function"), source);
                    if (callee != null) {
                        usages.add(IdentifierUsage.of(callee, ReferenceType.CALL, startLine(child)));
                    }
                }
                case "new_expression" -> {
                    String callee = calleeName(child.getChildByFieldName("constructor"), source);
                    if (callee != null) {
                        usages.add(IdentifierUsage.of(callee, ReferenceType.CALL, startLine(child)));
                    }
                }
                case "type_identifier" -> usages.add(
                        IdentifierUsage.of(source.text(child), ReferenceType.MENTION, startLine(child)));
                case "extends_clause" -> {
                    TSNode value = child.getChildByFieldName("value");
                    if (!value.isNull() && "identifier".equals(value.getType())) {
                        usages.add(IdentifierUsage.of(source.text(value), ReferenceType.MENTION, startLine(value)));
                    }
                }
                default -> {
                    // other nodes only matter through their children
                }
            }
            collectUsages(child, source, usages, skipMethods);
        }
    }

    private String calleeName(TSNode callee, Source source) {
        if (callee.isNull()) {
            return null;
        }
        return switch (callee.getType()) {
            case "identifier" -> source.text(callee);
            case "member_expression" -> {
                TSNode property = callee.getChildByFieldName("property");
                yield property.isNull() ? null : source.text(property);
            }
            default -> null;
        };
    }

    private static TSNode firstChildOfType(TSNode node, String type) {
        for (TSNode child : children(node)) {
            if (type.equals(child.getType())) {
                return child;
            }
        }
        return null;
    }

    /**
     * All children, anonymous tokens included. Callers dispatch on the node type; indexed access
     * to named children is not reliable in the bundled binding.
     */
    private static List<TSNode> children(TSNode node) {
        int count = node.getChildCount();
        List<TSNode> children = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            TSNode child = node.getChild(i);
            if (child != null && !child.isNull()) {
                children.add(child);
            }
        }
        return children;
    }

    private static int startLine(TSNode node) {
        return node.getStartPoint().getRow() + 1;
    }

    private static int endLine(TSNode node) {
        return node.getEndPoint().getRow() + 1;
    }

    private static String unquote(String literal) {
        if (literal == null || literal.length() < 2) {
            return literal;
        }
        char first = literal.charAt(0);
        if ((first == '\'' || first == '"' || first == '`') && literal.charAt(literal.length() - 1) == first) {
            return literal.substring(1, literal.length() - 1);
        }
        return literal;
    }

    /** Source bytes, Tree-sitter offsets are UTF-8 byte offsets. */
    private record Source(byte[] bytes) {

        String text(TSNode node) {
            if (node == null || node.isNull()) {
                return null;
            }
            int start = node.getStartByte();
            int end = node.getEndByte();
            return new String(bytes, start, end - start, StandardCharsets.UTF_8);
        }
    }
}
