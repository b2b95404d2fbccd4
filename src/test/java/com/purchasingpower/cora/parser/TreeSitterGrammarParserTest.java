package com.purchasingpower.cora.parser;

import com.purchasingpower.cora.model.index.EntityType;
import com.purchasingpower.cora.model.index.ReferenceType;
import com.purchasingpower.cora.model.parse.IdentifierUsage;
import com.purchasingpower.cora.model.parse.Language;
import com.purchasingpower.cora.model.parse.SyntaxNode;
import com.purchasingpower.cora.model.parse.SyntaxTree;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("Tree-sitter Grammar Parser Tests")
class TreeSitterGrammarParserTest {

    private static final String LOADER = """
            import { readFile as rf } from './io';
            import Default from './defaults';

            export function load(path: string): string {
              return rf(path);
            }

            export class Loader extends Base {
              run(): void {
                load('x');
              }
            }

            export { parse as parseConfig } from './parser';
            export * from './util';
            """;

    private TreeSitterGrammarParser parser;

    @BeforeEach
    void setUp() {
        parser = new TreeSitterGrammarParser();
    }

    @Test
    @DisplayName("Should report exported functions and classes with the export keyword in their span")
    void testParse_ExportedDeclarations() throws ParseFailedException {
        // When
        SyntaxTree tree = parser.parse(LOADER, Language.TYPESCRIPT);

        // Then
        List<SyntaxNode> declarations = tree.topLevel().stream().filter(SyntaxNode::isDeclaration)
                .collect(Collectors.toList());
        assertThat(declarations).extracting(SyntaxNode::getName).containsExactly("load", "Loader");

        SyntaxNode load = declarations.get(0);
        assertEquals(EntityType.FUNCTION, load.getDeclaration());
        assertEquals(4, load.getStartLine());
        assertEquals(6, load.getEndLine());

        SyntaxNode loader = declarations.get(1);
        assertEquals(EntityType.CLASS, loader.getDeclaration());
        assertEquals(8, loader.getStartLine());
        assertEquals(12, loader.getEndLine());
        assertThat(loader.getChildren()).extracting(SyntaxNode::getName).containsExactly("run");
    }

    @Test
    @DisplayName("Should keep module paths and aliases of imports")
    void testParse_Imports() throws ParseFailedException {
        // When
        List<IdentifierUsage> usages = allUsages(parser.parse(LOADER, Language.TYPESCRIPT));

        // Then
        assertThat(usages).contains(
                new IdentifierUsage("readFile", ReferenceType.IMPORT, 1, "./io", "rf"),
                new IdentifierUsage("default", ReferenceType.IMPORT, 2, "./defaults", "Default"));
    }

    @Test
    @DisplayName("Should record named and wildcard re-exports")
    void testParse_Reexports() throws ParseFailedException {
        // When
        List<IdentifierUsage> usages = allUsages(parser.parse(LOADER, Language.TYPESCRIPT));

        // Then
        assertThat(usages).contains(
                new IdentifierUsage("parse", ReferenceType.REEXPORT, 14, "./parser", "parseConfig"),
                new IdentifierUsage("*", ReferenceType.REEXPORT, 15, "./util", null));
    }

    @Test
    @DisplayName("Should record calls inside functions and methods, and heritage mentions")
    void testParse_CallsAndMentions() throws ParseFailedException {
        // When
        List<IdentifierUsage> usages = allUsages(parser.parse(LOADER, Language.TYPESCRIPT));

        // Then
        assertThat(usages).contains(
                IdentifierUsage.of("rf", ReferenceType.CALL, 5),
                IdentifierUsage.of("load", ReferenceType.CALL, 10),
                IdentifierUsage.of("Base", ReferenceType.MENTION, 8));
    }

    @Test
    @DisplayName("Should reject source with syntax errors")
    void testParse_SyntaxError_ShouldThrow() {
        assertThrows(ParseFailedException.class,
                () -> parser.parse("export function (((\n", Language.TYPESCRIPT));
    }

    private static List<IdentifierUsage> allUsages(SyntaxTree tree) {
        List<IdentifierUsage> usages = new ArrayList<>();
        tree.root().walk(node -> usages.addAll(node.getUsages()));
        return usages;
    }
}
