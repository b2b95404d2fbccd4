package com.purchasingpower.cora.chunking;

import com.purchasingpower.cora.configuration.AppProperties;
import com.purchasingpower.cora.model.parse.Language;
import com.purchasingpower.cora.support.IndexFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Chunk Builder Tests")
class ChunkBuilderTest {

    private AppProperties appProperties;
    private ChunkBuilder chunkBuilder;

    @BeforeEach
    void setUp() {
        appProperties = new AppProperties();
        chunkBuilder = IndexFixture.chunkBuilder(appProperties);
    }

    @Test
    @DisplayName("a.ts: three small functions merge, the 500-line class stays whole")
    void testBuild_SmallFunctionsMerge_LargeClassAlone() {
        // Given: three functions under the merge threshold and one 500-line class
        StringBuilder source = new StringBuilder()
                .append("function alpha() {\n  return 1;\n}\n\n")
                .append("function beta() {\n  return 2;\n}\n\n")
                .append("function gamma() {\n  return 3;\n}\n\n")
                .append("export class Big {\n");
        for (int i = 0; i < 498; i++) {
            source.append("  m").append(i).append("() { return ").append(i).append("; }\n");
        }
        source.append("}\n");

        // When
        ChunkedFile chunked = chunkBuilder.build("src/a.ts", source.toString());

        // Then
        assertTrue(chunked.isGrammarBased());
        assertEquals(2, chunked.chunks().size(), "Expected merged trio + class");

        ChunkDraft trio = chunked.chunks().get(0);
        assertEquals(1, trio.lineStart());
        assertEquals(11, trio.lineEnd());
        assertEquals("function", trio.declarationType());
        assertEquals(List.of("alpha", "beta", "gamma"),
                trio.items().stream().map(item -> item.name()).collect(Collectors.toList()));

        ChunkDraft big = chunked.chunks().get(1);
        assertEquals(12, big.lineStart());
        assertEquals(512, big.lineEnd());
        assertEquals("class", big.declarationType());
        assertTrue(big.content().length() > appProperties.getChunking().getMaxChunkChars(),
                "Declarations are never split, even above the soft maximum");

        System.out.println("✅ a.ts chunked into " + chunked.chunks().size() + " chunks");
    }

    @Test
    @DisplayName("A Java class above the maximum stays one chunk with all of its methods")
    void testBuild_OversizedJavaClassStaysWhole() {
        // Given: a class of 200 methods, well above max-chunk-chars
        StringBuilder source = new StringBuilder("package demo;\n\npublic class Registry {\n");
        for (int i = 0; i < 200; i++) {
            source.append("    public int lookup").append(i).append("() {\n        return ").append(i).append(";\n    }\n");
        }
        source.append("}\n");

        // When
        ChunkedFile chunked = chunkBuilder.build("src/main/java/demo/Registry.java", source.toString());

        // Then
        assertTrue(chunked.isGrammarBased());
        assertEquals(1, chunked.chunks().size());
        ChunkDraft registry = chunked.chunks().get(0);
        assertEquals("class", registry.declarationType());
        assertEquals(source.toString(), registry.content());
        assertTrue(registry.content().length() > appProperties.getChunking().getMaxChunkChars());
    }

    @Test
    @DisplayName("Chunks cover every line exactly once and concatenate back to the file")
    void testBuild_ExactCoverage() {
        // Given: imports and a trailing comment outside any declaration
        String source = """
                package demo;

                import java.util.List;

                class First {
                    int a;
                }

                class Second {
                    int b;
                }
                // trailing
                """;
        appProperties.getChunking().setMinChunkChars(1);

        // When
        ChunkedFile chunked = chunkBuilder.build("src/Demo.java", source);

        // Then
        assertEquals(2, chunked.chunks().size());
        assertEquals(source, chunked.chunks().stream().map(ChunkDraft::content).collect(Collectors.joining()));

        int expectedStart = 1;
        for (ChunkDraft chunk : chunked.chunks()) {
            assertEquals(expectedStart, chunk.lineStart(), "No gaps and no overlaps");
            expectedStart = chunk.lineEnd() + 1;
        }
        assertEquals(chunked.lines().count(), expectedStart - 1);

        // Header lines belong to the first declaration, trailing lines to the last
        assertEquals(7, chunked.chunks().get(0).lineEnd());
        assertEquals(12, chunked.chunks().get(1).lineEnd());
    }

    @Test
    @DisplayName("Small neighbours stop merging once the group would exceed the maximum")
    void testBuild_MergeBoundedByMaximum() {
        // Given: each class is 29 chars; the merged group may hold at most 100
        appProperties.getChunking().setMinChunkChars(50);
        appProperties.getChunking().setMaxChunkChars(100);
        StringBuilder source = new StringBuilder();
        for (int i = 0; i < 6; i++) {
            source.append("class C").append(i).append(" {\n    int value").append(i).append(";\n}\n");
        }

        // When
        ChunkedFile chunked = chunkBuilder.build("src/Many.java", source.toString());

        // Then
        assertTrue(chunked.chunks().size() > 1);
        assertTrue(chunked.chunks().size() < 6, "Small classes should be merged");
        for (ChunkDraft chunk : chunked.chunks()) {
            assertTrue(chunk.content().length() <= 100, "Merged chunk too large: " + chunk.content().length());
        }
    }

    @Test
    @DisplayName("Should fall back to line windows when the grammar rejects the file")
    void testBuild_ParseFailure_FallsBackToWindows() {
        // Given
        StringBuilder source = new StringBuilder("public class Broken {\n");
        for (int i = 0; i < 100; i++) {
            source.append("    void m").append(i).append("( {\n");
        }

        // When
        ChunkedFile chunked = chunkBuilder.build("src/Broken.java", source.toString());

        // Then
        assertFalse(chunked.isGrammarBased());
        assertEquals(Language.JAVA, chunked.language());
        assertFalse(chunked.chunks().isEmpty());
        assertEquals(source.toString(), chunked.chunks().stream().map(ChunkDraft::content).collect(Collectors.joining()));
        assertEquals("block", chunked.chunks().get(0).declarationType());
    }

    @Test
    @DisplayName("Plain text is cut into fixed windows")
    void testBuild_PlainText_FixedWindows() {
        // Given: 130 lines, window of 60
        StringBuilder source = new StringBuilder();
        for (int i = 1; i <= 130; i++) {
            source.append("line ").append(i).append('\n');
        }

        // When
        ChunkedFile chunked = chunkBuilder.build("notes.txt", source.toString());

        // Then
        assertEquals(3, chunked.chunks().size());
        assertEquals(60, chunked.chunks().get(0).lineEnd());
        assertEquals(120, chunked.chunks().get(1).lineEnd());
        assertEquals(130, chunked.chunks().get(2).lineEnd());
    }

    @Test
    @DisplayName("Markdown is chunked at headings")
    void testBuild_Markdown_Sections() {
        // Given
        String readme = """
                Intro text before any heading.
                # Title
                Some words.
                ## Install
                Run the installer.
                ## Usage
                Call the API.
                """;
        appProperties.getChunking().setMinChunkChars(1);

        // When
        ChunkedFile chunked = chunkBuilder.build("README.md", readme);

        // Then
        assertEquals(3, chunked.chunks().size());
        assertEquals(1, chunked.chunks().get(0).lineStart(), "Preamble joins the first section");
        assertEquals("section", chunked.chunks().get(0).declarationType());
        assertEquals(4, chunked.chunks().get(1).lineStart());
    }

    @Test
    @DisplayName("Small Markdown sections merge into one chunk with default thresholds")
    void testBuild_Markdown_SmallSectionsMerge() {
        // When
        ChunkedFile chunked = chunkBuilder.build("README.md", "# A\none\n# B\ntwo\n# C\nthree\n");

        // Then
        assertEquals(1, chunked.chunks().size());
        assertEquals(3, chunked.chunks().get(0).items().size());
    }

    @Test
    @DisplayName("Empty content produces no chunks")
    void testBuild_Empty() {
        ChunkedFile chunked = chunkBuilder.build("empty.ts", "");

        assertTrue(chunked.isEmpty());
        assertEquals(0, chunked.lines().count());
    }

    @Test
    @DisplayName("Chunking the same content twice gives the same chunks")
    void testBuild_Deterministic() {
        String source = "class A {\n}\n\nclass B {\n    void b() {}\n}\n";

        ChunkedFile first = chunkBuilder.build("src/AB.java", source);
        ChunkedFile second = chunkBuilder.build("src/AB.java", source);

        assertEquals(first.chunks().size(), second.chunks().size());
        for (int i = 0; i < first.chunks().size(); i++) {
            assertEquals(first.chunks().get(i).lineStart(), second.chunks().get(i).lineStart());
            assertEquals(first.chunks().get(i).content(), second.chunks().get(i).content());
        }
    }
}
