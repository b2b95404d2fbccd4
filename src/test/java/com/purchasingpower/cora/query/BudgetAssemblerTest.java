package com.purchasingpower.cora.query;

import com.purchasingpower.cora.configuration.AppProperties;
import com.purchasingpower.cora.model.index.Chunk;
import com.purchasingpower.cora.model.query.ContextSection;
import com.purchasingpower.cora.model.query.FileContext;
import com.purchasingpower.cora.model.query.QueryResponse;
import com.purchasingpower.cora.model.query.RenderMode;
import com.purchasingpower.cora.model.query.RepositoryContext;
import com.purchasingpower.cora.model.query.UsedChunk;
import com.purchasingpower.cora.model.retrieval.RankedChunk;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Budget Assembler Tests")
class BudgetAssemblerTest {

    private static final String LINE = "x".repeat(99) + "\n";

    private AppProperties appProperties;
    private BudgetAssembler assembler;

    @BeforeEach
    void setUp() {
        appProperties = new AppProperties();
        assembler = new BudgetAssembler(appProperties);
    }

    @Test
    @DisplayName("Full chunks while they fit, then elided entries, then the tail is cut")
    void testAssemble_FullThenElidedThenCut() {
        // Given: four 100-char chunks, budget 290
        List<RankedChunk> ranked = fourChunks();

        // When
        QueryResponse response = assembler.assemble(List.of(), ranked, 290, List.of("demo"));

        // Then
        assertThat(response.getUsedChunks()).extracting(UsedChunk::getRenderMode)
                .containsExactly(RenderMode.FULL, RenderMode.FULL, RenderMode.ELIDED);
        assertTrue(response.isTruncated());

        FileContext file = response.getRepositories().get(0).getFiles().get(0);
        assertEquals(2, file.getSections().size(), "Adjacent full chunks merge into one section");
        ContextSection full = file.getSections().get(0);
        assertEquals(1, full.getLineStart());
        assertEquals(2, full.getLineEnd());
        assertEquals(LINE + LINE, full.getContent());
        assertEquals(List.of("c0", "c1"), full.getChunkIds());

        ContextSection elided = file.getSections().get(1);
        assertEquals(RenderMode.ELIDED, elided.getRenderMode());
        assertEquals("...", elided.getContent());

        assertEquals(203, response.getRenderedChars());
    }

    @Test
    @DisplayName("Full content never exceeds the budget when nothing is boosted")
    void testAssemble_FullContentWithinBudget() {
        for (int budget : new int[]{0, 99, 100, 250, 399, 400, 1000}) {
            QueryResponse response = assembler.assemble(List.of(), fourChunks(), budget, List.of("demo"));

            int fullChars = response.getUsedChunks().stream()
                    .filter(used -> used.getRenderMode() == RenderMode.FULL)
                    .mapToInt(used -> LINE.length())
                    .sum();
            assertTrue(fullChars <= budget, "budget " + budget + " rendered " + fullChars);
        }
    }

    @Test
    @DisplayName("Without tail cut every remaining chunk is kept as an elided entry")
    void testAssemble_TailCutDisabled() {
        // Given
        appProperties.getBudget().setTailCutEnabled(false);

        // When
        QueryResponse response = assembler.assemble(List.of(), fourChunks(), 290, List.of("demo"));

        // Then
        assertFalse(response.isTruncated());
        assertThat(response.getUsedChunks()).extracting(UsedChunk::getRenderMode)
                .containsExactly(RenderMode.FULL, RenderMode.FULL, RenderMode.ELIDED, RenderMode.ELIDED);
        List<ContextSection> sections = response.getRepositories().get(0).getFiles().get(0).getSections();
        assertEquals(2, sections.size());
        assertEquals(3, sections.get(1).getLineStart());
        assertEquals(4, sections.get(1).getLineEnd());
    }

    @Test
    @DisplayName("A boosted unit is rendered in full even when it alone exceeds the budget")
    void testAssemble_BoostedOvershoot() {
        // Given
        Chunk readme = chunk("demo", "README.md", "readme", 1, "r".repeat(499) + "\n");
        BoostedUnit unit = new BoostedUnit("README.md", List.of(ContextSlice.full(readme)));

        // When
        QueryResponse response = assembler.assemble(List.of(unit), fourChunks(), 100, List.of("demo"));

        // Then
        UsedChunk boosted = response.getUsedChunks().get(0);
        assertEquals("readme", boosted.getChunkId());
        assertTrue(boosted.isBoosted());
        assertEquals(RenderMode.FULL, boosted.getRenderMode());
        assertEquals(1, response.getUsedChunks().size(), "Nothing else fits after the overshoot");
        assertTrue(response.isTruncated());
        assertEquals(500, response.getRenderedChars());
    }

    @Test
    @DisplayName("A boosted file walks its chunks: full while they fit, then elided, then cut")
    void testAssemble_BoostedFileChunksFollowBudget() {
        // Given: one boosted file of three 100-char chunks, budget 190, elided entries cost 80
        Chunk first = chunk("demo", "src/big.ts", "big0", 1, LINE);
        Chunk second = chunk("demo", "src/big.ts", "big1", 2, LINE);
        Chunk third = chunk("demo", "src/big.ts", "big2", 3, LINE);
        BoostedUnit unit = new BoostedUnit("src/big.ts",
                List.of(ContextSlice.full(first), ContextSlice.full(second), ContextSlice.full(third)));

        // When
        QueryResponse response = assembler.assemble(List.of(unit), List.of(), 190, List.of("demo"));

        // Then
        assertThat(response.getUsedChunks()).extracting(UsedChunk::getRenderMode)
                .containsExactly(RenderMode.FULL, RenderMode.ELIDED);
        assertThat(response.getUsedChunks()).allMatch(UsedChunk::isBoosted);
        assertTrue(response.isTruncated());
        assertEquals(103, response.getRenderedChars());
    }

    @Test
    @DisplayName("A declaration boosted as one line is widened when the ranked walk reaches its chunk")
    void testAssemble_DeclarationLineWidenedByRankedChunk() {
        // Given
        Chunk service = Chunk.builder()
                .id("svc")
                .fileVersionId("demo:src/svc.ts")
                .repoId("demo")
                .filePath("src/svc.ts")
                .content("export class Service {\n  run() {}\n}\n")
                .lineStart(1)
                .lineEnd(3)
                .language("typescript")
                .declarationType("class")
                .build();
        BoostedUnit declaration = new BoostedUnit("src/svc.ts#Service", List.of(ContextSlice.line(service, 1)));

        // When
        QueryResponse response = assembler.assemble(List.of(declaration), List.of(ranked(service, 0.8)), 1000,
                List.of("demo"));

        // Then
        assertEquals(1, response.getUsedChunks().size());
        UsedChunk used = response.getUsedChunks().get(0);
        assertTrue(used.isBoosted());
        assertEquals(RenderMode.FULL, used.getRenderMode());
        assertEquals(1, used.getLineStart());
        assertEquals(3, used.getLineEnd());
        ContextSection section = response.getRepositories().get(0).getFiles().get(0).getSections().get(0);
        assertEquals(service.getContent(), section.getContent());
    }

    @Test
    @DisplayName("A declaration line stays a line when its whole chunk no longer fits")
    void testAssemble_DeclarationLineKeptWhenChunkTooLarge() {
        // Given
        Chunk service = Chunk.builder()
                .id("svc")
                .fileVersionId("demo:src/svc.ts")
                .repoId("demo")
                .filePath("src/svc.ts")
                .content("export class Service {\n" + LINE.repeat(5) + "}\n")
                .lineStart(1)
                .lineEnd(7)
                .language("typescript")
                .declarationType("class")
                .build();
        BoostedUnit declaration = new BoostedUnit("src/svc.ts#Service", List.of(ContextSlice.line(service, 1)));

        // When
        QueryResponse response = assembler.assemble(List.of(declaration), List.of(ranked(service, 0.8)), 100,
                List.of("demo"));

        // Then
        assertEquals(1, response.getUsedChunks().size());
        assertEquals(1, response.getUsedChunks().get(0).getLineEnd());
        assertEquals("export class Service {", response.getRepositories().get(0).getFiles().get(0)
                .getSections().get(0).getContent());
    }

    @Test
    @DisplayName("Repositories follow the request order, unlisted ones come after in name order")
    void testAssemble_RepositoryOrder() {
        // Given
        List<RankedChunk> ranked = List.of(
                ranked(chunk("z-repo", "a.ts", "z", 1, "z\n"), 0.9),
                ranked(chunk("alpha", "a.ts", "a", 1, "a\n"), 0.8),
                ranked(chunk("beta", "a.ts", "b", 1, "b\n"), 0.7),
                ranked(chunk("y-repo", "a.ts", "y", 1, "y\n"), 0.6));

        // When
        QueryResponse response = assembler.assemble(List.of(), ranked, 1000, List.of("beta", "alpha"));

        // Then
        assertThat(response.getRepositories()).extracting(RepositoryContext::getRepoId)
                .containsExactly("beta", "alpha", "y-repo", "z-repo");
        assertThat(response.getUsedChunks()).extracting(UsedChunk::getChunkId)
                .containsExactly("z", "a", "b", "y");
    }

    @Test
    @DisplayName("Files are ordered by path and non-adjacent chunks stay separate sections")
    void testAssemble_FileAndSectionOrder() {
        // Given
        List<RankedChunk> ranked = List.of(
                ranked(chunk("demo", "src/b.ts", "b5", 5, "five\n"), 0.9),
                ranked(chunk("demo", "src/b.ts", "b1", 1, "one\n"), 0.8),
                ranked(chunk("demo", "src/a.ts", "a1", 1, "alpha\n"), 0.7));

        // When
        QueryResponse response = assembler.assemble(List.of(), ranked, 1000, List.of("demo"));

        // Then
        List<FileContext> files = response.getRepositories().get(0).getFiles();
        assertThat(files).extracting(FileContext::getFilePath).containsExactly("src/a.ts", "src/b.ts");
        assertThat(files.get(1).getSections()).extracting(ContextSection::getLineStart).containsExactly(1, 5);
        assertFalse(response.isTruncated());
    }

    @Test
    @DisplayName("A chunk selected twice is placed once")
    void testAssemble_NoDuplicates() {
        Chunk shared = chunk("demo", "src/a.ts", "shared", 1, "shared\n");
        BoostedUnit unit = new BoostedUnit("src/a.ts", List.of(ContextSlice.full(shared)));

        QueryResponse response = assembler.assemble(List.of(unit), List.of(ranked(shared, 0.9)), 1000, List.of("demo"));

        assertEquals(1, response.getUsedChunks().size());
        assertTrue(response.getUsedChunks().get(0).isBoosted());
    }

    @Test
    @DisplayName("A reached deadline stops the walk and marks the response truncated")
    void testAssemble_Deadline() {
        QueryResponse response = assembler.assemble(List.of(), fourChunks(), 1000, List.of("demo"), () -> true);

        assertTrue(response.isTruncated());
        assertTrue(response.getUsedChunks().isEmpty());
        assertTrue(response.getRepositories().isEmpty());
    }

    private static List<RankedChunk> fourChunks() {
        return List.of(
                ranked(chunk("demo", "src/a.ts", "c0", 1, LINE), 0.9),
                ranked(chunk("demo", "src/a.ts", "c1", 2, LINE), 0.8),
                ranked(chunk("demo", "src/a.ts", "c2", 3, LINE), 0.7),
                ranked(chunk("demo", "src/a.ts", "c3", 4, LINE), 0.6));
    }

    private static RankedChunk ranked(Chunk chunk, double score) {
        return RankedChunk.builder().chunk(chunk).retrievalScore(score).combinedScore(score).candidate(true).build();
    }

    private static Chunk chunk(String repoId, String filePath, String id, int line, String content) {
        return Chunk.builder()
                .id(id)
                .fileVersionId(repoId + ":" + filePath)
                .repoId(repoId)
                .filePath(filePath)
                .content(content)
                .lineStart(line)
                .lineEnd(line)
                .language("typescript")
                .declarationType("block")
                .build();
    }
}
