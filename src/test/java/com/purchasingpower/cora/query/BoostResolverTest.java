package com.purchasingpower.cora.query;

import com.purchasingpower.cora.knowledge.impl.InMemoryIndexStore;
import com.purchasingpower.cora.model.index.Chunk;
import com.purchasingpower.cora.model.query.BoostDirectives;
import com.purchasingpower.cora.model.query.DeclarationBoost;
import com.purchasingpower.cora.model.retrieval.QueryScope;
import com.purchasingpower.cora.support.BagOfWordsEmbeddingService;
import com.purchasingpower.cora.support.IndexFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Boost Resolver Tests")
class BoostResolverTest {

    private static final String CACHE = """
            import os

            def evict(key):
                return key

            def load(key):
                return key
            """;

    @TempDir
    Path checkout;

    private IndexFixture fixture;
    private BoostResolver boostResolver;

    @BeforeEach
    void setUp() {
        fixture = new IndexFixture(checkout, new InMemoryIndexStore(), new BagOfWordsEmbeddingService());
        fixture.register("demo");
        boostResolver = new BoostResolver(fixture.store, fixture.referenceResolver);
        fixture.writeAndIndex("demo", "README.md", "# Demo\nIntro.\n## Usage\nRun it.\n");
        fixture.writeAndIndex("demo", "src/cache.py", CACHE);
    }

    @Test
    @DisplayName("A file directive yields every chunk of the file's latest version")
    void testResolve_FileDirective() {
        // When
        List<BoostedUnit> units = boostResolver.resolve(
                BoostDirectives.builder().file("README.md").build(), List.of("demo"), QueryScope.latest());

        // Then
        assertEquals(1, units.size());
        assertEquals("demo:README.md", units.get(0).directive());
        assertThat(units.get(0).slices()).extracting(ContextSlice::chunkId)
                .containsExactlyElementsOf(fixture.latestChunks("demo", "README.md").stream()
                        .map(Chunk::getId).collect(Collectors.toList()));
    }

    @Test
    @DisplayName("Paths are normalized and unknown files are skipped")
    void testResolve_NormalizedAndUnknownFiles() {
        List<BoostedUnit> units = boostResolver.resolve(
                BoostDirectives.builder().file("./src/../README.md").file("missing.md").build(),
                List.of("demo"), QueryScope.latest());

        assertEquals(1, units.size());
        assertEquals("demo:README.md", units.get(0).directive());
    }

    @Test
    @DisplayName("A file held by two requested repositories is boosted from both")
    void testResolve_FileInTwoRepositories() {
        fixture.register("mirror");
        fixture.index("mirror", "README.md");

        List<BoostedUnit> units = boostResolver.resolve(
                BoostDirectives.builder().file("README.md").build(), List.of("mirror", "demo"), QueryScope.latest());

        assertThat(units).extracting(BoostedUnit::directive).containsExactly("mirror:README.md", "demo:README.md");
    }

    @Test
    @DisplayName("A declaration without implementation contributes only its first line")
    void testResolve_DeclarationSignatureOnly() {
        // Given
        DeclarationBoost declaration = DeclarationBoost.builder()
                .repoId("demo")
                .path("src/cache.py#evict")
                .includeImplementation(false)
                .build();

        // When
        List<BoostedUnit> units = boostResolver.resolve(
                BoostDirectives.builder().declaration(declaration).build(), List.of("demo"), QueryScope.latest());

        // Then
        assertEquals(1, units.size());
        ContextSlice slice = units.get(0).slices().get(0);
        assertEquals(3, slice.lineStart());
        assertEquals(3, slice.lineEnd());
        assertEquals("def evict(key):", slice.content());
    }

    @Test
    @DisplayName("A declaration with implementation contributes its whole chunk")
    void testResolve_DeclarationWithImplementation() {
        DeclarationBoost declaration = DeclarationBoost.builder().repoId("demo").path("load").build();

        List<BoostedUnit> units = boostResolver.resolve(
                BoostDirectives.builder().declaration(declaration).build(), List.of("demo"), QueryScope.latest());

        assertEquals(1, units.size());
        assertEquals(CACHE, units.get(0).slices().get(0).content());
    }

    @Test
    @DisplayName("Declarations that do not resolve are skipped")
    void testResolve_UnknownDeclaration() {
        DeclarationBoost declaration = DeclarationBoost.builder().repoId("demo").path("src/cache.py#nothing").build();

        assertTrue(boostResolver.resolve(BoostDirectives.builder().declaration(declaration).build(),
                List.of("demo"), QueryScope.latest()).isEmpty());
        assertTrue(boostResolver.resolve(null, List.of("demo"), QueryScope.latest()).isEmpty());
    }

    @Test
    @DisplayName("A pinned scope boosts the file as it was at the pinned instant")
    void testResolve_PinnedFileVersion() {
        // Given
        Instant t1 = Instant.parse("2024-05-01T00:00:00Z");
        fixture.atCommit("c1", t1);
        fixture.writeAndIndex("demo", "NOTES.md", "# Notes\nold\n");
        fixture.atCommit("c2", t1.plusSeconds(3600));
        fixture.writeAndIndex("demo", "NOTES.md", "# Notes\nnew\n");
        QueryScope pinned = QueryScope.builder().repoId("demo").pin("demo", t1).build();

        // When
        List<BoostedUnit> units = boostResolver.resolve(
                BoostDirectives.builder().file("NOTES.md").build(), List.of("demo"), pinned);

        // Then
        assertEquals("# Notes\nold\n", units.get(0).slices().get(0).content());
    }
}
