package com.purchasingpower.cora.query;

import com.purchasingpower.cora.configuration.AppProperties;
import com.purchasingpower.cora.exception.QueryFailedException;
import com.purchasingpower.cora.exception.StoreUnavailableException;
import com.purchasingpower.cora.knowledge.EmbeddingService;
import com.purchasingpower.cora.knowledge.IndexStore;
import com.purchasingpower.cora.knowledge.impl.InMemoryIndexStore;
import com.purchasingpower.cora.model.index.Chunk;
import com.purchasingpower.cora.model.query.BoostDirectives;
import com.purchasingpower.cora.model.query.QueryMessage;
import com.purchasingpower.cora.model.query.QueryRequest;
import com.purchasingpower.cora.model.query.QueryResponse;
import com.purchasingpower.cora.model.query.RenderMode;
import com.purchasingpower.cora.model.query.RepoSpec;
import com.purchasingpower.cora.model.query.UsedChunk;
import com.purchasingpower.cora.model.retrieval.QueryScope;
import com.purchasingpower.cora.model.retrieval.RetrievalCandidate;
import com.purchasingpower.cora.support.BagOfWordsEmbeddingService;
import com.purchasingpower.cora.support.IndexFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("Context Query Service Tests")
class ContextQueryServiceTest {

    @TempDir
    Path checkout;

    @Test
    @DisplayName("A boosted README is rendered in full next to the retrieved code")
    void testQuery_BoostedReadmeIncludedInFull() {
        // Given
        IndexFixture fixture = new IndexFixture(checkout, new InMemoryIndexStore(), new BagOfWordsEmbeddingService());
        fixture.register("demo");
        fixture.writeAndIndex("demo", "README.md", "# Demo\nA small service.\n## Layout\nSee src.\n");
        fixture.writeAndIndex("demo", "src/locks.py",
                "class LockManager:\n    # concurrency logic for shared state\n    def acquire(self):\n        return True\n");
        fixture.writeAndIndex("demo", "src/workers.py",
                "def start_workers(count):\n    # concurrency: one thread per worker\n    return count\n");

        QueryRequest request = QueryRequest.builder()
                .message(QueryMessage.user("concurrency logic"))
                .repo(RepoSpec.latest("demo"))
                .approxLength(8000)
                .boostDirectives(BoostDirectives.builder().file("README.md").build())
                .build();

        // When
        QueryResponse response = fixture.queryService().query(request);

        // Then
        assertThat(response.usedFiles()).contains("demo:README.md", "demo:src/locks.py");
        UsedChunk readme = response.getUsedChunks().get(0);
        assertEquals("README.md", readme.getFilePath());
        assertTrue(readme.isBoosted());
        assertEquals(RenderMode.FULL, readme.getRenderMode());
        assertFalse(response.isDegraded());
        assertFalse(response.isTruncated());

        System.out.println("✅ Used files: " + response.usedFiles());
    }

    @Test
    @DisplayName("A function called by a retrieved chunk is pulled in through the reference graph")
    void testQuery_CalleeReachedThroughGraph() {
        // Given: embeddings are down, so only lexical matches are candidates
        EmbeddingService failing = mock(EmbeddingService.class);
        when(failing.embed(anyString())).thenThrow(new IllegalStateException("embedding provider down"));
        when(failing.embedAll(anyList())).thenThrow(new IllegalStateException("embedding provider down"));
        IndexFixture fixture = new IndexFixture(checkout, new InMemoryIndexStore(), failing);
        fixture.register("demo");
        fixture.writeAndIndex("demo", "app/util.py", "def parse_payload():\n    return 42\n");
        fixture.writeAndIndex("demo", "app/main.py", "def handle_request():\n    return parse_payload()\n");

        QueryRequest request = QueryRequest.builder()
                .message(QueryMessage.user("handle request"))
                .repo(RepoSpec.latest("demo"))
                .approxLength(4000)
                .build();

        // When
        QueryResponse response = fixture.queryService().query(request);

        // Then
        assertThat(response.getUsedChunks()).extracting(UsedChunk::getFilePath)
                .containsExactly("app/main.py", "app/util.py");
        UsedChunk callee = response.getUsedChunks().get(1);
        assertEquals(0.4 * 0.85, callee.getCombinedScore(), 1e-3);
        assertEquals(RenderMode.FULL, callee.getRenderMode());
    }

    @Test
    @DisplayName("Expansion failure degrades to retrieval ranking")
    void testQuery_ExpansionFailureDegrades() {
        // Given
        HybridRetriever retriever = mock(HybridRetriever.class);
        LinkRankExpander expander = mock(LinkRankExpander.class);
        BoostResolver boostResolver = mock(BoostResolver.class);
        when(retriever.search(anyString(), any(), anyInt())).thenReturn(List.of(
                candidate("a", 0.4), candidate("b", 0.8)));
        when(expander.expand(anyList(), any())).thenThrow(new StoreUnavailableException("buildGraph", null));
        when(boostResolver.resolve(any(), anyList(), any())).thenReturn(List.of());

        ContextQueryService service = service(retriever, expander, boostResolver, mock(IndexStore.class));

        // When
        QueryResponse response = service.query(request("anything"));

        // Then
        assertTrue(response.isDegraded());
        assertThat(response.getUsedChunks()).extracting(UsedChunk::getChunkId).containsExactly("b", "a");
        assertEquals(1.0, response.getUsedChunks().get(0).getCombinedScore(), 1e-9);
        assertEquals(0.5, response.getUsedChunks().get(1).getCombinedScore(), 1e-9);
    }

    @Test
    @DisplayName("Boost failure degrades but keeps ranked chunks")
    void testQuery_BoostFailureDegrades() {
        HybridRetriever retriever = mock(HybridRetriever.class);
        LinkRankExpander expander = mock(LinkRankExpander.class);
        BoostResolver boostResolver = mock(BoostResolver.class);
        when(retriever.search(anyString(), any(), anyInt())).thenReturn(List.of(candidate("a", 0.4)));
        when(expander.expand(anyList(), any())).thenReturn(List.of());
        when(boostResolver.resolve(any(), anyList(), any())).thenThrow(new StoreUnavailableException("boost", null));

        QueryResponse response = service(retriever, expander, boostResolver, mock(IndexStore.class))
                .query(request("anything"));

        assertTrue(response.isDegraded());
    }

    @Test
    @DisplayName("Store failure during retrieval fails the query")
    void testQuery_RetrievalFailureFails() {
        HybridRetriever retriever = mock(HybridRetriever.class);
        when(retriever.search(anyString(), any(), anyInt()))
                .thenThrow(new StoreUnavailableException("hybridQuery", new RuntimeException("connection refused")));

        ContextQueryService service = service(retriever, mock(LinkRankExpander.class), mock(BoostResolver.class),
                mock(IndexStore.class));

        QueryFailedException e = assertThrows(QueryFailedException.class, () -> service.query(request("anything")));
        assertTrue(e.getMessage().contains("hybridQuery"));
    }

    @Test
    @DisplayName("Version specifiers resolve as indexed commits first, then as instants")
    void testResolveScope_VersionSpecifiers() {
        // Given
        IndexStore store = mock(IndexStore.class);
        Instant commitTime = Instant.parse("2024-06-01T12:00:00Z");
        when(store.findCommitTimestamp("demo", "abc123")).thenReturn(Optional.of(commitTime));
        when(store.findCommitTimestamp("other", "2024-01-01T00:00:00Z")).thenReturn(Optional.empty());
        ContextQueryService service = service(mock(HybridRetriever.class), mock(LinkRankExpander.class),
                mock(BoostResolver.class), store);

        // When
        QueryScope scope = service.resolveScope(List.of(
                RepoSpec.at("demo", "abc123"),
                RepoSpec.at("other", "2024-01-01T00:00:00Z"),
                RepoSpec.latest("third")));

        // Then
        assertEquals(List.of("demo", "other", "third"), scope.getRepoIds());
        assertEquals(commitTime, scope.asOf("demo"));
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), scope.asOf("other"));
        assertNull(scope.asOf("third"));
    }

    @Test
    @DisplayName("An unknown version specifier fails the query")
    void testQuery_UnknownVersionFails() {
        IndexStore store = mock(IndexStore.class);
        when(store.findCommitTimestamp(anyString(), anyString())).thenReturn(Optional.empty());
        ContextQueryService service = service(mock(HybridRetriever.class), mock(LinkRankExpander.class),
                mock(BoostResolver.class), store);

        QueryRequest request = QueryRequest.builder()
                .message(QueryMessage.user("anything"))
                .repo(RepoSpec.at("demo", "not-a-commit"))
                .approxLength(100)
                .build();

        assertThrows(QueryFailedException.class, () -> service.query(request));
    }

    @Test
    @DisplayName("Without a user message nothing is retrieved and the response is empty")
    void testQuery_NoUserMessage() {
        HybridRetriever retriever = mock(HybridRetriever.class);
        LinkRankExpander expander = mock(LinkRankExpander.class);
        BoostResolver boostResolver = mock(BoostResolver.class);
        when(expander.expand(anyList(), any())).thenReturn(List.of());
        when(boostResolver.resolve(any(), anyList(), any())).thenReturn(List.of());

        QueryRequest request = QueryRequest.builder()
                .message(new QueryMessage("assistant", "previous answer"))
                .repo(RepoSpec.latest("demo"))
                .approxLength(100)
                .build();

        QueryResponse response = service(retriever, expander, boostResolver, mock(IndexStore.class)).query(request);

        assertTrue(response.getUsedChunks().isEmpty());
        assertEquals(0, response.getRenderedChars());
    }

    private static ContextQueryService service(HybridRetriever retriever, LinkRankExpander expander,
                                               BoostResolver boostResolver, IndexStore store) {
        AppProperties appProperties = new AppProperties();
        return new ContextQueryService(retriever, expander, boostResolver, new BudgetAssembler(appProperties),
                store, appProperties);
    }

    private static QueryRequest request(String text) {
        return QueryRequest.builder()
                .message(QueryMessage.user(text))
                .repo(RepoSpec.latest("demo"))
                .approxLength(1000)
                .build();
    }

    private static RetrievalCandidate candidate(String id, double score) {
        Chunk chunk = Chunk.builder()
                .id(id)
                .fileVersionId(id + "-v")
                .repoId("demo")
                .filePath("src/" + id + ".ts")
                .content("export const " + id + " = 1;\n")
                .lineStart(1)
                .lineEnd(1)
                .language("typescript")
                .declarationType("block")
                .build();
        return RetrievalCandidate.builder().chunk(chunk).fusedScore(score).lexicalScore(score).build();
    }
}
