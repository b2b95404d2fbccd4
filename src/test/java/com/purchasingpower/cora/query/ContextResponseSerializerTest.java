package com.purchasingpower.cora.query;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.cora.model.query.ContextSection;
import com.purchasingpower.cora.model.query.FileContext;
import com.purchasingpower.cora.model.query.QueryRequest;
import com.purchasingpower.cora.model.query.QueryResponse;
import com.purchasingpower.cora.model.query.RenderMode;
import com.purchasingpower.cora.model.query.RepositoryContext;
import com.purchasingpower.cora.model.query.UsedChunk;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Context Response Serializer Tests")
class ContextResponseSerializerTest {

    private final ContextResponseSerializer serializer = new ContextResponseSerializer(new ObjectMapper());

    @Test
    @DisplayName("Requests are read from the wire format")
    void testReadRequest() {
        // Given
        String json = """
                {
                  "messages": [
                    {"role": "user", "content": "how is the cache evicted?"}
                  ],
                  "approxLength": 6000,
                  "repos": [
                    {"repoId": "demo", "versionSpecifier": "abc123"},
                    {"repoId": "docs"}
                  ],
                  "boostDirectives": {
                    "files": ["README.md"],
                    "declarations": [
                      {"repoId": "demo", "path": "src/cache.ts#evict", "includeImplementation": false}
                    ]
                  },
                  "timeoutMs": 2500
                }
                """;

        // When
        QueryRequest request = serializer.readRequest(json);

        // Then
        assertEquals("how is the cache evicted?", request.latestUserContent().orElseThrow());
        assertEquals(6000, request.getApproxLength());
        assertEquals(2500, request.getTimeoutMs());
        assertTrue(request.getRepos().get(0).isPinned());
        assertFalse(request.getRepos().get(1).isPinned());
        assertEquals("README.md", request.getBoostDirectives().getFiles().get(0));
        assertEquals("evict", request.getBoostDirectives().getDeclarations().get(0).identifier());
        assertEquals("src/cache.ts", request.getBoostDirectives().getDeclarations().get(0).filePath());
        assertFalse(request.getBoostDirectives().getDeclarations().get(0).isIncludeImplementation());
    }

    @Test
    @DisplayName("Malformed requests are rejected")
    void testReadRequest_Malformed() {
        assertThrows(IllegalArgumentException.class, () -> serializer.readRequest("{\"approxLength\": "));
    }

    @Test
    @DisplayName("Responses serialize with their metadata")
    void testToJson() {
        String json = serializer.toJson(sampleResponse());

        assertTrue(json.contains("\"repoId\":\"demo\""));
        assertTrue(json.contains("\"renderMode\":\"ELIDED\""));
        assertTrue(json.contains("\"renderedChars\":28"));
        assertTrue(json.contains("\"truncated\":true"));
    }

    @Test
    @DisplayName("Text rendering has one header per file and marks elided sections")
    void testToText() {
        String expected = """
                === demo:src/cache.ts ===
                --- lines 1-2 ---
                // Evicts stale entries.
                export function evict() {
                }
                --- lines 3-9 (elided) ---
                ...

                """;

        assertEquals(expected, serializer.toText(sampleResponse()));
    }

    private static QueryResponse sampleResponse() {
        ContextSection full = ContextSection.builder()
                .lineStart(1)
                .lineEnd(2)
                .renderMode(RenderMode.FULL)
                .content("export function evict() {\n}")
                .commentary("Evicts stale entries.")
                .chunkId("c0")
                .build();
        ContextSection elided = ContextSection.builder()
                .lineStart(3)
                .lineEnd(9)
                .renderMode(RenderMode.ELIDED)
                .content("...")
                .chunkId("c1")
                .build();
        FileContext file = FileContext.builder()
                .filePath("src/cache.ts")
                .fileVersionId("v1")
                .language("typescript")
                .section(full)
                .section(elided)
                .build();
        return QueryResponse.builder()
                .repository(RepositoryContext.builder().repoId("demo").file(file).build())
                .usedChunk(UsedChunk.builder().chunkId("c0").repoId("demo").filePath("src/cache.ts")
                        .lineStart(1).lineEnd(2).renderMode(RenderMode.FULL).combinedScore(1.0).build())
                .usedChunk(UsedChunk.builder().chunkId("c1").repoId("demo").filePath("src/cache.ts")
                        .lineStart(3).lineEnd(9).renderMode(RenderMode.ELIDED).combinedScore(0.5).build())
                .renderedChars(28)
                .truncated(true)
                .build();
    }
}
