package com.purchasingpower.cora;

import com.purchasingpower.cora.configuration.AppProperties;
import com.purchasingpower.cora.knowledge.CommentaryGenerator;
import com.purchasingpower.cora.knowledge.EmbeddingService;
import com.purchasingpower.cora.knowledge.IndexStore;
import com.purchasingpower.cora.knowledge.impl.InMemoryIndexStore;
import com.purchasingpower.cora.knowledge.impl.NoOpCommentaryGenerator;
import com.purchasingpower.cora.model.index.RepositoryRef;
import com.purchasingpower.cora.model.query.QueryRequest;
import com.purchasingpower.cora.model.query.QueryResponse;
import com.purchasingpower.cora.model.sync.FileIndexOutcome;
import com.purchasingpower.cora.model.sync.ReindexResult;
import com.purchasingpower.cora.query.ContextQueryService;
import com.purchasingpower.cora.query.ContextResponseSerializer;
import com.purchasingpower.cora.service.ReindexCoordinator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@DisplayName("Application Context Tests")
class CoraApplicationTest {

    @MockBean
    private EmbeddingService embeddingService;

    @Autowired
    private IndexStore indexStore;

    @Autowired
    private CommentaryGenerator commentaryGenerator;

    @Autowired
    private AppProperties appProperties;

    @Autowired
    private ReindexCoordinator reindexCoordinator;

    @Autowired
    private ContextQueryService contextQueryService;

    @Autowired
    private ContextResponseSerializer serializer;

    @TempDir
    Path checkout;

    @Test
    @DisplayName("Defaults wire the in-memory store and no commentary")
    void contextLoads() {
        assertInstanceOf(InMemoryIndexStore.class, indexStore);
        assertInstanceOf(NoOpCommentaryGenerator.class, commentaryGenerator);
        assertEquals(400, appProperties.getChunking().getMinChunkChars());
        assertEquals(0.85, appProperties.getRanking().getDamping());
    }

    @Test
    @DisplayName("Index a checkout and answer a query read from JSON")
    void indexAndQuery() throws Exception {
        // Given
        Files.writeString(checkout.resolve("scheduler.py"),
                "def schedule_jobs(queue):\n    # round robin over workers\n    return queue\n");
        Files.writeString(checkout.resolve("README.md"), "# Scheduler\nRuns jobs.\n");
        reindexCoordinator.registerRepository(RepositoryRef.builder()
                .repoId("app-test")
                .checkoutPath(checkout.toString())
                .build());

        // When
        ReindexResult indexed = reindexCoordinator.refresh("app-test", List.of(), false).join();
        QueryRequest request = serializer.readRequest("""
                {"messages": [{"role": "user", "content": "schedule jobs round robin"}],
                 "approxLength": 2000,
                 "repos": [{"repoId": "app-test"}]}
                """);
        QueryResponse response = contextQueryService.query(request);

        // Then
        assertEquals(2, indexed.count(FileIndexOutcome.INDEXED));
        assertEquals("app-test:scheduler.py", response.usedFiles().get(0));
        assertTrue(serializer.toText(response).contains("def schedule_jobs(queue):"));
        assertTrue(serializer.toJson(response).contains("\"usedChunks\""));

        System.out.println("✅ " + indexed.summary());
    }
}
