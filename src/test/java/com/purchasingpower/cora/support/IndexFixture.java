package com.purchasingpower.cora.support;

import com.purchasingpower.cora.chunking.ChunkBuilder;
import com.purchasingpower.cora.chunking.FixedWindowContentItemSplitter;
import com.purchasingpower.cora.chunking.HeadingContentItemSplitter;
import com.purchasingpower.cora.chunking.KeyValueContentItemSplitter;
import com.purchasingpower.cora.configuration.AppProperties;
import com.purchasingpower.cora.configuration.GlobalRetryConfig;
import com.purchasingpower.cora.knowledge.EmbeddingService;
import com.purchasingpower.cora.knowledge.IndexStore;
import com.purchasingpower.cora.knowledge.impl.NoOpCommentaryGenerator;
import com.purchasingpower.cora.knowledge.impl.ReferenceExtractorImpl;
import com.purchasingpower.cora.knowledge.impl.ReferenceResolverImpl;
import com.purchasingpower.cora.model.index.Chunk;
import com.purchasingpower.cora.model.index.FileVersion;
import com.purchasingpower.cora.model.index.RepositoryRef;
import com.purchasingpower.cora.model.sync.FileIndexResult;
import com.purchasingpower.cora.parser.GrammarParserRegistry;
import com.purchasingpower.cora.parser.JavaGrammarParser;
import com.purchasingpower.cora.parser.TreeSitterGrammarParser;
import com.purchasingpower.cora.query.BoostResolver;
import com.purchasingpower.cora.query.BudgetAssembler;
import com.purchasingpower.cora.query.ContextQueryService;
import com.purchasingpower.cora.query.HybridRetriever;
import com.purchasingpower.cora.query.LinkRankExpander;
import com.purchasingpower.cora.service.GitRepositoryService;
import com.purchasingpower.cora.service.GitRepositoryService.CommitInfo;
import com.purchasingpower.cora.service.impl.ReindexCoordinatorImpl;
import com.purchasingpower.cora.util.RetryExecutor;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Indexing and query components wired by hand over an in-memory store, a checkout directory and
 * a mocked git service. Passes run on the calling thread.
 */
public class IndexFixture {

    public final AppProperties appProperties = new AppProperties();
    public final GlobalRetryConfig retryConfig = new GlobalRetryConfig();
    public final IndexStore store;
    public final EmbeddingService embeddingService;
    public final GitRepositoryService gitRepositoryService = mock(GitRepositoryService.class);
    public final ChunkBuilder chunkBuilder = chunkBuilder(appProperties);
    public final ReferenceExtractorImpl referenceExtractor;
    public final ReferenceResolverImpl referenceResolver;
    public final RetryExecutor retryExecutor;
    public final ReindexCoordinatorImpl coordinator;
    public final Path checkout;

    public IndexFixture(Path checkout, IndexStore store, EmbeddingService embeddingService) {
        this(checkout, store, embeddingService, new ReferenceExtractorImpl());
    }

    public IndexFixture(Path checkout, IndexStore store, EmbeddingService embeddingService,
                        ReferenceExtractorImpl referenceExtractor) {
        this.checkout = checkout;
        this.referenceExtractor = referenceExtractor;
        this.store = store;
        this.embeddingService = embeddingService;
        retryConfig.setMaxAttempts(2);
        retryConfig.setBackoffMs(0);
        retryConfig.setMaxBackoffMs(0);
        this.retryExecutor = new RetryExecutor(retryConfig);
        this.referenceResolver = new ReferenceResolverImpl(store);
        this.coordinator = new ReindexCoordinatorImpl(store, chunkBuilder, referenceExtractor, referenceResolver,
                embeddingService, new NoOpCommentaryGenerator(), gitRepositoryService, retryExecutor,
                appProperties, Runnable::run);
    }

    public static ChunkBuilder chunkBuilder(AppProperties appProperties) {
        FixedWindowContentItemSplitter fixedWindow = new FixedWindowContentItemSplitter(appProperties);
        GrammarParserRegistry registry = new GrammarParserRegistry(
                List.of(new JavaGrammarParser(), new TreeSitterGrammarParser()));
        return new ChunkBuilder(registry,
                List.of(new HeadingContentItemSplitter(), new KeyValueContentItemSplitter(), fixedWindow),
                fixedWindow, appProperties);
    }

    public RepositoryRef register(String repoId) {
        RepositoryRef repository = RepositoryRef.builder()
                .repoId(repoId)
                .originUri("file://" + checkout)
                .checkoutPath(checkout.toString())
                .build();
        coordinator.registerRepository(repository);
        return repository;
    }

    public void write(String filePath, String content) {
        Path file = checkout.resolve(filePath);
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public void delete(String filePath) {
        try {
            Files.deleteIfExists(checkout.resolve(filePath));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Makes every following pass see HEAD at the given commit. */
    public void atCommit(String hash, Instant timestamp) {
        when(gitRepositoryService.headCommit(any())).thenReturn(Optional.of(new CommitInfo(hash, timestamp)));
    }

    public FileIndexResult index(String repoId, String filePath) {
        return coordinator.reindexFile(repoId, filePath, false);
    }

    public FileIndexResult writeAndIndex(String repoId, String filePath, String content) {
        write(filePath, content);
        return index(repoId, filePath);
    }

    public FileVersion latest(String repoId, String filePath) {
        return store.findLatestFileVersion(repoId, "", filePath)
                .orElseThrow(() -> new AssertionError("No latest version of " + filePath));
    }

    public List<Chunk> latestChunks(String repoId, String filePath) {
        return store.findChunksForFileVersion(latest(repoId, filePath).getId());
    }

    public ContextQueryService queryService() {
        return new ContextQueryService(
                new HybridRetriever(store, embeddingService),
                new LinkRankExpander(referenceResolver, store, appProperties),
                new BoostResolver(store, referenceResolver),
                new BudgetAssembler(appProperties),
                store,
                appProperties);
    }
}
