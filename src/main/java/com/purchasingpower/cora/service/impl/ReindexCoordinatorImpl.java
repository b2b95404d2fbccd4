package com.purchasingpower.cora.service.impl;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.Striped;
import com.purchasingpower.cora.chunking.ChunkBuilder;
import com.purchasingpower.cora.chunking.ChunkDraft;
import com.purchasingpower.cora.chunking.ChunkedFile;
import com.purchasingpower.cora.configuration.AppProperties;
import com.purchasingpower.cora.configuration.IndexingProperties;
import com.purchasingpower.cora.exception.IndexingException;
import com.purchasingpower.cora.knowledge.CommentaryGenerator;
import com.purchasingpower.cora.knowledge.EmbeddingService;
import com.purchasingpower.cora.knowledge.ExtractedEntities;
import com.purchasingpower.cora.knowledge.IndexStore;
import com.purchasingpower.cora.knowledge.ReferenceExtractor;
import com.purchasingpower.cora.knowledge.ReferenceResolver;
import com.purchasingpower.cora.model.ServiceType;
import com.purchasingpower.cora.model.index.Chunk;
import com.purchasingpower.cora.model.index.CommitFileVersion;
import com.purchasingpower.cora.model.index.ContentEntityDefinition;
import com.purchasingpower.cora.model.index.ContentEntityReference;
import com.purchasingpower.cora.model.index.FileVersion;
import com.purchasingpower.cora.model.index.PathEvent;
import com.purchasingpower.cora.model.index.RepositoryRef;
import com.purchasingpower.cora.model.retrieval.QueryScope;
import com.purchasingpower.cora.model.sync.ChangedFile;
import com.purchasingpower.cora.model.sync.FileIndexOutcome;
import com.purchasingpower.cora.model.sync.FileIndexResult;
import com.purchasingpower.cora.model.sync.ReindexResult;
import com.purchasingpower.cora.model.sync.SyncType;
import com.purchasingpower.cora.service.GitRepositoryService;
import com.purchasingpower.cora.service.GitRepositoryService.CommitInfo;
import com.purchasingpower.cora.service.ReindexCoordinator;
import com.purchasingpower.cora.util.ContentHashing;
import com.purchasingpower.cora.util.ExternalCallLogger;
import com.purchasingpower.cora.util.ImportPaths;
import com.purchasingpower.cora.util.RetryExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reindex passes over registered repositories.
 *
 * <p>HOW A FILE IS INDEXED:
 * <pre>
 * 1. Missing file         -> its path is retired (older versions stay for pinned queries)
 * 2. Hash == latest       -> nothing is written; the commit row is still recorded
 * 3. Published before     -> that stored version becomes the latest again
 * 4. Otherwise            -> chunk, extract, describe, embed, stage the missing records, publish
 * </pre>
 *
 * <p>Staged records are written under a retry. Until publish succeeds, the previous version stays
 * the latest one; a version that was staged but never published is finished by the next pass.
 * A forced refresh never removes chunks of a published version, it only adds what is missing.
 * Every publish and retire is recorded as a {@link PathEvent} for pinned reads.
 */
@Slf4j
@Service
public class ReindexCoordinatorImpl implements ReindexCoordinator {

    private static final int LOCK_STRIPES = 64;

    private final IndexStore indexStore;
    private final ChunkBuilder chunkBuilder;
    private final ReferenceExtractor referenceExtractor;
    private final ReferenceResolver referenceResolver;
    private final EmbeddingService embeddingService;
    private final CommentaryGenerator commentaryGenerator;
    private final GitRepositoryService gitRepositoryService;
    private final RetryExecutor retryExecutor;
    private final AppProperties appProperties;
    private final Executor indexingExecutor;

    private final Striped<Lock> fileLocks = Striped.lock(LOCK_STRIPES);

    public ReindexCoordinatorImpl(IndexStore indexStore,
                                  ChunkBuilder chunkBuilder,
                                  ReferenceExtractor referenceExtractor,
                                  ReferenceResolver referenceResolver,
                                  EmbeddingService embeddingService,
                                  CommentaryGenerator commentaryGenerator,
                                  GitRepositoryService gitRepositoryService,
                                  RetryExecutor retryExecutor,
                                  AppProperties appProperties,
                                  @Qualifier("indexingExecutor") Executor indexingExecutor) {
        this.indexStore = indexStore;
        this.chunkBuilder = chunkBuilder;
        this.referenceExtractor = referenceExtractor;
        this.referenceResolver = referenceResolver;
        this.embeddingService = embeddingService;
        this.commentaryGenerator = commentaryGenerator;
        this.gitRepositoryService = gitRepositoryService;
        this.retryExecutor = retryExecutor;
        this.appProperties = appProperties;
        this.indexingExecutor = indexingExecutor;
    }

    @Override
    public void registerRepository(RepositoryRef repository) {
        Preconditions.checkArgument(repository.getRepoId() != null && !repository.getRepoId().isBlank(),
                "repoId is required");
        retryExecutor.run(ServiceType.INDEX_STORE, "saveRepository", () -> indexStore.saveRepository(repository));
        log.info("Registered repository {} (checkout: {}, project dir: '{}')",
                repository.getRepoId(), repository.getCheckoutPath(), repository.getProjectDir());
    }

    @Override
    public CompletableFuture<ReindexResult> notifyChanged(String repoId, List<String> filePaths) {
        RepositoryRef repository = requireRepository(repoId);
        if (filePaths == null || filePaths.isEmpty()) {
            log.info("Change notification without paths for {}: full rescan", repoId);
            return fullRescan(repository, false, SyncType.FULL_RESCAN);
        }
        log.info("Change notification for {}: {} paths", repoId, filePaths.size());
        return runPass(repository, SyncType.NOTIFIED_PATHS, normalize(filePaths), false, headOf(repository),
                null, false);
    }

    @Override
    public CompletableFuture<ReindexResult> refresh(String repoId, List<String> filePaths, boolean force) {
        RepositoryRef repository = requireRepository(repoId);
        SyncType syncType = force ? SyncType.FORCED_REFRESH : SyncType.FULL_RESCAN;
        if (filePaths == null || filePaths.isEmpty()) {
            log.warn("Refresh requested for {} (force={}): full rescan", repoId, force);
            return fullRescan(repository, force, syncType);
        }
        return runPass(repository, force ? SyncType.FORCED_REFRESH : SyncType.NOTIFIED_PATHS,
                normalize(filePaths), force, headOf(repository), null, false);
    }

    @Override
    public CompletableFuture<ReindexResult> syncToHead(String repoId) {
        long startTime = System.currentTimeMillis();
        RepositoryRef repository = requireRepository(repoId);
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("Starting sync to HEAD for repository: {}", repoId);
        log.info("═══════════════════════════════════════════════════════════════");

        try {
            Optional<CommitInfo> head = headOf(repository);
            String lastIndexedCommit = repository.getLastIndexedCommit();

            if (head.isEmpty() || lastIndexedCommit == null) {
                log.info("No previous indexed commit. Performing FULL RESCAN.");
                return fullRescan(repository, false, SyncType.FULL_RESCAN);
            }
            String currentCommit = head.get().hash();
            if (lastIndexedCommit.equals(currentCommit)) {
                log.info("Already indexed at commit {}. No changes.", abbreviate(currentCommit));
                return CompletableFuture.completedFuture(ReindexResult.builder()
                        .repoId(repoId)
                        .syncType(SyncType.NO_CHANGES)
                        .fromCommit(lastIndexedCommit)
                        .toCommit(currentCommit)
                        .totalTimeMs(System.currentTimeMillis() - startTime)
                        .build());
            }

            log.info("Finding changes: {}..{}", abbreviate(lastIndexedCommit), abbreviate(currentCommit));
            List<ChangedFile> changedFiles = gitRepositoryService.changedFilesBetween(
                    checkoutOf(repository), lastIndexedCommit, currentCommit);
            String prefix = projectPrefix(repository);
            PathFilter filter = new PathFilter(appProperties.getIndexing());
            List<String> paths = new ArrayList<>();
            for (ChangedFile changedFile : changedFiles) {
                if (!changedFile.path().startsWith(prefix)) {
                    continue;
                }
                String path = changedFile.path().substring(prefix.length());
                if (filter.accepts(path)) {
                    log.info("  {} {}", changedFile.changeType(), path);
                    paths.add(path);
                }
            }
            return runPass(repository, SyncType.INCREMENTAL, paths, false, head, lastIndexedCommit, true);

        } catch (RuntimeException e) {
            log.error("Sync to HEAD failed for {}", repoId, e);
            return CompletableFuture.completedFuture(
                    ReindexResult.error(repoId, System.currentTimeMillis() - startTime));
        }
    }

    @Override
    public FileIndexResult reindexFile(String repoId, String filePath, boolean force) {
        RepositoryRef repository = requireRepository(repoId);
        return indexPath(repository, normalize(List.of(filePath)).get(0), force, headOf(repository).orElse(null));
    }

    // =========================================================================
    // Passes
    // =========================================================================

    private CompletableFuture<ReindexResult> fullRescan(RepositoryRef repository, boolean force, SyncType syncType) {
        long startTime = System.currentTimeMillis();
        try {
            Set<String> paths = new LinkedHashSet<>(scanPaths(repository));
            // paths indexed before but gone from the checkout get retired
            indexStore.findLatestFileVersions(repository.getRepoId()).stream()
                    .map(FileVersion::getFilePath)
                    .forEach(paths::add);
            log.info("Full rescan of {}: {} paths", repository.getRepoId(), paths.size());
            return runPass(repository, syncType, new ArrayList<>(paths), force, headOf(repository),
                    repository.getLastIndexedCommit(), true);
        } catch (RuntimeException e) {
            log.error("Full rescan failed for {}", repository.getRepoId(), e);
            return CompletableFuture.completedFuture(
                    ReindexResult.error(repository.getRepoId(), System.currentTimeMillis() - startTime));
        }
    }

    private CompletableFuture<ReindexResult> runPass(RepositoryRef repository, SyncType syncType, List<String> paths,
                                                     boolean force, Optional<CommitInfo> head, String fromCommit,
                                                     boolean advanceIndexedCommit) {
        long startTime = System.currentTimeMillis();
        CommitInfo commit = head.orElse(null);

        List<CompletableFuture<FileIndexResult>> futures = paths.stream()
                .distinct()
                .map(path -> CompletableFuture.supplyAsync(
                        () -> indexPath(repository, path, force, commit), indexingExecutor))
                .collect(Collectors.toList());

        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).thenApply(done -> {
            ReindexResult.ReindexResultBuilder result = ReindexResult.builder()
                    .repoId(repository.getRepoId())
                    .syncType(syncType)
                    .fromCommit(fromCommit)
                    .toCommit(commit == null ? null : commit.hash());
            futures.forEach(future -> result.file(future.join()));
            ReindexResult partial = result.totalTimeMs(System.currentTimeMillis() - startTime).build();

            if (advanceIndexedCommit && commit != null && partial.isSuccess()) {
                retryExecutor.run(ServiceType.INDEX_STORE, "updateIndexState",
                        () -> indexStore.updateIndexState(repository.getRepoId(), commit.hash(), Instant.now()));
            }
            log.info("Reindex complete: {}", partial.summary());
            return partial;
        });
    }

    private List<String> scanPaths(RepositoryRef repository) {
        PathFilter filter = new PathFilter(appProperties.getIndexing());
        File checkout = checkoutOf(repository);
        Stream<String> candidates;

        if (gitRepositoryService.isGitRepository(checkout)) {
            String prefix = projectPrefix(repository);
            candidates = gitRepositoryService.listTrackedFiles(checkout).stream()
                    .filter(path -> path.startsWith(prefix))
                    .map(path -> path.substring(prefix.length()));
        } else {
            Path root = projectRoot(repository);
            try (Stream<Path> walk = Files.walk(root)) {
                candidates = walk.filter(Files::isRegularFile)
                        .map(file -> root.relativize(file).toString().replace(File.separatorChar, '/'))
                        .collect(Collectors.toList())
                        .stream();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to walk " + root, e);
            }
        }
        return candidates.filter(filter::accepts).sorted().collect(Collectors.toList());
    }

    // =========================================================================
    // Single file
    // =========================================================================

    private FileIndexResult indexPath(RepositoryRef repository, String filePath, boolean force, CommitInfo commit) {
        Lock lock = fileLocks.get(repository.getRepoId() + '\u0000' + filePath);
        lock.lock();
        try {
            return indexLocked(repository, filePath, force, commit);
        } catch (IndexingException e) {
            log.error("❌ Failed to index {}:{}: {}", repository.getRepoId(), filePath, e.getMessage(), e.getCause());
            return FileIndexResult.failed(filePath, e.getMessage());
        } catch (RuntimeException e) {
            log.error("❌ Unexpected error indexing {}:{}", repository.getRepoId(), filePath, e);
            return FileIndexResult.failed(filePath, e.getClass().getSimpleName() + ": " + e.getMessage());
        } finally {
            lock.unlock();
        }
    }

    private FileIndexResult indexLocked(RepositoryRef repository, String filePath, boolean force, CommitInfo commit) {
        String repoId = repository.getRepoId();
        String projectDir = repository.getProjectDir();
        Path file = projectRoot(repository).resolve(filePath);

        if (!Files.isRegularFile(file)) {
            boolean retired = storeCall(repoId, filePath, "retireFilePath",
                    () -> indexStore.retireFilePath(repoId, projectDir, filePath));
            if (retired) {
                recordEvent(PathEvent.deleted(repoId, projectDir, filePath, hashOf(commit), timeOf(commit)));
                log.info("Retired {}:{}", repoId, filePath);
            }
            return FileIndexResult.of(filePath, retired ? FileIndexOutcome.RETIRED : FileIndexOutcome.SKIPPED, null);
        }

        Optional<String> content = readText(file);
        if (content.isEmpty()) {
            return FileIndexResult.of(filePath, FileIndexOutcome.SKIPPED, null);
        }

        ChunkedFile chunked = chunkBuilder.build(filePath, content.get());
        FileVersion candidate = FileVersion.builder()
                .repoId(repoId)
                .projectDir(projectDir)
                .filePath(filePath)
                .contentHash(ContentHashing.sha256(content.get()))
                .language(chunked.language().getId())
                .lineCount(chunked.lines().count())
                .createdAt(Instant.now())
                .build();

        Optional<FileVersion> latest = storeCall(repoId, filePath, "findLatestFileVersion",
                () -> indexStore.findLatestFileVersion(repoId, projectDir, filePath));
        boolean isLatest = latest.isPresent() && latest.get().getId().equals(candidate.getId());
        if (!force && isLatest) {
            recordCommit(latest.get(), commit);
            return FileIndexResult.of(filePath, FileIndexOutcome.UNCHANGED, latest.get().getId());
        }

        Optional<FileVersion> stored = storeCall(repoId, filePath, "findFileVersion",
                () -> indexStore.findFileVersion(candidate.getId()));
        boolean published = stored.isPresent() && wasPublished(stored.get());
        if (!force && published) {
            publish(stored.get(), commit);
            recordCommit(stored.get(), commit);
            log.info("Republished earlier version of {}:{}", repoId, filePath);
            return FileIndexResult.of(filePath, FileIndexOutcome.REPUBLISHED, stored.get().getId());
        }

        // a stored version that never got published is an unfinished earlier attempt
        FileVersion version = stored.orElse(candidate);
        List<Chunk> chunks = writeVersion(version, chunked, published);
        if (!isLatest) {
            publish(version, commit);
        }
        recordCommit(version, commit);
        log.info("Indexed {}:{} -> {} chunks ({})", repoId, filePath, chunks.size(), chunked.language().getId());
        return new FileIndexResult(filePath, FileIndexOutcome.INDEXED, version.getId(), chunks.size(), null);
    }

    /**
     * Writes the records of a version that are not stored yet. Chunks already stored are kept as
     * they are, except that a chunk stored without a vector gets one. Chunks of a published
     * version are never removed; leftovers of an unpublished attempt that no longer match the
     * current chunking are cleared first.
     *
     * @return all chunks of the version, in ordinal order
     */
    private List<Chunk> writeVersion(FileVersion version, ChunkedFile chunked, boolean published) {
        List<ChunkDraft> drafts = chunked.chunks();
        List<Chunk> existing = storeCall(version.getRepoId(), version.getFilePath(), "findChunksForFileVersion",
                () -> indexStore.findChunksForFileVersion(version.getId()));

        if (!sameBoundaries(existing, drafts)) {
            if (published) {
                log.warn("⚠️  Stored chunks of {} ({}) do not match the current chunking; keeping them",
                        version.getFilePath(), version.getId());
                return existing;
            }
            storeCall(version.getRepoId(), version.getFilePath(), "clearStagedVersion", () -> {
                indexStore.deleteChunksForFileVersion(version);
                return null;
            });
            existing = List.of();
        }

        Map<Integer, Chunk> kept = new LinkedHashMap<>();
        for (Chunk chunk : existing) {
            if (chunk.hasEmbedding()) {
                kept.put(chunk.getOrdinal(), chunk);
            }
        }
        List<ChunkDraft> pending = drafts.stream()
                .filter(draft -> !kept.containsKey(draft.ordinal()))
                .collect(Collectors.toList());

        ExtractedEntities entities = referenceExtractor.extract(version, chunked);
        List<String> commentaries = new ArrayList<>();
        List<String> embeddingTexts = new ArrayList<>();
        for (ChunkDraft draft : pending) {
            String commentary = commentaryGenerator.describe(version.getFilePath(), version.getLanguage(), draft)
                    .orElse(null);
            commentaries.add(commentary);
            embeddingTexts.add(commentary == null ? draft.content() : draft.content() + "\n\n" + commentary);
        }
        List<float[]> vectors = embed(version, embeddingTexts);
        Map<String, List<String>> targets = referenceTargets(version, entities);

        List<Chunk> written = new ArrayList<>();
        for (int i = 0; i < pending.size(); i++) {
            ChunkDraft draft = pending.get(i);
            String chunkId = Chunk.idOf(version.getId(), draft.ordinal());
            written.add(Chunk.builder()
                    .id(chunkId)
                    .fileVersionId(version.getId())
                    .repoId(version.getRepoId())
                    .filePath(version.getFilePath())
                    .ordinal(draft.ordinal())
                    .content(draft.content())
                    .commentary(commentaries.get(i))
                    .lineStart(draft.lineStart())
                    .lineEnd(draft.lineEnd())
                    .language(version.getLanguage())
                    .declarationType(draft.declarationType())
                    .referenceSymbols(entities.symbolsUsedIn(chunkId))
                    .referenceChunks(targets.getOrDefault(chunkId, List.of()))
                    .embedding(vectors == null ? null : vectors.get(i))
                    .build());
        }

        storeCall(version.getRepoId(), version.getFilePath(), "writeFileVersion", () -> {
            indexStore.saveFileVersion(version);
            indexStore.saveDefinitions(entities.definitions());
            indexStore.saveReferences(entities.references());
            written.forEach(indexStore::upsertChunk);
            return null;
        });

        List<Chunk> chunks = new ArrayList<>(kept.values());
        chunks.addAll(written);
        chunks.sort(Comparator.comparingInt(Chunk::getOrdinal));
        return chunks;
    }

    /** Stored chunks, possibly a partial set, line up with the drafts of the same ordinal. */
    private static boolean sameBoundaries(List<Chunk> existing, List<ChunkDraft> drafts) {
        for (Chunk chunk : existing) {
            if (chunk.getOrdinal() >= drafts.size()) {
                return false;
            }
            ChunkDraft draft = drafts.get(chunk.getOrdinal());
            if (draft.ordinal() != chunk.getOrdinal()
                    || draft.lineStart() != chunk.getLineStart()
                    || draft.lineEnd() != chunk.getLineEnd()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Chunks each chunk's references point at. A reference without an import hint prefers a
     * definition of the same file; everything else goes through the resolver.
     */
    private Map<String, List<String>> referenceTargets(FileVersion version, ExtractedEntities entities) {
        Map<String, String> local = new LinkedHashMap<>();
        for (ContentEntityDefinition definition : entities.definitions()) {
            if (definition.getChunkId() != null) {
                local.putIfAbsent(definition.getIdentifier(), definition.getChunkId());
            }
        }

        QueryScope scope = QueryScope.latest();
        Map<String, Set<String>> targets = new LinkedHashMap<>();
        for (ContentEntityReference reference : entities.references()) {
            if (reference.getChunkId() == null) {
                continue;
            }
            Optional<String> target = reference.getImportPath() == null && local.containsKey(reference.getIdentifierUsed())
                    ? Optional.of(local.get(reference.getIdentifierUsed()))
                    : storeCall(version.getRepoId(), version.getFilePath(), "resolveReference",
                            () -> referenceResolver.resolveToChunk(reference, scope));
            target.filter(chunkId -> !chunkId.equals(reference.getChunkId()))
                    .ifPresent(chunkId -> targets.computeIfAbsent(reference.getChunkId(), id -> new LinkedHashSet<>())
                            .add(chunkId));
        }
        return targets.entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, entry -> new ArrayList<>(entry.getValue())));
    }

    /**
     * @return vectors in chunk order, null when embedding kept failing
     */
    private List<float[]> embed(FileVersion version, List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        try {
            List<float[]> vectors = retryExecutor.execute(ServiceType.EMBEDDING, "embedChunks",
                    ExternalCallLogger.fileTarget(version.getRepoId(), version.getFilePath()),
                    () -> embeddingService.embedAll(texts));
            if (vectors.size() != texts.size()) {
                log.warn("⚠️  Embedding returned {} vectors for {} chunks of {}, storing without vectors",
                        vectors.size(), texts.size(), version.getFilePath());
                return null;
            }
            return vectors;
        } catch (RuntimeException e) {
            log.warn("⚠️  Embedding failed for {}, storing chunks without vectors: {}",
                    version.getFilePath(), e.getMessage());
            return null;
        }
    }

    private void publish(FileVersion version, CommitInfo commit) {
        storeCall(version.getRepoId(), version.getFilePath(), "publishFileVersion", () -> {
            indexStore.publishFileVersion(version);
            return null;
        });
        recordEvent(PathEvent.published(version, hashOf(commit), timeOf(commit)));
    }

    private boolean wasPublished(FileVersion version) {
        String repoId = version.getRepoId();
        String filePath = version.getFilePath();
        boolean event = storeCall(repoId, filePath, "findPathEvents",
                () -> indexStore.findPathEvents(repoId, version.getProjectDir(), filePath)).stream()
                .anyMatch(pathEvent -> version.getId().equals(pathEvent.fileVersionId()));
        return event || !storeCall(repoId, filePath, "findCommitFileVersions",
                () -> indexStore.findCommitFileVersions(version.getId())).isEmpty();
    }

    private void recordEvent(PathEvent event) {
        storeCall(event.repoId(), event.filePath(), "recordPathEvent", () -> {
            indexStore.recordPathEvent(event);
            return null;
        });
    }

    private static String hashOf(CommitInfo commit) {
        return commit == null ? null : commit.hash();
    }

    private static Instant timeOf(CommitInfo commit) {
        return commit == null ? Instant.now() : commit.timestamp();
    }

    private void recordCommit(FileVersion version, CommitInfo commit) {
        if (commit == null) {
            return;
        }
        CommitFileVersion row = new CommitFileVersion(
                version.getId(), version.getRepoId(), version.getFilePath(), commit.hash(), commit.timestamp());
        storeCall(version.getRepoId(), version.getFilePath(), "saveCommitFileVersion", () -> {
            indexStore.saveCommitFileVersion(row);
            return null;
        });
    }

    private <T> T storeCall(String repoId, String filePath, String operation, Supplier<T> action) {
        try {
            return retryExecutor.execute(ServiceType.INDEX_STORE, operation,
                    ExternalCallLogger.fileTarget(repoId, filePath), action);
        } catch (RuntimeException e) {
            throw new IndexingException(repoId, filePath, operation + " failed: " + e.getMessage(), e);
        }
    }

    private Optional<String> readText(Path file) {
        IndexingProperties indexing = appProperties.getIndexing();
        try {
            if (Files.size(file) > indexing.getMaxFileBytes()) {
                log.info("Skipping {}: larger than {} bytes", file, indexing.getMaxFileBytes());
                return Optional.empty();
            }
            byte[] bytes = Files.readAllBytes(file);
            for (byte b : bytes) {
                if (b == 0) {
                    log.debug("Skipping binary file {}", file);
                    return Optional.empty();
                }
            }
            return Optional.of(new String(bytes, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IndexingException(null, file.toString(), "Could not read file", e);
        }
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private RepositoryRef requireRepository(String repoId) {
        RepositoryRef repository = indexStore.findRepository(repoId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown repository: " + repoId));
        Preconditions.checkArgument(repository.hasCheckout(), "Repository %s has no checkout", repoId);
        return repository;
    }

    private Optional<CommitInfo> headOf(RepositoryRef repository) {
        return gitRepositoryService.headCommit(checkoutOf(repository));
    }

    private static File checkoutOf(RepositoryRef repository) {
        return new File(repository.getCheckoutPath());
    }

    private static Path projectRoot(RepositoryRef repository) {
        Path checkout = Path.of(repository.getCheckoutPath());
        String projectDir = repository.getProjectDir();
        return projectDir == null || projectDir.isEmpty() ? checkout : checkout.resolve(projectDir);
    }

    private static String projectPrefix(RepositoryRef repository) {
        String projectDir = repository.getProjectDir();
        return projectDir == null || projectDir.isEmpty() ? "" : ImportPaths.normalize(projectDir) + "/";
    }

    private static List<String> normalize(List<String> filePaths) {
        return filePaths.stream()
                .map(path -> ImportPaths.normalize(path.replace('\\', '/')))
                .filter(path -> !path.isEmpty())
                .distinct()
                .collect(Collectors.toList());
    }

    private static String abbreviate(String commit) {
        return commit.length() > 8 ? commit.substring(0, 8) : commit;
    }

    /** Include/exclude globs of a rescan, relative to the project directory. */
    private static final class PathFilter {

        private final List<PathMatcher> includes;
        private final List<PathMatcher> excludes;

        private PathFilter(IndexingProperties indexing) {
            this.includes = matchers(indexing.getInclude());
            this.excludes = matchers(indexing.getExclude());
        }

        boolean accepts(String path) {
            Path relative = Path.of(path);
            boolean included = includes.isEmpty() || includes.stream().anyMatch(matcher -> matcher.matches(relative));
            return included && excludes.stream().noneMatch(matcher -> matcher.matches(relative));
        }

        // "**/x/**" must also match "x/..." at the root
        private static List<PathMatcher> matchers(List<String> globs) {
            List<PathMatcher> matchers = new ArrayList<>();
            for (String glob : globs) {
                matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + glob));
                if (glob.startsWith("**/")) {
                    matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + glob.substring(3)));
                }
            }
            return matchers;
        }
    }
}
