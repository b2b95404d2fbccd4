package com.purchasingpower.cora.knowledge.impl;

import com.purchasingpower.cora.knowledge.IndexStore;
import com.purchasingpower.cora.model.index.Chunk;
import com.purchasingpower.cora.model.index.CommitFileVersion;
import com.purchasingpower.cora.model.index.ContentEntityDefinition;
import com.purchasingpower.cora.model.index.ContentEntityReference;
import com.purchasingpower.cora.model.index.FileVersion;
import com.purchasingpower.cora.model.index.PathEvent;
import com.purchasingpower.cora.model.index.ReferenceType;
import com.purchasingpower.cora.model.index.RepositoryRef;
import com.purchasingpower.cora.model.retrieval.QueryScope;
import com.purchasingpower.cora.model.retrieval.RetrievalCandidate;
import com.purchasingpower.cora.util.LexicalTokens;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Index store kept in process memory. Used when {@code app.store.type=memory} (the default) and
 * in tests.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryIndexStore implements IndexStore {

    private final Map<String, RepositoryRef> repositories = new ConcurrentHashMap<>();
    private final Map<String, FileVersion> versions = new ConcurrentHashMap<>();
    private final Map<String, String> latestByPath = new ConcurrentHashMap<>();
    private final Map<String, List<CommitFileVersion>> commitsByVersion = new ConcurrentHashMap<>();
    private final Map<String, List<PathEvent>> eventsByPath = new ConcurrentHashMap<>();
    private final Map<String, Chunk> chunks = new ConcurrentHashMap<>();
    private final Map<String, List<ContentEntityDefinition>> definitionsByVersion = new ConcurrentHashMap<>();
    private final Map<String, List<ContentEntityReference>> referencesByVersion = new ConcurrentHashMap<>();

    // =========================================================================
    // Repositories
    // =========================================================================

    @Override
    public void saveRepository(RepositoryRef repository) {
        repositories.merge(repository.getRepoId(), repository, (existing, incoming) -> incoming.toBuilder()
                .lastIndexedCommit(incoming.getLastIndexedCommit() != null
                        ? incoming.getLastIndexedCommit() : existing.getLastIndexedCommit())
                .lastIndexedAt(incoming.getLastIndexedAt() != null
                        ? incoming.getLastIndexedAt() : existing.getLastIndexedAt())
                .build());
    }

    @Override
    public Optional<RepositoryRef> findRepository(String repoId) {
        return Optional.ofNullable(repositories.get(repoId));
    }

    @Override
    public void updateIndexState(String repoId, String commitHash, Instant indexedAt) {
        repositories.computeIfPresent(repoId, (id, repository) -> repository.toBuilder()
                .lastIndexedCommit(commitHash)
                .lastIndexedAt(indexedAt)
                .build());
    }

    // =========================================================================
    // File versions
    // =========================================================================

    @Override
    public void saveFileVersion(FileVersion fileVersion) {
        versions.putIfAbsent(fileVersion.getId(), fileVersion);
    }

    @Override
    public void publishFileVersion(FileVersion fileVersion) {
        versions.putIfAbsent(fileVersion.getId(), fileVersion);
        latestByPath.put(pathKey(fileVersion.getRepoId(), fileVersion.getProjectDir(), fileVersion.getFilePath()),
                fileVersion.getId());
    }

    @Override
    public boolean retireFilePath(String repoId, String projectDir, String filePath) {
        return latestByPath.remove(pathKey(repoId, projectDir, filePath)) != null;
    }

    @Override
    public Optional<FileVersion> findFileVersion(String fileVersionId) {
        return Optional.ofNullable(versions.get(fileVersionId));
    }

    @Override
    public Optional<FileVersion> findLatestFileVersion(String repoId, String projectDir, String filePath) {
        return Optional.ofNullable(latestByPath.get(pathKey(repoId, projectDir, filePath))).map(versions::get);
    }

    @Override
    public List<FileVersion> findLatestFileVersions(String repoId) {
        return latestByPath.values().stream()
                .map(versions::get)
                .filter(Objects::nonNull)
                .filter(version -> version.getRepoId().equals(repoId))
                .sorted(Comparator.comparing(FileVersion::getFilePath))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<FileVersion> findVisibleFileVersion(String repoId, String projectDir, String filePath,
                                                        Instant asOf) {
        if (asOf == null) {
            return findLatestFileVersion(repoId, projectDir, filePath);
        }
        List<FileVersion> history = versions.values().stream()
                .filter(version -> version.getRepoId().equals(repoId)
                        && Objects.equals(version.getProjectDir(), projectDir)
                        && version.getFilePath().equals(filePath))
                .collect(Collectors.toList());
        return VersionVisibility.visibleAt(history,
                versionId -> commitsByVersion.getOrDefault(versionId, List.of()),
                findPathEvents(repoId, projectDir, filePath), asOf);
    }

    // =========================================================================
    // Commit provenance
    // =========================================================================

    @Override
    public void saveCommitFileVersion(CommitFileVersion commitFileVersion) {
        List<CommitFileVersion> rows = commitsByVersion.computeIfAbsent(commitFileVersion.fileVersionId(),
                id -> new CopyOnWriteArrayList<>());
        boolean known = rows.stream().anyMatch(row -> row.commitHash().equals(commitFileVersion.commitHash()));
        if (!known) {
            rows.add(commitFileVersion);
        }
    }

    @Override
    public List<CommitFileVersion> findCommitFileVersions(String fileVersionId) {
        return List.copyOf(commitsByVersion.getOrDefault(fileVersionId, List.of()));
    }

    @Override
    public Optional<Instant> findCommitTimestamp(String repoId, String commitHash) {
        return commitsByVersion.values().stream()
                .flatMap(List::stream)
                .filter(row -> row.repoId().equals(repoId) && row.commitHash().equals(commitHash))
                .map(CommitFileVersion::timestamp)
                .findFirst();
    }

    @Override
    public void recordPathEvent(PathEvent event) {
        List<PathEvent> events = eventsByPath.computeIfAbsent(
                pathKey(event.repoId(), event.projectDir(), event.filePath()), key -> new CopyOnWriteArrayList<>());
        if (!events.contains(event)) {
            events.add(event);
        }
    }

    @Override
    public List<PathEvent> findPathEvents(String repoId, String projectDir, String filePath) {
        return List.copyOf(eventsByPath.getOrDefault(pathKey(repoId, projectDir, filePath), List.of()));
    }

    // =========================================================================
    // Chunks
    // =========================================================================

    @Override
    public void upsertChunk(Chunk chunk) {
        chunks.put(chunk.getId(), chunk);
    }

    @Override
    public void deleteChunksForFileVersion(FileVersion fileVersion) {
        String versionId = fileVersion.getId();
        chunks.values().removeIf(chunk -> chunk.getFileVersionId().equals(versionId));
        definitionsByVersion.remove(versionId);
        referencesByVersion.remove(versionId);
    }

    @Override
    public List<Chunk> findChunksForFileVersion(String fileVersionId) {
        return chunks.values().stream()
                .filter(chunk -> chunk.getFileVersionId().equals(fileVersionId))
                .sorted(Comparator.comparingInt(Chunk::getOrdinal))
                .collect(Collectors.toList());
    }

    @Override
    public List<Chunk> findChunksByIds(Collection<String> chunkIds) {
        return chunkIds.stream()
                .distinct()
                .map(chunks::get)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
    }

    @Override
    public List<RetrievalCandidate> hybridQuery(String text, float[] vector, QueryScope scope, int k) {
        Set<String> queryTokens = LexicalTokens.tokenize(text);
        VisibilityCache visibility = new VisibilityCache(scope);
        List<RetrievalCandidate> candidates = new ArrayList<>();

        for (Chunk chunk : chunks.values()) {
            if (!visibility.isVisible(chunk.getFileVersionId())) {
                continue;
            }
            RetrievalCandidate candidate = HybridScoring.score(chunk, queryTokens, vector);
            if (candidate != null) {
                candidates.add(candidate);
            }
        }

        candidates.sort(HybridScoring.BEST_FIRST);
        return candidates.size() > k ? new ArrayList<>(candidates.subList(0, k)) : candidates;
    }

    // =========================================================================
    // Definitions and references
    // =========================================================================

    @Override
    public void saveDefinitions(List<ContentEntityDefinition> definitions) {
        for (ContentEntityDefinition definition : definitions) {
            List<ContentEntityDefinition> stored = definitionsByVersion.computeIfAbsent(
                    definition.getFileVersionId(), id -> new CopyOnWriteArrayList<>());
            if (stored.stream().noneMatch(existing -> existing.getId().equals(definition.getId()))) {
                stored.add(definition);
            }
        }
    }

    @Override
    public void saveReferences(List<ContentEntityReference> references) {
        for (ContentEntityReference reference : references) {
            List<ContentEntityReference> stored = referencesByVersion.computeIfAbsent(
                    reference.getFileVersionId(), id -> new CopyOnWriteArrayList<>());
            if (!stored.contains(reference)) {
                stored.add(reference);
            }
        }
    }

    @Override
    public List<ContentEntityDefinition> getByIdentifier(String identifier, QueryScope scope) {
        return definitionsByVersion.values().stream()
                .flatMap(List::stream)
                .filter(definition -> definition.getIdentifier().equals(identifier))
                .filter(definition -> scope.includes(definition.getRepoId()))
                .sorted(Comparator.comparing(ContentEntityDefinition::getId))
                .collect(Collectors.toList());
    }

    @Override
    public List<ContentEntityDefinition> findDefinitionsByChunkIds(Collection<String> chunkIds) {
        Set<String> wanted = new HashSet<>(chunkIds);
        return definitionsByVersion.values().stream()
                .flatMap(List::stream)
                .filter(definition -> definition.getChunkId() != null && wanted.contains(definition.getChunkId()))
                .sorted(Comparator.comparing(ContentEntityDefinition::getId))
                .collect(Collectors.toList());
    }

    @Override
    public List<ContentEntityReference> findReferencesByChunkIds(Collection<String> chunkIds) {
        Set<String> wanted = new HashSet<>(chunkIds);
        return referencesByVersion.values().stream()
                .flatMap(List::stream)
                .filter(reference -> reference.getChunkId() != null && wanted.contains(reference.getChunkId()))
                .sorted(REFERENCE_ORDER)
                .collect(Collectors.toList());
    }

    @Override
    public List<ContentEntityReference> findReferencesToIdentifier(String identifier, QueryScope scope) {
        return referencesByVersion.values().stream()
                .flatMap(List::stream)
                .filter(reference -> reference.getIdentifierUsed().equals(identifier))
                .filter(reference -> scope.includes(reference.getRepoId()))
                .sorted(REFERENCE_ORDER)
                .collect(Collectors.toList());
    }

    @Override
    public List<ContentEntityReference> findReexports(String exportedName, QueryScope scope) {
        return referencesByVersion.values().stream()
                .flatMap(List::stream)
                .filter(reference -> reference.getReferenceType() == ReferenceType.REEXPORT)
                .filter(reference -> reference.exportedName().equals(exportedName)
                        || "*".equals(reference.getIdentifierUsed()))
                .filter(reference -> scope.includes(reference.getRepoId()))
                .sorted(REFERENCE_ORDER)
                .collect(Collectors.toList());
    }

    private static final Comparator<ContentEntityReference> REFERENCE_ORDER = Comparator
            .comparing(ContentEntityReference::getFileVersionId)
            .thenComparingInt(ContentEntityReference::getLine)
            .thenComparing(ContentEntityReference::getIdentifierUsed);

    private static String pathKey(String repoId, String projectDir, String filePath) {
        return repoId + '\u0000' + (projectDir == null ? "" : projectDir) + '\u0000' + filePath;
    }

    /** Per-query memo of which file versions the scope can see. */
    private final class VisibilityCache {

        private final QueryScope scope;
        private final Map<String, Boolean> visible = new HashMap<>();

        private VisibilityCache(QueryScope scope) {
            this.scope = scope;
        }

        boolean isVisible(String fileVersionId) {
            return visible.computeIfAbsent(fileVersionId, id -> {
                FileVersion version = versions.get(id);
                if (version == null || !scope.includes(version.getRepoId())) {
                    return false;
                }
                return findVisibleFileVersion(version.getRepoId(), version.getProjectDir(), version.getFilePath(),
                        scope.asOf(version.getRepoId()))
                        .map(visibleVersion -> visibleVersion.getId().equals(id))
                        .orElse(false);
            });
        }
    }
}
