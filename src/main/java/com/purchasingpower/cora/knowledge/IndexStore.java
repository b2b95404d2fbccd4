package com.purchasingpower.cora.knowledge;

import com.purchasingpower.cora.model.index.Chunk;
import com.purchasingpower.cora.model.index.CommitFileVersion;
import com.purchasingpower.cora.model.index.ContentEntityDefinition;
import com.purchasingpower.cora.model.index.ContentEntityReference;
import com.purchasingpower.cora.model.index.FileVersion;
import com.purchasingpower.cora.model.index.PathEvent;
import com.purchasingpower.cora.model.index.RepositoryRef;
import com.purchasingpower.cora.model.retrieval.QueryScope;
import com.purchasingpower.cora.model.retrieval.RetrievalCandidate;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * The persistent index: the only place index state lives.
 *
 * <p>Writes for a file version are staged. Chunks, definitions and references of a new version
 * are written first and only {@link #publishFileVersion(FileVersion)} makes the version the
 * latest one for its path, so readers never observe a half-written version. Older versions and
 * their chunks are kept for pinned reads.
 *
 * <p>Implementations signal an unreachable backend with
 * {@link com.purchasingpower.cora.exception.StoreUnavailableException}.
 */
public interface IndexStore {

    // =========================================================================
    // Repositories
    // =========================================================================

    void saveRepository(RepositoryRef repository);

    Optional<RepositoryRef> findRepository(String repoId);

    /**
     * Move the repository's last indexed commit pointer.
     */
    void updateIndexState(String repoId, String commitHash, Instant indexedAt);

    // =========================================================================
    // File versions
    // =========================================================================

    /**
     * Store a version without making it visible as latest. Saving an existing version is a no-op.
     */
    void saveFileVersion(FileVersion fileVersion);

    /**
     * Make the version the latest for its path. A retired path becomes live again.
     */
    void publishFileVersion(FileVersion fileVersion);

    /**
     * Mark a deleted path: it has no latest version any more. Its versions stay stored.
     *
     * @return true when the path had a latest version
     */
    boolean retireFilePath(String repoId, String projectDir, String filePath);

    Optional<FileVersion> findFileVersion(String fileVersionId);

    Optional<FileVersion> findLatestFileVersion(String repoId, String projectDir, String filePath);

    /** Latest versions of every live path of the repository. */
    List<FileVersion> findLatestFileVersions(String repoId);

    /**
     * Version of the path a reader pinned at {@code asOf} sees: the version recorded at the
     * newest commit not after {@code asOf}, or for paths without commit provenance the version
     * of the newest {@link PathEvent} not after it. Empty when that event is a deletion. Paths
     * without either fall back to the newest version created not after {@code asOf}. A null
     * {@code asOf} means the latest published version.
     */
    Optional<FileVersion> findVisibleFileVersion(String repoId, String projectDir, String filePath, Instant asOf);

    // =========================================================================
    // Commit provenance
    // =========================================================================

    void saveCommitFileVersion(CommitFileVersion commitFileVersion);

    List<CommitFileVersion> findCommitFileVersions(String fileVersionId);

    /** Timestamp recorded for a commit of the repository, if any file was indexed at it. */
    Optional<Instant> findCommitTimestamp(String repoId, String commitHash);

    /**
     * Append a publication or deletion of a path. Recording the same event twice is a no-op.
     */
    void recordPathEvent(PathEvent event);

    /** Events of one path, oldest first. */
    List<PathEvent> findPathEvents(String repoId, String projectDir, String filePath);

    // =========================================================================
    // Chunks
    // =========================================================================

    void upsertChunk(Chunk chunk);

    /**
     * Remove the chunks, definitions and references of one version.
     */
    void deleteChunksForFileVersion(FileVersion fileVersion);

    /** Chunks of one version ordered by ordinal. */
    List<Chunk> findChunksForFileVersion(String fileVersionId);

    List<Chunk> findChunksByIds(Collection<String> chunkIds);

    /**
     * Combined vector-similarity and lexical search over the chunks visible in the scope.
     *
     * @param text   query text for the lexical part
     * @param vector query embedding, null for a lexical-only search
     * @param scope  repositories and versions to search
     * @param k      maximum number of results
     * @return candidates ordered by fused score, best first
     */
    List<RetrievalCandidate> hybridQuery(String text, float[] vector, QueryScope scope, int k);

    // =========================================================================
    // Definitions and references
    // =========================================================================

    /** Saving a definition again is a no-op. */
    void saveDefinitions(List<ContentEntityDefinition> definitions);

    /** Saving a reference again is a no-op. */
    void saveReferences(List<ContentEntityReference> references);

    /**
     * Definitions of an identifier in the scope's repositories, across all stored versions.
     * Callers decide which versions are visible.
     */
    List<ContentEntityDefinition> getByIdentifier(String identifier, QueryScope scope);

    List<ContentEntityDefinition> findDefinitionsByChunkIds(Collection<String> chunkIds);

    List<ContentEntityReference> findReferencesByChunkIds(Collection<String> chunkIds);

    /** References using an identifier in the scope's repositories, across all stored versions. */
    List<ContentEntityReference> findReferencesToIdentifier(String identifier, QueryScope scope);

    /**
     * Re-export references exposing {@code exportedName}, including wildcard re-exports.
     */
    List<ContentEntityReference> findReexports(String exportedName, QueryScope scope);
}
