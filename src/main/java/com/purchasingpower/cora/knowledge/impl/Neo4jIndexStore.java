package com.purchasingpower.cora.knowledge.impl;

import com.purchasingpower.cora.configuration.AppProperties;
import com.purchasingpower.cora.configuration.StoreProperties;
import com.purchasingpower.cora.exception.StoreUnavailableException;
import com.purchasingpower.cora.knowledge.IndexStore;
import com.purchasingpower.cora.model.CallContext;
import com.purchasingpower.cora.model.ServiceType;
import com.purchasingpower.cora.model.index.Chunk;
import com.purchasingpower.cora.model.index.CommitFileVersion;
import com.purchasingpower.cora.model.index.ContentEntityDefinition;
import com.purchasingpower.cora.model.index.ContentEntityReference;
import com.purchasingpower.cora.model.index.EntityType;
import com.purchasingpower.cora.model.index.FileVersion;
import com.purchasingpower.cora.model.index.PathEvent;
import com.purchasingpower.cora.model.index.ReferenceType;
import com.purchasingpower.cora.model.index.RepositoryRef;
import com.purchasingpower.cora.model.retrieval.QueryScope;
import com.purchasingpower.cora.model.retrieval.RetrievalCandidate;
import com.purchasingpower.cora.util.ExternalCallLogger;
import com.purchasingpower.cora.util.LexicalTokens;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.Session;
import org.neo4j.driver.TransactionContext;
import org.neo4j.driver.Value;
import org.neo4j.driver.exceptions.ServiceUnavailableException;
import org.neo4j.driver.exceptions.SessionExpiredException;
import org.neo4j.driver.exceptions.TransientException;
import org.neo4j.driver.types.Node;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Index store backed by Neo4j. Used when {@code app.store.type=neo4j}.
 *
 * <p>Graph layout:
 * <pre>
 * (:Repository {id})
 * (:FileVersion {id, repoId, projectDir, filePath, latest})
 * (:CommitFileVersion {fileVersionId, commitHash, timestamp})
 * (:PathEvent {repoId, projectDir, filePath, fileVersionId, commitHash, timestamp, recordedAt})
 * (:Chunk {id, fileVersionId, embedding, searchTokens})
 * (:Definition {id, identifier, chunkId}), (:Reference {identifierUsed, chunkId})
 * </pre>
 *
 * <p>Candidates come from the {@code chunk_embedding_index} vector index and the
 * {@code chunk_text_index} full-text index; they are scored by {@link HybridScoring} so rankings
 * match the in-memory store.
 *
 * @since 0.1.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.store.type", havingValue = "neo4j")
public class Neo4jIndexStore implements IndexStore {

    private static final int CANDIDATE_FETCH_FACTOR = 5;
    private static final int MIN_CANDIDATE_FETCH = 50;

    private final AppProperties appProperties;

    private Driver driver;

    @PostConstruct
    public void init() {
        StoreProperties store = appProperties.getStore();
        log.info("🟢 Initializing Neo4j index store at: {}", store.getUri());
        driver = GraphDatabase.driver(store.getUri(), AuthTokens.basic(store.getUsername(), store.getPassword()));
        createIndexes(store.getEmbeddingDimensions());
    }

    @PreDestroy
    public void close() {
        if (driver != null) {
            driver.close();
            log.info("Neo4j index store connection closed");
        }
    }

    private void createIndexes(int dimensions) {
        try (Session session = driver.session()) {
            session.run("CREATE INDEX repository_id IF NOT EXISTS FOR (r:Repository) ON (r.id)");
            session.run("CREATE INDEX file_version_id IF NOT EXISTS FOR (f:FileVersion) ON (f.id)");
            session.run("CREATE INDEX file_version_path IF NOT EXISTS FOR (f:FileVersion) ON (f.repoId, f.filePath)");
            session.run("CREATE INDEX commit_file_version IF NOT EXISTS FOR (c:CommitFileVersion) ON (c.fileVersionId)");
            session.run("CREATE INDEX commit_hash IF NOT EXISTS FOR (c:CommitFileVersion) ON (c.repoId, c.commitHash)");
            session.run("CREATE INDEX path_event_path IF NOT EXISTS FOR (e:PathEvent) ON (e.repoId, e.filePath)");
            session.run("CREATE INDEX chunk_id IF NOT EXISTS FOR (c:Chunk) ON (c.id)");
            session.run("CREATE INDEX chunk_file_version IF NOT EXISTS FOR (c:Chunk) ON (c.fileVersionId)");
            session.run("CREATE INDEX definition_identifier IF NOT EXISTS FOR (d:Definition) ON (d.identifier)");
            session.run("CREATE INDEX definition_chunk IF NOT EXISTS FOR (d:Definition) ON (d.chunkId)");
            session.run("CREATE INDEX reference_identifier IF NOT EXISTS FOR (r:Reference) ON (r.identifierUsed)");
            session.run("CREATE INDEX reference_chunk IF NOT EXISTS FOR (r:Reference) ON (r.chunkId)");
            log.info("✅ Neo4j property indexes created");

            session.run("""
                CREATE VECTOR INDEX chunk_embedding_index IF NOT EXISTS
                FOR (c:Chunk) ON (c.embedding)
                OPTIONS {indexConfig: {
                  `vector.dimensions`: %d,
                  `vector.similarity_function`: 'cosine'
                }}
                """.formatted(dimensions));
            session.run("CREATE FULLTEXT INDEX chunk_text_index IF NOT EXISTS FOR (c:Chunk) ON EACH [c.searchTokens]");
            log.info("✅ Created search indexes: chunk_embedding_index, chunk_text_index");

        } catch (RuntimeException e) {
            log.warn("⚠️  Failed to create indexes (may require Neo4j 5.x+): {}", e.getMessage());
        }
    }

    // =========================================================================
    // Repositories
    // =========================================================================

    @Override
    public void saveRepository(RepositoryRef repository) {
        String cypher = """
            MERGE (r:Repository {id: $id})
            SET r.originUri = $originUri,
                r.checkoutPath = $checkoutPath,
                r.projectDir = $projectDir,
                r.lastIndexedCommit = coalesce($lastIndexedCommit, r.lastIndexedCommit),
                r.lastIndexedAt = coalesce($lastIndexedAt, r.lastIndexedAt)
            """;
        write("saveRepository", tx -> tx.run(cypher, createParams(
                "id", repository.getRepoId(),
                "originUri", repository.getOriginUri(),
                "checkoutPath", repository.getCheckoutPath(),
                "projectDir", repository.getProjectDir(),
                "lastIndexedCommit", repository.getLastIndexedCommit(),
                "lastIndexedAt", instantString(repository.getLastIndexedAt()))).consume());
    }

    @Override
    public Optional<RepositoryRef> findRepository(String repoId) {
        return read("findRepository", tx -> tx.run("MATCH (r:Repository {id: $id}) RETURN r",
                        createParams("id", repoId)).stream()
                .map(record -> nodeToRepository(record.get("r").asNode()))
                .findFirst());
    }

    @Override
    public void updateIndexState(String repoId, String commitHash, Instant indexedAt) {
        write("updateIndexState", tx -> tx.run("""
                MATCH (r:Repository {id: $id})
                SET r.lastIndexedCommit = $commit, r.lastIndexedAt = $at
                """, createParams("id", repoId, "commit", commitHash, "at", instantString(indexedAt))).consume());
    }

    // =========================================================================
    // File versions
    // =========================================================================

    @Override
    public void saveFileVersion(FileVersion fileVersion) {
        write("saveFileVersion", tx -> mergeFileVersion(tx, fileVersion));
    }

    @Override
    public void publishFileVersion(FileVersion fileVersion) {
        write("publishFileVersion", tx -> {
            mergeFileVersion(tx, fileVersion);
            tx.run("""
                MATCH (f:FileVersion {repoId: $repoId, projectDir: $projectDir, filePath: $filePath})
                SET f.latest = (f.id = $id)
                """, createParams(
                    "repoId", fileVersion.getRepoId(),
                    "projectDir", nullToEmpty(fileVersion.getProjectDir()),
                    "filePath", fileVersion.getFilePath(),
                    "id", fileVersion.getId())).consume();
            return null;
        });
    }

    private Object mergeFileVersion(TransactionContext tx, FileVersion fileVersion) {
        String cypher = """
            MERGE (f:FileVersion {id: $id})
            ON CREATE SET f.repoId = $repoId,
                          f.projectDir = $projectDir,
                          f.filePath = $filePath,
                          f.contentHash = $contentHash,
                          f.language = $language,
                          f.lineCount = $lineCount,
                          f.createdAt = $createdAt,
                          f.latest = false
            """;
        return tx.run(cypher, createParams(
                "id", fileVersion.getId(),
                "repoId", fileVersion.getRepoId(),
                "projectDir", nullToEmpty(fileVersion.getProjectDir()),
                "filePath", fileVersion.getFilePath(),
                "contentHash", fileVersion.getContentHash(),
                "language", fileVersion.getLanguage(),
                "lineCount", fileVersion.getLineCount(),
                "createdAt", instantString(fileVersion.getCreatedAt()))).consume();
    }

    @Override
    public boolean retireFilePath(String repoId, String projectDir, String filePath) {
        return write("retireFilePath", tx -> tx.run("""
                MATCH (f:FileVersion {repoId: $repoId, projectDir: $projectDir, filePath: $filePath, latest: true})
                SET f.latest = false
                RETURN count(f) AS retired
                """, createParams("repoId", repoId, "projectDir", nullToEmpty(projectDir), "filePath", filePath))
                .single().get("retired").asLong() > 0);
    }

    @Override
    public Optional<FileVersion> findFileVersion(String fileVersionId) {
        return read("findFileVersion", tx -> tx.run("MATCH (f:FileVersion {id: $id}) RETURN f",
                        createParams("id", fileVersionId)).stream()
                .map(record -> nodeToFileVersion(record.get("f").asNode()))
                .findFirst());
    }

    @Override
    public Optional<FileVersion> findLatestFileVersion(String repoId, String projectDir, String filePath) {
        return read("findLatestFileVersion", tx -> tx.run("""
                        MATCH (f:FileVersion {repoId: $repoId, projectDir: $projectDir, filePath: $filePath, latest: true})
                        RETURN f
                        """, createParams("repoId", repoId, "projectDir", nullToEmpty(projectDir), "filePath", filePath))
                .stream()
                .map(record -> nodeToFileVersion(record.get("f").asNode()))
                .findFirst());
    }

    @Override
    public List<FileVersion> findLatestFileVersions(String repoId) {
        return read("findLatestFileVersions", tx -> tx.run("""
                        MATCH (f:FileVersion {repoId: $repoId, latest: true})
                        RETURN f ORDER BY f.filePath
                        """, createParams("repoId", repoId)).stream()
                .map(record -> nodeToFileVersion(record.get("f").asNode()))
                .collect(Collectors.toList()));
    }

    @Override
    public Optional<FileVersion> findVisibleFileVersion(String repoId, String projectDir, String filePath,
                                                        Instant asOf) {
        if (asOf == null) {
            return findLatestFileVersion(repoId, projectDir, filePath);
        }
        return read("findVisibleFileVersion", tx -> {
            List<FileVersion> history = tx.run("""
                            MATCH (f:FileVersion {repoId: $repoId, projectDir: $projectDir, filePath: $filePath})
                            RETURN f
                            """, createParams("repoId", repoId, "projectDir", nullToEmpty(projectDir), "filePath", filePath))
                    .stream()
                    .map(record -> nodeToFileVersion(record.get("f").asNode()))
                    .collect(Collectors.toList());
            Map<String, List<CommitFileVersion>> rows = commitRows(tx, history);
            return VersionVisibility.visibleAt(history, id -> rows.getOrDefault(id, List.of()),
                    pathEvents(tx, repoId, projectDir, filePath), asOf);
        });
    }

    // =========================================================================
    // Commit provenance
    // =========================================================================

    @Override
    public void saveCommitFileVersion(CommitFileVersion row) {
        write("saveCommitFileVersion", tx -> tx.run("""
                MERGE (c:CommitFileVersion {fileVersionId: $fileVersionId, commitHash: $commitHash})
                ON CREATE SET c.repoId = $repoId, c.filePath = $filePath, c.timestamp = $timestamp
                """, createParams(
                "fileVersionId", row.fileVersionId(),
                "commitHash", row.commitHash(),
                "repoId", row.repoId(),
                "filePath", row.filePath(),
                "timestamp", instantString(row.timestamp()))).consume());
    }

    @Override
    public List<CommitFileVersion> findCommitFileVersions(String fileVersionId) {
        return read("findCommitFileVersions", tx -> tx.run("""
                        MATCH (c:CommitFileVersion {fileVersionId: $id})
                        RETURN c ORDER BY c.timestamp
                        """, createParams("id", fileVersionId)).stream()
                .map(record -> nodeToCommitRow(record.get("c").asNode()))
                .collect(Collectors.toList()));
    }

    @Override
    public Optional<Instant> findCommitTimestamp(String repoId, String commitHash) {
        return read("findCommitTimestamp", tx -> tx.run("""
                        MATCH (c:CommitFileVersion {repoId: $repoId, commitHash: $commitHash})
                        RETURN c.timestamp AS timestamp LIMIT 1
                        """, createParams("repoId", repoId, "commitHash", commitHash)).stream()
                .map(record -> Instant.parse(record.get("timestamp").asString()))
                .findFirst());
    }

    /**
     * Absent version ids and commits are stored as empty strings so the event can be merged on
     * all of its fields.
     */
    @Override
    public void recordPathEvent(PathEvent event) {
        write("recordPathEvent", tx -> tx.run("""
                MERGE (e:PathEvent {repoId: $repoId, projectDir: $projectDir, filePath: $filePath,
                                    fileVersionId: $fileVersionId, commitHash: $commitHash, timestamp: $timestamp})
                ON CREATE SET e.recordedAt = $recordedAt
                """, createParams(
                "repoId", event.repoId(),
                "projectDir", nullToEmpty(event.projectDir()),
                "filePath", event.filePath(),
                "fileVersionId", nullToEmpty(event.fileVersionId()),
                "commitHash", nullToEmpty(event.commitHash()),
                "timestamp", instantString(event.timestamp()),
                "recordedAt", System.currentTimeMillis())).consume());
    }

    @Override
    public List<PathEvent> findPathEvents(String repoId, String projectDir, String filePath) {
        return read("findPathEvents", tx -> pathEvents(tx, repoId, projectDir, filePath));
    }

    private List<PathEvent> pathEvents(TransactionContext tx, String repoId, String projectDir, String filePath) {
        return tx.run("""
                        MATCH (e:PathEvent {repoId: $repoId, projectDir: $projectDir, filePath: $filePath})
                        RETURN e ORDER BY e.recordedAt, e.timestamp
                        """, createParams("repoId", repoId, "projectDir", nullToEmpty(projectDir), "filePath", filePath))
                .stream()
                .map(record -> nodeToPathEvent(record.get("e").asNode()))
                .collect(Collectors.toList());
    }

    private Map<String, List<CommitFileVersion>> commitRows(TransactionContext tx, Collection<FileVersion> versions) {
        List<String> ids = versions.stream().map(FileVersion::getId).collect(Collectors.toList());
        return tx.run("MATCH (c:CommitFileVersion) WHERE c.fileVersionId IN $ids RETURN c",
                        createParams("ids", ids)).stream()
                .map(record -> nodeToCommitRow(record.get("c").asNode()))
                .collect(Collectors.groupingBy(CommitFileVersion::fileVersionId));
    }

    // =========================================================================
    // Chunks
    // =========================================================================

    @Override
    public void upsertChunk(Chunk chunk) {
        String cypher = """
            MERGE (c:Chunk {id: $id})
            SET c.fileVersionId = $fileVersionId,
                c.repoId = $repoId,
                c.filePath = $filePath,
                c.ordinal = $ordinal,
                c.content = $content,
                c.commentary = $commentary,
                c.lineStart = $lineStart,
                c.lineEnd = $lineEnd,
                c.language = $language,
                c.declarationType = $declarationType,
                c.referenceSymbols = $referenceSymbols,
                c.referenceChunks = $referenceChunks,
                c.searchTokens = $searchTokens,
                c.embedding = $embedding
            """;
        String searchable = chunk.getCommentary() == null
                ? chunk.getContent() : chunk.getContent() + "\n" + chunk.getCommentary();
        write("upsertChunk", tx -> tx.run(cypher, createParams(
                "id", chunk.getId(),
                "fileVersionId", chunk.getFileVersionId(),
                "repoId", chunk.getRepoId(),
                "filePath", chunk.getFilePath(),
                "ordinal", chunk.getOrdinal(),
                "content", chunk.getContent(),
                "commentary", chunk.getCommentary(),
                "lineStart", chunk.getLineStart(),
                "lineEnd", chunk.getLineEnd(),
                "language", chunk.getLanguage(),
                "declarationType", chunk.getDeclarationType(),
                "referenceSymbols", chunk.getReferenceSymbols(),
                "referenceChunks", chunk.getReferenceChunks(),
                "searchTokens", String.join(" ", LexicalTokens.tokenize(searchable)),
                "embedding", toList(chunk.getEmbedding()))).consume());
    }

    @Override
    public void deleteChunksForFileVersion(FileVersion fileVersion) {
        write("deleteChunksForFileVersion", tx -> {
            Map<String, Object> params = createParams("id", fileVersion.getId());
            tx.run("MATCH (c:Chunk {fileVersionId: $id}) DETACH DELETE c", params).consume();
            tx.run("MATCH (d:Definition {fileVersionId: $id}) DETACH DELETE d", params).consume();
            tx.run("MATCH (r:Reference {fileVersionId: $id}) DETACH DELETE r", params).consume();
            return null;
        });
    }

    @Override
    public List<Chunk> findChunksForFileVersion(String fileVersionId) {
        return read("findChunksForFileVersion", tx -> tx.run("""
                        MATCH (c:Chunk {fileVersionId: $id})
                        RETURN c ORDER BY c.ordinal
                        """, createParams("id", fileVersionId)).stream()
                .map(record -> nodeToChunk(record.get("c").asNode()))
                .collect(Collectors.toList()));
    }

    @Override
    public List<Chunk> findChunksByIds(Collection<String> chunkIds) {
        if (chunkIds.isEmpty()) {
            return List.of();
        }
        List<String> ids = chunkIds.stream().distinct().collect(Collectors.toList());
        Map<String, Chunk> byId = read("findChunksByIds", tx -> tx.run(
                        "MATCH (c:Chunk) WHERE c.id IN $ids RETURN c", createParams("ids", ids)).stream()
                .map(record -> nodeToChunk(record.get("c").asNode()))
                .collect(Collectors.toMap(Chunk::getId, Function.identity())));
        return ids.stream().map(byId::get).filter(chunk -> chunk != null).collect(Collectors.toList());
    }

    @Override
    public List<RetrievalCandidate> hybridQuery(String text, float[] vector, QueryScope scope, int k) {
        Set<String> queryTokens = LexicalTokens.tokenize(text);
        int fetch = Math.max(k * CANDIDATE_FETCH_FACTOR, MIN_CANDIDATE_FETCH);

        CallContext call = ExternalCallLogger.startCall(ServiceType.INDEX_STORE, "hybridQuery", log);
        call.logRequest("Hybrid query", "Tokens", queryTokens.size(), "Vector", vector != null, "K", k);
        try {
            List<RetrievalCandidate> candidates = read("hybridQuery", tx -> {
                List<String> visible = visibleVersionIds(tx, scope);
                Map<String, Chunk> pool = new LinkedHashMap<>();
                if (vector != null) {
                    tx.run("""
                            CALL db.index.vector.queryNodes('chunk_embedding_index', $limit, $queryEmbedding)
                            YIELD node, score
                            WHERE node.fileVersionId IN $visible
                            RETURN node
                            """, createParams("limit", fetch, "queryEmbedding", toList(vector), "visible", visible))
                            .stream()
                            .map(record -> nodeToChunk(record.get("node").asNode()))
                            .forEach(chunk -> pool.putIfAbsent(chunk.getId(), chunk));
                }
                if (!queryTokens.isEmpty()) {
                    tx.run("""
                            CALL db.index.fulltext.queryNodes('chunk_text_index', $query)
                            YIELD node, score
                            WHERE node.fileVersionId IN $visible
                            RETURN node LIMIT $limit
                            """, createParams("query", String.join(" OR ", queryTokens), "visible", visible,
                                    "limit", fetch))
                            .stream()
                            .map(record -> nodeToChunk(record.get("node").asNode()))
                            .forEach(chunk -> pool.putIfAbsent(chunk.getId(), chunk));
                }
                List<RetrievalCandidate> scored = new ArrayList<>();
                for (Chunk chunk : pool.values()) {
                    RetrievalCandidate candidate = HybridScoring.score(chunk, queryTokens, vector);
                    if (candidate != null) {
                        scored.add(candidate);
                    }
                }
                return scored;
            });
            candidates.sort(HybridScoring.BEST_FIRST);
            List<RetrievalCandidate> top = candidates.size() > k ? new ArrayList<>(candidates.subList(0, k)) : candidates;
            call.logResponse("Hybrid query complete", "Candidates", top.size());
            return top;
        } catch (RuntimeException e) {
            call.logError("Hybrid query failed", e);
            throw e;
        }
    }

    private List<String> visibleVersionIds(TransactionContext tx, QueryScope scope) {
        List<String> repoIds = scope.getRepoIds().isEmpty()
                ? tx.run("MATCH (f:FileVersion) RETURN DISTINCT f.repoId AS repoId").stream()
                        .map(record -> record.get("repoId").asString())
                        .collect(Collectors.toList())
                : scope.getRepoIds();

        List<String> visible = new ArrayList<>();
        for (String repoId : repoIds) {
            Instant asOf = scope.asOf(repoId);
            if (asOf == null) {
                tx.run("MATCH (f:FileVersion {repoId: $repoId, latest: true}) RETURN f.id AS id",
                                createParams("repoId", repoId)).stream()
                        .map(record -> record.get("id").asString())
                        .forEach(visible::add);
                continue;
            }
            List<FileVersion> history = tx.run("MATCH (f:FileVersion {repoId: $repoId}) RETURN f",
                            createParams("repoId", repoId)).stream()
                    .map(record -> nodeToFileVersion(record.get("f").asNode()))
                    .collect(Collectors.toList());
            Map<String, List<CommitFileVersion>> rows = commitRows(tx, history);
            history.stream()
                    .collect(Collectors.groupingBy(version -> version.getProjectDir() + '\u0000' + version.getFilePath()))
                    .values()
                    .forEach(pathHistory -> {
                        FileVersion any = pathHistory.get(0);
                        List<PathEvent> events = pathEvents(tx, repoId, any.getProjectDir(), any.getFilePath());
                        VersionVisibility.visibleAt(pathHistory, id -> rows.getOrDefault(id, List.of()), events, asOf)
                                .ifPresent(version -> visible.add(version.getId()));
                    });
        }
        return visible;
    }

    // =========================================================================
    // Definitions and references
    // =========================================================================

    @Override
    public void saveDefinitions(List<ContentEntityDefinition> definitions) {
        if (definitions.isEmpty()) {
            return;
        }
        List<Map<String, Object>> rows = definitions.stream()
                .map(definition -> createParams(
                        "id", definition.getId(),
                        "identifier", definition.getIdentifier(),
                        "entityType", definition.getEntityType().name(),
                        "repoId", definition.getRepoId(),
                        "filePath", definition.getFilePath(),
                        "fileVersionId", definition.getFileVersionId(),
                        "lineStart", definition.getLineStart(),
                        "lineEnd", definition.getLineEnd(),
                        "chunkId", definition.getChunkId()))
                .collect(Collectors.toList());
        write("saveDefinitions", tx -> tx.run("""
                UNWIND $rows AS row
                MERGE (d:Definition {id: row.id})
                SET d += row
                """, createParams("rows", rows)).consume());
    }

    @Override
    public void saveReferences(List<ContentEntityReference> references) {
        if (references.isEmpty()) {
            return;
        }
        List<Map<String, Object>> rows = references.stream()
                .map(reference -> createParams(
                        "identifierUsed", reference.getIdentifierUsed(),
                        "referenceType", reference.getReferenceType().name(),
                        "importPath", reference.getImportPath(),
                        "alias", reference.getAlias(),
                        "repoId", reference.getRepoId(),
                        "filePath", reference.getFilePath(),
                        "fileVersionId", reference.getFileVersionId(),
                        "line", reference.getLine(),
                        "chunkId", reference.getChunkId()))
                .collect(Collectors.toList());
        write("saveReferences", tx -> tx.run("""
                UNWIND $rows AS row
                MERGE (r:Reference {fileVersionId: row.fileVersionId, identifierUsed: row.identifierUsed,
                                    referenceType: row.referenceType, line: row.line})
                SET r += row
                """, createParams("rows", rows)).consume());
    }

    @Override
    public List<ContentEntityDefinition> getByIdentifier(String identifier, QueryScope scope) {
        return read("getByIdentifier", tx -> tx.run("""
                        MATCH (d:Definition {identifier: $identifier})
                        WHERE size($repoIds) = 0 OR d.repoId IN $repoIds
                        RETURN d ORDER BY d.id
                        """, createParams("identifier", identifier, "repoIds", scope.getRepoIds())).stream()
                .map(record -> nodeToDefinition(record.get("d").asNode()))
                .collect(Collectors.toList()));
    }

    @Override
    public List<ContentEntityDefinition> findDefinitionsByChunkIds(Collection<String> chunkIds) {
        return read("findDefinitionsByChunkIds", tx -> tx.run("""
                        MATCH (d:Definition) WHERE d.chunkId IN $ids
                        RETURN d ORDER BY d.id
                        """, createParams("ids", List.copyOf(chunkIds))).stream()
                .map(record -> nodeToDefinition(record.get("d").asNode()))
                .collect(Collectors.toList()));
    }

    @Override
    public List<ContentEntityReference> findReferencesByChunkIds(Collection<String> chunkIds) {
        return read("findReferencesByChunkIds", tx -> tx.run("""
                        MATCH (r:Reference) WHERE r.chunkId IN $ids
                        RETURN r ORDER BY r.fileVersionId, r.line, r.identifierUsed
                        """, createParams("ids", List.copyOf(chunkIds))).stream()
                .map(record -> nodeToReference(record.get("r").asNode()))
                .collect(Collectors.toList()));
    }

    @Override
    public List<ContentEntityReference> findReferencesToIdentifier(String identifier, QueryScope scope) {
        return read("findReferencesToIdentifier", tx -> tx.run("""
                        MATCH (r:Reference {identifierUsed: $identifier})
                        WHERE size($repoIds) = 0 OR r.repoId IN $repoIds
                        RETURN r ORDER BY r.fileVersionId, r.line, r.identifierUsed
                        """, createParams("identifier", identifier, "repoIds", scope.getRepoIds())).stream()
                .map(record -> nodeToReference(record.get("r").asNode()))
                .collect(Collectors.toList()));
    }

    @Override
    public List<ContentEntityReference> findReexports(String exportedName, QueryScope scope) {
        return read("findReexports", tx -> tx.run("""
                        MATCH (r:Reference {referenceType: 'REEXPORT'})
                        WHERE (size($repoIds) = 0 OR r.repoId IN $repoIds)
                          AND (r.identifierUsed = '*' OR coalesce(r.alias, r.identifierUsed) = $name)
                        RETURN r ORDER BY r.fileVersionId, r.line, r.identifierUsed
                        """, createParams("name", exportedName, "repoIds", scope.getRepoIds())).stream()
                .map(record -> nodeToReference(record.get("r").asNode()))
                .filter(reference -> "*".equals(reference.getIdentifierUsed())
                        || reference.exportedName().equals(exportedName))
                .collect(Collectors.toList()));
    }

    // =========================================================================
    // Sessions and mapping
    // =========================================================================

    private <T> T read(String operation, Function<TransactionContext, T> work) {
        try (Session session = driver.session()) {
            return session.executeRead(work::apply);
        } catch (ServiceUnavailableException | SessionExpiredException | TransientException e) {
            throw new StoreUnavailableException(operation, e);
        }
    }

    private <T> T write(String operation, Function<TransactionContext, T> work) {
        try (Session session = driver.session()) {
            return session.executeWrite(work::apply);
        } catch (ServiceUnavailableException | SessionExpiredException | TransientException e) {
            throw new StoreUnavailableException(operation, e);
        }
    }

    /**
     * Builds a parameter map that accepts nulls; Map.of rejects them. A null removes the property
     * it is assigned to.
     */
    private static Map<String, Object> createParams(Object... keyValues) {
        Map<String, Object> params = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            params.put((String) keyValues[i], keyValues[i + 1]);
        }
        return params;
    }

    private static RepositoryRef nodeToRepository(Node node) {
        return RepositoryRef.builder()
                .repoId(node.get("id").asString())
                .originUri(string(node, "originUri"))
                .checkoutPath(string(node, "checkoutPath"))
                .projectDir(nullToEmpty(string(node, "projectDir")))
                .lastIndexedCommit(string(node, "lastIndexedCommit"))
                .lastIndexedAt(instant(node, "lastIndexedAt"))
                .build();
    }

    private static FileVersion nodeToFileVersion(Node node) {
        return FileVersion.builder()
                .repoId(node.get("repoId").asString())
                .projectDir(nullToEmpty(string(node, "projectDir")))
                .filePath(node.get("filePath").asString())
                .contentHash(node.get("contentHash").asString())
                .language(string(node, "language"))
                .lineCount(node.get("lineCount").asInt())
                .createdAt(instant(node, "createdAt"))
                .build();
    }

    private static CommitFileVersion nodeToCommitRow(Node node) {
        return new CommitFileVersion(
                node.get("fileVersionId").asString(),
                node.get("repoId").asString(),
                node.get("filePath").asString(),
                node.get("commitHash").asString(),
                instant(node, "timestamp"));
    }

    private static PathEvent nodeToPathEvent(Node node) {
        return new PathEvent(
                node.get("repoId").asString(),
                nullToEmpty(string(node, "projectDir")),
                node.get("filePath").asString(),
                emptyToNull(string(node, "fileVersionId")),
                emptyToNull(string(node, "commitHash")),
                instant(node, "timestamp"));
    }

    private static Chunk nodeToChunk(Node node) {
        return Chunk.builder()
                .id(node.get("id").asString())
                .fileVersionId(node.get("fileVersionId").asString())
                .repoId(node.get("repoId").asString())
                .filePath(node.get("filePath").asString())
                .ordinal(node.get("ordinal").asInt())
                .content(node.get("content").asString())
                .commentary(string(node, "commentary"))
                .lineStart(node.get("lineStart").asInt())
                .lineEnd(node.get("lineEnd").asInt())
                .language(string(node, "language"))
                .declarationType(string(node, "declarationType"))
                .referenceSymbols(strings(node, "referenceSymbols"))
                .referenceChunks(strings(node, "referenceChunks"))
                .embedding(floats(node.get("embedding")))
                .build();
    }

    private static ContentEntityDefinition nodeToDefinition(Node node) {
        return ContentEntityDefinition.builder()
                .identifier(node.get("identifier").asString())
                .entityType(EntityType.valueOf(node.get("entityType").asString()))
                .repoId(node.get("repoId").asString())
                .filePath(node.get("filePath").asString())
                .fileVersionId(node.get("fileVersionId").asString())
                .lineStart(node.get("lineStart").asInt())
                .lineEnd(node.get("lineEnd").asInt())
                .chunkId(string(node, "chunkId"))
                .build();
    }

    private static ContentEntityReference nodeToReference(Node node) {
        return ContentEntityReference.builder()
                .identifierUsed(node.get("identifierUsed").asString())
                .referenceType(ReferenceType.valueOf(node.get("referenceType").asString()))
                .importPath(string(node, "importPath"))
                .alias(string(node, "alias"))
                .repoId(node.get("repoId").asString())
                .filePath(node.get("filePath").asString())
                .fileVersionId(node.get("fileVersionId").asString())
                .line(node.get("line").asInt())
                .chunkId(string(node, "chunkId"))
                .build();
    }

    private static String string(Node node, String key) {
        Value value = node.get(key);
        return value.isNull() ? null : value.asString();
    }

    private static List<String> strings(Node node, String key) {
        Value value = node.get(key);
        return value.isNull() ? List.of() : value.asList(Value::asString);
    }

    private static Instant instant(Node node, String key) {
        String text = string(node, key);
        return text == null ? null : Instant.parse(text);
    }

    private static String instantString(Instant instant) {
        return instant == null ? null : instant.toString();
    }

    private static String nullToEmpty(String text) {
        return text == null ? "" : text;
    }

    private static String emptyToNull(String text) {
        return text == null || text.isEmpty() ? null : text;
    }

    private static float[] floats(Value value) {
        if (value.isNull()) {
            return null;
        }
        List<Double> values = value.asList(Value::asDouble);
        float[] vector = new float[values.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = values.get(i).floatValue();
        }
        return vector;
    }

    private static List<Double> toList(float[] vector) {
        if (vector == null) {
            return null;
        }
        List<Double> values = new ArrayList<>(vector.length);
        for (float component : vector) {
            values.add((double) component);
        }
        return values;
    }
}
