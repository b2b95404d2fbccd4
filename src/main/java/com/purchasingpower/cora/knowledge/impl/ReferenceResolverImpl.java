package com.purchasingpower.cora.knowledge.impl;

import com.purchasingpower.cora.knowledge.IndexStore;
import com.purchasingpower.cora.knowledge.ReferenceGraph;
import com.purchasingpower.cora.knowledge.ReferenceResolver;
import com.purchasingpower.cora.knowledge.ResolutionConstraints;
import com.purchasingpower.cora.knowledge.ResolvedDefinition;
import com.purchasingpower.cora.model.index.ContentEntityDefinition;
import com.purchasingpower.cora.model.index.ContentEntityReference;
import com.purchasingpower.cora.model.index.FileVersion;
import com.purchasingpower.cora.model.retrieval.QueryScope;
import com.purchasingpower.cora.util.ImportPaths;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class ReferenceResolverImpl implements ReferenceResolver {

    private static final Comparator<ResolvedDefinition> CANDIDATE_ORDER = Comparator
            .comparingInt(ResolvedDefinition::getVersionDistance)
            .thenComparingInt(ResolvedDefinition::getPathDistance)
            .thenComparing(resolved -> resolved.getDefinition().getId());

    private final IndexStore indexStore;

    @Override
    public List<ResolvedDefinition> resolve(String identifierUsed, ResolutionConstraints constraints) {
        return new Resolution(constraints.getScope()).resolve(identifierUsed, constraints, true);
    }

    @Override
    public List<ResolvedDefinition> resolve(ContentEntityReference reference, QueryScope scope) {
        Resolution resolution = new Resolution(scope);
        return resolution.resolve(reference.getIdentifierUsed(), resolution.constraintsFor(reference), true);
    }

    @Override
    public Optional<String> resolveToChunk(ContentEntityReference reference, QueryScope scope) {
        return new Resolution(scope).topChunk(reference);
    }

    @Override
    public ReferenceGraph buildGraph(Collection<String> chunkIds, QueryScope scope) {
        Resolution resolution = new Resolution(scope);
        ReferenceGraph graph = new ReferenceGraph();
        Set<String> seeds = new LinkedHashSet<>(chunkIds);
        if (seeds.isEmpty()) {
            return graph;
        }

        for (ContentEntityReference reference : indexStore.findReferencesByChunkIds(seeds)) {
            resolution.topChunk(reference).ifPresent(target -> graph.addEdge(reference.getChunkId(), target));
        }

        for (ContentEntityDefinition definition : indexStore.findDefinitionsByChunkIds(seeds)) {
            for (ContentEntityReference reference : resolution.referencesTo(definition.getIdentifier())) {
                if (reference.getChunkId() == null || reference.getChunkId().equals(definition.getChunkId())
                        || !resolution.isVisible(reference.getFileVersionId())) {
                    continue;
                }
                resolution.topChunk(reference)
                        .filter(target -> target.equals(definition.getChunkId()))
                        .ifPresent(target -> graph.addEdge(reference.getChunkId(), target));
            }
        }

        log.debug("Reference graph over {} seed chunks: {} nodes, {} edges", seeds.size(), graph.nodes().size(),
                graph.edgeCount());
        return graph;
    }

    /**
     * Working state of one resolution request: memoizes version visibility and lookups so a graph
     * build touches the store once per file version and identifier.
     */
    private final class Resolution {

        private final QueryScope scope;
        private final Map<String, Optional<FileVersion>> versions = new HashMap<>();
        private final Map<String, Boolean> visibility = new HashMap<>();
        private final Map<String, List<ContentEntityDefinition>> definitionsByIdentifier = new HashMap<>();
        private final Map<String, List<ContentEntityReference>> referencesByIdentifier = new HashMap<>();
        private final Map<String, Optional<String>> topChunks = new HashMap<>();

        private Resolution(QueryScope scope) {
            this.scope = scope;
        }

        List<ResolvedDefinition> resolve(String identifier, ResolutionConstraints constraints,
                                         boolean followReexports) {
            List<ResolvedDefinition> candidates = definitionsOf(identifier).stream()
                    .filter(definition -> constraints.getEntityType() == null
                            || definition.getEntityType() == constraints.getEntityType())
                    .map(definition -> candidate(definition, constraints))
                    .filter(Objects::nonNull)
                    .collect(Collectors.toList());

            if (constraints.getImportPath() != null) {
                String module = ImportPaths.resolve(constraints.getReferencingFilePath(), constraints.getImportPath());
                List<ResolvedDefinition> inModule = candidates.stream()
                        .filter(candidate -> ImportPaths.matches(module, candidate.getDefinition().getFilePath()))
                        .collect(Collectors.toList());
                if (!inModule.isEmpty()) {
                    candidates = inModule;
                } else if (followReexports) {
                    List<ResolvedDefinition> forwarded = throughReexports(identifier, module, constraints);
                    if (!forwarded.isEmpty()) {
                        candidates = forwarded;
                    }
                }
            }

            candidates.sort(CANDIDATE_ORDER);
            return candidates;
        }

        /**
         * One hop: re-exports in the imported module that expose the identifier are resolved
         * from the module's own point of view, without following further re-exports.
         */
        private List<ResolvedDefinition> throughReexports(String identifier, String module,
                                                          ResolutionConstraints constraints) {
            List<ResolvedDefinition> forwarded = new ArrayList<>();
            for (ContentEntityReference reexport : indexStore.findReexports(identifier, scope)) {
                if (!ImportPaths.matches(module, reexport.getFilePath()) || !isVisible(reexport.getFileVersionId())) {
                    continue;
                }
                String original = "*".equals(reexport.getIdentifierUsed()) ? identifier : reexport.getIdentifierUsed();
                ResolutionConstraints hop = constraintsFor(reexport).toBuilder()
                        .entityType(constraints.getEntityType())
                        .build();
                for (ResolvedDefinition resolved : resolve(original, hop, false)) {
                    forwarded.add(new ResolvedDefinition(resolved.getDefinition(), resolved.getFileVersion(),
                            versionDistance(resolved.getFileVersion(), constraints.getReferencedAt()),
                            pathDistance(resolved.getDefinition(), constraints), true));
                }
            }
            return forwarded.stream().distinct().collect(Collectors.toList());
        }

        Optional<String> topChunk(ContentEntityReference reference) {
            String key = reference.getFileVersionId() + '|' + reference.getIdentifierUsed() + '|'
                    + reference.getImportPath() + '|' + reference.getChunkId();
            return topChunks.computeIfAbsent(key, k -> resolve(reference.getIdentifierUsed(),
                    constraintsFor(reference), true).stream()
                    .findFirst()
                    .map(ResolvedDefinition::getChunkId)
                    .filter(chunkId -> !chunkId.equals(reference.getChunkId())));
        }

        ResolutionConstraints constraintsFor(ContentEntityReference reference) {
            Instant referencedAt = version(reference.getFileVersionId()).map(FileVersion::getCreatedAt).orElse(null);
            return ResolutionConstraints.builder()
                    .scope(scope)
                    .importPath(reference.getImportPath())
                    .referencingRepoId(reference.getRepoId())
                    .referencingFilePath(reference.getFilePath())
                    .referencedAt(referencedAt)
                    .build();
        }

        List<ContentEntityReference> referencesTo(String identifier) {
            return referencesByIdentifier.computeIfAbsent(identifier,
                    id -> indexStore.findReferencesToIdentifier(id, scope));
        }

        boolean isVisible(String fileVersionId) {
            return visibility.computeIfAbsent(fileVersionId, id -> version(id)
                    .filter(version -> scope.includes(version.getRepoId()))
                    .flatMap(version -> indexStore.findVisibleFileVersion(version.getRepoId(),
                            version.getProjectDir(), version.getFilePath(), scope.asOf(version.getRepoId())))
                    .map(visible -> visible.getId().equals(id))
                    .orElse(false));
        }

        private List<ContentEntityDefinition> definitionsOf(String identifier) {
            return definitionsByIdentifier.computeIfAbsent(identifier, id -> indexStore.getByIdentifier(id, scope));
        }

        private ResolvedDefinition candidate(ContentEntityDefinition definition, ResolutionConstraints constraints) {
            if (definition.getChunkId() == null || !isVisible(definition.getFileVersionId())) {
                return null;
            }
            FileVersion version = version(definition.getFileVersionId()).orElse(null);
            if (version == null) {
                return null;
            }
            return new ResolvedDefinition(definition, version, versionDistance(version, constraints.getReferencedAt()),
                    pathDistance(definition, constraints), false);
        }

        private Optional<FileVersion> version(String fileVersionId) {
            return versions.computeIfAbsent(fileVersionId, indexStore::findFileVersion);
        }
    }

    private static int versionDistance(FileVersion version, Instant referencedAt) {
        if (referencedAt == null || version.getCreatedAt() == null) {
            return 0;
        }
        return version.getCreatedAt().isAfter(referencedAt) ? 1 : 0;
    }

    private static int pathDistance(ContentEntityDefinition definition, ResolutionConstraints constraints) {
        if (!Objects.equals(definition.getRepoId(), constraints.getReferencingRepoId())) {
            return 3;
        }
        String referencingPath = constraints.getReferencingFilePath();
        if (definition.getFilePath().equals(referencingPath)) {
            return 0;
        }
        if (referencingPath != null && directoryOf(definition.getFilePath()).equals(directoryOf(referencingPath))) {
            return 1;
        }
        return 2;
    }

    private static String directoryOf(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? "" : path.substring(0, slash);
    }
}
