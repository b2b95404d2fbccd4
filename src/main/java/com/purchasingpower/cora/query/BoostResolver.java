package com.purchasingpower.cora.query;

import com.purchasingpower.cora.knowledge.IndexStore;
import com.purchasingpower.cora.knowledge.ReferenceResolver;
import com.purchasingpower.cora.knowledge.ResolutionConstraints;
import com.purchasingpower.cora.knowledge.ResolvedDefinition;
import com.purchasingpower.cora.model.index.Chunk;
import com.purchasingpower.cora.model.index.FileVersion;
import com.purchasingpower.cora.model.index.RepositoryRef;
import com.purchasingpower.cora.model.query.BoostDirectives;
import com.purchasingpower.cora.model.query.DeclarationBoost;
import com.purchasingpower.cora.model.retrieval.QueryScope;
import com.purchasingpower.cora.util.ImportPaths;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Turns boost directives into units that the budget assembler places before ranked chunks.
 *
 * A file directive yields every chunk of the visible version of that file, once per requested
 * repository holding it. A declaration directive yields the chunk owning its top resolution
 * candidate. Directives that match nothing are skipped with a warning.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BoostResolver {

    private final IndexStore indexStore;
    private final ReferenceResolver referenceResolver;

    /**
     * @param repoIds requested repositories, in request order
     */
    public List<BoostedUnit> resolve(BoostDirectives directives, List<String> repoIds, QueryScope scope) {
        List<BoostedUnit> units = new ArrayList<>();
        if (directives == null || directives.isEmpty()) {
            return units;
        }
        for (String filePath : nullSafe(directives.getFiles())) {
            List<BoostedUnit> fileUnits = resolveFile(ImportPaths.normalize(filePath), repoIds, scope);
            if (fileUnits.isEmpty()) {
                log.warn("⚠️  Boosted file not found, ignoring: {}", filePath);
            }
            units.addAll(fileUnits);
        }
        for (DeclarationBoost declaration : nullSafe(directives.getDeclarations())) {
            Optional<BoostedUnit> unit = resolveDeclaration(declaration, scope);
            if (unit.isEmpty()) {
                log.warn("⚠️  Boosted declaration not found, ignoring: {} in {}",
                        declaration.getPath(), declaration.getRepoId());
            }
            unit.ifPresent(units::add);
        }
        return units;
    }

    private List<BoostedUnit> resolveFile(String filePath, List<String> repoIds, QueryScope scope) {
        List<BoostedUnit> units = new ArrayList<>();
        for (String repoId : repoIds) {
            String projectDir = indexStore.findRepository(repoId).map(RepositoryRef::getProjectDir).orElse("");
            Optional<FileVersion> version = indexStore.findVisibleFileVersion(
                    repoId, projectDir, filePath, scope.asOf(repoId));
            if (version.isEmpty()) {
                continue;
            }
            List<ContextSlice> slices = indexStore.findChunksForFileVersion(version.get().getId()).stream()
                    .map(ContextSlice::full)
                    .collect(Collectors.toList());
            if (!slices.isEmpty()) {
                units.add(new BoostedUnit(repoId + ":" + filePath, slices));
            }
        }
        return units;
    }

    private Optional<BoostedUnit> resolveDeclaration(DeclarationBoost declaration, QueryScope scope) {
        if (declaration.getPath() == null || declaration.getPath().isBlank()) {
            return Optional.empty();
        }
        String filePath = declaration.filePath() == null ? null : ImportPaths.normalize(declaration.filePath());
        QueryScope declarationScope = declaration.getRepoId() == null || !scope.includes(declaration.getRepoId())
                ? scope
                : narrow(scope, declaration.getRepoId());
        ResolutionConstraints constraints = ResolutionConstraints.builder()
                .scope(declarationScope)
                .referencingRepoId(declaration.getRepoId())
                .referencingFilePath(filePath)
                .build();

        Optional<ResolvedDefinition> match = referenceResolver.resolve(declaration.identifier(), constraints).stream()
                .filter(resolved -> filePath == null || resolved.getDefinition().getFilePath().equals(filePath))
                .filter(resolved -> resolved.getChunkId() != null)
                .findFirst();
        if (match.isEmpty()) {
            return Optional.empty();
        }

        List<Chunk> chunks = indexStore.findChunksByIds(List.of(match.get().getChunkId()));
        if (chunks.isEmpty()) {
            return Optional.empty();
        }
        Chunk chunk = chunks.get(0);
        ContextSlice slice = declaration.isIncludeImplementation()
                ? ContextSlice.full(chunk)
                : ContextSlice.line(chunk, match.get().getDefinition().getLineStart());
        return Optional.of(new BoostedUnit(declaration.getRepoId() + ":" + declaration.getPath(), List.of(slice)));
    }

    private static QueryScope narrow(QueryScope scope, String repoId) {
        QueryScope.QueryScopeBuilder builder = QueryScope.builder().repoId(repoId);
        Optional.ofNullable(scope.asOf(repoId)).ifPresent(asOf -> builder.pin(repoId, asOf));
        return builder.build();
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list == null ? List.of() : list;
    }
}
