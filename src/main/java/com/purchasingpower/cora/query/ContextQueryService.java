package com.purchasingpower.cora.query;

import com.google.common.base.Preconditions;
import com.purchasingpower.cora.configuration.AppProperties;
import com.purchasingpower.cora.exception.QueryFailedException;
import com.purchasingpower.cora.exception.StoreUnavailableException;
import com.purchasingpower.cora.knowledge.IndexStore;
import com.purchasingpower.cora.model.query.QueryRequest;
import com.purchasingpower.cora.model.query.QueryResponse;
import com.purchasingpower.cora.model.query.RepoSpec;
import com.purchasingpower.cora.model.retrieval.QueryScope;
import com.purchasingpower.cora.model.retrieval.RankedChunk;
import com.purchasingpower.cora.model.retrieval.RetrievalCandidate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs a context query: hybrid retrieval, link-rank expansion, boosts and budget assembly.
 *
 * <p>Failure handling:
 * <ul>
 *   <li>store unavailable before any chunk was fetched: {@link QueryFailedException}</li>
 *   <li>store unavailable later: what was fetched is assembled and the response is degraded</li>
 *   <li>deadline passed: remaining stages are skipped, the response is degraded</li>
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContextQueryService {

    private final HybridRetriever hybridRetriever;
    private final LinkRankExpander linkRankExpander;
    private final BoostResolver boostResolver;
    private final BudgetAssembler budgetAssembler;
    private final IndexStore indexStore;
    private final AppProperties appProperties;

    public QueryResponse query(QueryRequest request) {
        Preconditions.checkNotNull(request, "request");
        Preconditions.checkArgument(request.getApproxLength() >= 0, "approxLength must not be negative");

        long startTime = System.currentTimeMillis();
        long deadline = request.getTimeoutMs() > 0 ? startTime + request.getTimeoutMs() : Long.MAX_VALUE;
        List<String> repoIds = request.getRepos() == null ? List.of()
                : request.getRepos().stream().map(RepoSpec::getRepoId).distinct().collect(Collectors.toList());

        log.info("🔍 Context query: repos={}, approxLength={}, boosts={}",
                repoIds, request.getApproxLength(), request.getBoostDirectives() != null
                        && !request.getBoostDirectives().isEmpty());

        QueryScope scope;
        List<RetrievalCandidate> candidates;
        try {
            scope = resolveScope(request.getRepos());
            String queryText = request.latestUserContent().orElse(null);
            candidates = queryText == null
                    ? List.of()
                    : hybridRetriever.search(queryText, scope, appProperties.getRanking().getCandidateCount());
        } catch (StoreUnavailableException e) {
            log.error("❌ Context query failed before any data was fetched", e);
            throw new QueryFailedException("Index store unavailable: " + e.getOperation(), e);
        }

        boolean degraded = false;
        List<RankedChunk> ranked = retrievalOnly(candidates);
        if (expired(deadline)) {
            log.warn("⚠️  Deadline reached after retrieval, skipping expansion");
            degraded = true;
        } else {
            try {
                ranked = linkRankExpander.expand(candidates, scope);
            } catch (StoreUnavailableException e) {
                log.warn("⚠️  Expansion failed, using retrieval ranking: {}", e.getMessage());
                degraded = true;
            }
        }

        List<BoostedUnit> boosts = List.of();
        if (expired(deadline)) {
            degraded = true;
        } else {
            try {
                boosts = boostResolver.resolve(request.getBoostDirectives(), repoIds, scope);
            } catch (StoreUnavailableException e) {
                log.warn("⚠️  Boost resolution failed, continuing without boosts: {}", e.getMessage());
                degraded = true;
            }
        }

        QueryResponse response = budgetAssembler.assemble(boosts, ranked, request.getApproxLength(), repoIds,
                () -> expired(deadline));
        degraded = degraded || (response.isTruncated() && expired(deadline));

        log.info("✅ Context query done in {}ms: {} candidates, {} ranked, {} boosted units, {} chunks used{}",
                System.currentTimeMillis() - startTime, candidates.size(), ranked.size(), boosts.size(),
                response.getUsedChunks().size(), degraded ? " (degraded)" : "");
        return response.toBuilder().degraded(degraded).build();
    }

    /**
     * A version specifier is an indexed commit hash or an ISO-8601 instant.
     */
    QueryScope resolveScope(List<RepoSpec> repos) {
        QueryScope.QueryScopeBuilder scope = QueryScope.builder();
        if (repos == null) {
            return scope.build();
        }
        for (RepoSpec repo : repos) {
            Preconditions.checkArgument(repo.getRepoId() != null && !repo.getRepoId().isBlank(), "repoId is required");
            scope.repoId(repo.getRepoId());
            if (repo.isPinned()) {
                scope.pin(repo.getRepoId(), pinInstant(repo));
            }
        }
        return scope.build();
    }

    private Instant pinInstant(RepoSpec repo) {
        String specifier = repo.getVersionSpecifier().trim();
        return indexStore.findCommitTimestamp(repo.getRepoId(), specifier)
                .orElseGet(() -> {
                    try {
                        return Instant.parse(specifier);
                    } catch (DateTimeParseException e) {
                        throw new QueryFailedException(
                                "Unknown version " + specifier + " for repository " + repo.getRepoId(), e);
                    }
                });
    }

    private static List<RankedChunk> retrievalOnly(List<RetrievalCandidate> candidates) {
        double max = candidates.stream().mapToDouble(RetrievalCandidate::getFusedScore).max().orElse(0);
        return candidates.stream()
                .map(candidate -> RankedChunk.builder()
                        .chunk(candidate.getChunk())
                        .retrievalScore(candidate.getFusedScore())
                        .combinedScore(max > 0 ? candidate.getFusedScore() / max : 0)
                        .candidate(true)
                        .build())
                .sorted(RankedChunk.BY_RANK)
                .collect(Collectors.toList());
    }

    private static boolean expired(long deadline) {
        return System.currentTimeMillis() >= deadline;
    }
}
