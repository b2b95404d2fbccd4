package com.purchasingpower.cora.query;

import com.purchasingpower.cora.configuration.AppProperties;
import com.purchasingpower.cora.configuration.BudgetProperties;
import com.purchasingpower.cora.model.index.Chunk;
import com.purchasingpower.cora.model.query.ContextSection;
import com.purchasingpower.cora.model.query.FileContext;
import com.purchasingpower.cora.model.query.QueryResponse;
import com.purchasingpower.cora.model.query.RenderMode;
import com.purchasingpower.cora.model.query.RepositoryContext;
import com.purchasingpower.cora.model.query.UsedChunk;
import com.purchasingpower.cora.model.retrieval.RankedChunk;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.BooleanSupplier;

/**
 * Fits boosted units and ranked chunks into an approximate character budget.
 *
 * <p>Selection walks boosted units first, in directive order, then ranked chunks by rank. The
 * first slice of a boosted unit is rendered in full as long as the budget is not used up when it is
 * reached, so it may overshoot by its own size. Every other slice, boosted or ranked, is rendered in
 * full while it fits; after the first one that does not, every later slice is elided and costs
 * {@code elidedEntryChars}. With tail cut enabled the walk stops once an elided entry no longer fits
 * either.
 *
 * <p>A chunk is placed once. When a chunk placed as a single declaration line comes up again as a
 * whole chunk, the placement is widened to the whole chunk if it still fits.
 *
 * <p>The output is grouped by repository (request order), then file path, with sections in line
 * order. Adjacent chunks of one file rendered the same way merge into one section.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BudgetAssembler {

    private final AppProperties appProperties;

    public QueryResponse assemble(List<BoostedUnit> boosts, List<RankedChunk> ranked, int approxLength,
                                  List<String> repoOrder) {
        return assemble(boosts, ranked, approxLength, repoOrder, () -> false);
    }

    /**
     * @param deadlineReached checked before each placement; when it turns true the walk stops and
     *                        the response is marked truncated
     */
    public QueryResponse assemble(List<BoostedUnit> boosts, List<RankedChunk> ranked, int approxLength,
                                  List<String> repoOrder, BooleanSupplier deadlineReached) {
        BudgetProperties budget = appProperties.getBudget();
        Walk walk = new Walk(approxLength, budget);

        for (BoostedUnit unit : boosts) {
            if (deadlineReached.getAsBoolean()) {
                walk.truncated = true;
                break;
            }
            if (!walk.placeBoosted(unit)) {
                break;
            }
        }
        if (!walk.truncated) {
            for (RankedChunk rankedChunk : ranked) {
                if (deadlineReached.getAsBoolean()) {
                    walk.truncated = true;
                    break;
                }
                if (!walk.placeRanked(rankedChunk)) {
                    break;
                }
            }
        }

        QueryResponse response = render(walk.placements, repoOrder, budget.getElisionMarker(), walk.truncated);
        log.info("Budget assembly: {} chunks placed ({} elided), {} of ~{} chars{}",
                walk.placements.size(),
                walk.placements.stream().filter(placement -> placement.mode() == RenderMode.ELIDED).count(),
                response.getRenderedChars(), approxLength, walk.truncated ? ", truncated" : "");
        return response;
    }

    // =========================================================================
    // Selection
    // =========================================================================

    private record Placement(ContextSlice slice, RenderMode mode, boolean boosted, double score) {
    }

    private static final class Walk {

        private final int approxLength;
        private final BudgetProperties budget;
        private final List<Placement> placements = new ArrayList<>();
        private final Map<String, Integer> placed = new HashMap<>();
        private int used;
        private boolean overflowed;
        private boolean truncated;

        private Walk(int approxLength, BudgetProperties budget) {
            this.approxLength = approxLength;
            this.budget = budget;
        }

        /** @return false once the walk has to stop */
        boolean placeBoosted(BoostedUnit unit) {
            boolean first = true;
            for (ContextSlice slice : unit.slices()) {
                if (placed.containsKey(slice.chunkId())) {
                    widen(slice, true, 1.0);
                    continue;
                }
                boolean full = first
                        ? approxLength > 0 && used < approxLength
                        : !overflowed && used + slice.length() <= approxLength;
                first = false;
                if (full) {
                    add(slice, RenderMode.FULL, true, 1.0);
                    used += slice.length();
                    continue;
                }
                overflowed = true;
                if (!placeElided(slice, true, 1.0)) {
                    return false;
                }
            }
            return true;
        }

        boolean placeRanked(RankedChunk rankedChunk) {
            ContextSlice slice = ContextSlice.full(rankedChunk.getChunk());
            if (placed.containsKey(slice.chunkId())) {
                widen(slice, false, rankedChunk.getCombinedScore());
                return true;
            }
            if (!overflowed && used + slice.length() <= approxLength) {
                add(slice, RenderMode.FULL, false, rankedChunk.getCombinedScore());
                used += slice.length();
                return true;
            }
            overflowed = true;
            return placeElided(slice, false, rankedChunk.getCombinedScore());
        }

        /** Replaces a full-rendered part of a chunk with the whole chunk when the difference fits. */
        private void widen(ContextSlice whole, boolean boosted, double score) {
            int index = placed.get(whole.chunkId());
            Placement current = placements.get(index);
            if (current.mode() != RenderMode.FULL || current.slice().isWhole() || !whole.isWhole()) {
                return;
            }
            int extra = whole.length() - current.slice().length();
            if (overflowed || used + extra > approxLength) {
                overflowed = true;
                return;
            }
            placements.set(index, new Placement(whole, RenderMode.FULL, current.boosted() || boosted,
                    Math.max(current.score(), score)));
            used += extra;
        }

        private boolean placeElided(ContextSlice slice, boolean boosted, double score) {
            int cost = budget.getElidedEntryChars();
            if (budget.isTailCutEnabled() && used + cost > approxLength) {
                truncated = true;
                return false;
            }
            add(slice, RenderMode.ELIDED, boosted, score);
            used += cost;
            return true;
        }

        private void add(ContextSlice slice, RenderMode mode, boolean boosted, double score) {
            placed.put(slice.chunkId(), placements.size());
            placements.add(new Placement(slice, mode, boosted, score));
        }
    }

    // =========================================================================
    // Rendering
    // =========================================================================

    private static QueryResponse render(List<Placement> placements, List<String> repoOrder, String marker,
                                        boolean truncated) {
        Map<String, Map<String, List<Placement>>> byRepo = new LinkedHashMap<>();
        for (String repoId : repoOrder) {
            byRepo.put(repoId, new TreeMap<>());
        }
        Map<String, Map<String, List<Placement>>> unlisted = new TreeMap<>();
        for (Placement placement : placements) {
            Chunk chunk = placement.slice().chunk();
            Map<String, Map<String, List<Placement>>> target = byRepo.containsKey(chunk.getRepoId()) ? byRepo : unlisted;
            target.computeIfAbsent(chunk.getRepoId(), id -> new TreeMap<>())
                    .computeIfAbsent(chunk.getFilePath() + '\u0000' + chunk.getFileVersionId(), key -> new ArrayList<>())
                    .add(placement);
        }
        byRepo.putAll(unlisted);

        QueryResponse.QueryResponseBuilder response = QueryResponse.builder().truncated(truncated);
        int renderedChars = 0;
        for (Map.Entry<String, Map<String, List<Placement>>> repo : byRepo.entrySet()) {
            if (repo.getValue().isEmpty()) {
                continue;
            }
            RepositoryContext.RepositoryContextBuilder repository = RepositoryContext.builder().repoId(repo.getKey());
            for (List<Placement> filePlacements : repo.getValue().values()) {
                FileContext file = renderFile(filePlacements, marker);
                renderedChars += file.getSections().stream().mapToInt(section -> section.getContent().length()).sum();
                repository.file(file);
            }
            response.repository(repository.build());
        }

        for (Placement placement : placements) {
            ContextSlice slice = placement.slice();
            response.usedChunk(UsedChunk.builder()
                    .chunkId(slice.chunkId())
                    .repoId(slice.chunk().getRepoId())
                    .filePath(slice.chunk().getFilePath())
                    .lineStart(slice.lineStart())
                    .lineEnd(slice.lineEnd())
                    .renderMode(placement.mode())
                    .boosted(placement.boosted())
                    .combinedScore(placement.score())
                    .build());
        }
        return response.renderedChars(renderedChars).build();
    }

    private static FileContext renderFile(List<Placement> placements, String marker) {
        List<Placement> ordered = new ArrayList<>(placements);
        ordered.sort(Comparator.comparingInt((Placement placement) -> placement.slice().lineStart()));
        Chunk first = ordered.get(0).slice().chunk();

        FileContext.FileContextBuilder file = FileContext.builder()
                .filePath(first.getFilePath())
                .fileVersionId(first.getFileVersionId())
                .language(first.getLanguage());

        List<Placement> run = new ArrayList<>();
        for (Placement placement : ordered) {
            if (!run.isEmpty()) {
                Placement last = run.get(run.size() - 1);
                boolean adjacent = placement.slice().lineStart() == last.slice().lineEnd() + 1;
                if (!adjacent || placement.mode() != last.mode()) {
                    file.section(section(run, marker));
                    run = new ArrayList<>();
                }
            }
            run.add(placement);
        }
        file.section(section(run, marker));
        return file.build();
    }

    private static ContextSection section(List<Placement> run, String marker) {
        RenderMode mode = run.get(0).mode();
        ContextSection.ContextSectionBuilder section = ContextSection.builder()
                .lineStart(run.get(0).slice().lineStart())
                .lineEnd(run.get(run.size() - 1).slice().lineEnd())
                .renderMode(mode);

        StringBuilder content = new StringBuilder();
        for (Placement placement : run) {
            ContextSlice slice = placement.slice();
            section.chunkId(slice.chunkId());
            if (slice.chunk().getCommentary() != null) {
                section.commentary(slice.chunk().getCommentary());
            }
            if (mode == RenderMode.FULL) {
                if (content.length() > 0 && content.charAt(content.length() - 1) != '\n') {
                    content.append('\n');
                }
                content.append(slice.content());
            }
        }
        return section.content(mode == RenderMode.FULL ? content.toString() : marker).build();
    }
}
