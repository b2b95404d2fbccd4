package com.purchasingpower.cora.knowledge.impl;

import com.purchasingpower.cora.model.index.CommitFileVersion;
import com.purchasingpower.cora.model.index.FileVersion;
import com.purchasingpower.cora.model.index.PathEvent;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Picks the version of one path that a reader pinned at an instant sees.
 *
 * Commit provenance wins: the version recorded at the newest commit not after the instant, unless
 * the path was deleted at a newer commit. A path never indexed at a commit replays its publish
 * and delete events instead, and a path without any falls back to creation times.
 */
final class VersionVisibility {

    private static final Comparator<Entry> NEWEST_LAST = Comparator
            .comparing(Entry::timestamp)
            .thenComparingInt(Entry::sequence)
            .thenComparing(Entry::createdAt);

    private VersionVisibility() {
    }

    /**
     * @param history all stored versions of one path
     * @param rows    commit rows of each version, by file version id
     * @param events  publish and delete events of the path, oldest first
     * @param asOf    instant the reader is pinned to
     */
    static Optional<FileVersion> visibleAt(Collection<FileVersion> history,
                                           Function<String, List<CommitFileVersion>> rows,
                                           List<PathEvent> events,
                                           Instant asOf) {
        Map<String, FileVersion> byId = history.stream()
                .collect(Collectors.toMap(FileVersion::getId, Function.identity(), (a, b) -> a));

        List<Entry> commitEntries = new ArrayList<>();
        history.stream()
                .flatMap(version -> rows.apply(version.getId()).stream())
                .forEach(row -> commitEntries.add(new Entry(row.timestamp(), -1, row.fileVersionId(),
                        createdAt(byId, row.fileVersionId()))));
        List<Entry> plainEntries = new ArrayList<>();
        for (int i = 0; i < events.size(); i++) {
            PathEvent event = events.get(i);
            Entry entry = new Entry(event.timestamp(), i, event.fileVersionId(), createdAt(byId, event.fileVersionId()));
            (event.hasCommit() ? commitEntries : plainEntries).add(entry);
        }

        if (!commitEntries.isEmpty()) {
            return newestAt(commitEntries, byId, asOf);
        }
        if (!plainEntries.isEmpty()) {
            return newestAt(plainEntries, byId, asOf);
        }
        return history.stream()
                .filter(version -> !version.getCreatedAt().isAfter(asOf))
                .max(Comparator.comparing(FileVersion::getCreatedAt));
    }

    private static Optional<FileVersion> newestAt(List<Entry> entries, Map<String, FileVersion> byId, Instant asOf) {
        return entries.stream()
                .filter(entry -> !entry.timestamp().isAfter(asOf))
                .max(NEWEST_LAST)
                .flatMap(entry -> entry.fileVersionId() == null
                        ? Optional.empty()
                        : Optional.ofNullable(byId.get(entry.fileVersionId())));
    }

    private static Instant createdAt(Map<String, FileVersion> byId, String fileVersionId) {
        FileVersion version = fileVersionId == null ? null : byId.get(fileVersionId);
        return version == null || version.getCreatedAt() == null ? Instant.MIN : version.getCreatedAt();
    }

    /** One point on the path's timeline; a null version id is a deletion. */
    private record Entry(Instant timestamp, int sequence, String fileVersionId, Instant createdAt) {
    }
}
