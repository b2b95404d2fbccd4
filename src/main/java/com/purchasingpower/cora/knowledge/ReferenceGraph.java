package com.purchasingpower.cora.knowledge;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Directed chunk-to-chunk dependency edges, held as forward and reverse adjacency lists.
 *
 * An edge {@code A -> B} means a reference inside chunk A resolves to a definition owned by
 * chunk B. Cycles are allowed. A graph is built per request and discarded afterwards.
 */
public class ReferenceGraph {

    private final Map<String, Set<String>> outgoing = new LinkedHashMap<>();
    private final Map<String, Set<String>> incoming = new LinkedHashMap<>();

    /**
     * @return true when the edge was new; self-loops are ignored
     */
    public boolean addEdge(String fromChunkId, String toChunkId) {
        if (fromChunkId == null || toChunkId == null || fromChunkId.equals(toChunkId)) {
            return false;
        }
        boolean added = outgoing.computeIfAbsent(fromChunkId, id -> new LinkedHashSet<>()).add(toChunkId);
        incoming.computeIfAbsent(toChunkId, id -> new LinkedHashSet<>()).add(fromChunkId);
        return added;
    }

    public Set<String> successors(String chunkId) {
        return Collections.unmodifiableSet(outgoing.getOrDefault(chunkId, Set.of()));
    }

    public Set<String> predecessors(String chunkId) {
        return Collections.unmodifiableSet(incoming.getOrDefault(chunkId, Set.of()));
    }

    /** One-hop neighbours in either direction. */
    public Set<String> neighbours(String chunkId) {
        Set<String> neighbours = new LinkedHashSet<>(successors(chunkId));
        neighbours.addAll(predecessors(chunkId));
        return neighbours;
    }

    public boolean hasEdge(String fromChunkId, String toChunkId) {
        return outgoing.getOrDefault(fromChunkId, Set.of()).contains(toChunkId);
    }

    /** Every chunk touching at least one edge. */
    public Set<String> nodes() {
        Set<String> nodes = new LinkedHashSet<>(outgoing.keySet());
        nodes.addAll(incoming.keySet());
        return nodes;
    }

    public int edgeCount() {
        return outgoing.values().stream().mapToInt(Set::size).sum();
    }
}
