package com.purchasingpower.cora.knowledge;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Reference Graph Tests")
class ReferenceGraphTest {

    @Test
    @DisplayName("Edges are kept in both adjacency directions")
    void addEdge_shouldTrackForwardAndReverse() {
        ReferenceGraph graph = new ReferenceGraph();

        assertTrue(graph.addEdge("a", "b"));
        assertTrue(graph.addEdge("c", "b"));
        assertFalse(graph.addEdge("a", "b"), "Duplicate edge");

        assertThat(graph.successors("a")).containsExactly("b");
        assertThat(graph.predecessors("b")).containsExactly("a", "c");
        assertThat(graph.neighbours("b")).containsExactly("a", "c");
        assertThat(graph.nodes()).containsExactlyInAnyOrder("a", "b", "c");
        assertEquals(2, graph.edgeCount());
    }

    @Test
    @DisplayName("Self-loops and null ends are ignored, cycles are allowed")
    void addEdge_shouldIgnoreSelfLoops() {
        ReferenceGraph graph = new ReferenceGraph();

        assertFalse(graph.addEdge("a", "a"));
        assertFalse(graph.addEdge("a", null));
        assertTrue(graph.addEdge("a", "b"));
        assertTrue(graph.addEdge("b", "a"));

        assertTrue(graph.hasEdge("b", "a"));
        assertThat(graph.successors("unknown")).isEmpty();
    }
}
