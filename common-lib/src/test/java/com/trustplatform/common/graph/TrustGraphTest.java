package com.trustplatform.common.graph;

import com.trustplatform.common.model.ComponentType;
import com.trustplatform.common.model.TrustEdge;
import com.trustplatform.common.model.TrustNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TrustGraphTest {

    private TrustGraph graph;

    @BeforeEach
    void setUp() {
        graph = new TrustGraph();
        graph.addNode(TrustNode.of("A", 0.9, ComponentType.API));
        graph.addNode(TrustNode.of("B", 0.8, ComponentType.MICROSERVICE));
        graph.addNode(TrustNode.of("C", 0.7, ComponentType.DATABASE));
    }

    // ── nodes ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("nodes")
    class Nodes {

        @Test
        @DisplayName("re-adding a node replaces it without growing the graph")
        void addNodeIsIdempotentById() {
            graph.addNode(TrustNode.of("A", 0.4, ComponentType.API));

            assertEquals(3, graph.nodeCount());
            assertEquals(0.4, graph.snapshot().node("A").orElseThrow().trustScore());
        }

        @Test
        @DisplayName("updateTrustScore on unknown node reports false and changes nothing")
        void updateUnknownNode() {
            assertFalse(graph.updateTrustScore("missing", 0.1, Instant.now()));
            assertEquals(3, graph.nodeCount());
        }

        @Test
        @DisplayName("updateTrustScore replaces score and timestamp")
        void updateKnownNode() {
            Instant at = Instant.parse("2026-01-01T00:00:00Z");

            assertTrue(graph.updateTrustScore("B", 0.15, at));

            TrustNode b = graph.snapshot().node("B").orElseThrow();
            assertEquals(0.15, b.trustScore());
            assertEquals(at, b.lastUpdated());
            assertEquals(ComponentType.MICROSERVICE, b.componentType());
        }

        @Test
        @DisplayName("removing a node drops every edge touching it")
        void removeNodeDropsEdges() {
            graph.addEdge(TrustEdge.of("A", "B", 0.5));
            graph.addEdge(TrustEdge.of("B", "C", 0.5));
            graph.addEdge(TrustEdge.of("A", "C", 0.5));

            assertTrue(graph.removeNode("B"));

            GraphSnapshot snapshot = graph.snapshot();
            assertEquals(1, snapshot.edgeCount());
            assertEquals(List.of("C"), snapshot.successors("A"));
            assertTrue(snapshot.successors("B").isEmpty());
        }
    }

    // ── edges ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("edges and the dependency index")
    class Edges {

        @Test
        @DisplayName("replacing an edge keeps one index entry and the new weight")
        void replaceEdge() {
            graph.addEdge(TrustEdge.of("A", "B", 0.5));
            graph.addEdge(TrustEdge.of("A", "C", 0.5));
            graph.addEdge(TrustEdge.of("A", "B", 0.9));

            GraphSnapshot snapshot = graph.snapshot();
            assertEquals(2, snapshot.edgeCount());
            assertEquals(List.of("B", "C"), snapshot.successors("A"));
            assertEquals(0.9, snapshot.edge("A", "B").orElseThrow().trustWeight());
        }

        @Test
        @DisplayName("removing an edge removes it from the index")
        void removeEdge() {
            graph.addEdge(TrustEdge.of("A", "B", 0.5));

            assertTrue(graph.removeEdge("A", "B"));
            assertFalse(graph.removeEdge("A", "B"));
            assertTrue(graph.snapshot().successors("A").isEmpty());
        }

        @Test
        @DisplayName("edges to unregistered ids are kept")
        void danglingEdge() {
            graph.addEdge(TrustEdge.of("A", "ghost", 0.5));

            GraphSnapshot snapshot = graph.snapshot();
            assertEquals(List.of("ghost"), snapshot.successors("A"));
            assertTrue(snapshot.node("ghost").isEmpty());
        }
    }

    @Test
    @DisplayName("snapshot is unaffected by later writes")
    void snapshotIsolation() {
        GraphSnapshot before = graph.snapshot();

        graph.addEdge(TrustEdge.of("A", "B", 0.5));
        graph.updateTrustScore("A", 0.1, Instant.now());

        assertEquals(0, before.edgeCount());
        assertEquals(0.9, before.trustScores().get("A"));
    }
}
