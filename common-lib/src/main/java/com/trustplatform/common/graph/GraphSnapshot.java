package com.trustplatform.common.graph;

import com.trustplatform.common.model.TrustEdge;
import com.trustplatform.common.model.TrustNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only copy of a {@link TrustGraph} taken under its read lock.
 *
 * <p>Iteration order everywhere is registration order, which keeps the single-pass
 * propagation models deterministic for a given build-up sequence.
 */
public final class GraphSnapshot {

    private final Map<String, TrustNode> nodes;
    private final Map<String, TrustEdge> edges;
    private final Map<String, List<TrustEdge>> outgoing;

    GraphSnapshot(Map<String, TrustNode> nodes,
                  Map<String, TrustEdge> edges,
                  Map<String, List<String>> dependencies) {
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.edges = Collections.unmodifiableMap(new LinkedHashMap<>(edges));

        Map<String, List<TrustEdge>> index = new LinkedHashMap<>();
        dependencies.forEach((from, targets) -> {
            List<TrustEdge> out = new ArrayList<>(targets.size());
            for (String to : targets) {
                TrustEdge edge = edges.get(TrustEdge.key(from, to));
                if (edge != null) {
                    out.add(edge);
                }
            }
            index.put(from, List.copyOf(out));
        });
        this.outgoing = Collections.unmodifiableMap(index);
    }

    public Optional<TrustNode> node(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public Collection<TrustNode> nodes() {
        return nodes.values();
    }

    public Collection<TrustEdge> edges() {
        return edges.values();
    }

    public Optional<TrustEdge> edge(String from, String to) {
        return Optional.ofNullable(edges.get(TrustEdge.key(from, to)));
    }

    /** Edges leaving {@code id}, in the order they were first added. Never null. */
    public List<TrustEdge> outgoing(String id) {
        return outgoing.getOrDefault(id, List.of());
    }

    public List<String> successors(String id) {
        return outgoing(id).stream().map(TrustEdge::to).toList();
    }

    /** Current registered trust score per node id. */
    public Map<String, Double> trustScores() {
        Map<String, Double> scores = new LinkedHashMap<>();
        nodes.forEach((id, node) -> scores.put(id, node.trustScore()));
        return scores;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }
}
