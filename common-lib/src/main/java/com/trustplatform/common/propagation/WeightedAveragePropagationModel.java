package com.trustplatform.common.propagation;

import com.trustplatform.common.graph.GraphSnapshot;
import com.trustplatform.common.model.TrustEdge;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Multiplicative attenuation along a breadth-first traversal.
 *
 * <pre>
 *   trust(source) = 1.0
 *   trust(target) = trust(current) × edge.trustWeight
 * </pre>
 *
 * <p>First visit wins: the value assigned when a node is first discovered is final, even if a
 * later path would give it higher trust. Exact for tree-shaped subgraphs; on multi-path graphs
 * the result follows edge registration order. Runs in O(V + E).
 */
public class WeightedAveragePropagationModel implements TrustPropagationModel {

    public static final String NAME = "weighted_average";

    @Override
    public Map<String, Double> propagate(GraphSnapshot graph, String source) {
        Map<String, Double> scores = new LinkedHashMap<>();
        Set<String> visited = new HashSet<>();
        Deque<Map.Entry<String, Double>> queue = new ArrayDeque<>();

        queue.add(Map.entry(source, 1.0));
        visited.add(source);

        while (!queue.isEmpty()) {
            Map.Entry<String, Double> current = queue.poll();
            scores.put(current.getKey(), current.getValue());

            for (TrustEdge edge : graph.outgoing(current.getKey())) {
                if (visited.add(edge.to())) {
                    queue.add(Map.entry(edge.to(), current.getValue() * edge.trustWeight()));
                }
            }
        }
        return scores;
    }

    @Override
    public String modelName() {
        return NAME;
    }
}
