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
 * Breadth-first propagation scaled by a table of conditional probabilities.
 *
 * <pre>
 *   trust(target) = trust(current) × edge.trustWeight × P(current → target)
 * </pre>
 *
 * <p>{@code P} is looked up by {@code "from->to"} and defaults to {@value #DEFAULT_PROBABILITY}.
 * Same first-visit-wins traversal as {@link WeightedAveragePropagationModel}.
 */
public class BayesianPropagationModel implements TrustPropagationModel {

    public static final String NAME = "bayesian";

    static final double DEFAULT_PROBABILITY = 0.5;

    private final Map<String, Double> conditionalProbabilities;

    public BayesianPropagationModel() {
        this(Map.of());
    }

    public BayesianPropagationModel(Map<String, Double> conditionalProbabilities) {
        this.conditionalProbabilities = Map.copyOf(conditionalProbabilities);
    }

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
                    double probability = conditionalProbability(edge.from(), edge.to());
                    queue.add(Map.entry(edge.to(), current.getValue() * edge.trustWeight() * probability));
                }
            }
        }
        return scores;
    }

    public double conditionalProbability(String from, String to) {
        return conditionalProbabilities.getOrDefault(TrustEdge.key(from, to), DEFAULT_PROBABILITY);
    }

    @Override
    public String modelName() {
        return NAME;
    }
}
