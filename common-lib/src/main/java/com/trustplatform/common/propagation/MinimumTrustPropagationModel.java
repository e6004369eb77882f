package com.trustplatform.common.propagation;

import com.trustplatform.common.graph.GraphSnapshot;
import com.trustplatform.common.model.TrustEdge;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pessimistic propagation: a component is only as trusted as the weakest relationship on the
 * path that reached it.
 *
 * <pre>
 *   trust(source) = 1.0
 *   trust(target) = min(trust(current), edge.trustWeight)
 * </pre>
 *
 * <p>A node already reached is re-queued only when a strictly lower value is found, so the
 * final value is the minimum over the paths this pass discovers. Values only decrease and are
 * drawn from the finite set of edge weights, which bounds the number of re-queues on cyclic graphs.
 */
public class MinimumTrustPropagationModel implements TrustPropagationModel {

    public static final String NAME = "minimum_trust";

    @Override
    public Map<String, Double> propagate(GraphSnapshot graph, String source) {
        Map<String, Double> scores = new LinkedHashMap<>();
        Deque<Map.Entry<String, Double>> queue = new ArrayDeque<>();

        scores.put(source, 1.0);
        queue.add(Map.entry(source, 1.0));

        while (!queue.isEmpty()) {
            Map.Entry<String, Double> current = queue.poll();
            double currentTrust = current.getValue();
            // stale entry: a lower value was recorded after this one was queued
            if (scores.get(current.getKey()) < currentTrust) {
                continue;
            }

            for (TrustEdge edge : graph.outgoing(current.getKey())) {
                double propagated = Math.min(currentTrust, edge.trustWeight());
                Double existing = scores.get(edge.to());
                if (existing == null || propagated < existing) {
                    scores.put(edge.to(), propagated);
                    queue.add(Map.entry(edge.to(), propagated));
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
