package com.trustplatform.common.propagation;

import com.trustplatform.common.graph.GraphSnapshot;

import java.util.Map;

/**
 * Strategy contract for deriving downstream trust from a single source component.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b>:   safe to call concurrently on shared snapshots</li>
 *   <li><b>Terminating</b>: cycles in the graph must not cause endless re-queueing</li>
 *   <li><b>Non-null</b>:    the result always contains the source at 1.0 unless a cycle
 *       leads back to it with a combination rule that lowers it</li>
 * </ul>
 *
 * <p>Register new implementations in {@link PropagationModelRegistry}; callers iterate the
 * registry and never name concrete models.
 */
public interface TrustPropagationModel {

    /**
     * @param graph  consistent snapshot to traverse
     * @param source id of the component seeded at trust 1.0 (need not be a registered node)
     * @return node id → derived trust for every component reached from {@code source}
     */
    Map<String, Double> propagate(GraphSnapshot graph, String source);

    String modelName();
}
