package com.trustplatform.common.propagation;

import com.trustplatform.common.graph.GraphSnapshot;
import com.trustplatform.common.graph.TrustGraph;
import com.trustplatform.common.model.ComponentType;
import com.trustplatform.common.model.TrustEdge;
import com.trustplatform.common.model.TrustNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour of the three built-in propagation models on small hand-built graphs.
 */
class PropagationModelsTest {

    private static final List<TrustPropagationModel> ALL_MODELS = List.of(
        new WeightedAveragePropagationModel(),
        new MinimumTrustPropagationModel(),
        new BayesianPropagationModel());

    private static GraphSnapshot chain() {
        TrustGraph graph = new TrustGraph();
        graph.addNode(TrustNode.of("A", 0.9, ComponentType.API));
        graph.addNode(TrustNode.of("B", 0.8, ComponentType.MICROSERVICE));
        graph.addNode(TrustNode.of("C", 0.7, ComponentType.DATABASE));
        graph.addEdge(TrustEdge.of("A", "B", 0.5));
        graph.addEdge(TrustEdge.of("B", "C", 0.4));
        return graph.snapshot();
    }

    private static GraphSnapshot cycle() {
        TrustGraph graph = new TrustGraph();
        graph.addEdge(TrustEdge.of("A", "B", 0.9));
        graph.addEdge(TrustEdge.of("B", "C", 0.8));
        graph.addEdge(TrustEdge.of("C", "A", 0.7));
        return graph.snapshot();
    }

    @Nested
    @DisplayName("common properties")
    class Common {

        @Test
        @DisplayName("source without outgoing edges yields only itself at 1.0")
        void isolatedSource() {
            GraphSnapshot snapshot = chain();
            for (TrustPropagationModel model : ALL_MODELS) {
                assertEquals(Map.of("C", 1.0), model.propagate(snapshot, "C"), model.modelName());
                assertEquals(Map.of("unknown", 1.0), model.propagate(snapshot, "unknown"), model.modelName());
            }
        }

        @Test
        @DisplayName("all values stay within [0, 1] for weights within [0, 1]")
        void boundedOutput() {
            for (TrustPropagationModel model : ALL_MODELS) {
                model.propagate(cycle(), "A").values()
                    .forEach(v -> assertTrue(v >= 0.0 && v <= 1.0, model.modelName() + " produced " + v));
            }
        }

        @Test
        @DisplayName("cycles terminate and visit each node once")
        void cycleTerminates() {
            for (TrustPropagationModel model : ALL_MODELS) {
                assertEquals(3, model.propagate(cycle(), "A").size(), model.modelName());
            }
        }
    }

    @Nested
    @DisplayName("weighted_average")
    class WeightedAverage {

        @Test
        @DisplayName("A→B(0.5)→C(0.4) gives A=1.0, B=0.5, C=0.2")
        void chainProduct() {
            Map<String, Double> scores = new WeightedAveragePropagationModel().propagate(chain(), "A");

            assertEquals(1.0, scores.get("A"), 1e-9);
            assertEquals(0.5, scores.get("B"), 1e-9);
            assertEquals(0.2, scores.get("C"), 1e-9);
        }

        @Test
        @DisplayName("first path to reach a node wins")
        void firstVisitWins() {
            TrustGraph graph = new TrustGraph();
            graph.addEdge(TrustEdge.of("S", "X", 0.2));
            graph.addEdge(TrustEdge.of("S", "Y", 1.0));
            graph.addEdge(TrustEdge.of("Y", "X", 1.0));

            Map<String, Double> scores = new WeightedAveragePropagationModel().propagate(graph.snapshot(), "S");

            assertEquals(0.2, scores.get("X"), 1e-9);
        }
    }

    @Nested
    @DisplayName("minimum_trust")
    class MinimumTrust {

        @Test
        @DisplayName("value is the minimum weight along the path")
        void chainMinimum() {
            Map<String, Double> scores = new MinimumTrustPropagationModel().propagate(chain(), "A");

            assertEquals(0.5, scores.get("B"), 1e-9);
            assertEquals(0.4, scores.get("C"), 1e-9);
        }

        @Test
        @DisplayName("a later, weaker path lowers an already reached node")
        void weakerPathLowersValue() {
            TrustGraph graph = new TrustGraph();
            graph.addEdge(TrustEdge.of("S", "X", 0.9));
            graph.addEdge(TrustEdge.of("S", "Y", 0.3));
            graph.addEdge(TrustEdge.of("Y", "X", 1.0));
            graph.addEdge(TrustEdge.of("X", "Z", 1.0));

            Map<String, Double> scores = new MinimumTrustPropagationModel().propagate(graph.snapshot(), "S");

            assertEquals(0.3, scores.get("X"), 1e-9);
            assertEquals(0.3, scores.get("Z"), 1e-9);
        }
    }

    @Nested
    @DisplayName("bayesian")
    class Bayesian {

        @Test
        @DisplayName("unknown pairs use the default probability")
        void defaultProbability() {
            Map<String, Double> scores = new BayesianPropagationModel().propagate(chain(), "A");

            assertEquals(0.25, scores.get("B"), 1e-9);
            assertEquals(0.05, scores.get("C"), 1e-9);
        }

        @Test
        @DisplayName("configured probabilities scale each hop")
        void configuredProbability() {
            BayesianPropagationModel model = new BayesianPropagationModel(Map.of("A->B", 1.0, "B->C", 0.5));

            Map<String, Double> scores = model.propagate(chain(), "A");

            assertEquals(0.5, scores.get("B"), 1e-9);
            assertEquals(0.1, scores.get("C"), 1e-9);
            assertEquals(0.5, model.conditionalProbability("X", "Y"));
        }
    }

    @Test
    @DisplayName("registry defaults hold the three models in registration order")
    void registryDefaults() {
        PropagationModelRegistry registry = PropagationModelRegistry.withDefaults(Map.of());

        assertEquals(List.of("weighted_average", "minimum_trust", "bayesian"), List.copyOf(registry.names()));
        assertTrue(registry.get("bayesian").isPresent());
        assertTrue(registry.get("nope").isEmpty());
    }
}
