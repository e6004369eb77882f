package com.trustplatform.response.controller;

import com.trustplatform.common.analysis.StructuralAnalyzer;
import com.trustplatform.common.composition.CompositionEngine;
import com.trustplatform.common.graph.TrustGraph;
import com.trustplatform.common.model.ComponentType;
import com.trustplatform.common.model.TrustEdge;
import com.trustplatform.common.model.TrustNode;
import com.trustplatform.common.model.TrustScoreUpdate;
import com.trustplatform.common.policy.ActionType;
import com.trustplatform.common.policy.ComparisonOperator;
import com.trustplatform.common.policy.ResponseAction;
import com.trustplatform.common.policy.ResponseCondition;
import com.trustplatform.common.policy.ResponsePolicy;
import com.trustplatform.common.policy.ResponsePolicySet;
import com.trustplatform.common.propagation.PropagationModelRegistry;
import com.trustplatform.common.propagation.WeightedAveragePropagationModel;
import com.trustplatform.response.alert.AlertManager;
import com.trustplatform.response.executor.ExecutorRegistry;
import com.trustplatform.response.executor.IsolationExecutor;
import com.trustplatform.response.incident.IncidentStore;
import com.trustplatform.response.ingest.TrustScoreIngestionService;
import com.trustplatform.response.service.ActionDispatcher;
import com.trustplatform.response.service.IncidentResponseEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.List;

class TrustReportControllerTest {

    private WebTestClient client;
    private IncidentResponseEngine engine;
    private TrustScoreIngestionService ingestion;

    @BeforeEach
    void setUp() {
        TrustGraph graph = new TrustGraph();
        graph.addNode(TrustNode.of("A", 0.9, ComponentType.API));
        graph.addNode(TrustNode.of("B", 0.8, ComponentType.DATABASE));
        graph.addEdge(TrustEdge.of("A", "B", 0.5));

        PropagationModelRegistry models = new PropagationModelRegistry();
        models.register(new WeightedAveragePropagationModel());
        CompositionEngine composition = new CompositionEngine(graph, models, new StructuralAnalyzer());

        ExecutorRegistry registry = new ExecutorRegistry(List.of(new IsolationExecutor()), false);
        engine = new IncidentResponseEngine(new ResponsePolicySet(), new ActionDispatcher(registry),
            new IncidentStore(), registry);
        AlertManager alerts = new AlertManager(0.2, 0.5);
        ingestion = new TrustScoreIngestionService(graph, alerts, engine, 100, 0.2, 0.5);

        client = WebTestClient
            .bindToController(new TrustReportController(ingestion, engine, alerts, composition))
            .controllerAdvice(new ErrorHandler())
            .build();
    }

    @Test
    @DisplayName("low score shows up in scores, incidents and alerts")
    void ingestedState() {
        engine.addResponsePolicy(ResponsePolicy.of("isolate", "isolate", 1,
            List.of(ResponseCondition.trustScore(ComparisonOperator.LESS_THAN, 0.2)),
            List.of(ResponseAction.of("isolate", ActionType.ISOLATE_COMPONENT, List.of()))));
        ingestion.ingest(TrustScoreUpdate.of("B", 0.1, 1.0)).block();

        client.get().uri("/api/v1/trust/scores").exchange()
            .expectStatus().isOk()
            .expectBody().jsonPath("$.B").isEqualTo(0.1);

        client.get().uri("/api/v1/trust/incidents").exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.length()").isEqualTo(1)
            .jsonPath("$[0].componentId").isEqualTo("B")
            .jsonPath("$[0].status").isEqualTo("OPEN");

        client.get().uri("/api/v1/trust/alerts").exchange()
            .expectStatus().isOk()
            .expectBody().jsonPath("$[0].severity").isEqualTo("CRITICAL");

        client.get().uri("/api/v1/trust/scores/B/status").exchange()
            .expectStatus().isOk()
            .expectBody(String.class).isEqualTo("\"CRITICAL\"");
    }

    @Test
    @DisplayName("system trust over the registered components")
    void systemTrust() {
        client.get().uri("/api/v1/trust/system?roots=A").exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.componentScores.A").isEqualTo(1.0)
            .jsonPath("$.componentScores.B").isEqualTo(0.5);
    }

    @Test
    @DisplayName("propagation analysis per model")
    void propagation() {
        client.get().uri("/api/v1/trust/propagation/A").exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.sourceComponent").isEqualTo("A")
            .jsonPath("$.propagationResults.weighted_average.B").isEqualTo(0.5);
    }

    @Test
    @DisplayName("unknown incident → 404")
    void incidentNotFound() {
        client.get().uri("/api/v1/trust/incidents/missing").exchange()
            .expectStatus().isNotFound()
            .expectBody().jsonPath("$.code").isEqualTo("NOT_FOUND");
    }
}
