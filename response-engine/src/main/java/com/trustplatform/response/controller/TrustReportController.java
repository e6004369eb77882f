package com.trustplatform.response.controller;

import com.trustplatform.common.composition.CompositionEngine;
import com.trustplatform.common.composition.PropagationAnalysis;
import com.trustplatform.common.composition.SystemTrustScore;
import com.trustplatform.common.model.TrustNode;
import com.trustplatform.response.alert.Alert;
import com.trustplatform.response.alert.AlertManager;
import com.trustplatform.response.incident.Incident;
import com.trustplatform.response.ingest.ComponentStatus;
import com.trustplatform.response.ingest.TrustScoreIngestionService;
import com.trustplatform.response.ingest.TrustScorePoint;
import com.trustplatform.response.service.IncidentResponseEngine;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Read-only views over trust scores, incidents, alerts and composition results.
 */
@RestController
@RequestMapping("/api/v1/trust")
public class TrustReportController {

    private final TrustScoreIngestionService ingestion;
    private final IncidentResponseEngine responseEngine;
    private final AlertManager alertManager;
    private final CompositionEngine compositionEngine;

    public TrustReportController(TrustScoreIngestionService ingestion,
                                 IncidentResponseEngine responseEngine,
                                 AlertManager alertManager,
                                 CompositionEngine compositionEngine) {
        this.ingestion         = ingestion;
        this.responseEngine    = responseEngine;
        this.alertManager      = alertManager;
        this.compositionEngine = compositionEngine;
    }

    @GetMapping("/scores")
    public Mono<Map<String, Double>> scores() {
        return Mono.fromSupplier(ingestion::getTrustScores);
    }

    @GetMapping("/scores/{componentId}/history")
    public Mono<List<TrustScorePoint>> history(@PathVariable String componentId) {
        return Mono.fromSupplier(() -> ingestion.getTrustHistory(componentId));
    }

    @GetMapping("/scores/{componentId}/status")
    public Mono<ComponentStatus> status(@PathVariable String componentId) {
        return Mono.fromSupplier(() -> ingestion.getComponentStatus(componentId));
    }

    @GetMapping("/incidents")
    public Mono<List<Incident>> activeIncidents() {
        return Mono.fromSupplier(responseEngine::getActiveIncidents);
    }

    @GetMapping("/incidents/{incidentId}")
    public Mono<Incident> incident(@PathVariable String incidentId) {
        return Mono.fromSupplier(() -> responseEngine.getIncident(incidentId));
    }

    @GetMapping("/alerts")
    public Mono<List<Alert>> activeAlerts() {
        return Mono.fromSupplier(alertManager::getActiveAlerts);
    }

    /** Without {@code roots}, every registered component is used as a root. */
    @GetMapping("/system")
    public Mono<SystemTrustScore> systemTrust(@RequestParam(required = false) List<String> roots) {
        return Mono.fromSupplier(() -> {
            List<String> effective = roots != null && !roots.isEmpty()
                ? roots
                : compositionEngine.graph().snapshot().nodes().stream().map(TrustNode::id).toList();
            return compositionEngine.calculateSystemTrust(effective);
        });
    }

    @GetMapping("/propagation/{source}")
    public Mono<PropagationAnalysis> propagation(@PathVariable String source) {
        return Mono.fromSupplier(() -> compositionEngine.getPropagationAnalysis(source));
    }
}
