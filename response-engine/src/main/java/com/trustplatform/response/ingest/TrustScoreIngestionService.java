package com.trustplatform.response.ingest;

import com.trustplatform.common.exception.TrustEngineException;
import com.trustplatform.common.graph.TrustGraph;
import com.trustplatform.common.model.TrustScoreUpdate;
import com.trustplatform.common.policy.TrustContext;
import com.trustplatform.response.alert.AlertManager;
import com.trustplatform.response.service.IncidentResponseEngine;
import com.trustplatform.response.service.ResponseReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for the upstream scoring feed.
 *
 * <h3>Per update</h3>
 * <ol>
 *   <li>Reject scores or confidences outside [0.0, 1.0].</li>
 *   <li>Write the score to the trust graph. An unregistered component is logged and processing
 *       continues.</li>
 *   <li>Append to the component's bounded history ({@code trust.history.max-points}).</li>
 *   <li>Evaluate alert thresholds.</li>
 *   <li>Build a {@link TrustContext} from the update and its signals and hand it to the
 *       {@link IncidentResponseEngine}.</li>
 * </ol>
 */
@Service
public class TrustScoreIngestionService {

    private static final Logger log = LoggerFactory.getLogger(TrustScoreIngestionService.class);

    private final TrustGraph graph;
    private final AlertManager alerts;
    private final IncidentResponseEngine responseEngine;
    private final int maxHistoryPoints;
    private final double criticalThreshold;
    private final double warningThreshold;

    private final Map<String, Deque<TrustScorePoint>> history = new LinkedHashMap<>();

    public TrustScoreIngestionService(TrustGraph graph,
                                      AlertManager alerts,
                                      IncidentResponseEngine responseEngine,
                                      @Value("${trust.history.max-points:100}") int maxHistoryPoints,
                                      @Value("${trust.alerts.critical-threshold:0.2}") double criticalThreshold,
                                      @Value("${trust.alerts.warning-threshold:0.5}") double warningThreshold) {
        this.graph             = graph;
        this.alerts            = alerts;
        this.responseEngine    = responseEngine;
        this.maxHistoryPoints  = Math.max(1, maxHistoryPoints);
        this.criticalThreshold = criticalThreshold;
        this.warningThreshold  = warningThreshold;
    }

    public Mono<ResponseReport> ingest(TrustScoreUpdate update) {
        return ingest(update, TrustSignals.none());
    }

    public Mono<ResponseReport> ingest(TrustScoreUpdate update, TrustSignals signals) {
        return Mono.defer(() -> {
            validate(update);
            Instant timestamp = update.timestamp() != null ? update.timestamp() : Instant.now();
            String componentId = update.componentId();

            if (!graph.updateTrustScore(componentId, update.trustScore(), timestamp)) {
                log.warn("[TrustScoreIngestionService] UNKNOWN_COMPONENT componentId={} trustScore={}",
                    componentId, update.trustScore());
            }
            record(componentId, new TrustScorePoint(update.trustScore(), update.confidence(), timestamp));
            alerts.evaluateTrustScore(componentId, update.trustScore());

            TrustSignals s = signals != null ? signals : TrustSignals.none();
            TrustContext context = new TrustContext(componentId, update.trustScore(), s.securityEvents(),
                s.performanceMetrics(), s.behavioralAnomalies(), s.failedDependencies(),
                s.communicationFailures(), timestamp);
            return responseEngine.processTrustUpdate(context);
        });
    }

    private static void validate(TrustScoreUpdate update) {
        if (update.componentId() == null || update.componentId().isBlank()) {
            throw new TrustEngineException("Trust score update without component id");
        }
        if (!inUnitRange(update.trustScore())) {
            throw new TrustEngineException("Trust score " + update.trustScore()
                + " out of range [0, 1] for " + update.componentId());
        }
        if (!inUnitRange(update.confidence())) {
            throw new TrustEngineException("Confidence " + update.confidence()
                + " out of range [0, 1] for " + update.componentId());
        }
    }

    private static boolean inUnitRange(double value) {
        return value >= 0.0 && value <= 1.0;
    }

    private synchronized void record(String componentId, TrustScorePoint point) {
        Deque<TrustScorePoint> points = history.computeIfAbsent(componentId, k -> new ArrayDeque<>());
        points.addLast(point);
        while (points.size() > maxHistoryPoints) {
            points.removeFirst();
        }
    }

    /** Latest ingested score per component. */
    public synchronized Map<String, Double> getTrustScores() {
        Map<String, Double> scores = new LinkedHashMap<>();
        history.forEach((componentId, points) -> scores.put(componentId, points.getLast().trustScore()));
        return scores;
    }

    /** Oldest first; empty for a component never ingested. */
    public synchronized List<TrustScorePoint> getTrustHistory(String componentId) {
        Deque<TrustScorePoint> points = history.get(componentId);
        return points == null ? List.of() : List.copyOf(points);
    }

    public synchronized ComponentStatus getComponentStatus(String componentId) {
        Deque<TrustScorePoint> points = history.get(componentId);
        if (points == null) {
            return ComponentStatus.UNKNOWN;
        }
        double latest = points.getLast().trustScore();
        if (latest < criticalThreshold) return ComponentStatus.CRITICAL;
        if (latest < warningThreshold) return ComponentStatus.WARNING;
        return ComponentStatus.HEALTHY;
    }
}
