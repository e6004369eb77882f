package com.trustplatform.response.alert;

import com.trustplatform.common.exception.ResourceNotFoundException;
import com.trustplatform.common.exception.TrustEngineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Threshold alerting over incoming trust scores, plus the alert lifecycle.
 *
 * <h3>Trust score bands</h3>
 * <pre>
 *   score &lt; trust.alerts.critical-threshold (0.2) → CRITICAL TRUST_SCORE_LOW
 *   score &lt; trust.alerts.warning-threshold  (0.5) → MEDIUM   TRUST_SCORE_LOW
 *   otherwise                                     → no alert
 * </pre>
 * While a component has an open alert of a given type, raising it again returns that alert
 * instead of a duplicate. When the new severity is higher, the open alert is upgraded in place
 * (severity, message and score) and becomes {@link AlertStatus#ACTIVE} again.
 */
@Component
public class AlertManager {

    private static final Logger log = LoggerFactory.getLogger(AlertManager.class);

    private final double criticalThreshold;
    private final double warningThreshold;
    private final Map<String, Alert> alerts = new LinkedHashMap<>();

    public AlertManager(@Value("${trust.alerts.critical-threshold:0.2}") double criticalThreshold,
                        @Value("${trust.alerts.warning-threshold:0.5}") double warningThreshold) {
        if (criticalThreshold > warningThreshold) {
            throw new TrustEngineException("Critical alert threshold " + criticalThreshold
                + " is above warning threshold " + warningThreshold);
        }
        this.criticalThreshold = criticalThreshold;
        this.warningThreshold  = warningThreshold;
    }

    public Optional<Alert> evaluateTrustScore(String componentId, double trustScore) {
        AlertSeverity severity;
        if (trustScore < criticalThreshold) {
            severity = AlertSeverity.CRITICAL;
        } else if (trustScore < warningThreshold) {
            severity = AlertSeverity.MEDIUM;
        } else {
            return Optional.empty();
        }
        String message = String.format("Trust score %.3f below %s threshold for %s",
            trustScore, severity == AlertSeverity.CRITICAL ? "critical" : "warning", componentId);
        return Optional.of(raise(componentId, AlertType.TRUST_SCORE_LOW, severity, message, trustScore));
    }

    public Alert raise(String componentId, AlertType type, AlertSeverity severity, String message) {
        return raise(componentId, type, severity, message, null);
    }

    private synchronized Alert raise(String componentId, AlertType type, AlertSeverity severity,
                                     String message, Double trustScore) {
        for (Alert existing : alerts.values()) {
            if (existing.getStatus().isOpen()
                    && existing.getAlertType() == type
                    && existing.getComponentId().equals(componentId)) {
                if (existing.getSeverity().compareTo(severity) >= 0) {
                    return existing.copy();
                }
                return upgrade(existing, severity, message, trustScore);
            }
        }

        Alert alert = new Alert();
        alert.setAlertId(UUID.randomUUID().toString());
        alert.setAlertType(type);
        alert.setSeverity(severity);
        alert.setComponentId(componentId);
        alert.setMessage(message);
        alert.setTrustScore(trustScore);
        alert.setStatus(AlertStatus.ACTIVE);
        alert.setCreatedAt(Instant.now());
        alerts.put(alert.getAlertId(), alert);

        log.warn("[AlertManager] ALERT_RAISED alertId={} componentId={} type={} severity={}",
            alert.getAlertId(), componentId, type, severity);
        return alert.copy();
    }

    // an acknowledged alert returns to ACTIVE when its severity rises
    private Alert upgrade(Alert alert, AlertSeverity severity, String message, Double trustScore) {
        AlertSeverity previous = alert.getSeverity();
        alert.setSeverity(severity);
        alert.setMessage(message);
        alert.setTrustScore(trustScore);
        alert.setStatus(AlertStatus.ACTIVE);
        alert.setAcknowledgedAt(null);
        log.warn("[AlertManager] ALERT_UPGRADED alertId={} componentId={} type={} from={} to={}",
            alert.getAlertId(), alert.getComponentId(), alert.getAlertType(), previous, severity);
        return alert.copy();
    }

    public synchronized Alert acknowledge(String alertId) {
        Alert alert = move(alertId, AlertStatus.ACKNOWLEDGED);
        alert.setAcknowledgedAt(Instant.now());
        return alert.copy();
    }

    public synchronized Alert resolve(String alertId) {
        Alert alert = move(alertId, AlertStatus.RESOLVED);
        alert.setResolvedAt(Instant.now());
        return alert.copy();
    }

    public synchronized Alert suppress(String alertId) {
        return move(alertId, AlertStatus.SUPPRESSED).copy();
    }

    public synchronized Alert get(String alertId) {
        return require(alertId).copy();
    }

    /** Alerts still {@link AlertStatus#isOpen() open}, oldest first. */
    public synchronized List<Alert> getActiveAlerts() {
        return alerts.values().stream()
            .filter(a -> a.getStatus().isOpen())
            .map(Alert::copy)
            .toList();
    }

    private Alert move(String alertId, AlertStatus next) {
        Alert alert = require(alertId);
        if (!alert.getStatus().canTransitionTo(next)) {
            throw new TrustEngineException("Alert " + alertId + " cannot move from "
                + alert.getStatus() + " to " + next);
        }
        alert.setStatus(next);
        log.info("[AlertManager] ALERT_{} alertId={} componentId={}", next, alertId, alert.getComponentId());
        return alert;
    }

    private Alert require(String alertId) {
        Alert alert = alerts.get(alertId);
        if (alert == null) {
            throw new ResourceNotFoundException("Alert", alertId);
        }
        return alert;
    }
}
