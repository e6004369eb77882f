package com.trustplatform.response.incident;

import com.trustplatform.common.exception.ResourceNotFoundException;
import com.trustplatform.common.exception.TrustEngineException;
import com.trustplatform.common.policy.EscalationStep;
import com.trustplatform.common.policy.ResponseAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * In-memory incident store keyed by incident id, with a secondary index of the one active
 * incident per component.
 *
 * <p>At most one active (non-terminal) incident exists per component. Once it is resolved or
 * closed the index entry is dropped and the next action against that component opens a fresh
 * incident; the old one stays readable by id.
 *
 * <p>All operations are serialized on the store monitor. Returned incidents are copies.
 */
@Component
public class IncidentStore {

    private static final Logger log = LoggerFactory.getLogger(IncidentStore.class);

    private final Map<String, Incident> incidents = new LinkedHashMap<>();
    private final Map<String, String> activeByComponent = new LinkedHashMap<>();

    /**
     * Opens an incident for {@code componentId}, or returns the one already active.
     */
    public synchronized Incident open(String componentId, IncidentSeverity severity, String description) {
        return openInternal(componentId, severity, description).copy();
    }

    /**
     * Appends {@code record} to the component's active incident, opening one with the given
     * severity and description when none is active.
     */
    public synchronized Incident appendAction(String componentId, ActionRecord record,
                                              IncidentSeverity severityIfNew, String descriptionIfNew) {
        Incident incident = openInternal(componentId, severityIfNew, descriptionIfNew);
        incident.getActionsTaken().add(record);
        Instant now = Instant.now();
        incident.setUpdatedAt(now);

        IncidentMetrics metrics = incident.getMetrics();
        if (metrics.getResponseTime() == null) {
            Duration elapsed = Duration.between(incident.getCreatedAt(), now);
            metrics.setResponseTime(elapsed.isNegative() ? Duration.ZERO : elapsed);
        }
        if (!record.succeeded()) {
            metrics.setFailedActions(metrics.getFailedActions() + 1);
        }
        return incident.copy();
    }

    public synchronized Incident resolve(String incidentId) {
        return finish(incidentId, IncidentStatus.RESOLVED);
    }

    public synchronized Incident close(String incidentId) {
        return finish(incidentId, IncidentStatus.CLOSED);
    }

    public synchronized Incident transition(String incidentId, IncidentStatus next) {
        if (next.isTerminal()) {
            return finish(incidentId, next);
        }
        Incident incident = require(incidentId);
        checkTransition(incident, next);
        incident.setStatus(next);
        incident.setUpdatedAt(Instant.now());
        log.info("[IncidentStore] INCIDENT_STATUS incidentId={} status={}", incidentId, next);
        return incident.copy();
    }

    /**
     * Applies the next unapplied step of {@code chain} to the incident and moves it to
     * {@link IncidentStatus#ESCALATED}.
     *
     * <p>The step index is the number of this chain's steps already in the escalation history.
     * Selection and recording happen under the store monitor, so concurrent callers never apply
     * the same step twice.
     *
     * @throws TrustEngineException the chain is empty or exhausted, or the incident is closed
     */
    public synchronized AppliedEscalation escalate(String incidentId, String policyId, List<EscalationStep> chain,
                                                   String escalatedTo, String reason) {
        Incident incident = require(incidentId);
        checkTransition(incident, IncidentStatus.ESCALATED);

        Set<String> chainStepIds = new HashSet<>();
        chain.forEach(step -> chainStepIds.add(step.stepId()));
        long applied = incident.getEscalationHistory().stream()
            .filter(r -> chainStepIds.contains(r.stepId()))
            .count();
        if (applied >= chain.size()) {
            throw new TrustEngineException("No further escalation step in policy " + policyId
                + " for incident " + incidentId);
        }

        EscalationStep step = chain.get((int) applied);
        List<String> actionIds = step.actions().stream().map(ResponseAction::actionId).toList();
        EscalationRecord record = new EscalationRecord(step.stepId(), Instant.now(), escalatedTo, reason,
            step.approvalRequired(), actionIds);
        incident.getEscalationHistory().add(record);
        incident.setStatus(IncidentStatus.ESCALATED);
        incident.setUpdatedAt(record.escalatedAt());
        log.info("[IncidentStore] INCIDENT_ESCALATED incidentId={} policyId={} step={} to={}",
            incidentId, policyId, step.stepId(), escalatedTo);
        return new AppliedEscalation(incident.copy(), step);
    }

    public synchronized Incident get(String incidentId) {
        return require(incidentId).copy();
    }

    public synchronized Optional<Incident> findActive(String componentId) {
        String id = activeByComponent.get(componentId);
        return id == null ? Optional.empty() : Optional.of(incidents.get(id).copy());
    }

    public synchronized List<Incident> active() {
        return activeByComponent.values().stream()
            .map(incidents::get)
            .map(Incident::copy)
            .toList();
    }

    public synchronized List<Incident> all() {
        return incidents.values().stream().map(Incident::copy).toList();
    }

    // ── internals (monitor held) ────────────────────────────────────────────

    private Incident openInternal(String componentId, IncidentSeverity severity, String description) {
        String activeId = activeByComponent.get(componentId);
        if (activeId != null) {
            return incidents.get(activeId);
        }
        Instant now = Instant.now();
        Incident incident = new Incident();
        incident.setIncidentId(UUID.randomUUID().toString());
        incident.setComponentId(componentId);
        incident.setTitle("Trust Score Incident - " + componentId);
        incident.setDescription(description);
        incident.setSeverity(severity);
        incident.setStatus(IncidentStatus.OPEN);
        incident.getAffectedComponents().add(componentId);
        incident.setCreatedAt(now);
        incident.setUpdatedAt(now);

        incidents.put(incident.getIncidentId(), incident);
        activeByComponent.put(componentId, incident.getIncidentId());
        log.info("[IncidentStore] INCIDENT_OPENED incidentId={} componentId={} severity={}",
            incident.getIncidentId(), componentId, severity);
        return incident;
    }

    private Incident finish(String incidentId, IncidentStatus terminal) {
        Incident incident = require(incidentId);
        checkTransition(incident, terminal);
        Instant now = Instant.now();
        incident.setStatus(terminal);
        incident.setUpdatedAt(now);
        if (terminal == IncidentStatus.RESOLVED) {
            incident.setResolvedAt(now);
        }
        incident.getMetrics().setResolutionTime(Duration.between(incident.getCreatedAt(), now));
        activeByComponent.remove(incident.getComponentId(), incidentId);
        log.info("[IncidentStore] INCIDENT_{} incidentId={} componentId={}",
            terminal, incidentId, incident.getComponentId());
        return incident.copy();
    }

    private Incident require(String incidentId) {
        Incident incident = incidents.get(incidentId);
        if (incident == null) {
            throw new ResourceNotFoundException("Incident", incidentId);
        }
        return incident;
    }

    private static void checkTransition(Incident incident, IncidentStatus next) {
        if (!incident.getStatus().canTransitionTo(next)) {
            throw new TrustEngineException("Incident " + incident.getIncidentId()
                + " cannot move from " + incident.getStatus() + " to " + next);
        }
    }
}
