package com.trustplatform.response.service;

import com.trustplatform.common.policy.EscalationStep;
import com.trustplatform.common.policy.PolicyEvaluator;
import com.trustplatform.common.policy.ResponseAction;
import com.trustplatform.common.policy.ResponsePolicy;
import com.trustplatform.common.policy.ResponsePolicySet;
import com.trustplatform.common.policy.TrustContext;
import com.trustplatform.response.executor.ExecutorRegistry;
import com.trustplatform.response.incident.ActionRecord;
import com.trustplatform.response.incident.AppliedEscalation;
import com.trustplatform.response.incident.Incident;
import com.trustplatform.response.incident.IncidentSeverity;
import com.trustplatform.response.incident.IncidentStatus;
import com.trustplatform.response.incident.IncidentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns trust updates into remediation.
 *
 * <h3>Flow for {@link #processTrustUpdate(TrustContext)}</h3>
 * <ol>
 *   <li>Decide: walk the policy set in priority order; every enabled policy whose conditions all
 *       hold fires. This step is synchronous and completes before anything is dispatched.</li>
 *   <li>Dispatch: every action of every firing policy goes through {@link ActionDispatcher}.
 *       Dispatches run concurrently; records come back in decision order.</li>
 *   <li>Record: once every dispatch has finished, records are appended in decision order to the
 *       active incident of every target component, opening one when needed.</li>
 * </ol>
 * A failed action never stops its siblings.
 */
@Service
public class IncidentResponseEngine {

    private static final Logger log = LoggerFactory.getLogger(IncidentResponseEngine.class);

    private final ResponsePolicySet policies;
    private final ActionDispatcher dispatcher;
    private final IncidentStore incidents;
    private final ExecutorRegistry executors;

    public IncidentResponseEngine(ResponsePolicySet policies,
                                  ActionDispatcher dispatcher,
                                  IncidentStore incidents,
                                  ExecutorRegistry executors) {
        this.policies   = policies;
        this.dispatcher = dispatcher;
        this.incidents  = incidents;
        this.executors  = executors;
    }

    public Mono<ResponseReport> processTrustUpdate(TrustContext context) {
        List<ResponsePolicy> firing = PolicyEvaluator.evaluate(policies.ordered(), context);
        if (firing.isEmpty()) {
            log.debug("[IncidentResponseEngine] NO_POLICY_MATCH componentId={} trustScore={}",
                context.componentId(), context.trustScore());
            return Mono.just(ResponseReport.noAction(context.componentId(), context.trustScore()));
        }

        List<String> policyIds = firing.stream().map(ResponsePolicy::policyId).toList();
        log.info("[IncidentResponseEngine] POLICIES_TRIGGERED componentId={} trustScore={} policies={}",
            context.componentId(), context.trustScore(), policyIds);

        IncidentSeverity severity = IncidentSeverity.fromTrustScore(context.trustScore());
        String description = String.format("Trust score %.3f for %s triggered %s",
            context.trustScore(), context.componentId(), policyIds);

        return Flux.fromIterable(firing)
            .concatMapIterable(policy -> policy.actions().stream()
                .map(action -> new ScheduledAction(policy.policyId(), action))
                .toList())
            .flatMapSequential(scheduled -> dispatcher.dispatch(scheduled.action(), scheduled.policyId())
                .map(record -> new Dispatched(scheduled.action(), record)))
            .collectList()
            .map(dispatched -> {
                List<ActionRecord> records = new ArrayList<>();
                Set<String> incidentIds = new LinkedHashSet<>();
                for (Dispatched d : dispatched) {
                    DispatchOutcome outcome = recordOutcome(d.action(), d.record(), context.componentId(),
                        severity, description);
                    records.add(outcome.record());
                    incidentIds.addAll(outcome.incidentIds());
                }
                return new ResponseReport(context.componentId(), context.trustScore(), policyIds,
                    records, new ArrayList<>(incidentIds), Instant.now());
            });
    }

    private DispatchOutcome recordOutcome(ResponseAction action, ActionRecord record, String componentId,
                                          IncidentSeverity severity, String description) {
        List<String> incidentIds = new ArrayList<>();
        for (String target : action.targetsOrDefault(componentId)) {
            incidentIds.add(incidents.appendAction(target, record, severity, description).getIncidentId());
        }
        return new DispatchOutcome(record, incidentIds);
    }

    // ── policies & executors ────────────────────────────────────────────────

    public void addResponsePolicy(ResponsePolicy policy) {
        policies.add(policy);
        log.info("[IncidentResponseEngine] POLICY_ADDED policyId={} priority={}", policy.policyId(), policy.priority());
    }

    public boolean removeResponsePolicy(String policyId) {
        boolean removed = policies.remove(policyId);
        log.info("[IncidentResponseEngine] POLICY_REMOVED policyId={} removed={}", policyId, removed);
        return removed;
    }

    public List<ResponsePolicy> getResponsePolicies() {
        return policies.ordered();
    }

    public List<String> getExecutorNames() {
        return executors.names();
    }

    // ── incidents ───────────────────────────────────────────────────────────

    public Incident createIncident(String componentId, IncidentSeverity severity, String description) {
        return incidents.open(componentId, severity, description);
    }

    public Incident resolveIncident(String incidentId) {
        return incidents.resolve(incidentId);
    }

    public Incident closeIncident(String incidentId) {
        return incidents.close(incidentId);
    }

    public Incident updateIncidentStatus(String incidentId, IncidentStatus status) {
        return incidents.transition(incidentId, status);
    }

    public Incident getIncident(String incidentId) {
        return incidents.get(incidentId);
    }

    public List<Incident> getActiveIncidents() {
        return incidents.active();
    }

    /**
     * Applies the next unapplied step of {@code policyId}'s escalation chain to the incident.
     *
     * <p>Steps are applied in chain order; {@link IncidentStore#escalate} picks and records the step
     * atomically. The incident moves to {@link IncidentStatus#ESCALATED}. The step's actions are
     * dispatched and appended to the incident unless the step requires approval.
     *
     * @throws com.trustplatform.common.exception.ResourceNotFoundException unknown incident or policy
     * @throws com.trustplatform.common.exception.TrustEngineException the chain is empty or exhausted, or the incident is closed
     */
    public Mono<Incident> escalateIncident(String incidentId, String policyId, String escalatedTo, String reason) {
        return Mono.defer(() -> {
            List<EscalationStep> chain = policies.get(policyId).escalationChain();
            AppliedEscalation applied = incidents.escalate(incidentId, policyId, chain, escalatedTo, reason);
            Incident escalated = applied.incident();
            EscalationStep step = applied.step();

            if (step.approvalRequired() || step.actions().isEmpty()) {
                return Mono.just(escalated);
            }

            return Flux.fromIterable(step.actions())
                .flatMapSequential(action -> dispatcher.dispatch(action, policyId)
                    .map(record -> new Dispatched(action, record)))
                .collectList()
                .map(dispatched -> {
                    dispatched.forEach(d -> recordOutcome(d.action(), d.record(), escalated.getComponentId(),
                        escalated.getSeverity(), escalated.getDescription()));
                    return incidents.get(incidentId);
                });
        });
    }

    private record ScheduledAction(String policyId, ResponseAction action) {
    }

    private record Dispatched(ResponseAction action, ActionRecord record) {
    }
}
