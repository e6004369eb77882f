package com.trustplatform.response.recovery;

import com.trustplatform.common.exception.ResourceNotFoundException;
import com.trustplatform.common.exception.TrustEngineException;
import com.trustplatform.response.incident.ActionRecord;
import com.trustplatform.response.service.ActionDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Runs registered {@link RecoveryPlan recovery plans} against a component.
 *
 * <p>Steps execute strictly one after another through {@link ActionDispatcher}, so each gets the
 * same executor routing, timeout and retry handling as policy actions. The first failed step ends
 * the run as {@link RecoveryStatus#FAILED}. When every step succeeds, the plan's success criteria
 * are checked against the step metrics merged in step order (a later step overwrites an earlier
 * metric of the same name); all must hold for {@link RecoveryStatus#COMPLETED}.
 */
@Component
public class RecoveryCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RecoveryCoordinator.class);

    private final ActionDispatcher dispatcher;
    private final Map<String, RecoveryPlan> plans = new LinkedHashMap<>();
    private final List<RecoveryRecord> history = new ArrayList<>();

    public RecoveryCoordinator(ActionDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    public synchronized void registerPlan(RecoveryPlan plan) {
        plans.put(plan.planId(), plan);
        log.info("[RecoveryCoordinator] PLAN_REGISTERED planId={} steps={}", plan.planId(), plan.steps().size());
    }

    public synchronized RecoveryPlan getPlan(String planId) {
        RecoveryPlan plan = plans.get(planId);
        if (plan == null) {
            throw new ResourceNotFoundException("Recovery plan", planId);
        }
        return plan;
    }

    public Mono<RecoveryRecord> startRecovery(String componentId, String planId) {
        return Mono.defer(() -> {
            RecoveryPlan plan = getPlan(planId);
            if (!plan.appliesTo(componentId)) {
                throw new TrustEngineException("Recovery plan " + planId + " does not cover component " + componentId);
            }

            RecoveryRecord record = new RecoveryRecord();
            record.setRecoveryId(UUID.randomUUID().toString());
            record.setPlanId(planId);
            record.setComponentId(componentId);
            record.setStartedAt(Instant.now());
            record.setStatus(RecoveryStatus.IN_PROGRESS);
            log.info("[RecoveryCoordinator] RECOVERY_STARTED recoveryId={} planId={} componentId={}",
                record.getRecoveryId(), planId, componentId);

            return Flux.fromIterable(plan.steps())
                .concatMap(step -> dispatcher.dispatch(step.toAction(componentId), planId))
                .takeUntil(step -> !step.succeeded())
                .collectList()
                .map(steps -> finish(plan, record, steps));
        });
    }

    private RecoveryRecord finish(RecoveryPlan plan, RecoveryRecord record, List<ActionRecord> steps) {
        Map<String, Double> metrics = new HashMap<>();
        for (ActionRecord step : steps) {
            if (!step.succeeded()) {
                record.setStatus(RecoveryStatus.FAILED);
                record.setFailureReason("Step " + step.actionId() + " failed: " + step.result());
                break;
            }
            record.getStepsCompleted().add(step.actionId());
            metrics.putAll(step.metrics());
        }

        if (record.getStatus() == RecoveryStatus.IN_PROGRESS) {
            for (SuccessCriterion criterion : plan.successCriteria()) {
                if (criterion.isMet(metrics)) {
                    record.getSuccessCriteriaMet().add(criterion.criterionId());
                }
            }
            boolean allMet = record.getSuccessCriteriaMet().size() == plan.successCriteria().size();
            record.setStatus(allMet ? RecoveryStatus.COMPLETED : RecoveryStatus.FAILED);
            if (!allMet) {
                record.setFailureReason("Success criteria not met");
            }
        }
        record.setCompletedAt(Instant.now());

        synchronized (this) {
            history.add(record.copy());
        }
        log.info("[RecoveryCoordinator] RECOVERY_{} recoveryId={} stepsCompleted={} criteriaMet={}",
            record.getStatus(), record.getRecoveryId(), record.getStepsCompleted(), record.getSuccessCriteriaMet());
        return record;
    }

    public synchronized List<RecoveryRecord> getRecoveryHistory() {
        return history.stream().map(RecoveryRecord::copy).toList();
    }
}
