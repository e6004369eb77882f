package com.trustplatform.response.service;

import com.trustplatform.common.policy.ResponseAction;
import com.trustplatform.response.executor.ActionExecutionException;
import com.trustplatform.response.executor.ActionExecutor;
import com.trustplatform.response.executor.ActionResult;
import com.trustplatform.response.executor.ExecutorRegistry;
import com.trustplatform.response.incident.ActionRecord;
import com.trustplatform.response.incident.ActionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one {@link ResponseAction} against its executor and turns every outcome into an
 * {@link ActionRecord}. The returned {@link Mono} never errors.
 *
 * <h3>Failure mapping</h3>
 * <ul>
 *   <li>no executor routed for the action type → FAILED, zero attempts</li>
 *   <li>executor reports unhealthy → FAILED, zero attempts</li>
 *   <li>executor throws, or returns an unsuccessful result → retried up to
 *       {@code retryCount} times, then FAILED</li>
 *   <li>an attempt exceeds {@code timeout} → counts as a failed attempt</li>
 * </ul>
 */
@Service
public class ActionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ActionDispatcher.class);

    private final ExecutorRegistry registry;

    public ActionDispatcher(ExecutorRegistry registry) {
        this.registry = registry;
    }

    public Mono<ActionRecord> dispatch(ResponseAction action, String policyId) {
        Instant started = Instant.now();
        Optional<ActionExecutor> resolved = registry.resolve(action.actionType());
        if (resolved.isEmpty()) {
            log.warn("[ActionDispatcher] NO_EXECUTOR actionId={} actionType={} policyId={}",
                action.actionId(), action.actionType(), policyId);
            return Mono.just(failed(action, policyId, null,
                "No executor for action type " + action.actionType(), started, 0));
        }

        ActionExecutor executor = resolved.get();
        if (!executor.isHealthy()) {
            log.warn("[ActionDispatcher] EXECUTOR_UNHEALTHY actionId={} executor={}",
                action.actionId(), executor.executorName());
            return Mono.just(failed(action, policyId, executor.executorName(),
                "Executor " + executor.executorName() + " is unhealthy", started, 0));
        }

        AtomicInteger attempts = new AtomicInteger();
        return Mono.fromCallable(() -> invoke(executor, action, attempts))
            .subscribeOn(Schedulers.boundedElastic())
            .timeout(action.timeout())
            .retry(action.retryCount())
            .map(result -> {
                log.info("[ActionDispatcher] ACTION_COMPLETED actionId={} executor={} attempts={}",
                    action.actionId(), executor.executorName(), attempts.get());
                return new ActionRecord(action.actionId(), action.actionType(), policyId,
                    executor.executorName(), started, ActionStatus.COMPLETED, result.message(),
                    result.metrics(), Duration.between(started, Instant.now()), attempts.get());
            })
            .onErrorResume(e -> {
                String message = e instanceof TimeoutException
                    ? "Timed out after " + action.timeout()
                    : e.getMessage();
                log.warn("[ActionDispatcher] ACTION_FAILED actionId={} executor={} attempts={} reason={}",
                    action.actionId(), executor.executorName(), attempts.get(), message);
                return Mono.just(failed(action, policyId, executor.executorName(), message, started,
                    attempts.get()));
            });
    }

    private static ActionResult invoke(ActionExecutor executor, ResponseAction action, AtomicInteger attempts) {
        attempts.incrementAndGet();
        ActionResult result = executor.execute(action);
        if (!result.success()) {
            throw new ActionExecutionException(executor.executorName(), result.message());
        }
        return result;
    }

    private static ActionRecord failed(ResponseAction action, String policyId, String executorName,
                                       String message, Instant started, int attempts) {
        return new ActionRecord(action.actionId(), action.actionType(), policyId, executorName, started,
            ActionStatus.FAILED, message, Map.of(), Duration.between(started, Instant.now()), attempts);
    }
}
