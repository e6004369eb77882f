package com.trustplatform.response.incident;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trustplatform.common.policy.ActionType;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Outcome of one action dispatch, as appended to an {@link Incident}.
 *
 * <p>{@code executorName} is {@code null} when no executor could be resolved;
 * {@code attempts} counts executor invocations including retries.
 */
public record ActionRecord(
    @JsonProperty("actionId") String actionId,
    @JsonProperty("actionType") ActionType actionType,
    @JsonProperty("policyId") String policyId,
    @JsonProperty("executorName") String executorName,
    @JsonProperty("executedAt") Instant executedAt,
    @JsonProperty("status") ActionStatus status,
    @JsonProperty("result") String result,
    @JsonProperty("metrics") Map<String, Double> metrics,
    @JsonProperty("duration") Duration duration,
    @JsonProperty("attempts") int attempts
) {
    public ActionRecord {
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
    }

    public boolean succeeded() {
        return status == ActionStatus.COMPLETED;
    }
}
