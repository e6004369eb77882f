package com.trustplatform.common.policy;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * A remediation step scheduled by a {@link ResponsePolicy}.
 *
 * <p>{@code targetComponents} names the components whose incidents record the outcome; when
 * empty, the component under evaluation is the target. {@code timeout} and {@code retryCount}
 * bound each executor invocation. {@code dependencies} lists action ids this one logically
 * follows and is informational only.
 */
public record ResponseAction(
    @JsonProperty("actionId") String actionId,
    @JsonProperty("actionType") ActionType actionType,
    @JsonProperty("targetComponents") List<String> targetComponents,
    @JsonProperty("parameters") Map<String, String> parameters,
    @JsonProperty("timeout") Duration timeout,
    @JsonProperty("retryCount") int retryCount,
    @JsonProperty("dependencies") List<String> dependencies
) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    public ResponseAction {
        targetComponents = targetComponents == null ? List.of() : List.copyOf(targetComponents);
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
        timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
        retryCount = Math.max(0, retryCount);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    public static ResponseAction of(String actionId, ActionType type, List<String> targets) {
        return new ResponseAction(actionId, type, targets, Map.of(), DEFAULT_TIMEOUT, 0, List.of());
    }

    public static ResponseAction of(String actionId, ActionType type, List<String> targets,
                                    Map<String, String> parameters) {
        return new ResponseAction(actionId, type, targets, parameters, DEFAULT_TIMEOUT, 0, List.of());
    }

    /** Same action aimed at {@code componentId} when no explicit targets were configured. */
    public List<String> targetsOrDefault(String componentId) {
        return targetComponents.isEmpty() ? List.of(componentId) : targetComponents;
    }
}
