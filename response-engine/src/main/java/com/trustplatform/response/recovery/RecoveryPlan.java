package com.trustplatform.response.recovery;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Ordered recovery procedure. {@code targetComponents} lists the components the plan is meant
 * for; an empty list means any component.
 */
public record RecoveryPlan(
    @JsonProperty("planId") String planId,
    @JsonProperty("name") String name,
    @JsonProperty("targetComponents") List<String> targetComponents,
    @JsonProperty("steps") List<RecoveryStep> steps,
    @JsonProperty("successCriteria") List<SuccessCriterion> successCriteria
) {
    public RecoveryPlan {
        targetComponents = targetComponents == null ? List.of() : List.copyOf(targetComponents);
        steps = List.copyOf(steps);
        successCriteria = successCriteria == null ? List.of() : List.copyOf(successCriteria);
    }

    public boolean appliesTo(String componentId) {
        return targetComponents.isEmpty() || targetComponents.contains(componentId);
    }
}
