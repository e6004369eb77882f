package com.trustplatform.common.composition;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

public record CompositionAction(
    @JsonProperty("actionType") CompositionActionType actionType,
    @JsonProperty("targetComponents") List<String> targetComponents,
    @JsonProperty("parameters") Map<String, String> parameters
) {
    public CompositionAction {
        targetComponents = targetComponents == null ? List.of() : List.copyOf(targetComponents);
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }
}
