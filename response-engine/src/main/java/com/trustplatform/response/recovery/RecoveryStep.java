package com.trustplatform.response.recovery;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trustplatform.common.policy.ActionType;
import com.trustplatform.common.policy.ResponseAction;

import java.time.Duration;
import java.util.List;
import java.util.Map;

public record RecoveryStep(
    @JsonProperty("stepId") String stepId,
    @JsonProperty("stepName") String stepName,
    @JsonProperty("actionType") ActionType actionType,
    @JsonProperty("parameters") Map<String, String> parameters,
    @JsonProperty("timeout") Duration timeout,
    @JsonProperty("retryCount") int retryCount
) {
    public RecoveryStep {
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
        timeout = timeout == null ? ResponseAction.DEFAULT_TIMEOUT : timeout;
    }

    public static RecoveryStep of(String stepId, String stepName, ActionType actionType) {
        return new RecoveryStep(stepId, stepName, actionType, Map.of(), null, 0);
    }

    /** The step as a dispatchable action aimed at {@code componentId}. */
    ResponseAction toAction(String componentId) {
        return new ResponseAction(stepId, actionType, List.of(componentId), parameters, timeout, retryCount, List.of());
    }
}
