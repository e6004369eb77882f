package com.trustplatform.common.policy;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.util.List;

/**
 * One rung of a policy's escalation chain. {@code delay} is advisory for the scheduler that
 * drives escalation; steps with {@code approvalRequired} are recorded but their actions are not
 * dispatched automatically.
 */
public record EscalationStep(
    @JsonProperty("stepId") String stepId,
    @JsonProperty("delay") Duration delay,
    @JsonProperty("actions") List<ResponseAction> actions,
    @JsonProperty("notificationChannels") List<String> notificationChannels,
    @JsonProperty("approvalRequired") boolean approvalRequired
) {
    public EscalationStep {
        delay = delay == null ? Duration.ZERO : delay;
        actions = actions == null ? List.of() : List.copyOf(actions);
        notificationChannels = notificationChannels == null ? List.of() : List.copyOf(notificationChannels);
    }
}
