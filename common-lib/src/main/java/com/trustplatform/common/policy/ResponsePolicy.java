package com.trustplatform.common.policy;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Prioritized rule: when every condition holds, every action is dispatched.
 * Lower {@code priority} is evaluated first. Policies do not exclude each other.
 */
public record ResponsePolicy(
    @JsonProperty("policyId") String policyId,
    @JsonProperty("name") String name,
    @JsonProperty("conditions") List<ResponseCondition> conditions,
    @JsonProperty("actions") List<ResponseAction> actions,
    @JsonProperty("priority") int priority,
    @JsonProperty("enabled") boolean enabled,
    @JsonProperty("escalationChain") List<EscalationStep> escalationChain
) {
    public ResponsePolicy {
        conditions = List.copyOf(conditions);
        actions = List.copyOf(actions);
        escalationChain = escalationChain == null ? List.of() : List.copyOf(escalationChain);
    }

    public static ResponsePolicy of(String policyId, String name, int priority,
                                    List<ResponseCondition> conditions, List<ResponseAction> actions) {
        return new ResponsePolicy(policyId, name, conditions, actions, priority, true, List.of());
    }

    public ResponsePolicy withEnabled(boolean flag) {
        return new ResponsePolicy(policyId, name, conditions, actions, priority, flag, escalationChain);
    }
}
