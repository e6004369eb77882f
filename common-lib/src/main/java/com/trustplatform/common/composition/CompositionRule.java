package com.trustplatform.common.composition;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Graph-wide rule: matches when any of its {@code conditions} holds for any node.
 * Lower {@code priority} is evaluated first.
 */
public record CompositionRule(
    @JsonProperty("ruleId") String ruleId,
    @JsonProperty("ruleType") CompositionRuleType ruleType,
    @JsonProperty("conditions") List<CompositionCondition> conditions,
    @JsonProperty("actions") List<CompositionAction> actions,
    @JsonProperty("priority") int priority
) {
    public CompositionRule {
        conditions = List.copyOf(conditions);
        actions = List.copyOf(actions);
    }
}
