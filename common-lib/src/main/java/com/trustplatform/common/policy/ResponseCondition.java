package com.trustplatform.common.policy;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * One {@code (metric, operator, threshold[, duration])} predicate of a {@link ResponsePolicy}.
 *
 * <p>{@code duration} is carried for policy authors but the evaluator applies no time window.
 */
public record ResponseCondition(
    @JsonProperty("conditionType") ConditionType conditionType,
    @JsonProperty("metricName") String metricName,
    @JsonProperty("operator") ComparisonOperator operator,
    @JsonProperty("threshold") double threshold,
    @JsonProperty("duration") Duration duration
) {
    public static ResponseCondition trustScore(ComparisonOperator operator, double threshold) {
        return new ResponseCondition(ConditionType.TRUST_SCORE, "trust_score", operator, threshold, null);
    }

    public static ResponseCondition of(ConditionType type, String metricName,
                                       ComparisonOperator operator, double threshold) {
        return new ResponseCondition(type, metricName, operator, threshold, null);
    }
}
