package com.trustplatform.response.recovery;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trustplatform.common.policy.ComparisonOperator;

import java.util.Map;

/** Holds when {@code metricName} is present in the merged step metrics and passes the comparison. */
public record SuccessCriterion(
    @JsonProperty("criterionId") String criterionId,
    @JsonProperty("metricName") String metricName,
    @JsonProperty("operator") ComparisonOperator operator,
    @JsonProperty("threshold") double threshold,
    @JsonProperty("description") String description
) {
    public boolean isMet(Map<String, Double> metrics) {
        Double value = metrics.get(metricName);
        return value != null && operator.compare(value, threshold);
    }
}
