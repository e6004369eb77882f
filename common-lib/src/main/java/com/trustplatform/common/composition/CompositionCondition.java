package com.trustplatform.common.composition;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trustplatform.common.model.ComponentType;

/**
 * Whole-graph predicate. Null fields are ignored; {@code componentType}, when set, restricts
 * which nodes the other predicates look at.
 */
public record CompositionCondition(
    @JsonProperty("componentType") ComponentType componentType,
    @JsonProperty("trustThreshold") Double trustThreshold,
    @JsonProperty("securityCondition") SecurityCondition securityCondition
) {
    public static CompositionCondition trustBelow(double threshold) {
        return new CompositionCondition(null, threshold, null);
    }

    public static CompositionCondition security(SecurityCondition condition) {
        return new CompositionCondition(null, null, condition);
    }
}
