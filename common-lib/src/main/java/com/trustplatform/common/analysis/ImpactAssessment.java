package com.trustplatform.common.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Forward closure of a weak component: everything it can affect, itself included.
 */
public record ImpactAssessment(
    @JsonProperty("affectedComponents") List<String> affectedComponents,
    @JsonProperty("severity") ImpactSeverity severity
) {
    public ImpactAssessment {
        affectedComponents = List.copyOf(affectedComponents);
    }
}
