package com.trustplatform.common.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record WeakLink(
    @JsonProperty("componentId") String componentId,
    @JsonProperty("trustScore") double trustScore,
    @JsonProperty("impactAssessment") ImpactAssessment impactAssessment,
    @JsonProperty("mitigationSuggestions") List<String> mitigationSuggestions
) {
    public WeakLink {
        mitigationSuggestions = List.copyOf(mitigationSuggestions);
    }
}
