package com.trustplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Directed relationship {@code from → to}. {@code trustWeight} is the attenuation factor
 * applied when trust propagates across this edge.
 */
public record TrustEdge(
    @JsonProperty("from") String from,
    @JsonProperty("to") String to,
    @JsonProperty("relationshipType") RelationshipType relationshipType,
    @JsonProperty("trustWeight") double trustWeight,
    @JsonProperty("dataFlowVolume") double dataFlowVolume,
    @JsonProperty("criticality") double criticality
) {
    public static TrustEdge of(String from, String to, double trustWeight) {
        return new TrustEdge(from, to, RelationshipType.DEPENDENCY, trustWeight, 0.0, 0.5);
    }

    @JsonIgnore
    public String key() {
        return key(from, to);
    }

    public static String key(String from, String to) {
        return from + "->" + to;
    }
}
