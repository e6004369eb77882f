package com.trustplatform.common.composition;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Matches a node whose vulnerability exceeds {@code vulnerabilityThreshold}, whose compliance
 * falls below {@code complianceThreshold}, or which is not fully patched when
 * {@code patchStatusRequired} is set.
 */
public record SecurityCondition(
    @JsonProperty("vulnerabilityThreshold") double vulnerabilityThreshold,
    @JsonProperty("patchStatusRequired") boolean patchStatusRequired,
    @JsonProperty("complianceThreshold") double complianceThreshold
) {
    public static SecurityCondition vulnerabilityAbove(double threshold) {
        return new SecurityCondition(threshold, false, 0.0);
    }
}
