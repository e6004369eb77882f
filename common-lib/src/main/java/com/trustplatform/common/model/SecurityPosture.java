package com.trustplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Security sub-scores of a component. Each value is conventionally in [0.0, 1.0];
 * {@code vulnerabilityScore} grows with exposure, the others grow with hardening.
 */
public record SecurityPosture(
    @JsonProperty("vulnerabilityScore") double vulnerabilityScore,
    @JsonProperty("patchStatus") double patchStatus,
    @JsonProperty("complianceScore") double complianceScore,
    @JsonProperty("encryptionStatus") double encryptionStatus,
    @JsonProperty("accessControlScore") double accessControlScore
) {
    /** Fully patched, compliant, encrypted posture with no known vulnerabilities. */
    public static SecurityPosture hardened() {
        return new SecurityPosture(0.0, 1.0, 1.0, 1.0, 1.0);
    }
}
