package com.trustplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One tuple from the upstream scoring feed. Score and confidence are expected in [0.0, 1.0].
 */
public record TrustScoreUpdate(
    @JsonProperty("componentId") String componentId,
    @JsonProperty("trustScore") double trustScore,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("timestamp") Instant timestamp
) {
    public static TrustScoreUpdate of(String componentId, double trustScore, double confidence) {
        return new TrustScoreUpdate(componentId, trustScore, confidence, Instant.now());
    }
}
