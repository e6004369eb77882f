package com.trustplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * A component registered in the {@link com.trustplatform.common.graph.TrustGraph}.
 *
 * <p>{@code trustScore} is conventionally in [0.0, 1.0] but the graph never clamps it.
 * Instances are immutable; the graph replaces a node on every update.
 */
public record TrustNode(
    @JsonProperty("id") String id,
    @JsonProperty("trustScore") double trustScore,
    @JsonProperty("componentType") ComponentType componentType,
    @JsonProperty("securityPosture") SecurityPosture securityPosture,
    @JsonProperty("lastUpdated") Instant lastUpdated,
    @JsonProperty("metadata") Map<String, String> metadata
) {
    public TrustNode {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        securityPosture = securityPosture == null ? SecurityPosture.hardened() : securityPosture;
    }

    public static TrustNode of(String id, double trustScore, ComponentType componentType) {
        return new TrustNode(id, trustScore, componentType, SecurityPosture.hardened(), Instant.now(), Map.of());
    }

    public TrustNode withTrustScore(double score, Instant updatedAt) {
        return new TrustNode(id, score, componentType, securityPosture, updatedAt, metadata);
    }
}
