package com.trustplatform.common.composition;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Side-by-side output of every registered propagation model for one source.
 * {@code propagationResults} maps model name → (component id → derived trust).
 */
public record PropagationAnalysis(
    @JsonProperty("sourceComponent") String sourceComponent,
    @JsonProperty("propagationResults") Map<String, Map<String, Double>> propagationResults,
    @JsonProperty("timestamp") Instant timestamp
) {}
