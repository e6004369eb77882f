package com.trustplatform.common.policy;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Everything a {@link ResponsePolicy} can look at for one component at one point in time.
 */
public record TrustContext(
    @JsonProperty("componentId") String componentId,
    @JsonProperty("trustScore") double trustScore,
    @JsonProperty("securityEvents") List<SecurityEvent> securityEvents,
    @JsonProperty("performanceMetrics") Map<String, Double> performanceMetrics,
    @JsonProperty("behavioralAnomalies") List<BehavioralAnomaly> behavioralAnomalies,
    @JsonProperty("failedDependencies") List<String> failedDependencies,
    @JsonProperty("communicationFailures") List<String> communicationFailures,
    @JsonProperty("timestamp") Instant timestamp
) {
    public TrustContext {
        securityEvents = securityEvents == null ? List.of() : List.copyOf(securityEvents);
        performanceMetrics = performanceMetrics == null ? Map.of() : Map.copyOf(performanceMetrics);
        behavioralAnomalies = behavioralAnomalies == null ? List.of() : List.copyOf(behavioralAnomalies);
        failedDependencies = failedDependencies == null ? List.of() : List.copyOf(failedDependencies);
        communicationFailures = communicationFailures == null ? List.of() : List.copyOf(communicationFailures);
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    /** Context carrying only a trust score. */
    public static TrustContext of(String componentId, double trustScore) {
        return new TrustContext(componentId, trustScore, List.of(), Map.of(), List.of(), List.of(), List.of(), Instant.now());
    }
}
