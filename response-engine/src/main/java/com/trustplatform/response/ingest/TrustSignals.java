package com.trustplatform.response.ingest;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trustplatform.common.policy.BehavioralAnomaly;
import com.trustplatform.common.policy.SecurityEvent;

import java.util.List;
import java.util.Map;

/**
 * Observations that accompany a trust score update and feed policy conditions.
 */
public record TrustSignals(
    @JsonProperty("securityEvents") List<SecurityEvent> securityEvents,
    @JsonProperty("performanceMetrics") Map<String, Double> performanceMetrics,
    @JsonProperty("behavioralAnomalies") List<BehavioralAnomaly> behavioralAnomalies,
    @JsonProperty("failedDependencies") List<String> failedDependencies,
    @JsonProperty("communicationFailures") List<String> communicationFailures
) {
    public TrustSignals {
        securityEvents = securityEvents == null ? List.of() : List.copyOf(securityEvents);
        performanceMetrics = performanceMetrics == null ? Map.of() : Map.copyOf(performanceMetrics);
        behavioralAnomalies = behavioralAnomalies == null ? List.of() : List.copyOf(behavioralAnomalies);
        failedDependencies = failedDependencies == null ? List.of() : List.copyOf(failedDependencies);
        communicationFailures = communicationFailures == null ? List.of() : List.copyOf(communicationFailures);
    }

    public static TrustSignals none() {
        return new TrustSignals(List.of(), Map.of(), List.of(), List.of(), List.of());
    }
}
