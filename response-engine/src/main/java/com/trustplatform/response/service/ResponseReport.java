package com.trustplatform.response.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trustplatform.response.incident.ActionRecord;

import java.time.Instant;
import java.util.List;

/**
 * What one trust update set in motion: the policies that fired (priority order), the action
 * records in decision order, and the incidents those records were appended to.
 */
public record ResponseReport(
    @JsonProperty("componentId") String componentId,
    @JsonProperty("trustScore") double trustScore,
    @JsonProperty("triggeredPolicies") List<String> triggeredPolicies,
    @JsonProperty("actionRecords") List<ActionRecord> actionRecords,
    @JsonProperty("incidentIds") List<String> incidentIds,
    @JsonProperty("timestamp") Instant timestamp
) {
    public ResponseReport {
        triggeredPolicies = List.copyOf(triggeredPolicies);
        actionRecords = List.copyOf(actionRecords);
        incidentIds = List.copyOf(incidentIds);
    }

    public static ResponseReport noAction(String componentId, double trustScore) {
        return new ResponseReport(componentId, trustScore, List.of(), List.of(), List.of(), Instant.now());
    }

    public boolean anyTriggered() {
        return !triggeredPolicies.isEmpty();
    }
}
