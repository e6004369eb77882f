package com.trustplatform.response.incident;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

public record EscalationRecord(
    @JsonProperty("stepId") String stepId,
    @JsonProperty("escalatedAt") Instant escalatedAt,
    @JsonProperty("escalatedTo") String escalatedTo,
    @JsonProperty("reason") String reason,
    @JsonProperty("approvalPending") boolean approvalPending,
    @JsonProperty("actionsTaken") List<String> actionsTaken
) {
    public EscalationRecord {
        actionsTaken = actionsTaken == null ? List.of() : List.copyOf(actionsTaken);
    }
}
