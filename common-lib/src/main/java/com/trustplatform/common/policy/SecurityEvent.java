package com.trustplatform.common.policy;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record SecurityEvent(
    @JsonProperty("eventType") String eventType,
    @JsonProperty("severity") double severity,
    @JsonProperty("source") String source,
    @JsonProperty("description") String description,
    @JsonProperty("timestamp") Instant timestamp
) {}
