package com.trustplatform.common.policy;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record BehavioralAnomaly(
    @JsonProperty("anomalyType") String anomalyType,
    @JsonProperty("severity") double severity,
    @JsonProperty("description") String description,
    @JsonProperty("timestamp") Instant timestamp
) {}
