package com.trustplatform.response.ingest;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record TrustScorePoint(
    @JsonProperty("trustScore") double trustScore,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("timestamp") Instant timestamp
) {}
