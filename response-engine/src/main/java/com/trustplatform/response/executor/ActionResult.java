package com.trustplatform.response.executor;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

public record ActionResult(
    @JsonProperty("success") boolean success,
    @JsonProperty("message") String message,
    @JsonProperty("metrics") Map<String, Double> metrics,
    @JsonProperty("timestamp") Instant timestamp
) {
    public static ActionResult success(String message, Map<String, Double> metrics) {
        return new ActionResult(true, message, metrics, Instant.now());
    }

    public static ActionResult failure(String message) {
        return new ActionResult(false, message, Map.of(), Instant.now());
    }
}
