package com.trustplatform.common.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record CriticalPath(
    @JsonProperty("path") List<String> path,
    @JsonProperty("criticality") double criticality,
    @JsonProperty("description") String description
) {
    public CriticalPath {
        path = List.copyOf(path);
    }
}
