package com.trustplatform.response.ingest;

public enum ComponentStatus {
    HEALTHY,
    WARNING,
    CRITICAL,
    UNKNOWN
}
