package com.trustplatform.response.alert;

public enum AlertType {
    TRUST_SCORE_LOW,
    SECURITY_VIOLATION,
    PERFORMANCE_DEGRADATION,
    COMPLIANCE_VIOLATION,
    ANOMALY_DETECTED
}
