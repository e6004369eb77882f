package com.trustplatform.response.alert;

public enum AlertSeverity {
    INFO,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
