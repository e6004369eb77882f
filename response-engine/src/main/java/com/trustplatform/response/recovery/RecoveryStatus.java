package com.trustplatform.response.recovery;

public enum RecoveryStatus {
    IN_PROGRESS,
    COMPLETED,
    FAILED,
    CANCELLED
}
