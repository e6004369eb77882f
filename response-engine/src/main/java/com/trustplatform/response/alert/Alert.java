package com.trustplatform.response.alert;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
public class Alert {

    private String alertId;

    private AlertType alertType;

    private AlertSeverity severity;

    private String componentId;

    private String message;

    private Double trustScore;

    private AlertStatus status;

    private Instant createdAt;

    private Instant acknowledgedAt;

    private Instant resolvedAt;

    public Alert copy() {
        Alert copy = new Alert();
        copy.setAlertId(alertId);
        copy.setAlertType(alertType);
        copy.setSeverity(severity);
        copy.setComponentId(componentId);
        copy.setMessage(message);
        copy.setTrustScore(trustScore);
        copy.setStatus(status);
        copy.setCreatedAt(createdAt);
        copy.setAcknowledgedAt(acknowledgedAt);
        copy.setResolvedAt(resolvedAt);
        return copy;
    }
}
