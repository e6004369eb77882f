package com.trustplatform.response.incident;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Timing figures derived from an incident's timestamps.
 * {@code responseTime} is creation → first recorded action; {@code resolutionTime} is
 * creation → resolution.
 */
@Data
@NoArgsConstructor
public class IncidentMetrics {

    private Duration responseTime;

    private Duration resolutionTime;

    private double businessImpact;

    private int failedActions;

    public IncidentMetrics copy() {
        IncidentMetrics copy = new IncidentMetrics();
        copy.setResponseTime(responseTime);
        copy.setResolutionTime(resolutionTime);
        copy.setBusinessImpact(businessImpact);
        copy.setFailedActions(failedActions);
        return copy;
    }
}
