package com.trustplatform.response.incident;

/**
 * Severity of an {@link Incident}. {@link #fromTrustScore(double)} maps the score that opened the
 * incident:
 * <pre>
 *   score &lt; 0.1 → CRITICAL
 *   score &lt; 0.2 → HIGH
 *   score &lt; 0.5 → MEDIUM
 *   otherwise   → LOW
 * </pre>
 * {@link #EMERGENCY} is only ever set explicitly.
 */
public enum IncidentSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL,
    EMERGENCY;

    public static IncidentSeverity fromTrustScore(double trustScore) {
        if (trustScore < 0.1) return CRITICAL;
        if (trustScore < 0.2) return HIGH;
        if (trustScore < 0.5) return MEDIUM;
        return LOW;
    }
}
