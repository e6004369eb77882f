package com.trustplatform.common.policy;

/**
 * Which part of the {@link TrustContext} a {@link ResponseCondition} reads.
 *
 * <ul>
 *   <li>{@link #TRUST_SCORE}:           the component's current trust score</li>
 *   <li>{@link #SECURITY_EVENT}:        holds if any event's severity satisfies the comparison</li>
 *   <li>{@link #PERFORMANCE_METRIC}:    the metric named by {@code metricName}; absent = not met</li>
 *   <li>{@link #BEHAVIORAL_ANOMALY}:    number of anomalies</li>
 *   <li>{@link #DEPENDENCY_FAILURE}:    number of failed dependencies</li>
 *   <li>{@link #COMMUNICATION_FAILURE}: number of communication failures</li>
 * </ul>
 */
public enum ConditionType {
    TRUST_SCORE,
    SECURITY_EVENT,
    PERFORMANCE_METRIC,
    BEHAVIORAL_ANOMALY,
    DEPENDENCY_FAILURE,
    COMMUNICATION_FAILURE
}
