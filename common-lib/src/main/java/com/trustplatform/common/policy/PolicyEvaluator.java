package com.trustplatform.common.policy;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides which {@link ResponsePolicy policies} fire for a {@link TrustContext}.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Walk the policies in the order given (callers pass {@link ResponsePolicySet#ordered()},
 *       ascending priority).</li>
 *   <li>Skip disabled policies.</li>
 *   <li>A policy fires when every one of its conditions holds (AND). A policy with no
 *       conditions always fires.</li>
 * </ol>
 *
 * <p>Counting conditions ({@link ConditionType#BEHAVIORAL_ANOMALY},
 * {@link ConditionType#DEPENDENCY_FAILURE}, {@link ConditionType#COMMUNICATION_FAILURE})
 * compare the list size against the threshold with the condition's operator.
 *
 * <p>Pure static utility without Spring dependencies or state.
 */
public final class PolicyEvaluator {

    private PolicyEvaluator() {}

    /** @return the firing policies, preserving the input order */
    public static List<ResponsePolicy> evaluate(List<ResponsePolicy> policies, TrustContext context) {
        List<ResponsePolicy> firing = new ArrayList<>();
        for (ResponsePolicy policy : policies) {
            if (policy.enabled() && allConditionsHold(policy, context)) {
                firing.add(policy);
            }
        }
        return firing;
    }

    public static boolean allConditionsHold(ResponsePolicy policy, TrustContext context) {
        for (ResponseCondition condition : policy.conditions()) {
            if (!holds(condition, context)) {
                return false;
            }
        }
        return true;
    }

    public static boolean holds(ResponseCondition condition, TrustContext context) {
        ComparisonOperator op = condition.operator();
        double threshold = condition.threshold();
        return switch (condition.conditionType()) {
            case TRUST_SCORE -> op.compare(context.trustScore(), threshold);
            case SECURITY_EVENT -> context.securityEvents().stream()
                .anyMatch(event -> op.compare(event.severity(), threshold));
            case PERFORMANCE_METRIC -> {
                Double value = context.performanceMetrics().get(condition.metricName());
                yield value != null && op.compare(value, threshold);
            }
            case BEHAVIORAL_ANOMALY    -> op.compare(context.behavioralAnomalies().size(), threshold);
            case DEPENDENCY_FAILURE    -> op.compare(context.failedDependencies().size(), threshold);
            case COMMUNICATION_FAILURE -> op.compare(context.communicationFailures().size(), threshold);
        };
    }
}
