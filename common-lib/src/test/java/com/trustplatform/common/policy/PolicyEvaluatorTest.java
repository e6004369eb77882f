package com.trustplatform.common.policy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PolicyEvaluatorTest {

    private static final ResponseAction ISOLATE =
        ResponseAction.of("isolate", ActionType.ISOLATE_COMPONENT, List.of());

    private static ResponsePolicy policy(String id, int priority, ResponseCondition... conditions) {
        return ResponsePolicy.of(id, id, priority, List.of(conditions), List.of(ISOLATE));
    }

    private static TrustContext context(double score, int anomalies, List<SecurityEvent> events) {
        List<BehavioralAnomaly> found = new ArrayList<>();
        for (int i = 0; i < anomalies; i++) {
            found.add(new BehavioralAnomaly("spike", 0.5, "anomaly " + i, Instant.now()));
        }
        return new TrustContext("X", score, events, Map.of("latency_ms", 250.0), found,
            List.of("db"), List.of(), Instant.now());
    }

    @Nested
    @DisplayName("AND semantics")
    class AndSemantics {

        @Test
        @DisplayName("policy fires only when every condition holds")
        void allConditionsRequired() {
            ResponsePolicy p = policy("p", 1,
                ResponseCondition.trustScore(ComparisonOperator.LESS_THAN, 0.3),
                ResponseCondition.of(ConditionType.BEHAVIORAL_ANOMALY, "anomalies",
                    ComparisonOperator.GREATER_THAN_OR_EQUAL, 2));

            assertTrue(PolicyEvaluator.allConditionsHold(p, context(0.2, 2, List.of())));
            assertFalse(PolicyEvaluator.allConditionsHold(p, context(0.2, 1, List.of())));
            assertFalse(PolicyEvaluator.allConditionsHold(p, context(0.4, 3, List.of())));
        }

        @Test
        @DisplayName("policy without conditions always fires")
        void emptyConditions() {
            assertTrue(PolicyEvaluator.allConditionsHold(policy("p", 1), context(1.0, 0, List.of())));
        }
    }

    @Test
    @DisplayName("evaluate keeps order and skips disabled policies")
    void evaluateOrderAndEnabled() {
        ResponseCondition low = ResponseCondition.trustScore(ComparisonOperator.LESS_THAN, 0.5);
        List<ResponsePolicy> policies = List.of(
            policy("first", 1, low),
            policy("off", 2, low).withEnabled(false),
            policy("second", 3, low));

        List<ResponsePolicy> firing = PolicyEvaluator.evaluate(policies, context(0.1, 0, List.of()));

        assertEquals(List.of("first", "second"), firing.stream().map(ResponsePolicy::policyId).toList());
    }

    @Nested
    @DisplayName("condition types")
    class ConditionTypes {

        @Test
        @DisplayName("security event: any event severity satisfying the operator")
        void securityEvent() {
            ResponseCondition severe = ResponseCondition.of(ConditionType.SECURITY_EVENT, "severity",
                ComparisonOperator.GREATER_THAN, 0.7);
            SecurityEvent mild = new SecurityEvent("scan", 0.3, "ids", "port scan", Instant.now());
            SecurityEvent bad = new SecurityEvent("intrusion", 0.9, "ids", "login burst", Instant.now());

            assertFalse(PolicyEvaluator.holds(severe, context(0.9, 0, List.of(mild))));
            assertTrue(PolicyEvaluator.holds(severe, context(0.9, 0, List.of(mild, bad))));
            assertFalse(PolicyEvaluator.holds(severe, context(0.9, 0, List.of())));
        }

        @Test
        @DisplayName("performance metric: absent metric never matches")
        void performanceMetric() {
            ResponseCondition slow = ResponseCondition.of(ConditionType.PERFORMANCE_METRIC, "latency_ms",
                ComparisonOperator.GREATER_THAN, 200);
            ResponseCondition missing = ResponseCondition.of(ConditionType.PERFORMANCE_METRIC, "error_rate",
                ComparisonOperator.LESS_THAN, 1.0);

            assertTrue(PolicyEvaluator.holds(slow, context(0.9, 0, List.of())));
            assertFalse(PolicyEvaluator.holds(missing, context(0.9, 0, List.of())));
        }

        @Test
        @DisplayName("dependency failures are counted")
        void dependencyFailure() {
            ResponseCondition oneFailed = ResponseCondition.of(ConditionType.DEPENDENCY_FAILURE, "deps",
                ComparisonOperator.EQUAL_TO, 1);

            assertTrue(PolicyEvaluator.holds(oneFailed, context(0.9, 0, List.of())));
        }
    }

    @Test
    @DisplayName("equality tolerates 0.001")
    void equalityEpsilon() {
        assertTrue(ComparisonOperator.EQUAL_TO.compare(0.5004, 0.5));
        assertFalse(ComparisonOperator.EQUAL_TO.compare(0.502, 0.5));
        assertTrue(ComparisonOperator.NOT_EQUAL_TO.compare(0.502, 0.5));
    }
}
