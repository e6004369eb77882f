package com.trustplatform.common.composition;

public enum CompositionRuleType {
    TRUST_THRESHOLD,
    DEPENDENCY_FAILURE,
    SECURITY_VIOLATION,
    PERFORMANCE_DEGRADATION,
    COMPLIANCE_VIOLATION
}
