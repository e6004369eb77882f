package com.trustplatform.common.policy;

/**
 * Numeric comparison used by {@link ResponseCondition}. Equality is tolerant to
 * {@value #EQUALITY_EPSILON}.
 */
public enum ComparisonOperator {
    GREATER_THAN,
    LESS_THAN,
    EQUAL_TO,
    NOT_EQUAL_TO,
    GREATER_THAN_OR_EQUAL,
    LESS_THAN_OR_EQUAL;

    static final double EQUALITY_EPSILON = 0.001;

    public boolean compare(double value, double threshold) {
        return switch (this) {
            case GREATER_THAN          -> value > threshold;
            case LESS_THAN             -> value < threshold;
            case EQUAL_TO              -> Math.abs(value - threshold) < EQUALITY_EPSILON;
            case NOT_EQUAL_TO          -> Math.abs(value - threshold) >= EQUALITY_EPSILON;
            case GREATER_THAN_OR_EQUAL -> value >= threshold;
            case LESS_THAN_OR_EQUAL    -> value <= threshold;
        };
    }
}
