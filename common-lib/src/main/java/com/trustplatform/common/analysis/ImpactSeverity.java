package com.trustplatform.common.analysis;

/**
 * Coarse blast-radius flag of an {@link ImpactAssessment}.
 */
public enum ImpactSeverity {
    HIGH(1.0),
    MODERATE(0.5);

    private final double score;

    ImpactSeverity(double score) {
        this.score = score;
    }

    public double score() {
        return score;
    }
}
