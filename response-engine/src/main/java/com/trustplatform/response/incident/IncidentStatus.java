package com.trustplatform.response.incident;

import java.util.EnumSet;
import java.util.Set;

/**
 * Incident lifecycle.
 *
 * <pre>
 *   OPEN → INVESTIGATING → MITIGATING → { RESOLVED | CLOSED | ESCALATED }
 * </pre>
 * Any non-terminal state may jump straight to a terminal one or to {@link #ESCALATED};
 * an escalated incident can still be resolved or closed. {@link #RESOLVED} and {@link #CLOSED}
 * are terminal.
 */
public enum IncidentStatus {
    OPEN,
    INVESTIGATING,
    MITIGATING,
    RESOLVED,
    CLOSED,
    ESCALATED;

    public boolean isTerminal() {
        return this == RESOLVED || this == CLOSED;
    }

    public boolean canTransitionTo(IncidentStatus next) {
        return allowedNext().contains(next);
    }

    private Set<IncidentStatus> allowedNext() {
        return switch (this) {
            case OPEN          -> EnumSet.of(INVESTIGATING, MITIGATING, RESOLVED, CLOSED, ESCALATED);
            case INVESTIGATING -> EnumSet.of(MITIGATING, RESOLVED, CLOSED, ESCALATED);
            case MITIGATING    -> EnumSet.of(RESOLVED, CLOSED, ESCALATED);
            case ESCALATED     -> EnumSet.of(MITIGATING, RESOLVED, CLOSED, ESCALATED);
            case RESOLVED, CLOSED -> EnumSet.noneOf(IncidentStatus.class);
        };
    }
}
