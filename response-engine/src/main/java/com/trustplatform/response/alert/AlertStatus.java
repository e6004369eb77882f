package com.trustplatform.response.alert;

/**
 * Alert lifecycle.
 * <pre>
 *   ACTIVE       → ACKNOWLEDGED | SUPPRESSED | RESOLVED
 *   ACKNOWLEDGED → SUPPRESSED | RESOLVED
 *   SUPPRESSED   → RESOLVED
 *   RESOLVED     → (terminal)
 * </pre>
 */
public enum AlertStatus {
    ACTIVE,
    ACKNOWLEDGED,
    SUPPRESSED,
    RESOLVED;

    public boolean canTransitionTo(AlertStatus next) {
        return switch (this) {
            case ACTIVE       -> next != ACTIVE;
            case ACKNOWLEDGED -> next == SUPPRESSED || next == RESOLVED;
            case SUPPRESSED   -> next == RESOLVED;
            case RESOLVED     -> false;
        };
    }

    /** Active and acknowledged alerts still need attention. */
    public boolean isOpen() {
        return this == ACTIVE || this == ACKNOWLEDGED;
    }
}
