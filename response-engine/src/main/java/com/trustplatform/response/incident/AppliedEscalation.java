package com.trustplatform.response.incident;

import com.trustplatform.common.policy.EscalationStep;

/** The incident after an escalation, and the chain step that was applied to it. */
public record AppliedEscalation(Incident incident, EscalationStep step) {
}
