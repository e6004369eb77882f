package com.trustplatform.response.incident;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Accumulating record of remediation against one component.
 * Instances handed out by {@link IncidentStore} are copies; mutate only through the store.
 */
@Data
@NoArgsConstructor
public class Incident {

    private String incidentId;

    private String componentId;

    private String title;

    private String description;

    private IncidentSeverity severity;

    private IncidentStatus status;

    private List<String> affectedComponents = new ArrayList<>();

    private String rootCause;

    private List<ActionRecord> actionsTaken = new ArrayList<>();

    private List<EscalationRecord> escalationHistory = new ArrayList<>();

    private Instant createdAt;

    private Instant updatedAt;

    private Instant resolvedAt;

    private IncidentMetrics metrics = new IncidentMetrics();

    public boolean isActive() {
        return status != null && !status.isTerminal();
    }

    public Incident copy() {
        Incident copy = new Incident();
        copy.setIncidentId(incidentId);
        copy.setComponentId(componentId);
        copy.setTitle(title);
        copy.setDescription(description);
        copy.setSeverity(severity);
        copy.setStatus(status);
        copy.setAffectedComponents(new ArrayList<>(affectedComponents));
        copy.setRootCause(rootCause);
        copy.setActionsTaken(new ArrayList<>(actionsTaken));
        copy.setEscalationHistory(new ArrayList<>(escalationHistory));
        copy.setCreatedAt(createdAt);
        copy.setUpdatedAt(updatedAt);
        copy.setResolvedAt(resolvedAt);
        copy.setMetrics(metrics.copy());
        return copy;
    }
}
