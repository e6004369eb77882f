package com.trustplatform.response.recovery;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
public class RecoveryRecord {

    private String recoveryId;

    private String planId;

    private String componentId;

    private Instant startedAt;

    private Instant completedAt;

    private RecoveryStatus status;

    private List<String> stepsCompleted = new ArrayList<>();

    private List<String> successCriteriaMet = new ArrayList<>();

    private String failureReason;

    public RecoveryRecord copy() {
        RecoveryRecord copy = new RecoveryRecord();
        copy.setRecoveryId(recoveryId);
        copy.setPlanId(planId);
        copy.setComponentId(componentId);
        copy.setStartedAt(startedAt);
        copy.setCompletedAt(completedAt);
        copy.setStatus(status);
        copy.setStepsCompleted(new ArrayList<>(stepsCompleted));
        copy.setSuccessCriteriaMet(new ArrayList<>(successCriteriaMet));
        copy.setFailureReason(failureReason);
        return copy;
    }
}
