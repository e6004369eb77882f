package com.trustplatform.response.recovery;

import com.trustplatform.common.exception.ResourceNotFoundException;
import com.trustplatform.common.exception.TrustEngineException;
import com.trustplatform.common.policy.ActionType;
import com.trustplatform.common.policy.ComparisonOperator;
import com.trustplatform.response.executor.ConfigurationExecutor;
import com.trustplatform.response.executor.ExecutorRegistry;
import com.trustplatform.response.executor.IsolationExecutor;
import com.trustplatform.response.executor.ScalingExecutor;
import com.trustplatform.response.service.ActionDispatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RecoveryCoordinatorTest {

    private RecoveryCoordinator coordinator;

    @BeforeEach
    void setUp() {
        ExecutorRegistry registry = new ExecutorRegistry(
            List.of(new IsolationExecutor(), new ScalingExecutor(), new ConfigurationExecutor()), false);
        coordinator = new RecoveryCoordinator(new ActionDispatcher(registry));
    }

    @Test
    @DisplayName("all steps succeed and criteria hold → COMPLETED")
    void completed() {
        coordinator.registerPlan(new RecoveryPlan("restore", "Restore service", List.of(),
            List.of(RecoveryStep.of("s1", "Harden config", ActionType.UPDATE_CONFIGURATION),
                new RecoveryStep("s2", "Add capacity", ActionType.SCALE_RESOURCES, Map.of("scale_factor", "3"), null, 0)),
            List.of(new SuccessCriterion("c1", "scale_factor", ComparisonOperator.GREATER_THAN_OR_EQUAL, 3.0, "scaled"),
                new SuccessCriterion("c2", "config_updated", ComparisonOperator.EQUAL_TO, 1.0, "hardened"))));

        RecoveryRecord record = coordinator.startRecovery("X", "restore").block();

        assertEquals(RecoveryStatus.COMPLETED, record.getStatus());
        assertEquals(List.of("s1", "s2"), record.getStepsCompleted());
        assertEquals(List.of("c1", "c2"), record.getSuccessCriteriaMet());
        assertNotNull(record.getCompletedAt());
        assertEquals(1, coordinator.getRecoveryHistory().size());
    }

    @Test
    @DisplayName("stops at the first failing step")
    void stopsAtFirstFailure() {
        coordinator.registerPlan(new RecoveryPlan("broken", "Broken", List.of(),
            List.of(RecoveryStep.of("s1", "Isolate", ActionType.ISOLATE_COMPONENT),
                RecoveryStep.of("s2", "Restart", ActionType.RESTART_SERVICE),
                RecoveryStep.of("s3", "Scale", ActionType.SCALE_RESOURCES)),
            List.of()));

        RecoveryRecord record = coordinator.startRecovery("X", "broken").block();

        assertEquals(RecoveryStatus.FAILED, record.getStatus());
        assertEquals(List.of("s1"), record.getStepsCompleted());
        assertTrue(record.getFailureReason().startsWith("Step s2 failed"));
    }

    @Test
    @DisplayName("unmet success criterion → FAILED")
    void criteriaNotMet() {
        coordinator.registerPlan(new RecoveryPlan("weak", "Weak", List.of(),
            List.of(RecoveryStep.of("s1", "Scale", ActionType.SCALE_RESOURCES)),
            List.of(new SuccessCriterion("c1", "scale_factor", ComparisonOperator.GREATER_THAN, 5.0, "big scale"))));

        RecoveryRecord record = coordinator.startRecovery("X", "weak").block();

        assertEquals(RecoveryStatus.FAILED, record.getStatus());
        assertTrue(record.getSuccessCriteriaMet().isEmpty());
    }

    @Test
    @DisplayName("unknown plan is not found; plan scoped to other components is rejected")
    void invalidRequests() {
        coordinator.registerPlan(new RecoveryPlan("db-only", "DB", List.of("db"),
            List.of(RecoveryStep.of("s1", "Isolate", ActionType.ISOLATE_COMPONENT)), List.of()));

        assertThrows(ResourceNotFoundException.class, () -> coordinator.startRecovery("X", "missing").block());
        assertThrows(TrustEngineException.class, () -> coordinator.startRecovery("X", "db-only").block());
    }
}
