package com.trustplatform.response.executor;

import com.trustplatform.common.policy.ActionType;
import com.trustplatform.common.policy.ResponseAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Hands remediation off to an external workflow, named by the {@code workflow_id} parameter.
 */
@Component
public class WorkflowExecutor implements ActionExecutor {

    private static final Logger log = LoggerFactory.getLogger(WorkflowExecutor.class);

    public static final String NAME = "workflow";

    static final String DEFAULT_WORKFLOW = "security_response";

    @Override
    public String executorName() { return NAME; }

    @Override
    public boolean isHealthy() { return true; }

    @Override
    public ActionResult execute(ResponseAction action) {
        if (action.actionType() != ActionType.TRIGGER_WORKFLOW) {
            throw new ActionExecutionException(NAME, "Invalid action type " + action.actionType());
        }
        String workflowId = action.parameters().getOrDefault("workflow_id", DEFAULT_WORKFLOW);
        log.info("[WorkflowExecutor] WORKFLOW_TRIGGERED actionId={} workflowId={}", action.actionId(), workflowId);

        return ActionResult.success("Triggered workflow: " + workflowId, Map.of("workflow_triggered", 1.0));
    }
}
