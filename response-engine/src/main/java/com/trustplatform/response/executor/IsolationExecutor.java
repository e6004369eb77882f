package com.trustplatform.response.executor;

import com.trustplatform.common.policy.ActionType;
import com.trustplatform.common.policy.ResponseAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Cuts a component off from its peers. The network layer is simulated: the executor reports the
 * isolated targets and a nominal isolation time.
 */
@Component
public class IsolationExecutor implements ActionExecutor {

    private static final Logger log = LoggerFactory.getLogger(IsolationExecutor.class);

    public static final String NAME = "isolation";

    private static final double ISOLATION_TIME_SECONDS = 2.5;

    @Override
    public String executorName() { return NAME; }

    @Override
    public boolean isHealthy() { return true; }

    @Override
    public ActionResult execute(ResponseAction action) {
        if (action.actionType() != ActionType.ISOLATE_COMPONENT) {
            throw new ActionExecutionException(NAME, "Invalid action type " + action.actionType());
        }
        log.info("[IsolationExecutor] ISOLATING actionId={} targets={}", action.actionId(), action.targetComponents());

        return ActionResult.success(
            "Isolated components: " + action.targetComponents(),
            Map.of(
                "components_isolated", (double) action.targetComponents().size(),
                "isolation_time",      ISOLATION_TIME_SECONDS
            ));
    }
}
