package com.trustplatform.response.executor;

import com.trustplatform.common.policy.ActionType;
import com.trustplatform.common.policy.ResponseAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Scales the target components' resources by the {@code scale_factor} parameter
 * (default {@value #DEFAULT_SCALE_FACTOR}). An unparsable factor falls back to the default.
 */
@Component
public class ScalingExecutor implements ActionExecutor {

    private static final Logger log = LoggerFactory.getLogger(ScalingExecutor.class);

    public static final String NAME = "scaling";

    static final double DEFAULT_SCALE_FACTOR = 2.0;
    private static final double SCALING_TIME_SECONDS = 30.0;

    @Override
    public String executorName() { return NAME; }

    @Override
    public boolean isHealthy() { return true; }

    @Override
    public ActionResult execute(ResponseAction action) {
        if (action.actionType() != ActionType.SCALE_RESOURCES) {
            throw new ActionExecutionException(NAME, "Invalid action type " + action.actionType());
        }
        double factor = parseFactor(action.parameters().get("scale_factor"));
        if (factor <= 0.0) {
            return ActionResult.failure("Scale factor must be positive, got " + factor);
        }
        log.info("[ScalingExecutor] SCALING actionId={} targets={} factor={}",
            action.actionId(), action.targetComponents(), factor);

        return ActionResult.success(
            "Scaled resources by factor: " + factor,
            Map.of(
                "scale_factor", factor,
                "scaling_time", SCALING_TIME_SECONDS
            ));
    }

    private static double parseFactor(String raw) {
        if (raw == null) {
            return DEFAULT_SCALE_FACTOR;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("[ScalingExecutor] Unparsable scale_factor='{}' → default {}", raw, DEFAULT_SCALE_FACTOR);
            return DEFAULT_SCALE_FACTOR;
        }
    }
}
