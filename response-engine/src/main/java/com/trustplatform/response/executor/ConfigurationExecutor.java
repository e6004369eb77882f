package com.trustplatform.response.executor;

import com.trustplatform.common.policy.ActionType;
import com.trustplatform.common.policy.ResponseAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class ConfigurationExecutor implements ActionExecutor {

    private static final Logger log = LoggerFactory.getLogger(ConfigurationExecutor.class);

    public static final String NAME = "configuration";

    static final String DEFAULT_KEY   = "security_policy";
    static final String DEFAULT_VALUE = "enhanced";

    @Override
    public String executorName() { return NAME; }

    @Override
    public boolean isHealthy() { return true; }

    @Override
    public ActionResult execute(ResponseAction action) {
        if (action.actionType() != ActionType.UPDATE_CONFIGURATION) {
            throw new ActionExecutionException(NAME, "Invalid action type " + action.actionType());
        }
        String key   = action.parameters().getOrDefault("config_key", DEFAULT_KEY);
        String value = action.parameters().getOrDefault("config_value", DEFAULT_VALUE);
        log.info("[ConfigurationExecutor] CONFIG_UPDATE actionId={} targets={} {}={}",
            action.actionId(), action.targetComponents(), key, value);

        return ActionResult.success(
            "Updated configuration: " + key + " = " + value,
            Map.of("config_updated", 1.0));
    }
}
