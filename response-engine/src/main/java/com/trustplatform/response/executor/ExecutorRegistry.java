package com.trustplatform.response.executor;

import com.trustplatform.common.policy.ActionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Name → {@link ActionExecutor} registry with a fixed action-type routing table.
 *
 * <pre>
 *   ISOLATE_COMPONENT    → "isolation"
 *   SCALE_RESOURCES      → "scaling"
 *   UPDATE_CONFIGURATION → "configuration"
 *   TRIGGER_WORKFLOW     → "workflow"
 *   anything else        → none  (or the first registered executor when
 *                                  trust.response.fallback-to-any-executor=true)
 * </pre>
 *
 * <p>Every {@link ActionExecutor} bean is registered at startup under its
 * {@link ActionExecutor#executorName()}; further executors may be added at runtime.
 */
@Component
public class ExecutorRegistry {

    private static final Logger log = LoggerFactory.getLogger(ExecutorRegistry.class);

    static final Map<ActionType, String> ROUTES = Map.of(
        ActionType.ISOLATE_COMPONENT,    IsolationExecutor.NAME,
        ActionType.SCALE_RESOURCES,      ScalingExecutor.NAME,
        ActionType.UPDATE_CONFIGURATION, ConfigurationExecutor.NAME,
        ActionType.TRIGGER_WORKFLOW,     WorkflowExecutor.NAME
    );

    private final Map<String, ActionExecutor> executors = new LinkedHashMap<>();
    private final boolean fallbackToAny;

    public ExecutorRegistry(List<ActionExecutor> executors,
                            @Value("${trust.response.fallback-to-any-executor:false}") boolean fallbackToAny) {
        this.fallbackToAny = fallbackToAny;
        executors.forEach(this::register);
        log.info("[ExecutorRegistry] Registered executors={} fallbackToAny={}", this.executors.keySet(), fallbackToAny);
    }

    public synchronized void register(ActionExecutor executor) {
        register(executor.executorName(), executor);
    }

    public synchronized void register(String name, ActionExecutor executor) {
        ActionExecutor previous = executors.put(name, executor);
        if (previous != null) {
            log.info("[ExecutorRegistry] Replaced executor name={}", name);
        }
    }

    public synchronized Optional<ActionExecutor> byName(String name) {
        return Optional.ofNullable(executors.get(name));
    }

    /** Executor responsible for {@code type}, if any. */
    public synchronized Optional<ActionExecutor> resolve(ActionType type) {
        String name = ROUTES.get(type);
        if (name != null) {
            return Optional.ofNullable(executors.get(name));
        }
        if (fallbackToAny && !executors.isEmpty()) {
            ActionExecutor any = executors.values().iterator().next();
            log.warn("[ExecutorRegistry] No route for actionType={} → fallback executor={}", type, any.executorName());
            return Optional.of(any);
        }
        return Optional.empty();
    }

    public synchronized List<String> names() {
        return List.copyOf(executors.keySet());
    }
}
