package com.trustplatform.common.propagation;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Name → {@link TrustPropagationModel} lookup, iterated in registration order.
 * Registration replaces a model with the same name. Thread-safe.
 */
public class PropagationModelRegistry {

    private final Map<String, TrustPropagationModel> models = new LinkedHashMap<>();

    /** Registry holding the three built-in models. */
    public static PropagationModelRegistry withDefaults(Map<String, Double> conditionalProbabilities) {
        PropagationModelRegistry registry = new PropagationModelRegistry();
        registry.register(new WeightedAveragePropagationModel());
        registry.register(new MinimumTrustPropagationModel());
        registry.register(new BayesianPropagationModel(conditionalProbabilities));
        return registry;
    }

    public synchronized void register(TrustPropagationModel model) {
        register(model.modelName(), model);
    }

    public synchronized void register(String name, TrustPropagationModel model) {
        models.put(name, model);
    }

    public synchronized Optional<TrustPropagationModel> get(String name) {
        return Optional.ofNullable(models.get(name));
    }

    /** Point-in-time copy, safe to iterate while other threads register. */
    public synchronized Map<String, TrustPropagationModel> all() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(models));
    }

    public synchronized Collection<String> names() {
        return List.copyOf(models.keySet());
    }

    public synchronized boolean isEmpty() {
        return models.isEmpty();
    }
}
