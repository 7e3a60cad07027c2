package com.xgraph.server.fit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Name to model lookup table. New models are registered here; the fit engine never
 * changes to support them.
 */
public class ModelRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ModelRegistry.class);

    private final Map<String, RegisteredModel> models = new LinkedHashMap<>();

    public static ModelRegistry withBuiltins() {
        ModelRegistry registry = new ModelRegistry();
        BuiltinModels.registerAll(registry);
        return registry;
    }

    public synchronized void register(String name, String expression, ModelFunction function,
            List<ParameterSpec> defaults) {
        if (name == null || name.isEmpty() || function == null) {
            throw new IllegalArgumentException("Model name and function are required");
        }
        Set<String> seen = new HashSet<>();
        for (ParameterSpec p : defaults) {
            if (!seen.add(p.getName())) {
                throw new IllegalArgumentException("Model " + name + " repeats parameter " + p.getName());
            }
        }
        if (models.put(name, new RegisteredModel(name, expression, function, defaults)) != null) {
            logger.info("Replaced fit model '{}'", name);
        } else {
            logger.debug("Registered fit model '{}': {}", name, expression);
        }
    }

    public synchronized Optional<RegisteredModel> get(String name) {
        return Optional.ofNullable(models.get(name));
    }

    public synchronized List<String> names() {
        return new ArrayList<>(models.keySet());
    }

    public synchronized List<RegisteredModel> all() {
        return new ArrayList<>(models.values());
    }
}
