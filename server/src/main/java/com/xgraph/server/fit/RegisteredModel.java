package com.xgraph.server.fit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class RegisteredModel {
    private final String name;
    private final String expression;
    private final ModelFunction function;
    private final List<ParameterSpec> defaults;

    public RegisteredModel(String name, String expression, ModelFunction function, List<ParameterSpec> defaults) {
        this.name = name;
        this.expression = expression;
        this.function = function;
        this.defaults = Collections.unmodifiableList(new ArrayList<>(defaults));
    }

    public String getName() {
        return name;
    }

    /** Human-readable formula, e.g. {@code a*exp(-x/b)+c}. */
    public String getExpression() {
        return expression;
    }

    public ModelFunction getFunction() {
        return function;
    }

    public List<ParameterSpec> getDefaults() {
        return defaults;
    }

    public List<String> parameterNames() {
        List<String> names = new ArrayList<>();
        for (ParameterSpec p : defaults) {
            names.add(p.getName());
        }
        return names;
    }
}
