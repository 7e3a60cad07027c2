package com.xgraph.server.fit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * What to fit: a registered model name, its parameters, and the x-range whose points
 * take part.
 */
public final class FitSpec {
    private final String model;
    private final List<ParameterSpec> parameters;
    private final double xMin;
    private final double xMax;

    public FitSpec(String model, List<ParameterSpec> parameters, double xMin, double xMax) {
        if (model == null || model.isEmpty()) {
            throw new IllegalArgumentException("Model name is required");
        }
        if (Double.isNaN(xMin) || Double.isNaN(xMax) || xMin > xMax) {
            throw new IllegalArgumentException("Invalid fit range [" + xMin + ", " + xMax + "]");
        }
        Set<String> names = new HashSet<>();
        for (ParameterSpec p : parameters) {
            if (!names.add(p.getName())) {
                throw new IllegalArgumentException("Duplicate parameter " + p.getName());
            }
        }
        this.model = model;
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        this.xMin = xMin;
        this.xMax = xMax;
    }

    /** A spec seeded with the model's registered default parameters. */
    public static FitSpec fromDefaults(ModelRegistry registry, String model, double xMin, double xMax) {
        RegisteredModel m = registry.get(model)
                .orElseThrow(() -> new IllegalArgumentException("Unknown fit model: " + model));
        return new FitSpec(model, m.getDefaults(), xMin, xMax);
    }

    /** Whole x axis. */
    public static FitSpec unbounded(String model, List<ParameterSpec> parameters) {
        return new FitSpec(model, parameters, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);
    }

    public String getModel() {
        return model;
    }

    public List<ParameterSpec> getParameters() {
        return parameters;
    }

    public ParameterSpec parameter(String name) {
        for (ParameterSpec p : parameters) {
            if (p.getName().equals(name)) {
                return p;
            }
        }
        return null;
    }

    public double getXMin() {
        return xMin;
    }

    public double getXMax() {
        return xMax;
    }

    public FitSpec withParameter(ParameterSpec replacement) {
        List<ParameterSpec> next = new ArrayList<>();
        boolean replaced = false;
        for (ParameterSpec p : parameters) {
            if (p.getName().equals(replacement.getName())) {
                next.add(replacement);
                replaced = true;
            } else {
                next.add(p);
            }
        }
        if (!replaced) {
            next.add(replacement);
        }
        return new FitSpec(model, next, xMin, xMax);
    }

    public FitSpec withRange(double newMin, double newMax) {
        return new FitSpec(model, parameters, newMin, newMax);
    }

    public boolean contains(double x) {
        return x >= xMin && x <= xMax;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FitSpec))
            return false;
        FitSpec that = (FitSpec) o;
        return Double.compare(xMin, that.xMin) == 0 && Double.compare(xMax, that.xMax) == 0
                && model.equals(that.model) && parameters.equals(that.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(model, parameters, xMin, xMax);
    }

    @Override
    public String toString() {
        return "FitSpec{" + model + " " + parameters + " x in [" + xMin + ", " + xMax + "]}";
    }
}
