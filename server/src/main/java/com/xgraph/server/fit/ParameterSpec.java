package com.xgraph.server.fit;

import java.util.Objects;

/**
 * One named model parameter: start value, whether it is held fixed, and optional bounds
 * (infinite when absent).
 */
public final class ParameterSpec {
    private final String name;
    private final double value;
    private final boolean fixed;
    private final double min;
    private final double max;

    public ParameterSpec(String name, double value) {
        this(name, value, false, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);
    }

    public ParameterSpec(String name, double value, boolean fixed, double min, double max) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Parameter name is required");
        }
        if (Double.isNaN(min) || Double.isNaN(max) || min > max) {
            throw new IllegalArgumentException("Invalid bounds [" + min + ", " + max + "] for " + name);
        }
        this.name = name;
        this.value = value;
        this.fixed = fixed;
        this.min = min;
        this.max = max;
    }

    public static ParameterSpec fixed(String name, double value) {
        return new ParameterSpec(name, value, true, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);
    }

    public static ParameterSpec bounded(String name, double value, double min, double max) {
        return new ParameterSpec(name, value, false, min, max);
    }

    public String getName() {
        return name;
    }

    public double getValue() {
        return value;
    }

    public boolean isFixed() {
        return fixed;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public double clip(double v) {
        return Math.max(min, Math.min(max, v));
    }

    public ParameterSpec withValue(double newValue) {
        return new ParameterSpec(name, newValue, fixed, min, max);
    }

    public ParameterSpec withFixed(boolean newFixed) {
        return new ParameterSpec(name, value, newFixed, min, max);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ParameterSpec))
            return false;
        ParameterSpec that = (ParameterSpec) o;
        return Double.compare(value, that.value) == 0 && fixed == that.fixed && Double.compare(min, that.min) == 0
                && Double.compare(max, that.max) == 0 && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, value, fixed, min, max);
    }

    @Override
    public String toString() {
        return name + "=" + value + (fixed ? " (fixed)" : "") + " in [" + min + ", " + max + "]";
    }
}
