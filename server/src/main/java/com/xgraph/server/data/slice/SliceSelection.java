package com.xgraph.server.data.slice;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Request for a 1-D lane of a variable: the dimension to plot along x and a fixed
 * index for every other dimension. Expected units are optional; when given they must
 * match the resolved units exactly (after canonicalisation).
 */
public final class SliceSelection {
    private final String nodePath;
    private final String variable;
    private final String xDim;
    private final Map<String, Integer> fixed;
    private final String expectedXUnits;
    private final String expectedYUnits;

    public SliceSelection(String nodePath, String variable, String xDim, Map<String, Integer> fixed) {
        this(nodePath, variable, xDim, fixed, null, null);
    }

    public SliceSelection(String nodePath, String variable, String xDim, Map<String, Integer> fixed,
            String expectedXUnits, String expectedYUnits) {
        this.nodePath = nodePath;
        this.variable = variable;
        this.xDim = xDim;
        this.fixed = Collections.unmodifiableMap(fixed != null ? new LinkedHashMap<>(fixed) : new LinkedHashMap<>());
        this.expectedXUnits = expectedXUnits;
        this.expectedYUnits = expectedYUnits;
    }

    public String getNodePath() {
        return nodePath;
    }

    public String getVariable() {
        return variable;
    }

    public String getXDim() {
        return xDim;
    }

    public Map<String, Integer> getFixed() {
        return fixed;
    }

    public String getExpectedXUnits() {
        return expectedXUnits;
    }

    public String getExpectedYUnits() {
        return expectedYUnits;
    }

    /** Same selection with one fixed index changed, e.g. stepping to the next sweep. */
    public SliceSelection withFixed(String dim, int index) {
        Map<String, Integer> next = new LinkedHashMap<>(fixed);
        next.put(dim, index);
        return new SliceSelection(nodePath, variable, xDim, next, expectedXUnits, expectedYUnits);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SliceSelection))
            return false;
        SliceSelection that = (SliceSelection) o;
        return Objects.equals(nodePath, that.nodePath) && Objects.equals(variable, that.variable)
                && Objects.equals(xDim, that.xDim) && fixed.equals(that.fixed)
                && Objects.equals(expectedXUnits, that.expectedXUnits)
                && Objects.equals(expectedYUnits, that.expectedYUnits);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodePath, variable, xDim, fixed, expectedXUnits, expectedYUnits);
    }

    @Override
    public String toString() {
        return "SliceSelection{" + nodePath + ":" + variable + " x=" + xDim + " fixed=" + fixed + "}";
    }
}
