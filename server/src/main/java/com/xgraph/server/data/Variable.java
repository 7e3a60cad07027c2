package com.xgraph.server.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A named n-dimensional data array with one dimension name per axis.
 */
public class Variable {

    private final String name;
    private final List<String> dims;
    private final NdArray data;
    private final String units;
    private final Map<String, Object> attrs = new LinkedHashMap<>();

    public Variable(String name, List<String> dims, NdArray data, String units) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Variable name is required");
        }
        if (dims == null || data == null) {
            throw new IllegalArgumentException("Variable " + name + " needs dims and data");
        }
        if (dims.size() != data.ndim()) {
            throw new IllegalArgumentException("Variable " + name + " has " + dims.size() + " dims but data is "
                    + data.ndim() + "-D");
        }
        Set<String> seen = new HashSet<>();
        for (String d : dims) {
            if (!seen.add(d)) {
                throw new IllegalArgumentException("Variable " + name + " repeats dimension " + d);
            }
        }
        this.name = name;
        this.dims = Collections.unmodifiableList(new ArrayList<>(dims));
        this.data = data;
        this.units = units;
    }

    public String getName() {
        return name;
    }

    public List<String> getDims() {
        return dims;
    }

    public NdArray getData() {
        return data;
    }

    /** Declared unit string, may be null when the variable is dimensionless or unlabelled. */
    public String getUnits() {
        return units;
    }

    public Map<String, Object> getAttrs() {
        return attrs;
    }

    public int axisOf(String dim) {
        return dims.indexOf(dim);
    }

    public int extent(String dim) {
        int axis = axisOf(dim);
        if (axis < 0) {
            throw new IllegalArgumentException("Variable " + name + " has no dimension " + dim);
        }
        return data.extent(axis);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name).append(" (");
        for (int i = 0; i < dims.size(); i++) {
            if (i > 0)
                sb.append(", ");
            sb.append(dims.get(i)).append(": ").append(data.extent(i));
        }
        sb.append(")");
        if (units != null && !units.isEmpty()) {
            sb.append(" [").append(units).append("]");
        }
        return sb.toString();
    }
}
