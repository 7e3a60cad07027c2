package com.xgraph.server.data;

/**
 * A named 1-D array labelling positions along one dimension. A coordinate whose
 * name equals its dimension is the index coordinate for that dimension.
 */
public class Coordinate {

    private final String name;
    private final String dim;
    private final double[] values;
    private final String units;

    public Coordinate(String name, double[] values, String units) {
        this(name, name, values, units);
    }

    public Coordinate(String name, String dim, double[] values, String units) {
        if (name == null || name.isEmpty() || dim == null || dim.isEmpty()) {
            throw new IllegalArgumentException("Coordinate name and dimension are required");
        }
        if (values == null) {
            throw new IllegalArgumentException("Coordinate " + name + " has no values");
        }
        this.name = name;
        this.dim = dim;
        this.values = values.clone();
        this.units = units;
    }

    public String getName() {
        return name;
    }

    public String getDim() {
        return dim;
    }

    public boolean isIndex() {
        return name.equals(dim);
    }

    public int length() {
        return values.length;
    }

    public double value(int i) {
        return values[i];
    }

    public double[] getValues() {
        return values.clone();
    }

    public String getUnits() {
        return units;
    }

    @Override
    public String toString() {
        return name + " (" + dim + ": " + values.length + ")" + (units != null ? " [" + units + "]" : "");
    }
}
