package com.xgraph.server.data.slice;

import com.xgraph.units.UnitRegistry;

/**
 * An extracted (x, y) sequence with its units and the selection it came from.
 * Immutable; accessors hand out copies.
 */
public final class Slice {
    private final double[] x;
    private final double[] y;
    private final String xUnits;
    private final String yUnits;
    private final SliceSelection selection;

    public Slice(double[] x, double[] y, String xUnits, String yUnits, SliceSelection selection) {
        if (x.length != y.length) {
            throw new IllegalArgumentException("x and y lengths differ: " + x.length + " vs " + y.length);
        }
        this.x = x.clone();
        this.y = y.clone();
        this.xUnits = xUnits;
        this.yUnits = yUnits;
        this.selection = selection;
    }

    public int size() {
        return x.length;
    }

    public double x(int i) {
        return x[i];
    }

    public double y(int i) {
        return y[i];
    }

    public double[] getX() {
        return x.clone();
    }

    public double[] getY() {
        return y.clone();
    }

    public String getXUnits() {
        return xUnits;
    }

    public String getYUnits() {
        return yUnits;
    }

    public SliceSelection getSelection() {
        return selection;
    }

    /**
     * Returns a new slice with x and/or y converted. A null target leaves that axis as is.
     */
    public Slice convertUnits(UnitRegistry units, String toXUnits, String toYUnits) {
        double[] nx = toXUnits != null ? units.convert(x, xUnits, toXUnits) : x;
        double[] ny = toYUnits != null ? units.convert(y, yUnits, toYUnits) : y;
        return new Slice(nx, ny, toXUnits != null ? toXUnits : xUnits, toYUnits != null ? toYUnits : yUnits,
                selection);
    }

    @Override
    public String toString() {
        return "Slice{n=" + x.length + ", x[" + xUnits + "], y[" + yUnits + "], " + selection + "}";
    }
}
