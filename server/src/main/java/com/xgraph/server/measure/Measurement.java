package com.xgraph.server.measure;

/**
 * A single value measured over a slice region. Extremum measurements also carry the x
 * position where the extremum sits; for the others {@code x} is NaN.
 */
public class Measurement {
    private final MeasureType type;
    private final double x;
    private final double value;
    private final int points;
    private final String units;

    public Measurement(MeasureType type, double x, double value, int points, String units) {
        this.type = type;
        this.x = x;
        this.value = value;
        this.points = points;
        this.units = units;
    }

    public MeasureType getType() {
        return type;
    }

    public double getX() {
        return x;
    }

    public double getValue() {
        return value;
    }

    public int getPoints() {
        return points;
    }

    public String getUnits() {
        return units;
    }

    @Override
    public String toString() {
        return "Measurement{" + type + (Double.isNaN(x) ? "" : " at x=" + x) + " = " + value
                + (units != null ? " " + units : "") + ", n=" + points + "}";
    }
}
