package com.xgraph.server.data;

public class DimensionMismatchException extends DataTreeException {

    private final String dim;
    private final int expected;
    private final int actual;

    public DimensionMismatchException(String dim, int expected, int actual) {
        super("Length mismatch along '" + dim + "': variable extent " + expected + " vs coordinate length " + actual);
        this.dim = dim;
        this.expected = expected;
        this.actual = actual;
    }

    public String getDim() {
        return dim;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
