package com.xgraph.units;

public class IncommensurableUnitsException extends RuntimeException {

    public IncommensurableUnitsException(String from, String to) {
        super("Cannot convert '" + from + "' to '" + to + "'");
    }

    public IncommensurableUnitsException(String from, String to, Throwable cause) {
        super("Cannot convert '" + from + "' to '" + to + "'", cause);
    }
}
