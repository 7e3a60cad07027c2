package com.xgraph.server.data;

/**
 * The forest is cyclic or otherwise malformed. Aborts an index build.
 */
public class StructuralException extends DataTreeException {

    public StructuralException(String message) {
        super(message);
    }
}
