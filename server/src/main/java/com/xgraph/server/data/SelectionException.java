package com.xgraph.server.data;

/**
 * A slice selection does not describe a valid 1-D lane of a variable.
 */
public class SelectionException extends DataTreeException {

    public SelectionException(String message) {
        super(message);
    }
}
