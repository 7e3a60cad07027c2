package com.xgraph.server.data;

/**
 * Base type for failures raised by the data tree engine. All of them are
 * reported synchronously to the caller and never retried.
 */
public class DataTreeException extends RuntimeException {

    public DataTreeException(String message) {
        super(message);
    }

    public DataTreeException(String message, Throwable cause) {
        super(message, cause);
    }
}
