package com.xgraph.server.data;

/**
 * A path does not name any node of the forest.
 */
public class NodeNotFoundException extends SelectionException {

    private final String path;

    public NodeNotFoundException(String path) {
        super("No node at path " + path);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
