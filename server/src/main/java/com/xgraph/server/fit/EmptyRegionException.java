package com.xgraph.server.fit;

import com.xgraph.server.data.DataTreeException;

/**
 * No slice point falls inside the requested x-range.
 */
public class EmptyRegionException extends DataTreeException {

    public EmptyRegionException(double xMin, double xMax) {
        super("No points with x in [" + xMin + ", " + xMax + "]");
    }
}
