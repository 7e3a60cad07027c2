package com.xgraph.server.data.slice;

import com.xgraph.server.data.Coordinate;
import com.xgraph.server.data.DataForest;
import com.xgraph.server.data.DataNode;
import com.xgraph.server.data.DimensionMismatchException;
import com.xgraph.server.data.NodeNotFoundException;
import com.xgraph.server.data.SelectionException;
import com.xgraph.server.data.Variable;
import com.xgraph.units.UnitRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns an n-dimensional variable plus fixed indices for all but one dimension into a
 * {@link Slice}. Units pass through as declared; nothing is converted here.
 */
public class SliceExtractor {

    private static final Logger logger = LoggerFactory.getLogger(SliceExtractor.class);

    private final DataForest forest;
    private final UnitRegistry units;

    public SliceExtractor(DataForest forest, UnitRegistry units) {
        this.forest = forest;
        this.units = units;
    }

    public Slice extract(SliceSelection selection) {
        DataNode node = forest.resolve(selection.getNodePath())
                .orElseThrow(() -> new NodeNotFoundException(selection.getNodePath()));
        return extract(node, selection);
    }

    public Slice extract(DataNode node, SliceSelection selection) {
        Variable var = node.getVariable(selection.getVariable());
        if (var == null) {
            throw new SelectionException("Node " + node.getName() + " has no data variable '"
                    + selection.getVariable() + "'");
        }
        String xDim = selection.getXDim();
        int xAxis = var.axisOf(xDim);
        if (xAxis < 0) {
            throw new SelectionException("'" + xDim + "' is not a dimension of " + var);
        }
        Map<String, Integer> fixed = selection.getFixed();
        if (fixed.containsKey(xDim)) {
            throw new SelectionException("x dimension '" + xDim + "' must not have a fixed index");
        }
        for (String dim : fixed.keySet()) {
            if (var.axisOf(dim) < 0) {
                throw new SelectionException("Fixed index given for unknown dimension '" + dim + "' of " + var);
            }
        }

        List<String> dims = var.getDims();
        int[] index = new int[dims.size()];
        for (int axis = 0; axis < dims.size(); axis++) {
            if (axis == xAxis) {
                continue;
            }
            String dim = dims.get(axis);
            Integer i = fixed.get(dim);
            if (i == null) {
                throw new SelectionException("No fixed index for dimension '" + dim + "' of " + var);
            }
            int extent = var.getData().extent(axis);
            if (i < 0 || i >= extent) {
                throw new SelectionException("Index " + i + " out of range for dimension '" + dim
                        + "' with length " + extent);
            }
            index[axis] = i;
        }

        int n = var.getData().extent(xAxis);
        double[] x;
        String xUnits;
        Optional<Coordinate> coord = forest.resolveCoordinate(node, xDim);
        if (coord.isPresent()) {
            if (coord.get().length() != n) {
                throw new DimensionMismatchException(xDim, n, coord.get().length());
            }
            x = coord.get().getValues();
            xUnits = coord.get().getUnits();
        } else {
            x = new double[n];
            for (int i = 0; i < n; i++) {
                x[i] = i;
            }
            xUnits = UnitRegistry.INDEX_UNITS;
        }
        double[] y = var.getData().line(xAxis, index);
        String yUnits = var.getUnits();

        checkUnits("x", selection.getExpectedXUnits(), xUnits);
        checkUnits("y", selection.getExpectedYUnits(), yUnits);

        logger.trace("Extracted {} points from {}/{} along {}", n, node.getName(), var.getName(), xDim);
        return new Slice(x, y, xUnits, yUnits, selection);
    }

    private void checkUnits(String axis, String expected, String actual) {
        if (expected == null) {
            return;
        }
        if (!units.sameUnits(expected, actual)) {
            throw new SelectionException(axis + " units '" + actual + "' do not match requested '" + expected
                    + "'; convert the slice explicitly");
        }
    }
}
