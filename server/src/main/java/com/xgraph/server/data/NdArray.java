package com.xgraph.server.data;

import java.util.Arrays;

/**
 * Dense row-major n-dimensional array of doubles.
 */
public class NdArray {

    private final int[] shape;
    private final int[] strides;
    private final double[] data;

    public NdArray(double[] data, int... shape) {
        if (data == null || shape == null) {
            throw new IllegalArgumentException("data and shape are required");
        }
        long size = 1;
        for (int n : shape) {
            if (n < 0) {
                throw new IllegalArgumentException("Negative extent in shape " + Arrays.toString(shape));
            }
            size *= n;
        }
        if (size != data.length) {
            throw new IllegalArgumentException("Shape " + Arrays.toString(shape) + " needs " + size
                    + " values but got " + data.length);
        }
        this.shape = shape.clone();
        this.data = data.clone();
        this.strides = new int[shape.length];
        int stride = 1;
        for (int axis = shape.length - 1; axis >= 0; axis--) {
            strides[axis] = stride;
            stride *= shape[axis];
        }
    }

    public static NdArray of(double... values) {
        return new NdArray(values, values.length);
    }

    /** Builds a 2-D array from rows, all rows must have the same length. */
    public static NdArray of(double[][] rows) {
        int nrows = rows.length;
        int ncols = nrows == 0 ? 0 : rows[0].length;
        double[] flat = new double[nrows * ncols];
        for (int r = 0; r < nrows; r++) {
            if (rows[r].length != ncols) {
                throw new IllegalArgumentException("Ragged row " + r);
            }
            System.arraycopy(rows[r], 0, flat, r * ncols, ncols);
        }
        return new NdArray(flat, nrows, ncols);
    }

    public int ndim() {
        return shape.length;
    }

    public int[] shape() {
        return shape.clone();
    }

    public int extent(int axis) {
        return shape[axis];
    }

    public int size() {
        return data.length;
    }

    public double get(int... index) {
        return data[offset(index)];
    }

    /**
     * Extracts the 1-D lane along {@code axis}. Entries of {@code index} for every
     * other axis select the lane; the entry at {@code axis} is ignored.
     */
    public double[] line(int axis, int[] index) {
        if (index.length != shape.length) {
            throw new IllegalArgumentException("Expected " + shape.length + " indices, got " + index.length);
        }
        if (shape[axis] == 0) {
            return new double[0];
        }
        int[] start = index.clone();
        start[axis] = 0;
        int base = offset(start);
        double[] out = new double[shape[axis]];
        for (int i = 0; i < out.length; i++) {
            out[i] = data[base + i * strides[axis]];
        }
        return out;
    }

    public double[] toArray() {
        return data.clone();
    }

    private int offset(int[] index) {
        if (index.length != shape.length) {
            throw new IllegalArgumentException("Expected " + shape.length + " indices, got " + index.length);
        }
        int off = 0;
        for (int axis = 0; axis < index.length; axis++) {
            if (index[axis] < 0 || index[axis] >= shape[axis]) {
                throw new IndexOutOfBoundsException("Index " + index[axis] + " out of range for axis " + axis
                        + " with extent " + shape[axis]);
            }
            off += index[axis] * strides[axis];
        }
        return off;
    }
}
