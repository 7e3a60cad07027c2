package com.xgraph.server.data;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

public class NdArrayTest {

    @Test
    public void testRowMajorIndexing() {
        // 2 x 3
        NdArray a = new NdArray(new double[] { 1, 2, 3, 4, 5, 6 }, 2, 3);
        assertEquals(2, a.ndim());
        assertEquals(6, a.size());
        assertEquals(3, a.extent(1));
        assertEquals(1.0, a.get(0, 0));
        assertEquals(3.0, a.get(0, 2));
        assertEquals(4.0, a.get(1, 0));
        assertEquals(6.0, a.get(1, 2));
    }

    @Test
    public void testLineAlongEitherAxis() {
        NdArray a = NdArray.of(new double[][] { { 1, 2, 3 }, { 4, 5, 6 } });
        assertArrayEquals(new double[] { 4, 5, 6 }, a.line(1, new int[] { 1, 0 }));
        assertArrayEquals(new double[] { 2, 5 }, a.line(0, new int[] { 0, 1 }));
        // the entry at the line axis is ignored
        assertArrayEquals(new double[] { 2, 5 }, a.line(0, new int[] { 1, 1 }));
    }

    @Test
    public void testThreeDimensionalLine() {
        double[] data = new double[2 * 3 * 4];
        for (int i = 0; i < data.length; i++) {
            data[i] = i;
        }
        NdArray a = new NdArray(data, 2, 3, 4);
        // [1, :, 2] -> 12 + 4*j + 2
        assertArrayEquals(new double[] { 14, 18, 22 }, a.line(1, new int[] { 1, 0, 2 }));
    }

    @Test
    public void testShapeMismatchRejected() {
        assertThrows(IllegalArgumentException.class, () -> new NdArray(new double[5], 2, 3));
        assertThrows(IllegalArgumentException.class, () -> NdArray.of(new double[][] { { 1, 2 }, { 3 } }));
    }

    @Test
    public void testOutOfRangeIndex() {
        NdArray a = NdArray.of(1, 2, 3);
        assertThrows(IndexOutOfBoundsException.class, () -> a.get(3));
        assertThrows(IllegalArgumentException.class, () -> a.get(0, 0));
    }

    @Test
    public void testEmptyAxis() {
        NdArray a = new NdArray(new double[0], 0, 2);
        assertEquals(0, a.line(0, new int[] { 0, 1 }).length);
    }
}
