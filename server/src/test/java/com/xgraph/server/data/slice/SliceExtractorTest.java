package com.xgraph.server.data.slice;

import com.xgraph.server.data.Coordinate;
import com.xgraph.server.data.DataForest;
import com.xgraph.server.data.DataNode;
import com.xgraph.server.data.DimensionMismatchException;
import com.xgraph.server.data.NdArray;
import com.xgraph.server.data.NodeNotFoundException;
import com.xgraph.server.data.SelectionException;
import com.xgraph.server.data.Variable;
import com.xgraph.units.UnitRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SliceExtractorTest {

    private final UnitRegistry units = new UnitRegistry();
    private DataForest forest;
    private DataNode node;
    private SliceExtractor extractor;

    @BeforeEach
    public void setUp() {
        forest = new DataForest();
        node = forest.addRoot("cell");
        // I[time, sweep] = 1000 * sweep + time index
        double[] data = new double[100 * 3];
        for (int t = 0; t < 100; t++) {
            for (int s = 0; s < 3; s++) {
                data[t * 3 + s] = 1000 * s + t;
            }
        }
        double[] time = new double[100];
        for (int i = 0; i < 100; i++) {
            time[i] = 0.01 * i;
        }
        node.putVariable(new Variable("I", List.of("time", "sweep"), new NdArray(data, 100, 3), "pA"));
        node.putCoordinate(new Coordinate("time", time, "s"));
        extractor = new SliceExtractor(forest, units);
    }

    @Test
    public void testExtractAlongTime() {
        Slice slice = extractor.extract(new SliceSelection("/cell", "I", "time", Map.of("sweep", 1)));
        assertEquals(100, slice.size());
        assertEquals("s", slice.getXUnits());
        assertEquals("pA", slice.getYUnits());
        for (int i = 0; i < 100; i++) {
            assertEquals(0.01 * i, slice.x(i), 1e-12);
            assertEquals(1000 + i, slice.y(i), 1e-12);
        }
    }

    @Test
    public void testMissingCoordinateFallsBackToIndex() {
        Slice slice = extractor.extract(new SliceSelection("/cell", "I", "sweep", Map.of("time", 4)));
        assertArrayEquals(new double[] { 0, 1, 2 }, slice.getX());
        assertArrayEquals(new double[] { 4, 1004, 2004 }, slice.getY());
        assertEquals(UnitRegistry.INDEX_UNITS, slice.getXUnits());
    }

    @Test
    public void testInheritedCoordinate() {
        DataNode child = forest.addChild(node, "filtered");
        child.putVariable(new Variable("I", List.of("time"), new NdArray(new double[100], 100), "pA"));
        Slice slice = extractor.extract(new SliceSelection("/cell/filtered", "I", "time", Map.of()));
        assertEquals(0.99, slice.x(99), 1e-12);
        assertEquals("s", slice.getXUnits());
    }

    @Test
    public void testOutOfRangeIndex() {
        SliceSelection sel = new SliceSelection("/cell", "I", "time", Map.of("sweep", 3));
        assertThrows(SelectionException.class, () -> extractor.extract(sel));
        SliceSelection negative = new SliceSelection("/cell", "I", "time", Map.of("sweep", -1));
        assertThrows(SelectionException.class, () -> extractor.extract(negative));
    }

    @Test
    public void testXDimWithFixedIndexRejected() {
        SliceSelection sel = new SliceSelection("/cell", "I", "time", Map.of("sweep", 0, "time", 2));
        assertThrows(SelectionException.class, () -> extractor.extract(sel));
    }

    @Test
    public void testInvalidSelections() {
        assertThrows(SelectionException.class,
                () -> extractor.extract(new SliceSelection("/cell", "I", "time", Map.of())));
        assertThrows(SelectionException.class,
                () -> extractor.extract(new SliceSelection("/cell", "I", "channel", Map.of("sweep", 0))));
        assertThrows(SelectionException.class,
                () -> extractor.extract(new SliceSelection("/cell", "V", "time", Map.of("sweep", 0))));
        assertThrows(SelectionException.class,
                () -> extractor.extract(new SliceSelection("/cell", "I", "time", Map.of("sweep", 0, "trial", 0))));
        assertThrows(NodeNotFoundException.class,
                () -> extractor.extract(new SliceSelection("/nowhere", "I", "time", Map.of("sweep", 0))));
    }

    @Test
    public void testCoordinateLengthMismatch() {
        DataNode other = forest.addRoot("short");
        other.putVariable(new Variable("V", List.of("t"), NdArray.of(1, 2, 3, 4, 5), "mV"));
        other.putCoordinate(new Coordinate("t", new double[] { 0, 1, 2, 3 }, "s"));
        DimensionMismatchException e = assertThrows(DimensionMismatchException.class,
                () -> extractor.extract(new SliceSelection("/short", "V", "t", Map.of())));
        assertEquals("t", e.getDim());
    }

    @Test
    public void testExpectedUnits() {
        SliceSelection matching = new SliceSelection("/cell", "I", "time", Map.of("sweep", 0), "s", "pA");
        assertEquals(100, extractor.extract(matching).size());

        SliceSelection wrongX = new SliceSelection("/cell", "I", "time", Map.of("sweep", 0), "ms", null);
        assertThrows(SelectionException.class, () -> extractor.extract(wrongX));
    }

    @Test
    public void testExplicitConversion() {
        Slice slice = extractor.extract(new SliceSelection("/cell", "I", "time", Map.of("sweep", 0)));
        Slice ms = slice.convertUnits(units, "ms", null);
        assertEquals("ms", ms.getXUnits());
        assertEquals(990.0, ms.x(99), 1e-9);
        assertEquals(slice.y(5), ms.y(5));
        // source is untouched
        assertEquals(0.99, slice.x(99), 1e-12);
    }
}
