package com.xgraph.server.data.tree;

import com.xgraph.server.data.Coordinate;
import com.xgraph.server.data.DataForest;
import com.xgraph.server.data.DataNode;
import com.xgraph.server.data.NdArray;
import com.xgraph.server.data.StructuralException;
import com.xgraph.server.data.Variable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TreeIndexBuilderTest {

    private DataForest forest;
    private DataNode root;
    private DataNode a;
    private DataNode b;
    private DataNode aChild;

    /**
     * root (time, sweep; var I)
     * +- a (redefines time)
     * |  +- aChild
     * +- b
     */
    @BeforeEach
    public void setUp() {
        forest = new DataForest();
        root = forest.addRoot("root");
        root.putVariable(new Variable("I", List.of("time", "sweep"), new NdArray(new double[300], 100, 3), "pA"));
        root.putCoordinate(new Coordinate("time", ramp(100, 0.01), "s"));
        root.putCoordinate(new Coordinate("sweep", new double[] { 1, 2, 3 }, null));
        a = forest.addChild(root, "a");
        a.putCoordinate(new Coordinate("time", ramp(100, 10), "ms"));
        aChild = forest.addChild(a, "aChild");
        b = forest.addChild(root, "b");
    }

    @Test
    public void testDepthFirstOrder() {
        TreeIndex index = TreeIndex.build(forest, VisibilityConfig.all());
        assertEquals(4, index.size());
        assertEquals("/root", index.entries().get(0).getPath());
        assertEquals("/root/a", index.entries().get(1).getPath());
        assertEquals("/root/a/aChild", index.entries().get(2).getPath());
        assertEquals("/root/b", index.entries().get(3).getPath());
        assertEquals(2, index.entries().get(2).getDepth());
    }

    @Test
    public void testShadowingAppliesToDescendantsOnly() {
        TreeIndex index = TreeIndex.build(forest, VisibilityConfig.all());

        TreeIndexEntry entryA = index.lookup("/root/a").orElseThrow();
        assertEquals(List.of("time"), entryA.getOwnCoords());
        assertEquals(List.of("sweep"), entryA.getInheritedCoords());

        // aChild inherits a's time, not root's; it still appears once
        TreeIndexEntry entryChild = index.lookup("/root/a/aChild").orElseThrow();
        assertTrue(entryChild.getOwnCoords().isEmpty());
        assertEquals(2, entryChild.getInheritedCoords().size());
        assertTrue(entryChild.getInheritedCoords().contains("time"));
        assertEquals("ms", forest.resolveCoordinate(aChild, "time").orElseThrow().getUnits());

        // sibling b is unaffected by a's redefinition
        assertEquals("s", forest.resolveCoordinate(b, "time").orElseThrow().getUnits());
        TreeIndexEntry entryB = index.lookup("/root/b").orElseThrow();
        assertTrue(entryB.getInheritedCoords().contains("time"));
    }

    @Test
    public void testNameSetsAreDisjoint() {
        TreeIndex index = TreeIndex.build(forest, VisibilityConfig.all());
        for (TreeIndexEntry e : index.entries()) {
            for (String own : e.getOwnCoords()) {
                assertFalse(e.getInheritedCoords().contains(own), own + " both own and inherited at " + e.getPath());
                assertFalse(e.getDataVars().contains(own));
            }
        }
    }

    @Test
    public void testRebuildIsDeterministic() {
        TreeIndex first = TreeIndex.build(forest, VisibilityConfig.all());
        TreeIndex second = TreeIndex.build(forest, VisibilityConfig.all());
        assertEquals(first.entries(), second.entries());
    }

    @Test
    public void testVisibilityFlags() {
        VisibilityConfig noInherited = new VisibilityConfig(true, true, false);
        TreeIndexEntry entryA = TreeIndex.build(forest, noInherited).lookup("/root/a").orElseThrow();
        assertTrue(entryA.getInheritedCoords().isEmpty());
        assertEquals(List.of("time"), entryA.getOwnCoords());

        TreeIndexEntry rootEntry = TreeIndex.build(forest, VisibilityConfig.nodesOnly()).lookup("/root").orElseThrow();
        assertEquals(List.of("a", "b"), rootEntry.rowNames());
    }

    @Test
    public void testRowNamesAndDetails() {
        TreeIndexEntry rootEntry = TreeIndex.build(forest, VisibilityConfig.all()).lookup("/root").orElseThrow();
        // variables, index coords in dimension order, then children
        assertEquals(List.of("I", "time", "sweep", "a", "b"), rootEntry.rowNames());
        assertEquals("(time: 100, sweep: 3)", rootEntry.details());
    }

    @Test
    public void testNonIndexCoordinatesAfterIndexOnes() {
        root.putCoordinate(new Coordinate("stimulus", "time", ramp(100, 1), "mV"));
        TreeIndexEntry rootEntry = TreeIndex.build(forest, VisibilityConfig.all()).lookup("/root").orElseThrow();
        assertEquals(List.of("time", "sweep", "stimulus"), rootEntry.getOwnCoords());
    }

    @Test
    public void testLookupMissingPath() {
        TreeIndex index = TreeIndex.build(forest, VisibilityConfig.all());
        assertTrue(index.lookup("/root/c").isEmpty());
        assertTrue(index.lookup("/").isEmpty());
        assertTrue(index.lookup("root/a").isPresent());
    }

    @Test
    public void testCycleIsStructuralError() {
        // re-link root beneath its own grandchild
        forest.attachChild(aChild, root);
        assertThrows(StructuralException.class, () -> TreeIndex.build(forest, VisibilityConfig.all()));
    }

    @Test
    public void testSelfParentIsStructuralError() {
        forest.attachChild(b, b);
        assertThrows(StructuralException.class, () -> TreeIndex.build(forest, VisibilityConfig.all()));
    }

    @Test
    public void testIndexRecordsRevision() {
        TreeIndex index = TreeIndex.build(forest, VisibilityConfig.all());
        assertEquals(forest.revision(), index.getForestRevision());
        forest.renameNode(b, "c");
        assertNotEquals(forest.revision(), index.getForestRevision());
    }

    private static double[] ramp(int n, double step) {
        double[] v = new double[n];
        for (int i = 0; i < n; i++) {
            v[i] = i * step;
        }
        return v;
    }
}
