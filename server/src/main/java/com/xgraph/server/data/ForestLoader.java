package com.xgraph.server.data;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xgraph.server.data.events.Event;
import com.xgraph.server.data.events.EventOverlay;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a forest from a JSON document of nested nodes. Each node may declare
 * coordinates (explicit values or a regular start/step/count range), data variables
 * (flat row-major data plus dims, with an optional shape), attributes, events and
 * children.
 */
public class ForestLoader {

    private static final Logger logger = LoggerFactory.getLogger(ForestLoader.class);

    private final ObjectMapper mapper;

    public ForestLoader() {
        this.mapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public static class RangeDef {
        public double start;
        public double step = 1.0;
        public int count;
    }

    public static class CoordDef {
        public String name;
        public String dim;
        public String units;
        public double[] values;
        public RangeDef range;
    }

    public static class VarDef {
        public String name;
        public List<String> dims;
        public int[] shape;
        public String units;
        public double[] data;
        public Map<String, Object> attrs;
    }

    public static class EventDef {
        public double time;
        public String text;
    }

    public static class NodeDef {
        public String name;
        public Map<String, Object> attrs;
        public List<CoordDef> coords;
        public List<VarDef> vars;
        public List<EventDef> events;
        public List<NodeDef> children;
    }

    public static class ForestDef {
        public List<NodeDef> nodes;
    }

    public void load(Path file, DataForest forest, EventOverlay overlay) {
        try (InputStream is = Files.newInputStream(file)) {
            load(is, forest, overlay);
            logger.info("Loaded forest from {} ({} nodes)", file, forest.size());
        } catch (IOException e) {
            throw new RuntimeException("Failed to read forest from " + file, e);
        }
    }

    /**
     * Adds the document's nodes and events to {@code forest} and {@code overlay}. Either the
     * whole document is added and the forest validates, or nothing is added.
     */
    public void load(InputStream jsonStream, DataForest forest, EventOverlay overlay) {
        ForestDef def;
        try {
            def = mapper.readValue(jsonStream, ForestDef.class);
        } catch (IOException e) {
            throw new RuntimeException("Failed to parse forest JSON", e);
        }
        if (def.nodes == null) {
            return;
        }
        List<DataNode> added = new ArrayList<>();
        try {
            for (NodeDef nd : def.nodes) {
                DataNode root;
                try {
                    root = forest.addRoot(nd.name);
                } catch (IllegalArgumentException e) {
                    throw new StructuralException("Invalid root '" + nd.name + "': " + e.getMessage());
                }
                added.add(root);
                fill(forest, overlay, root, nd, new HashMap<>());
            }
            forest.touch();
            forest.validate();
        } catch (RuntimeException e) {
            rollback(forest, overlay, added);
            throw e;
        }
    }

    private static void rollback(DataForest forest, EventOverlay overlay, List<DataNode> added) {
        for (DataNode root : added) {
            Deque<DataNode> stack = new ArrayDeque<>();
            stack.push(root);
            while (!stack.isEmpty()) {
                DataNode n = stack.pop();
                overlay.clear(n);
                n.getChildren().forEach(stack::push);
            }
            forest.removeNode(root);
        }
        logger.debug("Rolled back {} partially loaded root(s)", added.size());
    }

    private void fill(DataForest forest, EventOverlay overlay, DataNode node, NodeDef nd,
            Map<String, Integer> inheritedSizes) {
        try {
            if (nd.attrs != null) {
                node.getAttrs().putAll(nd.attrs);
            }
            Map<String, Integer> sizes = new HashMap<>(inheritedSizes);
            if (nd.coords != null) {
                for (CoordDef cd : nd.coords) {
                    Coordinate c = toCoordinate(cd);
                    node.putCoordinate(c);
                    sizes.put(c.getDim(), c.length());
                }
            }
            if (nd.vars != null) {
                for (VarDef vd : nd.vars) {
                    node.putVariable(toVariable(vd, sizes));
                }
            }
            if (nd.events != null) {
                for (EventDef ed : nd.events) {
                    overlay.addEvent(node, new Event(ed.time, ed.text));
                }
            }
            if (nd.children != null) {
                for (NodeDef cd : nd.children) {
                    DataNode child = forest.addChild(node, cd.name);
                    fill(forest, overlay, child, cd, sizes);
                }
            }
        } catch (IllegalArgumentException e) {
            throw new StructuralException("Invalid node '" + nd.name + "': " + e.getMessage());
        }
    }

    private static Coordinate toCoordinate(CoordDef cd) {
        double[] values = cd.values;
        if (values == null && cd.range != null) {
            values = new double[cd.range.count];
            for (int i = 0; i < values.length; i++) {
                values[i] = cd.range.start + i * cd.range.step;
            }
        }
        if (values == null) {
            throw new IllegalArgumentException("Coordinate " + cd.name + " needs values or a range");
        }
        return new Coordinate(cd.name, cd.dim != null ? cd.dim : cd.name, values, cd.units);
    }

    private static Variable toVariable(VarDef vd, Map<String, Integer> sizes) {
        if (vd.data == null || vd.dims == null) {
            throw new IllegalArgumentException("Variable " + vd.name + " needs dims and data");
        }
        int[] shape = vd.shape;
        if (shape == null) {
            shape = new int[vd.dims.size()];
            for (int axis = 0; axis < shape.length; axis++) {
                Integer n = sizes.get(vd.dims.get(axis));
                if (n == null) {
                    if (shape.length == 1) {
                        n = vd.data.length;
                    } else {
                        throw new IllegalArgumentException("Cannot infer length of dimension '"
                                + vd.dims.get(axis) + "' for " + vd.name + "; give a shape");
                    }
                }
                shape[axis] = n;
            }
        }
        Variable v = new Variable(vd.name, new ArrayList<>(vd.dims), new NdArray(vd.data, shape), vd.units);
        if (vd.attrs != null) {
            v.getAttrs().putAll(new LinkedHashMap<>(vd.attrs));
        }
        return v;
    }
}
