package com.xgraph.server.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One dataset in the forest: ordered data variables, ordered coordinates, attributes
 * and owned children. The parent is held as an id resolved through the owning
 * {@link DataForest}, never as a reference.
 */
public class DataNode {

    public static final int NO_PARENT = -1;

    private final int id;
    private String name;
    int parentId = NO_PARENT;
    final List<DataNode> children = new ArrayList<>();

    private final Map<String, Variable> dataVars = new LinkedHashMap<>();
    private final Map<String, Coordinate> coords = new LinkedHashMap<>();
    private final Map<String, Object> attrs = new LinkedHashMap<>();

    // forest to notify of content edits; null once the node is removed
    DataForest owner;

    DataNode(int id, String name, DataForest owner) {
        this.id = id;
        this.name = name;
        this.owner = owner;
    }

    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    void setName(String name) {
        this.name = name;
    }

    public int getParentId() {
        return parentId;
    }

    public boolean isRoot() {
        return parentId == NO_PARENT;
    }

    public List<DataNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public DataNode child(String childName) {
        for (DataNode c : children) {
            if (c.getName().equals(childName)) {
                return c;
            }
        }
        return null;
    }

    public Map<String, Variable> getDataVars() {
        return Collections.unmodifiableMap(dataVars);
    }

    public Map<String, Coordinate> getCoords() {
        return Collections.unmodifiableMap(coords);
    }

    public Map<String, Object> getAttrs() {
        return attrs;
    }

    public Variable getVariable(String varName) {
        return dataVars.get(varName);
    }

    public Coordinate getCoordinate(String coordName) {
        return coords.get(coordName);
    }

    public DataNode putVariable(Variable var) {
        if (coords.containsKey(var.getName())) {
            throw new IllegalArgumentException("Node " + name + " already has a coordinate named " + var.getName());
        }
        dataVars.put(var.getName(), var);
        changed();
        return this;
    }

    public DataNode putCoordinate(Coordinate coord) {
        if (dataVars.containsKey(coord.getName())) {
            throw new IllegalArgumentException("Node " + name + " already has a variable named " + coord.getName());
        }
        coords.put(coord.getName(), coord);
        changed();
        return this;
    }

    public Variable removeVariable(String varName) {
        Variable removed = dataVars.remove(varName);
        if (removed != null) {
            changed();
        }
        return removed;
    }

    public Coordinate removeCoordinate(String coordName) {
        Coordinate removed = coords.remove(coordName);
        if (removed != null) {
            changed();
        }
        return removed;
    }

    /** Reorders data variables; names not listed keep their relative order after the listed ones. */
    public void reorderVariables(List<String> order) {
        Map<String, Variable> reordered = new LinkedHashMap<>();
        for (String n : order) {
            Variable v = dataVars.get(n);
            if (v != null) {
                reordered.put(n, v);
            }
        }
        for (Map.Entry<String, Variable> e : dataVars.entrySet()) {
            reordered.putIfAbsent(e.getKey(), e.getValue());
        }
        dataVars.clear();
        dataVars.putAll(reordered);
        changed();
    }

    /** Dimension names in the order they first appear across the data variables. */
    public List<String> orderedDims() {
        List<String> dims = new ArrayList<>();
        for (Variable v : dataVars.values()) {
            for (String d : v.getDims()) {
                if (!dims.contains(d)) {
                    dims.add(d);
                }
            }
        }
        return dims;
    }

    /**
     * Lengths of the dimensions used by this node's own variables and coordinates, data
     * variables first. Conflicting lengths are reported by {@link DataForest#validate()}.
     */
    public Map<String, Integer> sizes() {
        Map<String, Integer> sizes = new LinkedHashMap<>();
        for (Variable v : dataVars.values()) {
            for (int axis = 0; axis < v.getDims().size(); axis++) {
                sizes.putIfAbsent(v.getDims().get(axis), v.getData().extent(axis));
            }
        }
        for (Coordinate c : coords.values()) {
            sizes.putIfAbsent(c.getDim(), c.length());
        }
        return sizes;
    }

    private void changed() {
        if (owner != null) {
            owner.touch();
        }
    }

    public boolean hasData() {
        return !dataVars.isEmpty() || !coords.isEmpty();
    }

    @Override
    public String toString() {
        return "DataNode{id=" + id + ", name='" + name + "', vars=" + dataVars.keySet() + ", coords="
                + coords.keySet() + ", children=" + children.size() + "}";
    }
}
