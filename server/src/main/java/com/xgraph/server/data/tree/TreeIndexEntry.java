package com.xgraph.server.data.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Display projection of one node. Derived from the forest and a {@link VisibilityConfig};
 * never mutated after the index is built.
 */
public class TreeIndexEntry {
    private final String path;
    private final String name;
    private final int depth;
    private final List<String> dataVars;
    private final List<String> ownCoords;
    private final List<String> inheritedCoords;
    private final List<String> childPaths;
    private final Map<String, Integer> sizes;

    public TreeIndexEntry(String path, String name, int depth, List<String> dataVars, List<String> ownCoords,
            List<String> inheritedCoords, List<String> childPaths, Map<String, Integer> sizes) {
        this.path = path;
        this.name = name;
        this.depth = depth;
        this.dataVars = Collections.unmodifiableList(new ArrayList<>(dataVars));
        this.ownCoords = Collections.unmodifiableList(new ArrayList<>(ownCoords));
        this.inheritedCoords = Collections.unmodifiableList(new ArrayList<>(inheritedCoords));
        this.childPaths = Collections.unmodifiableList(new ArrayList<>(childPaths));
        this.sizes = Collections.unmodifiableMap(new LinkedHashMap<>(sizes));
    }

    public String getPath() {
        return path;
    }

    public String getName() {
        return name;
    }

    public int getDepth() {
        return depth;
    }

    public List<String> getDataVars() {
        return dataVars;
    }

    public List<String> getOwnCoords() {
        return ownCoords;
    }

    public List<String> getInheritedCoords() {
        return inheritedCoords;
    }

    public List<String> getChildPaths() {
        return childPaths;
    }

    public Map<String, Integer> getSizes() {
        return sizes;
    }

    /** Visible rows under this node: variables, coordinates, then child nodes. */
    public List<String> rowNames() {
        List<String> rows = new ArrayList<>(dataVars);
        rows.addAll(ownCoords);
        rows.addAll(inheritedCoords);
        for (String child : childPaths) {
            rows.add(child.substring(child.lastIndexOf('/') + 1));
        }
        return rows;
    }

    /** Details column text, e.g. {@code (time: 100, sweep: 3)}. */
    public String details() {
        StringBuilder sb = new StringBuilder("(");
        boolean first = true;
        for (Map.Entry<String, Integer> e : sizes.entrySet()) {
            if (!first)
                sb.append(", ");
            sb.append(e.getKey()).append(": ").append(e.getValue());
            first = false;
        }
        return sb.append(")").toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TreeIndexEntry))
            return false;
        TreeIndexEntry that = (TreeIndexEntry) o;
        return depth == that.depth && path.equals(that.path) && dataVars.equals(that.dataVars)
                && ownCoords.equals(that.ownCoords) && inheritedCoords.equals(that.inheritedCoords)
                && childPaths.equals(that.childPaths) && sizes.equals(that.sizes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, depth, dataVars, ownCoords, inheritedCoords, childPaths, sizes);
    }

    @Override
    public String toString() {
        return "TreeIndexEntry{" + path + " vars=" + dataVars + " coords=" + ownCoords + " inherited="
                + inheritedCoords + " children=" + childPaths.size() + "}";
    }
}
