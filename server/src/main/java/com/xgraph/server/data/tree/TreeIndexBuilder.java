package com.xgraph.server.data.tree;

import com.xgraph.server.data.Coordinate;
import com.xgraph.server.data.DataForest;
import com.xgraph.server.data.DataNode;
import com.xgraph.server.data.StructuralException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class TreeIndexBuilder {

    private static final Logger logger = LoggerFactory.getLogger(TreeIndexBuilder.class);

    private final VisibilityConfig visibility;

    public TreeIndexBuilder(VisibilityConfig visibility) {
        this.visibility = visibility != null ? visibility.copy() : VisibilityConfig.all();
    }

    /**
     * Walks the forest depth-first, children in stored order.
     *
     * @throws StructuralException if a node is its own descendant, is reachable from
     *                             two parents, disagrees with its parent handle, shares a
     *                             name with a sibling, or cannot be reached from any root
     */
    public TreeIndex build(DataForest forest) {
        List<TreeIndexEntry> entries = new ArrayList<>();
        Set<DataNode> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Set<DataNode> onPath = Collections.newSetFromMap(new IdentityHashMap<>());

        checkSiblingNames(forest.getRoots(), "forest root");
        for (DataNode root : forest.getRoots()) {
            if (!root.isRoot()) {
                throw new StructuralException("Top-level node " + root.getName() + " has a parent handle");
            }
            visit(root, "", 0, new LinkedHashMap<>(), entries, visited, onPath);
        }

        if (visited.size() != forest.size()) {
            List<String> lost = new ArrayList<>();
            for (DataNode n : forest.allNodes()) {
                if (!visited.contains(n)) {
                    lost.add(n.getName() + "#" + n.getId());
                }
            }
            throw new StructuralException("Nodes not reachable from any root (cyclic parent links?): " + lost);
        }

        logger.debug("Built tree index with {} entries ({})", entries.size(), visibility);
        return new TreeIndex(entries, visibility, forest.revision());
    }

    private void visit(DataNode node, String parentPath, int depth, Map<String, Coordinate> scope,
            List<TreeIndexEntry> out, Set<DataNode> visited, Set<DataNode> onPath) {
        String path = parentPath + DataForest.SEPARATOR + node.getName();
        if (onPath.contains(node)) {
            throw new StructuralException("Cycle detected: " + path + " is its own descendant");
        }
        if (!visited.add(node)) {
            throw new StructuralException("Node " + path + " is reachable from more than one parent");
        }
        onPath.add(node);

        Map<String, Coordinate> inherited = new LinkedHashMap<>();
        for (Map.Entry<String, Coordinate> e : scope.entrySet()) {
            if (node.getCoordinate(e.getKey()) == null) {
                inherited.put(e.getKey(), e.getValue());
            }
        }

        List<String> childPaths = new ArrayList<>();
        for (DataNode child : node.getChildren()) {
            if (child.getParentId() != node.getId()) {
                throw new StructuralException("Child " + child.getName() + " of " + path
                        + " points to a different parent");
            }
            childPaths.add(path + DataForest.SEPARATOR + child.getName());
        }
        checkSiblingNames(node.getChildren(), path);

        Map<String, Integer> sizes = new LinkedHashMap<>(node.sizes());
        for (Coordinate c : inherited.values()) {
            sizes.putIfAbsent(c.getDim(), c.length());
        }

        List<String> dims = new ArrayList<>(node.orderedDims());
        out.add(new TreeIndexEntry(path, node.getName(), depth,
                visibility.showDataVars ? new ArrayList<>(node.getDataVars().keySet()) : List.of(),
                visibility.showOwnCoords ? orderCoords(node.getCoords(), dims) : List.of(),
                visibility.showInheritedCoords ? orderCoords(inherited, dims) : List.of(),
                childPaths, sizes));

        // a coordinate defined here shadows the ancestor's version for the whole subtree
        Map<String, Coordinate> childScope = new LinkedHashMap<>(scope);
        childScope.putAll(node.getCoords());
        for (DataNode child : node.getChildren()) {
            visit(child, path, depth + 1, childScope, out, visited, onPath);
        }
        onPath.remove(node);
    }

    /** Index coordinates in dimension order first, then any remaining ones as stored. */
    static List<String> orderCoords(Map<String, Coordinate> coords, List<String> dims) {
        List<String> names = new ArrayList<>();
        for (String dim : dims) {
            Coordinate c = coords.get(dim);
            if (c != null && c.isIndex()) {
                names.add(dim);
            }
        }
        for (Coordinate c : coords.values()) {
            if (c.isIndex() && !names.contains(c.getName())) {
                names.add(c.getName());
            }
        }
        for (Coordinate c : coords.values()) {
            if (!c.isIndex()) {
                names.add(c.getName());
            }
        }
        return names;
    }

    private static void checkSiblingNames(List<DataNode> siblings, String where) {
        Set<String> names = new HashSet<>();
        for (DataNode s : siblings) {
            if (!names.add(s.getName())) {
                throw new StructuralException("Duplicate child name '" + s.getName() + "' under " + where);
            }
        }
    }
}
