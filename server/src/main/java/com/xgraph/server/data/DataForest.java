package com.xgraph.server.data;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owner of every {@link DataNode} in a forest. Nodes are registered by integer id; a
 * node's parent is looked up here from the id it stores.
 *
 * <p>Single writer: edits are not synchronized and must not overlap with an index
 * build or a slice extraction.
 */
public class DataForest {

    private static final Logger logger = LoggerFactory.getLogger(DataForest.class);

    public static final String SEPARATOR = "/";

    private final Map<Integer, DataNode> registry = new HashMap<>();
    private final List<DataNode> roots = new ArrayList<>();
    private int nextId = 0;
    private long revision = 0;

    public List<DataNode> getRoots() {
        return Collections.unmodifiableList(roots);
    }

    public Collection<DataNode> allNodes() {
        return Collections.unmodifiableCollection(registry.values());
    }

    public int size() {
        return registry.size();
    }

    /** Incremented on every structural edit and on every variable or coordinate change of an owned node. */
    public long revision() {
        return revision;
    }

    public void touch() {
        revision++;
    }

    public DataNode node(int id) {
        return registry.get(id);
    }

    public Optional<DataNode> parentOf(DataNode node) {
        if (node.parentId == DataNode.NO_PARENT) {
            return Optional.empty();
        }
        return Optional.ofNullable(registry.get(node.parentId));
    }

    public DataNode addRoot(String name) {
        checkName(name);
        checkUnique(name, roots, null);
        DataNode node = register(name);
        roots.add(node);
        revision++;
        return node;
    }

    public DataNode addChild(DataNode parent, String name) {
        return addChild(parent, name, parent.children.size());
    }

    public DataNode addChild(DataNode parent, String name, int row) {
        requireOwned(parent);
        checkName(name);
        checkUnique(name, parent.children, null);
        DataNode node = register(name);
        node.parentId = parent.getId();
        parent.children.add(clampRow(row, parent.children.size()), node);
        revision++;
        return node;
    }

    /**
     * Re-links an existing node under {@code parent} without checking ancestry. Loaders that
     * wire children by id use this; a cycle introduced here is reported when the index is
     * built.
     */
    public void attachChild(DataNode parent, DataNode child) {
        requireOwned(parent);
        requireOwned(child);
        detach(child);
        child.parentId = parent.getId();
        parent.children.add(child);
        revision++;
    }

    /** Moves a node (and its subtree) under a new parent, or to the top level when parent is null. */
    public void moveNode(DataNode node, DataNode newParent, int row) {
        requireOwned(node);
        if (newParent != null) {
            requireOwned(newParent);
            if (isSelfOrAncestor(node, newParent)) {
                throw new StructuralException("Cannot move " + pathOf(node) + " beneath itself ("
                        + pathOf(newParent) + ")");
            }
        }
        List<DataNode> targetSiblings = newParent != null ? newParent.children : roots;
        if (parentOf(node).orElse(null) != newParent) {
            checkUnique(node.getName(), targetSiblings, node);
        }
        int oldRow = detach(node);
        if (parentOf(node).orElse(null) == newParent && oldRow >= 0 && oldRow < row) {
            row--;
        }
        node.parentId = newParent != null ? newParent.getId() : DataNode.NO_PARENT;
        targetSiblings.add(clampRow(row, targetSiblings.size()), node);
        revision++;
    }

    public void renameNode(DataNode node, String newName) {
        requireOwned(node);
        checkName(newName);
        if (newName.equals(node.getName())) {
            return;
        }
        List<DataNode> siblings = parentOf(node).map(p -> p.children).orElse(roots);
        checkUnique(newName, siblings, node);
        node.setName(newName);
        revision++;
    }

    /** Removes a node and its whole subtree from the forest. */
    public void removeNode(DataNode node) {
        requireOwned(node);
        detach(node);
        Deque<DataNode> stack = new ArrayDeque<>();
        stack.push(node);
        int removed = 0;
        while (!stack.isEmpty()) {
            DataNode n = stack.pop();
            if (registry.remove(n.getId()) != null) {
                n.owner = null;
                removed++;
                for (DataNode c : n.children) {
                    stack.push(c);
                }
            }
        }
        node.parentId = DataNode.NO_PARENT;
        revision++;
        logger.debug("Removed {} node(s) rooted at {}", removed, node.getName());
    }

    /** Root-relative path such as {@code /recording/sweeps}. */
    public String pathOf(DataNode node) {
        List<String> names = new ArrayList<>();
        DataNode cur = node;
        int steps = 0;
        while (cur != null) {
            if (++steps > registry.size() + 1) {
                throw new StructuralException("Parent chain of node " + node.getName() + " is cyclic");
            }
            names.add(cur.getName());
            cur = cur.parentId == DataNode.NO_PARENT ? null : registry.get(cur.parentId);
        }
        Collections.reverse(names);
        return SEPARATOR + String.join(SEPARATOR, names);
    }

    /** Ancestors of a node, nearest first. */
    public List<DataNode> ancestors(DataNode node) {
        List<DataNode> out = new ArrayList<>();
        DataNode cur = parentOf(node).orElse(null);
        while (cur != null) {
            if (out.size() > registry.size()) {
                throw new StructuralException("Parent chain of node " + node.getName() + " is cyclic");
            }
            out.add(cur);
            cur = parentOf(cur).orElse(null);
        }
        return out;
    }

    public Optional<DataNode> resolve(String path) {
        List<String> parts = splitPath(path);
        if (parts.isEmpty()) {
            return Optional.empty();
        }
        DataNode cur = null;
        for (DataNode r : roots) {
            if (r.getName().equals(parts.get(0))) {
                cur = r;
                break;
            }
        }
        for (int i = 1; i < parts.size() && cur != null; i++) {
            cur = cur.child(parts.get(i));
        }
        return Optional.ofNullable(cur);
    }

    /**
     * Resolves a coordinate by walking from the node upward; the nearest definition wins.
     */
    public Optional<Coordinate> resolveCoordinate(DataNode node, String name) {
        Coordinate own = node.getCoordinate(name);
        if (own != null) {
            return Optional.of(own);
        }
        for (DataNode a : ancestors(node)) {
            Coordinate c = a.getCoordinate(name);
            if (c != null) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }

    /**
     * Coordinates visible at a node through its ancestors and not redefined on the node
     * itself, in order of the nearest defining ancestor.
     */
    public Map<String, Coordinate> inheritedCoordinates(DataNode node) {
        Map<String, Coordinate> inherited = new LinkedHashMap<>();
        for (DataNode a : ancestors(node)) {
            for (Coordinate c : a.getCoords().values()) {
                if (node.getCoordinate(c.getName()) == null) {
                    inherited.putIfAbsent(c.getName(), c);
                }
            }
        }
        return inherited;
    }

    /** Type of the object at {@code path}: a node, or a variable/coordinate under its parent node. */
    public Optional<ItemType> itemTypeAt(String path) {
        if (resolve(path).isPresent()) {
            return Optional.of(ItemType.NODE);
        }
        List<String> parts = splitPath(path);
        if (parts.size() < 2) {
            return Optional.empty();
        }
        String leaf = parts.get(parts.size() - 1);
        String parentPath = SEPARATOR + String.join(SEPARATOR, parts.subList(0, parts.size() - 1));
        Optional<DataNode> parent = resolve(parentPath);
        if (parent.isEmpty()) {
            return Optional.empty();
        }
        if (parent.get().getVariable(leaf) != null) {
            return Optional.of(ItemType.DATA_VAR);
        }
        if (resolveCoordinate(parent.get(), leaf).isPresent()) {
            return Optional.of(ItemType.COORD);
        }
        return Optional.empty();
    }

    /**
     * Checks that every variable and coordinate agrees with the length of the same
     * dimension defined at the node or any ancestor.
     */
    public void validate() {
        Deque<DataNode> stack = new ArrayDeque<>();
        for (int i = roots.size() - 1; i >= 0; i--) {
            stack.push(roots.get(i));
        }
        int visited = 0;
        while (!stack.isEmpty()) {
            DataNode node = stack.pop();
            if (++visited > registry.size()) {
                throw new StructuralException("Forest contains a cycle");
            }
            Map<String, Integer> sizes = new LinkedHashMap<>();
            for (Variable v : node.getDataVars().values()) {
                for (int axis = 0; axis < v.getDims().size(); axis++) {
                    checkSize(node, sizes, v.getDims().get(axis), v.getData().extent(axis), v.getName());
                }
            }
            for (Coordinate c : node.getCoords().values()) {
                checkSize(node, sizes, c.getDim(), c.length(), c.getName());
            }
            for (Map.Entry<String, Integer> e : sizes.entrySet()) {
                for (DataNode a : ancestors(node)) {
                    Integer upper = a.sizes().get(e.getKey());
                    if (upper != null && !upper.equals(e.getValue())) {
                        throw new StructuralException("Dimension '" + e.getKey() + "' has length " + e.getValue()
                                + " at " + pathOf(node) + " but " + upper + " at ancestor " + pathOf(a));
                    }
                }
            }
            for (int i = node.children.size() - 1; i >= 0; i--) {
                stack.push(node.children.get(i));
            }
        }
    }

    public static String uniqueName(String name, Collection<String> taken) {
        if (!taken.contains(name)) {
            return name;
        }
        int i = 2;
        String candidate = name + "_" + i;
        while (taken.contains(candidate)) {
            i++;
            candidate = name + "_" + i;
        }
        return candidate;
    }

    public static List<String> splitPath(String path) {
        List<String> parts = new ArrayList<>();
        if (path == null) {
            return parts;
        }
        for (String p : path.split(SEPARATOR)) {
            if (!p.isEmpty()) {
                parts.add(p);
            }
        }
        return parts;
    }

    private void checkSize(DataNode node, Map<String, Integer> sizes, String dim, int length, String owner) {
        Integer prev = sizes.putIfAbsent(dim, length);
        if (prev != null && prev != length) {
            throw new StructuralException("Dimension '" + dim + "' of " + owner + " has length " + length
                    + " but " + prev + " elsewhere in " + pathOf(node));
        }
    }

    private DataNode register(String name) {
        DataNode node = new DataNode(nextId++, name, this);
        registry.put(node.getId(), node);
        return node;
    }

    private int detach(DataNode node) {
        List<DataNode> siblings = parentOf(node).map(p -> p.children).orElse(roots);
        int row = indexOfIdentity(siblings, node);
        if (row >= 0) {
            siblings.remove(row);
        }
        return row;
    }

    private boolean isSelfOrAncestor(DataNode candidate, DataNode node) {
        if (candidate == node) {
            return true;
        }
        for (DataNode a : ancestors(node)) {
            if (a == candidate) {
                return true;
            }
        }
        return false;
    }

    private void requireOwned(DataNode node) {
        if (node == null || registry.get(node.getId()) != node) {
            throw new IllegalArgumentException("Node does not belong to this forest: " + node);
        }
    }

    private static void checkName(String name) {
        if (name == null || name.isEmpty() || name.contains(SEPARATOR)) {
            throw new IllegalArgumentException("Invalid node name: '" + name + "'");
        }
    }

    private static void checkUnique(String name, List<DataNode> siblings, DataNode self) {
        for (DataNode s : siblings) {
            if (s != self && s.getName().equals(name)) {
                throw new IllegalArgumentException("Name '" + name + "' already exists among siblings");
            }
        }
    }

    private static int indexOfIdentity(List<DataNode> list, DataNode node) {
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i) == node) {
                return i;
            }
        }
        return -1;
    }

    private static int clampRow(int row, int size) {
        return Math.max(0, Math.min(row, size));
    }
}
