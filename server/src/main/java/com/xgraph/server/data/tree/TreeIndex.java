package com.xgraph.server.data.tree;

import com.xgraph.server.data.DataForest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Depth-first, display-ordered index over a forest. Immutable; rebuild it with
 * {@link TreeIndexBuilder} whenever the forest or the visibility settings change.
 */
public class TreeIndex {
    private final List<TreeIndexEntry> entries;
    private final Map<String, TreeIndexEntry> byPath;
    private final VisibilityConfig visibility;
    private final long forestRevision;

    TreeIndex(List<TreeIndexEntry> entries, VisibilityConfig visibility, long forestRevision) {
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
        Map<String, TreeIndexEntry> map = new LinkedHashMap<>();
        for (TreeIndexEntry e : entries) {
            map.put(e.getPath(), e);
        }
        this.byPath = Collections.unmodifiableMap(map);
        this.visibility = visibility.copy();
        this.forestRevision = forestRevision;
    }

    public static TreeIndex build(DataForest forest, VisibilityConfig visibility) {
        return new TreeIndexBuilder(visibility).build(forest);
    }

    public List<TreeIndexEntry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public Optional<TreeIndexEntry> lookup(String path) {
        List<String> parts = DataForest.splitPath(path);
        if (parts.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(byPath.get(DataForest.SEPARATOR + String.join(DataForest.SEPARATOR, parts)));
    }

    public VisibilityConfig getVisibility() {
        return visibility.copy();
    }

    public long getForestRevision() {
        return forestRevision;
    }
}
