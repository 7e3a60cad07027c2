package com.xgraph.server.data.tree;

import java.util.Objects;

/**
 * Which kinds of rows the tree index shows under each node.
 */
public class VisibilityConfig {
    public boolean showDataVars = true;
    public boolean showOwnCoords = true;
    public boolean showInheritedCoords = true;

    public VisibilityConfig() {
    }

    public VisibilityConfig(boolean showDataVars, boolean showOwnCoords, boolean showInheritedCoords) {
        this.showDataVars = showDataVars;
        this.showOwnCoords = showOwnCoords;
        this.showInheritedCoords = showInheritedCoords;
    }

    public static VisibilityConfig all() {
        return new VisibilityConfig(true, true, true);
    }

    public static VisibilityConfig nodesOnly() {
        return new VisibilityConfig(false, false, false);
    }

    public VisibilityConfig copy() {
        return new VisibilityConfig(showDataVars, showOwnCoords, showInheritedCoords);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof VisibilityConfig))
            return false;
        VisibilityConfig that = (VisibilityConfig) o;
        return showDataVars == that.showDataVars && showOwnCoords == that.showOwnCoords
                && showInheritedCoords == that.showInheritedCoords;
    }

    @Override
    public int hashCode() {
        return Objects.hash(showDataVars, showOwnCoords, showInheritedCoords);
    }

    @Override
    public String toString() {
        return "VisibilityConfig{dataVars=" + showDataVars + ", ownCoords=" + showOwnCoords + ", inheritedCoords="
                + showInheritedCoords + '}';
    }
}
