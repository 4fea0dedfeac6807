package org.pagemark.cfi;

import java.util.Objects;

/**
 * Concrete span between two points of one section.
 *
 * @param start start boundary.
 * @param end end boundary.
 * @param <N> host node type.
 */
public record NodeRange<N>(NodeOffset<N> start, NodeOffset<N> end) {

    /**
     * Validates required fields.
     */
    public NodeRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
    }

    /**
     * Returns true when both boundaries are the same point.
     */
    public boolean isCollapsed() {
        return start.equals(end);
    }
}
