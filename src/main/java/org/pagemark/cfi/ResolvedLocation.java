package org.pagemark.cfi;

import lombok.Value;

import java.util.List;
import java.util.Objects;

/**
 * Transient resolution result handed to rendering, search and annotation collaborators.
 *
 * @param <N> host node type.
 */
@Value
public class ResolvedLocation<N> {
    /**
     * Zero-based section index.
     */
    int sectionIndex;

    /**
     * Point anchor, or null for ranges.
     */
    NodeOffset<N> point;

    /**
     * Range anchor, or null for points.
     */
    NodeRange<N> range;

    /**
     * Non-fatal drift detected during resolution, in walk order.
     */
    List<ResolutionWarning> warnings;

    private ResolvedLocation(int sectionIndex, NodeOffset<N> point, NodeRange<N> range, List<ResolutionWarning> warnings) {
        this.sectionIndex = sectionIndex;
        this.point = point;
        this.range = range;
        this.warnings = List.copyOf(warnings);
    }

    /**
     * Creates a point location.
     */
    public static <N> ResolvedLocation<N> point(int sectionIndex, NodeOffset<N> point, List<ResolutionWarning> warnings) {
        return new ResolvedLocation<>(sectionIndex, Objects.requireNonNull(point, "point"), null, warnings);
    }

    /**
     * Creates a range location.
     */
    public static <N> ResolvedLocation<N> range(int sectionIndex, NodeRange<N> range, List<ResolutionWarning> warnings) {
        return new ResolvedLocation<>(sectionIndex, null, Objects.requireNonNull(range, "range"), warnings);
    }

    /**
     * Returns true for range locations.
     */
    public boolean isRange() {
        return range != null;
    }

    /**
     * Returns the point, or the range start.
     */
    public NodeOffset<N> start() {
        return isRange() ? range.start() : point;
    }

    /**
     * Returns the point, or the range end.
     */
    public NodeOffset<N> end() {
        return isRange() ? range.end() : point;
    }

    /**
     * Returns true when resolution recorded any warning.
     */
    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
