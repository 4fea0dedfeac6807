package org.pagemark.cfi;

import lombok.Value;

import java.util.Objects;

/**
 * Parsed canonical fragment identifier: either a point path or a range.
 *
 * <p>A range keeps the shared {@code parent} prefix and the {@code start}/{@code end} suffixes
 * relative to it, exactly as written. {@link #collapse(boolean)} joins them into absolute
 * paths.</p>
 */
@Value
public class Cfi {
    /**
     * Point path, or null for ranges.
     */
    CfiPath path;

    /**
     * Shared range prefix, or null for points.
     */
    CfiPath parent;

    /**
     * Range start suffix relative to {@link #parent}, or null for points.
     */
    CfiPath start;

    /**
     * Range end suffix relative to {@link #parent}, or null for points.
     */
    CfiPath end;

    private Cfi(CfiPath path, CfiPath parent, CfiPath start, CfiPath end) {
        this.path = path;
        this.parent = parent;
        this.start = start;
        this.end = end;
    }

    /**
     * Creates a point identifier.
     */
    public static Cfi point(CfiPath path) {
        return new Cfi(Objects.requireNonNull(path, "path"), null, null, null);
    }

    /**
     * Creates a range identifier.
     */
    public static Cfi range(CfiPath parent, CfiPath start, CfiPath end) {
        CfiPath nonNullParent = Objects.requireNonNull(parent, "parent");
        if (nonNullParent.lastStep().hasTerminal()) {
            throw new IllegalArgumentException("range parent must not carry terminal data");
        }
        return new Cfi(
                null,
                nonNullParent,
                Objects.requireNonNull(start, "start"),
                Objects.requireNonNull(end, "end")
        );
    }

    /**
     * Returns true for range identifiers.
     */
    public boolean isRange() {
        return parent != null;
    }

    /**
     * Returns the absolute path of one range boundary; points return their own path.
     *
     * @param toEnd true for the end boundary, false for the start boundary.
     */
    public CfiPath collapse(boolean toEnd) {
        if (!isRange()) {
            return path;
        }
        return parent.append(toEnd ? end : start);
    }

    /**
     * Returns the path that carries the section reference.
     */
    public CfiPath anchorPath() {
        return isRange() ? parent : path;
    }

    @Override
    public String toString() {
        return CfiFormatter.format(this);
    }
}
