package org.pagemark.progress;

import it.unimi.dsi.fastutil.longs.LongArrayList;

import java.util.List;
import java.util.Objects;

/**
 * Immutable prefix-sum table over effective section sizes.
 *
 * <p>{@code before(i)} is the summed effective size of sections {@code [0, i)}; non-linear
 * sections contribute zero. The sequence is non-decreasing by construction and saturates at
 * {@link Long#MAX_VALUE}.</p>
 */
public final class CumulativeTable {
    /**
     * Table of a document without sections.
     */
    public static final CumulativeTable EMPTY = new CumulativeTable(new long[0], new long[]{0L}, new boolean[0]);

    private final long[] sizes;
    // length sizes.length + 1; the last entry is the total
    private final long[] before;
    private final boolean[] linear;

    private CumulativeTable(long[] sizes, long[] before, boolean[] linear) {
        this.sizes = sizes;
        this.before = before;
        this.linear = linear;
    }

    /**
     * Builds a table from section metadata in document order.
     */
    public static CumulativeTable build(List<SectionMeta> sections) {
        Objects.requireNonNull(sections, "sections");
        if (sections.isEmpty()) {
            return EMPTY;
        }
        LongArrayList sizes = new LongArrayList(sections.size());
        LongArrayList before = new LongArrayList(sections.size() + 1);
        boolean[] linear = new boolean[sections.size()];
        long running = 0L;
        for (int i = 0; i < sections.size(); i++) {
            SectionMeta meta = Objects.requireNonNull(sections.get(i), "section");
            long size = meta.effectiveSize();
            before.add(running);
            sizes.add(size);
            linear[i] = meta.linear();
            running = size > Long.MAX_VALUE - running ? Long.MAX_VALUE : running + size;
        }
        before.add(running);
        return new CumulativeTable(sizes.toLongArray(), before.toLongArray(), linear);
    }

    public int sectionCount() {
        return sizes.length;
    }

    public long total() {
        return before[sizes.length];
    }

    /**
     * Effective size of one section.
     */
    public long size(int sectionIndex) {
        return sizes[sectionIndex];
    }

    /**
     * Summed effective size of all sections before {@code sectionIndex}.
     */
    public long before(int sectionIndex) {
        return before[sectionIndex];
    }

    public boolean isLinear(int sectionIndex) {
        return linear[sectionIndex];
    }

    /**
     * Global start fraction of a section, {@code before(i) / total}. Callers check for a zero
     * total first.
     */
    double startFraction(int sectionIndex) {
        return (double) before[sectionIndex] / total();
    }

    /**
     * Index of the section owning a global fraction in {@code (0, 1)}.
     *
     * <p>Compares against {@link #startFraction(int)}, so a fraction equal to a reported boundary
     * belongs to the later section. Zero-size sections never own a fraction.</p>
     */
    int sectionContaining(double fraction) {
        // largest i with startFraction(i) <= fraction; a zero-size section shares its start with the next
        int lo = 0;
        int hi = sizes.length - 1;
        int found = -1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            if (startFraction(mid) <= fraction) {
                found = mid;
                lo = mid + 1;
            } else {
                hi = mid - 1;
            }
        }
        return Math.max(found, 0);
    }

    /**
     * First linear section, or 0 when none is linear.
     */
    int firstLinear() {
        for (int i = 0; i < linear.length; i++) {
            if (linear[i]) {
                return i;
            }
        }
        return 0;
    }

    /**
     * Last linear section, or the last section when none is linear.
     */
    int lastLinear() {
        for (int i = linear.length - 1; i >= 0; i--) {
            if (linear[i]) {
                return i;
            }
        }
        return linear.length - 1;
    }
}
