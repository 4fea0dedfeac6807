package org.pagemark.cfi;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Document-order comparator over parsed identifiers of one document.
 *
 * <p>Paths compare step by step, group by group: first by index, then, on the terminal steps of
 * both paths, by character offset (absent before present), temporal offset and spatial point.
 * Integer order of indices already places an odd gap index {@code k} strictly between the
 * element indices {@code k-1} and {@code k+1}. A strict prefix sorts before its extensions.
 * Because the section reference is the first addressing step, paths of different sections are
 * ordered by section first.</p>
 *
 * <p>Ranges compare by their collapsed start, then by their collapsed end; a point behaves like
 * an empty range. Assertions and side bias never affect order. The order is total over paths of
 * one document, so it is safe for sorting and deduplication. Comparing identifiers of unrelated
 * documents is a caller contract violation with undefined order.</p>
 */
public final class CfiComparator implements Comparator<Cfi> {
    /**
     * Shared stateless instance.
     */
    public static final CfiComparator INSTANCE = new CfiComparator();

    /**
     * Three-way comparison result.
     */
    public enum Ordering {
        LESS,
        EQUAL,
        GREATER;

        static Ordering of(int comparison) {
            if (comparison < 0) {
                return LESS;
            }
            return comparison == 0 ? EQUAL : GREATER;
        }
    }

    @Override
    public int compare(Cfi a, Cfi b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        if (!a.isRange() && !b.isRange()) {
            return comparePaths(a.getPath(), b.getPath());
        }
        int start = comparePaths(a.collapse(false), b.collapse(false));
        if (start != 0) {
            return start;
        }
        return comparePaths(a.collapse(true), b.collapse(true));
    }

    /**
     * Compares two identifiers and returns a named ordering.
     */
    public Ordering order(Cfi a, Cfi b) {
        return Ordering.of(compare(a, b));
    }

    /**
     * Parses and compares two CFI strings.
     *
     * @throws CfiParseException when either string is malformed.
     */
    public int compare(String a, String b) {
        return compare(CfiParser.parse(a), CfiParser.parse(b));
    }

    /**
     * Compares two absolute paths.
     */
    public int comparePaths(CfiPath a, CfiPath b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        int groupCount = Math.max(a.groupCount(), b.groupCount());
        for (int g = 0; g < groupCount; g++) {
            if (g >= a.groupCount()) {
                return -1;
            }
            if (g >= b.groupCount()) {
                return 1;
            }
            List<CfiStep> p = a.group(g);
            List<CfiStep> q = b.group(g);
            boolean lastGroupA = g == a.groupCount() - 1;
            boolean lastGroupB = g == b.groupCount() - 1;
            int stepCount = Math.max(p.size(), q.size());
            for (int i = 0; i < stepCount; i++) {
                if (i >= p.size()) {
                    return -1;
                }
                if (i >= q.size()) {
                    return 1;
                }
                CfiStep x = p.get(i);
                CfiStep y = q.get(i);
                int byIndex = Integer.compare(x.getIndex(), y.getIndex());
                if (byIndex != 0) {
                    return byIndex;
                }
                boolean terminalX = lastGroupA && i == p.size() - 1;
                boolean terminalY = lastGroupB && i == q.size() - 1;
                if (terminalX && terminalY) {
                    int byTerminal = compareTerminals(x, y);
                    if (byTerminal != 0) {
                        return byTerminal;
                    }
                }
            }
        }
        return 0;
    }

    private static int compareTerminals(CfiStep x, CfiStep y) {
        int byOffset = compareNullable(x.getOffset(), y.getOffset());
        if (byOffset != 0) {
            return byOffset;
        }
        int byTime = compareNullable(x.getTemporalOffset(), y.getTemporalOffset());
        if (byTime != 0) {
            return byTime;
        }
        // Spatial points order top-to-bottom, then left-to-right.
        int byY = compareNullable(x.getSpatialY(), y.getSpatialY());
        if (byY != 0) {
            return byY;
        }
        return compareNullable(x.getSpatialX(), y.getSpatialX());
    }

    private static <T extends Comparable<T>> int compareNullable(T x, T y) {
        if (x == null) {
            return y == null ? 0 : -1;
        }
        if (y == null) {
            return 1;
        }
        return x.compareTo(y);
    }
}
