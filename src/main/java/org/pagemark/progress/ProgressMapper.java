package org.pagemark.progress;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;

/**
 * Maps between section-local positions and whole-document reading progress.
 *
 * <p>The mapper owns one {@link CumulativeTable} per open document. {@link #rebuild(List)}
 * publishes a new table atomically; every read captures a single snapshot, so concurrent
 * readers see either the old or the new table. Numeric inputs are clamped and no method throws
 * for out-of-range values.</p>
 */
@Slf4j
public final class ProgressMapper {
    private final ProgressPolicy policy;
    private volatile CumulativeTable table = CumulativeTable.EMPTY;

    public ProgressMapper() {
        this(ProgressPolicy.defaults());
    }

    public ProgressMapper(ProgressPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy").validate();
    }

    /**
     * Creates a mapper already populated with {@code sections}.
     */
    public static ProgressMapper of(List<SectionMeta> sections) {
        ProgressMapper mapper = new ProgressMapper();
        mapper.rebuild(sections);
        return mapper;
    }

    /**
     * Replaces the section table.
     */
    public void rebuild(List<SectionMeta> sections) {
        CumulativeTable next = CumulativeTable.build(sections);
        table = next;
        log.debug("Rebuilt progress table: sections={}, linearTotal={}", next.sectionCount(), next.total());
    }

    /**
     * Discards the section table when the document is closed.
     */
    public void clear() {
        table = CumulativeTable.EMPTY;
    }

    /**
     * Returns the currently published table.
     */
    public CumulativeTable table() {
        return table;
    }

    /**
     * Converts a section-local fraction to a global fraction in {@code [0,1]}.
     *
     * <p>When no linear section has any size the result is {@code sectionIndex / sectionCount}.</p>
     */
    public double toGlobalFraction(int sectionIndex, double localFraction) {
        CumulativeTable snapshot = table;
        int count = snapshot.sectionCount();
        if (count == 0) {
            return 0.0d;
        }
        int index = clampIndex(sectionIndex, count);
        if (snapshot.total() == 0L) {
            return (double) index / count;
        }
        double local = clampFraction(localFraction);
        double position = snapshot.before(index) + local * snapshot.size(index);
        return clampFraction(position / snapshot.total());
    }

    /**
     * Returns the global start fraction of every section, in document order.
     *
     * <p>Zero-size and non-linear sections share the start of the next section.</p>
     */
    public double[] sectionBoundaries() {
        CumulativeTable snapshot = table;
        int count = snapshot.sectionCount();
        double[] boundaries = new double[count];
        long total = snapshot.total();
        for (int i = 0; i < count; i++) {
            boundaries[i] = total == 0L ? (double) i / count : snapshot.startFraction(i);
        }
        return boundaries;
    }

    /**
     * Locates the section containing a global fraction.
     *
     * <p>A fraction exactly on a boundary belongs to the later section. Fractions at or below 0
     * map to the start of the first linear section; fractions at or above 1 map to the end of
     * the last linear section. An empty document yields section 0 at fraction 0.</p>
     */
    public SectionPosition sectionAt(double globalFraction) {
        CumulativeTable snapshot = table;
        int count = snapshot.sectionCount();
        if (count == 0) {
            return new SectionPosition(0, 0.0d);
        }
        double fraction = Double.isNaN(globalFraction) ? 0.0d : globalFraction;
        if (snapshot.total() == 0L) {
            double scaled = clampFraction(fraction) * count;
            int index = Math.min((int) Math.floor(scaled), count - 1);
            return new SectionPosition(index, clampFraction(scaled - index));
        }
        if (fraction <= 0.0d) {
            return new SectionPosition(snapshot.firstLinear(), 0.0d);
        }
        if (fraction >= 1.0d) {
            return new SectionPosition(snapshot.lastLinear(), 1.0d);
        }
        int index = snapshot.sectionContaining(fraction);
        double start = snapshot.startFraction(index);
        double end = index + 1 < count ? snapshot.startFraction(index + 1) : 1.0d;
        double local = end > start ? (fraction - start) / (end - start) : 0.0d;
        return new SectionPosition(index, clampFraction(local));
    }

    /**
     * Builds a reader-facing progress snapshot.
     *
     * @param sectionIndex current section.
     * @param localFraction fraction of the section before the visible page.
     * @param pageFraction fraction of the section covered by the visible page.
     */
    public ReadingProgress progress(int sectionIndex, double localFraction, double pageFraction) {
        CumulativeTable snapshot = table;
        int count = snapshot.sectionCount();
        if (count == 0) {
            return ReadingProgress.builder().build();
        }
        int index = clampIndex(sectionIndex, count);
        double local = clampFraction(localFraction);
        double page = clampFraction(pageFraction);
        long total = snapshot.total();
        long sectionSize = snapshot.size(index);

        double position = snapshot.before(index) + local * sectionSize;
        double next = Math.min(position + page * sectionSize, total);
        double fraction = total == 0L ? (double) index / count : clampFraction(next / total);
        long perLocation = policy.getSizePerLocation();
        double perMinute = policy.getSizePerTimeUnit();

        return ReadingProgress.builder()
                .fraction(fraction)
                .sectionCurrent(index)
                .sectionTotal(count)
                .locationCurrent((long) Math.floor(position / perLocation))
                .locationNext((long) Math.floor(next / perLocation))
                .locationTotal(total / perLocation + (total % perLocation == 0L ? 0L : 1L))
                .minutesLeftInSection((1.0d - local) * sectionSize / perMinute)
                .minutesLeftInBook((total - position) / perMinute)
                .build();
    }

    private static int clampIndex(int sectionIndex, int count) {
        return Math.max(0, Math.min(sectionIndex, count - 1));
    }

    private static double clampFraction(double fraction) {
        if (Double.isNaN(fraction) || fraction <= 0.0d) {
            return 0.0d;
        }
        return Math.min(fraction, 1.0d);
    }
}
