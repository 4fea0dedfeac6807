package org.pagemark.progress;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("ProgressMapper Tests")
class ProgressMapperTest {
    private static final double EPS = 1e-9d;

    private final ProgressMapper mapper = ProgressMapper.of(List.of(
            SectionMeta.linear("a", 100L),
            SectionMeta.linear("b", 300L),
            SectionMeta.linear("c", 100L)
    ));

    @ParameterizedTest
    @CsvSource({
            "0, 0.0, 0.0",
            "0, 1.0, 0.2",
            "1, 0.0, 0.2",
            "1, 0.5, 0.5",
            "2, 0.0, 0.8",
            "2, 1.0, 1.0",
            "5, 1.0, 1.0",
            "-3, 0.5, 0.1",
            "1, 7.0, 0.8",
            "1, -1.0, 0.2"
    })
    @DisplayName("Local fraction maps through cumulative sizes")
    void testToGlobalFraction(int section, double local, double expected) {
        assertEquals(expected, mapper.toGlobalFraction(section, local), EPS);
    }

    @Test
    @DisplayName("Global fraction is monotone in document order")
    void testMonotone() {
        double previous = -1.0d;
        for (int section = 0; section < 3; section++) {
            for (int step = 0; step <= 10; step++) {
                double fraction = mapper.toGlobalFraction(section, step / 10.0d);
                assertTrue(fraction >= previous, "section " + section + " step " + step);
                assertTrue(fraction >= 0.0d && fraction <= 1.0d);
                previous = fraction;
            }
        }
    }

    @Test
    @DisplayName("Boundaries mark where each section begins")
    void testBoundaries() {
        assertArrayEquals(new double[]{0.0d, 0.2d, 0.8d}, mapper.sectionBoundaries(), EPS);
    }

    @Test
    @DisplayName("Non-linear sections contribute no size")
    void testNonLinearSections() {
        mapper.rebuild(List.of(
                SectionMeta.linear("a", 100L),
                SectionMeta.nonLinear("notes", 5_000L),
                SectionMeta.linear("c", 100L)
        ));

        assertEquals(200L, mapper.table().total());
        assertEquals(0.5d, mapper.toGlobalFraction(1, 0.7d), EPS);
        assertEquals(0.75d, mapper.toGlobalFraction(2, 0.5d), EPS);
        assertArrayEquals(new double[]{0.0d, 0.5d, 0.5d}, mapper.sectionBoundaries(), EPS);
        assertEquals(2, mapper.sectionAt(0.5d).sectionIndex());
    }

    @Test
    @DisplayName("Section lookup resolves exact boundaries to the later section")
    void testSectionAt() {
        assertPosition(0, 0.5d, mapper.sectionAt(0.1d));
        assertPosition(1, 0.0d, mapper.sectionAt(0.2d));
        assertPosition(1, 0.5d, mapper.sectionAt(0.5d));
        assertPosition(2, 0.0d, mapper.sectionAt(0.8d));
        assertPosition(0, 0.0d, mapper.sectionAt(-0.3d));
        assertPosition(2, 1.0d, mapper.sectionAt(1.0d));
        assertPosition(2, 1.0d, mapper.sectionAt(4.0d));
        assertPosition(0, 0.0d, mapper.sectionAt(Double.NaN));
    }

    @Test
    @DisplayName("Section lookup skips zero-size sections and leading non-linear sections")
    void testSectionAtSkipsEmptySections() {
        mapper.rebuild(List.of(
                SectionMeta.nonLinear("cover", 40L),
                SectionMeta.linear("a", 100L),
                SectionMeta.linear("empty", 0L),
                SectionMeta.linear("b", 100L),
                SectionMeta.nonLinear("back", 10L)
        ));

        assertPosition(1, 0.0d, mapper.sectionAt(0.0d));
        assertPosition(3, 0.0d, mapper.sectionAt(0.5d));
        assertPosition(3, 1.0d, mapper.sectionAt(1.0d));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "1 48",
            "3 7 11 13",
            "1 2 3 5 8 13 21 34 55 89",
            "997 1 1009 3 1013"
    })
    @DisplayName("Every reported boundary resolves to the start of its own section")
    void testBoundariesRoundTrip(String sizes) {
        List<SectionMeta> sections = new ArrayList<>();
        for (String size : sizes.split(" ")) {
            sections.add(SectionMeta.linear("s" + sections.size(), Long.parseLong(size)));
        }
        mapper.rebuild(sections);

        double[] boundaries = mapper.sectionBoundaries();
        for (int i = 1; i < boundaries.length; i++) {
            assertPosition(i, 0.0d, mapper.sectionAt(boundaries[i]));
            assertEquals(i, mapper.sectionAt(mapper.toGlobalFraction(i, 0.0d)).sectionIndex());
        }
    }

    @Test
    @DisplayName("Totals past the long range saturate instead of failing")
    void testSaturatedTotal() {
        mapper.rebuild(List.of(
                SectionMeta.linear("huge", Long.MAX_VALUE),
                SectionMeta.linear("tail", 10L)
        ));

        assertEquals(Long.MAX_VALUE, mapper.table().total());
        double fraction = mapper.toGlobalFraction(1, 0.5d);
        assertTrue(fraction >= 0.0d && fraction <= 1.0d);
        assertEquals(0, mapper.sectionAt(0.5d).sectionIndex());
        assertEquals(Long.MAX_VALUE / 1_500L + 1L, mapper.progress(0, 0.5d, 0.1d).getLocationTotal());
    }

    @Test
    @DisplayName("Zero total falls back to section count")
    void testZeroTotal() {
        mapper.rebuild(List.of(
                SectionMeta.linear("a", 0L),
                SectionMeta.nonLinear("b", 50L),
                SectionMeta.linear("c", 0L),
                SectionMeta.linear("d", 0L)
        ));

        assertEquals(0.0d, mapper.toGlobalFraction(0, 0.9d), EPS);
        assertEquals(0.5d, mapper.toGlobalFraction(2, 0.3d), EPS);
        assertArrayEquals(new double[]{0.0d, 0.25d, 0.5d, 0.75d}, mapper.sectionBoundaries(), EPS);
        assertPosition(2, 0.2d, mapper.sectionAt(0.55d));
    }

    @Test
    @DisplayName("Empty and cleared documents never throw")
    void testEmpty() {
        mapper.clear();

        assertEquals(0, mapper.table().sectionCount());
        assertEquals(0.0d, mapper.toGlobalFraction(3, 0.5d), EPS);
        assertEquals(0, mapper.sectionBoundaries().length);
        assertPosition(0, 0.0d, mapper.sectionAt(0.4d));
        assertEquals(0.0d, mapper.progress(0, 0.5d, 0.1d).getFraction(), EPS);
    }

    @Test
    @DisplayName("Reading progress derives locations and remaining time")
    void testReadingProgress() {
        ProgressMapper sized = new ProgressMapper(ProgressPolicy.builder().sizePerLocation(100L).sizePerTimeUnit(50L).build());
        sized.rebuild(List.of(
                SectionMeta.linear("a", 1_000L),
                SectionMeta.linear("b", 3_000L),
                SectionMeta.linear("c", 1_000L)
        ));

        ReadingProgress progress = sized.progress(1, 0.5d, 0.1d);

        assertEquals(2_800.0d / 5_000.0d, progress.getFraction(), EPS);
        assertEquals(1, progress.getSectionCurrent());
        assertEquals(3, progress.getSectionTotal());
        assertEquals(25L, progress.getLocationCurrent());
        assertEquals(28L, progress.getLocationNext());
        assertEquals(50L, progress.getLocationTotal());
        assertEquals(30.0d, progress.getMinutesLeftInSection(), EPS);
        assertEquals(50.0d, progress.getMinutesLeftInBook(), EPS);
    }

    @Test
    @DisplayName("Default progress policy and validation")
    void testProgressPolicy() {
        ProgressPolicy defaults = ProgressPolicy.defaults();
        assertEquals(1_500L, defaults.getSizePerLocation());
        assertEquals(1_600L, defaults.getSizePerTimeUnit());

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> new ProgressMapper(ProgressPolicy.builder().sizePerLocation(0L).build()));
        assertTrue(ex.getMessage().startsWith(ProgressPolicy.REASON_INVALID_PROGRESS_POLICY));
        assertThrows(IllegalArgumentException.class, () -> SectionMeta.linear("x", -1L));
    }

    private static void assertPosition(int section, double fraction, SectionPosition position) {
        assertEquals(section, position.sectionIndex());
        assertEquals(fraction, position.fractionInSection(), EPS);
    }
}
