package org.pagemark.cfi;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.pagemark.core.tree.SectionTrees;
import org.pagemark.testutil.MemoryTree;
import org.pagemark.testutil.TestNode;
import org.pagemark.testutil.TestTrees;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.pagemark.testutil.TestNode.element;
import static org.pagemark.testutil.TestNode.text;

@DisplayName("CfiResolver Tests")
class CfiResolverTest {
    private final TestTrees.Book book = TestTrees.book();
    private final CfiResolver resolver = new CfiResolver();

    @Test
    @DisplayName("Leading section step, indirection into the body sub-document")
    void testResolvesThroughSubdocument() {
        ResolvedLocation<TestNode> location = resolver.resolve("/6/4!/4", book.sections());

        assertEquals(2, location.getSectionIndex());
        assertFalse(location.isRange());
        assertSame(book.target(), location.getPoint().node());
        assertSame(book.sub(), location.getPoint().tree());
        assertNull(location.getPoint().offset());
        assertFalse(location.hasWarnings());
    }

    @Test
    @DisplayName("Section step written as its own first group enters the section root")
    void testSectionAsOwnGroup() {
        NodeOffset<TestNode> body = resolver.resolve("/4!/4", book.sections()).getPoint();
        assertSame(book.trees().get(1).root().child(1), body.node());

        ResolvedLocation<TestNode> target = resolver.resolve("/6!/4!/4", book.sections());
        assertEquals(2, target.getSectionIndex());
        assertSame(book.target(), target.getPoint().node());
        assertSame(book.sub(), target.getPoint().tree());
        assertFalse(target.hasWarnings());

        NodeOffset<TestNode> hello = resolver.resolve("/6!/4!/4/1:3", book.sections()).getPoint();
        assertSame(book.hello(), hello.node());
        assertEquals(3, hello.offset());
        assertEquals(1, resolver.sectionIndex(CfiParser.parse("/4!/4")));
    }

    @Test
    @DisplayName("Odd terminal step addresses text between element children")
    void testTextGap() {
        NodeOffset<TestNode> between = resolver.resolve("/6/4!/3:2", book.sections()).getPoint();
        assertSame(book.between(), between.node());
        assertEquals(2, between.offset());
        assertTrue(between.isText());

        NodeOffset<TestNode> world = resolver.resolve("/6/4[b]!/4[target]/3:3", book.sections()).getPoint();
        assertSame(book.world(), world.node());
        assertEquals(3, world.offset());

        NodeOffset<TestNode> bare = resolver.resolve("/6/4!/1", book.sections()).getPoint();
        assertSame(book.intro(), bare.node());
        assertNull(bare.offset());
    }

    @Test
    @DisplayName("Offset on an element walks its descendant text")
    void testElementOffset() {
        NodeOffset<TestNode> point = resolver.resolve("/6/4!/4:8", book.sections()).getPoint();

        assertSame(book.em().child(0), point.node());
        assertEquals(2, point.offset());
    }

    @Test
    @DisplayName("Side bias chooses between adjacent text nodes at a shared boundary")
    void testSideBias() {
        MemoryTree flat = TestTrees.flat();
        SectionTrees<TestNode> sections = SectionTrees.of(List.of(flat));
        TestNode body = flat.root().child(0);

        NodeOffset<TestNode> before = resolver.resolve("/2/2/3:3", sections).getPoint();
        assertSame(body.child(2), before.node());
        assertEquals(3, before.offset());

        NodeOffset<TestNode> after = resolver.resolve("/2/2/3:3[;s=a]", sections).getPoint();
        assertSame(body.child(3), after.node());
        assertEquals(0, after.offset());

        NodeOffset<TestNode> inSecond = resolver.resolve("/2/2/3:5", sections).getPoint();
        assertSame(body.child(3), inSecond.node());
        assertEquals(2, inSecond.offset());
    }

    @Test
    @DisplayName("Offset past the end of the text clamps with a warning")
    void testOffsetClamped() {
        MemoryTree flat = TestTrees.flat();
        ResolvedLocation<TestNode> location = resolver.resolve("/2/2/3:99", SectionTrees.of(List.of(flat)));

        assertSame(flat.root().child(0).child(3), location.getPoint().node());
        assertEquals(4, location.getPoint().offset());
        assertEquals(List.of(CfiResolver.WARNING_OFFSET_CLAMPED), reasonCodes(location));
    }

    @Test
    @DisplayName("Empty text gap resolves to a child boundary")
    void testEmptyGap() {
        MemoryTree section2 = book.trees().get(2);

        NodeOffset<TestNode> start = resolver.resolve("/6/1", book.sections()).getPoint();
        assertSame(section2.root(), start.node());
        assertEquals(0, start.offset());
        assertTrue(start.isChildBoundary());

        ResolvedLocation<TestNode> clamped = resolver.resolve("/6/3:4", book.sections());
        assertEquals(1, clamped.getPoint().offset());
        assertEquals(List.of(CfiResolver.WARNING_OFFSET_CLAMPED), reasonCodes(clamped));
    }

    @Test
    @DisplayName("Terminal element index past the end clamps to the end boundary")
    void testTerminalIndexClamped() {
        ResolvedLocation<TestNode> location = resolver.resolve("/6/4!/10", book.sections());

        assertSame(book.subRoot(), location.getPoint().node());
        assertEquals(5, location.getPoint().offset());
        assertEquals(List.of(CfiResolver.WARNING_INDEX_CLAMPED), reasonCodes(location));
    }

    @Test
    @DisplayName("Addressing failures raise reason-coded exceptions")
    void testResolutionErrors() {
        assertResolutionError(CfiResolver.REASON_INDEX_OUT_OF_BOUNDS, "/6/4!/10/2");
        assertResolutionError(CfiResolver.REASON_TEXT_STEP_NOT_TERMINAL, "/6/4!/3/2");
        assertResolutionError(CfiResolver.REASON_SECTION_OUT_OF_BOUNDS, "/8/2");
        assertResolutionError(CfiResolver.REASON_INVALID_SECTION_STEP, "/3/2");
        assertResolutionError(CfiResolver.REASON_INVALID_SECTION_STEP, "/0");
        assertResolutionError(CfiResolver.REASON_NO_SUBDOCUMENT, "/6/2!/2");
        assertResolutionError(CfiResolver.REASON_RANGE_ORDER, "/6/4!/4,/3:3,/1:2");
    }

    @Test
    @DisplayName("Section that the host has not loaded")
    void testSectionNotLoaded() {
        SectionTrees<TestNode> partial = SectionTrees.of(Arrays.asList(book.trees().get(0), null, book.trees().get(2)));

        CfiResolutionException ex = assertThrows(CfiResolutionException.class, () -> resolver.resolve("/4/2", partial));
        assertEquals(CfiResolver.REASON_SECTION_NOT_LOADED, ex.reasonCode());
        assertEquals(2, resolver.resolve("/6/4!/4", partial).getSectionIndex());
    }

    @Test
    @DisplayName("Identifier mismatch keeps the positional node by default")
    void testIdentifierMismatchPositional() {
        ResolvedLocation<TestNode> location = resolver.resolve("/6/4!/4[first]", book.sections());

        assertSame(book.target(), location.getPoint().node());
        assertEquals(List.of(CfiResolver.WARNING_ID_ASSERTION_MISMATCH), reasonCodes(location));
    }

    @Test
    @DisplayName("Identifier mismatch follows the identifier when preferred")
    void testIdentifierMismatchPreferIdentifier() {
        CfiResolver preferring = new CfiResolver(CfiPolicy.builder()
                .idAssertionMode(CfiPolicy.IdAssertionMode.PREFER_IDENTIFIER)
                .build());

        ResolvedLocation<TestNode> redirected = preferring.resolve("/6/4!/4[first]", book.sections());
        assertSame(book.first(), redirected.getPoint().node());
        assertEquals(List.of(CfiResolver.WARNING_ID_ASSERTION_REDIRECTED), reasonCodes(redirected));

        ResolvedLocation<TestNode> missing = preferring.resolve("/6/4!/4[nope]", book.sections());
        assertSame(book.target(), missing.getPoint().node());
        assertEquals(List.of(CfiResolver.WARNING_ID_ASSERTION_MISMATCH), reasonCodes(missing));
    }

    @Test
    @DisplayName("Range resolves the shared parent once and both suffixes from it")
    void testRange() {
        ResolvedLocation<TestNode> location = resolver.resolve("/6/4!/4,/1:2,/3:3", book.sections());

        assertTrue(location.isRange());
        assertEquals(2, location.getSectionIndex());
        assertSame(book.hello(), location.start().node());
        assertEquals(2, location.start().offset());
        assertSame(book.world(), location.end().node());
        assertEquals(3, location.end().offset());
        assertFalse(location.getRange().isCollapsed());
    }

    @Test
    @DisplayName("Range over sibling elements inside a sub-document keeps start before end")
    void testRangeOverSiblings() {
        TestNode first = element("li", text("a"));
        TestNode second = element("li", text("b"));
        TestNode host = element("body");
        MemoryTree section = new MemoryTree(element("html", element("head"), host));
        MemoryTree sub = section.embed(host, element("div", element("ul", first, second)));
        SectionTrees<TestNode> sections = SectionTrees.of(List.of(book.trees().get(0), book.trees().get(1), section));

        ResolvedLocation<TestNode> location = resolver.resolve("/6/4!/2,/2,/4", sections);

        assertTrue(location.isRange());
        assertEquals(2, location.getSectionIndex());
        assertSame(first, location.start().node());
        assertSame(second, location.end().node());
        assertSame(sub, location.start().tree());

        CfiGenerator generator = new CfiGenerator();
        String start = generator.generate(2, location.start());
        String end = generator.generate(2, location.end());
        assertEquals("/6/4!/2/2", start);
        assertEquals("/6/4!/2/4", end);
        assertTrue(CfiComparator.INSTANCE.compare(start, end) < 0);

        CfiResolutionException ex = assertThrows(CfiResolutionException.class,
                () -> resolver.resolve("/6/4!/2,/4,/2", sections));
        assertEquals(CfiResolver.REASON_RANGE_ORDER, ex.reasonCode());
    }

    @Test
    @DisplayName("Spine reference addressing")
    void testSpineReference() {
        CfiResolver epub = new CfiResolver(CfiPolicy.epub());

        assertEquals(2, epub.sectionIndex(CfiParser.parse("epubcfi(/6/6!/4!/4)")));
        ResolvedLocation<TestNode> location = epub.resolve("epubcfi(/6/6!/4!/4/1:3)", book.sections());
        assertEquals(2, location.getSectionIndex());
        assertSame(book.hello(), location.getPoint().node());
        assertEquals(3, location.getPoint().offset());
        assertFalse(location.hasWarnings());

        ResolvedLocation<TestNode> root = epub.resolve("/6/2", book.sections());
        assertEquals(0, root.getSectionIndex());
        assertSame(book.trees().get(0).root(), root.getPoint().node());

        ResolvedLocation<TestNode> mismatch = epub.resolve("/8/6!/4!/4", book.sections());
        assertSame(book.target(), mismatch.getPoint().node());
        assertEquals(List.of(CfiResolver.WARNING_PACKAGE_PREFIX_MISMATCH), reasonCodes(mismatch));

        CfiResolutionException ex = assertThrows(CfiResolutionException.class,
                () -> epub.resolve("/6,/2!/2,/4!/2", book.sections()));
        assertEquals(CfiResolver.REASON_RANGE_CROSSES_SECTIONS, ex.reasonCode());
    }

    @Test
    @DisplayName("Section index is read without touching any tree")
    void testSectionIndex() {
        assertEquals(2, resolver.sectionIndex(CfiParser.parse("/6/4!/4")));
        assertEquals(0, resolver.sectionIndex(CfiParser.parse("/2,/2,/4")));
        assertEquals(1, resolver.sectionIndex(CfiParser.parsePath("/4/2/1:5")));
    }

    @Test
    @DisplayName("resolveInSection works with only the addressed section loaded")
    void testResolveInSection() {
        Cfi cfi = CfiParser.parse("/6/4!/4/1:1");

        ResolvedLocation<TestNode> location = resolver.resolveInSection(cfi, book.trees().get(2));

        assertEquals(2, location.getSectionIndex());
        assertSame(book.hello(), location.getPoint().node());
    }

    @Test
    @DisplayName("Malformed strings surface the parse failure")
    void testParseFailurePropagates() {
        assertThrows(CfiParseException.class, () -> resolver.resolve("/6/4!/", book.sections()));
    }

    private void assertResolutionError(String reasonCode, String cfi) {
        CfiResolutionException ex = assertThrows(CfiResolutionException.class, () -> resolver.resolve(cfi, book.sections()));
        assertEquals(reasonCode, ex.reasonCode(), ex.getMessage());
    }

    private static List<String> reasonCodes(ResolvedLocation<?> location) {
        return location.getWarnings().stream().map(ResolutionWarning::reasonCode).toList();
    }
}
