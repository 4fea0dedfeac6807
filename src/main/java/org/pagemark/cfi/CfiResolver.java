package org.pagemark.cfi;

import lombok.extern.slf4j.Slf4j;
import org.pagemark.core.tree.DocumentTree;
import org.pagemark.core.tree.NodeKind;
import org.pagemark.core.tree.SectionTrees;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Walks parsed identifiers against section trees.
 *
 * <p>The resolver is immutable and keeps no per-call state, so one instance can serve any number
 * of threads. Hard addressing failures raise {@link CfiResolutionException}; drift the scheme is
 * expected to tolerate (identifier mismatch, terminal index or offset past the end) is reported
 * as {@link ResolutionWarning} on the result and logged.</p>
 */
@Slf4j
public final class CfiResolver {
    public static final String REASON_INVALID_SECTION_STEP = "CFI_INVALID_SECTION_STEP";
    public static final String REASON_SECTION_OUT_OF_BOUNDS = "CFI_SECTION_OUT_OF_BOUNDS";
    public static final String REASON_SECTION_NOT_LOADED = "CFI_SECTION_NOT_LOADED";
    public static final String REASON_INDEX_OUT_OF_BOUNDS = "CFI_INDEX_OUT_OF_BOUNDS";
    public static final String REASON_TEXT_STEP_NOT_TERMINAL = "CFI_TEXT_STEP_NOT_TERMINAL";
    public static final String REASON_NOT_AN_ELEMENT = "CFI_NOT_AN_ELEMENT";
    public static final String REASON_NO_SUBDOCUMENT = "CFI_NO_SUBDOCUMENT";
    public static final String REASON_RANGE_ORDER = "CFI_RANGE_ORDER";
    public static final String REASON_RANGE_CROSSES_SECTIONS = "CFI_RANGE_CROSSES_SECTIONS";

    public static final String WARNING_ID_ASSERTION_MISMATCH = "CFI_ID_ASSERTION_MISMATCH";
    public static final String WARNING_ID_ASSERTION_REDIRECTED = "CFI_ID_ASSERTION_REDIRECTED";
    public static final String WARNING_INDEX_CLAMPED = "CFI_INDEX_CLAMPED";
    public static final String WARNING_OFFSET_CLAMPED = "CFI_OFFSET_CLAMPED";
    public static final String WARNING_PACKAGE_PREFIX_MISMATCH = "CFI_PACKAGE_PREFIX_MISMATCH";

    private final CfiPolicy policy;

    public CfiResolver() {
        this(CfiPolicy.defaults());
    }

    public CfiResolver(CfiPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy").validate();
    }

    /**
     * Returns the bound addressing policy.
     */
    public CfiPolicy policy() {
        return policy;
    }

    /**
     * Extracts the zero-based section index without touching any tree.
     *
     * <p>Callers use this to load the section before resolving.</p>
     */
    public int sectionIndex(Cfi cfi) {
        return sectionIndex(Objects.requireNonNull(cfi, "cfi").collapse(false));
    }

    /**
     * Extracts the zero-based section index of an absolute path.
     */
    public int sectionIndex(CfiPath path) {
        List<CfiStep> first = Objects.requireNonNull(path, "path").group(0);
        CfiStep sectionStep = switch (policy.getSectionAddressing()) {
            case LEADING_STEP -> first.get(0);
            case SPINE_REFERENCE -> first.get(first.size() - 1);
        };
        return toSectionIndex(sectionStep);
    }

    /**
     * Parses and resolves one CFI string.
     *
     * @throws CfiParseException when the string is malformed.
     * @throws CfiResolutionException when the identifier cannot be walked.
     */
    public <N> ResolvedLocation<N> resolve(String cfi, SectionTrees<N> sections) {
        return resolve(CfiParser.parse(cfi), sections);
    }

    /**
     * Resolves an identifier whose section is the only tree the caller has loaded.
     */
    public <N> ResolvedLocation<N> resolveInSection(Cfi cfi, DocumentTree<N> sectionTree) {
        int section = sectionIndex(cfi);
        return resolve(cfi, SectionTrees.single(section, section + 1, sectionTree));
    }

    /**
     * Resolves a point or range identifier.
     *
     * <p>Ranges walk the shared parent once and continue the start and end suffixes from the
     * node it reaches. The resolved start must not come after the resolved end.</p>
     *
     * @throws CfiResolutionException when the identifier cannot be walked.
     */
    public <N> ResolvedLocation<N> resolve(Cfi cfi, SectionTrees<N> sections) {
        Objects.requireNonNull(cfi, "cfi");
        Objects.requireNonNull(sections, "sections");
        List<ResolutionWarning> warnings = new ArrayList<>();

        if (!cfi.isRange()) {
            List<PathItem> items = items(cfi.getPath());
            Landing<N> landing = finish(Cursor.initial(), items, 0, sections, warnings);
            return ResolvedLocation.point(landing.sectionIndex(), landing.point(), warnings);
        }

        CfiPath startPath = cfi.collapse(false);
        CfiPath endPath = cfi.collapse(true);
        List<PathItem> startItems = items(startPath);
        List<PathItem> endItems = items(endPath);
        int shared = cfi.getParent().stepCount();

        Cursor<N> base = Cursor.initial();
        for (int i = 0; i < shared; i++) {
            base = descend(base, startItems.get(i), sections, warnings);
        }
        Landing<N> start = finish(base, startItems, shared, sections, warnings);
        Landing<N> end = finish(base, endItems, shared, sections, warnings);

        if (start.sectionIndex() != end.sectionIndex()) {
            throw new CfiResolutionException(
                    REASON_RANGE_CROSSES_SECTIONS,
                    "range start is in section " + start.sectionIndex() + " but end is in section " + end.sectionIndex()
            );
        }
        if (CfiComparator.INSTANCE.comparePaths(startPath, endPath) > 0) {
            throw new CfiResolutionException(
                    REASON_RANGE_ORDER,
                    "range start " + startPath + " comes after end " + endPath
            );
        }
        return ResolvedLocation.range(start.sectionIndex(), new NodeRange<>(start.point(), end.point()), warnings);
    }

    private <N> Landing<N> finish(
            Cursor<N> cursor,
            List<PathItem> items,
            int from,
            SectionTrees<N> sections,
            List<ResolutionWarning> warnings
    ) {
        Cursor<N> current = cursor;
        for (int i = from; i < items.size() - 1; i++) {
            current = descend(current, items.get(i), sections, warnings);
        }
        return land(current, items.get(items.size() - 1), sections, warnings);
    }

    /**
     * Consumes one non-terminal step.
     */
    private <N> Cursor<N> descend(
            Cursor<N> cursor,
            PathItem item,
            SectionTrees<N> sections,
            List<ResolutionWarning> warnings
    ) {
        if (cursor.sectionIndex() < 0) {
            return sectionStep(cursor, item, sections, warnings);
        }
        Cursor<N> current = crossBoundary(cursor, item);
        CfiStep step = item.step();
        N node = requireElement(current);
        if (step.isTextStep()) {
            throw new CfiResolutionException(
                    REASON_TEXT_STEP_NOT_TERMINAL,
                    "odd index " + step.getIndex() + " addresses text and must be the last step"
            );
        }
        ChildSlots<N> slots = ChildSlots.of(current.tree(), node);
        int position = step.getIndex() / 2 - 1;
        if (position < 0 || position >= slots.elementCount()) {
            throw new CfiResolutionException(
                    REASON_INDEX_OUT_OF_BOUNDS,
                    "index " + step.getIndex() + " exceeds " + slots.elementCount() + " element children"
            );
        }
        N child = checkIdentifier(current.tree(), slots.element(position), step, warnings);
        return current.at(child);
    }

    /**
     * Consumes the terminal step and produces the addressed point.
     */
    private <N> Landing<N> land(
            Cursor<N> cursor,
            PathItem item,
            SectionTrees<N> sections,
            List<ResolutionWarning> warnings
    ) {
        if (cursor.sectionIndex() < 0) {
            Cursor<N> section = sectionStep(cursor, item, sections, warnings);
            return new Landing<>(section.sectionIndex(), NodeOffset.of(section.tree(), section.node()));
        }
        Cursor<N> current = crossBoundary(cursor, item);
        CfiStep step = item.step();
        DocumentTree<N> tree = current.tree();
        N node = requireElement(current);
        ChildSlots<N> slots = ChildSlots.of(tree, node);

        if (step.isElementStep()) {
            int position = step.getIndex() / 2 - 1;
            if (position < 0 || position >= slots.elementCount()) {
                warn(warnings, WARNING_INDEX_CLAMPED,
                        "index " + step.getIndex() + " is outside " + slots.elementCount()
                                + " element children; using the nearest boundary");
                int boundary = position < 0 ? 0 : slots.childCount();
                return new Landing<>(current.sectionIndex(), new NodeOffset<>(tree, node, boundary));
            }
            N child = checkIdentifier(tree, slots.element(position), step, warnings);
            if (step.getOffset() != null) {
                return new Landing<>(current.sectionIndex(), offsetInElement(tree, child, step, warnings));
            }
            return new Landing<>(current.sectionIndex(), NodeOffset.of(tree, child));
        }

        int gap = (step.getIndex() - 1) / 2;
        if (gap > slots.elementCount()) {
            warn(warnings, WARNING_INDEX_CLAMPED,
                    "index " + step.getIndex() + " is past the last gap; using the end boundary");
            gap = slots.elementCount();
        }
        List<N> texts = slots.gapTexts(gap);
        if (texts.isEmpty()) {
            if (step.getOffset() != null && step.getOffset() > 0) {
                warn(warnings, WARNING_OFFSET_CLAMPED,
                        "offset " + step.getOffset() + " addresses an empty gap; using the gap boundary");
            }
            return new Landing<>(current.sectionIndex(), new NodeOffset<>(tree, node, slots.gapStart(gap)));
        }
        if (step.getOffset() == null) {
            return new Landing<>(current.sectionIndex(), NodeOffset.of(tree, texts.get(0)));
        }
        return new Landing<>(current.sectionIndex(), walkText(tree, texts, step, warnings));
    }

    private <N> Cursor<N> sectionStep(
            Cursor<N> cursor,
            PathItem item,
            SectionTrees<N> sections,
            List<ResolutionWarning> warnings
    ) {
        if (policy.getSectionAddressing() == CfiPolicy.SectionAddressing.SPINE_REFERENCE) {
            List<Integer> prefix = policy.getPackagePrefix();
            if (!item.lastInGroup()) {
                int position = item.position();
                if (position >= prefix.size() || prefix.get(position) != item.step().getIndex()) {
                    warn(warnings, WARNING_PACKAGE_PREFIX_MISMATCH,
                            "package step " + item.step().getIndex() + " does not match prefix " + prefix);
                }
                return cursor;
            }
            if (item.position() != prefix.size()) {
                warn(warnings, WARNING_PACKAGE_PREFIX_MISMATCH,
                        "section reference preceded by " + item.position() + " package steps, expected " + prefix.size());
            }
        }
        int sectionIndex = toSectionIndex(item.step());
        DocumentTree<N> tree = loadSection(sections, sectionIndex);
        // a leading section step that closes its group leaves the next '!' to enter the section root
        boolean entered = policy.getSectionAddressing() == CfiPolicy.SectionAddressing.LEADING_STEP
                && !item.lastInGroup();
        return new Cursor<>(sectionIndex, tree, tree.root(), entered);
    }

    /**
     * Applies the indirection preceding the first step of a group.
     */
    private static <N> Cursor<N> crossBoundary(Cursor<N> cursor, PathItem item) {
        if (item.position() != 0 || item.group() == 0) {
            return cursor;
        }
        if (!cursor.entered()) {
            return new Cursor<>(cursor.sectionIndex(), cursor.tree(), cursor.tree().root(), true);
        }
        DocumentTree<N> subtree = cursor.tree().subtree(cursor.node());
        if (subtree == null) {
            throw new CfiResolutionException(
                    REASON_NO_SUBDOCUMENT,
                    "indirection into a node without an embedded document"
            );
        }
        return new Cursor<>(cursor.sectionIndex(), subtree, subtree.root(), true);
    }

    private static <N> N requireElement(Cursor<N> cursor) {
        N node = cursor.node();
        if (cursor.tree().kind(node) != NodeKind.ELEMENT) {
            throw new CfiResolutionException(REASON_NOT_AN_ELEMENT, "cannot step into a text node");
        }
        return node;
    }

    private <N> N checkIdentifier(DocumentTree<N> tree, N positional, CfiStep step, List<ResolutionWarning> warnings) {
        String expected = step.getIdAssertion();
        if (expected == null) {
            return positional;
        }
        String actual = tree.identifier(positional);
        if (expected.equals(actual)) {
            return positional;
        }
        if (policy.getIdAssertionMode() == CfiPolicy.IdAssertionMode.PREFER_IDENTIFIER) {
            N match = findByIdentifier(tree, expected);
            if (match != null) {
                warn(warnings, WARNING_ID_ASSERTION_REDIRECTED,
                        "identifier '" + expected + "' found away from index " + step.getIndex() + "; using it");
                return match;
            }
        }
        warn(warnings, WARNING_ID_ASSERTION_MISMATCH,
                "index " + step.getIndex() + " expected identifier '" + expected + "' but found '" + actual + "'");
        return positional;
    }

    private static <N> N findByIdentifier(DocumentTree<N> tree, String identifier) {
        Deque<N> pending = new ArrayDeque<>();
        pending.push(tree.root());
        while (!pending.isEmpty()) {
            N node = pending.pop();
            if (tree.kind(node) != NodeKind.ELEMENT) {
                continue;
            }
            if (identifier.equals(tree.identifier(node))) {
                return node;
            }
            List<N> children = tree.children(node);
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
        return null;
    }

    /**
     * Places a character offset into a run of sibling text nodes.
     */
    private static <N> NodeOffset<N> walkText(
            DocumentTree<N> tree,
            List<N> texts,
            CfiStep step,
            List<ResolutionWarning> warnings
    ) {
        int remaining = step.getOffset();
        boolean after = step.getSideBias() == SideBias.AFTER;
        for (int i = 0; i < texts.size(); i++) {
            N text = texts.get(i);
            int length = tree.textLength(text);
            if (remaining < length) {
                return new NodeOffset<>(tree, text, remaining);
            }
            if (remaining == length) {
                if (after && i + 1 < texts.size()) {
                    remaining = 0;
                    continue;
                }
                return new NodeOffset<>(tree, text, remaining);
            }
            remaining -= length;
        }
        N last = texts.get(texts.size() - 1);
        warn(warnings, WARNING_OFFSET_CLAMPED,
                "offset " + step.getOffset() + " is past the end of the text; using the end");
        return new NodeOffset<>(tree, last, tree.textLength(last));
    }

    /**
     * Places a character offset into the descendant text of an element.
     */
    private static <N> NodeOffset<N> offsetInElement(
            DocumentTree<N> tree,
            N element,
            CfiStep step,
            List<ResolutionWarning> warnings
    ) {
        List<N> texts = new ArrayList<>();
        collectText(tree, element, texts);
        if (texts.isEmpty()) {
            if (step.getOffset() > 0) {
                warn(warnings, WARNING_OFFSET_CLAMPED,
                        "offset " + step.getOffset() + " addresses an element without text");
            }
            return new NodeOffset<>(tree, element, 0);
        }
        return walkText(tree, texts, step, warnings);
    }

    private static <N> void collectText(DocumentTree<N> tree, N node, List<N> out) {
        for (N child : tree.children(node)) {
            if (tree.kind(child) == NodeKind.TEXT) {
                out.add(child);
            } else {
                collectText(tree, child, out);
            }
        }
    }

    private static <N> DocumentTree<N> loadSection(SectionTrees<N> sections, int sectionIndex) {
        if (sectionIndex >= sections.sectionCount()) {
            throw new CfiResolutionException(
                    REASON_SECTION_OUT_OF_BOUNDS,
                    "section " + sectionIndex + " does not exist in a document of " + sections.sectionCount() + " sections"
            );
        }
        DocumentTree<N> tree = sections.tree(sectionIndex);
        if (tree == null) {
            throw new CfiResolutionException(REASON_SECTION_NOT_LOADED, "section " + sectionIndex + " is not loaded");
        }
        return tree;
    }

    private static int toSectionIndex(CfiStep step) {
        int index = step.getIndex();
        if (index < 2 || (index & 1) == 1) {
            throw new CfiResolutionException(
                    REASON_INVALID_SECTION_STEP,
                    "section step must be an even index >= 2 but was " + index
            );
        }
        return index / 2 - 1;
    }

    private static void warn(List<ResolutionWarning> warnings, String reasonCode, String message) {
        log.warn("[{}] {}", reasonCode, message);
        warnings.add(new ResolutionWarning(reasonCode, message));
    }

    private static List<PathItem> items(CfiPath path) {
        List<PathItem> items = new ArrayList<>(path.stepCount());
        for (int g = 0; g < path.groupCount(); g++) {
            List<CfiStep> group = path.group(g);
            for (int i = 0; i < group.size(); i++) {
                items.add(new PathItem(group.get(i), g, i, i == group.size() - 1));
            }
        }
        return items;
    }

    /**
     * One step with its position in the group structure.
     */
    private record PathItem(CfiStep step, int group, int position, boolean lastInGroup) {
    }

    /**
     * Immutable walk state. {@code sectionIndex < 0} until the section step is consumed;
     * {@code entered} is false while a spine reference still awaits its indirection.
     */
    private record Cursor<N>(int sectionIndex, DocumentTree<N> tree, N node, boolean entered) {
        static <N> Cursor<N> initial() {
            return new Cursor<>(-1, null, null, false);
        }

        Cursor<N> at(N next) {
            return new Cursor<>(sectionIndex, tree, next, entered);
        }
    }

    private record Landing<N>(int sectionIndex, NodeOffset<N> point) {
    }
}
