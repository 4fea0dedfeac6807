package org.pagemark.cfi;

import org.pagemark.core.tree.DocumentTree;
import org.pagemark.core.tree.NodeKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Produces canonical identifiers for concrete tree positions.
 *
 * <p>Generation is the inverse of {@link CfiResolver} under the same {@link CfiPolicy}: a
 * generated string, parsed and resolved, addresses a point equal to the input under
 * {@link CfiComparator}. Instances are immutable and thread-safe.</p>
 */
public final class CfiGenerator {
    private final CfiPolicy policy;

    public CfiGenerator() {
        this(CfiPolicy.defaults());
    }

    public CfiGenerator(CfiPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy").validate();
    }

    /**
     * Returns the bound addressing policy.
     */
    public CfiPolicy policy() {
        return policy;
    }

    /**
     * Generates the canonical string for one point.
     *
     * @param sectionIndex zero-based section that owns {@code tree} (or its outermost host tree).
     * @param tree tree containing {@code node}.
     * @param node addressed node.
     * @param offset character offset for text nodes, child boundary for elements, or null.
     * @throws IllegalArgumentException when the node does not belong to the tree or the offset
     *                                  is out of range.
     */
    public <N> String generate(int sectionIndex, DocumentTree<N> tree, N node, Integer offset) {
        return render(Cfi.point(generatePath(sectionIndex, tree, node, offset)));
    }

    /**
     * Generates the canonical string for one resolved point.
     */
    public <N> String generate(int sectionIndex, NodeOffset<N> point) {
        Objects.requireNonNull(point, "point");
        return generate(sectionIndex, point.tree(), point.node(), point.offset());
    }

    /**
     * Regenerates the canonical string of a resolution result.
     */
    public <N> String generate(ResolvedLocation<N> location) {
        Objects.requireNonNull(location, "location");
        if (location.isRange()) {
            return generateRange(location.getSectionIndex(), location.start(), location.end());
        }
        return generate(location.getSectionIndex(), location.getPoint());
    }

    /**
     * Generates the parsed path for one point.
     */
    public <N> CfiPath generatePath(int sectionIndex, DocumentTree<N> tree, N node, Integer offset) {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(node, "node");
        int sectionStep = CfiPolicy.sectionStepIndex(sectionIndex);
        return new CfiPath(groups(sectionStep, tree, node, offset));
    }

    /**
     * Generates a range whose boundaries both live in one section.
     */
    public <N> String generateRange(
            int sectionIndex,
            DocumentTree<N> tree,
            N startNode,
            Integer startOffset,
            N endNode,
            Integer endOffset
    ) {
        return generateRange(
                sectionIndex,
                new NodeOffset<>(tree, startNode, startOffset),
                new NodeOffset<>(tree, endNode, endOffset)
        );
    }

    /**
     * Generates a range from two points of one section.
     *
     * <p>Boundaries may live in different sub-documents of the section.</p>
     *
     * @throws IllegalArgumentException when {@code start} comes after {@code end}.
     */
    public <N> String generateRange(int sectionIndex, NodeOffset<N> start, NodeOffset<N> end) {
        return render(rangeOf(sectionIndex, start, end));
    }

    /**
     * Builds the parsed range for two points of one section.
     */
    public <N> Cfi rangeOf(int sectionIndex, NodeOffset<N> start, NodeOffset<N> end) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        CfiPath startPath = generatePath(sectionIndex, start.tree(), start.node(), start.offset());
        CfiPath endPath = generatePath(sectionIndex, end.tree(), end.node(), end.offset());
        if (CfiComparator.INSTANCE.comparePaths(startPath, endPath) > 0) {
            throw new IllegalArgumentException("range start " + startPath + " comes after end " + endPath);
        }
        return split(startPath, endPath);
    }

    private String render(Cfi cfi) {
        String text = CfiFormatter.format(cfi);
        return policy.isWrapOutput() ? CfiFormatter.wrap(text) : text;
    }

    private <N> List<List<CfiStep>> groups(int sectionStep, DocumentTree<N> tree, N node, Integer offset) {
        List<CfiStep> local = stepsWithin(tree, node, offset);
        DocumentTree<N> hostTree = tree.hostTree();
        if (hostTree != null) {
            N host = Objects.requireNonNull(tree.host(), "host");
            if (policy.getSectionAddressing() == CfiPolicy.SectionAddressing.SPINE_REFERENCE
                    && hostTree.hostTree() == null
                    && host.equals(hostTree.root())) {
                throw new IllegalArgumentException("a sub-document hosted by the section root has no spine address");
            }
            List<List<CfiStep>> outer = groups(sectionStep, hostTree, host, null);
            // the root of a sub-document is addressed through its host
            if (!local.isEmpty()) {
                outer.add(local);
            }
            return outer;
        }

        List<List<CfiStep>> groups = new ArrayList<>();
        List<CfiStep> first = new ArrayList<>();
        if (policy.getSectionAddressing() == CfiPolicy.SectionAddressing.SPINE_REFERENCE) {
            for (int index : policy.getPackagePrefix()) {
                first.add(CfiStep.of(index));
            }
            first.add(CfiStep.of(sectionStep));
            groups.add(first);
            if (!local.isEmpty()) {
                groups.add(local);
            }
            return groups;
        }
        first.add(CfiStep.of(sectionStep));
        first.addAll(local);
        groups.add(first);
        return groups;
    }

    /**
     * Builds the steps that lead from the tree root to {@code node}, terminal data included.
     */
    private <N> List<CfiStep> stepsWithin(DocumentTree<N> tree, N node, Integer offset) {
        List<CfiStep> reversed = new ArrayList<>();
        NodeKind kind = tree.kind(node);
        if (kind == NodeKind.ELEMENT && offset != null) {
            reversed.add(boundaryStep(tree, node, offset));
        }

        N current = node;
        N parent = tree.parent(current);
        if (kind == NodeKind.TEXT) {
            if (parent == null) {
                throw new IllegalArgumentException("text node has no parent element");
            }
            reversed.add(textStep(tree, parent, current, offset));
            current = parent;
            parent = tree.parent(current);
        }
        while (parent != null) {
            ChildSlots<N> slots = ChildSlots.of(tree, parent);
            int raw = requireChild(slots, current);
            CfiStep.CfiStepBuilder step = CfiStep.builder().index(2 * (slots.elementsBefore(raw) + 1));
            if (policy.isEmitIdAssertions()) {
                step.idAssertion(tree.identifier(current));
            }
            reversed.add(step.build());
            current = parent;
            parent = tree.parent(current);
        }
        if (!current.equals(tree.root())) {
            throw new IllegalArgumentException("node does not belong to the given tree");
        }

        List<CfiStep> steps = new ArrayList<>(reversed.size());
        for (int i = reversed.size() - 1; i >= 0; i--) {
            steps.add(reversed.get(i));
        }
        return steps;
    }

    private static <N> CfiStep textStep(DocumentTree<N> tree, N parent, N text, Integer offset) {
        int length = tree.textLength(text);
        if (offset != null && offset > length) {
            throw new IllegalArgumentException("offset " + offset + " exceeds text length " + length);
        }
        ChildSlots<N> slots = ChildSlots.of(tree, parent);
        int raw = requireChild(slots, text);
        int gap = slots.elementsBefore(raw);
        int before = slots.textBefore(gap, raw);
        int index = 2 * gap + 1;
        if (offset == null && before == 0) {
            return CfiStep.of(index);
        }
        int local = offset == null ? 0 : offset;
        CfiStep.CfiStepBuilder step = CfiStep.builder().index(index).offset(before + local);
        if (local == 0 && before > 0) {
            // same character position as the end of the previous text node; keep this one
            step.sideBias(SideBias.AFTER);
        }
        return step.build();
    }

    private static <N> CfiStep boundaryStep(DocumentTree<N> tree, N element, int boundary) {
        ChildSlots<N> slots = ChildSlots.of(tree, element);
        if (boundary > slots.childCount()) {
            throw new IllegalArgumentException(
                    "boundary " + boundary + " exceeds " + slots.childCount() + " children"
            );
        }
        int gap = slots.elementsBefore(boundary);
        return CfiStep.withOffset(2 * gap + 1, slots.textBefore(gap, boundary));
    }

    private static <N> int requireChild(ChildSlots<N> slots, N child) {
        int raw = slots.rawIndexOf(child);
        if (raw < 0) {
            throw new IllegalArgumentException("node is not a child of its reported parent");
        }
        return raw;
    }

    /**
     * Splits two absolute paths into a shared parent and the two suffixes.
     *
     * <p>The parent is the longest common step prefix that leaves both suffixes non-empty and
     * ends inside a group both suffixes continue.</p>
     */
    private static Cfi split(CfiPath startPath, CfiPath endPath) {
        List<int[]> startSlots = slots(startPath);
        List<int[]> endSlots = slots(endPath);
        int limit = Math.min(startSlots.size(), endSlots.size()) - 1;
        int shared = 0;
        while (shared < limit
                && sameSlot(startSlots.get(shared), endSlots.get(shared))
                && stepAt(startPath, startSlots.get(shared)).equals(stepAt(endPath, endSlots.get(shared)))) {
            shared++;
        }
        while (shared > 0 && (startsGroup(startSlots.get(shared)) || startsGroup(endSlots.get(shared)))) {
            shared--;
        }
        if (shared == 0) {
            throw new IllegalArgumentException("range boundaries share no addressable parent");
        }
        int[] last = startSlots.get(shared - 1);
        return Cfi.range(
                prefix(startPath, last),
                suffix(startPath, startSlots.get(shared)),
                suffix(endPath, endSlots.get(shared))
        );
    }

    // {group, position} for every step in path order
    private static List<int[]> slots(CfiPath path) {
        List<int[]> slots = new ArrayList<>(path.stepCount());
        for (int g = 0; g < path.groupCount(); g++) {
            for (int i = 0; i < path.group(g).size(); i++) {
                slots.add(new int[]{g, i});
            }
        }
        return slots;
    }

    private static boolean sameSlot(int[] a, int[] b) {
        return a[0] == b[0] && a[1] == b[1];
    }

    private static boolean startsGroup(int[] slot) {
        return slot[1] == 0;
    }

    private static CfiStep stepAt(CfiPath path, int[] slot) {
        return path.group(slot[0]).get(slot[1]);
    }

    private static CfiPath prefix(CfiPath path, int[] lastSlot) {
        List<List<CfiStep>> groups = new ArrayList<>(path.groups().subList(0, lastSlot[0]));
        groups.add(path.group(lastSlot[0]).subList(0, lastSlot[1] + 1));
        return new CfiPath(groups);
    }

    private static CfiPath suffix(CfiPath path, int[] firstSlot) {
        List<List<CfiStep>> groups = new ArrayList<>();
        List<CfiStep> firstGroup = path.group(firstSlot[0]);
        groups.add(firstGroup.subList(firstSlot[1], firstGroup.size()));
        groups.addAll(path.groups().subList(firstSlot[0] + 1, path.groupCount()));
        return new CfiPath(groups);
    }
}
