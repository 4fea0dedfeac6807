package org.pagemark.cfi;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.pagemark.core.tree.DocumentTree;
import org.pagemark.core.tree.NodeKind;

import java.util.List;

/**
 * CFI slot view over the children of one element.
 *
 * <p>Element child {@code j} (zero-based) sits at even index {@code 2(j+1)}; gap {@code g} holds
 * the text children between element {@code g-1} and element {@code g} and sits at odd index
 * {@code 2g+1}. There is always one more gap than there are element children.</p>
 */
final class ChildSlots<N> {
    private final DocumentTree<N> tree;
    private final List<N> children;
    // raw child index of each element child, in order
    private final IntArrayList elementChildIndex;

    private ChildSlots(DocumentTree<N> tree, List<N> children, IntArrayList elementChildIndex) {
        this.tree = tree;
        this.children = children;
        this.elementChildIndex = elementChildIndex;
    }

    static <N> ChildSlots<N> of(DocumentTree<N> tree, N node) {
        List<N> children = tree.children(node);
        IntArrayList elements = new IntArrayList(children.size());
        for (int i = 0; i < children.size(); i++) {
            if (tree.kind(children.get(i)) == NodeKind.ELEMENT) {
                elements.add(i);
            }
        }
        return new ChildSlots<>(tree, children, elements);
    }

    int childCount() {
        return children.size();
    }

    int elementCount() {
        return elementChildIndex.size();
    }

    N element(int zeroBased) {
        return children.get(elementChildIndex.getInt(zeroBased));
    }

    /**
     * First raw child index of gap {@code g}.
     */
    int gapStart(int g) {
        return g == 0 ? 0 : elementChildIndex.getInt(g - 1) + 1;
    }

    /**
     * Raw child index one past the end of gap {@code g}.
     */
    int gapEnd(int g) {
        return g < elementChildIndex.size() ? elementChildIndex.getInt(g) : children.size();
    }

    List<N> gapTexts(int g) {
        return children.subList(gapStart(g), gapEnd(g));
    }

    /**
     * Raw child index of {@code child}, or -1 when it is not a child.
     */
    int rawIndexOf(N child) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i).equals(child)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Number of element children before raw child index {@code rawIndex}.
     */
    int elementsBefore(int rawIndex) {
        int count = 0;
        while (count < elementChildIndex.size() && elementChildIndex.getInt(count) < rawIndex) {
            count++;
        }
        return count;
    }

    /**
     * Total text length of the gap children in {@code [gapStart(g), rawIndex)}.
     */
    int textBefore(int g, int rawIndex) {
        int length = 0;
        for (int i = gapStart(g); i < rawIndex; i++) {
            length += tree.textLength(children.get(i));
        }
        return length;
    }
}
