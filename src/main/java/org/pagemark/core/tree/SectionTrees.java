package org.pagemark.core.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Section-indexed access to the trees of one open document.
 *
 * @param <N> host node type.
 */
public interface SectionTrees<N> {

    /**
     * Returns number of sections in document order.
     */
    int sectionCount();

    /**
     * Returns the loaded tree for one section, or {@code null} when the host has not loaded it.
     *
     * @param sectionIndex zero-based section index in {@code [0, sectionCount())}.
     */
    DocumentTree<N> tree(int sectionIndex);

    /**
     * Creates an immutable view over already-loaded trees.
     *
     * <p>List entries may be {@code null} for sections that are not loaded.</p>
     */
    static <N> SectionTrees<N> of(List<? extends DocumentTree<N>> trees) {
        Objects.requireNonNull(trees, "trees");
        List<DocumentTree<N>> snapshot = Collections.unmodifiableList(new ArrayList<>(trees));
        return new SectionTrees<>() {
            @Override
            public int sectionCount() {
                return snapshot.size();
            }

            @Override
            public DocumentTree<N> tree(int sectionIndex) {
                if (sectionIndex < 0 || sectionIndex >= snapshot.size()) {
                    return null;
                }
                return snapshot.get(sectionIndex);
            }
        };
    }

    /**
     * Creates a one-section view whose only tree sits at {@code sectionIndex}.
     *
     * <p>Useful when a host keeps a single section loaded at a time.</p>
     */
    static <N> SectionTrees<N> single(int sectionIndex, int sectionCount, DocumentTree<N> tree) {
        Objects.requireNonNull(tree, "tree");
        if (sectionIndex < 0 || sectionIndex >= sectionCount) {
            throw new IllegalArgumentException("sectionIndex must be in [0, sectionCount)");
        }
        return new SectionTrees<>() {
            @Override
            public int sectionCount() {
                return sectionCount;
            }

            @Override
            public DocumentTree<N> tree(int index) {
                return index == sectionIndex ? tree : null;
            }
        };
    }
}
