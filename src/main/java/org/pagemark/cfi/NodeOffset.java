package org.pagemark.cfi;

import org.pagemark.core.tree.DocumentTree;
import org.pagemark.core.tree.NodeKind;

import java.util.Objects;

/**
 * Concrete point in a document tree.
 *
 * <p>For a text node {@code offset} is a character offset. For an element a null offset denotes
 * the element itself and a non-null offset denotes the boundary before child number
 * {@code offset} (counted over {@link DocumentTree#children(Object)}).</p>
 *
 * @param tree tree that owns {@code node}.
 * @param node addressed node.
 * @param offset character offset or child boundary, or null.
 * @param <N> host node type.
 */
public record NodeOffset<N>(DocumentTree<N> tree, N node, Integer offset) {

    /**
     * Validates required fields.
     */
    public NodeOffset {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(node, "node");
        if (offset != null && offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0");
        }
    }

    /**
     * Creates a point addressing a node without offset.
     */
    public static <N> NodeOffset<N> of(DocumentTree<N> tree, N node) {
        return new NodeOffset<>(tree, node, null);
    }

    /**
     * Returns true when the point sits inside a text node.
     */
    public boolean isText() {
        return tree.kind(node) == NodeKind.TEXT;
    }

    /**
     * Returns true when the point is a boundary between children of an element.
     */
    public boolean isChildBoundary() {
        return offset != null && tree.kind(node) == NodeKind.ELEMENT;
    }
}
