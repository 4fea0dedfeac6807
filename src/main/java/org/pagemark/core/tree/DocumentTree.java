package org.pagemark.core.tree;

import java.util.List;

/**
 * Read-only capability view over one loaded section (or one embedded sub-document).
 *
 * <p>The addressing core never touches a concrete browser or parser tree; hosts adapt their
 * node type {@code N} through this contract. Implementations must be safe for concurrent
 * readers while the snapshot they expose is not mutated.</p>
 *
 * @param <N> host node type.
 */
public interface DocumentTree<N> {

    /**
     * Returns the root element of this tree.
     */
    N root();

    /**
     * Returns element and text children of {@code node} in document order.
     *
     * <p>Nodes of any other kind (comments, processing instructions) must be filtered out.</p>
     */
    List<N> children(N node);

    /**
     * Returns the node kind.
     */
    NodeKind kind(N node);

    /**
     * Returns the character length of a text node; element nodes report {@code 0}.
     */
    int textLength(N node);

    /**
     * Returns the identifier attribute of an element, or {@code null} when absent.
     */
    String identifier(N node);

    /**
     * Returns the embedded sub-document rooted at {@code node}, or {@code null} when the node
     * embeds nothing.
     *
     * <p>The returned tree must report {@code node} as its {@link #host()} and this tree as its
     * {@link #hostTree()}.</p>
     */
    DocumentTree<N> subtree(N node);

    /**
     * Returns the parent of {@code node}, or {@code null} for {@link #root()}.
     */
    N parent(N node);

    /**
     * Returns the node that embeds this tree, or {@code null} for a section tree.
     */
    default N host() {
        return null;
    }

    /**
     * Returns the tree containing {@link #host()}, or {@code null} for a section tree.
     */
    default DocumentTree<N> hostTree() {
        return null;
    }
}
