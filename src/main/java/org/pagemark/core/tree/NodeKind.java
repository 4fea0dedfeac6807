package org.pagemark.core.tree;

/**
 * Node discriminator exposed by {@link DocumentTree}.
 */
public enum NodeKind {
    /**
     * Element node. Element children occupy even CFI indices.
     */
    ELEMENT,

    /**
     * Character data node. Runs of text between elements share one odd CFI index.
     */
    TEXT
}
