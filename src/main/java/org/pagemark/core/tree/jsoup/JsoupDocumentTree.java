package org.pagemark.core.tree.jsoup;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.pagemark.core.tree.DocumentTree;
import org.pagemark.core.tree.NodeKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link DocumentTree} adapter over a parsed jsoup document.
 *
 * <p>The root is the document element ({@code <html>}). Comments, doctypes and script data are
 * not part of the addressable tree. Inline frames carrying a {@code srcdoc} attribute expose
 * their content as an embedded sub-document, parsed on first access and cached.</p>
 *
 * <p>The wrapped document must not be mutated while the adapter is in use.</p>
 */
@Slf4j
public final class JsoupDocumentTree implements DocumentTree<Node> {
    private static final String SRCDOC_ATTRIBUTE = "srcdoc";

    private final Document document;
    private final Element root;
    private final Node host;
    private final JsoupDocumentTree hostTree;
    private final Map<Node, JsoupDocumentTree> subtrees = new ConcurrentHashMap<>();

    public JsoupDocumentTree(Document document) {
        this(document, null, null);
    }

    private JsoupDocumentTree(Document document, Node host, JsoupDocumentTree hostTree) {
        this.document = Objects.requireNonNull(document, "document");
        this.root = document.children().first();
        if (root == null) {
            throw new IllegalArgumentException("document has no root element");
        }
        this.host = host;
        this.hostTree = hostTree;
    }

    /**
     * Parses markup into a section tree.
     */
    public static JsoupDocumentTree parse(String html) {
        return new JsoupDocumentTree(Jsoup.parse(Objects.requireNonNull(html, "html")));
    }

    /**
     * Returns the wrapped document.
     */
    public Document document() {
        return document;
    }

    @Override
    public Node root() {
        return root;
    }

    @Override
    public List<Node> children(Node node) {
        List<Node> childNodes = node.childNodes();
        if (childNodes.isEmpty()) {
            return Collections.emptyList();
        }
        List<Node> children = new ArrayList<>(childNodes.size());
        for (Node child : childNodes) {
            if (child instanceof Element || child instanceof TextNode) {
                children.add(child);
            }
        }
        return children;
    }

    @Override
    public NodeKind kind(Node node) {
        if (node instanceof Element) {
            return NodeKind.ELEMENT;
        }
        if (node instanceof TextNode) {
            return NodeKind.TEXT;
        }
        throw new IllegalArgumentException("unsupported node type " + node.nodeName());
    }

    @Override
    public int textLength(Node node) {
        return node instanceof TextNode text ? text.getWholeText().length() : 0;
    }

    @Override
    public String identifier(Node node) {
        if (!(node instanceof Element element)) {
            return null;
        }
        String id = element.id();
        return id.isEmpty() ? null : id;
    }

    @Override
    public DocumentTree<Node> subtree(Node node) {
        if (!(node instanceof Element element) || !element.hasAttr(SRCDOC_ATTRIBUTE)) {
            return null;
        }
        return subtrees.computeIfAbsent(node, key -> {
            log.debug("Parsing embedded document of <{}>", element.tagName());
            return new JsoupDocumentTree(Jsoup.parse(element.attr(SRCDOC_ATTRIBUTE)), key, this);
        });
    }

    @Override
    public Node parent(Node node) {
        if (node == root) {
            return null;
        }
        return node.parent();
    }

    @Override
    public Node host() {
        return host;
    }

    @Override
    public DocumentTree<Node> hostTree() {
        return hostTree;
    }
}
