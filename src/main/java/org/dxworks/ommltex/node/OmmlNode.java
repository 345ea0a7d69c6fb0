package org.dxworks.ommltex.node;

import org.dxworks.ommltex.latex.LatexSymbols;
import org.dxworks.ommltex.parser.OmmlParser;
import org.dxworks.ommltex.parser.XmlHelper;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node of the equation tree built from one OMML element.
 *
 * <p>Nodes are completed by a single {@link #build(Element, OmmlParser)} call: properties are read
 * first, children are parsed recursively next, and kind-specific fields are resolved from the parsed
 * children last. The source element is not kept once the build returns. {@link #toLatex()} may only be
 * called on a built node; it never changes state and returns the same text on every call.
 *
 * <p>The parent reference is a read-only lookup used for context queries such as
 * {@link #enclosingDelimiter()}.
 */
public abstract class OmmlNode {

    private final String tag;
    private final OmmlNode parent;
    private List<OmmlNode> children = Collections.emptyList();

    protected OmmlNode(String tag, OmmlNode parent) {
        this.tag = tag;
        this.parent = parent;
    }

    public final void build(Element element, OmmlParser parser) {
        parseProperties(element);
        children = Collections.unmodifiableList(parseChildren(element, parser));
        resolve();
    }

    protected void parseProperties(Element element) {
    }

    protected List<OmmlNode> parseChildren(Element element, OmmlParser parser) {
        List<OmmlNode> parsed = new ArrayList<>();
        for (Node child = element.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (!XmlHelper.isElement(child) || XmlHelper.isPropertyElement(child)) {
                continue;
            }
            parsed.add(parser.parse(child, this));
        }
        return parsed;
    }

    /**
     * Completes kind-specific fields once the children exist.
     */
    protected void resolve() {
    }

    public abstract String toLatex();

    /**
     * Text of this subtree without formatting wrappers. Used to recognise function names.
     */
    public String plainText() {
        StringBuilder sb = new StringBuilder();
        for (OmmlNode child : children) {
            sb.append(child.plainText());
        }
        return sb.toString();
    }

    public String getTag() {
        return tag;
    }

    public OmmlNode getParent() {
        return parent;
    }

    public List<OmmlNode> getChildren() {
        return children;
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    protected String childrenToLatex() {
        StringBuilder sb = new StringBuilder();
        for (OmmlNode child : children) {
            LatexSymbols.append(sb, child.toLatex());
        }
        return sb.toString();
    }

    protected OmmlNode findChild(String childTag) {
        for (OmmlNode child : children) {
            if (childTag.equals(child.getTag())) {
                return child;
            }
        }
        return null;
    }

    protected List<OmmlNode> findChildren(String childTag) {
        List<OmmlNode> found = new ArrayList<>();
        for (OmmlNode child : children) {
            if (childTag.equals(child.getTag())) {
                found.add(child);
            }
        }
        return found;
    }

    /**
     * The first child container with the given tag, or null when it is missing or holds no content.
     */
    protected OmmlNode content(String childTag) {
        OmmlNode container = findChild(childTag);
        return container == null || container.isEmpty() ? null : container;
    }

    /**
     * The delimiter this node sits in: the parent itself, or the delimiter around the {@code e}
     * argument that holds only this node. A delimiter with more than one segment encloses nothing.
     */
    protected DelimiterNode enclosingDelimiter() {
        OmmlNode context = parent;
        if (context != null && "e".equals(context.getTag()) && context.getChildren().size() == 1) {
            context = context.getParent();
        }
        return context instanceof DelimiterNode delimiter && delimiter.getSegmentCount() == 1 ? delimiter : null;
    }

    /**
     * True when this node already renders the brackets of its enclosing delimiter.
     */
    protected boolean rendersEnclosingDelimiter() {
        return false;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + tag + "]";
    }
}
