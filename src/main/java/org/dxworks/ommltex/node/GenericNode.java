package org.dxworks.ommltex.node;

/**
 * Fallback for unregistered tags, elements outside the math namespace and non-element nodes.
 * Renders as the concatenation of its children, so unknown wrappers are transparent.
 */
public class GenericNode extends OmmlNode {

    public GenericNode(String tag, OmmlNode parent) {
        super(tag, parent);
    }

    @Override
    public String toLatex() {
        return childrenToLatex();
    }
}
