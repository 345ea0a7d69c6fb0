package org.dxworks.ommltex.node;

import org.dxworks.ommltex.parser.XmlHelper;
import org.w3c.dom.Element;

/**
 * Bar ({@code m:bar}) drawn over or under a base expression.
 */
public class BarNode extends OmmlNode {

    public static final String MISSING_BASE = "{ERROR: Bar missing base element}";

    private boolean bottom;
    private OmmlNode base;

    public BarNode(String tag, OmmlNode parent) {
        super(tag, parent);
    }

    @Override
    protected void parseProperties(Element element) {
        bottom = "bot".equals(XmlHelper.val(XmlHelper.propertyChild(element, "barPr", "pos")));
    }

    @Override
    protected void resolve() {
        base = content("e");
    }

    @Override
    public String toLatex() {
        if (base == null) {
            return MISSING_BASE;
        }
        return (bottom ? "\\underline{" : "\\overline{") + base.toLatex() + "}";
    }
}
