package org.dxworks.ommltex.node;

import org.dxworks.ommltex.parser.XmlHelper;
import org.w3c.dom.Element;

/**
 * Phantom ({@code m:phant}): takes up the space of its base, which is shown only when
 * {@code m:show} is on.
 */
public class PhantomNode extends OmmlNode {

    private boolean show;
    private OmmlNode base;

    public PhantomNode(String tag, OmmlNode parent) {
        super(tag, parent);
    }

    @Override
    protected void parseProperties(Element element) {
        show = XmlHelper.isOn(XmlHelper.propertyChild(element, "phantPr", "show"));
    }

    @Override
    protected void resolve() {
        base = content("e");
    }

    @Override
    public String toLatex() {
        if (base == null) {
            return "";
        }
        return show ? base.toLatex() : "\\phantom{" + base.toLatex() + "}";
    }
}
