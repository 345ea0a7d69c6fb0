package org.dxworks.ommltex.node;

import org.dxworks.ommltex.parser.XmlHelper;
import org.w3c.dom.Element;

/**
 * Radical ({@code m:rad}): base under the root sign and an optional degree.
 */
public class RadicalNode extends OmmlNode {

    public static final String INCOMPLETE = "{ERROR: Incomplete Radical}";

    private boolean hideDegree;
    private OmmlNode base;
    private OmmlNode degree;

    public RadicalNode(String tag, OmmlNode parent) {
        super(tag, parent);
    }

    @Override
    protected void parseProperties(Element element) {
        hideDegree = XmlHelper.isOn(XmlHelper.propertyChild(element, "radPr", "degHide"));
    }

    @Override
    protected void resolve() {
        base = content("e");
        degree = content("deg");
    }

    @Override
    public String toLatex() {
        if (base == null) {
            return INCOMPLETE;
        }
        String baseLatex = base.toLatex();
        if (degree == null || hideDegree) {
            return "\\sqrt{" + baseLatex + "}";
        }
        String degreeLatex = degree.toLatex().strip();
        // square root written with an explicit degree
        if (degreeLatex.isEmpty() || degreeLatex.equals("2")) {
            return "\\sqrt{" + baseLatex + "}";
        }
        return "\\sqrt[" + degreeLatex + "]{" + baseLatex + "}";
    }
}
