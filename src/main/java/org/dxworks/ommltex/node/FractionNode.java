package org.dxworks.ommltex.node;

import org.dxworks.ommltex.parser.XmlHelper;
import org.w3c.dom.Element;

/**
 * Fraction ({@code m:f}) with numerator and denominator containers.
 */
public class FractionNode extends OmmlNode {

    public static final String INCOMPLETE = "{ERROR: Incomplete Fraction}";

    private String fractionType;
    private OmmlNode numerator;
    private OmmlNode denominator;

    public FractionNode(String tag, OmmlNode parent) {
        super(tag, parent);
    }

    @Override
    protected void parseProperties(Element element) {
        fractionType = XmlHelper.val(XmlHelper.propertyChild(element, "fPr", "type"));
    }

    @Override
    protected void resolve() {
        numerator = content("num");
        denominator = content("den");
    }

    @Override
    public String toLatex() {
        if (numerator == null || denominator == null) {
            return INCOMPLETE;
        }
        String num = numerator.toLatex();
        String den = denominator.toLatex();
        if (fractionType == null) {
            return "\\frac{" + num + "}{" + den + "}";
        }
        return switch (fractionType) {
            case "noBar" -> "\\binom{" + num + "}{" + den + "}";
            case "lin" -> "{" + num + "} \\over {" + den + "}";
            case "skw" -> "{" + num + "}/{" + den + "}";
            default -> "\\frac{" + num + "}{" + den + "}";
        };
    }

    public String getFractionType() {
        return fractionType;
    }
}
