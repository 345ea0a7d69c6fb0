package org.dxworks.ommltex.node;

import org.dxworks.ommltex.latex.LatexSymbols;
import org.dxworks.ommltex.parser.XmlHelper;
import org.w3c.dom.Element;

/**
 * N-ary operator ({@code m:nary}) such as a sum, product or integral with optional limits.
 */
public class NaryNode extends OmmlNode {

    public static final String MISSING_BASE = "{ERROR: N-ary operator missing base element}";
    public static final String UNDER_OVER = "undOvr";
    public static final String SUB_SUP = "subSup";

    private String operatorChar;
    private String limitLocation;
    private boolean hideSubscript;
    private boolean hideSuperscript;
    private OmmlNode base;
    private OmmlNode lowerLimit;
    private OmmlNode upperLimit;

    public NaryNode(String tag, OmmlNode parent) {
        super(tag, parent);
    }

    @Override
    protected void parseProperties(Element element) {
        Element naryPr = XmlHelper.childElement(element, "naryPr");
        if (naryPr == null) {
            return;
        }
        operatorChar = XmlHelper.val(XmlHelper.childElement(naryPr, "chr"));
        limitLocation = XmlHelper.val(XmlHelper.childElement(naryPr, "limLoc"));
        hideSubscript = XmlHelper.isOn(XmlHelper.childElement(naryPr, "subHide"));
        hideSuperscript = XmlHelper.isOn(XmlHelper.childElement(naryPr, "supHide"));
    }

    @Override
    protected void resolve() {
        base = content("e");
        lowerLimit = hideSubscript ? null : content("sub");
        upperLimit = hideSuperscript ? null : content("sup");
    }

    @Override
    public String toLatex() {
        if (base == null) {
            return MISSING_BASE;
        }
        String operator = operator();
        StringBuilder sb = new StringBuilder(operator);
        boolean hasLimits = lowerLimit != null || upperLimit != null;
        if (hasLimits && UNDER_OVER.equals(limitLocation) && isCommand(operator)) {
            sb.append("\\limits");
        }
        if (lowerLimit != null) {
            sb.append("_{").append(lowerLimit.toLatex()).append('}');
        }
        if (upperLimit != null) {
            sb.append("^{").append(upperLimit.toLatex()).append('}');
        }
        return sb.append(' ').append(base.toLatex()).toString();
    }

    private static boolean isCommand(String operator) {
        return operator.length() > 1 && operator.charAt(0) == '\\'
                && operator.substring(1).chars().allMatch(Character::isLetter);
    }

    String operator() {
        if (operatorChar == null || operatorChar.isEmpty()) {
            return "\\sum";
        }
        if (operatorChar.codePointCount(0, operatorChar.length()) == 1) {
            int codePoint = operatorChar.codePointAt(0);
            if (LatexSymbols.hasSymbol(codePoint)) {
                return LatexSymbols.symbol(codePoint);
            }
        }
        return LatexSymbols.escape(operatorChar);
    }

    public String getLimitLocation() {
        return limitLocation;
    }
}
