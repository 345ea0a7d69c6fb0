package org.dxworks.ommltex.node;

import org.dxworks.ommltex.latex.LatexSymbols;
import org.dxworks.ommltex.parser.XmlHelper;
import org.w3c.dom.Element;

/**
 * Accent ({@code m:acc}) over a base expression.
 */
public class AccentNode extends OmmlNode {

    public static final String MISSING_BASE = "{ERROR: Accent missing base}";
    // OMML default when accPr carries no chr
    static final String DEFAULT_ACCENT = "\u0302";

    private String accentChar = DEFAULT_ACCENT;
    private OmmlNode base;

    public AccentNode(String tag, OmmlNode parent) {
        super(tag, parent);
    }

    @Override
    protected void parseProperties(Element element) {
        String chr = XmlHelper.val(XmlHelper.propertyChild(element, "accPr", "chr"));
        if (chr != null) {
            accentChar = chr;
        }
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
        String baseLatex = base.toLatex();
        if (accentChar.isEmpty()) {
            return baseLatex;
        }
        return LatexSymbols.accentTemplate(accentChar)
                .map(template -> String.format(template, baseLatex))
                .orElseGet(() -> "\\text{Accent?}{" + baseLatex + "}");
    }

    public String getAccentChar() {
        return accentChar;
    }
}
