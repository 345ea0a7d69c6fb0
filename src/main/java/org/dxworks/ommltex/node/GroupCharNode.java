package org.dxworks.ommltex.node;

import org.dxworks.ommltex.parser.XmlHelper;
import org.w3c.dom.Element;

import java.util.Set;

/**
 * Grouping character ({@code m:groupChr}) such as a brace stretched over or under a base.
 */
public class GroupCharNode extends OmmlNode {

    public static final String MISSING_BASE = "{ERROR: GroupChar missing base}";
    // bottom curly bracket, the OMML default
    static final String DEFAULT_CHAR = "\u23DF";
    private static final Set<String> BRACES = Set.of("{", "}", "\u23DE", "\u23DF");

    private String groupChar = DEFAULT_CHAR;
    private String position;
    private OmmlNode base;

    public GroupCharNode(String tag, OmmlNode parent) {
        super(tag, parent);
    }

    @Override
    protected void parseProperties(Element element) {
        Element groupChrPr = XmlHelper.childElement(element, "groupChrPr");
        String chr = XmlHelper.val(XmlHelper.childElement(groupChrPr, "chr"));
        if (chr != null) {
            groupChar = chr;
        }
        position = XmlHelper.val(XmlHelper.childElement(groupChrPr, "pos"));
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
        if (!BRACES.contains(groupChar)) {
            return baseLatex;
        }
        return ("top".equals(position) ? "\\overbrace{" : "\\underbrace{") + baseLatex + "}";
    }
}
