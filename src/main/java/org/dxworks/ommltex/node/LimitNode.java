package org.dxworks.ommltex.node;

import org.dxworks.ommltex.latex.LatexSymbols;

/**
 * Lower and upper limits ({@code m:limLow}, {@code m:limUpp}): a base with an expression set below
 * or above it.
 */
public class LimitNode extends OmmlNode {

    private final boolean lower;
    private OmmlNode base;
    private OmmlNode limit;

    public LimitNode(String tag, OmmlNode parent) {
        super(tag, parent);
        this.lower = "limLow".equals(tag);
    }

    @Override
    protected void resolve() {
        base = content("e");
        limit = content("lim");
    }

    @Override
    public String toLatex() {
        String marker = lower ? "_" : "^";
        if (base == null && limit != null) {
            return marker + "{" + limit.toLatex() + "}";
        }
        if (limit == null) {
            return (base != null ? base.toLatex() : "") + incompleteMarker();
        }
        String macro = LatexSymbols.functionMacro(base.plainText().strip()).orElse(null);
        if (macro != null) {
            return macro + marker + "{" + limit.toLatex() + "}";
        }
        return "{" + base.toLatex() + "}" + marker + "{" + limit.toLatex() + "}";
    }

    private String incompleteMarker() {
        return lower ? "{ERROR: LimLow incomplete}" : "{ERROR: LimUpp incomplete}";
    }

    public boolean isLower() {
        return lower;
    }
}
