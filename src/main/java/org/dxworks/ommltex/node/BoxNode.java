package org.dxworks.ommltex.node;

/**
 * Box ({@code m:box}) and border box ({@code m:borderBox}), both rendered as a boxed expression.
 */
public class BoxNode extends OmmlNode {

    public static final String MISSING_BASE = "{ERROR: Box missing base element}";

    private OmmlNode base;

    public BoxNode(String tag, OmmlNode parent) {
        super(tag, parent);
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
        return "\\boxed{" + base.toLatex() + "}";
    }
}
