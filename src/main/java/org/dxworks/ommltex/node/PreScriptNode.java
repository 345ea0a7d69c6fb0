package org.dxworks.ommltex.node;

/**
 * Pre-sub-superscript ({@code m:sPre}): scripts written before the base.
 */
public class PreScriptNode extends OmmlNode {

    private OmmlNode base;
    private OmmlNode subscript;
    private OmmlNode superscript;

    public PreScriptNode(String tag, OmmlNode parent) {
        super(tag, parent);
    }

    @Override
    protected void resolve() {
        base = content("e");
        subscript = content("sub");
        superscript = content("sup");
    }

    @Override
    public String toLatex() {
        StringBuilder sb = new StringBuilder("{}");
        if (subscript != null) {
            sb.append("_{").append(subscript.toLatex()).append('}');
        }
        if (superscript != null) {
            sb.append("^{").append(superscript.toLatex()).append('}');
        }
        sb.append('{').append(base != null ? base.toLatex() : "").append('}');
        return sb.toString();
    }
}
