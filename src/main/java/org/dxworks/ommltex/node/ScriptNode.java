package org.dxworks.ommltex.node;

/**
 * Subscript, superscript and combined scripts ({@code m:sSub}, {@code m:sSup}, {@code m:sSubSup}).
 * All three tags share one rendering routine keyed on which scripts are present.
 */
public class ScriptNode extends OmmlNode {

    private OmmlNode base;
    private OmmlNode subscript;
    private OmmlNode superscript;

    public ScriptNode(String tag, OmmlNode parent) {
        super(tag, parent);
    }

    @Override
    protected void resolve() {
        base = content("e");
        if (!"sSup".equals(getTag())) {
            subscript = content("sub");
        }
        if (!"sSub".equals(getTag())) {
            superscript = content("sup");
        }
    }

    @Override
    public String toLatex() {
        return render(base, subscript, superscript);
    }

    static String render(OmmlNode base, OmmlNode subscript, OmmlNode superscript) {
        String baseLatex = base != null ? base.toLatex() : "";
        if (subscript == null && superscript == null) {
            return base != null ? baseLatex : "{}";
        }
        StringBuilder sb = new StringBuilder("{").append(baseLatex).append('}');
        if (subscript != null) {
            sb.append("_{").append(subscript.toLatex()).append('}');
        }
        if (superscript != null) {
            sb.append("^{").append(superscript.toLatex()).append('}');
        }
        return sb.toString();
    }

    public boolean hasSubscript() {
        return subscript != null;
    }

    public boolean hasSuperscript() {
        return superscript != null;
    }
}
