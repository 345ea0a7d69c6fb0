package org.dxworks.ommltex.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Equation array ({@code m:eqArr}): one row per non-empty {@code m:e} child. Inside a delimiter that
 * opens with a brace and never closes it renders as a case distinction.
 */
public class EquationArrayNode extends OmmlNode {

    public static final String CASES_ENVIRONMENT = "cases";
    public static final String ALIGNED_ENVIRONMENT = "aligned";

    private List<OmmlNode> rows = Collections.emptyList();

    public EquationArrayNode(String tag, OmmlNode parent) {
        super(tag, parent);
    }

    @Override
    protected void resolve() {
        List<OmmlNode> found = new ArrayList<>();
        for (OmmlNode row : findChildren("e")) {
            if (!row.isEmpty()) {
                found.add(row);
            }
        }
        rows = Collections.unmodifiableList(found);
    }

    @Override
    public String toLatex() {
        if (rows.isEmpty()) {
            return "";
        }
        String environment = isCases() ? CASES_ENVIRONMENT : ALIGNED_ENVIRONMENT;
        List<String> lines = new ArrayList<>();
        for (OmmlNode row : rows) {
            lines.add(row.toLatex());
        }
        return "\\begin{" + environment + "}\n"
                + String.join(MatrixNode.ROW_SEPARATOR, lines)
                + "\n\\end{" + environment + "}";
    }

    public boolean isCases() {
        DelimiterNode delimiter = enclosingDelimiter();
        return delimiter != null && "{".equals(delimiter.getBeginChar()) && !delimiter.hasClosingChar();
    }

    @Override
    protected boolean rendersEnclosingDelimiter() {
        return !rows.isEmpty() && isCases();
    }

    public int getRowCount() {
        return rows.size();
    }
}
