package org.dxworks.ommltex.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Matrix ({@code m:m}). The environment follows the brackets of the enclosing delimiter.
 */
public class MatrixNode extends OmmlNode {

    public static final String PLAIN_ENVIRONMENT = "matrix";
    static final String ROW_SEPARATOR = " \\\\ \n";

    private List<MatrixRowNode> rows = Collections.emptyList();

    public MatrixNode(String tag, OmmlNode parent) {
        super(tag, parent);
    }

    @Override
    protected void resolve() {
        List<MatrixRowNode> found = new ArrayList<>();
        for (OmmlNode child : getChildren()) {
            if (child instanceof MatrixRowNode row && row.getCellCount() > 0) {
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
        String environment = environment();
        List<String> renderedRows = new ArrayList<>();
        for (MatrixRowNode row : rows) {
            renderedRows.add(row.toLatex());
        }
        return "\\begin{" + environment + "}\n"
                + String.join(ROW_SEPARATOR, renderedRows)
                + "\n\\end{" + environment + "}";
    }

    public String environment() {
        DelimiterNode delimiter = enclosingDelimiter();
        if (delimiter == null) {
            return PLAIN_ENVIRONMENT;
        }
        String pair = delimiter.getBeginChar() + delimiter.getEndChar();
        return switch (pair) {
            case "()" -> "pmatrix";
            case "[]" -> "bmatrix";
            case "{}" -> "Bmatrix";
            case "||" -> "vmatrix";
            case "\u2016\u2016" -> "Vmatrix";
            default -> PLAIN_ENVIRONMENT;
        };
    }

    @Override
    protected boolean rendersEnclosingDelimiter() {
        return !rows.isEmpty() && !PLAIN_ENVIRONMENT.equals(environment());
    }

    public int getRowCount() {
        return rows.size();
    }
}
