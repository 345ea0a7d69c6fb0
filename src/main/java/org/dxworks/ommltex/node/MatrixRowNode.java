package org.dxworks.ommltex.node;

import java.util.ArrayList;
import java.util.List;

/**
 * Matrix row ({@code m:mr}); every {@code m:e} child is one cell, empty cells included.
 */
public class MatrixRowNode extends OmmlNode {

    public MatrixRowNode(String tag, OmmlNode parent) {
        super(tag, parent);
    }

    @Override
    public String toLatex() {
        List<String> cells = new ArrayList<>();
        for (OmmlNode cell : findChildren("e")) {
            cells.add(cell.toLatex());
        }
        return String.join(" & ", cells);
    }

    public int getCellCount() {
        return findChildren("e").size();
    }
}
