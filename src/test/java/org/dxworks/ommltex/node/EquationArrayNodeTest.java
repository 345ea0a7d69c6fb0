package org.dxworks.ommltex.node;

import org.junit.jupiter.api.Test;

import static org.dxworks.ommltex.TestUtils.convert;
import static org.dxworks.ommltex.TestUtils.parseNode;
import static org.dxworks.ommltex.TestUtils.r;
import static org.junit.jupiter.api.Assertions.*;

public class EquationArrayNodeTest {

    private static final String ROWS = "<m:eqArr><m:e>" + r("x") + "</m:e><m:e>" + r("y") + "</m:e></m:eqArr>";

    @Test
    void topLevelArrayIsAligned() {
        String xml = "<m:eqArr><m:e>" + r("a&amp;=1") + "</m:e><m:e>" + r("b&amp;=2") + "</m:e></m:eqArr>";
        assertEquals("\\begin{aligned}\na&=1 \\\\ \nb&=2\n\\end{aligned}", convert(xml));
    }

    @Test
    void openBraceWithoutClosingCharacterIsCases() {
        String xml = "<m:d><m:dPr><m:begChr m:val=\"{\"/><m:endChr m:val=\"\"/></m:dPr><m:e>" + ROWS + "</m:e></m:d>";
        assertEquals("\\begin{cases}\nx \\\\ \ny\n\\end{cases}", convert(xml));
    }

    @Test
    void openBraceWithUndeclaredClosingCharacterIsCases() {
        String xml = "<m:d><m:dPr><m:begChr m:val=\"{\"/></m:dPr><m:e>" + ROWS + "</m:e></m:d>";
        assertEquals("\\begin{cases}\nx \\\\ \ny\n\\end{cases}", convert(xml));
    }

    @Test
    void closedBracesKeepTheDelimiter() {
        String xml = "<m:d><m:dPr><m:begChr m:val=\"{\"/><m:endChr m:val=\"}\"/></m:dPr><m:e>" + ROWS + "</m:e></m:d>";
        assertEquals("\\{\\begin{aligned}\nx \\\\ \ny\n\\end{aligned}\\}", convert(xml));
    }

    @Test
    void braceAroundSeveralSegmentsIsNotCases() {
        String xml = "<m:d><m:dPr><m:begChr m:val=\"{\"/><m:endChr m:val=\"\"/></m:dPr>"
                + "<m:e>" + ROWS + "</m:e><m:e>" + r("z") + "</m:e></m:d>";
        assertEquals("\\{\\begin{aligned}\nx \\\\ \ny\n\\end{aligned}, z", convert(xml));
    }

    @Test
    void emptyRowsAreSkipped() throws Exception {
        EquationArrayNode node = (EquationArrayNode) parseNode("eqArr", "<m:e/><m:e>" + r("x") + "</m:e>");
        assertEquals(1, node.getRowCount());
        assertFalse(node.isCases());
        assertEquals("\\begin{aligned}\nx\n\\end{aligned}", node.toLatex());
    }

    @Test
    void arrayWithoutRowsRendersNothing() {
        assertEquals("", convert("<m:eqArr/>"));
    }
}
