package org.dxworks.ommltex.node;

import org.junit.jupiter.api.Test;

import static org.dxworks.ommltex.TestUtils.convert;
import static org.dxworks.ommltex.TestUtils.r;
import static org.junit.jupiter.api.Assertions.*;

public class FractionNodeTest {

    private static String fraction(String type, String num, String den) {
        String props = type == null ? "" : "<m:fPr><m:type m:val=\"" + type + "\"/></m:fPr>";
        return "<m:f>" + props + "<m:num>" + num + "</m:num><m:den>" + den + "</m:den></m:f>";
    }

    @Test
    void defaultFraction() {
        assertEquals("\\frac{1}{2}", convert(fraction(null, r("1"), r("2"))));
    }

    @Test
    void fractionTypes() {
        assertEquals("\\binom{n}{k}", convert(fraction("noBar", r("n"), r("k"))));
        assertEquals("{a} \\over {b}", convert(fraction("lin", r("a"), r("b"))));
        assertEquals("{a}/{b}", convert(fraction("skw", r("a"), r("b"))));
        assertEquals("\\frac{a}{b}", convert(fraction("bar", r("a"), r("b"))));
    }

    @Test
    void nestedFraction() {
        assertEquals("\\frac{\\frac{1}{x}}{2}", convert(fraction(null, fraction(null, r("1"), r("x")), r("2"))));
    }

    @Test
    void missingDenominatorIsIncomplete() {
        assertEquals(FractionNode.INCOMPLETE, convert("<m:f><m:num>" + r("1") + "</m:num></m:f>"));
    }

    @Test
    void emptyNumeratorIsIncomplete() {
        assertEquals("{ERROR: Incomplete Fraction}", convert(fraction(null, "", r("2"))));
    }

    @Test
    void incompleteFractionKeepsSurroundingText() {
        assertEquals("a+{ERROR: Incomplete Fraction}", convert(r("a+") + "<m:f><m:num>" + r("1") + "</m:num></m:f>"));
    }
}
