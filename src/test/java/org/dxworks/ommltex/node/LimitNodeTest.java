package org.dxworks.ommltex.node;

import org.junit.jupiter.api.Test;

import static org.dxworks.ommltex.TestUtils.convert;
import static org.dxworks.ommltex.TestUtils.r;
import static org.junit.jupiter.api.Assertions.*;

public class LimitNodeTest {

    private static String limit(String tag, String base, String lim) {
        StringBuilder sb = new StringBuilder("<m:").append(tag).append('>');
        if (base != null) sb.append("<m:e>").append(base).append("</m:e>");
        if (lim != null) sb.append("<m:lim>").append(lim).append("</m:lim>");
        return sb.append("</m:").append(tag).append('>').toString();
    }

    @Test
    void functionNameBaseBecomesItsMacro() {
        String base = "<m:r><m:rPr><m:sty m:val=\"p\"/></m:rPr><m:t>lim</m:t></m:r>";
        assertEquals("\\lim_{x\\rightarrow0}", convert(limit("limLow", base, r("x\u21920"))));
    }

    @Test
    void ordinaryBaseIsGrouped() {
        assertEquals("{x}_{0}", convert(limit("limLow", r("x"), r("0"))));
        assertEquals("{A}^{k}", convert(limit("limUpp", r("A"), r("k"))));
    }

    @Test
    void limitWithoutBase() {
        assertEquals("_{n}", convert(limit("limLow", null, r("n"))));
        assertEquals("^{n}", convert(limit("limUpp", "", r("n"))));
    }

    @Test
    void missingLimitIsReportedAfterTheBase() {
        assertEquals("x{ERROR: LimLow incomplete}", convert(limit("limLow", r("x"), null)));
        assertEquals("x{ERROR: LimUpp incomplete}", convert(limit("limUpp", r("x"), "")));
        assertEquals("{ERROR: LimLow incomplete}", convert(limit("limLow", null, null)));
    }
}
