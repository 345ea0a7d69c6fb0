package org.dxworks.ommltex.node;

import org.junit.jupiter.api.Test;

import static org.dxworks.ommltex.TestUtils.convert;
import static org.dxworks.ommltex.TestUtils.parseNode;
import static org.dxworks.ommltex.TestUtils.r;
import static org.junit.jupiter.api.Assertions.*;

public class ScriptNodeTest {

    private static String e(String inner) {
        return "<m:e>" + inner + "</m:e>";
    }

    @Test
    void superscript() {
        assertEquals("{x}^{2}", convert("<m:sSup>" + e(r("x")) + "<m:sup>" + r("2") + "</m:sup></m:sSup>"));
    }

    @Test
    void subscript() {
        assertEquals("{a}_{i}", convert("<m:sSub>" + e(r("a")) + "<m:sub>" + r("i") + "</m:sub></m:sSub>"));
    }

    @Test
    void subSuperscript() {
        String xml = "<m:sSubSup>" + e(r("x")) + "<m:sub>" + r("i") + "</m:sub><m:sup>" + r("2") + "</m:sup></m:sSubSup>";
        assertEquals("{x}_{i}^{2}", convert(xml));
    }

    @Test
    void childrenAreFoundByTagNotPosition() {
        String xml = "<m:sSubSup><m:sup>" + r("2") + "</m:sup><m:sub>" + r("i") + "</m:sub>" + e(r("x")) + "</m:sSubSup>";
        assertEquals("{x}_{i}^{2}", convert(xml));
    }

    @Test
    void superscriptIgnoresStraySubscript() throws Exception {
        OmmlNode node = parseNode("sSup", e(r("x")) + "<m:sub>" + r("i") + "</m:sub><m:sup>" + r("2") + "</m:sup>");
        ScriptNode script = (ScriptNode) node;
        assertFalse(script.hasSubscript());
        assertTrue(script.hasSuperscript());
        assertEquals("{x}^{2}", script.toLatex());
    }

    @Test
    void missingBaseRendersEmptyGroup() {
        assertEquals("{}^{2}", convert("<m:sSup><m:e/><m:sup>" + r("2") + "</m:sup></m:sSup>"));
        assertEquals("{}_{0}", convert("<m:sSub><m:sub>" + r("0") + "</m:sub></m:sSub>"));
    }

    @Test
    void noScriptsRendersTheBase() {
        assertEquals("x", convert("<m:sSup>" + e(r("x")) + "</m:sSup>"));
        assertEquals("{}", convert("<m:sSubSup/>"));
    }

    @Test
    void preScripts() {
        String xml = "<m:sPre><m:sub>" + r("1") + "</m:sub><m:sup>" + r("2") + "</m:sup>" + e(r("X")) + "</m:sPre>";
        assertEquals("{}_{1}^{2}{X}", convert(xml));
    }

    @Test
    void preSubscriptOnly() {
        assertEquals("{}_{n}{C}", convert("<m:sPre><m:sub>" + r("n") + "</m:sub>" + e(r("C")) + "</m:sPre>"));
    }
}
