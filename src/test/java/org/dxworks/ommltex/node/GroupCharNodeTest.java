package org.dxworks.ommltex.node;

import org.junit.jupiter.api.Test;

import static org.dxworks.ommltex.TestUtils.convert;
import static org.dxworks.ommltex.TestUtils.r;
import static org.junit.jupiter.api.Assertions.*;

public class GroupCharNodeTest {

    private static String group(String props, String base) {
        return "<m:groupChr>" + props + "<m:e>" + base + "</m:e></m:groupChr>";
    }

    @Test
    void defaultCharacterIsAnUnderbrace() {
        assertEquals("\\underbrace{a+b}", convert(group("", r("a+b"))));
    }

    @Test
    void braceOnTopIsAnOverbrace() {
        String props = "<m:groupChrPr><m:chr m:val=\"\u23DE\"/><m:pos m:val=\"top\"/></m:groupChrPr>";
        assertEquals("\\overbrace{x}", convert(group(props, r("x"))));
    }

    @Test
    void otherCharactersPassTheBaseThrough() {
        String props = "<m:groupChrPr><m:chr m:val=\"\u2192\"/><m:pos m:val=\"top\"/></m:groupChrPr>";
        assertEquals("x", convert(group(props, r("x"))));
    }

    @Test
    void missingBase() {
        assertEquals(GroupCharNode.MISSING_BASE, convert("<m:groupChr/>"));
    }
}
