package org.dxworks.ommltex.latex;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class LatexSymbolsTest {

    @Test
    void symbol_mapsGreekAndOperators() {
        assertEquals("\\alpha", LatexSymbols.symbol(0x03B1));
        assertEquals("\\Omega", LatexSymbols.symbol(0x03A9));
        assertEquals("\\leq", LatexSymbols.symbol(0x2264));
        assertEquals("\\infty", LatexSymbols.symbol(0x221E));
        assertEquals("-", LatexSymbols.symbol(0x2212));
    }

    @Test
    void symbol_greekCapitalsThatLookLatinBecomeLetters() {
        assertEquals("A", LatexSymbols.symbol(0x0391));
        assertEquals("P", LatexSymbols.symbol(0x03A1));
    }

    @Test
    void symbol_mathItalicLettersBecomeAscii() {
        assertEquals("x", LatexSymbols.symbol(0x1D465));
        assertEquals("A", LatexSymbols.symbol(0x1D434));
        assertEquals("h", LatexSymbols.symbol(0x210E));
    }

    @Test
    void symbol_unmappedCharacterIsReturnedUnchanged() {
        assertEquals("x", LatexSymbols.symbol('x'));
        assertFalse(LatexSymbols.hasSymbol('x'));
        assertTrue(LatexSymbols.hasSymbol(0x2211));
    }

    @Test
    void symbol_invisibleOperatorsMapToNothing() {
        assertEquals("", LatexSymbols.symbol(0x2061));
        assertEquals("", LatexSymbols.symbol(0x2062));
    }

    @Test
    void functionMacro_knownAndUnknownNames() {
        assertEquals(Optional.of("\\sin"), LatexSymbols.functionMacro("sin"));
        assertEquals(Optional.of("\\lim"), LatexSymbols.functionMacro("lim"));
        assertEquals(Optional.of("\\operatorname{arccot}"), LatexSymbols.functionMacro("arccot"));
        assertTrue(LatexSymbols.functionMacro("foo").isEmpty());
        assertTrue(LatexSymbols.functionMacro(null).isEmpty());
    }

    @Test
    void accentTemplate_acceptsCharacterOrHexCode() {
        assertEquals(Optional.of("\\hat{%s}"), LatexSymbols.accentTemplate("\u0302"));
        assertEquals(Optional.of("\\hat{%s}"), LatexSymbols.accentTemplate("0302"));
        assertEquals(Optional.of("\\vec{%s}"), LatexSymbols.accentTemplate("\u20D7"));
        assertEquals(Optional.of("\\ddot{%s}"), LatexSymbols.accentTemplate(".."));
        assertTrue(LatexSymbols.accentTemplate("@").isEmpty());
        assertTrue(LatexSymbols.accentTemplate("").isEmpty());
        assertTrue(LatexSymbols.accentTemplate(null).isEmpty());
    }

    @Test
    void delimiter_mapsBracketsAndEscapesTheRest() {
        assertEquals("(", LatexSymbols.delimiter("("));
        assertEquals("\\{", LatexSymbols.delimiter("{"));
        assertEquals("\\langle", LatexSymbols.delimiter("\u27E8"));
        assertEquals("\\|", LatexSymbols.delimiter("\u2016"));
        assertEquals("\\#", LatexSymbols.delimiter("#"));
        assertEquals("", LatexSymbols.delimiter(""));
        assertEquals("", LatexSymbols.delimiter(null));
    }

    @Test
    void escape_coversLatexSpecialCharacters() {
        assertEquals("\\&\\%\\$\\#\\_\\{\\}", LatexSymbols.escape("&%$#_{}"));
        assertEquals("\\textasciitilde{}", LatexSymbols.escape('~'));
        assertEquals("\\textasciicircum{}", LatexSymbols.escape('^'));
        assertEquals("\\textbackslash{}", LatexSymbols.escape('\\'));
        assertEquals("abc", LatexSymbols.escape("abc"));
        assertEquals("", LatexSymbols.escape((String) null));
    }

    @Test
    void append_separatesControlWordFromLetters() {
        StringBuilder latex = new StringBuilder("\\alpha");
        LatexSymbols.append(latex, "x");
        LatexSymbols.append(latex, "\\beta");
        LatexSymbols.append(latex, "2");
        LatexSymbols.append(latex, "");
        assertEquals("\\alpha x\\beta2", latex.toString());
    }

    @Test
    void append_lineBreakIsNotAControlWord() {
        StringBuilder latex = new StringBuilder("a\\\\");
        LatexSymbols.append(latex, "b");
        LatexSymbols.append(latex, "cd");
        assertEquals("a\\\\bcd", latex.toString());

        StringBuilder command = new StringBuilder("\\\\\\alpha");
        LatexSymbols.append(command, "x");
        assertEquals("\\\\\\alpha x", command.toString());
    }

    @Test
    void append_leavesEscapedSymbolsAlone() {
        StringBuilder latex = new StringBuilder("\\{");
        LatexSymbols.append(latex, "x");
        assertEquals("\\{x", latex.toString());
    }
}
