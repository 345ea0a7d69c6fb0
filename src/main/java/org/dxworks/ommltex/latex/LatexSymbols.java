package org.dxworks.ommltex.latex;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Static lookup tables used while translating OMML into LaTeX.
 * All maps are unmodifiable after class initialization and safe to share between threads.
 */
public final class LatexSymbols {

    public static final String OMML_NAMESPACE = "http://schemas.openxmlformats.org/officeDocument/2006/math";

    private static final Map<Integer, String> UNICODE_TO_LATEX;
    private static final Map<String, String> FUNCTION_NAMES_TO_LATEX;
    private static final Map<String, String> ACCENT_TEMPLATES;
    private static final Map<String, String> DELIMITERS;
    private static final Map<Character, String> SPECIAL_CHARS;

    static {
        Map<Integer, String> symbols = new HashMap<>();

        // Greek
        symbols.put(0x03B1, "\\alpha");
        symbols.put(0x03B2, "\\beta");
        symbols.put(0x03B3, "\\gamma");
        symbols.put(0x03B4, "\\delta");
        symbols.put(0x03B5, "\\varepsilon");
        symbols.put(0x03B6, "\\zeta");
        symbols.put(0x03B7, "\\eta");
        symbols.put(0x03B8, "\\theta");
        symbols.put(0x03B9, "\\iota");
        symbols.put(0x03BA, "\\kappa");
        symbols.put(0x03BB, "\\lambda");
        symbols.put(0x03BC, "\\mu");
        symbols.put(0x03BD, "\\nu");
        symbols.put(0x03BE, "\\xi");
        symbols.put(0x03BF, "o");
        symbols.put(0x03C0, "\\pi");
        symbols.put(0x03C1, "\\rho");
        symbols.put(0x03C2, "\\varsigma");
        symbols.put(0x03C3, "\\sigma");
        symbols.put(0x03C4, "\\tau");
        symbols.put(0x03C5, "\\upsilon");
        symbols.put(0x03C6, "\\phi");
        symbols.put(0x03C7, "\\chi");
        symbols.put(0x03C8, "\\psi");
        symbols.put(0x03C9, "\\omega");
        symbols.put(0x0391, "A");
        symbols.put(0x0392, "B");
        symbols.put(0x0393, "\\Gamma");
        symbols.put(0x0394, "\\Delta");
        symbols.put(0x0395, "E");
        symbols.put(0x0396, "Z");
        symbols.put(0x0397, "H");
        symbols.put(0x0398, "\\Theta");
        symbols.put(0x0399, "I");
        symbols.put(0x039A, "K");
        symbols.put(0x039B, "\\Lambda");
        symbols.put(0x039C, "M");
        symbols.put(0x039D, "N");
        symbols.put(0x039E, "\\Xi");
        symbols.put(0x039F, "O");
        symbols.put(0x03A0, "\\Pi");
        symbols.put(0x03A1, "P");
        symbols.put(0x03A3, "\\Sigma");
        symbols.put(0x03A4, "T");
        symbols.put(0x03A5, "\\Upsilon");
        symbols.put(0x03A6, "\\Phi");
        symbols.put(0x03A7, "X");
        symbols.put(0x03A8, "\\Psi");
        symbols.put(0x03A9, "\\Omega");
        symbols.put(0x03F5, "\\epsilon");
        symbols.put(0x03D1, "\\vartheta");
        symbols.put(0x03F0, "\\varkappa");
        symbols.put(0x03D5, "\\varphi");
        symbols.put(0x03F1, "\\varrho");
        symbols.put(0x03D6, "\\varpi");

        // Arrows
        symbols.put(0x2190, "\\leftarrow");
        symbols.put(0x2191, "\\uparrow");
        symbols.put(0x2192, "\\rightarrow");
        symbols.put(0x2193, "\\downarrow");
        symbols.put(0x2194, "\\leftrightarrow");
        symbols.put(0x2195, "\\updownarrow");
        symbols.put(0x2196, "\\nwarrow");
        symbols.put(0x2197, "\\nearrow");
        symbols.put(0x2198, "\\searrow");
        symbols.put(0x2199, "\\swarrow");
        symbols.put(0x21A6, "\\mapsto");
        symbols.put(0x21D0, "\\Leftarrow");
        symbols.put(0x21D2, "\\Rightarrow");
        symbols.put(0x21D4, "\\Leftrightarrow");

        // Relations
        symbols.put(0x2260, "\\neq");
        symbols.put(0x2264, "\\leq");
        symbols.put(0x2265, "\\geq");
        symbols.put(0x2266, "\\leqq");
        symbols.put(0x2267, "\\geqq");
        symbols.put(0x2268, "\\lneqq");
        symbols.put(0x2269, "\\gneqq");
        symbols.put(0x226A, "\\ll");
        symbols.put(0x226B, "\\gg");
        symbols.put(0x2208, "\\in");
        symbols.put(0x2209, "\\notin");
        symbols.put(0x220B, "\\ni");
        symbols.put(0x2261, "\\equiv");
        symbols.put(0x2248, "\\approx");
        symbols.put(0x2245, "\\cong");
        symbols.put(0x223C, "\\sim");
        symbols.put(0x221D, "\\propto");
        symbols.put(0x2282, "\\subset");
        symbols.put(0x2283, "\\supset");
        symbols.put(0x2286, "\\subseteq");
        symbols.put(0x2287, "\\supseteq");
        symbols.put(0x22A5, "\\perp");
        symbols.put(0x2225, "\\parallel");
        symbols.put(0x2223, "\\mid");

        // Binary operators
        symbols.put(0x00B1, "\\pm");
        symbols.put(0x2213, "\\mp");
        symbols.put(0x00D7, "\\times");
        symbols.put(0x00F7, "\\div");
        symbols.put(0x22C5, "\\cdot");
        symbols.put(0x2218, "\\circ");
        symbols.put(0x2227, "\\wedge");
        symbols.put(0x2228, "\\vee");
        symbols.put(0x2229, "\\cap");
        symbols.put(0x222A, "\\cup");
        symbols.put(0x2295, "\\oplus");
        symbols.put(0x2297, "\\otimes");
        symbols.put(0x2212, "-");

        // N-ary operators
        symbols.put(0x2211, "\\sum");
        symbols.put(0x220F, "\\prod");
        symbols.put(0x2210, "\\coprod");
        symbols.put(0x222B, "\\int");
        symbols.put(0x222C, "\\iint");
        symbols.put(0x222D, "\\iiint");
        symbols.put(0x222E, "\\oint");
        symbols.put(0x22C0, "\\bigwedge");
        symbols.put(0x22C1, "\\bigvee");
        symbols.put(0x22C2, "\\bigcap");
        symbols.put(0x22C3, "\\bigcup");
        symbols.put(0x2A00, "\\bigodot");
        symbols.put(0x2A01, "\\bigoplus");
        symbols.put(0x2A02, "\\bigotimes");

        // Ellipses and miscellaneous
        symbols.put(0x2026, "\\dots");
        symbols.put(0x22EE, "\\vdots");
        symbols.put(0x22EF, "\\cdots");
        symbols.put(0x22F1, "\\ddots");
        symbols.put(0x221E, "\\infty");
        symbols.put(0x2202, "\\partial");
        symbols.put(0x2207, "\\nabla");
        symbols.put(0x2200, "\\forall");
        symbols.put(0x2203, "\\exists");
        symbols.put(0x2204, "\\nexists");
        symbols.put(0x2205, "\\emptyset");
        symbols.put(0x2220, "\\angle");
        symbols.put(0x2234, "\\therefore");
        symbols.put(0x2235, "\\because");
        symbols.put(0x221A, "\\surd");
        symbols.put(0x2032, "'");
        symbols.put(0x2033, "''");
        symbols.put(0x00B0, "^{\\circ}");
        symbols.put(0x2118, "\\wp");
        symbols.put(0x210F, "\\hbar");
        symbols.put(0x2113, "\\ell");
        symbols.put(0x2111, "\\Im");
        symbols.put(0x211C, "\\Re");
        symbols.put(0x2135, "\\aleph");

        // Double-struck
        symbols.put(0x2102, "\\mathbb{C}");
        symbols.put(0x2115, "\\mathbb{N}");
        symbols.put(0x211A, "\\mathbb{Q}");
        symbols.put(0x211D, "\\mathbb{R}");
        symbols.put(0x2124, "\\mathbb{Z}");

        // Mathematical italic letters; styling comes from the run properties
        for (int i = 0; i < 26; i++) {
            symbols.put(0x1D434 + i, String.valueOf((char) ('A' + i)));
            symbols.put(0x1D44E + i, String.valueOf((char) ('a' + i)));
        }
        symbols.put(0x210E, "h");

        // Spacing and invisible operators
        symbols.put(0x2009, "\\,");
        symbols.put(0x200A, "\\:");
        symbols.put(0x2005, "\\;");
        symbols.put(0x2003, "\\quad");
        symbols.put(0x200B, "");
        symbols.put(0x00A0, "~");
        symbols.put(0x2061, "");
        symbols.put(0x2062, "");
        symbols.put(0x2063, "");
        symbols.put(0x2064, "");

        UNICODE_TO_LATEX = Collections.unmodifiableMap(symbols);

        Map<String, String> functions = new HashMap<>();
        for (String name : new String[] {
                "sin", "cos", "tan", "arcsin", "arccos", "arctan", "sinh", "cosh", "tanh", "coth",
                "sec", "csc", "cot", "exp", "ln", "log", "lg", "det", "dim", "lim", "liminf", "limsup",
                "min", "max", "sup", "inf", "gcd", "Pr", "arg", "deg", "hom", "ker"}) {
            functions.put(name, "\\" + name);
        }
        functions.put("arccot", "\\operatorname{arccot}");
        FUNCTION_NAMES_TO_LATEX = Collections.unmodifiableMap(functions);

        Map<String, String> accents = new HashMap<>();
        accents.put("\u0300", "\\grave{%s}");
        accents.put("\u0301", "\\acute{%s}");
        accents.put("\u0302", "\\hat{%s}");
        accents.put("\u0303", "\\tilde{%s}");
        accents.put("\u0304", "\\bar{%s}");
        accents.put("\u0305", "\\overline{%s}");
        accents.put("\u0306", "\\breve{%s}");
        accents.put("\u0307", "\\dot{%s}");
        accents.put("\u0308", "\\ddot{%s}");
        accents.put("\u030C", "\\check{%s}");
        accents.put("\u20DB", "\\dddot{%s}");
        accents.put("\u20D6", "\\overleftarrow{%s}");
        accents.put("\u20D7", "\\vec{%s}");
        accents.put("\u20E1", "\\overleftrightarrow{%s}");
        accents.put("^", "\\hat{%s}");
        accents.put("~", "\\tilde{%s}");
        accents.put("-", "\\bar{%s}");
        accents.put("\u00AF", "\\bar{%s}");
        accents.put("\u2192", "\\vec{%s}");
        accents.put(".", "\\dot{%s}");
        accents.put("..", "\\ddot{%s}");
        accents.put("'", "\\acute{%s}");
        accents.put("`", "\\grave{%s}");
        accents.put("\u02D8", "\\breve{%s}");
        accents.put("\u02C7", "\\check{%s}");
        ACCENT_TEMPLATES = Collections.unmodifiableMap(accents);

        Map<String, String> delimiters = new HashMap<>();
        delimiters.put("(", "(");
        delimiters.put(")", ")");
        delimiters.put("[", "[");
        delimiters.put("]", "]");
        delimiters.put("{", "\\{");
        delimiters.put("}", "\\}");
        delimiters.put("|", "|");
        delimiters.put("\u2016", "\\|");
        delimiters.put("\u27E8", "\\langle");
        delimiters.put("\u27E9", "\\rangle");
        delimiters.put("\u2329", "\\langle");
        delimiters.put("\u232A", "\\rangle");
        delimiters.put("\u2308", "\\lceil");
        delimiters.put("\u2309", "\\rceil");
        delimiters.put("\u230A", "\\lfloor");
        delimiters.put("\u230B", "\\rfloor");
        DELIMITERS = Collections.unmodifiableMap(delimiters);

        Map<Character, String> special = new HashMap<>();
        special.put('&', "\\&");
        special.put('%', "\\%");
        special.put('$', "\\$");
        special.put('#', "\\#");
        special.put('_', "\\_");
        special.put('{', "\\{");
        special.put('}', "\\}");
        special.put('~', "\\textasciitilde{}");
        special.put('^', "\\textasciicircum{}");
        special.put('\\', "\\textbackslash{}");
        special.put('\n', "\\\\");
        SPECIAL_CHARS = Collections.unmodifiableMap(special);
    }

    private LatexSymbols() {
    }

    /**
     * LaTeX for a single code point, or the character itself when there is no mapping.
     */
    public static String symbol(int codePoint) {
        String mapped = UNICODE_TO_LATEX.get(codePoint);
        return mapped != null ? mapped : new String(Character.toChars(codePoint));
    }

    public static boolean hasSymbol(int codePoint) {
        return UNICODE_TO_LATEX.containsKey(codePoint);
    }

    public static Optional<String> functionMacro(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(FUNCTION_NAMES_TO_LATEX.get(name));
    }

    /**
     * Accent template with a single {@code %s} slot for the base expression. Accepts the accent
     * character itself or its four digit hex code point ("0302").
     */
    public static Optional<String> accentTemplate(String accent) {
        if (accent == null || accent.isEmpty()) return Optional.empty();
        String template = ACCENT_TEMPLATES.get(accent);
        if (template == null && accent.length() == 4 && accent.chars().allMatch(c -> Character.digit(c, 16) >= 0)) {
            template = ACCENT_TEMPLATES.get(String.valueOf((char) Integer.parseInt(accent, 16)));
        }
        return Optional.ofNullable(template);
    }

    /**
     * Bracket form of a delimiter character; unknown characters are escaped.
     */
    public static String delimiter(String chr) {
        if (chr == null || chr.isEmpty()) return "";
        String mapped = DELIMITERS.get(chr);
        return mapped != null ? mapped : escape(chr);
    }

    /**
     * Appends a LaTeX fragment, inserting a space where a trailing control word would otherwise run
     * into the letters that follow it.
     */
    public static void append(StringBuilder latex, String piece) {
        if (piece == null || piece.isEmpty()) return;
        if (Character.isLetter(piece.charAt(0)) && endsWithControlWord(latex)) {
            latex.append(' ');
        }
        latex.append(piece);
    }

    static boolean endsWithControlWord(CharSequence latex) {
        int end = latex.length();
        int start = end;
        while (start > 0 && Character.isLetter(latex.charAt(start - 1))) {
            start--;
        }
        if (start == end) {
            return false;
        }
        int backslashes = 0;
        while (start - backslashes > 0 && latex.charAt(start - backslashes - 1) == '\\') {
            backslashes++;
        }
        return backslashes % 2 == 1;
    }

    public static String escape(char c) {
        String escaped = SPECIAL_CHARS.get(c);
        return escaped != null ? escaped : String.valueOf(c);
    }

    public static String escape(String text) {
        if (text == null) return "";
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            sb.append(escape(text.charAt(i)));
        }
        return sb.toString();
    }
}
