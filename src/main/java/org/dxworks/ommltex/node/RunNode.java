package org.dxworks.ommltex.node;

import org.dxworks.ommltex.latex.LatexSymbols;
import org.dxworks.ommltex.parser.OmmlParser;
import org.dxworks.ommltex.parser.XmlHelper;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.Collections;
import java.util.List;

/**
 * A run of text ({@code m:r}). Symbols are translated while building, so rendering only applies the
 * style wrappers.
 */
public class RunNode extends OmmlNode {

    public enum Typeface {
        SCRIPT("\\mathscr"),
        FRAKTUR("\\mathfrak"),
        DOUBLE_STRUCK("\\mathbb"),
        SANS_SERIF("\\mathsf"),
        MONOSPACE("\\mathtt");

        private final String command;

        Typeface(String command) {
            this.command = command;
        }

        public String getCommand() {
            return command;
        }

        static Typeface fromScript(String value) {
            if (value == null) return SCRIPT;
            return switch (value) {
                case "script" -> SCRIPT;
                case "fraktur" -> FRAKTUR;
                case "double-struck" -> DOUBLE_STRUCK;
                case "sans-serif" -> SANS_SERIF;
                case "monospace" -> MONOSPACE;
                default -> null;
            };
        }
    }

    private String rawText = "";
    private String text = "";
    private boolean plain;
    private boolean bold;
    private boolean italic;
    private Typeface typeface;

    public RunNode(String tag, OmmlNode parent) {
        super(tag, parent);
    }

    @Override
    protected void parseProperties(Element element) {
        Element rPr = XmlHelper.childElement(element, "rPr");
        if (rPr != null) {
            parseStyle(rPr);
        }
        StringBuilder raw = new StringBuilder();
        for (Node child = element.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (XmlHelper.isMathElement(child, "t")) {
                raw.append(XmlHelper.text(child));
            }
        }
        rawText = raw.toString();
        text = translate(rawText, insideEquationArray());
    }

    private boolean insideEquationArray() {
        for (OmmlNode node = getParent(); node != null; node = node.getParent()) {
            if (node instanceof EquationArrayNode) {
                return true;
            }
            if (node instanceof MatrixNode) {
                return false;
            }
        }
        return false;
    }

    private void parseStyle(Element rPr) {
        String sty = XmlHelper.val(XmlHelper.childElement(rPr, "sty"));
        if (sty != null) {
            switch (sty) {
                case "p" -> plain = true;
                case "b" -> bold = true;
                case "i" -> italic = true;
                case "bi" -> {
                    bold = true;
                    italic = true;
                }
                default -> {
                }
            }
        }

        Element scr = XmlHelper.childElement(rPr, "scr");
        if (scr != null) {
            typeface = Typeface.fromScript(XmlHelper.val(scr));
        } else if (XmlHelper.childElement(rPr, "frak") != null) {
            typeface = Typeface.FRAKTUR;
        }

        if (sty == null || plain) {
            if (XmlHelper.isOn(XmlHelper.childElement(rPr, "b"))) {
                bold = true;
            }
            if (XmlHelper.isOn(XmlHelper.childElement(rPr, "i"))) {
                italic = true;
            }
        }
    }

    /**
     * Replaces every code point by its LaTeX form. Unmapped characters are escaped. {@code &} stays
     * raw only when {@code alignment} is set, where it marks an alignment point of an equation array row.
     */
    static String translate(String raw, boolean alignment) {
        StringBuilder sb = new StringBuilder(raw.length());
        int i = 0;
        while (i < raw.length()) {
            int codePoint = raw.codePointAt(i);
            i += Character.charCount(codePoint);

            String piece;
            if (LatexSymbols.hasSymbol(codePoint)) {
                piece = LatexSymbols.symbol(codePoint);
            } else if ((alignment && codePoint == '&') || Character.charCount(codePoint) > 1) {
                piece = new String(Character.toChars(codePoint));
            } else {
                piece = LatexSymbols.escape((char) codePoint);
            }
            LatexSymbols.append(sb, piece);
        }
        return sb.toString();
    }

    @Override
    protected List<OmmlNode> parseChildren(Element element, OmmlParser parser) {
        return Collections.emptyList();
    }

    @Override
    public String toLatex() {
        if (text.isEmpty()) {
            return "";
        }
        if (typeface != null) {
            return typeface.getCommand() + "{" + text + "}";
        }
        String out = text;
        if (plain && isWord(rawText.strip())) {
            out = "\\mathrm{" + out + "}";
        }
        if (italic) {
            out = "\\mathit{" + out + "}";
        }
        if (bold) {
            out = "\\mathbf{" + out + "}";
        }
        return out;
    }

    private static boolean isWord(String s) {
        return s.length() > 1 && s.chars().allMatch(Character::isLetter);
    }

    @Override
    public String plainText() {
        return text;
    }

    public String getText() {
        return text;
    }

    public boolean isPlain() {
        return plain;
    }

    public boolean isBold() {
        return bold;
    }

    public boolean isItalic() {
        return italic;
    }

    public Typeface getTypeface() {
        return typeface;
    }
}
