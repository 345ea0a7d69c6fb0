package org.dxworks.ommltex.node;

import org.dxworks.ommltex.latex.LatexSymbols;
import org.dxworks.ommltex.parser.XmlHelper;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Delimiter ({@code m:d}): bracket pair around one or more segments.
 */
public class DelimiterNode extends OmmlNode {

    public static final String DEFAULT_BEGIN = "(";
    public static final String DEFAULT_END = ")";
    public static final String DEFAULT_SEPARATOR = ", ";

    private String beginChar = DEFAULT_BEGIN;
    private String endChar = DEFAULT_END;
    private boolean endCharDeclared;
    private String separatorChar;
    private boolean grow;
    private List<List<OmmlNode>> segments = Collections.emptyList();

    public DelimiterNode(String tag, OmmlNode parent) {
        super(tag, parent);
    }

    @Override
    protected void parseProperties(Element element) {
        Element dPr = XmlHelper.childElement(element, "dPr");
        if (dPr == null) {
            return;
        }
        String begin = XmlHelper.val(XmlHelper.childElement(dPr, "begChr"));
        if (begin != null) {
            beginChar = begin;
        }
        String end = XmlHelper.val(XmlHelper.childElement(dPr, "endChr"));
        if (end != null) {
            endChar = end;
            endCharDeclared = true;
        }
        separatorChar = XmlHelper.val(XmlHelper.childElement(dPr, "sepChr"));
        grow = XmlHelper.isOn(XmlHelper.childElement(dPr, "grow"));
    }

    /**
     * Each {@code e} argument is one segment; an explicit {@code sep} child also closes a segment.
     */
    @Override
    protected void resolve() {
        List<List<OmmlNode>> parsed = new ArrayList<>();
        List<OmmlNode> current = new ArrayList<>();
        boolean currentHasArgument = false;
        for (OmmlNode child : getChildren()) {
            if ("sep".equals(child.getTag())) {
                parsed.add(current);
                current = new ArrayList<>();
                currentHasArgument = false;
            } else if ("e".equals(child.getTag())) {
                if (currentHasArgument) {
                    parsed.add(current);
                    current = new ArrayList<>();
                }
                current.add(child);
                currentHasArgument = true;
            } else {
                current.add(child);
            }
        }
        parsed.add(current);
        segments = parsed;
    }

    @Override
    public String toLatex() {
        if (segments.size() == 1 && segments.get(0).size() == 1) {
            OmmlNode only = segments.get(0).get(0);
            OmmlNode inner = "e".equals(only.getTag()) && only.getChildren().size() == 1
                    ? only.getChildren().get(0)
                    : only;
            if (inner.rendersEnclosingDelimiter()) {
                return inner.toLatex();
            }
        }

        List<String> parts = new ArrayList<>();
        for (List<OmmlNode> segment : segments) {
            StringBuilder sb = new StringBuilder();
            for (OmmlNode node : segment) {
                LatexSymbols.append(sb, node.toLatex());
            }
            parts.add(sb.toString());
        }
        String separator = separatorChar != null ? LatexSymbols.escape(separatorChar) : DEFAULT_SEPARATOR;
        String content = String.join(separator, parts);

        String open = LatexSymbols.delimiter(beginChar);
        String close = LatexSymbols.delimiter(endChar);
        StringBuilder latex = new StringBuilder();
        if (grow) {
            latex.append("\\left").append(open.isEmpty() ? "." : open);
            LatexSymbols.append(latex, content);
            latex.append("\\right");
            LatexSymbols.append(latex, close.isEmpty() ? "." : close);
            return latex.toString();
        }
        latex.append(open);
        LatexSymbols.append(latex, content);
        return latex.append(close).toString();
    }

    public String getBeginChar() {
        return beginChar;
    }

    public String getEndChar() {
        return endChar;
    }

    /**
     * False when no closing character was declared or the declared one is blank.
     */
    public boolean hasClosingChar() {
        return endCharDeclared && !endChar.isBlank();
    }

    public boolean isGrow() {
        return grow;
    }

    public int getSegmentCount() {
        return segments.size();
    }
}
