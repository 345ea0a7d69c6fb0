package org.dxworks.ommltex;

import org.dxworks.ommltex.latex.LatexSymbols;
import org.dxworks.ommltex.node.OmmlNode;
import org.dxworks.ommltex.parser.OmmlParseException;
import org.dxworks.ommltex.parser.OmmlParser;
import org.dxworks.ommltex.parser.XmlHelper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

/**
 * Entry points for translating OMML into LaTeX. The result never carries math-mode delimiters.
 * Instances are stateless and may be shared between threads.
 */
public class OmmlToLatex {

    private static final Logger LOG = LoggerFactory.getLogger(OmmlToLatex.class);

    public static final String PARSE_ERROR = "[OMML Parse Error]";
    public static final String CONVERSION_ERROR = "[OMML Conversion Error]";
    public static final String NOT_OMATH_ERROR = "[Error: Not an oMath element]";

    private final OmmlParser parser;

    public OmmlToLatex() {
        this(new OmmlParser());
    }

    public OmmlToLatex(OmmlParser parser) {
        this.parser = parser;
    }

    /**
     * Translates an XML string holding an {@code m:oMath} element, or any single OMML element.
     * Failures are reported through {@link #PARSE_ERROR} and {@link #CONVERSION_ERROR}, never thrown.
     */
    public String convert(String xml) {
        Element root;
        try {
            root = XmlHelper.parse(xml).getDocumentElement();
        } catch (OmmlParseException e) {
            LOG.warn("Could not parse OMML: {}", e.getMessage());
            return PARSE_ERROR;
        }

        try {
            if (XmlHelper.isMathElement(root, "oMath")) {
                return renderChildren(root);
            }
            return convertElement(root);
        } catch (RuntimeException e) {
            LOG.warn("OMML conversion failed", e);
            return CONVERSION_ERROR;
        }
    }

    /**
     * Translates an already parsed {@code m:oMath} element.
     */
    public String convert(Element oMath) {
        if (!XmlHelper.isMathElement(oMath, "oMath")) {
            LOG.debug("Expected an oMath element, got {}", oMath != null ? oMath.getNodeName() : null);
            return NOT_OMATH_ERROR;
        }
        try {
            return renderChildren(oMath);
        } catch (RuntimeException e) {
            LOG.warn("OMML conversion failed", e);
            return CONVERSION_ERROR;
        }
    }

    /**
     * Translates one OMML element that is not wrapped in {@code m:oMath}.
     */
    public String convertElement(Element element) {
        return parse(element).toLatex();
    }

    public OmmlNode parse(Element element) {
        return parser.parse(element, null);
    }

    private String renderChildren(Element oMath) {
        StringBuilder latex = new StringBuilder();
        for (Node child = oMath.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (XmlHelper.isElement(child) && !XmlHelper.isPropertyElement(child)) {
                LatexSymbols.append(latex, parser.parse(child, null).toLatex());
            }
        }
        return latex.toString();
    }
}
