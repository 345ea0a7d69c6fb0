package org.dxworks.ommltex.parser;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.Set;

import static org.dxworks.ommltex.latex.LatexSymbols.OMML_NAMESPACE;

public class XmlHelper {

    private static final Set<String> OFF_VALUES = Set.of("0", "off", "false");

    /**
     * Parses a string into a namespace aware DOM. DOCTYPE declarations are refused so that no
     * external entity is ever resolved.
     */
    public static Document parse(String xml) throws OmmlParseException {
        if (xml == null) {
            throw new OmmlParseException("No XML input", null);
        }
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new DefaultHandler());
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (SAXException | IOException | ParserConfigurationException e) {
            throw new OmmlParseException("Invalid OMML XML: " + e.getMessage(), e);
        }
    }

    public static boolean isElement(Node node) {
        return node != null && node.getNodeType() == Node.ELEMENT_NODE;
    }

    public static boolean isMathElement(Node node) {
        return isElement(node) && OMML_NAMESPACE.equals(node.getNamespaceURI());
    }

    public static boolean isMathElement(Node node, String localName) {
        return isMathElement(node) && localName.equals(localName(node));
    }

    public static String localName(Node node) {
        if (node == null) return null;
        String local = node.getLocalName();
        if (local != null) return local;
        String name = node.getNodeName();
        int colon = name.indexOf(':');
        return colon >= 0 ? name.substring(colon + 1) : name;
    }

    /**
     * Property containers (fPr, dPr, naryPr, rPr, ctrlPr, ...) carry settings only and are never
     * parsed as content.
     */
    public static boolean isPropertyElement(Node node) {
        return isMathElement(node) && localName(node).endsWith("Pr");
    }

    public static Element childElement(Element parent, String localName) {
        if (parent == null) return null;
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (isMathElement(child, localName)) {
                return (Element) child;
            }
        }
        return null;
    }

    public static Element propertyChild(Element parent, String propertiesName, String localName) {
        return childElement(childElement(parent, propertiesName), localName);
    }

    /**
     * The {@code m:val} attribute of an element, falling back to an unqualified {@code val}.
     * Returns null when the element or both attributes are absent.
     */
    public static String val(Element element) {
        if (element == null) return null;
        if (element.hasAttributeNS(OMML_NAMESPACE, "val")) {
            return element.getAttributeNS(OMML_NAMESPACE, "val");
        }
        if (element.hasAttribute("val")) {
            return element.getAttribute("val");
        }
        return null;
    }

    /**
     * OMML on/off toggle: present with no value means on.
     */
    public static boolean isOn(Element toggle) {
        if (toggle == null) return false;
        String value = val(toggle);
        return value == null || !OFF_VALUES.contains(value.trim().toLowerCase());
    }

    public static String text(Node node) {
        if (node == null) return "";
        String content = node.getTextContent();
        return content != null ? content : "";
    }
}
