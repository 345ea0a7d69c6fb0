package org.dxworks.ommltex;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.dxworks.ommltex.latex.LatexSymbols;
import org.dxworks.ommltex.node.OmmlNode;
import org.dxworks.ommltex.parser.XmlHelper;
import org.w3c.dom.Element;

public class TestUtils {
    public static final ObjectMapper APPROVAL_MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private static final OmmlToLatex CONVERTER = new OmmlToLatex();

    public static String omath(String inner) {
        return "<m:oMath xmlns:m=\"" + LatexSymbols.OMML_NAMESPACE + "\">" + inner + "</m:oMath>";
    }

    /**
     * A single OMML element with the math namespace declared on it.
     */
    public static String element(String tag, String inner) {
        return "<m:" + tag + " xmlns:m=\"" + LatexSymbols.OMML_NAMESPACE + "\">" + inner + "</m:" + tag + ">";
    }

    public static String r(String text) {
        return "<m:r><m:t>" + text + "</m:t></m:r>";
    }

    public static String convert(String inner) {
        return CONVERTER.convert(omath(inner));
    }

    public static Element parseElement(String xml) throws Exception {
        return XmlHelper.parse(xml).getDocumentElement();
    }

    public static OmmlNode parseNode(String tag, String inner) throws Exception {
        return CONVERTER.parse(parseElement(element(tag, inner)));
    }
}
