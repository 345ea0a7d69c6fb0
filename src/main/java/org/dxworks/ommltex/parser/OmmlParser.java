package org.dxworks.ommltex.parser;

import org.dxworks.ommltex.NodeRegistry;
import org.dxworks.ommltex.node.GenericNode;
import org.dxworks.ommltex.node.NodeFactory;
import org.dxworks.ommltex.node.OmmlNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

/**
 * Builds the node tree for an XML node. Total over well-formed XML: anything that is not a registered
 * math element becomes a {@link GenericNode}.
 */
public class OmmlParser {

    private static final Logger LOG = LoggerFactory.getLogger(OmmlParser.class);

    private final NodeRegistry registry;

    public OmmlParser() {
        this(NodeRegistry.defaultRegistry());
    }

    public OmmlParser(NodeRegistry registry) {
        this.registry = registry;
    }

    public OmmlNode parse(Node xml, OmmlNode parent) {
        if (!XmlHelper.isElement(xml)) {
            return new GenericNode(xml != null ? xml.getNodeName() : "#null", parent);
        }
        Element element = (Element) xml;
        String localName = XmlHelper.localName(element);

        NodeFactory factory;
        if (XmlHelper.isMathElement(element)) {
            factory = registry.lookup(localName).orElse(GenericNode::new);
        } else {
            LOG.debug("Element {} is outside the math namespace, treating it as a generic wrapper", element.getNodeName());
            factory = GenericNode::new;
        }

        OmmlNode node = factory.create(localName, parent);
        node.build(element, this);
        return node;
    }

    public NodeRegistry getRegistry() {
        return registry;
    }
}
