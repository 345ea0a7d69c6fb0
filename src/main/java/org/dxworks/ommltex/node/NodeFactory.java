package org.dxworks.ommltex.node;

@FunctionalInterface
public interface NodeFactory {
    OmmlNode create(String tag, OmmlNode parent);
}
