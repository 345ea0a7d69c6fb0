package org.dxworks.ommltex;

import org.dxworks.ommltex.node.AccentNode;
import org.dxworks.ommltex.node.BarNode;
import org.dxworks.ommltex.node.BoxNode;
import org.dxworks.ommltex.node.DelimiterNode;
import org.dxworks.ommltex.node.EquationArrayNode;
import org.dxworks.ommltex.node.FractionNode;
import org.dxworks.ommltex.node.FunctionNode;
import org.dxworks.ommltex.node.GroupCharNode;
import org.dxworks.ommltex.node.LimitNode;
import org.dxworks.ommltex.node.MatrixNode;
import org.dxworks.ommltex.node.MatrixRowNode;
import org.dxworks.ommltex.node.NaryNode;
import org.dxworks.ommltex.node.NodeFactory;
import org.dxworks.ommltex.node.PhantomNode;
import org.dxworks.ommltex.node.PreScriptNode;
import org.dxworks.ommltex.node.RadicalNode;
import org.dxworks.ommltex.node.RunNode;
import org.dxworks.ommltex.node.ScriptNode;

/**
 * Every OMML tag with a dedicated node kind. Anything else becomes a generic node.
 */
public enum NodeKind {
    RUN("r", RunNode::new),
    FRACTION("f", FractionNode::new),
    SUBSCRIPT("sSub", ScriptNode::new),
    SUPERSCRIPT("sSup", ScriptNode::new),
    SUB_SUPERSCRIPT("sSubSup", ScriptNode::new),
    PRE_SCRIPT("sPre", PreScriptNode::new),
    RADICAL("rad", RadicalNode::new),
    DELIMITER("d", DelimiterNode::new),
    FUNCTION("func", FunctionNode::new),
    NARY("nary", NaryNode::new),
    MATRIX("m", MatrixNode::new),
    MATRIX_ROW("mr", MatrixRowNode::new),
    ACCENT("acc", AccentNode::new),
    BAR("bar", BarNode::new),
    BOX("box", BoxNode::new),
    BORDER_BOX("borderBox", BoxNode::new),
    GROUP_CHAR("groupChr", GroupCharNode::new),
    LIMIT_LOW("limLow", LimitNode::new),
    LIMIT_UPP("limUpp", LimitNode::new),
    EQUATION_ARRAY("eqArr", EquationArrayNode::new),
    PHANTOM("phant", PhantomNode::new);

    private final String tag;
    private final NodeFactory factory;

    NodeKind(String tag, NodeFactory factory) {
        this.tag = tag;
        this.factory = factory;
    }

    public String getTag() {
        return tag;
    }

    public NodeFactory getFactory() {
        return factory;
    }
}
