package org.dxworks.ommltex.node;

import org.dxworks.ommltex.latex.LatexSymbols;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Function application ({@code m:func}): a name from {@code m:fName} and the {@code m:e} arguments.
 */
public class FunctionNode extends OmmlNode {

    public static final String MISSING_NAME = "{ERROR: Missing function name}";

    private OmmlNode name;
    private List<OmmlNode> arguments = Collections.emptyList();

    public FunctionNode(String tag, OmmlNode parent) {
        super(tag, parent);
    }

    @Override
    protected void resolve() {
        name = content("fName");
        List<OmmlNode> found = new ArrayList<>();
        for (OmmlNode argument : findChildren("e")) {
            if (!argument.isEmpty()) {
                found.add(argument);
            }
        }
        arguments = Collections.unmodifiableList(found);
    }

    @Override
    public String toLatex() {
        List<String> args = new ArrayList<>();
        for (OmmlNode argument : arguments) {
            args.add(argument.toLatex());
        }
        if (name == null) {
            return args.isEmpty()
                    ? MISSING_NAME
                    : "{ERROR: Missing function name; args: " + String.join("", args) + "}";
        }

        String macro = functionName();
        if (args.isEmpty()) {
            return macro;
        }
        if (macro.equals("\\lim") && args.size() == 1) {
            return macro + "_{" + args.get(0) + "}";
        }
        if (isLimitConstruct()) {
            return macro + " " + String.join(", ", args);
        }
        return macro + "(" + String.join(", ", args) + ")";
    }

    private String functionName() {
        String text = name.plainText().strip();
        return LatexSymbols.functionMacro(text).orElseGet(() -> {
            String rendered = name.toLatex().strip();
            if (rendered.startsWith("\\") && !rendered.contains("operatorname")) {
                return rendered;
            }
            return "\\operatorname{" + rendered + "}";
        });
    }

    private boolean isLimitConstruct() {
        return name.getChildren().size() == 1 && name.getChildren().get(0) instanceof LimitNode;
    }

    public int getArgumentCount() {
        return arguments.size();
    }
}
