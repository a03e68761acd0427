package org.dxworks.omml2latex.model;

import java.util.List;

/**
 * Function application such as {@code sin x}. The name is a node because markup allows
 * structured names, e.g. {@code lim} carrying a lower limit.
 */
public final class Function implements MarkupNode {
    public final MarkupNode name;
    public final MarkupNode argument;

    public Function(MarkupNode name, MarkupNode argument) {
        this.name = name;
        this.argument = argument;
    }

    @Override
    public String kind() {
        return "function";
    }

    @Override
    public List<MarkupNode> slots() {
        return NodeLists.of(name, argument);
    }

    @Override
    public List<String> missingParts() {
        return NodeLists.missing("name", name, "argument", argument);
    }

    @Override
    public <R, A> R accept(MarkupVisitor<R, A> visitor, A arg) {
        return visitor.visitFunction(this, arg);
    }
}
